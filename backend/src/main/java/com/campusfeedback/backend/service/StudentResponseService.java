package com.campusfeedback.backend.service;

import com.campusfeedback.backend.dto.SubmissionStatusDto;
import com.campusfeedback.backend.entity.FeedbackForm;
import com.campusfeedback.backend.entity.FeedbackQuestion;
import com.campusfeedback.backend.entity.FormAccess;
import com.campusfeedback.backend.entity.FormStatus;
import com.campusfeedback.backend.entity.OverrideStudent;
import com.campusfeedback.backend.entity.Student;
import com.campusfeedback.backend.entity.StudentResponse;
import com.campusfeedback.backend.entity.SubjectAllocation;
import com.campusfeedback.backend.exception.AlreadySubmittedException;
import com.campusfeedback.backend.exception.BizException;
import com.campusfeedback.backend.exception.InconsistentDataException;
import com.campusfeedback.backend.exception.ResourceNotFoundException;
import com.campusfeedback.backend.exception.SubmissionForbiddenException;
import com.campusfeedback.backend.repository.FeedbackFormRepository;
import com.campusfeedback.backend.repository.FeedbackQuestionRepository;
import com.campusfeedback.backend.repository.FeedbackSnapshotRepository;
import com.campusfeedback.backend.repository.FormAccessRepository;
import com.campusfeedback.backend.repository.OverrideStudentRepository;
import com.campusfeedback.backend.repository.StudentRepository;
import com.campusfeedback.backend.repository.StudentResponseRepository;
import com.campusfeedback.backend.service.codec.ResponseValueCodec;
import com.campusfeedback.backend.service.submission.AcademicContext;
import com.campusfeedback.backend.service.submission.FeedbackSnapshotAssembler;
import com.campusfeedback.backend.service.submission.Respondent;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class StudentResponseService {

    private final FormAccessRepository formAccessRepository;
    private final FeedbackFormRepository feedbackFormRepository;
    private final FeedbackQuestionRepository feedbackQuestionRepository;
    private final StudentRepository studentRepository;
    private final OverrideStudentRepository overrideStudentRepository;
    private final StudentResponseRepository studentResponseRepository;
    private final FeedbackSnapshotRepository feedbackSnapshotRepository;
    private final FeedbackSnapshotAssembler snapshotAssembler;
    private final ResponseValueCodec responseValueCodec;
    private final FacultyPerformanceService facultyPerformanceService;
    private final Clock clock;

    @Value("${feedback.submission.reject-unknown-questions:false}")
    private boolean rejectUnknownQuestions;

    /**
     * Submits the answers behind a one-time access token.
     * <p>
     * The grant row is locked for the whole transaction, so a second submission with the same
     * token waits for the first to commit and then fails with {@link AlreadySubmittedException}.
     * Every answer gets a {@link StudentResponse} and a denormalized snapshot; the grant is
     * flipped to submitted in the same transaction. Question ids that do not belong to the form
     * (unknown, foreign or soft-deleted) are skipped unless strict mode is configured.
     *
     * @return the created responses, in the order the answers were given
     */
    @Transactional
    public List<StudentResponse> submitResponses(String token, Map<String, JsonNode> responses) {
        LocalDateTime submittedAt = LocalDateTime.now(clock);

        FormAccess formAccess = formAccessRepository.findByAccessTokenForUpdate(token)
                .orElseThrow(() -> new ResourceNotFoundException("INVALID_TOKEN", "Invalid access token."));

        FeedbackForm form = feedbackFormRepository.findWithAllocationById(formAccess.getForm().getId())
                .filter(f -> !f.isDeleted())
                .orElseThrow(() -> new ResourceNotFoundException("FORM_NOT_FOUND", "Form not found or is deleted."));

        assertOpenForSubmission(form, submittedAt);

        if (formAccess.isSubmitted()) {
            throw new AlreadySubmittedException("Feedback already submitted for this access token.");
        }

        assertAllocationLoaded(form, formAccess);
        Respondent respondent = resolveRespondent(formAccess);

        Map<String, FeedbackQuestion> questions = loadQuestions(form, responses.keySet());
        if (rejectUnknownQuestions && questions.size() < responses.size()) {
            Set<String> unknown = responses.keySet().stream()
                    .filter(id -> !questions.containsKey(id))
                    .collect(Collectors.toCollection(LinkedHashSet::new));
            throw new BizException("UNKNOWN_QUESTION", "Questions not found in this form: " + unknown);
        }

        AcademicContext academic = snapshotAssembler.resolveAcademicContext(respondent, form);
        Student student = null;
        OverrideStudent overrideStudent = null;
        if (respondent instanceof Respondent.Enrolled) {
            student = ((Respondent.Enrolled) respondent).student();
        } else {
            overrideStudent = ((Respondent.RosterOverride) respondent).student();
        }

        List<StudentResponse> created = new ArrayList<>();
        Set<String> facultyIds = new LinkedHashSet<>();
        for (Map.Entry<String, JsonNode> answer : responses.entrySet()) {
            FeedbackQuestion question = questions.get(answer.getKey());
            if (question == null) {
                log.warn("Question {} is not an active question of form {}; skipping answer", answer.getKey(), form.getId());
                continue;
            }

            StudentResponse response = studentResponseRepository.save(new StudentResponse(
                    student,
                    overrideStudent,
                    form,
                    question,
                    responseValueCodec.encode(answer.getValue()),
                    submittedAt
            ));
            feedbackSnapshotRepository.save(snapshotAssembler.assemble(respondent, form, question, academic, response));

            created.add(response);
            facultyIds.add(question.getFaculty().getId());
        }

        formAccess.setSubmitted(true);
        formAccessRepository.save(formAccess);

        evictReportsAfterCommit(facultyIds, academic.academicYearId());
        log.info("Stored {} of {} answers for form {} (respondent {})",
                created.size(), responses.size(), form.getId(), respondent.id());
        return created;
    }

    @Transactional(readOnly = true)
    public SubmissionStatusDto checkSubmission(String token) {
        FormAccess formAccess = formAccessRepository.findByAccessToken(token)
                .orElseThrow(() -> new ResourceNotFoundException("INVALID_TOKEN", "Invalid access token."));

        if (formAccess.getForm() == null || formAccess.getForm().isDeleted()) {
            throw new ResourceNotFoundException("FORM_NOT_FOUND", "Form not found or is deleted.");
        }
        return new SubmissionStatusDto(formAccess.isSubmitted());
    }

    private void assertOpenForSubmission(FeedbackForm form, LocalDateTime now) {
        if (form.getStatus() != FormStatus.ACTIVE) {
            throw new SubmissionForbiddenException("FORM_NOT_ACTIVE", "Form is not currently active for submission.");
        }
        // the end date itself still counts as open
        if (form.getEndDate() != null && now.isAfter(form.getEndDate())) {
            throw new SubmissionForbiddenException("SUBMISSION_CLOSED", "Form submission period has ended.");
        }
    }

    private void assertAllocationLoaded(FeedbackForm form, FormAccess formAccess) {
        SubjectAllocation allocation = form.getSubjectAllocation();
        if (allocation == null || allocation.getFaculty() == null || allocation.getSubject() == null) {
            log.error("Form {} (grant {}) has no complete subject allocation", form.getId(), formAccess.getId());
            throw new InconsistentDataException("Missing essential form data for snapshot creation.");
        }
    }

    private Respondent resolveRespondent(FormAccess formAccess) {
        boolean hasStudent = formAccess.getStudent() != null;
        boolean hasOverride = formAccess.getOverrideStudent() != null;
        if (hasStudent == hasOverride) {
            log.error("Grant {} must reference exactly one respondent (student: {}, override: {})",
                    formAccess.getId(), hasStudent, hasOverride);
            throw new InconsistentDataException("No unique respondent found for snapshot creation.");
        }

        if (hasOverride) {
            String overrideId = formAccess.getOverrideStudent().getId();
            return overrideStudentRepository.findById(overrideId)
                    .<Respondent>map(Respondent.RosterOverride::new)
                    .orElseThrow(() -> {
                        log.error("Grant {} references missing override student {}", formAccess.getId(), overrideId);
                        return new InconsistentDataException("Missing override student data for snapshot creation.");
                    });
        }

        String studentId = formAccess.getStudent().getId();
        Student student = studentRepository.findWithAcademicsById(studentId)
                .orElseThrow(() -> {
                    log.error("Grant {} references missing student {}", formAccess.getId(), studentId);
                    return new InconsistentDataException("Missing essential student data for snapshot creation.");
                });
        if (student.getAcademicYear() == null || student.getSemester() == null || student.getDivision() == null) {
            log.error("Student {} is missing academic year, semester or division", studentId);
            throw new InconsistentDataException("Missing essential student data for snapshot creation.");
        }
        return new Respondent.Enrolled(student);
    }

    private Map<String, FeedbackQuestion> loadQuestions(FeedbackForm form, Set<String> questionIds) {
        if (questionIds.isEmpty()) {
            return Map.of();
        }
        return feedbackQuestionRepository.findActiveByFormIdAndIdIn(form.getId(), questionIds).stream()
                .collect(Collectors.toMap(FeedbackQuestion::getId, Function.identity()));
    }

    private void evictReportsAfterCommit(Set<String> facultyIds, String academicYearId) {
        if (facultyIds.isEmpty() || !TransactionSynchronizationManager.isSynchronizationActive()) {
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                facultyIds.forEach(facultyId -> facultyPerformanceService.evict(facultyId, academicYearId));
            }
        });
    }
}
