package com.campusfeedback.backend.service;

import com.campusfeedback.backend.dto.SubmissionStatusDto;
import com.campusfeedback.backend.entity.FeedbackForm;
import com.campusfeedback.backend.entity.FeedbackQuestion;
import com.campusfeedback.backend.entity.FeedbackSnapshot;
import com.campusfeedback.backend.entity.FormAccess;
import com.campusfeedback.backend.entity.FormStatus;
import com.campusfeedback.backend.entity.LectureType;
import com.campusfeedback.backend.entity.OverrideStudent;
import com.campusfeedback.backend.entity.Student;
import com.campusfeedback.backend.entity.StudentResponse;
import com.campusfeedback.backend.entity.SubjectAllocation;
import com.campusfeedback.backend.exception.AlreadySubmittedException;
import com.campusfeedback.backend.exception.InconsistentDataException;
import com.campusfeedback.backend.exception.ResourceNotFoundException;
import com.campusfeedback.backend.exception.SubmissionForbiddenException;
import com.campusfeedback.backend.support.IntegrationTestSupport;
import com.campusfeedback.backend.support.TestClockConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@Import(TestClockConfig.class)
class StudentResponseServiceTest extends IntegrationTestSupport {

    @Autowired
    private StudentResponseService studentResponseService;

    private FeedbackForm form;
    private FeedbackQuestion ratingQuestion;
    private FeedbackQuestion commentQuestion;

    @BeforeEach
    void createForm() {
        form = activeForm("OS mid-semester feedback");
        ratingQuestion = question(form, "How clear were the lectures?", "rating");
        commentQuestion = question(form, "Any other comments?", "text");
    }

    @Test
    @DisplayName("A valid submission stores one response and one snapshot per answer and consumes the token")
    void submitStoresResponsesAndSnapshots() {
        // Given
        Student student = enrolledStudent("Riya Shah");
        grant("tok-abc", form, student);

        // When
        List<StudentResponse> created = studentResponseService.submitResponses("tok-abc",
                answers(ratingQuestion.getId(), 5, commentQuestion.getId(), "Great"));

        // Then
        assertThat(created).hasSize(2);
        assertThat(created).extracting(StudentResponse::getResponseValue).containsExactly("5", "\"Great\"");
        assertThat(created).allSatisfy(response -> {
            assertThat(response.getSubmittedAt()).isEqualTo(TestClockConfig.START);
            assertThat(response.getStudent().getId()).isEqualTo(student.getId());
            assertThat(response.getOverrideStudent()).isNull();
        });
        assertThat(studentResponseRepository.count()).isEqualTo(2);
        assertThat(isSubmitted("tok-abc")).isTrue();

        List<FeedbackSnapshot> snapshots = feedbackSnapshotRepository.findByFormId(form.getId());
        assertThat(snapshots).hasSize(2);
        FeedbackSnapshot rating = snapshots.stream()
                .filter(s -> s.getQuestionId().equals(ratingQuestion.getId()))
                .findFirst().orElseThrow();
        assertThat(rating.getOriginalStudentResponseId()).isEqualTo(created.get(0).getId());
        assertThat(rating.getStudentId()).isEqualTo(student.getId());
        assertThat(rating.getOverrideStudentId()).isNull();
        assertThat(rating.isOverrideStudent()).isFalse();
        assertThat(rating.getStudentEnrollmentNumber()).isEqualTo(student.getEnrollmentNumber());
        assertThat(rating.getFormName()).isEqualTo("OS mid-semester feedback");
        assertThat(rating.getFormStatus()).isEqualTo("ACTIVE");
        assertThat(rating.getQuestionText()).isEqualTo("How clear were the lectures?");
        assertThat(rating.getQuestionCategoryName()).isEqualTo("Teaching");
        assertThat(rating.getFacultyName()).isEqualTo("Asha Mehta");
        assertThat(rating.getSubjectCode()).isEqualTo("CE501");
        assertThat(rating.getAcademicYearString()).isEqualTo("2025-26");
        assertThat(rating.getDepartmentAbbreviation()).isEqualTo("CE");
        assertThat(rating.getSemesterNumber()).isEqualTo(5);
        assertThat(rating.getDivisionName()).isEqualTo("A");
        assertThat(rating.getResponseValue()).isEqualTo("5");
        assertThat(rating.getBatch()).isEqualTo("B1");
    }

    @Test
    @DisplayName("Object answers are stored with their keys sorted")
    void objectAnswersAreStoredCanonically() {
        Student student = enrolledStudent("Kabir Rao");
        grant("tok-obj", form, student);

        List<StudentResponse> created = studentResponseService.submitResponses("tok-obj",
                answers(commentQuestion.getId(), Map.of("z", 1, "a", List.of("x", "y"))));

        assertThat(created.get(0).getResponseValue()).isEqualTo("{\"a\":[\"x\",\"y\"],\"z\":1}");
    }

    @Test
    @DisplayName("Answers to unknown, foreign, deleted or malformed question ids are skipped")
    void unknownQuestionsAreSkipped() {
        // Given
        FeedbackForm otherForm = activeForm("Another form");
        FeedbackQuestion foreign = question(otherForm, "Foreign question", "rating");
        FeedbackQuestion deleted = question(form, "Retired question", "rating");
        deleted.setDeleted(true);
        feedbackQuestionRepository.save(deleted);

        Student student = enrolledStudent("Meera Iyer");
        grant("tok-mixed", form, student);

        // When
        List<StudentResponse> created = studentResponseService.submitResponses("tok-mixed", answers(
                ratingQuestion.getId(), 4,
                UUID.randomUUID().toString(), 3,
                foreign.getId(), 2,
                deleted.getId(), 1,
                "bogusQ", 5));

        // Then
        assertThat(created).extracting(r -> r.getQuestion().getId()).containsExactly(ratingQuestion.getId());
        assertThat(studentResponseRepository.count()).isEqualTo(1);
        assertThat(feedbackSnapshotRepository.count()).isEqualTo(1);
        assertThat(isSubmitted("tok-mixed")).isTrue();
    }

    @Test
    @DisplayName("A payload with only unknown questions still consumes the token")
    void allUnknownQuestionsStillMarksSubmitted() {
        Student student = enrolledStudent("Dev Patel");
        grant("tok-none", form, student);

        List<StudentResponse> created = studentResponseService.submitResponses("tok-none",
                answers(UUID.randomUUID().toString(), 5));

        assertThat(created).isEmpty();
        assertThat(isSubmitted("tok-none")).isTrue();
        assertThat(studentResponseRepository.count()).isZero();
    }

    @Test
    @DisplayName("Override student snapshots take their academic fields from the form's division")
    void overrideStudentUsesFormDivision() {
        OverrideStudent guest = overrideStudent("Nikhil Jain", "Mechanical", "3");
        grant("tok-guest", form, guest);

        List<StudentResponse> created = studentResponseService.submitResponses("tok-guest",
                answers(ratingQuestion.getId(), 4));

        assertThat(created.get(0).getStudent()).isNull();
        assertThat(created.get(0).getOverrideStudent().getId()).isEqualTo(guest.getId());

        FeedbackSnapshot snapshot = feedbackSnapshotRepository.findByFormId(form.getId()).get(0);
        assertThat(snapshot.getStudentId()).isNull();
        assertThat(snapshot.getOverrideStudentId()).isEqualTo(guest.getId());
        assertThat(snapshot.isOverrideStudent()).isTrue();
        assertThat(snapshot.getDivisionId()).isEqualTo(division.getId());
        assertThat(snapshot.getSemesterNumber()).isEqualTo(5);
        assertThat(snapshot.getDepartmentName()).isEqualTo("Computer Engineering");
        assertThat(snapshot.getAcademicYearId()).isEqualTo(academicYear.getId());
    }

    @Test
    @DisplayName("Override student snapshots fall back to roster values when the form has no division")
    void overrideStudentFallsBackWithoutDivision() {
        SubjectAllocation noDivision = subjectAllocationRepository.save(
                new SubjectAllocation(faculty, subject, null, academicYear, LectureType.LAB));
        FeedbackForm labForm = feedbackFormRepository.save(new FeedbackForm("OS lab feedback", FormStatus.ACTIVE, noDivision));
        FeedbackQuestion labQuestion = question(labForm, "Lab support", "rating");
        OverrideStudent guest = overrideStudent("Tara Singh", "Mechanical", "3");
        grant("tok-lab", labForm, guest);

        studentResponseService.submitResponses("tok-lab", answers(labQuestion.getId(), 3));

        FeedbackSnapshot snapshot = feedbackSnapshotRepository.findByFormId(labForm.getId()).get(0);
        assertThat(snapshot.getDivisionId()).isEmpty();
        assertThat(snapshot.getAcademicYearId()).isEmpty();
        assertThat(snapshot.getDepartmentName()).isEqualTo("Mechanical");
        assertThat(snapshot.getSemesterNumber()).isEqualTo(3);
    }

    @Test
    @DisplayName("Submissions are accepted up to and including the end date")
    void submissionWindowIncludesEndDate() {
        LocalDateTime end = TestClockConfig.START.plusDays(1);
        form.setEndDate(end);
        save(form);
        grant("tok-before", form, enrolledStudent("Student One"));
        grant("tok-at", form, enrolledStudent("Student Two"));
        grant("tok-after", form, enrolledStudent("Student Three"));

        clock.setTo(end.minusNanos(1_000_000));
        assertThat(studentResponseService.submitResponses("tok-before", answers(ratingQuestion.getId(), 5))).hasSize(1);

        clock.setTo(end);
        assertThat(studentResponseService.submitResponses("tok-at", answers(ratingQuestion.getId(), 5))).hasSize(1);

        clock.advance(Duration.ofMillis(1));
        assertThatThrownBy(() -> studentResponseService.submitResponses("tok-after", answers(ratingQuestion.getId(), 5)))
                .isInstanceOf(SubmissionForbiddenException.class)
                .extracting("code").isEqualTo("SUBMISSION_CLOSED");
        assertThat(isSubmitted("tok-after")).isFalse();
    }

    @Test
    @DisplayName("A second submission with the same token is rejected and stores nothing")
    void secondSubmissionIsRejected() {
        grant("tok-twice", form, enrolledStudent("Asha Nair"));
        studentResponseService.submitResponses("tok-twice", answers(ratingQuestion.getId(), 5));

        assertThatThrownBy(() -> studentResponseService.submitResponses("tok-twice", answers(ratingQuestion.getId(), 1)))
                .isInstanceOf(AlreadySubmittedException.class)
                .extracting("code").isEqualTo("ALREADY_SUBMITTED");
        assertThat(studentResponseRepository.count()).isEqualTo(1);
        assertThat(feedbackSnapshotRepository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("Unknown tokens are reported as not found")
    void unknownTokenIsNotFound() {
        assertThatThrownBy(() -> studentResponseService.submitResponses("nope", answers(ratingQuestion.getId(), 5)))
                .isInstanceOf(ResourceNotFoundException.class)
                .extracting("code").isEqualTo("INVALID_TOKEN");
        assertThatThrownBy(() -> studentResponseService.checkSubmission("nope"))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @DisplayName("Deleted forms are reported as not found for both submit and status check")
    void deletedFormIsNotFound() {
        grant("tok-deleted", form, enrolledStudent("Ira Das"));
        form.setDeleted(true);
        save(form);

        assertThatThrownBy(() -> studentResponseService.submitResponses("tok-deleted", answers(ratingQuestion.getId(), 5)))
                .isInstanceOf(ResourceNotFoundException.class)
                .extracting("code").isEqualTo("FORM_NOT_FOUND");
        assertThatThrownBy(() -> studentResponseService.checkSubmission("tok-deleted"))
                .isInstanceOf(ResourceNotFoundException.class)
                .extracting("code").isEqualTo("FORM_NOT_FOUND");
    }

    @Test
    @DisplayName("Draft and closed forms do not accept submissions")
    void inactiveFormIsForbidden() {
        grant("tok-draft", form, enrolledStudent("Om Kulkarni"));
        form.setStatus(FormStatus.DRAFT);
        save(form);

        assertThatThrownBy(() -> studentResponseService.submitResponses("tok-draft", answers(ratingQuestion.getId(), 5)))
                .isInstanceOf(SubmissionForbiddenException.class)
                .extracting("code").isEqualTo("FORM_NOT_ACTIVE");

        form.setStatus(FormStatus.CLOSED);
        save(form);
        assertThatThrownBy(() -> studentResponseService.submitResponses("tok-draft", answers(ratingQuestion.getId(), 5)))
                .isInstanceOf(SubmissionForbiddenException.class);
        assertThat(isSubmitted("tok-draft")).isFalse();
    }

    @Test
    @DisplayName("A grant without any respondent is a data integrity error")
    void grantWithoutRespondentFails() {
        formAccessRepository.save(new FormAccess("tok-orphan", form, null, null));

        assertThatThrownBy(() -> studentResponseService.submitResponses("tok-orphan", answers(ratingQuestion.getId(), 5)))
                .isInstanceOf(InconsistentDataException.class);
        assertThat(isSubmitted("tok-orphan")).isFalse();
        assertThat(studentResponseRepository.count()).isZero();
    }

    @Test
    @DisplayName("A grant naming both an enrolled and an override student is a data integrity error")
    void grantWithBothRespondentsFails() {
        Student student = enrolledStudent("Ishaan Menon");
        OverrideStudent guest = overrideStudent("Ishaan Guest", "Civil", "2");
        formAccessRepository.save(new FormAccess("tok-both", form, student, guest));

        assertThatThrownBy(() -> studentResponseService.submitResponses("tok-both", answers(ratingQuestion.getId(), 5)))
                .isInstanceOf(InconsistentDataException.class);
        assertThat(isSubmitted("tok-both")).isFalse();
        assertThat(studentResponseRepository.count()).isZero();
        assertThat(feedbackSnapshotRepository.count()).isZero();
    }

    @Test
    @DisplayName("An enrolled student without a division is a data integrity error")
    void studentWithoutDivisionFails() {
        Student student = enrolledStudent("Zoya Khan");
        student.setDivision(null);
        studentRepository.save(student);
        grant("tok-nodiv", form, student);

        assertThatThrownBy(() -> studentResponseService.submitResponses("tok-nodiv", answers(ratingQuestion.getId(), 5)))
                .isInstanceOf(InconsistentDataException.class);
        assertThat(isSubmitted("tok-nodiv")).isFalse();
    }

    @Test
    @DisplayName("Checking status does not change it")
    void checkSubmissionIsReadOnly() {
        grant("tok-status", form, enrolledStudent("Aarav Gupta"));

        assertThat(studentResponseService.checkSubmission("tok-status")).isEqualTo(new SubmissionStatusDto(false));
        assertThat(studentResponseService.checkSubmission("tok-status")).isEqualTo(new SubmissionStatusDto(false));

        studentResponseService.submitResponses("tok-status", answers(ratingQuestion.getId(), 4));

        assertThat(studentResponseService.checkSubmission("tok-status").isSubmitted()).isTrue();
        assertThat(studentResponseService.checkSubmission("tok-status").isSubmitted()).isTrue();
    }

    @Test
    @DisplayName("Strict question policy is off by default")
    void lenientByDefault() {
        grant("tok-lenient", form, enrolledStudent("Neha Joshi"));

        assertThat(studentResponseService.submitResponses("tok-lenient",
                answers(ratingQuestion.getId(), 5, UUID.randomUUID().toString(), 1))).hasSize(1);
    }
}
