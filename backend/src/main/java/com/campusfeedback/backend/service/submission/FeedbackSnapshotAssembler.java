package com.campusfeedback.backend.service.submission;

import com.campusfeedback.backend.entity.Division;
import com.campusfeedback.backend.entity.FeedbackForm;
import com.campusfeedback.backend.entity.FeedbackQuestion;
import com.campusfeedback.backend.entity.FeedbackSnapshot;
import com.campusfeedback.backend.entity.OverrideStudent;
import com.campusfeedback.backend.entity.Student;
import com.campusfeedback.backend.entity.StudentResponse;
import com.campusfeedback.backend.entity.SubjectAllocation;
import com.campusfeedback.backend.repository.DivisionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
@RequiredArgsConstructor
@Slf4j
public class FeedbackSnapshotAssembler {

    private final DivisionRepository divisionRepository;

    /**
     * Enrolled students carry their own academic graph. Override students have none, so the
     * division of the form's subject allocation stands in for the cohort the feedback is about.
     */
    public AcademicContext resolveAcademicContext(Respondent respondent, FeedbackForm form) {
        if (respondent instanceof Respondent.Enrolled) {
            Student student = ((Respondent.Enrolled) respondent).student();
            return AcademicContext.of(student.getAcademicYear(), student.getSemester(), student.getDivision());
        }

        OverrideStudent overrideStudent = ((Respondent.RosterOverride) respondent).student();
        Optional<Division> formDivision = Optional.ofNullable(form.getSubjectAllocation())
                .map(SubjectAllocation::getDivision)
                .map(Division::getId)
                .flatMap(divisionRepository::findWithHierarchyById);

        if (formDivision.isEmpty()) {
            log.warn("No division found for form {}; snapshots for override student {} fall back to roster values",
                    form.getId(), overrideStudent.getId());
            return AcademicContext.fallbackFor(overrideStudent);
        }
        return AcademicContext.ofDivision(formDivision.get());
    }

    public FeedbackSnapshot assemble(Respondent respondent,
                                     FeedbackForm form,
                                     FeedbackQuestion question,
                                     AcademicContext academic,
                                     StudentResponse response) {
        FeedbackSnapshot.FeedbackSnapshotBuilder builder = FeedbackSnapshot.builder()
                .originalStudentResponseId(response.getId());

        if (respondent instanceof Respondent.Enrolled) {
            Student student = ((Respondent.Enrolled) respondent).student();
            builder.studentId(student.getId())
                    .overrideStudentId(null)
                    .overrideStudent(false)
                    .studentEnrollmentNumber(student.getEnrollmentNumber())
                    .studentName(student.getName())
                    .studentEmail(student.getEmail());
        } else {
            OverrideStudent student = ((Respondent.RosterOverride) respondent).student();
            builder.studentId(null)
                    .overrideStudentId(student.getId())
                    .overrideStudent(true)
                    .studentEnrollmentNumber(student.getEnrollmentNumber() == null ? "" : student.getEnrollmentNumber())
                    .studentName(student.getName())
                    .studentEmail(student.getEmail());
        }

        return builder
                .formId(form.getId())
                .formName(form.getTitle())
                .formStatus(form.getStatus().name())
                .formDeleted(form.isDeleted())
                .questionId(question.getId())
                .questionText(question.getText())
                .questionType(question.getType())
                .questionCategoryId(question.getCategory().getId())
                .questionCategoryName(question.getCategory().getCategoryName())
                .questionBatch(question.getBatch())
                .questionDeleted(question.isDeleted())
                .facultyId(question.getFaculty().getId())
                .facultyName(question.getFaculty().getName())
                .facultyEmail(question.getFaculty().getEmail())
                .facultyAbbreviation(question.getFaculty().getAbbreviation() == null ? "" : question.getFaculty().getAbbreviation())
                .subjectId(question.getSubject().getId())
                .subjectName(question.getSubject().getName())
                .subjectAbbreviation(question.getSubject().getAbbreviation())
                .subjectCode(question.getSubject().getSubjectCode())
                .subjectDeleted(question.getSubject().isDeleted())
                .academicYearId(academic.academicYearId())
                .academicYearString(academic.academicYearString())
                .academicYearDeleted(academic.academicYearDeleted())
                .departmentId(academic.departmentId())
                .departmentName(academic.departmentName())
                .departmentAbbreviation(academic.departmentAbbreviation())
                .departmentDeleted(academic.departmentDeleted())
                .semesterId(academic.semesterId())
                .semesterNumber(academic.semesterNumber())
                .semesterDeleted(academic.semesterDeleted())
                .divisionId(academic.divisionId())
                .divisionName(academic.divisionName())
                .divisionDeleted(academic.divisionDeleted())
                .responseValue(response.getResponseValue())
                .batch(question.getBatch())
                .submittedAt(response.getSubmittedAt())
                .build();
    }
}
