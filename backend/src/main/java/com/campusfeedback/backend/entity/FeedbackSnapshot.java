package com.campusfeedback.backend.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.time.LocalDateTime;

/**
 * Denormalized copy of everything reporting needs about one answer, frozen at submission
 * time. Rows are inserted once and never updated, so later edits or soft deletes of the
 * source entities do not change historical reports.
 */
@Entity
@Immutable
@Table(name = "feedback_snapshots", indexes = {
    @Index(name = "idx_snapshot_faculty_year", columnList = "faculty_id, academic_year_id"),
    @Index(name = "idx_snapshot_form", columnList = "form_id")
})
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeedbackSnapshot {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "original_student_response_id", nullable = false, unique = true, length = 36)
    private String originalStudentResponseId;

    // respondent
    @Column(name = "student_id", length = 36)
    private String studentId;

    @Column(name = "override_student_id", length = 36)
    private String overrideStudentId;

    @Column(name = "is_override_student", nullable = false)
    private boolean overrideStudent;

    @Column(name = "student_enrollment_number", length = 32)
    private String studentEnrollmentNumber;

    @Column(name = "student_name", nullable = false, length = 128)
    private String studentName;

    @Column(name = "student_email", nullable = false, length = 255)
    private String studentEmail;

    // form
    @Column(name = "form_id", nullable = false, length = 36)
    private String formId;

    @Column(name = "form_name", nullable = false, length = 255)
    private String formName;

    @Column(name = "form_status", nullable = false, length = 16)
    private String formStatus;

    @Column(name = "form_is_deleted", nullable = false)
    private boolean formDeleted;

    // question
    @Column(name = "question_id", nullable = false, length = 36)
    private String questionId;

    @Column(name = "question_text", nullable = false, columnDefinition = "TEXT")
    private String questionText;

    @Column(name = "question_type", nullable = false, length = 32)
    private String questionType;

    @Column(name = "question_category_id", nullable = false, length = 36)
    private String questionCategoryId;

    @Column(name = "question_category_name", nullable = false, length = 128)
    private String questionCategoryName;

    @Column(name = "question_batch", length = 32)
    private String questionBatch;

    @Column(name = "question_is_deleted", nullable = false)
    private boolean questionDeleted;

    // faculty
    @Column(name = "faculty_id", nullable = false, length = 36)
    private String facultyId;

    @Column(name = "faculty_name", nullable = false, length = 128)
    private String facultyName;

    @Column(name = "faculty_email", nullable = false, length = 255)
    private String facultyEmail;

    @Column(name = "faculty_abbreviation", length = 16)
    private String facultyAbbreviation;

    // subject
    @Column(name = "subject_id", nullable = false, length = 36)
    private String subjectId;

    @Column(name = "subject_name", nullable = false, length = 255)
    private String subjectName;

    @Column(name = "subject_abbreviation", length = 32)
    private String subjectAbbreviation;

    @Column(name = "subject_code", nullable = false, length = 32)
    private String subjectCode;

    @Column(name = "subject_is_deleted", nullable = false)
    private boolean subjectDeleted;

    // academic structure; empty strings when an override student's cohort could not be resolved
    @Column(name = "academic_year_id", nullable = false, length = 36)
    private String academicYearId;

    @Column(name = "academic_year_string", nullable = false, length = 16)
    private String academicYearString;

    @Column(name = "academic_year_is_deleted", nullable = false)
    private boolean academicYearDeleted;

    @Column(name = "department_id", nullable = false, length = 36)
    private String departmentId;

    @Column(name = "department_name", nullable = false, length = 128)
    private String departmentName;

    @Column(name = "department_abbreviation", nullable = false, length = 16)
    private String departmentAbbreviation;

    @Column(name = "department_is_deleted", nullable = false)
    private boolean departmentDeleted;

    @Column(name = "semester_id", nullable = false, length = 36)
    private String semesterId;

    @Column(name = "semester_number", nullable = false)
    private int semesterNumber;

    @Column(name = "semester_is_deleted", nullable = false)
    private boolean semesterDeleted;

    @Column(name = "division_id", nullable = false, length = 36)
    private String divisionId;

    @Column(name = "division_name", nullable = false, length = 32)
    private String divisionName;

    @Column(name = "division_is_deleted", nullable = false)
    private boolean divisionDeleted;

    // answer
    @Column(name = "response_value", nullable = false, columnDefinition = "TEXT")
    private String responseValue;

    @Column(length = 32)
    private String batch;

    @Column(name = "submitted_at", nullable = false)
    private LocalDateTime submittedAt;

    @Builder.Default
    @Column(name = "is_deleted", nullable = false)
    private boolean deleted = false;
}
