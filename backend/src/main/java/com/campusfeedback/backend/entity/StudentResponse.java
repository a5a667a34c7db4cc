package com.campusfeedback.backend.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

@Entity
@Table(name = "student_responses")
@Getter
@Setter
@NoArgsConstructor
public class StudentResponse {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "student_id")
    private Student student;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "override_student_id")
    private OverrideStudent overrideStudent;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "feedback_form_id", nullable = false)
    private FeedbackForm feedbackForm;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "question_id", nullable = false)
    private FeedbackQuestion question;

    @Column(name = "response_value", nullable = false, columnDefinition = "TEXT")
    private String responseValue;

    @Column(name = "submitted_at", nullable = false)
    private LocalDateTime submittedAt;

    @Column(name = "is_deleted", nullable = false)
    private boolean deleted = false;

    public StudentResponse(Student student, OverrideStudent overrideStudent, FeedbackForm feedbackForm,
                           FeedbackQuestion question, String responseValue, LocalDateTime submittedAt) {
        this.student = student;
        this.overrideStudent = overrideStudent;
        this.feedbackForm = feedbackForm;
        this.question = question;
        this.responseValue = responseValue;
        this.submittedAt = submittedAt;
    }
}
