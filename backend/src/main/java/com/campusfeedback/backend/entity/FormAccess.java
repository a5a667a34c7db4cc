package com.campusfeedback.backend.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * One-time access grant: the token a respondent uses to submit one form. Exactly one of
 * {@code student} and {@code overrideStudent} is set.
 */
@Entity
@Table(name = "form_access")
@Getter
@Setter
@NoArgsConstructor
public class FormAccess {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "access_token", nullable = false, unique = true, length = 128)
    private String accessToken;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "form_id", nullable = false)
    private FeedbackForm form;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "student_id")
    private Student student;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "override_student_id")
    private OverrideStudent overrideStudent;

    @Column(name = "is_submitted", nullable = false)
    private boolean submitted = false;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    public FormAccess(String accessToken, FeedbackForm form, Student student, OverrideStudent overrideStudent) {
        this.accessToken = accessToken;
        this.form = form;
        this.student = student;
        this.overrideStudent = overrideStudent;
    }

    @PrePersist
    public void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }
}
