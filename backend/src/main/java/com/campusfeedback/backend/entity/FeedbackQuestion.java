package com.campusfeedback.backend.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "feedback_questions")
@Getter
@Setter
@NoArgsConstructor
public class FeedbackQuestion {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "form_id", nullable = false)
    private FeedbackForm form;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "category_id", nullable = false)
    private QuestionCategory category;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "faculty_id", nullable = false)
    private Faculty faculty;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "subject_id", nullable = false)
    private Subject subject;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String text;

    // rating, text, choice ... see QuestionType
    @Column(nullable = false, length = 32)
    private String type;

    @Column(length = 32)
    private String batch;

    @Column(name = "is_required", nullable = false)
    private boolean required = true;

    @Column(name = "display_order", nullable = false)
    private int displayOrder;

    @Column(name = "is_deleted", nullable = false)
    private boolean deleted = false;

    public FeedbackQuestion(FeedbackForm form, QuestionCategory category, Faculty faculty, Subject subject,
                            String text, String type, String batch, int displayOrder) {
        this.form = form;
        this.category = category;
        this.faculty = faculty;
        this.subject = subject;
        this.text = text;
        this.type = type;
        this.batch = batch;
        this.displayOrder = displayOrder;
    }
}
