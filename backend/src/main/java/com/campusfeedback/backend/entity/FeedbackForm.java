package com.campusfeedback.backend.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

@Entity
@Table(name = "feedback_forms")
@Getter
@Setter
@NoArgsConstructor
public class FeedbackForm {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false, length = 255)
    private String title;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private FormStatus status = FormStatus.DRAFT;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "subject_allocation_id")
    private SubjectAllocation subjectAllocation;

    @Column(name = "start_date")
    private LocalDateTime startDate;

    // null means the form stays open until closed manually
    @Column(name = "end_date")
    private LocalDateTime endDate;

    @Column(name = "is_deleted", nullable = false)
    private boolean deleted = false;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    public FeedbackForm(String title, FormStatus status, SubjectAllocation subjectAllocation) {
        this.title = title;
        this.status = status;
        this.subjectAllocation = subjectAllocation;
    }

    @PrePersist
    public void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }
}
