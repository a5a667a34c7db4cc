package com.campusfeedback.backend.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * A respondent added to a form roster outside the enrollment pipeline. Department and
 * semester are free text and carry no link to the academic structure tables.
 */
@Entity
@Table(name = "override_students")
@Getter
@Setter
@NoArgsConstructor
public class OverrideStudent {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "enrollment_number", length = 32)
    private String enrollmentNumber;

    @Column(nullable = false, length = 128)
    private String name;

    @Column(nullable = false, length = 255)
    private String email;

    @Column(length = 128)
    private String department;

    @Column(length = 16)
    private String semester;

    @Column(name = "is_deleted", nullable = false)
    private boolean deleted = false;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    public OverrideStudent(String enrollmentNumber, String name, String email, String department, String semester) {
        this.enrollmentNumber = enrollmentNumber;
        this.name = name;
        this.email = email;
        this.department = department;
        this.semester = semester;
    }

    @PrePersist
    public void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }
}
