package com.campusfeedback.backend.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "subjects")
@Getter
@Setter
@NoArgsConstructor
public class Subject {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false, length = 255)
    private String name;

    @Column(length = 32)
    private String abbreviation;

    @Column(name = "subject_code", nullable = false, length = 32)
    private String subjectCode;

    @Column(name = "is_deleted", nullable = false)
    private boolean deleted = false;

    public Subject(String name, String abbreviation, String subjectCode) {
        this.name = name;
        this.abbreviation = abbreviation;
        this.subjectCode = subjectCode;
    }
}
