package com.campusfeedback.backend.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "academic_years")
@Getter
@Setter
@NoArgsConstructor
public class AcademicYear {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "year_string", nullable = false, unique = true, length = 16)
    private String yearString;

    @Column(name = "is_deleted", nullable = false)
    private boolean deleted = false;

    public AcademicYear(String yearString) {
        this.yearString = yearString;
    }
}
