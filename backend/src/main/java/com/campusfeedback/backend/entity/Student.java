package com.campusfeedback.backend.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "students")
@Getter
@Setter
@NoArgsConstructor
public class Student {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "enrollment_number", nullable = false, unique = true, length = 32)
    private String enrollmentNumber;

    @Column(nullable = false, length = 128)
    private String name;

    @Column(nullable = false, length = 255)
    private String email;

    @Column(length = 32)
    private String batch;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "academic_year_id")
    private AcademicYear academicYear;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "semester_id")
    private Semester semester;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "division_id")
    private Division division;

    @Column(name = "is_deleted", nullable = false)
    private boolean deleted = false;

    public Student(String enrollmentNumber, String name, String email, String batch,
                   AcademicYear academicYear, Semester semester, Division division) {
        this.enrollmentNumber = enrollmentNumber;
        this.name = name;
        this.email = email;
        this.batch = batch;
        this.academicYear = academicYear;
        this.semester = semester;
        this.division = division;
    }
}
