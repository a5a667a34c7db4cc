package com.campusfeedback.backend.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * The faculty / subject / division / lecture type tuple a feedback form evaluates.
 */
@Entity
@Table(name = "subject_allocations")
@Getter
@Setter
@NoArgsConstructor
public class SubjectAllocation {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "faculty_id", nullable = false)
    private Faculty faculty;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "subject_id", nullable = false)
    private Subject subject;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "division_id")
    private Division division;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "academic_year_id")
    private AcademicYear academicYear;

    @Enumerated(EnumType.STRING)
    @Column(name = "lecture_type", nullable = false, length = 16)
    private LectureType lectureType;

    @Column(name = "is_deleted", nullable = false)
    private boolean deleted = false;

    public SubjectAllocation(Faculty faculty, Subject subject, Division division, AcademicYear academicYear, LectureType lectureType) {
        this.faculty = faculty;
        this.subject = subject;
        this.division = division;
        this.academicYear = academicYear;
        this.lectureType = lectureType;
    }
}
