package com.campusfeedback.backend.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "divisions")
@Getter
@Setter
@NoArgsConstructor
public class Division {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "division_name", nullable = false, length = 32)
    private String divisionName;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "semester_id", nullable = false)
    private Semester semester;

    @Column(name = "is_deleted", nullable = false)
    private boolean deleted = false;

    public Division(String divisionName, Semester semester) {
        this.divisionName = divisionName;
        this.semester = semester;
    }
}
