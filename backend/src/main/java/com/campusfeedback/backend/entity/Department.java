package com.campusfeedback.backend.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "departments")
@Getter
@Setter
@NoArgsConstructor
public class Department {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false, length = 128)
    private String name;

    @Column(length = 16)
    private String abbreviation;

    @Column(name = "is_deleted", nullable = false)
    private boolean deleted = false;

    public Department(String name, String abbreviation) {
        this.name = name;
        this.abbreviation = abbreviation;
    }
}
