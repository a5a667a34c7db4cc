package com.campusfeedback.backend.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "faculty")
@Getter
@Setter
@NoArgsConstructor
public class Faculty {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false, length = 128)
    private String name;

    @Column(nullable = false, unique = true, length = 255)
    private String email;

    @Column(length = 16)
    private String abbreviation;

    @Column(name = "is_deleted", nullable = false)
    private boolean deleted = false;

    public Faculty(String name, String email, String abbreviation) {
        this.name = name;
        this.email = email;
        this.abbreviation = abbreviation;
    }
}
