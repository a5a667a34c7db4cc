package com.campusfeedback.backend.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "question_categories")
@Getter
@Setter
@NoArgsConstructor
public class QuestionCategory {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "category_name", nullable = false, length = 128)
    private String categoryName;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(name = "is_deleted", nullable = false)
    private boolean deleted = false;

    public QuestionCategory(String categoryName, String description) {
        this.categoryName = categoryName;
        this.description = description;
    }
}
