package com.campusfeedback.backend.repository;

import com.campusfeedback.backend.entity.QuestionCategory;
import org.springframework.data.jpa.repository.JpaRepository;

public interface QuestionCategoryRepository extends JpaRepository<QuestionCategory, String> {
}
