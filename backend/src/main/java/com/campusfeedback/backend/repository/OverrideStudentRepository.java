package com.campusfeedback.backend.repository;

import com.campusfeedback.backend.entity.OverrideStudent;
import org.springframework.data.jpa.repository.JpaRepository;

public interface OverrideStudentRepository extends JpaRepository<OverrideStudent, String> {
}
