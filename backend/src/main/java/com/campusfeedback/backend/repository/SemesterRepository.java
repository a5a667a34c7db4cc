package com.campusfeedback.backend.repository;

import com.campusfeedback.backend.entity.Semester;
import org.springframework.data.jpa.repository.JpaRepository;

public interface SemesterRepository extends JpaRepository<Semester, String> {
}
