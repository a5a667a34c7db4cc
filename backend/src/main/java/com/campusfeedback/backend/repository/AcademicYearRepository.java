package com.campusfeedback.backend.repository;

import com.campusfeedback.backend.entity.AcademicYear;
import org.springframework.data.jpa.repository.JpaRepository;

public interface AcademicYearRepository extends JpaRepository<AcademicYear, String> {
}
