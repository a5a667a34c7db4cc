package com.campusfeedback.backend.repository;

import com.campusfeedback.backend.entity.StudentResponse;
import org.springframework.data.jpa.repository.JpaRepository;

public interface StudentResponseRepository extends JpaRepository<StudentResponse, String> {
}
