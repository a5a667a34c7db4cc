package com.campusfeedback.backend.repository;

import com.campusfeedback.backend.entity.Student;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface StudentRepository extends JpaRepository<Student, String> {

    @EntityGraph(attributePaths = {"academicYear", "semester", "semester.department", "division"})
    Optional<Student> findWithAcademicsById(String id);
}
