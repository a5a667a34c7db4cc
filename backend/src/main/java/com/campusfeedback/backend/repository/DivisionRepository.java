package com.campusfeedback.backend.repository;

import com.campusfeedback.backend.entity.Division;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface DivisionRepository extends JpaRepository<Division, String> {

    @EntityGraph(attributePaths = {"semester", "semester.department", "semester.academicYear"})
    Optional<Division> findWithHierarchyById(String id);
}
