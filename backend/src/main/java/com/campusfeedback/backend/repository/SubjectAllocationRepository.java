package com.campusfeedback.backend.repository;

import com.campusfeedback.backend.entity.SubjectAllocation;
import org.springframework.data.jpa.repository.JpaRepository;

public interface SubjectAllocationRepository extends JpaRepository<SubjectAllocation, String> {
}
