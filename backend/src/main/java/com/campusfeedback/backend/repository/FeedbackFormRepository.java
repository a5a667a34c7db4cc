package com.campusfeedback.backend.repository;

import com.campusfeedback.backend.entity.FeedbackForm;
import com.campusfeedback.backend.entity.FormStatus;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.Optional;

public interface FeedbackFormRepository extends JpaRepository<FeedbackForm, String> {

    @EntityGraph(attributePaths = {"subjectAllocation", "subjectAllocation.faculty", "subjectAllocation.subject"})
    Optional<FeedbackForm> findWithAllocationById(String id);

    @Modifying(clearAutomatically = true)
    @Query("update FeedbackForm f set f.status = :closed where f.status = :active and f.deleted = false and f.endDate is not null and f.endDate < :now")
    int closeExpired(@Param("active") FormStatus active, @Param("closed") FormStatus closed, @Param("now") LocalDateTime now);
}
