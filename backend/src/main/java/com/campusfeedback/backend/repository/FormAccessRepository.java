package com.campusfeedback.backend.repository;

import com.campusfeedback.backend.entity.FormAccess;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface FormAccessRepository extends JpaRepository<FormAccess, String> {

    @EntityGraph(attributePaths = {"form"})
    Optional<FormAccess> findByAccessToken(String accessToken);

    // Row lock only; joining nullable associations here breaks FOR UPDATE on PostgreSQL.
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select a from FormAccess a where a.accessToken = :token")
    Optional<FormAccess> findByAccessTokenForUpdate(@Param("token") String token);
}
