package com.campusfeedback.backend.repository;

import com.campusfeedback.backend.entity.FeedbackQuestion;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;

public interface FeedbackQuestionRepository extends JpaRepository<FeedbackQuestion, String> {

    @Query("select q from FeedbackQuestion q join fetch q.category join fetch q.faculty join fetch q.subject " +
           "where q.id in :ids and q.form.id = :formId and q.deleted = false")
    List<FeedbackQuestion> findActiveByFormIdAndIdIn(@Param("formId") String formId, @Param("ids") Collection<String> ids);
}
