package com.campusfeedback.backend.repository;

import com.campusfeedback.backend.entity.FeedbackSnapshot;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface FeedbackSnapshotRepository extends JpaRepository<FeedbackSnapshot, String> {

    @Query("select s from FeedbackSnapshot s where s.facultyId = :facultyId and s.academicYearId = :academicYearId " +
           "and lower(s.questionType) = lower(:questionType) and s.formDeleted = false and s.deleted = false " +
           "order by s.semesterNumber asc")
    List<FeedbackSnapshot> findForFacultyReport(@Param("facultyId") String facultyId,
                                                @Param("academicYearId") String academicYearId,
                                                @Param("questionType") String questionType);

    List<FeedbackSnapshot> findByFormId(String formId);
}
