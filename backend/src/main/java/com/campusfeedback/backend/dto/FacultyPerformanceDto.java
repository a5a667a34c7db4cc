package com.campusfeedback.backend.dto;

import java.util.Map;

/**
 * Average rating per semester (1..8, null when there is no rating) for one faculty member
 * in one academic year.
 */
public record FacultyPerformanceDto(
        String facultyId,
        String facultyName,
        String academicYear,
        Map<Integer, Double> semesterAverages,
        Double totalAverage,
        int ratingCount
) {
}
