package com.campusfeedback.backend.controller;

import com.campusfeedback.backend.dto.ApiResponse;
import com.campusfeedback.backend.dto.FacultyPerformanceDto;
import com.campusfeedback.backend.service.FacultyPerformanceService;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Reporting endpoints for internal services, authenticated with the service API key.
 */
@RestController
@RequestMapping("/api/v1/service/analytics")
@RequiredArgsConstructor
public class ServiceAnalyticsController {

    private final FacultyPerformanceService facultyPerformanceService;

    @GetMapping("/faculty/{facultyId}/academic-years/{academicYearId}")
    public ResponseEntity<ApiResponse<FacultyPerformanceDto>> getFacultyPerformance(@PathVariable @Size(max = 36) String facultyId,
                                                                                   @PathVariable @Size(max = 36) String academicYearId) {
        return ResponseEntity.ok(ApiResponse.success(facultyPerformanceService.getFacultyPerformance(facultyId, academicYearId)));
    }
}
