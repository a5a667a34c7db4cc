package com.campusfeedback.backend.controller;

import com.campusfeedback.backend.dto.ApiResponse;
import com.campusfeedback.backend.dto.StudentResponseDto;
import com.campusfeedback.backend.dto.SubmissionStatusDto;
import com.campusfeedback.backend.dto.SubmittedResponsesDto;
import com.campusfeedback.backend.entity.StudentResponse;
import com.campusfeedback.backend.exception.BizException;
import com.campusfeedback.backend.service.StudentResponseService;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

// Public: the access token in the path is the only credential.
@RestController
@RequestMapping("/api/v1/student-responses")
@RequiredArgsConstructor
public class StudentResponseController {

    private final StudentResponseService studentResponseService;

    @PostMapping("/submit/{token}")
    public ResponseEntity<ApiResponse<SubmittedResponsesDto>> submitResponses(
            @PathVariable @Size(max = 128) String token,
            @RequestBody(required = false) Map<String, JsonNode> responses) {
        if (token == null || token.isBlank()) {
            throw new BizException("INVALID_REQUEST", "Access token is required.");
        }
        if (responses == null || responses.isEmpty()) {
            throw new BizException("INVALID_REQUEST", "At least one response is required for submission.");
        }

        List<StudentResponse> created = studentResponseService.submitResponses(token, responses);
        List<StudentResponseDto> dtos = created.stream()
                .map(StudentResponseDto::fromEntity)
                .toList();
        return ResponseEntity.ok(ApiResponse.success("Feedback submitted successfully.", dtos.size(), new SubmittedResponsesDto(dtos)));
    }

    @GetMapping("/check-submission/{token}")
    public ResponseEntity<ApiResponse<SubmissionStatusDto>> checkSubmission(@PathVariable @Size(max = 128) String token) {
        return ResponseEntity.ok(ApiResponse.success(studentResponseService.checkSubmission(token)));
    }
}
