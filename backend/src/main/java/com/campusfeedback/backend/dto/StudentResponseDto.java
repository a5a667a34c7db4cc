package com.campusfeedback.backend.dto;

import com.campusfeedback.backend.entity.StudentResponse;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

@Value
@Builder
public class StudentResponseDto {
    String id;
    String studentId;
    String overrideStudentId;
    String feedbackFormId;
    String questionId;
    String responseValue;
    LocalDateTime submittedAt;
    @JsonProperty("isDeleted")
    boolean deleted;

    public static StudentResponseDto fromEntity(StudentResponse entity) {
        return StudentResponseDto.builder()
                .id(entity.getId())
                .studentId(entity.getStudent() != null ? entity.getStudent().getId() : null)
                .overrideStudentId(entity.getOverrideStudent() != null ? entity.getOverrideStudent().getId() : null)
                .feedbackFormId(entity.getFeedbackForm().getId())
                .questionId(entity.getQuestion().getId())
                .responseValue(entity.getResponseValue())
                .submittedAt(entity.getSubmittedAt())
                .deleted(entity.isDeleted())
                .build();
    }
}
