package com.campusfeedback.backend.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SubmissionStatusDto(@JsonProperty("isSubmitted") boolean isSubmitted) {
}
