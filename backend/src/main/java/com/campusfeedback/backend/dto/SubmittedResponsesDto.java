package com.campusfeedback.backend.dto;

import java.util.List;

public record SubmittedResponsesDto(List<StudentResponseDto> responses) {
}
