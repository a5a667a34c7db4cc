package com.campusfeedback.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ApiError {
    private String status;
    private String code;
    private String message;

    public static ApiError fail(String code, String message) {
        return new ApiError("fail", code, message);
    }

    public static ApiError error(String code, String message) {
        return new ApiError("error", code, message);
    }
}
