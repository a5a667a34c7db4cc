package com.campusfeedback.backend.entity;

public enum FormStatus {
    DRAFT,
    ACTIVE,
    CLOSED
}
