package com.campusfeedback.backend.entity;

public enum LectureType {
    LECTURE,
    LAB
}
