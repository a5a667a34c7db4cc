package com.campusfeedback.backend.service.codec;

import java.util.Locale;
import java.util.Set;

/**
 * Families of question types. Questions store their type as free text; this maps the codes
 * in use onto the way their answers are decoded.
 */
public enum QuestionType {
    RATING(Set.of("rating", "scale", "number", "numeric")),
    TEXT(Set.of("text", "textarea", "comment")),
    CHOICE(Set.of("choice", "multiple_choice", "checkbox", "radio", "select")),
    OTHER(Set.of());

    private final Set<String> codes;

    QuestionType(Set<String> codes) {
        this.codes = codes;
    }

    public static QuestionType fromCode(String code) {
        if (code == null) {
            return OTHER;
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (QuestionType type : values()) {
            if (type.codes.contains(normalized)) {
                return type;
            }
        }
        return OTHER;
    }
}
