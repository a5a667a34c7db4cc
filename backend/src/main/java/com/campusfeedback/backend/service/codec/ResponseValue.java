package com.campusfeedback.backend.service.codec;

import java.math.BigDecimal;
import java.util.List;
import java.util.OptionalDouble;

/**
 * A stored answer decoded according to its question type.
 */
public interface ResponseValue {

    default OptionalDouble score() {
        return OptionalDouble.empty();
    }

    record Numeric(BigDecimal value) implements ResponseValue {
        @Override
        public OptionalDouble score() {
            return OptionalDouble.of(value.doubleValue());
        }
    }

    record Text(String value) implements ResponseValue {
    }

    record Choice(List<String> options) implements ResponseValue {
    }

    /** Anything that does not fit the question's type; holds the stored text verbatim. */
    record Raw(String json) implements ResponseValue {
    }
}
