package com.campusfeedback.backend.service.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Stores untyped answer payloads as compact JSON text and reads them back by question type.
 * Object keys are written in sorted order so equal answers always produce the same text.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ResponseValueCodec {

    private final ObjectMapper objectMapper;

    public String encode(JsonNode value) {
        JsonNode node = value == null ? NullNode.getInstance() : value;
        try {
            return objectMapper.writeValueAsString(canonicalize(node));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize response value", e);
        }
    }

    public ResponseValue decode(String questionType, String stored) {
        if (stored == null) {
            return new ResponseValue.Raw(null);
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(stored);
        } catch (JsonProcessingException e) {
            log.debug("Stored response value is not JSON, keeping it raw: {}", stored);
            return new ResponseValue.Raw(stored);
        }

        return switch (QuestionType.fromCode(questionType)) {
            case RATING -> decodeNumeric(node, stored);
            case TEXT -> new ResponseValue.Text(node.isTextual() ? node.asText() : node.toString());
            case CHOICE -> decodeChoice(node, stored);
            case OTHER -> new ResponseValue.Raw(stored);
        };
    }

    private ResponseValue decodeNumeric(JsonNode node, String stored) {
        if (node.isNumber()) {
            return new ResponseValue.Numeric(node.decimalValue());
        }
        if (node.isTextual()) {
            try {
                return new ResponseValue.Numeric(new BigDecimal(node.asText().trim()));
            } catch (NumberFormatException e) {
                return new ResponseValue.Raw(stored);
            }
        }
        if (node.isObject() && node.path("score").isNumber()) {
            return new ResponseValue.Numeric(node.get("score").decimalValue());
        }
        return new ResponseValue.Raw(stored);
    }

    private ResponseValue decodeChoice(JsonNode node, String stored) {
        if (node.isArray()) {
            List<String> options = new ArrayList<>();
            node.forEach(element -> options.add(element.asText()));
            return new ResponseValue.Choice(options);
        }
        if (node.isTextual()) {
            return new ResponseValue.Choice(List.of(node.asText()));
        }
        return new ResponseValue.Raw(stored);
    }

    private JsonNode canonicalize(JsonNode node) {
        if (node.isObject()) {
            Map<String, JsonNode> sorted = new TreeMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                sorted.put(field.getKey(), canonicalize(field.getValue()));
            }
            ObjectNode copy = objectMapper.createObjectNode();
            sorted.forEach(copy::set);
            return copy;
        }
        if (node.isArray()) {
            ArrayNode copy = objectMapper.createArrayNode();
            node.forEach(element -> copy.add(canonicalize(element)));
            return copy;
        }
        return node;
    }
}
