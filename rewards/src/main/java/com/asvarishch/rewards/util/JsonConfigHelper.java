package com.asvarishch.rewards.util;

import com.asvarishch.rewards.exception.RewardPolicyException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Typed reads over a policy JSON tree. Missing or null fields come back as {@code null};
 * present fields of the wrong shape raise {@link RewardPolicyException}.
 */
@Component
public class JsonConfigHelper {

    private final ObjectMapper objectMapper;

    public JsonConfigHelper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ObjectMapper mapper() {
        return objectMapper;
    }

    public JsonNode readConfigJson(String json) {
        if (isBlank(json)) {
            throw new RewardPolicyException("reward config is blank");
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new RewardPolicyException("reward config is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    public String writeJson(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize reward config", e);
        }
    }

    public BigDecimal getDecimal(JsonNode root, String field) {
        if (isAbsent(root, field)) {
            return null;
        }
        JsonNode node = root.get(field);
        if (node.isNumber()) {
            return node.decimalValue();
        }
        if (node.isTextual() && !isBlank(node.asText())) {
            try {
                return new BigDecimal(node.asText().trim());
            } catch (NumberFormatException e) {
                throw new RewardPolicyException("'" + field + "' is not a number: " + node.asText(), e);
            }
        }
        throw new RewardPolicyException("'" + field + "' must be a number");
    }

    public Integer getInt(JsonNode root, String field) {
        BigDecimal value = getDecimal(root, field);
        if (value == null) {
            return null;
        }
        try {
            return value.intValueExact();
        } catch (ArithmeticException e) {
            throw new RewardPolicyException("'" + field + "' must be a whole number: " + value, e);
        }
    }

    public String getText(JsonNode root, String field) {
        if (isAbsent(root, field)) {
            return null;
        }
        JsonNode node = root.get(field);
        if (!node.isTextual()) {
            throw new RewardPolicyException("'" + field + "' must be a string");
        }
        return node.asText();
    }

    public Boolean getBoolean(JsonNode root, String field) {
        if (isAbsent(root, field)) {
            return null;
        }
        JsonNode node = root.get(field);
        if (!node.isBoolean()) {
            throw new RewardPolicyException("'" + field + "' must be true or false");
        }
        return node.booleanValue();
    }

    public boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }

    private static boolean isAbsent(JsonNode root, String field) {
        return root == null || field == null || !root.has(field) || root.get(field).isNull();
    }
}
