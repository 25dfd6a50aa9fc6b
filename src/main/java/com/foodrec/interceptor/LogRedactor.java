package com.foodrec.interceptor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 로그용 JSON 본문에서 비밀값(API 키, 토큰 등) 가리기
 */
public class LogRedactor {

    static final String REDACTED = "[REDACTED]";
    private static final List<String> SENSITIVE_KEY_PARTS = List.of("api_key", "apikey", "authorization", "token");

    private final ObjectMapper objectMapper;
    private final int maxLength;

    public LogRedactor(ObjectMapper objectMapper, int maxLength) {
        this.objectMapper = objectMapper;
        this.maxLength = maxLength;
    }

    /**
     * JSON이 아니면 원문을 그대로(길이만 제한) 반환
     */
    public String redact(String body) {
        if (body == null || body.isEmpty()) {
            return body;
        }
        String result;
        try {
            JsonNode root = objectMapper.readTree(body);
            redactNode(root);
            result = objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            result = body;
        }
        return truncate(result);
    }

    private void redactNode(JsonNode node) {
        if (node == null) {
            return;
        }
        if (node.isObject()) {
            ObjectNode object = (ObjectNode) node;
            List<String> names = new ArrayList<>();
            object.fieldNames().forEachRemaining(names::add);
            for (String name : names) {
                if (isSensitive(name)) {
                    object.set(name, TextNode.valueOf(REDACTED));
                } else {
                    redactNode(object.get(name));
                }
            }
        } else if (node.isArray()) {
            for (JsonNode child : node) {
                redactNode(child);
            }
        }
    }

    private boolean isSensitive(String key) {
        String lower = key.toLowerCase(Locale.ROOT);
        for (String part : SENSITIVE_KEY_PARTS) {
            if (lower.contains(part)) {
                return true;
            }
        }
        return false;
    }

    private String truncate(String value) {
        if (value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength) + "...(truncated)";
    }
}
