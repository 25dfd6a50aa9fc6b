package com.foodrec.interceptor;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogRedactorTest {

    private final LogRedactor redactor = new LogRedactor(new ObjectMapper(), 200);

    @Test
    void should_RedactSensitiveKeysAtAnyDepth() {
        String body = "{\"apiKey\":\"AIza-secret\",\"profile\":{\"keywords\":[\"tacos\"],\"accessToken\":\"abc\"},"
                + "\"headers\":[{\"Authorization\":\"Bearer x\"}]}";

        String redacted = redactor.redact(body);

        assertThat(redacted)
                .doesNotContain("AIza-secret", "abc", "Bearer x")
                .contains("\"apiKey\":\"[REDACTED]\"", "\"accessToken\":\"[REDACTED]\"", "\"tacos\"");
    }

    @Test
    void should_PassThroughNonJsonBodies() {
        assertThat(redactor.redact("not json at all")).isEqualTo("not json at all");
        assertThat(redactor.redact(null)).isNull();
    }

    @Test
    void should_TruncateLongBodies() {
        String longBody = "x".repeat(500);

        assertThat(redactor.redact(longBody)).hasSize(200 + "...(truncated)".length()).endsWith("...(truncated)");
    }
}
