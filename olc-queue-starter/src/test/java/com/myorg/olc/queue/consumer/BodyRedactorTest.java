package com.myorg.olc.queue.consumer;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BodyRedactorTest {

    private final BodyRedactor redactor = new BodyRedactor(new ObjectMapper(), List.of("requesterEmail", "cardNumber"));

    @Test
    void masksSensitiveFieldsAtAnyDepth() {
        String body = "{\"orderId\":\"o1\",\"RequesterEmail\":\"a@b.c\",\"payment\":{\"cardNumber\":\"4111\"},"
                + "\"lines\":[{\"cardNumber\":\"5500\"}]}";

        String out = redactor.redact(body);

        assertThat(out).contains("\"orderId\":\"o1\"")
                .doesNotContain("a@b.c")
                .doesNotContain("4111")
                .doesNotContain("5500");
    }

    @Test
    void nonJsonBodyIsNeverEchoed() {
        assertThat(redactor.redact("email=a@b.c")).isEqualTo("<non-JSON body, 11 chars>");
    }
}
