package me.golemcore.desk.infrastructure.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.desk.domain.model.MessageStatus;
import me.golemcore.desk.domain.model.Priority;
import me.golemcore.desk.domain.model.SupportMessage;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AutoConfigurationTest {

    @Test
    void objectMapperWritesIsoInstantsAndWireLabels() throws Exception {
        ObjectMapper mapper = AutoConfiguration.objectMapper();
        SupportMessage message = SupportMessage.builder()
                .id(1L)
                .priority(Priority.URGENT)
                .status(MessageStatus.RESPONDED)
                .receivedAt(Instant.parse("2026-02-01T10:00:00Z"))
                .build();

        String json = mapper.writeValueAsString(message);

        assertTrue(json.contains("\"receivedAt\":\"2026-02-01T10:00:00Z\""), json);
        assertTrue(json.contains("\"priority\":\"Urgent\""), json);
        assertTrue(json.contains("\"status\":\"responded\""), json);
    }

    @Test
    void objectMapperIgnoresUnknownProperties() throws Exception {
        SupportMessage message = AutoConfiguration.objectMapper()
                .readValue("{\"id\":3,\"subject\":\"Help\",\"legacyField\":true}", SupportMessage.class);

        assertEquals("Help", message.getSubject());
    }
}
