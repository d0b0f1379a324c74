package me.golemcore.desk.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestRequest {
    private String sender;
    private String subject;
    private String body;
    private Instant receivedAt;
}
