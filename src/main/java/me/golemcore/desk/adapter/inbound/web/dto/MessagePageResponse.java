package me.golemcore.desk.adapter.inbound.web.dto;

import me.golemcore.desk.domain.model.SupportMessage;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One page of the message listing.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MessagePageResponse {
    private List<SupportMessage> items;
    private int total;
    private int limit;
    private int offset;
}
