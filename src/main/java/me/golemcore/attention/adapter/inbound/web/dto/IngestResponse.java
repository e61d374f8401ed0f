package me.golemcore.attention.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestResponse {
    private String messageId;
    private boolean dropped;
    private String dropReason;
    private String action;
    private String reason;
}
