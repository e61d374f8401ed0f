package me.golemcore.attention.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InboundMessageRequest {
    private String id;
    private String senderId;
    private String senderName;
    private String selfId;
    private String text;
    private List<String> mentions;
    private List<String> attachmentRefs;
}
