package me.golemcore.attention.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionStateDto {
    private String sessionId;
    private double energy;
    private double mood;
    private boolean locked;
    private String ownerSenderId;
    private String cycleState;
    private int accumulationSize;
    private int backgroundSize;
    private int ambientSize;
    private String lastReplyTime;
    private int totalReplies;
    private boolean dirty;
}
