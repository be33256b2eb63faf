package com.chatdesk.realtime.broadcast;

import com.chatdesk.realtime.dto.RealtimeEvent;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class BroadcastEnvelope {
    private ChannelFamily family;
    private UUID key;
    private String excludeConnectionId;
    private String originInstanceId;
    private RealtimeEvent event;
}
