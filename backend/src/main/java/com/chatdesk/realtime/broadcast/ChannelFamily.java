package com.chatdesk.realtime.broadcast;

/**
 * Broker channel families. Each family is one fixed Redis topic; the routing key
 * (conversation, tenant or user id) travels inside the envelope.
 */
public enum ChannelFamily {
    ROOM("chatdesk:broadcast:room"),
    TENANT("chatdesk:broadcast:tenant"),
    USER("chatdesk:broadcast:user");

    private final String topic;

    ChannelFamily(String topic) {
        this.topic = topic;
    }

    public String getTopic() {
        return topic;
    }
}
