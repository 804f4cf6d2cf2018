package com.queueserve.api.websocket;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Envelope for every realtime message: {@code { type, data }}.
 *
 * <p>{@code type} is one of {@code QUEUE_UPDATE}, {@code QUEUE_POSITION},
 * {@code KITCHEN_QUEUE} or {@code ORDER_READY}; clients dispatch on it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebSocketMessage {

    private String type;

    /** Serialized to JSON by Spring's message converter. */
    private Object data;

    public static WebSocketMessage of(String type, Object data) {
        return new WebSocketMessage(type, data);
    }
}
