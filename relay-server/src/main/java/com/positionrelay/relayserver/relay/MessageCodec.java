package com.positionrelay.relayserver.relay;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.type.LogicalType;
import com.positionrelay.relayserver.registry.PlayerRecord;

/**
 * JSON encoding of the two wire messages: the initial player record sent on
 * connect, and move events in either direction.
 */
public class MessageCodec {

    private final ObjectMapper objectMapper;

    public MessageCodec() {
        this(new ObjectMapper());
    }

    public MessageCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        // coordinates must be JSON numbers, "1.5" is rejected
        this.objectMapper.coercionConfigFor(LogicalType.Float)
                .setCoercion(CoercionInputShape.String, CoercionAction.Fail);
    }

    /**
     * Decodes an inbound message. The type is not checked here.
     */
    public MoveEvent decode(String payload) throws MalformedMessageException {
        MoveEvent event;
        try {
            event = objectMapper.readValue(payload, MoveEvent.class);
        } catch (JsonProcessingException e) {
            throw new MalformedMessageException(e.getOriginalMessage(), payload, e);
        }
        if (event == null) {
            throw new MalformedMessageException("Empty message", payload, null);
        }
        return event;
    }

    public String encode(MoveEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode move event for player " + event.playerId(), e);
        }
    }

    /**
     * Encodes {@code {id, x, y}}. The last-seen time stays server-side.
     */
    public String encodeInitialRecord(PlayerRecord record) {
        ObjectNode node = objectMapper.createObjectNode()
                .put("id", record.id())
                .put("x", record.x())
                .put("y", record.y());
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode initial record for player " + record.id(), e);
        }
    }
}
