package com.vibeloop.core.contracts;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * JSON wire form of {@link RunEvent}, shared by the event log and the SSE stream:
 * <pre>{"run_id":"...","seq":1,"ts":"2026-01-01T00:00:00Z","t":"prompt.sent","payload":{...}}</pre>
 * The payload class is resolved from {@code t} through {@link EventType#payloadType()}.
 * Uses a private mapper so the wire shape does not depend on application Jackson settings.
 */
@Component
public class EventCodec {

    private final ObjectMapper mapper;

    public EventCodec() {
        this.mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public ObjectNode toJson(RunEvent event) {
        ObjectNode node = mapper.createObjectNode();
        node.put("run_id", event.runId());
        node.put("seq", event.seq());
        node.put("ts", event.timestamp().toString());
        node.put("t", event.type().wireName());
        node.set("payload", mapper.valueToTree(event.payload()));
        return node;
    }

    public String encode(RunEvent event) {
        try {
            return mapper.writeValueAsString(toJson(event));
        } catch (JsonProcessingException e) {
            throw new EventCodecException("Failed to encode event " + event.type().wireName()
                    + " #" + event.seq() + " for run " + event.runId(), e);
        }
    }

    public RunEvent decode(String json) {
        JsonNode node;
        try {
            node = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new EventCodecException("Malformed event JSON: " + e.getOriginalMessage(), e);
        }
        if (node == null || !node.isObject()) {
            throw new EventCodecException("Event JSON must be an object");
        }

        String t = node.path("t").asText(null);
        if (t == null) {
            throw new EventCodecException("Event is missing its type");
        }
        EventType type = EventType.fromWireName(t)
                .orElseThrow(() -> new EventCodecException("Unknown event type: " + t));

        String runId = node.path("run_id").asText(null);
        if (runId == null || !node.path("seq").canConvertToLong()) {
            throw new EventCodecException("Event is missing run_id or seq");
        }

        Instant ts;
        try {
            ts = Instant.parse(node.path("ts").asText());
        } catch (DateTimeParseException e) {
            throw new EventCodecException("Invalid event timestamp: " + node.path("ts").asText(), e);
        }

        JsonNode payloadNode = node.path("payload");
        try {
            EventPayload payload = mapper.treeToValue(
                    payloadNode.isMissingNode() ? mapper.createObjectNode() : payloadNode,
                    type.payloadType());
            return new RunEvent(runId, node.path("seq").asLong(), ts, payload);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new EventCodecException("Invalid payload for " + t + ": " + e.getMessage(), e);
        }
    }
}
