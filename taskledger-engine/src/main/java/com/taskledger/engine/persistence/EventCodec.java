package com.taskledger.engine.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.taskledger.core.exception.CorruptionException;
import com.taskledger.core.exception.StorageException;
import com.taskledger.core.model.Event;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.OffsetDateTime;

/**
 * Encodes events as single-line JSON objects and decodes them back.
 *
 * Line format:
 * {"seq":12,"ts":"2024-05-01T10:00:00Z","type":"TaskAdded","workflowId":"wf_x","actor":"user","payload":{...}}
 */
public class EventCodec {

    static final String SEQ = "seq";
    static final String TS = "ts";
    static final String TYPE = "type";
    static final String WORKFLOW_ID = "workflowId";
    static final String ACTOR = "actor";
    static final String PAYLOAD = "payload";

    private final ObjectMapper objectMapper;

    public EventCodec() {
        this(createObjectMapper());
    }

    public EventCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Mapper shared by the log codec and the snapshot files.
     */
    public static ObjectMapper createObjectMapper() {
        return new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(SerializationFeature.INDENT_OUTPUT)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public ObjectMapper objectMapper() {
        return objectMapper;
    }

    /**
     * Encode an event as one line of JSON, without the trailing newline.
     */
    public String encode(Event event) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put(SEQ, event.sequence());
        node.put(TS, event.timestamp().toString());
        node.put(TYPE, event.type());
        node.put(WORKFLOW_ID, event.workflowId());
        if (event.actor() != null) {
            node.put(ACTOR, event.actor());
        }
        node.set(PAYLOAD, event.payload() == null ? objectMapper.createObjectNode() : event.payload());
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to encode event " + event.sequence(), e);
        }
    }

    /**
     * Decode one log line. Anything after the first JSON value (two events run
     * together on one line) makes the whole line corrupt.
     *
     * @throws CorruptionException if the line is not a well-formed event
     */
    public Event decode(String line) {
        JsonNode node;
        try {
            node = objectMapper.readTree(line);
        } catch (JsonProcessingException e) {
            throw new CorruptionException("Malformed JSON: " + e.getOriginalMessage(), e);
        }
        if (node == null || !node.isObject()) {
            throw new CorruptionException("Line is not a JSON object");
        }

        JsonNode seq = node.get(SEQ);
        if (seq == null || !seq.isIntegralNumber() || !seq.canConvertToLong() || seq.asLong() <= 0) {
            throw new CorruptionException("Missing or invalid '" + SEQ + "'");
        }

        Instant timestamp = parseTimestamp(requireText(node, TS));
        String type = requireText(node, TYPE);
        String workflowId = requireText(node, WORKFLOW_ID);

        JsonNode payload = node.get(PAYLOAD);
        if (payload == null || payload.isNull()) {
            payload = objectMapper.createObjectNode();
        } else if (!payload.isObject()) {
            throw new CorruptionException("'" + PAYLOAD + "' is not a JSON object");
        }

        JsonNode actor = node.get(ACTOR);
        return new Event(
            seq.asLong(),
            timestamp,
            type,
            workflowId,
            payload,
            actor == null || actor.isNull() ? null : actor.asText()
        );
    }

    private static String requireText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new CorruptionException("Missing or invalid '" + field + "'");
        }
        return value.asText();
    }

    private static Instant parseTimestamp(String text) {
        try {
            return Instant.parse(text);
        } catch (DateTimeException e) {
            try {
                return OffsetDateTime.parse(text).toInstant();
            } catch (DateTimeException ignored) {
                throw new CorruptionException("Invalid timestamp '" + text + "'", e);
            }
        }
    }
}
