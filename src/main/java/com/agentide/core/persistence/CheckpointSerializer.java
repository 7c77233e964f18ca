package com.agentide.core.persistence;

import com.agentide.core.model.SessionSnapshot;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/**
 * JSON encoding of {@link SessionSnapshot}s shared by every checkpoint store.
 */
public final class CheckpointSerializer {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .addModule(new ParameterNamesModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private CheckpointSerializer() {}

    public static String toJson(SessionSnapshot snapshot) {
        try {
            return MAPPER.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new CheckpointException("Failed to serialize checkpoint for session "
                    + snapshot.sessionId(), e);
        }
    }

    public static SessionSnapshot fromJson(String json) {
        try {
            return MAPPER.readValue(json, SessionSnapshot.class);
        } catch (JsonProcessingException e) {
            throw new CheckpointException("Failed to deserialize checkpoint: " + e.getOriginalMessage(), e);
        }
    }
}
