package com.faceattendance.gallery;

import com.faceattendance.exception.AttendanceException;
import com.faceattendance.exception.ErrorCode;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

/**
 * Converts embeddings to and from the JSON text stored in the users table.
 */
@Component
public class EmbeddingCodec {

    private final ObjectMapper objectMapper;

    public EmbeddingCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(float[] embedding) {
        try {
            return objectMapper.writeValueAsString(embedding);
        } catch (JsonProcessingException e) {
            throw new AttendanceException(ErrorCode.INVALID_EMBEDDING, "Cannot serialize embedding", e);
        }
    }

    public float[] decode(String json) {
        if (json == null || json.isBlank()) {
            throw AttendanceException.invalidEmbedding("Stored embedding is empty");
        }
        try {
            return objectMapper.readValue(json, float[].class);
        } catch (JsonProcessingException e) {
            throw new AttendanceException(ErrorCode.INVALID_EMBEDDING, "Invalid encoding format in database", e);
        }
    }
}
