package com.faceattendance.provider;

import com.faceattendance.config.AttendanceProperties;
import com.faceattendance.exception.AttendanceException;
import com.faceattendance.exception.ErrorCode;
import com.faceattendance.gallery.Embeddings;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.SocketTimeoutException;
import java.util.ArrayList;
import java.util.List;

/**
 * Calls the Python face service over HTTP.
 *
 * <p>Request: multipart {@code file} to {@code {url}/embed}. Response:
 * <pre>
 * {"success": true, "faces": [{"embedding": [...], "bbox": [x1, y1, x2, y2]}]}
 * {"success": false, "message": "...", "error_code": "decode_error"}
 * </pre>
 */
@Component
public class RemoteEmbeddingProvider implements EmbeddingProvider {
    private static final Logger log = LoggerFactory.getLogger(RemoteEmbeddingProvider.class);

    private static final String DECODE_ERROR_CODE = "decode_error";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String providerUrl;
    private final int dimension;

    public RemoteEmbeddingProvider(RestTemplate restTemplate, ObjectMapper objectMapper,
                                   AttendanceProperties properties) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.providerUrl = properties.getProvider().getUrl();
        this.dimension = properties.getEmbeddingDimension();
    }

    @Override
    public List<DetectedFace> extract(byte[] image) {
        String url = providerUrl + "/embed";
        log.debug("Calling embedding provider at {} ({} bytes)", url, image.length);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.MULTIPART_FORM_DATA);

        MultiValueMap<String, Object> body = new LinkedMultiValueMap<>();
        body.add("file", new ByteArrayResource(image) {
            @Override
            public String getFilename() {
                return "frame.jpg";
            }
        });

        ResponseEntity<String> response;
        try {
            response = restTemplate.postForEntity(url, new HttpEntity<>(body, headers), String.class);
        } catch (HttpStatusCodeException e) {
            // The service answers 4xx with the same JSON envelope
            return parse(e.getResponseBodyAsString());
        } catch (ResourceAccessException e) {
            if (e.getCause() instanceof SocketTimeoutException) {
                throw new AttendanceException(ErrorCode.PROVIDER_TIMEOUT,
                        "Face recognition service timed out", e);
            }
            throw new AttendanceException(ErrorCode.PROVIDER_FAILURE,
                    "Cannot connect to face recognition service at " + providerUrl, e);
        } catch (RestClientException e) {
            throw new AttendanceException(ErrorCode.PROVIDER_FAILURE,
                    "Face recognition service error: " + e.getMessage(), e);
        }
        return parse(response.getBody());
    }

    List<DetectedFace> parse(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json == null ? "" : json);
        } catch (JsonProcessingException e) {
            throw new AttendanceException(ErrorCode.PROVIDER_FAILURE,
                    "Invalid response from face recognition service", e);
        }
        if (root == null || root.isMissingNode() || !root.isObject()) {
            throw new AttendanceException(ErrorCode.PROVIDER_FAILURE,
                    "Empty response from face recognition service");
        }

        if (!root.path("success").asBoolean(false)) {
            String message = root.path("message").asText("Unknown error from face recognition service");
            if (DECODE_ERROR_CODE.equals(root.path("error_code").asText())) {
                throw AttendanceException.decodeError(message);
            }
            throw new AttendanceException(ErrorCode.PROVIDER_FAILURE, "Face encoding failed: " + message);
        }

        List<DetectedFace> faces = new ArrayList<>();
        for (JsonNode face : root.path("faces")) {
            JsonNode embedding = face.get("embedding");
            if (embedding == null || !embedding.isArray()) {
                throw new AttendanceException(ErrorCode.PROVIDER_FAILURE,
                        "Face recognition service returned a face without embedding");
            }
            faces.add(new DetectedFace(checked(toFloats(embedding)), face.has("bbox") ? toFloats(face.get("bbox")) : null));
        }
        log.debug("Embedding provider found {} face(s)", faces.size());
        return faces;
    }

    // A bad vector here is the service's fault, not the caller's
    private float[] checked(float[] embedding) {
        try {
            Embeddings.validate(embedding, dimension);
        } catch (AttendanceException e) {
            throw new AttendanceException(ErrorCode.PROVIDER_FAILURE,
                    "Face recognition service returned an unusable embedding: " + e.getMessage(), e);
        }
        return embedding;
    }

    private static float[] toFloats(JsonNode array) {
        float[] values = new float[array.size()];
        for (int i = 0; i < array.size(); i++) {
            values[i] = (float) array.get(i).asDouble();
        }
        return values;
    }
}
