package com.openforge.agentmemory.embedding;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.agentmemory.exception.ConfigurationException;
import com.openforge.agentmemory.exception.UpstreamException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;

/**
 * {@link EmbeddingGateway} over an OpenAI-compatible /embeddings endpoint.
 *
 * Raw {@link HttpClient} + Jackson, no SDK. Every request carries a read
 * timeout of {@code timeout-seconds}; expiry surfaces as an
 * {@link UpstreamException} like any other transport failure.
 */
@Slf4j
@Component
public class EmbeddingClient implements EmbeddingGateway {

    /** Inputs are cut to this many characters to stay below model token limits. */
    static final int MAX_INPUT_CHARS = 8000;

    private final HttpClient          httpClient;
    private final ObjectMapper        objectMapper;
    private final EmbeddingProperties props;

    public EmbeddingClient(HttpClient httpClient,
                           ObjectMapper objectMapper,
                           EmbeddingProperties props) {
        this.httpClient   = httpClient;
        this.objectMapper = objectMapper;
        this.props        = props;
    }

    // ── Public API ───────────────────────────────────────────────────────────

    /**
     * Embed a piece of text.
     *
     * @return vector with exactly {@link EmbeddingProperties#dimensions()} elements
     * @throws ConfigurationException if the endpoint answers with another dimensionality
     */
    @Override
    public List<Float> embed(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Cannot embed blank text");
        }

        String input = text.length() > MAX_INPUT_CHARS ? text.substring(0, MAX_INPUT_CHARS) : text;
        String body  = serialize(EmbeddingRequest.of(input, props.model(), props.dimensions()));

        log.debug("[Embed] → POST /embeddings model={} input-length={}", props.model(), input.length());

        HttpRequest httpRequest = HttpRequest.newBuilder()
                .uri(URI.create(props.baseUrl() + "/embeddings"))
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + props.apiKey())
                .timeout(Duration.ofSeconds(props.timeoutSeconds()))
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new EmbeddingException(
                    "Embedding API timed out after %ds".formatted(props.timeoutSeconds()), e);
        } catch (IOException e) {
            throw new EmbeddingException("Network error calling embedding API: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmbeddingException("Interrupted while calling embedding API", e);
        }

        List<Float> vector = parseResponse(response);
        if (vector.size() != props.dimensions()) {
            throw ConfigurationException.deployer(
                    "Embedding model %s returned %d dimensions, configured %d"
                            .formatted(props.model(), vector.size(), props.dimensions()));
        }
        return vector;
    }

    @Override
    public int dimensions() {
        return props.dimensions();
    }

    @Override
    public String modelName() {
        return props.model();
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private List<Float> parseResponse(HttpResponse<String> response) {
        int    status = response.statusCode();
        String body   = response.body();

        if (status == 429) throw new EmbeddingException("Embedding API rate-limited");
        if (status < 200 || status >= 300)
            throw new EmbeddingException("Embedding API returned HTTP %d: %s".formatted(status, abbreviate(body)));

        try {
            EmbeddingResponse resp = objectMapper.readValue(body, EmbeddingResponse.class);
            List<Float> vector = resp.firstEmbedding();
            if (vector == null) throw new EmbeddingException("Embedding response contained no data");
            log.debug("[Embed] ← vector dim={}", vector.size());
            return vector;
        } catch (JsonProcessingException e) {
            throw new EmbeddingException("Failed to parse embedding response: " + abbreviate(body), e);
        }
    }

    private String serialize(Object obj) {
        try {
            return objectMapper.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new EmbeddingException("Failed to serialize embedding request", e);
        }
    }

    private static String abbreviate(String body) {
        if (body == null) return "";
        return body.length() > 300 ? body.substring(0, 300) + "..." : body;
    }

    // ── Exception ────────────────────────────────────────────────────────────

    public static class EmbeddingException extends UpstreamException {
        public EmbeddingException(String message) { super(message); }
        public EmbeddingException(String message, Throwable cause) { super(message, cause); }
    }
}
