package org.jstats.pitwall_api.modules.openf1_gatherer.ingest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.jspecify.annotations.NullMarked;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.server.ResponseStatusException;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

import static org.springframework.http.HttpStatus.*;

@NullMarked
@Component
public class OpenF1Client {

    private static final Logger log = LoggerFactory.getLogger(OpenF1Client.class);

    private final RestClient http;

    public OpenF1Client(@Qualifier("openf1") RestClient http) {
        this.http = http;
    }

    /**
     * GET /{resource}?{query}, e.g. laps?session_key=9158&driver_number=44
     * - 200 JSON array -> body
     * - 404 -> empty array
     * - 429/5xx/IO -> retry with exponential backoff
     * - other 4xx -> throw (no retry)
     */
    @Retryable(
            retryFor = {
                    RateLimitedException.class,       // 429
                    Upstream5xxException.class,       // 5xx
                    ResourceAccessException.class     // I/O timeouts, connection issues
            },
            noRetryFor = {
                    UpstreamJsonParseException.class,
                    ResponseStatusException.class,
                    HttpClientErrorException.class
            },
            maxAttempts = 3,
            backoff = @Backoff(delay = 1000, multiplier = 2.0, maxDelay = 8000)
    )
    public JsonNode get(String resource, Map<String, ?> query) {
        try {
            if (log.isDebugEnabled()) {
                log.debug("Calling OpenF1 GET /{} {}", resource, query);
            }

            var resp = http.get()
                    .uri(u -> {
                        u.path("/{resource}");
                        query.forEach((name, value) -> u.queryParam(name, value));
                        return u.build(resource);
                    })
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .onStatus(s -> s.value() == 404, (req, res) -> { throw new NotFoundException(); })
                    .onStatus(s -> s.value() == 429, (req, res) -> {
                        throw new RateLimitedException(parseRetryAfter(res.getHeaders()));
                    })
                    .onStatus(HttpStatusCode::is5xxServerError, (req, res) -> {
                        throw new Upstream5xxException(res.getStatusCode().value());
                    })
                    .toEntity(JsonNode.class);

            var body = resp.getBody();
            if (body == null || !body.isArray()) {
                return JsonNodeFactory.instance.arrayNode();
            }
            return body;

        } catch (NotFoundException nf) {
            if (log.isDebugEnabled()) {
                log.debug("No OpenF1 {} data for {}", resource, query);
            }
            return JsonNodeFactory.instance.arrayNode();
        } catch (HttpClientErrorException ex) {
            var status = ex.getStatusCode();
            var bodyBytes = ex.getResponseBodyAsByteArray();
            var preview = new String(bodyBytes, 0, Math.min(bodyBytes.length, 500), StandardCharsets.UTF_8);
            log.warn("OpenF1 client error {} for {} {}. Body: {}", status.value(), resource, query, preview);
            throw new ResponseStatusException(status, problemMsg("Upstream 4xx from OpenF1", preview));
        } catch (org.springframework.http.converter.HttpMessageConversionException conv) {
            var msg = conv.getCause() instanceof com.fasterxml.jackson.core.JsonProcessingException jp
                    ? jp.getOriginalMessage()
                    : conv.getMessage();
            log.error("Failed to parse OpenF1 JSON for {} {}: {}", resource, query, msg);
            throw new UpstreamJsonParseException(String.valueOf(msg));
        }
    }

    // ---------- Retry helpers / exception types ----------
    public static final class NotFoundException extends RuntimeException {}

    public static final class RateLimitedException extends RuntimeException {
        public final Duration retryAfter;
        public RateLimitedException(Duration ra) { this.retryAfter = ra; }
    }

    public static final class Upstream5xxException extends RuntimeException {
        public final int status;
        public Upstream5xxException(int status) { this.status = status; }
    }

    public static final class UpstreamJsonParseException extends RuntimeException {
        public UpstreamJsonParseException(String msg) { super(msg); }
    }

    private static Duration parseRetryAfter(HttpHeaders headers) {
        var ra = headers.getFirst(HttpHeaders.RETRY_AFTER);
        if (ra == null || ra.isBlank()) return Duration.ofSeconds(2);
        try { return Duration.ofSeconds(Math.max(1, Long.parseLong(ra.trim()))); }
        catch (NumberFormatException ignore) { return Duration.ofSeconds(2); }
    }

    private static String problemMsg(String leading, String preview) {
        if (preview.isBlank()) return leading;
        return leading + ": " + preview;
    }

    // ---------- @Recover handlers (run after final retry attempt fails) ----------
    @Recover
    public JsonNode recoverRateLimit(RateLimitedException ex, String resource, Map<String, ?> query) {
        log.warn("Recover after rate limit for {} {}. Retry-After ~{}s", resource, query, ex.retryAfter.toSeconds());
        throw new ResponseStatusException(TOO_MANY_REQUESTS,
                "Rate limit reached at OpenF1; retry after ~" + ex.retryAfter.toSeconds() + "s");
    }

    @Recover
    public JsonNode recoverUpstream(Upstream5xxException ex, String resource, Map<String, ?> query) {
        log.error("Recover after upstream 5xx {} for {} {}", ex.status, resource, query);
        throw new ResponseStatusException(BAD_GATEWAY, "Upstream error from OpenF1: HTTP " + ex.status);
    }

    @Recover
    public JsonNode recoverIo(ResourceAccessException ex, String resource, Map<String, ?> query) {
        log.error("Recover after IO error while calling OpenF1 for {} {}", resource, query, ex);
        throw new ResponseStatusException(GATEWAY_TIMEOUT, "Upstream timeout while calling OpenF1");
    }

    // non-retryable failures (4xx, bad JSON) surface unchanged
    @Recover
    public JsonNode recoverNonRetryable(RuntimeException ex, String resource, Map<String, ?> query) {
        throw ex;
    }
}
