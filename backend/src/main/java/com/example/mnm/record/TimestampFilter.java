package com.example.mnm.record;

import com.example.mnm.exceptions.ErrorResponse;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Stamps JSON write payloads before authentication runs: {@code POST} bodies get fresh
 * {@code createdAt} and {@code updatedAt}, {@code PUT}/{@code PATCH} bodies get a fresh
 * {@code updatedAt} and lose any {@code createdAt}. Client-supplied values are overwritten.
 * Other requests, and bodies that are not JSON objects, pass through unchanged.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class TimestampFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(TimestampFilter.class);
    private static final int MAX_BODY_SIZE = 1024 * 1024;
    private static final Set<String> WRITE_METHODS = Set.of("POST", "PUT", "PATCH");
    private static final TypeReference<LinkedHashMap<String, Object>> PAYLOAD_TYPE = new TypeReference<>() { };

    private final ObjectMapper objectMapper;
    // decimals stay BigDecimal so the re-written body carries every digit the client sent
    private final ObjectReader payloadReader;
    private final RecordTimestamps timestamps;

    public TimestampFilter(ObjectMapper objectMapper, RecordTimestamps timestamps) {
        this.objectMapper = objectMapper;
        this.payloadReader = objectMapper.reader().with(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
        this.timestamps = timestamps;
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        String method = request.getMethod() != null ? request.getMethod().toUpperCase(Locale.ROOT) : "";
        if (!WRITE_METHODS.contains(method)) {
            return true;
        }
        String contentType = request.getContentType();
        return contentType == null || !contentType.toLowerCase(Locale.ROOT).contains("json");
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        byte[] body;
        try (InputStream inputStream = request.getInputStream()) {
            body = readWithLimit(inputStream);
        }
        if (body == null) {
            writePayloadTooLarge(response);
            return;
        }

        filterChain.doFilter(new RewrittenBodyRequest(request, stamp(request.getMethod(), body)), response);
    }

    private byte[] stamp(String method, byte[] body) {
        if (body.length == 0) {
            return body;
        }
        JsonNode tree;
        try {
            tree = payloadReader.readTree(body);
        } catch (IOException e) {
            log.debug("Leaving unparseable body untouched: {}", e.getMessage());
            return body;
        }
        if (!tree.isObject()) {
            return body;
        }

        Map<String, Object> payload;
        try {
            payload = payloadReader.forType(PAYLOAD_TYPE).readValue(tree);
        } catch (IOException e) {
            log.debug("Leaving body with unmappable fields untouched: {}", e.getMessage());
            return body;
        }
        if ("POST".equalsIgnoreCase(method)) {
            timestamps.stampCreated(payload);
        } else {
            timestamps.stampUpdated(payload);
        }

        try {
            return objectMapper.writeValueAsBytes(payload);
        } catch (IOException e) {
            log.warn("Could not re-serialize stamped body; forwarding original", e);
            return body;
        }
    }

    private byte[] readWithLimit(InputStream inputStream) throws IOException {
        byte[] content = inputStream.readNBytes(MAX_BODY_SIZE + 1);
        return content.length > MAX_BODY_SIZE ? null : content;
    }

    private void writePayloadTooLarge(HttpServletResponse response) throws IOException {
        response.setStatus(HttpStatus.PAYLOAD_TOO_LARGE.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getWriter(),
                new ErrorResponse(HttpStatus.PAYLOAD_TOO_LARGE.value(), "PAYLOAD_TOO_LARGE",
                        "Request body too large"));
    }
}
