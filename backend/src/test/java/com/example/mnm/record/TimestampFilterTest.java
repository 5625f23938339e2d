package com.example.mnm.record;

import com.example.mnm.MutableClock;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.ServletRequest;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TimestampFilterTest {

    private static final String NOW = "2024-05-01T10:15:30.123Z";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final TimestampFilter filter = new TimestampFilter(objectMapper,
            new RecordTimestamps(new MutableClock(Instant.parse(NOW))));

    @Test
    void postBodyGetsBothStampsOverwritingClientValues() throws Exception {
        Map<String, Object> forwarded = forwardedJson("POST",
                "{\"title\":\"Fix sink\",\"createdAt\":\"2000-01-01T00:00:00Z\",\"updatedAt\":\"bogus\"}");

        assertThat(forwarded)
                .containsEntry("title", "Fix sink")
                .containsEntry("createdAt", NOW)
                .containsEntry("updatedAt", NOW);
    }

    @Test
    void putAndPatchBodiesGetOnlyUpdatedAt() throws Exception {
        for (String method : new String[]{"PUT", "PATCH"}) {
            Map<String, Object> forwarded = forwardedJson(method,
                    "{\"title\":\"Fix sink\",\"createdAt\":\"2000-01-01T00:00:00Z\"}");

            assertThat(forwarded)
                    .doesNotContainKey("createdAt")
                    .containsEntry("updatedAt", NOW);
        }
    }

    @Test
    void forwardedRequestReportsTheRewrittenLength() throws Exception {
        MockHttpServletRequest request = jsonRequest("POST", "{}");
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, new MockHttpServletResponse(), chain);

        ServletRequest forwarded = chain.getRequest();
        byte[] body = forwarded.getInputStream().readAllBytes();
        assertThat(forwarded.getContentLength()).isEqualTo(body.length);
    }

    @Test
    void longDecimalsKeepEveryDigit() throws Exception {
        String forwarded = forwardedBody("PATCH", "{\"price\":12345678901234567890.123456789}");

        assertThat(forwarded).contains("\"price\":12345678901234567890.123456789");
    }

    @Test
    void nonObjectAndMalformedBodiesPassThroughUntouched() throws Exception {
        assertThat(forwardedBody("POST", "[1,2,3]")).isEqualTo("[1,2,3]");
        assertThat(forwardedBody("POST", "{not json")).isEqualTo("{not json");
    }

    @Test
    void readsAndNonJsonWritesAreNotFiltered() throws Exception {
        MockHttpServletRequest get = new MockHttpServletRequest("GET", "/services");
        MockFilterChain chain = new MockFilterChain();
        filter.doFilter(get, new MockHttpServletResponse(), chain);
        assertThat(chain.getRequest()).isSameAs(get);

        MockHttpServletRequest text = new MockHttpServletRequest("POST", "/services");
        text.setContentType("text/plain");
        text.setContent("hello".getBytes(StandardCharsets.UTF_8));
        MockFilterChain textChain = new MockFilterChain();
        filter.doFilter(text, new MockHttpServletResponse(), textChain);
        assertThat(textChain.getRequest()).isSameAs(text);
    }

    @Test
    void oversizedBodyIsRejected() throws Exception {
        MockHttpServletRequest request = jsonRequest("POST", "{\"blob\":\"" + "x".repeat(1024 * 1024) + "\"}");
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, response, chain);

        assertThat(response.getStatus()).isEqualTo(413);
        assertThat(response.getContentAsString()).contains("PAYLOAD_TOO_LARGE");
        assertThat(chain.getRequest()).isNull();
    }

    private Map<String, Object> forwardedJson(String method, String body) throws Exception {
        return objectMapper.readValue(forwardedBody(method, body), new TypeReference<>() { });
    }

    private String forwardedBody(String method, String body) throws Exception {
        MockFilterChain chain = new MockFilterChain();
        filter.doFilter(jsonRequest(method, body), new MockHttpServletResponse(), chain);
        return new String(chain.getRequest().getInputStream().readAllBytes(), StandardCharsets.UTF_8);
    }

    private MockHttpServletRequest jsonRequest(String method, String body) {
        MockHttpServletRequest request = new MockHttpServletRequest(method, "/services");
        request.setContentType("application/json");
        request.setContent(body.getBytes(StandardCharsets.UTF_8));
        return request;
    }
}
