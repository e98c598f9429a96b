package com.recnos.ratetelemetry.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.recnos.ratetelemetry.service.PrometheusMetrics;
import com.recnos.ratetelemetry.telemetry.EventCounter;
import com.recnos.ratetelemetry.telemetry.TelemetryAggregator;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.util.CharsetUtil;
import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;
import static org.assertj.core.api.Assertions.assertThat;

class HttpRequestHandlerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private final ObjectMapper objectMapper = HttpRequestHandler.newObjectMapper();

    private CollectorRegistry registry;
    private PrometheusMetrics metrics;
    private TelemetryAggregator aggregator;

    @BeforeEach
    void setUp() {
        registry = new CollectorRegistry();
        metrics = new PrometheusMetrics(registry);
        aggregator = new TelemetryAggregator(new EventCounter(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private Response send(HttpMethod method, String uri, String body) {
        EmbeddedChannel channel = new EmbeddedChannel(new HttpRequestHandler(aggregator, metrics, objectMapper));
        channel.writeInbound(new DefaultFullHttpRequest(HTTP_1_1, method, uri,
                Unpooled.copiedBuffer(body, CharsetUtil.UTF_8)));
        FullHttpResponse response = channel.readOutbound();
        try {
            return new Response(response.status(), response.content().toString(CharsetUtil.UTF_8));
        } finally {
            response.release();
            channel.finishAndReleaseAll();
        }
    }

    private record Response(HttpResponseStatus status, String body) {
    }

    @Test
    void acceptedEventIsCountedAndEchoed() throws Exception {
        Response response = send(HttpMethod.POST, "/data", "{\"username\":\"alice\",\"age\":31}");

        assertThat(response.status()).isEqualTo(HttpResponseStatus.OK);
        JsonNode json = objectMapper.readTree(response.body());
        assertThat(json.get("message").asText()).isEqualTo("Data received");
        assertThat(json.get("user").asText()).isEqualTo("alice");
        assertThat(json.get("age").asInt()).isEqualTo(31);
        assertThat(aggregator.total()).isEqualTo(1);
    }

    @Test
    void unknownFieldsAreIgnored() {
        Response response = send(HttpMethod.POST, "/data", "{\"username\":\"bob\",\"age\":2,\"extra\":true}");

        assertThat(response.status()).isEqualTo(HttpResponseStatus.OK);
        assertThat(aggregator.total()).isEqualTo(1);
    }

    @Test
    void invalidJsonIsRejectedAndNotCounted() {
        Response response = send(HttpMethod.POST, "/data", "{not json");

        assertThat(response.status()).isEqualTo(HttpResponseStatus.BAD_REQUEST);
        assertThat(response.body()).isEqualTo("{\"error\":\"Invalid JSON\"}");
        assertThat(aggregator.total()).isZero();
        assertThat(registry.getSampleValue("events_failed_total",
                new String[]{"reason"}, new String[]{"invalid_json"})).isEqualTo(1.0);
    }

    @Test
    void wrongFieldTypeIsRejected() {
        Response response = send(HttpMethod.POST, "/data", "{\"username\":\"carol\",\"age\":\"old\"}");

        assertThat(response.status()).isEqualTo(HttpResponseStatus.BAD_REQUEST);
        assertThat(aggregator.total()).isZero();
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "{\"username\":\"a\",\"age\":1} garbage",
            "{\"username\":\"a\",\"age\":1}{\"username\":\"b\",\"age\":2}",
            "{\"username\":\"a\",\"age\":1.5}",
            "{\"username\":\"a\",\"age\":\"1\"}",
            "{\"username\":5,\"age\":1}",
            "{\"username\":true,\"age\":1}",
            "{\"username\":\"a\",\"age\":true}"
    })
    void bodiesATypedDecoderRefusesAreNotCounted(String body) {
        Response response = send(HttpMethod.POST, "/data", body);

        assertThat(response.status()).isEqualTo(HttpResponseStatus.BAD_REQUEST);
        assertThat(response.body()).isEqualTo("{\"error\":\"Invalid JSON\"}");
        assertThat(aggregator.total()).isZero();
    }

    @Test
    void trailingWhitespaceAndCaseInsensitiveNamesAreAccepted() throws Exception {
        Response response = send(HttpMethod.POST, "/data", "{\"Username\":\"dave\",\"AGE\":40}\n  ");

        assertThat(response.status()).isEqualTo(HttpResponseStatus.OK);
        JsonNode json = objectMapper.readTree(response.body());
        assertThat(json.get("user").asText()).isEqualTo("dave");
        assertThat(json.get("age").asInt()).isEqualTo(40);
        assertThat(aggregator.total()).isEqualTo(1);
    }

    @ParameterizedTest
    @ValueSource(strings = {"{\"age\":1}", "{\"username\":null,\"age\":1}", "null"})
    void missingUsernameIsEchoedAsEmptyString(String body) throws Exception {
        Response response = send(HttpMethod.POST, "/data", body);

        assertThat(response.status()).isEqualTo(HttpResponseStatus.OK);
        JsonNode json = objectMapper.readTree(response.body());
        assertThat(json.get("user").isTextual()).isTrue();
        assertThat(json.get("user").asText()).isEmpty();
        assertThat(aggregator.total()).isEqualTo(1);
    }

    @Test
    void emptyBodyIsRejected() {
        Response response = send(HttpMethod.POST, "/data", "");

        assertThat(response.status()).isEqualTo(HttpResponseStatus.BAD_REQUEST);
        assertThat(aggregator.total()).isZero();
    }

    @Test
    void statsReportTheLatestSnapshot() throws Exception {
        send(HttpMethod.POST, "/data", "{\"username\":\"a\",\"age\":1}");
        send(HttpMethod.POST, "/data", "{\"username\":\"b\",\"age\":2}");
        aggregator.sampler().secondTick();

        Response response = send(HttpMethod.GET, "/stats", "");

        assertThat(response.status()).isEqualTo(HttpResponseStatus.OK);
        JsonNode json = objectMapper.readTree(response.body());
        assertThat(json.get("totalRequests").asLong()).isEqualTo(2);
        assertThat(json.get("requestsPerSecond").asLong()).isEqualTo(2);
        assertThat(json.get("requestsPerMinute").asLong()).isZero();
        assertThat(json.get("timestamp").asText()).isEqualTo(NOW.toString());
    }

    @Test
    void healthCheck() {
        Response response = send(HttpMethod.GET, "/health?verbose=1", "");

        assertThat(response.status()).isEqualTo(HttpResponseStatus.OK);
        assertThat(response.body()).isEqualTo("{\"status\":\"healthy\"}");
    }

    @Test
    void unknownRouteAndWrongMethod() {
        assertThat(send(HttpMethod.GET, "/nope", "").status()).isEqualTo(HttpResponseStatus.NOT_FOUND);
        assertThat(send(HttpMethod.GET, "/data", "").status()).isEqualTo(HttpResponseStatus.METHOD_NOT_ALLOWED);
        assertThat(aggregator.total()).isZero();
    }

    @Test
    void requestsAreInstrumented() {
        send(HttpMethod.POST, "/data", "{\"username\":\"a\",\"age\":1}");
        send(HttpMethod.POST, "/data", "oops");

        assertThat(registry.getSampleValue("http_requests_total",
                new String[]{"method", "endpoint", "status"},
                new String[]{"POST", "/data", "200"})).isEqualTo(1.0);
        assertThat(registry.getSampleValue("http_requests_total",
                new String[]{"method", "endpoint", "status"},
                new String[]{"POST", "/data", "400"})).isEqualTo(1.0);
        assertThat(registry.getSampleValue("http_requests_in_flight",
                new String[]{"method", "endpoint"},
                new String[]{"POST", "/data"})).isEqualTo(0.0);
    }

    @Test
    void nonStandardMethodsShareOneLabel() {
        send(HttpMethod.valueOf("BREW"), "/data", "");
        send(HttpMethod.valueOf("WHEN"), "/teapot", "");

        assertThat(registry.getSampleValue("http_requests_total",
                new String[]{"method", "endpoint", "status"},
                new String[]{"OTHER", "/data", "405"})).isEqualTo(1.0);
        assertThat(registry.getSampleValue("http_requests_total",
                new String[]{"method", "endpoint", "status"},
                new String[]{"OTHER", "other", "404"})).isEqualTo(1.0);
        assertThat(registry.getSampleValue("http_requests_total",
                new String[]{"method", "endpoint", "status"},
                new String[]{"BREW", "/data", "405"})).isNull();
        assertThat(aggregator.total()).isZero();
    }
}
