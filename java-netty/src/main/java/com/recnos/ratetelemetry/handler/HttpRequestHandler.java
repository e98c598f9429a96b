package com.recnos.ratetelemetry.handler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.type.LogicalType;
import com.recnos.ratetelemetry.dto.EventAckDto;
import com.recnos.ratetelemetry.dto.EventDto;
import com.recnos.ratetelemetry.dto.StatsDto;
import com.recnos.ratetelemetry.service.PrometheusMetrics;
import com.recnos.ratetelemetry.telemetry.TelemetryAggregator;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.*;
import io.netty.util.CharsetUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Set;

import static io.netty.handler.codec.http.HttpResponseStatus.*;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Ingress HTTP handler. Every accepted {@code POST /data} is one telemetry event.
 *
 * Requests are small and the counter never blocks, so everything runs on the event loop.
 */
public class HttpRequestHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger logger = LoggerFactory.getLogger(HttpRequestHandler.class);

    static final String DATA_PATH = "/data";
    static final String STATS_PATH = "/stats";
    static final String HEALTH_PATH = "/health";

    private static final Set<String> KNOWN_METHODS = Set.of(
            "GET", "HEAD", "POST", "PUT", "DELETE", "PATCH", "OPTIONS", "TRACE", "CONNECT");

    private final TelemetryAggregator aggregator;
    private final PrometheusMetrics metrics;
    private final ObjectMapper objectMapper;

    public HttpRequestHandler(TelemetryAggregator aggregator, PrometheusMetrics metrics, ObjectMapper objectMapper) {
        this.aggregator = aggregator;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
    }

    /**
     * Mapper for request bodies. Strict like a typed decoder: no trailing content, no
     * fractional ages, no numbers or booleans where a string is expected. Unknown fields
     * are ignored and field names match case-insensitively.
     */
    public static ObjectMapper newObjectMapper() {
        JsonMapper mapper = JsonMapper.builder()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT)
                .disable(MapperFeature.ALLOW_COERCION_OF_SCALARS)
                .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_PROPERTIES)
                .build();
        mapper.coercionConfigFor(LogicalType.Textual)
                .setCoercion(CoercionInputShape.Integer, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Float, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Boolean, CoercionAction.Fail);
        return mapper;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request) {
        long startTime = System.nanoTime();
        String path = new QueryStringDecoder(request.uri()).path();
        HttpMethod method = request.method();
        String endpoint = endpointLabel(path);
        String methodLabel = methodLabel(method);

        metrics.httpRequestsInFlight.labels(methodLabel, endpoint).inc();
        HttpResponseStatus status;
        try {
            status = route(ctx, path, method, request.content().toString(CharsetUtil.UTF_8));
        } catch (Exception e) {
            logger.error("Error handling request", e);
            status = sendErrorResponse(ctx, INTERNAL_SERVER_ERROR, "Internal server error");
        } finally {
            metrics.httpRequestsInFlight.labels(methodLabel, endpoint).dec();
        }
        double durationSeconds = (System.nanoTime() - startTime) / 1_000_000_000.0;
        metrics.recordHttpRequest(methodLabel, endpoint, status.code(), durationSeconds);
    }

    // clients may send any method token
    private static String methodLabel(HttpMethod method) {
        return KNOWN_METHODS.contains(method.name()) ? method.name() : "OTHER";
    }

    // unknown paths share one label value to bound series cardinality
    private static String endpointLabel(String path) {
        switch (path) {
            case DATA_PATH:
            case STATS_PATH:
            case HEALTH_PATH:
                return path;
            default:
                return "other";
        }
    }

    private HttpResponseStatus route(ChannelHandlerContext ctx, String path, HttpMethod method, String content)
            throws JsonProcessingException {
        switch (path) {
            case DATA_PATH:
                return method == HttpMethod.POST
                        ? handlePostData(ctx, content)
                        : sendErrorResponse(ctx, METHOD_NOT_ALLOWED, "Method not allowed");
            case STATS_PATH:
                return method == HttpMethod.GET
                        ? handleGetStats(ctx)
                        : sendErrorResponse(ctx, METHOD_NOT_ALLOWED, "Method not allowed");
            case HEALTH_PATH:
                return method == HttpMethod.GET
                        ? sendJsonResponse(ctx, OK, "{\"status\":\"healthy\"}")
                        : sendErrorResponse(ctx, METHOD_NOT_ALLOWED, "Method not allowed");
            default:
                return sendErrorResponse(ctx, NOT_FOUND, "Endpoint not found");
        }
    }

    /**
     * Handles POST /data. Only a parsable body is counted.
     */
    private HttpResponseStatus handlePostData(ChannelHandlerContext ctx, String content) throws JsonProcessingException {
        EventDto event;
        try {
            event = objectMapper.readValue(content, EventDto.class);
        } catch (JsonProcessingException e) {
            logger.debug("Invalid JSON in request: {}", e.getOriginalMessage());
            metrics.recordEventFailed("invalid_json");
            return sendErrorResponse(ctx, BAD_REQUEST, "Invalid JSON");
        }
        if (event == null) {
            // a literal JSON null decodes to no fields at all
            event = new EventDto();
        }

        aggregator.recordEvent();

        // an explicit "username": null answers like a missing one
        String user = Objects.requireNonNullElse(event.getUsername(), "");
        EventAckDto ack = new EventAckDto("Data received", user, event.getAge());
        return sendJsonResponse(ctx, OK, objectMapper.writeValueAsString(ack));
    }

    /**
     * Handles GET /stats - the snapshot of the most recent second tick.
     */
    private HttpResponseStatus handleGetStats(ChannelHandlerContext ctx) throws JsonProcessingException {
        StatsDto stats = StatsDto.from(aggregator.latestSnapshot());
        return sendJsonResponse(ctx, OK, objectMapper.writeValueAsString(stats));
    }

    private HttpResponseStatus sendJsonResponse(ChannelHandlerContext ctx, HttpResponseStatus status, String json) {
        FullHttpResponse response = new DefaultFullHttpResponse(
                HTTP_1_1,
                status,
                Unpooled.copiedBuffer(json, CharsetUtil.UTF_8)
        );

        response.headers().set(HttpHeaderNames.CONTENT_TYPE, "application/json; charset=UTF-8");
        response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, response.content().readableBytes());
        response.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.KEEP_ALIVE);

        ctx.writeAndFlush(response);
        return status;
    }

    private HttpResponseStatus sendErrorResponse(ChannelHandlerContext ctx, HttpResponseStatus status, String message) {
        String json = String.format("{\"error\":\"%s\"}", message);
        FullHttpResponse response = new DefaultFullHttpResponse(
                HTTP_1_1,
                status,
                Unpooled.copiedBuffer(json, CharsetUtil.UTF_8)
        );

        response.headers().set(HttpHeaderNames.CONTENT_TYPE, "application/json; charset=UTF-8");
        response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, response.content().readableBytes());
        response.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE);

        ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
        return status;
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        logger.error("Exception in channel handler", cause);
        ctx.close();
    }
}
