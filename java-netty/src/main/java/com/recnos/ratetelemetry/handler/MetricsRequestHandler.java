package com.recnos.ratetelemetry.handler;

import com.recnos.ratetelemetry.service.PrometheusMetrics;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.*;
import io.netty.util.CharsetUtil;
import io.prometheus.client.exporter.common.TextFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

import static io.netty.handler.codec.http.HttpResponseStatus.*;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Serves GET /metrics in the Prometheus text format on the metrics port.
 */
public class MetricsRequestHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger logger = LoggerFactory.getLogger(MetricsRequestHandler.class);

    static final String METRICS_PATH = "/metrics";

    private final PrometheusMetrics metrics;

    public MetricsRequestHandler(PrometheusMetrics metrics) {
        this.metrics = metrics;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request) {
        String path = new QueryStringDecoder(request.uri()).path();
        if (!METRICS_PATH.equals(path)) {
            sendResponse(ctx, NOT_FOUND, "text/plain; charset=UTF-8", "Not found\n", true);
            return;
        }
        if (request.method() != HttpMethod.GET) {
            sendResponse(ctx, METHOD_NOT_ALLOWED, "text/plain; charset=UTF-8", "Method not allowed\n", true);
            return;
        }
        try {
            sendResponse(ctx, OK, TextFormat.CONTENT_TYPE_004, metrics.scrape(), false);
        } catch (IOException e) {
            logger.error("Error exporting metrics", e);
            sendResponse(ctx, INTERNAL_SERVER_ERROR, "text/plain; charset=UTF-8", "Error exporting metrics\n", true);
        }
    }

    private void sendResponse(ChannelHandlerContext ctx, HttpResponseStatus status, String contentType,
                              String body, boolean close) {
        FullHttpResponse response = new DefaultFullHttpResponse(
                HTTP_1_1,
                status,
                Unpooled.copiedBuffer(body, CharsetUtil.UTF_8)
        );

        response.headers().set(HttpHeaderNames.CONTENT_TYPE, contentType);
        response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, response.content().readableBytes());

        if (close) {
            response.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE);
            ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
        } else {
            response.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.KEEP_ALIVE);
            ctx.writeAndFlush(response);
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        logger.error("Exception in metrics handler", cause);
        ctx.close();
    }
}
