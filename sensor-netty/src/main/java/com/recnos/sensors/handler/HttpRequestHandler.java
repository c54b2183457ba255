package com.recnos.sensors.handler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;
import com.recnos.sensors.dto.LocationDataDto;
import com.recnos.sensors.dto.QueryTimeoutDto;
import com.recnos.sensors.dto.SensorDataDto;
import com.recnos.sensors.metrics.SensorMetrics;
import com.recnos.sensors.model.AggregatedReport;
import com.recnos.sensors.model.SensorBatch;
import com.recnos.sensors.service.AggregatorRegistry;
import com.recnos.sensors.service.QueryCoordinator;
import com.recnos.sensors.service.QueryResult;
import com.recnos.sensors.service.ReportFilters;
import com.recnos.sensors.service.SensorIngestService;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.*;
import io.netty.util.CharsetUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;

import static io.netty.handler.codec.http.HttpResponseStatus.*;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * HTTP gateway in front of the aggregation core.
 *
 * <ul>
 *   <li>{@code POST /sensorapi/data} ingests a sensor batch</li>
 *   <li>{@code GET /api/locations} lists known locations</li>
 *   <li>{@code GET /api/data[?location=L][&vehicle=V]} runs a cross-location query</li>
 *   <li>{@code GET /health} and {@code GET /metrics}</li>
 * </ul>
 *
 * Work is moved off the event loop onto the business executor, since a query
 * may wait up to the coordinator's timeout.
 */
public class HttpRequestHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger logger = LoggerFactory.getLogger(HttpRequestHandler.class);
    private static final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new ParameterNamesModule());

    static final String INGEST_PATH = "/sensorapi/data";
    static final String LOCATIONS_PATH = "/api/locations";
    static final String DATA_PATH = "/api/data";
    static final String HEALTH_PATH = "/health";
    static final String METRICS_PATH = "/metrics";

    private static final String ACCEPTED_BODY = "{\"status\":\"sensor data received\"}";
    private static final String HEALTH_BODY = "{\"status\":\"healthy\"}";
    private static final String PROMETHEUS_CONTENT_TYPE = "text/plain; version=0.0.4; charset=utf-8";

    private final SensorIngestService ingestService;
    private final AggregatorRegistry registry;
    private final QueryCoordinator queryCoordinator;
    private final SensorMetrics metrics;
    private final Executor businessExecutor;

    public HttpRequestHandler(SensorIngestService ingestService,
                              AggregatorRegistry registry,
                              QueryCoordinator queryCoordinator,
                              SensorMetrics metrics,
                              Executor businessExecutor) {
        this.ingestService = ingestService;
        this.registry = registry;
        this.queryCoordinator = queryCoordinator;
        this.metrics = metrics;
        this.businessExecutor = businessExecutor;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request) {
        // Copy everything out of the request before leaving the event loop,
        // Netty releases the ByteBuf once this method returns
        String uri = request.uri();
        HttpMethod method = request.method();
        String content = request.content().toString(CharsetUtil.UTF_8);

        try {
            businessExecutor.execute(() -> handleRequest(ctx, uri, method, content));
        } catch (RejectedExecutionException e) {
            logger.warn("Business executor rejected {} {}", method, uri);
            sendErrorResponse(ctx, method, "other", SERVICE_UNAVAILABLE, "Server is shutting down");
        }
    }

    private void handleRequest(ChannelHandlerContext ctx, String uri, HttpMethod method, String content) {
        QueryStringDecoder decoder = new QueryStringDecoder(uri);
        String path = decoder.path();
        try {
            switch (path) {
                case INGEST_PATH:
                    if (method == HttpMethod.POST) {
                        handlePostSensorData(ctx, content);
                    } else {
                        sendErrorResponse(ctx, method, path, METHOD_NOT_ALLOWED, "Method not allowed");
                    }
                    break;
                case LOCATIONS_PATH:
                    if (method == HttpMethod.GET) {
                        handleGetLocations(ctx);
                    } else {
                        sendErrorResponse(ctx, method, path, METHOD_NOT_ALLOWED, "Method not allowed");
                    }
                    break;
                case DATA_PATH:
                    if (method == HttpMethod.GET) {
                        handleGetData(ctx, decoder.parameters());
                    } else {
                        sendErrorResponse(ctx, method, path, METHOD_NOT_ALLOWED, "Method not allowed");
                    }
                    break;
                case HEALTH_PATH:
                    if (method == HttpMethod.GET) {
                        sendJsonResponse(ctx, method, path, OK, HEALTH_BODY);
                    } else {
                        sendErrorResponse(ctx, method, path, METHOD_NOT_ALLOWED, "Method not allowed");
                    }
                    break;
                case METRICS_PATH:
                    if (method == HttpMethod.GET) {
                        sendResponse(ctx, method, path, OK, metrics.scrape(), PROMETHEUS_CONTENT_TYPE);
                    } else {
                        sendErrorResponse(ctx, method, path, METHOD_NOT_ALLOWED, "Method not allowed");
                    }
                    break;
                default:
                    sendErrorResponse(ctx, method, "other", NOT_FOUND, "Endpoint not found");
            }
        } catch (Exception e) {
            logger.error("Error handling {} {}", method, uri, e);
            sendErrorResponse(ctx, method, path, INTERNAL_SERVER_ERROR, "Internal server error");
        }
    }

    /**
     * Handles POST /sensorapi/data. Malformed bodies are rejected before they
     * reach the core; unknown vehicle labels are not an error.
     */
    private void handlePostSensorData(ChannelHandlerContext ctx, String content) {
        SensorDataDto dto;
        try {
            dto = objectMapper.readValue(content, SensorDataDto.class);
        } catch (JsonProcessingException e) {
            logger.debug("Invalid JSON in sensor batch: {}", e.getOriginalMessage());
            sendErrorResponse(ctx, HttpMethod.POST, INGEST_PATH, BAD_REQUEST, "Invalid request body");
            return;
        }

        if (dto == null || dto.location() == null || dto.location().isBlank()) {
            sendErrorResponse(ctx, HttpMethod.POST, INGEST_PATH, BAD_REQUEST, "location is required");
            return;
        }
        if (dto.data() == null) {
            sendErrorResponse(ctx, HttpMethod.POST, INGEST_PATH, BAD_REQUEST, "data is required");
            return;
        }

        ingestService.ingest(new SensorBatch(dto.location(), dto.data()));
        sendJsonResponse(ctx, HttpMethod.POST, INGEST_PATH, ACCEPTED, ACCEPTED_BODY);
    }

    /**
     * Handles GET /api/locations.
     */
    private void handleGetLocations(ChannelHandlerContext ctx) throws JsonProcessingException {
        String json = objectMapper.writeValueAsString(registry.listLocations());
        sendJsonResponse(ctx, HttpMethod.GET, LOCATIONS_PATH, OK, json);
    }

    /**
     * Handles GET /api/data. A timed-out query is reported as 504 together with
     * the locations that did not answer, never as a shorter list.
     */
    private void handleGetData(ChannelHandlerContext ctx, Map<String, List<String>> parameters)
            throws JsonProcessingException {
        QueryResult result = queryCoordinator.collect();

        if (!result.isComplete()) {
            String json = objectMapper.writeValueAsString(new QueryTimeoutDto(
                    "Query timed out after " + queryCoordinator.timeout().toMillis() + " ms",
                    result.missingLocations()));
            sendErrorJson(ctx, HttpMethod.GET, DATA_PATH, GATEWAY_TIMEOUT, json);
            return;
        }

        AggregatedReport report = ReportFilters.apply(result.report(),
                firstParameter(parameters, "location"),
                firstParameter(parameters, "vehicle"));

        List<LocationDataDto> body = report.entries().stream()
                .map(LocationDataDto::from)
                .collect(Collectors.toList());
        sendJsonResponse(ctx, HttpMethod.GET, DATA_PATH, OK, objectMapper.writeValueAsString(body));
    }

    private static Optional<String> firstParameter(Map<String, List<String>> parameters, String name) {
        List<String> values = parameters.get(name);
        if (values == null || values.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(values.get(0));
    }

    private void sendJsonResponse(ChannelHandlerContext ctx, HttpMethod method, String endpoint,
                                  HttpResponseStatus status, String json) {
        sendResponse(ctx, method, endpoint, status, json, "application/json; charset=UTF-8");
    }

    /**
     * Sends a response and keeps the connection open.
     */
    private void sendResponse(ChannelHandlerContext ctx, HttpMethod method, String endpoint,
                              HttpResponseStatus status, String body, String contentType) {
        FullHttpResponse response = new DefaultFullHttpResponse(
                HTTP_1_1,
                status,
                Unpooled.copiedBuffer(body, CharsetUtil.UTF_8)
        );

        response.headers().set(HttpHeaderNames.CONTENT_TYPE, contentType);
        response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, response.content().readableBytes());
        response.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.KEEP_ALIVE);

        metrics.recordHttpRequest(method.name(), endpoint, status.code());
        ctx.writeAndFlush(response);
    }

    private void sendErrorResponse(ChannelHandlerContext ctx, HttpMethod method, String endpoint,
                                   HttpResponseStatus status, String message) {
        sendErrorJson(ctx, method, endpoint, status, String.format("{\"error\":\"%s\"}", message));
    }

    /**
     * Sends an error response and closes the connection.
     */
    private void sendErrorJson(ChannelHandlerContext ctx, HttpMethod method, String endpoint,
                               HttpResponseStatus status, String json) {
        FullHttpResponse response = new DefaultFullHttpResponse(
                HTTP_1_1,
                status,
                Unpooled.copiedBuffer(json, CharsetUtil.UTF_8)
        );

        response.headers().set(HttpHeaderNames.CONTENT_TYPE, "application/json; charset=UTF-8");
        response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, response.content().readableBytes());
        response.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE);

        metrics.recordHttpRequest(method.name(), endpoint, status.code());
        ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        logger.error("Exception in channel handler", cause);
        ctx.close();
    }
}
