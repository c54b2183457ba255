package com.recnos.sensors.simulator;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;
import com.recnos.sensors.dto.SensorDataDto;
import com.recnos.sensors.model.VehicleType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Simulated roadside sensor. Every period it draws a batch of vehicle labels
 * from a weighted distribution and posts it to the sensor API.
 *
 * <pre>
 * SensorSimulator location carWeight motorcycleWeight busWeight vehiclesPerPeriod periodSeconds [baseUrl]
 * SensorSimulator west-seattle-bridge 3 1 2 10 5
 * </pre>
 */
public class SensorSimulator {

    private static final Logger logger = LoggerFactory.getLogger(SensorSimulator.class);
    private static final String DEFAULT_BASE_URL = "http://localhost:8080";
    private static final String USAGE = "Usage: SensorSimulator <location> <carWeight> <motorcycleWeight> "
            + "<busWeight> <vehiclesPerPeriod> <periodSeconds> [baseUrl]";

    private final Settings settings;
    private final List<String> distribution;
    private final Random random;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public SensorSimulator(Settings settings, Random random) {
        this.settings = settings;
        this.distribution = buildDistribution(settings);
        this.random = random;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .version(HttpClient.Version.HTTP_1_1)
                .build();
        this.objectMapper = new ObjectMapper().registerModule(new ParameterNamesModule());
    }

    /**
     * Simulator arguments, validated on construction.
     */
    public record Settings(
            String location,
            int carWeight,
            int motorcycleWeight,
            int busWeight,
            int vehiclesPerPeriod,
            Duration period,
            URI baseUri
    ) {
        public Settings {
            if (location == null || location.isBlank()) throw new IllegalArgumentException("location is required");
            if (carWeight < 0 || motorcycleWeight < 0 || busWeight < 0) {
                throw new IllegalArgumentException("weights must be >= 0");
            }
            if (carWeight + motorcycleWeight + busWeight == 0) {
                throw new IllegalArgumentException("at least one weight must be > 0");
            }
            if (vehiclesPerPeriod < 0) throw new IllegalArgumentException("vehiclesPerPeriod must be >= 0");
            if (period.isZero() || period.isNegative()) throw new IllegalArgumentException("period must be > 0");
            if (baseUri == null || baseUri.getHost() == null
                    || !("http".equalsIgnoreCase(baseUri.getScheme()) || "https".equalsIgnoreCase(baseUri.getScheme()))) {
                throw new IllegalArgumentException("baseUrl must be an http or https URL, got " + baseUri);
            }
        }

        public static Settings parse(String[] args) {
            if (args.length < 6 || args.length > 7) {
                throw new IllegalArgumentException("expected 6 or 7 arguments, got " + args.length);
            }
            try {
                return new Settings(
                        args[0],
                        Integer.parseInt(args[1]),
                        Integer.parseInt(args[2]),
                        Integer.parseInt(args[3]),
                        Integer.parseInt(args[4]),
                        Duration.ofSeconds(Long.parseLong(args[5])),
                        URI.create(args.length == 7 ? args[6] : DEFAULT_BASE_URL));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("not a number: " + e.getMessage(), e);
            }
        }
    }

    static List<String> buildDistribution(Settings settings) {
        List<String> labels = new ArrayList<>();
        labels.addAll(Collections.nCopies(settings.carWeight(), VehicleType.CAR.label()));
        labels.addAll(Collections.nCopies(settings.motorcycleWeight(), VehicleType.MOTORCYCLE.label()));
        labels.addAll(Collections.nCopies(settings.busWeight(), VehicleType.BUS.label()));
        return Collections.unmodifiableList(labels);
    }

    public SensorDataDto nextBatch() {
        List<String> vehicles = new ArrayList<>(settings.vehiclesPerPeriod());
        for (int i = 0; i < settings.vehiclesPerPeriod(); i++) {
            vehicles.add(distribution.get(random.nextInt(distribution.size())));
        }
        return new SensorDataDto(settings.location(), vehicles);
    }

    /**
     * @return the HTTP status returned by the server
     */
    public int send(SensorDataDto batch) throws IOException, InterruptedException {
        String json = objectMapper.writeValueAsString(batch);

        HttpRequest request = HttpRequest.newBuilder()
                .uri(settings.baseUri().resolve("/sensorapi/data"))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json))
                .timeout(Duration.ofSeconds(10))
                .build();

        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() / 100 != 2) {
            logger.warn("Server rejected batch: HTTP {}: {}", response.statusCode(), response.body());
        }
        return response.statusCode();
    }

    void tick() {
        SensorDataDto batch = nextBatch();
        try {
            int status = send(batch);
            logger.debug("Sent {} vehicle(s) for '{}': HTTP {}", batch.data().size(), batch.location(), status);
        } catch (IOException e) {
            logger.warn("Failed to send batch: {}", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            // an exception escaping here would cancel the scheduled task
            logger.error("Unexpected error sending batch", e);
        }
    }

    public ScheduledExecutorService start() {
        logger.info("Sensor started at {} with weights {}:{}:{} (c:m:b). {} vehicles every {} seconds.",
                settings.location(), settings.carWeight(), settings.motorcycleWeight(), settings.busWeight(),
                settings.vehiclesPerPeriod(), settings.period().toSeconds());
        logger.info("Sending data to {}", settings.baseUri().resolve("/sensorapi/data"));

        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        scheduler.scheduleWithFixedDelay(this::tick, 0, settings.period().toMillis(), TimeUnit.MILLISECONDS);
        return scheduler;
    }

    public static void main(String[] args) {
        Settings settings;
        try {
            settings = Settings.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(USAGE);
            System.exit(1);
            return;
        }
        ScheduledExecutorService scheduler = new SensorSimulator(settings, new Random()).start();
        Runtime.getRuntime().addShutdownHook(new Thread(scheduler::shutdownNow, "simulator-shutdown"));
    }
}
