package com.example.schemacache.loadgen;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Random;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.apache.commons.math3.distribution.ZipfDistribution;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Drives a running schema cache over HTTP.
 * Usage: java LoadGenerator <herd|zipf> [durationSeconds] [threads] [connections] [alpha] [invalidateRatio]
 */
public class LoadGenerator {

    private static final Logger log = LoggerFactory.getLogger(LoadGenerator.class);

    private static final HttpClient client = HttpClient.newHttpClient();
    private static final String BASE_URL = System.getProperty("schemacache.url", "http://localhost:8080");

    public static void main(String[] args) throws Exception {
        if (args.length < 1) {
            System.out.println("Usage: java LoadGenerator <herd|zipf> [durationSeconds] [threads] [connections] [alpha] [invalidateRatio]");
            return;
        }

        String scenario = args[0];
        int duration = args.length > 1 ? Integer.parseInt(args[1]) : 60;
        int threads = args.length > 2 ? Integer.parseInt(args[2]) : 100;

        System.out.println("Starting Scenario: " + scenario + " Duration: " + duration + "s");

        switch (scenario) {
            case "herd":
                runHerd(duration, threads);
                break;
            case "zipf":
                int connections = args.length > 3 ? Integer.parseInt(args[3]) : 50;
                double alpha = args.length > 4 ? Double.parseDouble(args[4]) : 0.9;
                double invalidateRatio = args.length > 5 ? Double.parseDouble(args[5]) : 0.01;
                runZipf(duration, threads, connections, alpha, invalidateRatio);
                break;
            default:
                System.out.println("Unknown scenario: " + scenario);
        }
    }

    // Many threads on one metadata key: with single-flight the backend sees one query per TTL window
    private static void runHerd(int durationSeconds, int threads) throws Exception {
        URI hot = metadataUri(BASE_URL, "hot-conn", "main", "public", "tables");

        ExecutorService executor = Executors.newFixedThreadPool(threads);
        AtomicLong requestCount = new AtomicLong();
        ConcurrentLinkedQueue<Double> latencies = new ConcurrentLinkedQueue<>();
        long endTime = System.currentTimeMillis() + durationSeconds * 1000L;

        System.out.println(String.format("Initializing herd scenario (Threads=%d, Duration=%ds)...", threads, durationSeconds));

        for (int i = 0; i < threads; i++) {
            executor.submit(() -> {
                while (System.currentTimeMillis() < endTime) {
                    try {
                        long start = System.currentTimeMillis();
                        send(HttpRequest.newBuilder(hot).GET().build());
                        latencies.add((double) (System.currentTimeMillis() - start));
                        requestCount.incrementAndGet();
                        Thread.sleep(1);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return;
                    } catch (Exception e) {
                        log.warn("Request to {} failed: {}", hot, e.toString());
                    }
                }
            });
        }

        executor.shutdown();
        executor.awaitTermination(durationSeconds + 10, TimeUnit.SECONDS);

        DescriptiveStatistics stats = new DescriptiveStatistics();
        latencies.forEach(stats::addValue);

        System.out.println("Herd scenario finished. Requests: " + requestCount.get());
        System.out.println(String.format("Stats: P99=%.2fms, Max=%.2fms", stats.getPercentile(99), stats.getMax()));
    }

    // Zipf-skewed connections, with the occasional reconnect invalidating a whole connection
    private static void runZipf(int durationSeconds, int threads, int connections, double alpha, double invalidateRatio)
            throws Exception {
        ZipfDistribution zipf = new ZipfDistribution(connections, alpha);

        ExecutorService executor = Executors.newFixedThreadPool(threads);
        AtomicLong requestCount = new AtomicLong();
        AtomicLong invalidations = new AtomicLong();
        long endTime = System.currentTimeMillis() + durationSeconds * 1000L;

        System.out.println(String.format("Initializing zipf scenario (Connections=%d, Threads=%d, Alpha=%.2f, InvalidateRatio=%.3f)...",
            connections, threads, alpha, invalidateRatio));

        for (int i = 0; i < threads; i++) {
            executor.submit(() -> {
                Random rand = new Random();
                while (System.currentTimeMillis() < endTime) {
                    String connection = "conn-" + sampleRank(zipf);
                    try {
                        if (rand.nextDouble() < invalidateRatio) {
                            send(HttpRequest.newBuilder(invalidateConnectionUri(BASE_URL, connection)).DELETE().build());
                            invalidations.incrementAndGet();
                        } else {
                            String database = "db-" + rand.nextInt(4);
                            String schema = "schema-" + rand.nextInt(8);
                            send(HttpRequest.newBuilder(metadataUri(BASE_URL, connection, database, schema, "tables")).GET().build());
                            requestCount.incrementAndGet();
                        }
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return;
                    } catch (Exception e) {
                        log.warn("Request for {} failed: {}", connection, e.toString());
                    }
                }
            });
        }

        executor.shutdown();
        executor.awaitTermination(durationSeconds + 10, TimeUnit.SECONDS);
        System.out.println("Zipf scenario finished. Lookups: " + requestCount.get() + ", Invalidations: " + invalidations.get());
    }

    private static synchronized int sampleRank(ZipfDistribution zipf) {
        // ZipfDistribution shares one RandomGenerator and is not thread safe
        return zipf.sample();
    }

    private static void send(HttpRequest request) throws Exception {
        client.send(request, HttpResponse.BodyHandlers.discarding());
    }

    static URI metadataUri(String baseUrl, String connection, String database, String schema, String category) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(baseUrl)
            .path("/metadata")
            .queryParam("connection", connection);
        if (database != null) {
            builder.queryParam("database", database);
        }
        if (schema != null) {
            builder.queryParam("schema", schema);
        }
        if (category != null) {
            builder.queryParam("category", category);
        }
        return builder.build().encode().toUri();
    }

    // Path segments need percent-encoding; form encoding would turn a space into a literal '+'
    static URI invalidateConnectionUri(String baseUrl, String connection) {
        return UriComponentsBuilder.fromUriString(baseUrl)
            .path("/cache/connections/{connection}")
            .buildAndExpand(connection)
            .encode()
            .toUri();
    }
}
