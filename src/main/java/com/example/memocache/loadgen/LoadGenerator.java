package com.example.memocache.loadgen;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives {@code GET /instances} on a running instance, then reports latency and how many calls
 * reached the backend.
 *
 * <p>Usage: {@code LoadGenerator <zipf|herd> [durationSeconds] [threads] [regions] [alpha]}
 * <ul>
 *   <li>zipf: regions drawn from a Zipf distribution, hot regions stay cached.
 *   <li>herd: every thread asks for the same region, which shows concurrent misses after expiry.
 * </ul>
 */
public class LoadGenerator {

    private static final Logger log = LoggerFactory.getLogger(LoadGenerator.class);

    private static final HttpClient client = HttpClient.newHttpClient();
    private static final ObjectMapper mapper = new ObjectMapper();
    private static final String BASE_URL = System.getProperty("memocache.url", "http://localhost:8080");

    public static void main(String[] args) throws Exception {
        if (args.length < 1) {
            System.out.println("Usage: java LoadGenerator <zipf|herd> [durationSeconds] [threads] [regions] [alpha]");
            return;
        }

        String scenario = args[0];
        int duration = args.length > 1 ? Integer.parseInt(args[1]) : 60;
        int threads = args.length > 2 ? Integer.parseInt(args[2]) : 50;

        LatencyReport report;
        switch (scenario) {
            case "zipf":
                int regions = args.length > 3 ? Integer.parseInt(args[3]) : 1_000;
                double alpha = args.length > 4 ? Double.parseDouble(args[4]) : 0.9;
                System.out.println(String.format("Zipf scenario (Regions=%d, Threads=%d, Alpha=%.2f)", regions, threads, alpha));
                ThreadLocal<RegionSampler> samplers = ThreadLocal.withInitial(() -> new RegionSampler(regions, alpha));
                report = run(duration, threads, () -> samplers.get().next());
                break;
            case "herd":
                System.out.println(String.format("Herd scenario (Threads=%d)", threads));
                report = run(duration, threads, () -> "us-east-1");
                break;
            default:
                System.out.println("Unknown scenario: " + scenario);
                return;
        }
        System.out.println("Finished. " + report);
        System.out.println("Backend calls: " + fetchBackendRequests());
    }

    static LatencyReport run(int durationSeconds, int threads, Supplier<String> regions) throws InterruptedException {
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        ConcurrentLinkedQueue<Double> latencies = new ConcurrentLinkedQueue<>();
        AtomicLong failures = new AtomicLong();
        long endTime = System.currentTimeMillis() + durationSeconds * 1000L;

        for (int i = 0; i < threads; i++) {
            executor.submit(() -> {
                while (System.currentTimeMillis() < endTime) {
                    try {
                        long start = System.nanoTime();
                        sendGet(regions.get());
                        latencies.add((System.nanoTime() - start) / 1_000_000.0);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return;
                    } catch (Exception e) {
                        failures.incrementAndGet();
                        log.debug("Request failed: {}", e.getMessage());
                    }
                }
            });
        }

        executor.shutdown();
        executor.awaitTermination(durationSeconds + 10, TimeUnit.SECONDS);
        return new LatencyReport(latencies, failures.get(), durationSeconds);
    }

    private static long fetchBackendRequests() throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(BASE_URL + "/stats"))
            .GET()
            .build();
        return backendRequests(client.send(request, HttpResponse.BodyHandlers.ofString()).body());
    }

    static long backendRequests(String statsJson) throws JsonProcessingException {
        JsonNode count = mapper.readTree(statsJson).path("backendRequests");
        if (!count.canConvertToLong()) {
            throw new IllegalStateException("No backendRequests in /stats response: " + statsJson);
        }
        return count.asLong();
    }

    private static void sendGet(String region) throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(BASE_URL + "/instances?region=" + region))
            .GET()
            .build();
        client.send(request, HttpResponse.BodyHandlers.discarding());
    }
}
