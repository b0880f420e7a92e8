package org.stress;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import io.prometheus.client.exporter.HTTPServer;
import java.io.IOException;

/**
 * Prometheus metrics collection and HTTP server for metric exposition.
 * 
 * <p>Metrics:
 * <ul>
 *   <li>{@code stress_ops_total}: Completed operations counter, per {@code workload}</li>
 *   <li>{@code stress_op_latency_seconds}: Per-operation latency histogram, per {@code workload}</li>
 *   <li>{@code stress_sessions}: Worker sessions currently holding a connection</li>
 * </ul>
 * 
 * <p>The HTTP server starts on the requested port, or the next free one within
 * 100 ports above it.
 * 
 * @author krishna.sundar
 * @version 1.0
 */
public class StressMetrics {
    public static final Counter ops = Counter.build()
            .name("stress_ops_total").help("Total operations").labelNames("workload").register();
    public static final Histogram latency = Histogram.build()
            .name("stress_op_latency_seconds").help("Operation latency seconds").labelNames("workload")
            .buckets(0.0001, 0.00025, 0.0005, 0.001, 0.0025, 0.005, 0.01, 0.025, 0.05, 0.1, 0.25, 0.5, 1, 2.5)
            .register();
    public static final Gauge sessions = Gauge.build()
            .name("stress_sessions").help("Open worker sessions").register();
    private static HTTPServer server;

    /**
     * Records one completed operation.
     * 
     * @param workload The workload label
     * @param micros The operation latency in microseconds
     */
    public static void record(String workload, long micros) {
        ops.labels(workload).inc();
        latency.labels(workload).observe(micros / 1_000_000.0);
    }
    
    /**
     * Starts the Prometheus metrics HTTP server on the specified port.
     * 
     * @param port The preferred port number for the HTTP server
     * @return The port actually bound
     * @throws IOException If no available port is found within the range
     */
    public static synchronized int startHttpServer(int port) throws IOException {
        if (server != null) {
            System.out.println("Metrics server already running on port " + server.getPort());
            return server.getPort();
        }
        
        try {
            server = new HTTPServer(port);
            System.out.println("Started Prometheus metrics server on port " + port);
            return port;
        } catch (IOException e) {
            if (e.getMessage() != null && e.getMessage().contains("Address already in use")) {
                System.out.println("Port " + port + " is already in use, trying to find an available port...");
            } else {
                throw e;
            }
        }
        
        IOException last = null;
        for (int tryPort = port + 1; tryPort < port + 100; tryPort++) {
            try {
                server = new HTTPServer(tryPort);
                System.out.println("Started Prometheus metrics server on port " + tryPort + " (original port " + port + " was in use)");
                return tryPort;
            } catch (IOException e) {
                last = e;
            }
        }
        
        throw new IOException("Could not find an available port starting from " + port, last);
    }

    public static synchronized void stopHttpServer() {
        if (server != null) {
            server.close();
            server = null;
        }
    }
}
