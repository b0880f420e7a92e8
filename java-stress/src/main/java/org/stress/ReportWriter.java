package org.stress;
import org.HdrHistogram.Histogram;
import java.io.*;
import java.nio.file.*;
import java.util.*;

/**
 * Utility class for writing stress results to CSV files.
 * 
 * <p>This class handles:
 * <ul>
 *   <li>Individual workload summary CSV files ({@code <workload>-summary.csv})</li>
 *   <li>Combined summary CSV file ({@code summary.csv}, appended per run)</li>
 *   <li>Console output of results</li>
 * </ul>
 * 
 * <p><b>CSV Format:</b>
 * <pre>
 * workload,ops,misses,p50,p90,p99,max,mean,throughput
 * </pre>
 * 
 * <p>Latencies are in microseconds, throughput in operations per second of wall-clock
 * time between the first submission and the last worker exiting.
 * 
 * @author krishna.sundar
 * @version 1.0
 */
public class ReportWriter {
    static final String HEADER = "workload,ops,misses,p50,p90,p99,max,mean,throughput";
    private static final String SUMMARY_CSV = "summary.csv";
    private static final List<String> summaryRows = new ArrayList<>();

    /**
     * Formats one CSV row (without a line terminator).
     */
    public static String formatRow(WorkloadResult r) {
        Histogram h = r.getLatency();
        double p50 = 0.0, p90 = 0.0, p99 = 0.0, max = 0.0, mean = 0.0;
        if (h.getTotalCount() > 0) {
            p50 = h.getValueAtPercentile(50.0);
            p90 = h.getValueAtPercentile(90.0);
            p99 = h.getValueAtPercentile(99.0);
            max = h.getMaxValue();
            mean = h.getMean();
        }
        return String.format(Locale.ROOT, "%s,%d,%d,%.2f,%.2f,%.2f,%.2f,%.2f,%.2f",
                r.getWorkload(), r.getOps(), r.getMisses(), p50, p90, p99, max, mean, r.getThroughput());
    }

    public static void writeSummary(WorkloadResult r) throws IOException {
        writeSummary(Paths.get(Config.RESULTS_DIR), r);
    }

    /**
     * Writes the per-workload CSV, remembers the row for the combined summary, and
     * prints it to the console.
     * 
     * @param dir The results directory, created if missing
     * @param r The workload result
     */
    public static synchronized void writeSummary(Path dir, WorkloadResult r) throws IOException {
        Files.createDirectories(dir);
        String row = formatRow(r);
        Path csvFile = dir.resolve(r.getWorkload() + "-summary.csv");
        try (BufferedWriter w = Files.newBufferedWriter(csvFile)) {
            w.write(HEADER);
            w.newLine();
            w.write(row);
            w.newLine();
        }
        summaryRows.add(row);

        Histogram h = r.getLatency();
        System.out.println(String.format(Locale.ROOT, "[%s] ops=%d misses=%d p50=%dus p90=%dus p99=%dus throughput=%.2f ops/s elapsed=%.2fs",
                r.getWorkload(), r.getOps(), r.getMisses(),
                h.getValueAtPercentile(50.0), h.getValueAtPercentile(90.0), h.getValueAtPercentile(99.0),
                r.getThroughput(), r.getElapsedSeconds()));
    }

    public static void writeFinalSummary() throws IOException {
        writeFinalSummary(Paths.get(Config.RESULTS_DIR));
    }

    /**
     * Appends every row collected since the last {@link #resetSummary()} to
     * {@code summary.csv}, writing the header first if the file is new.
     * 
     * @param dir The results directory, created if missing
     */
    public static synchronized void writeFinalSummary(Path dir) throws IOException {
        Files.createDirectories(dir);
        Path summaryFile = dir.resolve(SUMMARY_CSV);
        boolean fileExists = Files.exists(summaryFile);
        try (BufferedWriter w = Files.newBufferedWriter(summaryFile,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
            if (!fileExists) {
                w.write(HEADER);
                w.newLine();
            }
            for (String row : summaryRows) {
                w.write(row);
                w.newLine();
            }
        }
    }
    
    /**
     * Clears the rows collected for the combined summary.
     */
    public static synchronized void resetSummary() {
        summaryRows.clear();
    }
}
