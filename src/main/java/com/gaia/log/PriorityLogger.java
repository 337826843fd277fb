package com.gaia.log;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.gaia.core.ExecutionStatus;
import com.gaia.core.Priority;
import com.gaia.core.TestItem;
import com.gaia.priority.ScoreBreakdown;
import com.gaia.priority.ScoreCalculator;
import com.gaia.state.GaiaState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only record of scoring and scheduling decisions.
 * <p>
 * Score breakdowns are recomputed when an entry is logged, so they reflect the
 * state at logging time rather than the score an item was queued with.
 */
public class PriorityLogger {

    private static final Logger log = LoggerFactory.getLogger(PriorityLogger.class);

    public static final String DEFAULT_LOG_FILE = "priority_log.json";

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final Path logFile;
    private final Clock clock;
    private final List<LogEntry> entries = new ArrayList<>();

    public PriorityLogger() {
        this(Path.of(DEFAULT_LOG_FILE));
    }

    public PriorityLogger(Path logFile) {
        this(logFile, Clock.systemUTC());
    }

    public PriorityLogger(Path logFile, Clock clock) {
        this.logFile = logFile;
        this.clock = clock;
    }

    /**
     * Log a score calculation with action {@code scored}.
     */
    public void logScore(TestItem item, GaiaState state) {
        logScore(item, state, LogAction.SCORED);
    }

    /**
     * Log a score calculation.
     *
     * @param item   Item that was scored
     * @param state  Current state
     * @param action Action recorded on the entry (ingested, scored)
     */
    public void logScore(TestItem item, GaiaState state, LogAction action) {
        ScoreBreakdown breakdown = ScoreCalculator.computeScoreBreakdown(item, state);
        entries.add(new LogEntry(
                action,
                item.getId(),
                priorityTag(item),
                breakdown.totalScore(),
                breakdown,
                null,
                null,
                null,
                null,
                now(),
                state.getExecutionRound()
        ));
    }

    /**
     * Log an execution outcome.
     *
     * @param item    Executed item
     * @param state   State after the outcome was applied
     * @param result  Outcome status
     * @param details Executor payload, may be null or empty
     */
    public void logExecution(TestItem item, GaiaState state, ExecutionStatus result, Map<String, Object> details) {
        ScoreBreakdown breakdown = ScoreCalculator.computeScoreBreakdown(item, state);
        entries.add(new LogEntry(
                LogAction.EXECUTED,
                item.getId(),
                priorityTag(item),
                breakdown.totalScore(),
                breakdown,
                result.value(),
                details == null || details.isEmpty() ? null : details,
                null,
                null,
                now(),
                state.getExecutionRound()
        ));
    }

    /**
     * Log a queue re-scoring event.
     *
     * @param state  State the queue was rescored against
     * @param reason Trigger, e.g. {@code dom_change}
     */
    public void logRescore(GaiaState state, String reason) {
        entries.add(new LogEntry(
                LogAction.RESCORE,
                null,
                null,
                null,
                null,
                null,
                null,
                reason,
                state.snapshot(),
                now(),
                state.getExecutionRound()
        ));
    }

    /**
     * Write all entries to the log file as a JSON array.
     *
     * @throws UncheckedIOException if the file cannot be written
     */
    public void save() {
        try {
            Path parent = logFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(logFile.toFile(), entries);
            log.info("Saved {} priority log entries to {}", entries.size(), logFile);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write priority log to " + logFile, e);
        }
    }

    public List<LogEntry> getEntries() {
        return List.copyOf(entries);
    }

    /**
     * Derive aggregate statistics from the current entries.
     */
    public LogSummary getSummary() {
        if (entries.isEmpty()) {
            return LogSummary.empty();
        }

        int executed = 0;
        int success = 0;
        int failed = 0;
        int rescores = 0;
        Map<String, long[]> totals = new LinkedHashMap<>();

        for (LogEntry entry : entries) {
            if (entry.action() == LogAction.EXECUTED) {
                executed++;
                if (ExecutionStatus.SUCCESS.value().equals(entry.result())) {
                    success++;
                } else if (ExecutionStatus.FAILED.value().equals(entry.result())) {
                    failed++;
                }
            } else if (entry.action() == LogAction.RESCORE) {
                rescores++;
            }

            if (entry.priority() != null && entry.score() != null) {
                long[] acc = totals.computeIfAbsent(entry.priority(), k -> new long[2]);
                acc[0] += entry.score();
                acc[1]++;
            }
        }

        Map<String, Double> averages = new LinkedHashMap<>();
        totals.forEach((priority, acc) -> averages.put(priority, (double) acc[0] / acc[1]));

        return new LogSummary(entries.size(), executed, success, failed, rescores, averages);
    }

    public void clear() {
        entries.clear();
    }

    public Path getLogFile() {
        return logFile;
    }

    private String priorityTag(TestItem item) {
        return item.getPriority() != null ? item.getPriority() : Priority.MAY.name();
    }

    private String now() {
        return Instant.now(clock).toString();
    }
}
