package com.mltrading.alerting;

import com.mltrading.domain.enums.AlertCategory;
import com.mltrading.domain.enums.AlertOutcome;
import com.mltrading.domain.enums.AlertSeverity;
import com.mltrading.domain.model.Alert;
import com.mltrading.domain.model.AlertValidator;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Alerts for scheduled data-pipeline flows and their tasks.
 *
 * <p>Every alert carries the flow run id as its correlation id when one is given,
 * so the flow start, its task failures and its final outcome can be matched in the
 * inbox and in the fallback log.
 */
@Component
public class PipelineAlertNotifier {

    private static final Logger log = LoggerFactory.getLogger(PipelineAlertNotifier.class);

    static final String COMPONENT = "DataPipeline";

    private final AlertManager alertManager;
    private final Clock clock;

    public PipelineAlertNotifier(AlertManager alertManager, Clock clock) {
        this.alertManager = alertManager;
        this.clock = clock;
    }

    public AlertOutcome sendFlowStartAlert(String flowName, String correlationId) {
        AlertValidator.requireText(flowName, "flow name");
        return send(
                "Flow Started: " + flowName,
                "Data pipeline flow " + flowName + " has started",
                AlertSeverity.INFO,
                AlertCategory.DATA_PIPELINE,
                Map.of("flow_name", flowName),
                correlationId);
    }

    public AlertOutcome sendFlowSuccessAlert(String flowName, Duration duration, String correlationId) {
        AlertValidator.requireText(flowName, "flow name");
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("flow_name", flowName);
        String durationText = "";
        if (duration != null) {
            metadata.put("duration_seconds", duration.toMillis() / 1000.0);
            durationText = String.format(Locale.ROOT, " in %.1fs", duration.toMillis() / 1000.0);
        }
        return send(
                "Flow Completed: " + flowName,
                "Data pipeline flow " + flowName + " completed successfully" + durationText,
                AlertSeverity.INFO,
                AlertCategory.DATA_PIPELINE,
                metadata,
                correlationId);
    }

    public AlertOutcome sendFlowFailureAlert(String flowName, Throwable error, String correlationId) {
        AlertValidator.requireText(flowName, "flow name");
        Map<String, Object> metadata = errorMetadata(error);
        metadata.put("flow_name", flowName);
        return send(
                "Flow Failed: " + flowName,
                "Data pipeline flow " + flowName + " failed: " + describe(error),
                AlertSeverity.HIGH,
                AlertCategory.DATA_PIPELINE,
                metadata,
                correlationId);
    }

    public AlertOutcome sendTaskFailureAlert(String taskName, Throwable error, String correlationId) {
        AlertValidator.requireText(taskName, "task name");
        Map<String, Object> metadata = errorMetadata(error);
        metadata.put("task_name", taskName);
        return send(
                "Task Failed: " + taskName,
                "Pipeline task " + taskName + " failed: " + describe(error),
                AlertSeverity.MEDIUM,
                AlertCategory.DATA_PIPELINE,
                metadata,
                correlationId);
    }

    /**
     * Runs {@code work}; if it throws, raises a failure alert with the given severity
     * and category and rethrows the original exception unchanged.
     */
    public <T> T runWithFailureAlert(String name, AlertSeverity severity, AlertCategory category, Callable<T> work)
            throws Exception {
        AlertValidator.requireText(name, "name");
        try {
            return work.call();
        } catch (Exception e) {
            Map<String, Object> metadata = errorMetadata(e);
            metadata.put("function", name);
            send(
                    "Function Failed: " + name,
                    "Function " + name + " failed with error: " + describe(e),
                    severity != null ? severity : AlertSeverity.HIGH,
                    category != null ? category : AlertCategory.DATA_PIPELINE,
                    metadata,
                    null);
            throw e;
        }
    }

    /**
     * Runs {@code work} and raises a SYSTEM_HEALTH alert when it takes longer than
     * {@code threshold}, whether it completed or threw.
     */
    public <T> T runWithRuntimeAlert(String name, Duration threshold, Callable<T> work) throws Exception {
        AlertValidator.requireText(name, "name");
        AlertValidator.requirePresent(threshold, "threshold");
        Instant start = clock.instant();
        boolean failed = true;
        try {
            T result = work.call();
            failed = false;
            return result;
        } finally {
            Duration elapsed = Duration.between(start, clock.instant());
            if (elapsed.compareTo(threshold) > 0) {
                sendLongRuntimeAlert(name, elapsed, threshold, failed);
            }
        }
    }

    private void sendLongRuntimeAlert(String name, Duration elapsed, Duration threshold, boolean failed) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("function", name);
        metadata.put("runtime_seconds", elapsed.toMillis() / 1000.0);
        metadata.put("threshold_seconds", threshold.toMillis() / 1000.0);
        metadata.put("failed", failed);
        send(
                "Long Runtime: " + name,
                String.format(
                        Locale.ROOT,
                        "Function %s took %.1fs (threshold: %.1fs)%s",
                        name,
                        elapsed.toMillis() / 1000.0,
                        threshold.toMillis() / 1000.0,
                        failed ? " and failed" : ""),
                AlertSeverity.MEDIUM,
                AlertCategory.SYSTEM_HEALTH,
                metadata,
                null);
    }

    private AlertOutcome send(
            String title,
            String message,
            AlertSeverity severity,
            AlertCategory category,
            Map<String, ?> metadata,
            String correlationId) {
        Alert alert = Alert.builder()
                .title(title)
                .message(message)
                .severity(severity)
                .category(category)
                .component(COMPONENT)
                .metadata(metadata)
                .correlationId(correlationId)
                .build();
        AlertOutcome outcome = alertManager.process(alert);
        log.debug("Pipeline alert '{}' -> {}", title, outcome);
        return outcome;
    }

    private static Map<String, Object> errorMetadata(Throwable error) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (error != null) {
            metadata.put("error_type", error.getClass().getSimpleName());
            metadata.put("error_message", String.valueOf(error.getMessage()));
        }
        return metadata;
    }

    private static String describe(Throwable error) {
        if (error == null) {
            return "unknown error";
        }
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
