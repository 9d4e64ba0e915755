package com.simforge.orchestrator.model;

import java.time.Duration;

/**
 * Outcome of running an artifact in the external environment.
 *
 * @param outputRef     scene file produced, null if none
 * @param exitCode      process exit code, null if the process never started
 * @param failureDetail short reason when {@code success} is false
 * @param inspection    facts read back from the produced scene, null until inspected
 */
public record ExecutionRecord(
        boolean  success,
        String   outputRef,
        Duration elapsed,
        String   stdout,
        String   stderr,
        Integer  exitCode,
        String   failureDetail,
        SceneInspection inspection
) {
    private static final int MAX_DIAGNOSTIC_CHARS = 4000;

    public static ExecutionRecord failed(String detail, String stdout, String stderr,
                                         Integer exitCode, Duration elapsed) {
        return new ExecutionRecord(false, null, elapsed, stdout, stderr, exitCode, detail, null);
    }

    public ExecutionRecord withInspection(SceneInspection scene) {
        return new ExecutionRecord(success, outputRef, elapsed, stdout, stderr, exitCode, failureDetail, scene);
    }

    /**
     * Captured output condensed for error reports: the tail of stderr and stdout,
     * because Blender prints the traceback last.
     */
    public String diagnostics() {
        StringBuilder sb = new StringBuilder();
        if (failureDetail != null) {
            sb.append(failureDetail);
        }
        if (exitCode != null) {
            if (!sb.isEmpty()) sb.append('\n');
            sb.append("exit_code: ").append(exitCode);
        }
        appendTail(sb, "stderr", stderr);
        appendTail(sb, "stdout", stdout);
        return sb.isEmpty() ? "(no output)" : sb.toString();
    }

    private static void appendTail(StringBuilder sb, String label, String text) {
        if (text == null || text.isBlank()) return;
        String trimmed = text.stripTrailing();
        if (trimmed.length() > MAX_DIAGNOSTIC_CHARS) {
            trimmed = "..." + trimmed.substring(trimmed.length() - MAX_DIAGNOSTIC_CHARS);
        }
        if (!sb.isEmpty()) sb.append("\n\n");
        sb.append(label).append(":\n").append(trimmed);
    }
}
