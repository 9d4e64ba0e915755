package com.simforge.orchestrator.execution;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.simforge.orchestrator.error.FailureKind;
import com.simforge.orchestrator.error.StageException;
import com.simforge.orchestrator.model.Artifact;
import com.simforge.orchestrator.model.EnrichedPlan;
import com.simforge.orchestrator.model.ExecutionRecord;
import com.simforge.orchestrator.model.SceneInspection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Headless Blender driven as a subprocess.
 *
 * Both the scene script and the inspection script are written to temp files
 * and run with {@code --background --python}. stdout and stderr go to temp
 * files rather than pipes, so a chatty process can never block on a full pipe
 * buffer. On timeout the process is killed forcibly.
 */
@Component
public class BlenderProcessRunner implements ExecutionEnvironment, SceneInspector {

    private static final Logger log = LoggerFactory.getLogger(BlenderProcessRunner.class);

    static final String INSPECTION_MARKER   = "INSPECTION_RESULT:";
    static final String INSPECTION_RESOURCE = "scripts/inspect_scene.py";

    private final String       executable;
    private final ObjectMapper objectMapper;
    private final String       inspectionScript;

    public BlenderProcessRunner(@Value("${simforge.blender.executable:blender}") String executable,
                                ObjectMapper objectMapper) {
        this.executable       = executable;
        this.objectMapper     = objectMapper;
        this.inspectionScript = loadResource(INSPECTION_RESOURCE);
    }

    public String executable() {
        return executable;
    }

    // ------------------------------------------------------------------
    // ExecutionEnvironment
    // ------------------------------------------------------------------

    @Override
    public ExecutionRecord execute(Artifact artifact, Duration timeout) {
        Path output = Path.of(artifact.outputRef());
        try {
            Files.createDirectories(output.toAbsolutePath().getParent());
            Files.deleteIfExists(output);
        } catch (IOException e) {
            throw new StageException(FailureKind.EXECUTION_FAILURE,
                    "Cannot prepare output location " + output + ": " + e.getMessage(), e);
        }

        ProcessOutput run = runScript(artifact.script(), null, List.of(), timeout, "Scene build");
        if (run.exitCode() != 0) {
            return ExecutionRecord.failed("Blender exited with code " + run.exitCode(),
                    run.stdout(), run.stderr(), run.exitCode(), run.elapsed());
        }
        if (!Files.isRegularFile(output)) {
            return ExecutionRecord.failed("Blender finished but did not write " + output,
                    run.stdout(), run.stderr(), run.exitCode(), run.elapsed());
        }
        log.info("Scene written to {} in {} ms", output, run.elapsed().toMillis());
        return new ExecutionRecord(true, output.toString(), run.elapsed(),
                run.stdout(), run.stderr(), run.exitCode(), null, null);
    }

    // ------------------------------------------------------------------
    // SceneInspector
    // ------------------------------------------------------------------

    @Override
    public SceneInspection inspect(ExecutionRecord execution, EnrichedPlan plan, Duration timeout) {
        if (!execution.success() || execution.outputRef() == null) {
            throw new StageException(FailureKind.EXECUTION_FAILURE,
                    "Cannot inspect a failed execution", execution.diagnostics(), null);
        }
        ProcessOutput run = runScript(inspectionScript, execution.outputRef(),
                List.of(plan.plan().simulationType().wireValue()), timeout, "Scene inspection");
        if (run.exitCode() != 0) {
            throw new StageException(FailureKind.EXECUTION_FAILURE,
                    "Scene inspection exited with code " + run.exitCode(), run.tail(), null);
        }
        return parseInspection(run.stdout(), objectMapper);
    }

    /** Extracts the JSON printed after {@value #INSPECTION_MARKER}. */
    public static SceneInspection parseInspection(String stdout, ObjectMapper objectMapper) {
        int at = stdout == null ? -1 : stdout.indexOf(INSPECTION_MARKER);
        if (at < 0) {
            throw new StageException(FailureKind.EXECUTION_FAILURE,
                    "Scene inspection printed no " + INSPECTION_MARKER + " line");
        }
        String rest = stdout.substring(at + INSPECTION_MARKER.length());
        int eol = rest.indexOf('\n');
        String json = (eol < 0 ? rest : rest.substring(0, eol)).strip();
        try {
            return objectMapper.readValue(json, SceneInspection.class);
        } catch (JsonProcessingException e) {
            throw new StageException(FailureKind.EXECUTION_FAILURE,
                    "Malformed inspection result: " + e.getOriginalMessage(), json, e);
        }
    }

    // ------------------------------------------------------------------
    // Process plumbing
    // ------------------------------------------------------------------

    private record ProcessOutput(int exitCode, String stdout, String stderr, Duration elapsed) {
        String tail() {
            return ExecutionRecord.failed(null, stdout, stderr, exitCode, elapsed).diagnostics();
        }
    }

    private ProcessOutput runScript(String script, String sceneFile, List<String> scriptArgs,
                                    Duration timeout, String what) {
        Path scriptFile = null;
        Path stdoutFile = null;
        Path stderrFile = null;
        Process process = null;
        long start = System.nanoTime();
        try {
            scriptFile = Files.createTempFile("simforge_", ".py");
            stdoutFile = Files.createTempFile("simforge_", ".out");
            stderrFile = Files.createTempFile("simforge_", ".err");
            Files.writeString(scriptFile, script, StandardCharsets.UTF_8);

            List<String> command = new ArrayList<>();
            command.add(executable);
            if (sceneFile != null) command.add(sceneFile);
            command.add("--background");
            command.add("--python");
            command.add(scriptFile.toString());
            if (!scriptArgs.isEmpty()) {
                command.add("--");
                command.addAll(scriptArgs);
            }
            log.debug("{}: {}", what, String.join(" ", command));

            process = new ProcessBuilder(command)
                    .redirectOutput(stdoutFile.toFile())
                    .redirectError(stderrFile.toFile())
                    .start();

            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            String stdout = Files.readString(stdoutFile, StandardCharsets.UTF_8);
            String stderr = Files.readString(stderrFile, StandardCharsets.UTF_8);
            if (!finished) {
                process.destroyForcibly();
                log.warn("{} killed after {} ms", what, timeout.toMillis());
                throw new StageException(FailureKind.TIMEOUT,
                        what + " did not finish within " + timeout.toMillis() + " ms",
                        new ProcessOutput(-1, stdout, stderr, elapsed).tail(), null);
            }
            return new ProcessOutput(process.exitValue(), stdout, stderr, elapsed);

        } catch (IOException e) {
            throw new StageException(FailureKind.EXECUTION_FAILURE,
                    what + " could not run '" + executable + "': " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StageException(FailureKind.CANCELLED, what + " interrupted", e);
        } finally {
            if (process != null && process.isAlive()) {
                process.destroyForcibly();
            }
            deleteQuietly(scriptFile);
            deleteQuietly(stdoutFile);
            deleteQuietly(stderrFile);
        }
    }

    private static void deleteQuietly(Path file) {
        if (file == null) return;
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Could not delete temp file {}: {}", file, e.getMessage());
        }
    }

    private static String loadResource(String name) {
        try (InputStream in = new ClassPathResource(name).getInputStream()) {
            return StreamUtils.copyToString(in, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Missing script resource " + name, e);
        }
    }
}
