package com.purchasingpower.codegraph.extraction.scip;

import com.purchasingpower.codegraph.configuration.CodeGraphProperties;
import com.purchasingpower.codegraph.configuration.ScipProperties;
import com.purchasingpower.codegraph.exception.ExternalToolException;
import com.purchasingpower.codegraph.model.CallContext;
import com.purchasingpower.codegraph.model.ServiceType;
import com.purchasingpower.codegraph.util.ExternalCallLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Runs the external SCIP indexer synchronously and returns the artifact it wrote.
 *
 * <p>The artifact lives in a fresh temp directory owned by the caller on
 * success; on any failure the directory is deleted before the error is thrown.
 */
@Slf4j
@Component
public class ScipToolRunner {

    private final ScipProperties scipProperties;

    public ScipToolRunner(CodeGraphProperties properties) {
        this.scipProperties = properties.getScip();
    }

    /**
     * Locate the tool binary. Called before anything else in a SCIP run.
     *
     * @throws ExternalToolException if the binary cannot be found
     */
    public Path resolveExecutable() {
        String command = scipProperties.getCommand();
        return findExecutable(command, System.getenv("PATH"))
                .orElseThrow(() -> new ExternalToolException(
                        "SCIP indexer '" + command + "' not found; install it or set codegraph.scip.command"));
    }

    /**
     * Run the tool in the project root.
     *
     * @return path of the index artifact
     * @throws ExternalToolException if the tool is missing, fails, times out or writes no artifact
     */
    public Path run(Path projectRoot) {
        Path executable = resolveExecutable();
        Path outputDir;
        try {
            outputDir = Files.createTempDirectory("codegraph-scip");
        } catch (IOException e) {
            throw new ExternalToolException("Cannot create SCIP output directory", e);
        }
        Path artifact = outputDir.resolve(scipProperties.getOutputFile());
        Path logFile = outputDir.resolve("indexer.log");

        List<String> command = new ArrayList<>();
        command.add(executable.toString());
        for (String argument : scipProperties.getArguments()) {
            command.add(argument.replace(ScipProperties.OUTPUT_PLACEHOLDER, artifact.toString()));
        }

        CallContext callCtx = ExternalCallLogger.startCall(ServiceType.SCIP, "RunIndexer", log);
        callCtx.logRequest(ExternalCallLogger.formatCommand(command), "Project", projectRoot);
        try {
            Process process = new ProcessBuilder(command)
                    .directory(projectRoot.toFile())
                    .redirectErrorStream(true)
                    .redirectOutput(logFile.toFile())
                    .start();
            boolean finished = process.waitFor(scipProperties.getTimeout().toMillis(), TimeUnit.MILLISECONDS);
            String output = readOutput(logFile);
            if (!finished) {
                process.destroyForcibly();
                throw new ExternalToolException("SCIP indexer timed out after " + scipProperties.getTimeout(), output, null);
            }
            int exitCode = process.exitValue();
            if (exitCode != 0) {
                throw new ExternalToolException("SCIP indexer exited with status " + exitCode, output, exitCode);
            }
            if (!Files.isRegularFile(artifact)) {
                throw new ExternalToolException("SCIP indexer did not write " + artifact, output, exitCode);
            }
            log.debug("SCIP indexer output: {}", ExternalCallLogger.truncate(output, 2000));
            callCtx.logResponse("Index written", "Artifact", artifact, "Bytes", Files.size(artifact));
            return artifact;
        } catch (ExternalToolException e) {
            callCtx.logError(e.getMessage(), e);
            discardOutput(outputDir);
            throw e;
        } catch (IOException e) {
            callCtx.logError("Failed to run SCIP indexer", e);
            discardOutput(outputDir);
            throw new ExternalToolException("Failed to run SCIP indexer: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            callCtx.logError("Interrupted while waiting for SCIP indexer", e);
            discardOutput(outputDir);
            throw new ExternalToolException("Interrupted while waiting for SCIP indexer", e);
        }
    }

    private static void discardOutput(Path outputDir) {
        try {
            FileSystemUtils.deleteRecursively(outputDir);
        } catch (IOException e) {
            log.warn("⚠️ Could not delete SCIP output directory {}: {}", outputDir, e.getMessage());
        }
    }

    static Optional<Path> findExecutable(String command, String searchPath) {
        if (command == null || command.isBlank()) {
            return Optional.empty();
        }
        if (command.contains("/") || command.contains(File.separator)) {
            Path path = Paths.get(command);
            return Files.isRegularFile(path) && Files.isExecutable(path) ? Optional.of(path) : Optional.empty();
        }
        if (searchPath == null) {
            return Optional.empty();
        }
        for (String dir : searchPath.split(File.pathSeparator)) {
            if (dir.isBlank()) {
                continue;
            }
            Path candidate = Paths.get(dir, command);
            if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private static String readOutput(Path logFile) {
        try {
            return Files.exists(logFile) ? Files.readString(logFile, StandardCharsets.UTF_8) : "";
        } catch (IOException e) {
            return "(output unavailable: " + e.getMessage() + ")";
        }
    }
}
