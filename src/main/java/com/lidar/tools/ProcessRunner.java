package com.lidar.tools;

import com.lidar.exception.ToolExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs external commands with a timeout. Output goes through temporary files so a chatty
 * tool cannot block on a full pipe.
 */
@Slf4j
@Component
public class ProcessRunner {

    private static final int DIAGNOSTIC_TAIL = 2000;

    /**
     * Run a command to completion
     *
     * @param stdin text written to the process input, or null
     * @throws ToolExecutionException if the command cannot start, times out or exits non-zero
     */
    public ProcessResult run(List<String> command, String stdin, Path workDir, Duration timeout) {
        String tool = command.get(0);
        Path stdoutFile = null;
        Path stderrFile = null;
        Process process = null;
        try {
            stdoutFile = Files.createTempFile("tool-", ".out");
            stderrFile = Files.createTempFile("tool-", ".err");

            ProcessBuilder builder = new ProcessBuilder(command)
                    .redirectOutput(stdoutFile.toFile())
                    .redirectError(stderrFile.toFile());
            if (workDir != null) {
                builder.directory(workDir.toFile());
            }

            log.debug("Running {}", String.join(" ", command));
            process = builder.start();
            try (OutputStream in = process.getOutputStream()) {
                if (stdin != null) {
                    in.write(stdin.getBytes(StandardCharsets.UTF_8));
                }
            }

            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new ToolExecutionException(String.format(
                    "%s timed out after %ds", tool, timeout.toSeconds()));
            }

            ProcessResult result = new ProcessResult(process.exitValue(),
                    Files.readString(stdoutFile, StandardCharsets.UTF_8),
                    Files.readString(stderrFile, StandardCharsets.UTF_8));
            if (!result.isSuccess()) {
                throw new ToolExecutionException(String.format("%s exited with code %d: %s",
                    tool, result.getExitCode(), tail(result.getStderr(), result.getStdout())),
                    result.getExitCode());
            }
            return result;
        } catch (IOException e) {
            throw new ToolExecutionException("Could not run " + tool + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (process != null) {
                process.destroyForcibly();
            }
            throw new ToolExecutionException("Interrupted while running " + tool, e);
        } finally {
            deleteQuietly(stdoutFile);
            deleteQuietly(stderrFile);
        }
    }

    private static String tail(String stderr, String stdout) {
        String text = stderr == null || stderr.isBlank() ? stdout : stderr;
        if (text == null) {
            return "";
        }
        text = text.strip();
        return text.length() <= DIAGNOSTIC_TAIL ? text : "..." + text.substring(text.length() - DIAGNOSTIC_TAIL);
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Could not delete temporary file {}: {}", file, e.getMessage());
        }
    }
}
