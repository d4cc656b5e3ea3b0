package com.lidar.tools;

import com.lidar.exception.ToolExecutionException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@EnabledOnOs({OS.LINUX, OS.MAC})
class ProcessRunnerTest {

    private final ProcessRunner processRunner = new ProcessRunner();

    @Test
    void testCapturesOutputAndStdin() {
        ProcessResult result = processRunner.run(List.of("sh", "-c", "cat; echo done >&2"),
            "{\"pipeline\":[]}", null, Duration.ofSeconds(10));

        assertTrue(result.isSuccess());
        assertEquals("{\"pipeline\":[]}", result.getStdout());
        assertEquals("done", result.getStderr().strip());
    }

    @Test
    void testNonZeroExitCarriesDiagnostics() {
        ToolExecutionException error = assertThrows(ToolExecutionException.class,
            () -> processRunner.run(List.of("sh", "-c", "echo 'no such file' >&2; exit 3"),
                null, null, Duration.ofSeconds(10)));

        assertEquals(3, error.getExitCode());
        assertTrue(error.getMessage().contains("no such file"));
    }

    @Test
    void testTimeoutKillsProcess() {
        ToolExecutionException error = assertThrows(ToolExecutionException.class,
            () -> processRunner.run(List.of("sh", "-c", "sleep 30"), null, null, Duration.ofMillis(200)));

        assertTrue(error.getMessage().contains("timed out"));
    }

    @Test
    void testMissingExecutable() {
        assertThrows(ToolExecutionException.class,
            () -> processRunner.run(List.of("definitely-not-a-real-tool-xyz"), null, null, Duration.ofSeconds(5)));
    }
}
