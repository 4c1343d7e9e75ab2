package com.intellivuln.adapters;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@EnabledOnOs({OS.LINUX, OS.MAC})
class DefaultProcessRunnerTest {

    private final DefaultProcessRunner runner = new DefaultProcessRunner();

    @Test
    void capturesStdoutStderrAndExitCode() throws Exception {
        ProcessResult result = runner.run(List.of("sh", "-c", "echo out; echo err 1>&2; exit 3"),
            Map.of(), Duration.ofSeconds(10));

        assertEquals(3, result.getExitCode());
        assertEquals("out", result.getStdout().trim());
        assertEquals("err", result.getStderr().trim());
        assertFalse(result.isTimedOut());
    }

    @Test
    void passesEnvironment() throws Exception {
        ProcessResult result = runner.run(List.of("sh", "-c", "printf %s \"$GVM_USERNAME\""),
            Map.of("GVM_USERNAME", "scanner"), Duration.ofSeconds(10));

        assertEquals("scanner", result.getStdout());
    }

    @Test
    void killsProcessOnTimeout() throws Exception {
        ProcessResult result = runner.run(List.of("sleep", "10"), Map.of(), Duration.ofMillis(200));

        assertTrue(result.isTimedOut());
        assertEquals(-1, result.getExitCode());
        assertTrue(result.getDurationMs() < 10_000);
    }
}
