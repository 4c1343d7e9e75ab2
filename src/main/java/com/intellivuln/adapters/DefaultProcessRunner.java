package com.intellivuln.adapters;

import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Запуск процессов через ProcessBuilder.
 * stdout и stderr пишутся во временные файлы, чтобы большой вывод не блокировал процесс.
 */
@Slf4j
public class DefaultProcessRunner implements ProcessRunner {

    @Override
    public ProcessResult run(List<String> command, Map<String, String> environment, Duration timeout)
            throws IOException, InterruptedException {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("Команда не может быть пустой");
        }
        Path stdoutFile = Files.createTempFile("intellivuln-out-", ".log");
        Path stderrFile = Files.createTempFile("intellivuln-err-", ".log");
        long started = System.currentTimeMillis();
        try {
            ProcessBuilder builder = new ProcessBuilder(command);
            builder.redirectOutput(stdoutFile.toFile());
            builder.redirectError(stderrFile.toFile());
            builder.redirectInput(ProcessBuilder.Redirect.from(new File(nullDevice())));
            if (environment != null && !environment.isEmpty()) {
                builder.environment().putAll(environment);
            }

            log.debug("Запуск команды: {}", String.join(" ", command));
            Process process = builder.start();
            boolean finished;
            try {
                finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                process.destroyForcibly();
                throw e;
            }

            if (!finished) {
                log.warn("Процесс {} превысил таймаут {} с, принудительное завершение", command.get(0), timeout.toSeconds());
                process.destroyForcibly();
                process.waitFor(5, TimeUnit.SECONDS);
                return ProcessResult.builder()
                    .exitCode(-1)
                    .stdout(readQuietly(stdoutFile))
                    .stderr(readQuietly(stderrFile))
                    .timedOut(true)
                    .durationMs(System.currentTimeMillis() - started)
                    .build();
            }

            return ProcessResult.builder()
                .exitCode(process.exitValue())
                .stdout(Files.readString(stdoutFile, StandardCharsets.UTF_8))
                .stderr(Files.readString(stderrFile, StandardCharsets.UTF_8))
                .timedOut(false)
                .durationMs(System.currentTimeMillis() - started)
                .build();
        } finally {
            deleteQuietly(stdoutFile);
            deleteQuietly(stderrFile);
        }
    }

    private static String nullDevice() {
        return System.getProperty("os.name", "").toLowerCase().startsWith("windows") ? "NUL" : "/dev/null";
    }

    private static String readQuietly(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.debug("Не удалось прочитать вывод процесса {}: {}", file, e.getMessage());
            return "";
        }
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Не удалось удалить временный файл {}: {}", file, e.getMessage());
        }
    }
}
