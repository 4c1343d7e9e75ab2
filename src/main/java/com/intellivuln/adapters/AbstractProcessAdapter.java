package com.intellivuln.adapters;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.intellivuln.errors.ConfigurationException;
import com.intellivuln.models.Scan;
import com.intellivuln.models.ScanDepth;
import com.intellivuln.models.ScanTarget;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Общий сценарий адаптера внешнего процесса: проверка цели, сборка команды, запуск с таймаутом,
 * разбор JSON и преобразование в канонические находки. Любой сбой превращается в AdapterResult.failed.
 */
@Slf4j
public abstract class AbstractProcessAdapter implements ScannerAdapter {

    private static final int MAX_STDERR_IN_MESSAGE = 500;

    protected final ProcessRunner processRunner;

    protected AbstractProcessAdapter(ProcessRunner processRunner) {
        this.processRunner = processRunner;
    }

    @Override
    public final AdapterResult run(Scan scan) {
        String tool = toolName();
        Path workDir = null;
        try {
            validate(scan);
            if (needsWorkDir()) {
                workDir = Files.createTempDirectory("intellivuln-" + kind().value() + "-");
            }
            List<String> command = buildCommand(scan, workDir);
            Duration timeout = timeout(scan);
            log.info("{}: сканирование {} ({}), таймаут {} с", tool,
                scan.getTarget().getIdentifier(), depthOf(scan).value(), timeout.toSeconds());

            ProcessResult result = processRunner.run(command, environment(scan), timeout);
            if (result.isTimedOut()) {
                log.error("{}: превышен таймаут {} с", tool, timeout.toSeconds());
                return AdapterResult.failed(tool + ": превышен таймаут " + timeout.toSeconds() + " с");
            }
            if (result.getExitCode() != 0 && !acceptsExitCode(result.getExitCode())) {
                String stderr = abbreviate(result.getStderr());
                log.error("{}: процесс завершился с кодом {}: {}", tool, result.getExitCode(), stderr);
                return AdapterResult.failed(tool + " завершился с кодом " + result.getExitCode() + ": " + stderr);
            }

            JsonNode output = readOutput(result, workDir);
            List<Map<String, Object>> findings = extractFindings(output, scan);
            log.info("{}: получено находок {}", tool, findings.size());
            return AdapterResult.success(findings, output);
        } catch (ConfigurationException e) {
            log.error("{}: ошибка конфигурации: {}", tool, e.getMessage());
            return AdapterResult.failed(e.getMessage());
        } catch (JsonProcessingException e) {
            log.error("{}: некорректный JSON в выводе: {}", tool, e.getOriginalMessage());
            return AdapterResult.failed(tool + ": некорректный JSON в выводе: " + e.getOriginalMessage());
        } catch (IOException e) {
            log.error("{}: ошибка ввода-вывода", tool, e);
            return AdapterResult.failed(tool + ": ошибка ввода-вывода: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("{}: сканирование прервано", tool);
            return AdapterResult.failed(tool + ": сканирование прервано");
        } catch (RuntimeException e) {
            log.error("{}: непредвиденная ошибка", tool, e);
            return AdapterResult.failed(tool + ": непредвиденная ошибка: " + e.getMessage());
        } finally {
            if (workDir != null) {
                deleteRecursively(workDir);
            }
        }
    }

    /**
     * Человекочитаемое имя инструмента для логов и сообщений
     */
    protected abstract String toolName();

    protected abstract List<String> buildCommand(Scan scan, Path workDir) throws IOException;

    protected abstract List<Map<String, Object>> extractFindings(JsonNode output, Scan scan);

    protected abstract Duration defaultTimeout();

    /**
     * Проверка цели до запуска процесса. Переопределяется для ограничения поддерживаемых типов.
     */
    protected void validate(Scan scan) {
        ScanTarget target = scan.getTarget();
        if (target == null || target.getType() == null) {
            throw new ConfigurationException("Не указан тип цели сканирования");
        }
        if (target.getIdentifier() == null || target.getIdentifier().isBlank()) {
            throw new ConfigurationException("Не указан идентификатор цели сканирования");
        }
    }

    protected boolean needsWorkDir() {
        return false;
    }

    /**
     * Некоторые инструменты сигнализируют о найденных уязвимостях ненулевым кодом
     */
    protected boolean acceptsExitCode(int exitCode) {
        return false;
    }

    protected Map<String, String> environment(Scan scan) {
        return Map.of();
    }

    /**
     * Разбор вывода. По умолчанию JSON из stdout.
     */
    protected JsonNode readOutput(ProcessResult result, Path workDir) throws IOException {
        String stdout = result.getStdout();
        if (stdout == null || stdout.isBlank()) {
            throw new IOException("пустой вывод сканера");
        }
        return JsonFields.mapper().readTree(stdout);
    }

    /**
     * Таймаут из scanner_config.timeout_sec или значение по умолчанию адаптера
     */
    protected Duration timeout(Scan scan) {
        String override = scan.configValue("timeout_sec");
        if (override != null) {
            try {
                long seconds = Long.parseLong(override.trim());
                if (seconds > 0) {
                    return Duration.ofSeconds(seconds);
                }
            } catch (NumberFormatException e) {
                throw new ConfigurationException("Некорректный timeout_sec: " + override, e);
            }
        }
        return defaultTimeout();
    }

    protected static ScanDepth depthOf(Scan scan) {
        return scan.getDepth() != null ? scan.getDepth() : ScanDepth.NORMAL;
    }

    static String abbreviate(String text) {
        if (text == null) {
            return "";
        }
        String trimmed = text.trim();
        return trimmed.length() > MAX_STDERR_IN_MESSAGE
            ? trimmed.substring(0, MAX_STDERR_IN_MESSAGE) + "..."
            : trimmed;
    }

    private static void deleteRecursively(Path dir) {
        try (Stream<Path> paths = Files.walk(dir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException e) {
                    log.debug("Не удалось удалить {}: {}", path, e.getMessage());
                }
            });
        } catch (IOException e) {
            log.warn("Не удалось очистить рабочий каталог {}: {}", dir, e.getMessage());
        }
    }
}
