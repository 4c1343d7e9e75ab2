package com.intellivuln.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.intellivuln.errors.ConfigurationException;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Конфигурация движка из YAML файла.
 * Загруженный объект передается в адаптеры, тренер и контроллер при создании.
 */
@Slf4j
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class VulnScanConfig {

    public static final String DEFAULT_RESOURCE = "intellivuln-config.yaml";

    private Scanners scanners;
    private Workers workers;
    private Ml ml;

    /**
     * Загрузить конфигурацию из classpath
     */
    public static VulnScanConfig load() {
        try (InputStream is = VulnScanConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (is == null) {
                log.warn("{} не найден в classpath, используются значения по умолчанию", DEFAULT_RESOURCE);
                return defaults();
            }
            VulnScanConfig config = yamlMapper().readValue(is, VulnScanConfig.class);
            return config != null ? config.ensureDefaults() : defaults();
        } catch (IOException e) {
            throw new ConfigurationException("Ошибка загрузки конфигурации: " + e.getMessage(), e);
        }
    }

    /**
     * Загрузить конфигурацию из файла
     */
    public static VulnScanConfig load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new ConfigurationException("Файл конфигурации не найден: " + path);
        }
        try (InputStream is = Files.newInputStream(path)) {
            VulnScanConfig config = yamlMapper().readValue(is, VulnScanConfig.class);
            if (config == null) {
                throw new ConfigurationException("Пустой файл конфигурации: " + path);
            }
            log.info("Конфигурация загружена из {}", path);
            return config.ensureDefaults();
        } catch (IOException e) {
            throw new ConfigurationException("Ошибка чтения конфигурации " + path + ": " + e.getMessage(), e);
        }
    }

    public static VulnScanConfig defaults() {
        return new VulnScanConfig().ensureDefaults();
    }

    private static ObjectMapper yamlMapper() {
        return new ObjectMapper(new YAMLFactory());
    }

    /**
     * Заполнить отсутствующие секции значениями по умолчанию
     */
    public VulnScanConfig ensureDefaults() {
        if (scanners == null) {
            scanners = new Scanners();
        }
        scanners.ensureDefaults();
        if (workers == null) {
            workers = new Workers();
        }
        workers.ensureDefaults();
        if (ml == null) {
            ml = new Ml();
        }
        ml.ensureDefaults();
        return this;
    }

    /**
     * Переопределения из переменных окружения:
     * TRIVY_PATH, DEPENDENCY_CHECK_PATH, OPENVAS_COMMAND, OPENVAS_USER, OPENVAS_PASSWORD,
     * ML_MODEL_PATH, WORKER_POOL_SIZE
     */
    public VulnScanConfig applyEnvironment(Map<String, String> env) {
        ensureDefaults();
        if (env == null) {
            return this;
        }
        applyIfPresent(env, "TRIVY_PATH", value -> scanners.getTrivy().setPath(value));
        applyIfPresent(env, "DEPENDENCY_CHECK_PATH", value -> scanners.getDependencyCheck().setPath(value));
        applyIfPresent(env, "OPENVAS_COMMAND", value -> scanners.getOpenvas().setCommand(value));
        applyIfPresent(env, "OPENVAS_USER", value -> scanners.getOpenvas().setUsername(value));
        applyIfPresent(env, "OPENVAS_PASSWORD", value -> scanners.getOpenvas().setPassword(value));
        applyIfPresent(env, "ML_MODEL_PATH", value -> ml.setModelDir(value));
        applyIfPresent(env, "WORKER_POOL_SIZE", value -> {
            try {
                int poolSize = Integer.parseInt(value.trim());
                if (poolSize <= 0) {
                    throw new ConfigurationException("WORKER_POOL_SIZE должен быть положительным: " + value);
                }
                workers.setPoolSize(poolSize);
            } catch (NumberFormatException e) {
                throw new ConfigurationException("Некорректный WORKER_POOL_SIZE: " + value, e);
            }
        });
        return this;
    }

    private static void applyIfPresent(Map<String, String> env, String key, java.util.function.Consumer<String> setter) {
        String value = env.get(key);
        if (value != null && !value.isBlank()) {
            setter.accept(value);
        }
    }

    @Data
    public static class Scanners {
        private Trivy trivy;
        private DependencyCheck dependencyCheck;
        private OpenVas openvas;
        private Custom custom;

        private void ensureDefaults() {
            if (trivy == null) {
                trivy = new Trivy();
            }
            if (dependencyCheck == null) {
                dependencyCheck = new DependencyCheck();
            }
            if (openvas == null) {
                openvas = new OpenVas();
            }
            if (custom == null) {
                custom = new Custom();
            }
            trivy.ensureDefaults();
            dependencyCheck.ensureDefaults();
            openvas.ensureDefaults();
            custom.ensureDefaults();
        }
    }

    @Data
    public static class Trivy {
        private String path;
        private Integer timeoutSec;

        private void ensureDefaults() {
            if (path == null || path.isBlank()) {
                path = "trivy";
            }
            if (timeoutSec == null || timeoutSec <= 0) {
                timeoutSec = 600;
            }
        }
    }

    @Data
    public static class DependencyCheck {
        private String path;
        private Integer timeoutSec;
        /**
         * Каталог для временных отчетов; null - системный temp
         */
        private String reportDir;

        private void ensureDefaults() {
            if (path == null || path.isBlank()) {
                path = "dependency-check";
            }
            if (timeoutSec == null || timeoutSec <= 0) {
                timeoutSec = 1800;
            }
        }
    }

    @Data
    public static class OpenVas {
        private String command;
        private String username;
        private String password;
        private Integer timeoutSec;

        private void ensureDefaults() {
            if (command == null || command.isBlank()) {
                command = "gvm-scan";
            }
            if (username == null) {
                username = "admin";
            }
            if (password == null) {
                password = "";
            }
            if (timeoutSec == null || timeoutSec <= 0) {
                timeoutSec = 3600;
            }
        }
    }

    @Data
    public static class Custom {
        private Integer timeoutSec;

        private void ensureDefaults() {
            if (timeoutSec == null || timeoutSec <= 0) {
                timeoutSec = 600;
            }
        }
    }

    @Data
    public static class Workers {
        private Integer poolSize;
        private Integer shutdownTimeoutSec;

        private void ensureDefaults() {
            if (poolSize == null || poolSize <= 0) {
                poolSize = Math.max(2, Runtime.getRuntime().availableProcessors());
            }
            if (shutdownTimeoutSec == null || shutdownTimeoutSec < 0) {
                shutdownTimeoutSec = 30;
            }
        }
    }

    @Data
    public static class Ml {
        private String modelDir;
        private Double testSize;
        private Long randomSeed;
        private Integer minTrainingRecords;
        private Double importanceThreshold;
        /**
         * Порог аналитической оценки приоритета, начиная с которого запись считается срочной
         */
        private Double labelThreshold;
        private Map<String, Object> hyperparameters;

        private void ensureDefaults() {
            if (modelDir == null || modelDir.isBlank()) {
                modelDir = "models";
            }
            if (testSize == null || testSize <= 0.0 || testSize >= 1.0) {
                testSize = 0.2;
            }
            if (randomSeed == null) {
                randomSeed = 42L;
            }
            if (minTrainingRecords == null || minTrainingRecords < 2) {
                minTrainingRecords = 10;
            }
            if (importanceThreshold == null || importanceThreshold < 0.0) {
                importanceThreshold = 0.01;
            }
            if (labelThreshold == null) {
                labelThreshold = 0.5;
            }
            if (hyperparameters == null) {
                hyperparameters = new LinkedHashMap<>();
            }
        }
    }
}
