package com.intellivuln.cli;

import com.intellivuln.config.VulnScanConfig;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Главная CLI команда IntelliVuln
 */
@Slf4j
@Command(
    name = "intellivuln",
    mixinStandardHelpOptions = true,
    version = "IntelliVuln Engine 1.0.0",
    subcommands = {ScanCommand.class, TrainCommand.class, PredictCommand.class},
    description = """

        IntelliVuln Engine

        Оркестрация сканеров уязвимостей и ML-приоритизация находок

        Возможности:
          • Запуск Trivy, OWASP Dependency-Check, OpenVAS и собственных сканеров
          • Нормализация находок в единый формат
          • Обучение модели приоритизации на исторических данных
          • Оценка срочности устранения с объяснением
          • Интеграция с CI/CD (exit codes)

        """
)
public class MainCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Option(
        names = {"-c", "--config"},
        description = "YAML файл конфигурации (по умолчанию intellivuln-config.yaml из classpath)"
    )
    private Path configPath;

    @Option(
        names = {"--model-dir"},
        description = "Каталог артефактов моделей (перекрывает ml.modelDir)"
    )
    private Path modelDir;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    /**
     * Конфигурация с учетом --config, --model-dir и переменных окружения
     */
    VulnScanConfig loadConfig() {
        VulnScanConfig config = configPath != null ? VulnScanConfig.load(configPath) : VulnScanConfig.load();
        config.applyEnvironment(System.getenv());
        if (modelDir != null) {
            config.getMl().setModelDir(modelDir.toString());
        }
        log.debug("Каталог моделей: {}", config.getMl().getModelDir());
        return config;
    }
}
