package com.intellivuln.cli;

import com.intellivuln.core.IntelliVulnEngine;
import com.intellivuln.core.ScanHandle;
import com.intellivuln.errors.InvalidOperationException;
import com.intellivuln.errors.NoTrainedModelException;
import com.intellivuln.errors.VulnScanException;
import com.intellivuln.integration.CICDIntegration;
import com.intellivuln.models.Scan;
import com.intellivuln.models.ScanDepth;
import com.intellivuln.models.ScanRequest;
import com.intellivuln.models.ScanResults;
import com.intellivuln.models.ScanStatus;
import com.intellivuln.models.ScanTarget;
import com.intellivuln.models.TargetType;
import com.intellivuln.reports.JsonReportGenerator;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeoutException;

/**
 * Запуск сканирования цели одним сканером
 */
@Slf4j
@Command(
    name = "scan",
    mixinStandardHelpOptions = true,
    description = "Запустить сканирование и дождаться результата"
)
public class ScanCommand implements Callable<Integer> {

    @ParentCommand
    private MainCommand parent;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Цель: образ, хост, путь или URL репозитория")
    private String target;

    @Option(names = {"-s", "--scanner"}, required = true,
        description = "Сканер: trivy, dependency-check, openvas, custom")
    private String scanner;

    @Option(names = {"-t", "--target-type"}, required = true,
        description = "Тип цели: container, host, application, repository")
    private String targetType;

    @Option(names = {"-d", "--depth"}, description = "Глубина: quick, normal, deep (по умолчанию normal)")
    private String depth = "normal";

    @Option(names = {"--asset"}, description = "Идентификатор актива")
    private String assetId;

    @Option(names = {"--name"}, description = "Название сканирования")
    private String name;

    @Option(names = {"--command"}, description = "Команда custom сканера с подстановками {target}, {depth}, {target_type}")
    private String customCommand;

    @Option(names = {"--timeout"}, description = "Таймаут сканера в секундах")
    private Long timeoutSec;

    @Option(names = {"--wait"}, description = "Максимальное ожидание завершения в минутах (по умолчанию 120)")
    private long waitMinutes = 120;

    @Option(names = {"--prioritize"}, description = "Оценить находки обученной моделью")
    private boolean prioritize;

    @Option(names = {"--model"}, description = "Идентификатор модели для приоритизации")
    private String modelId;

    @Option(names = {"-o", "--output"}, description = "Путь JSON отчета")
    private Path output;

    @Option(names = {"--fail-on-high"}, description = "Прервать с ошибкой при обнаружении HIGH уязвимостей (для CI/CD)")
    private boolean failOnHigh;

    @Option(names = {"--ci"}, description = "Режим CI/CD (сводка + аннотации GitHub Actions)")
    private boolean ciMode;

    @Override
    public Integer call() throws Exception {
        PrintWriter err = spec.commandLine().getErr();
        TargetType type = TargetType.fromValue(targetType);
        if (type == null) {
            err.println("Неизвестный тип цели: " + targetType);
            return 2;
        }
        ScanDepth scanDepth = ScanDepth.parse(depth);
        if (scanDepth == null) {
            err.println("Неизвестная глубина сканирования: " + depth + " (quick, normal, deep)");
            return 2;
        }

        Map<String, Object> scannerConfig = new LinkedHashMap<>();
        if (customCommand != null) {
            scannerConfig.put("command", customCommand);
        }
        if (timeoutSec != null) {
            scannerConfig.put("timeout_sec", timeoutSec);
        }

        try (IntelliVulnEngine engine = IntelliVulnEngine.create(parent.loadConfig())) {
            Scan scan = engine.getScanController().createScan(ScanRequest.builder()
                .name(name)
                .scannerType(scanner)
                .assetId(assetId)
                .target(ScanTarget.of(type, target))
                .depth(scanDepth)
                .scannerConfig(scannerConfig)
                .build());

            ScanHandle handle = engine.getScanController().start(scan.getId());
            Scan finished;
            try {
                finished = handle.await(Duration.ofMinutes(waitMinutes));
            } catch (TimeoutException e) {
                finished = stopAfterTimeout(engine, scan.getId());
                if (finished.getStatus() == ScanStatus.STOPPED) {
                    err.println("Сканирование не завершилось за " + waitMinutes + " мин и было остановлено");
                    return 2;
                }
            }
            log.info("Сканирование {} завершено со статусом {}", finished.getId(), finished.getStatus().value());

            if (prioritize && finished.getStatus() == ScanStatus.COMPLETED) {
                engine.restoreModels();
                try {
                    engine.getPredictor().prioritizeScan(finished.getId(), modelId);
                } catch (NoTrainedModelException e) {
                    log.warn("Приоритизация пропущена: {}", e.getMessage());
                }
            }

            ScanResults results = engine.getScanController().getScanResults(finished.getId());
            if (output != null) {
                new JsonReportGenerator().generate(results, output);
            }

            PrintStream out = System.out;
            CICDIntegration.printCISummary(results, out);
            if (ciMode) {
                CICDIntegration.printGitHubAnnotations(results, out);
            }
            return CICDIntegration.getExitCode(results, failOnHigh);
        } catch (VulnScanException e) {
            err.println("Ошибка: " + e.getMessage());
            return 2;
        }
    }

    /**
     * Остановить сканирование после таймаута ожидания. Если оно успело завершиться само,
     * возвращается его итоговое состояние.
     */
    static Scan stopAfterTimeout(IntelliVulnEngine engine, String scanId) {
        try {
            return engine.getScanController().stop(scanId);
        } catch (InvalidOperationException e) {
            Scan current = engine.getScanController().getScan(scanId);
            log.info("Сканирование {} завершилось до остановки со статусом {}", scanId, current.getStatus().value());
            return current;
        }
    }
}
