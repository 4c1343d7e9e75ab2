package com.intellivuln.core;

import com.intellivuln.adapters.AdapterResult;
import com.intellivuln.adapters.ScannerAdapter;
import com.intellivuln.adapters.ScannerAdapterRegistry;
import com.intellivuln.async.AsyncDispatcher;
import com.intellivuln.errors.ConfigurationException;
import com.intellivuln.errors.EntityNotFoundException;
import com.intellivuln.errors.InvalidOperationException;
import com.intellivuln.models.Scan;
import com.intellivuln.models.ScanDepth;
import com.intellivuln.models.ScanFrequency;
import com.intellivuln.models.ScanRequest;
import com.intellivuln.models.ScanResults;
import com.intellivuln.models.ScanStatus;
import com.intellivuln.models.ScanTarget;
import com.intellivuln.models.Severity;
import com.intellivuln.models.Vulnerability;
import com.intellivuln.normalization.FindingNormalizer;
import com.intellivuln.persistence.ScanRepository;
import com.intellivuln.persistence.VulnerabilityRepository;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Жизненный цикл сканирования: pending → running → completed | failed | stopped.
 *
 * <p>Запуск и остановка синхронны и только меняют состояние. Работа адаптера выполняется
 * один раз через AsyncDispatcher, а продолжение после нее обновляет состояние ровно один раз.
 * Остановка и обработка результата сериализуются блокировкой сканирования: результат
 * остановленного сканирования отбрасывается.</p>
 */
@Slf4j
public class ScanLifecycleController {

    private final ScanRepository scanRepository;
    private final VulnerabilityRepository vulnerabilityRepository;
    private final ScannerAdapterRegistry adapterRegistry;
    private final FindingNormalizer normalizer;
    private final AsyncDispatcher dispatcher;

    private final ConcurrentHashMap<String, Object> scanLocks = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, CompletableFuture<Scan>> inFlight = new ConcurrentHashMap<>();

    public ScanLifecycleController(ScanRepository scanRepository,
                                   VulnerabilityRepository vulnerabilityRepository,
                                   ScannerAdapterRegistry adapterRegistry,
                                   FindingNormalizer normalizer,
                                   AsyncDispatcher dispatcher) {
        this.scanRepository = scanRepository;
        this.vulnerabilityRepository = vulnerabilityRepository;
        this.adapterRegistry = adapterRegistry;
        this.normalizer = normalizer;
        this.dispatcher = dispatcher;
    }

    /**
     * Создать сканирование в состоянии pending
     *
     * @throws ConfigurationException если не указаны тип или идентификатор цели
     */
    public Scan createScan(ScanRequest request) {
        if (request == null) {
            throw new ConfigurationException("Запрос на сканирование не может быть null");
        }
        validateTarget(request.getTarget());

        LocalDateTime now = LocalDateTime.now();
        ScanTarget target = request.getTarget();
        Scan scan = Scan.builder()
            .id(UUID.randomUUID().toString())
            .name(request.getName() != null && !request.getName().isBlank()
                ? request.getName()
                : "Scan " + target.getIdentifier())
            .description(request.getDescription())
            .scannerType(request.getScannerType())
            .assetId(request.getAssetId())
            .target(ScanTarget.of(target.getType(), target.getIdentifier().trim()))
            .depth(request.getDepth() != null ? request.getDepth() : ScanDepth.NORMAL)
            .frequency(request.getFrequency() != null ? request.getFrequency() : ScanFrequency.ONCE)
            .scannerConfig(request.getScannerConfig() != null
                ? new LinkedHashMap<>(request.getScannerConfig())
                : new LinkedHashMap<>())
            .status(ScanStatus.PENDING)
            .createdAt(now)
            .updatedAt(now)
            .build();

        Scan saved = scanRepository.save(scan);
        log.info("Создано сканирование {} ({}, цель {})", saved.getId(), saved.getScannerType(), target.getIdentifier());
        return saved;
    }

    /**
     * Запустить сканирование. Переход pending → running атомарен: из двух одновременных
     * запросов успешен ровно один, второй получает InvalidOperationException.
     */
    public ScanHandle start(String scanId) {
        Scan running = scanRepository.update(scanId, scan -> {
            if (scan.getStatus() != ScanStatus.PENDING) {
                throw new InvalidOperationException(
                    "Нельзя запустить сканирование " + scanId + " в состоянии " + scan.getStatus().value());
            }
            LocalDateTime now = LocalDateTime.now();
            scan.setStatus(ScanStatus.RUNNING);
            scan.setStartedAt(now);
            scan.setUpdatedAt(now);
            scan.setStatusMessage("Сканирование запущено");
            return scan;
        });
        log.info("Сканирование {} запущено", scanId);

        Optional<ScannerAdapter> adapter = adapterRegistry.find(running.getScannerType());
        if (adapter.isEmpty()) {
            String message = "Неподдерживаемый сканер: " + running.getScannerType();
            log.error("Сканирование {}: {}", scanId, message);
            Scan failed = finish(scanId, ScanStatus.FAILED, message);
            return new ScanHandle(failed, CompletableFuture.completedFuture(failed));
        }

        ScannerAdapter scannerAdapter = adapter.get();
        Scan snapshot = running.copy();
        CompletableFuture<Scan> completion = dispatcher
            .submit("scan-" + scanId, () -> scannerAdapter.run(snapshot))
            .handle((result, error) -> complete(scanId, result, error));
        inFlight.put(scanId, completion);
        completion.whenComplete((scan, error) -> inFlight.remove(scanId, completion));
        return new ScanHandle(running, completion);
    }

    /**
     * Остановить выполняющееся сканирование. Из любого другого состояния - InvalidOperationException.
     */
    public Scan stop(String scanId) {
        synchronized (lockFor(scanId)) {
            scanRepository.update(scanId, scan -> {
                if (scan.getStatus() != ScanStatus.RUNNING) {
                    throw new InvalidOperationException(
                        "Нельзя остановить сканирование " + scanId + " в состоянии " + scan.getStatus().value());
                }
                return scan;
            });
            Scan stopped = finish(scanId, ScanStatus.STOPPED, "Сканирование остановлено");
            log.info("Сканирование {} остановлено", scanId);
            return stopped;
        }
    }

    public Scan getScan(String scanId) {
        return scanRepository.findById(scanId)
            .orElseThrow(() -> new EntityNotFoundException("Сканирование", scanId));
    }

    public List<Scan> listScans(ScanFilter filter) {
        ScanFilter effective = filter != null ? filter : ScanFilter.any();
        return scanRepository.findAll().stream()
            .filter(effective::matches)
            .collect(Collectors.toList());
    }

    /**
     * Изменить описательные поля сканирования. Выполняющееся сканирование менять нельзя.
     */
    public Scan updateScan(String scanId, ScanRequest changes) {
        if (changes == null) {
            throw new ConfigurationException("Изменения не могут быть null");
        }
        if (changes.getTarget() != null) {
            validateTarget(changes.getTarget());
        }
        synchronized (lockFor(scanId)) {
            return scanRepository.update(scanId, scan -> {
                if (scan.getStatus() == ScanStatus.RUNNING) {
                    throw new InvalidOperationException("Нельзя изменить выполняющееся сканирование " + scanId);
                }
                if (changes.getName() != null) {
                    scan.setName(changes.getName());
                }
                if (changes.getDescription() != null) {
                    scan.setDescription(changes.getDescription());
                }
                if (changes.getScannerType() != null) {
                    scan.setScannerType(changes.getScannerType());
                }
                if (changes.getAssetId() != null) {
                    scan.setAssetId(changes.getAssetId());
                }
                if (changes.getTarget() != null) {
                    scan.setTarget(ScanTarget.of(changes.getTarget().getType(), changes.getTarget().getIdentifier().trim()));
                }
                if (changes.getDepth() != null) {
                    scan.setDepth(changes.getDepth());
                }
                if (changes.getFrequency() != null) {
                    scan.setFrequency(changes.getFrequency());
                }
                if (changes.getScannerConfig() != null && !changes.getScannerConfig().isEmpty()) {
                    scan.setScannerConfig(new LinkedHashMap<>(changes.getScannerConfig()));
                }
                scan.setUpdatedAt(LocalDateTime.now());
                return scan;
            });
        }
    }

    /**
     * Удалить сканирование вместе с его находками. Выполняющееся сканирование удалить нельзя.
     */
    public void deleteScan(String scanId) {
        synchronized (lockFor(scanId)) {
            Scan scan = getScan(scanId);
            if (scan.getStatus() == ScanStatus.RUNNING) {
                throw new InvalidOperationException("Нельзя удалить выполняющееся сканирование " + scanId);
            }
            int removed = vulnerabilityRepository.deleteByScanId(scanId);
            scanRepository.delete(scanId);
            log.info("Сканирование {} удалено вместе с {} находками", scanId, removed);
        }
        scanLocks.remove(scanId);
    }

    /**
     * Сводка сканирования и его находок
     */
    public ScanResults getScanResults(String scanId) {
        Scan scan = getScan(scanId);
        List<ScanResults.VulnerabilitySummary> summaries = vulnerabilityRepository.findByScanId(scanId).stream()
            .map(ScanResults.VulnerabilitySummary::from)
            .collect(Collectors.toList());
        return ScanResults.builder()
            .scanId(scan.getId())
            .scanName(scan.getName())
            .scannerType(scan.getScannerType())
            .assetId(scan.getAssetId())
            .target(scan.getTarget() != null ? scan.getTarget().getIdentifier() : null)
            .status(scan.getStatus())
            .statusMessage(scan.getStatusMessage())
            .startedAt(scan.getStartedAt())
            .completedAt(scan.getCompletedAt())
            .totalVulnerabilities(scan.getTotalVulnerabilities())
            .criticalCount(scan.getCriticalCount())
            .highCount(scan.getHighCount())
            .mediumCount(scan.getMediumCount())
            .lowCount(scan.getLowCount())
            .vulnerabilities(summaries)
            .build();
    }

    /**
     * Дождаться завершения запущенного сканирования. Для невыполняющегося возвращает текущее состояние.
     */
    public Scan awaitCompletion(String scanId, Duration timeout) throws InterruptedException, TimeoutException {
        CompletableFuture<Scan> completion = inFlight.get(scanId);
        if (completion == null) {
            return getScan(scanId);
        }
        return new ScanHandle(null, completion).await(timeout);
    }

    /**
     * Продолжение после работы адаптера. Никогда не выбрасывает исключений: сканирование
     * в любом случае покидает состояние running.
     */
    private Scan complete(String scanId, AdapterResult result, Throwable error) {
        try {
            synchronized (lockFor(scanId)) {
                Optional<Scan> current = scanRepository.findById(scanId);
                if (current.isEmpty()) {
                    log.warn("Сканирование {} исчезло до завершения, результат отброшен", scanId);
                    return null;
                }
                if (current.get().getStatus() != ScanStatus.RUNNING) {
                    log.info("Сканирование {} уже в состоянии {}, результат адаптера отброшен",
                        scanId, current.get().getStatus().value());
                    return current.get();
                }
                if (error != null) {
                    Throwable cause = error.getCause() != null ? error.getCause() : error;
                    log.error("Сканирование {}: сбой выполнения адаптера", scanId, cause);
                    return finish(scanId, ScanStatus.FAILED, "Ошибка выполнения сканирования: " + cause.getMessage());
                }
                if (result == null || !result.isSuccess()) {
                    String message = result != null ? result.getMessage() : "Адаптер не вернул результат";
                    log.error("Сканирование {} завершилось ошибкой: {}", scanId, message);
                    return finish(scanId, ScanStatus.FAILED, message);
                }
                return persistFindings(current.get(), result);
            }
        } catch (RuntimeException e) {
            log.error("Сканирование {}: ошибка обработки завершения", scanId, e);
            try {
                return finish(scanId, ScanStatus.FAILED, "Ошибка обработки результатов: " + e.getMessage());
            } catch (RuntimeException inner) {
                log.error("Сканирование {}: не удалось сохранить статус failed", scanId, inner);
                throw inner;
            }
        }
    }

    private Scan persistFindings(Scan scan, AdapterResult result) {
        int saved = 0;
        try {
            List<Vulnerability> findings = normalizer.normalize(result.getFindings(), scan.getId(), scan.getAssetId());
            for (Vulnerability vulnerability : findings) {
                LocalDateTime now = LocalDateTime.now();
                vulnerability.setId(UUID.randomUUID().toString());
                vulnerability.setCreatedAt(now);
                vulnerability.setUpdatedAt(now);
                vulnerabilityRepository.save(vulnerability);
                saved++;
            }
        } catch (RuntimeException e) {
            // уже сохраненные находки остаются, счетчики пересчитываются по ним
            log.error("Сканирование {}: ошибка нормализации после {} находок", scan.getId(), saved, e);
            return finish(scan.getId(), ScanStatus.FAILED, "Ошибка нормализации находок: " + e.getMessage());
        }
        log.info("Сканирование {} завершено, находок: {}", scan.getId(), saved);
        return finish(scan.getId(), ScanStatus.COMPLETED, "Сканирование завершено, находок: " + saved);
    }

    /**
     * Терминальный переход с пересчетом счетчиков по сохраненным находкам
     */
    private Scan finish(String scanId, ScanStatus status, String message) {
        List<Vulnerability> findings = vulnerabilityRepository.findByScanId(scanId);
        int critical = 0;
        int high = 0;
        int medium = 0;
        int low = 0;
        for (Vulnerability finding : findings) {
            Severity severity = finding.getSeverity() != null ? finding.getSeverity() : Severity.LOW;
            switch (severity) {
                case CRITICAL -> critical++;
                case HIGH -> high++;
                case MEDIUM -> medium++;
                case LOW -> low++;
            }
        }
        final int criticalCount = critical;
        final int highCount = high;
        final int mediumCount = medium;
        final int lowCount = low;
        return scanRepository.update(scanId, scan -> {
            LocalDateTime now = LocalDateTime.now();
            scan.setStatus(status);
            scan.setStatusMessage(message);
            scan.setCompletedAt(now);
            scan.setUpdatedAt(now);
            scan.setTotalVulnerabilities(findings.size());
            scan.setCriticalCount(criticalCount);
            scan.setHighCount(highCount);
            scan.setMediumCount(mediumCount);
            scan.setLowCount(lowCount);
            return scan;
        });
    }

    private Object lockFor(String scanId) {
        return scanLocks.computeIfAbsent(scanId, id -> new Object());
    }

    private static void validateTarget(ScanTarget target) {
        if (target == null || target.getType() == null) {
            throw new ConfigurationException("Не указан тип цели сканирования");
        }
        if (target.getIdentifier() == null || target.getIdentifier().isBlank()) {
            throw new ConfigurationException("Не указан идентификатор цели сканирования");
        }
    }
}
