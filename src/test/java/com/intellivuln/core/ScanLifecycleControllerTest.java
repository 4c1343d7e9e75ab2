package com.intellivuln.core;

import com.intellivuln.adapters.AdapterResult;
import com.intellivuln.adapters.FakeProcessRunner;
import com.intellivuln.adapters.ScannerAdapter;
import com.intellivuln.adapters.ScannerAdapterRegistry;
import com.intellivuln.adapters.TrivyAdapter;
import com.intellivuln.async.ExecutorAsyncDispatcher;
import com.intellivuln.config.VulnScanConfig;
import com.intellivuln.errors.ConfigurationException;
import com.intellivuln.errors.EntityNotFoundException;
import com.intellivuln.errors.InvalidOperationException;
import com.intellivuln.models.Scan;
import com.intellivuln.models.ScanRequest;
import com.intellivuln.models.ScanResults;
import com.intellivuln.models.ScanStatus;
import com.intellivuln.models.ScanTarget;
import com.intellivuln.models.ScannerKind;
import com.intellivuln.models.Severity;
import com.intellivuln.models.TargetType;
import com.intellivuln.models.Vulnerability;
import com.intellivuln.normalization.FindingNormalizer;
import com.intellivuln.persistence.InMemoryScanRepository;
import com.intellivuln.persistence.InMemoryVulnerabilityRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ScanLifecycleControllerTest {

    private static final Duration WAIT = Duration.ofSeconds(10);

    private InMemoryScanRepository scanRepository;
    private InMemoryVulnerabilityRepository vulnerabilityRepository;
    private ExecutorAsyncDispatcher dispatcher;
    private BlockingAdapter blockingAdapter;
    private ScanLifecycleController controller;

    @BeforeEach
    void setUp() throws Exception {
        scanRepository = new InMemoryScanRepository();
        vulnerabilityRepository = new InMemoryVulnerabilityRepository();
        dispatcher = new ExecutorAsyncDispatcher(4, 5);
        blockingAdapter = new BlockingAdapter();
        ScannerAdapterRegistry registry = new ScannerAdapterRegistry()
            .register(new TrivyAdapter(VulnScanConfig.defaults(), FakeProcessRunner.returningFixture("trivy-report.json")))
            .register(blockingAdapter);
        controller = new ScanLifecycleController(scanRepository, vulnerabilityRepository, registry,
            new FindingNormalizer(), dispatcher);
    }

    @AfterEach
    void tearDown() {
        blockingAdapter.release.countDown();
        dispatcher.close();
    }

    @Test
    void trivyScanCompletesWithSeverityCounts() throws Exception {
        Scan scan = controller.createScan(request("trivy", "nginx:1.21"));
        assertEquals(ScanStatus.PENDING, scan.getStatus());
        assertEquals("Scan nginx:1.21", scan.getName());

        ScanHandle handle = controller.start(scan.getId());
        assertEquals(ScanStatus.RUNNING, handle.getScan().getStatus());
        assertNotNull(handle.getScan().getStartedAt());

        Scan finished = handle.await(WAIT);

        assertEquals(ScanStatus.COMPLETED, finished.getStatus());
        assertEquals(2, finished.getTotalVulnerabilities());
        assertEquals(1, finished.getCriticalCount());
        assertEquals(0, finished.getHighCount());
        assertEquals(0, finished.getMediumCount());
        assertEquals(1, finished.getLowCount());
        assertNotNull(finished.getCompletedAt());

        List<Vulnerability> findings = vulnerabilityRepository.findByScanId(scan.getId());
        assertEquals(2, findings.size());
        Vulnerability critical = findings.stream()
            .filter(v -> v.getSeverity() == Severity.CRITICAL)
            .findFirst()
            .orElseThrow();
        assertEquals(9.8, critical.getCvssScore(), 1e-9);
        assertTrue(critical.isExploitAvailable());
        assertFalse(critical.isPatchAvailable());
        assertNotNull(critical.getId());
        assertEquals("asset-1", critical.getAssetId());

        ScanResults results = controller.getScanResults(scan.getId());
        assertTrue(results.hasCriticalVulnerabilities());
        assertEquals(2, results.getVulnerabilities().size());
    }

    @Test
    void startIsAllowedOnlyFromPending() throws Exception {
        Scan scan = controller.createScan(request("trivy", "nginx:1.21"));
        controller.start(scan.getId()).await(WAIT);

        assertThrows(InvalidOperationException.class, () -> controller.start(scan.getId()));
        assertThrows(InvalidOperationException.class, () -> controller.stop(scan.getId()),
            "Завершенное сканирование нельзя остановить");
    }

    @Test
    void stopRequiresRunningScan() {
        Scan scan = controller.createScan(request("trivy", "nginx:1.21"));

        assertThrows(InvalidOperationException.class, () -> controller.stop(scan.getId()));
        assertEquals(ScanStatus.PENDING, controller.getScan(scan.getId()).getStatus());
    }

    @Test
    void concurrentStartHasExactlyOneWinner() throws Exception {
        Scan scan = controller.createScan(request("custom", "app"));
        CountDownLatch ready = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        List<Future<Boolean>> attempts = new ArrayList<>();
        try {
            for (int i = 0; i < 8; i++) {
                Callable<Boolean> attempt = () -> {
                    ready.await();
                    try {
                        controller.start(scan.getId());
                        return true;
                    } catch (InvalidOperationException e) {
                        return false;
                    }
                };
                attempts.add(pool.submit(attempt));
            }
            ready.countDown();
            int winners = 0;
            for (Future<Boolean> attempt : attempts) {
                if (attempt.get(10, TimeUnit.SECONDS)) {
                    winners++;
                }
            }
            assertEquals(1, winners, "Запустить сканирование должен ровно один запрос");
            assertEquals(ScanStatus.RUNNING, controller.getScan(scan.getId()).getStatus());
            assertTrue(blockingAdapter.started.await(10, TimeUnit.SECONDS));
            assertEquals(1, blockingAdapter.runs, "Адаптер запускается один раз");
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void stoppedScanDiscardsLateAdapterResult() throws Exception {
        Scan scan = controller.createScan(request("custom", "app"));
        ScanHandle handle = controller.start(scan.getId());
        assertTrue(blockingAdapter.started.await(10, TimeUnit.SECONDS));

        Scan stopped = controller.stop(scan.getId());
        assertEquals(ScanStatus.STOPPED, stopped.getStatus());

        blockingAdapter.release.countDown();
        Scan afterAdapter = handle.await(WAIT);

        assertEquals(ScanStatus.STOPPED, afterAdapter.getStatus());
        assertEquals(ScanStatus.STOPPED, controller.getScan(scan.getId()).getStatus());
        assertTrue(vulnerabilityRepository.findByScanId(scan.getId()).isEmpty(),
            "Находки остановленного сканирования не сохраняются");
        assertEquals(0, controller.getScan(scan.getId()).getTotalVulnerabilities());
    }

    @Test
    void unsupportedScannerFailsImmediately() throws Exception {
        Scan scan = controller.createScan(request("nessus", "10.0.0.1"));

        ScanHandle handle = controller.start(scan.getId());

        assertTrue(handle.getCompletion().isDone());
        Scan failed = handle.await(WAIT);
        assertEquals(ScanStatus.FAILED, failed.getStatus());
        assertTrue(failed.getStatusMessage().contains("nessus"));
        assertEquals(0, failed.getTotalVulnerabilities());
    }

    @Test
    void failedAdapterResultMarksScanFailed() throws Exception {
        blockingAdapter.result = AdapterResult.failed("сканер упал");
        blockingAdapter.release.countDown();
        Scan scan = controller.createScan(request("custom", "app"));

        Scan finished = controller.start(scan.getId()).await(WAIT);

        assertEquals(ScanStatus.FAILED, finished.getStatus());
        assertEquals("сканер упал", finished.getStatusMessage());
    }

    @Test
    void adapterExceptionMarksScanFailed() throws Exception {
        blockingAdapter.failure = new IllegalStateException("boom");
        blockingAdapter.release.countDown();
        Scan scan = controller.createScan(request("custom", "app"));

        Scan finished = controller.start(scan.getId()).await(WAIT);

        assertEquals(ScanStatus.FAILED, finished.getStatus());
        assertTrue(finished.getStatusMessage().contains("boom"));
    }

    @Test
    void storageFaultKeepsSavedFindingsAndRecountsThem() throws Exception {
        SaveLimitedVulnerabilityRepository limited = new SaveLimitedVulnerabilityRepository(2);
        ScannerAdapterRegistry registry = new ScannerAdapterRegistry().register(blockingAdapter);
        ScanLifecycleController faulty = new ScanLifecycleController(scanRepository, limited, registry,
            new FindingNormalizer(), dispatcher);
        blockingAdapter.result = AdapterResult.success(List.of(
            Map.of("title", "first", "severity", "critical", "cvss_score", 9.1),
            Map.of("title", "second", "severity", "high", "cvss_score", 7.4),
            Map.of("title", "third", "severity", "low", "cvss_score", 2.2)), null);
        blockingAdapter.release.countDown();
        Scan scan = faulty.createScan(request("custom", "app"));

        Scan finished = faulty.start(scan.getId()).await(WAIT);

        assertEquals(ScanStatus.FAILED, finished.getStatus());
        assertTrue(finished.getStatusMessage().contains("диск заполнен"), finished.getStatusMessage());
        List<Vulnerability> stored = limited.findByScanId(scan.getId());
        assertEquals(2, stored.size());
        assertEquals(2, finished.getTotalVulnerabilities());
        assertEquals(1, finished.getCriticalCount());
        assertEquals(1, finished.getHighCount());
        assertEquals(0, finished.getMediumCount());
        assertEquals(0, finished.getLowCount());
    }

    @Test
    void createRejectsMissingTarget() {
        ScanRequest noTarget = ScanRequest.builder().scannerType("trivy").build();
        ScanRequest blankIdentifier = request("trivy", "  ");

        assertThrows(ConfigurationException.class, () -> controller.createScan(noTarget));
        assertThrows(ConfigurationException.class, () -> controller.createScan(blankIdentifier));
    }

    @Test
    void updateAndDeleteAreRejectedWhileRunning() throws Exception {
        Scan scan = controller.createScan(request("custom", "app"));
        controller.start(scan.getId());
        assertTrue(blockingAdapter.started.await(10, TimeUnit.SECONDS));

        ScanRequest rename = ScanRequest.builder().name("renamed").build();
        assertThrows(InvalidOperationException.class, () -> controller.updateScan(scan.getId(), rename));
        assertThrows(InvalidOperationException.class, () -> controller.deleteScan(scan.getId()));

        controller.stop(scan.getId());
        assertEquals("renamed", controller.updateScan(scan.getId(), rename).getName());
    }

    @Test
    void deleteRemovesScanAndFindings() throws Exception {
        Scan scan = controller.createScan(request("trivy", "nginx:1.21"));
        controller.start(scan.getId()).await(WAIT);
        assertEquals(2, vulnerabilityRepository.findByScanId(scan.getId()).size());

        controller.deleteScan(scan.getId());

        assertThrows(EntityNotFoundException.class, () -> controller.getScan(scan.getId()));
        assertTrue(vulnerabilityRepository.findByScanId(scan.getId()).isEmpty());
    }

    @Test
    void listScansAppliesFilter() throws Exception {
        Scan trivy = controller.createScan(request("trivy", "nginx:1.21"));
        controller.createScan(request("custom", "app"));
        controller.start(trivy.getId()).await(WAIT);

        assertEquals(2, controller.listScans(ScanFilter.any()).size());
        List<Scan> completed = controller.listScans(ScanFilter.builder().status(ScanStatus.COMPLETED).build());
        assertEquals(1, completed.size());
        assertEquals(trivy.getId(), completed.get(0).getId());
        assertEquals(1, controller.listScans(ScanFilter.builder().scannerKind(ScannerKind.CUSTOM).build()).size());
    }

    @Test
    void awaitCompletionReturnsCurrentStateForIdleScan() throws Exception {
        Scan scan = controller.createScan(request("trivy", "nginx:1.21"));

        assertEquals(ScanStatus.PENDING, controller.awaitCompletion(scan.getId(), WAIT).getStatus());
    }

    private static ScanRequest request(String scanner, String identifier) {
        TargetType type = "trivy".equals(scanner) ? TargetType.CONTAINER : TargetType.APPLICATION;
        return ScanRequest.builder()
            .scannerType(scanner)
            .assetId("asset-1")
            .target(ScanTarget.of(type, identifier))
            .build();
    }

    /**
     * Хранилище, отказывающее после заданного числа сохранений
     */
    private static class SaveLimitedVulnerabilityRepository extends InMemoryVulnerabilityRepository {
        private final int limit;
        private int saves;

        SaveLimitedVulnerabilityRepository(int limit) {
            this.limit = limit;
        }

        @Override
        public synchronized Vulnerability save(Vulnerability vulnerability) {
            if (saves >= limit) {
                throw new IllegalStateException("диск заполнен");
            }
            saves++;
            return super.save(vulnerability);
        }
    }

    /**
     * Адаптер, ожидающий разрешения перед возвратом результата
     */
    private static class BlockingAdapter implements ScannerAdapter {
        final CountDownLatch started = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);
        volatile int runs;
        volatile AdapterResult result = AdapterResult.success(
            List.of(Map.of("title", "late finding", "severity", "high")), null);
        volatile RuntimeException failure;

        @Override
        public ScannerKind kind() {
            return ScannerKind.CUSTOM;
        }

        @Override
        public AdapterResult run(Scan scan) {
            runs++;
            started.countDown();
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (failure != null) {
                throw failure;
            }
            return result;
        }
    }
}
