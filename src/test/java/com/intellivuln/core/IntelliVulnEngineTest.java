package com.intellivuln.core;

import com.intellivuln.adapters.FakeProcessRunner;
import com.intellivuln.config.VulnScanConfig;
import com.intellivuln.ml.SyntheticTrainingData;
import com.intellivuln.ml.TrainingRecord;
import com.intellivuln.models.ModelStatus;
import com.intellivuln.models.PriorityPrediction;
import com.intellivuln.models.Scan;
import com.intellivuln.models.ScanRequest;
import com.intellivuln.models.ScanStatus;
import com.intellivuln.models.ScanTarget;
import com.intellivuln.models.TargetType;
import com.intellivuln.models.TrainedModel;
import com.intellivuln.models.Vulnerability;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class IntelliVulnEngineTest {

    @TempDir
    Path modelDir;

    @Test
    void scanTrainAndPrioritizeEndToEnd() throws Exception {
        VulnScanConfig config = VulnScanConfig.defaults();
        config.getMl().setModelDir(modelDir.toString());
        String modelId;

        try (IntelliVulnEngine engine = IntelliVulnEngine.create(config,
                FakeProcessRunner.returningFixture("trivy-report.json"))) {
            Scan scan = engine.getScanController().createScan(ScanRequest.builder()
                .scannerType("trivy")
                .target(ScanTarget.of(TargetType.CONTAINER, "nginx:1.21"))
                .build());
            Scan finished = engine.getScanController().start(scan.getId()).await(Duration.ofSeconds(10));
            assertEquals(ScanStatus.COMPLETED, finished.getStatus());

            TrainedModel model = engine.getModelTrainer().createModel("e2e", null, Map.of("n_estimators", 40));
            TrainedModel trained = engine.getModelTrainer()
                .train(model.getId(), SyntheticTrainingData.generate(400, 42L).getRecords(), null);
            assertEquals(ModelStatus.TRAINED, trained.getStatus(), trained.getStatusMessage());
            modelId = trained.getId();

            List<PriorityPrediction> predictions = engine.getPredictor().prioritizeScan(scan.getId(), null);

            assertEquals(2, predictions.size());
            Vulnerability top = engine.getVulnerabilityRepository()
                .findById(predictions.get(0).getVulnerabilityId())
                .orElseThrow();
            assertEquals("CVE-2022-37434", top.getCveId(), "Критичная находка с эксплойтом первая");
            assertNotNull(top.getPriorityClass());
            assertNotNull(top.getPriorityExplanation());
        }

        try (IntelliVulnEngine restarted = IntelliVulnEngine.create(config)) {
            assertEquals(1, restarted.restoreModels());
            assertEquals(modelId, restarted.getPredictor().selectModel(null).getId());
        }
    }

    @Test
    void retrainsModelFromStoredHistory() {
        VulnScanConfig config = VulnScanConfig.defaults();
        config.getMl().setModelDir(modelDir.toString());

        try (IntelliVulnEngine engine = IntelliVulnEngine.create(config, FakeProcessRunner.returningStdout("{}"))) {
            List<TrainingRecord> synthetic = SyntheticTrainingData.generate(300, 11L).getRecords();
            for (int i = 0; i < synthetic.size(); i++) {
                Vulnerability vulnerability = synthetic.get(i).getVulnerability().copy();
                vulnerability.setId("hist-" + i);
                vulnerability.setAssetId(i % 3 == 0 ? "asset-a" : "asset-b");
                vulnerability.setPriorityScore(synthetic.get(i).getPriorityScore());
                engine.getVulnerabilityRepository().save(vulnerability);
            }
            engine.getVulnerabilityRepository().save(Vulnerability.builder().id("unscored").cvssScore(7.0).build());

            assertEquals(300, engine.historicalDataset(null).size());
            assertEquals(100, engine.historicalDataset("asset-a").size());

            TrainedModel model = engine.getModelTrainer().createModel("history", null, Map.of("n_estimators", 30));
            TrainedModel trained = engine.trainFromHistory(model.getId(), null, null);

            assertEquals(ModelStatus.TRAINED, trained.getStatus(), trained.getStatusMessage());
            assertEquals(300, trained.getMetrics().getDatasetSize());

            TrainedModel unknownAsset = engine.trainFromHistory(model.getId(), "asset-missing", null);
            assertEquals(ModelStatus.ERROR, unknownAsset.getStatus());
            assertTrue(unknownAsset.hasPayload(), "Прежний payload сохраняется");
        }
    }
}
