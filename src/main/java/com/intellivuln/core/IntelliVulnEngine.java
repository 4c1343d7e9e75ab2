package com.intellivuln.core;

import com.intellivuln.adapters.DefaultProcessRunner;
import com.intellivuln.adapters.ProcessRunner;
import com.intellivuln.adapters.ScannerAdapterRegistry;
import com.intellivuln.async.AsyncDispatcher;
import com.intellivuln.async.ExecutorAsyncDispatcher;
import com.intellivuln.config.VulnScanConfig;
import com.intellivuln.ml.FeatureExtractor;
import com.intellivuln.ml.ModelTrainer;
import com.intellivuln.ml.PrioritizationPredictor;
import com.intellivuln.ml.TrainingDataset;
import com.intellivuln.models.TrainedModel;
import com.intellivuln.models.Vulnerability;
import com.intellivuln.normalization.FindingNormalizer;
import com.intellivuln.persistence.FileSystemModelArtifactStore;
import com.intellivuln.persistence.InMemoryScanRepository;
import com.intellivuln.persistence.InMemoryTrainedModelRepository;
import com.intellivuln.persistence.InMemoryVulnerabilityRepository;
import com.intellivuln.persistence.ModelArtifactStore;
import com.intellivuln.persistence.ScanRepository;
import com.intellivuln.persistence.TrainedModelRepository;
import com.intellivuln.persistence.VulnerabilityRepository;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Сборка компонентов движка: репозитории, адаптеры, контроллер сканирований, тренер и предсказатель
 */
@Slf4j
@Getter
public class IntelliVulnEngine implements AutoCloseable {

    private final VulnScanConfig config;
    private final ScanRepository scanRepository;
    private final VulnerabilityRepository vulnerabilityRepository;
    private final TrainedModelRepository modelRepository;
    private final ModelArtifactStore artifactStore;
    private final AsyncDispatcher dispatcher;
    private final ScannerAdapterRegistry adapterRegistry;
    private final FindingNormalizer normalizer;
    private final FeatureExtractor featureExtractor;
    private final ScanLifecycleController scanController;
    private final ModelTrainer modelTrainer;
    private final PrioritizationPredictor predictor;

    public IntelliVulnEngine(VulnScanConfig config, ScannerAdapterRegistry adapterRegistry,
                             ModelArtifactStore artifactStore, AsyncDispatcher dispatcher) {
        this.config = config.ensureDefaults();
        this.scanRepository = new InMemoryScanRepository();
        this.vulnerabilityRepository = new InMemoryVulnerabilityRepository();
        this.modelRepository = new InMemoryTrainedModelRepository();
        this.artifactStore = artifactStore;
        this.dispatcher = dispatcher;
        this.adapterRegistry = adapterRegistry;
        this.normalizer = new FindingNormalizer();
        this.featureExtractor = new FeatureExtractor();
        this.scanController = new ScanLifecycleController(scanRepository, vulnerabilityRepository,
            adapterRegistry, normalizer, dispatcher);
        this.modelTrainer = new ModelTrainer(this.config, modelRepository, artifactStore, featureExtractor, dispatcher);
        this.predictor = new PrioritizationPredictor(modelRepository, vulnerabilityRepository,
            featureExtractor, normalizer);
    }

    /**
     * Движок со встроенными адаптерами, пулом из конфигурации и артефактами в ml.modelDir
     */
    public static IntelliVulnEngine create(VulnScanConfig config) {
        return create(config, new DefaultProcessRunner());
    }

    public static IntelliVulnEngine create(VulnScanConfig config, ProcessRunner processRunner) {
        VulnScanConfig effective = config.ensureDefaults();
        AsyncDispatcher dispatcher = new ExecutorAsyncDispatcher(effective.getWorkers().getPoolSize(),
            effective.getWorkers().getShutdownTimeoutSec());
        ModelArtifactStore store = new FileSystemModelArtifactStore(Path.of(effective.getMl().getModelDir()));
        return new IntelliVulnEngine(effective, ScannerAdapterRegistry.withDefaults(effective, processRunner),
            store, dispatcher);
    }

    /**
     * Загрузить сохраненные модели из хранилища артефактов
     *
     * @return число восстановленных моделей
     */
    public int restoreModels() {
        if (artifactStore == null) {
            return 0;
        }
        try {
            List<TrainedModel> stored = artifactStore.loadAll();
            for (TrainedModel model : stored) {
                modelRepository.save(model);
            }
            if (!stored.isEmpty()) {
                log.info("Восстановлено моделей из хранилища: {}", stored.size());
            }
            return stored.size();
        } catch (IOException e) {
            log.warn("Не удалось восстановить модели из хранилища: {}", e.getMessage());
            return 0;
        }
    }

    /**
     * Выборка из накопленной истории уязвимостей: всех или только одного актива
     */
    public TrainingDataset historicalDataset(String assetId) {
        List<Vulnerability> history = assetId != null
            ? vulnerabilityRepository.findByAssetId(assetId)
            : vulnerabilityRepository.findAll();
        TrainingDataset dataset = TrainingDataset.fromVulnerabilities(history);
        log.info("История для обучения{}: {} уязвимостей, с оценкой приоритета {}",
            assetId != null ? " (актив " + assetId + ")" : "", history.size(), dataset.size());
        return dataset;
    }

    /**
     * Переобучить модель на сохраненных уязвимостях с оценкой приоритета.
     * Недостаток истории отражается статусом error, как и при обычном обучении.
     */
    public TrainedModel trainFromHistory(String modelId, String assetId, Map<String, Object> hyperparameterOverrides) {
        return modelTrainer.train(modelId, historicalDataset(assetId).getRecords(), hyperparameterOverrides);
    }

    @Override
    public void close() {
        dispatcher.close();
    }
}
