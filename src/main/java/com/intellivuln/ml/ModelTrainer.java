package com.intellivuln.ml;

import com.intellivuln.async.AsyncDispatcher;
import com.intellivuln.config.VulnScanConfig;
import com.intellivuln.errors.EntityNotFoundException;
import com.intellivuln.errors.InvalidOperationException;
import com.intellivuln.errors.ModelDataException;
import com.intellivuln.models.FeatureImportance;
import com.intellivuln.models.ModelMetrics;
import com.intellivuln.models.ModelStatus;
import com.intellivuln.models.TrainedModel;
import com.intellivuln.persistence.ModelArtifactStore;
import com.intellivuln.persistence.TrainedModelRepository;
import lombok.extern.slf4j.Slf4j;
import smile.classification.GradientTreeBoost;
import smile.math.MathEx;
import smile.validation.metric.AUC;
import smile.validation.metric.Accuracy;
import smile.validation.metric.ConfusionMatrix;
import smile.validation.metric.FScore;
import smile.validation.metric.Precision;
import smile.validation.metric.Recall;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.stream.Collectors;

/**
 * Обучение моделей приоритизации на градиентном бустинге Smile.
 *
 * <p>Перевод модели в training выполняется атомарно и служит захватом: второй тренер,
 * увидевший training, получает InvalidOperationException. Сам фит идет вне вызывающего
 * потока; по завершении модель переходит в trained с payload или в error без изменения
 * прежнего payload.</p>
 */
@Slf4j
public class ModelTrainer {

    private final VulnScanConfig.Ml settings;
    private final TrainedModelRepository modelRepository;
    private final ModelArtifactStore artifactStore;
    private final FeatureExtractor featureExtractor;
    private final AsyncDispatcher dispatcher;

    /**
     * @param artifactStore хранилище артефактов; null - только репозиторий
     */
    public ModelTrainer(VulnScanConfig config,
                        TrainedModelRepository modelRepository,
                        ModelArtifactStore artifactStore,
                        FeatureExtractor featureExtractor,
                        AsyncDispatcher dispatcher) {
        this.settings = config.ensureDefaults().getMl();
        this.modelRepository = modelRepository;
        this.artifactStore = artifactStore;
        this.featureExtractor = featureExtractor;
        this.dispatcher = dispatcher;
    }

    /**
     * Создать пустую модель в статусе created
     */
    public TrainedModel createModel(String name, String description, Map<String, Object> hyperparameters) {
        Hyperparameters resolved = Hyperparameters.resolve(settings.getHyperparameters(), hyperparameters);
        LocalDateTime now = LocalDateTime.now();
        TrainedModel model = TrainedModel.builder()
            .id(UUID.randomUUID().toString())
            .name(name != null && !name.isBlank() ? name : "priority-model")
            .description(description)
            .hyperparameters(resolved.toMap())
            .status(ModelStatus.CREATED)
            .createdAt(now)
            .updatedAt(now)
            .build();
        TrainedModel saved = modelRepository.save(model);
        log.info("Создана модель {} ({})", saved.getId(), saved.getName());
        return saved;
    }

    /**
     * Захватить модель и запустить обучение асинхронно.
     * Конфликты состояния выбрасываются синхронно; ошибки обучения отражаются в статусе error.
     */
    public CompletableFuture<TrainedModel> trainAsync(String modelId, List<TrainingRecord> records,
                                                      Map<String, Object> hyperparameterOverrides) {
        // снимок до захвата: после перевода в training любой сбой обязан закончиться статусом error
        List<TrainingRecord> snapshot = records != null
            ? records.stream().filter(Objects::nonNull).collect(Collectors.toList())
            : List.of();
        TrainedModel claimed = claim(modelId, hyperparameterOverrides);
        try {
            Hyperparameters hyperparameters = Hyperparameters.resolve(claimed.getHyperparameters());
            return dispatcher.submit("train-" + modelId, () -> fit(claimed, snapshot, hyperparameters))
                .exceptionally(error -> markError(modelId, "Задача обучения не выполнена: " + error.getMessage()));
        } catch (RuntimeException e) {
            log.error("Не удалось запустить обучение модели {}", modelId, e);
            return CompletableFuture.completedFuture(markError(modelId, "Обучение не запущено: " + e.getMessage()));
        }
    }

    /**
     * Синхронный вариант trainAsync: возвращает модель в статусе trained или error
     */
    public TrainedModel train(String modelId, List<TrainingRecord> records,
                              Map<String, Object> hyperparameterOverrides) {
        try {
            return trainAsync(modelId, records, hyperparameterOverrides).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new ModelDataException("Обучение модели " + modelId + " прервано: " + cause.getMessage(), cause);
        }
    }

    /**
     * Метрики сохраненной модели на новых размеченных данных
     */
    public ModelMetrics evaluate(String modelId, List<TrainingRecord> records) {
        TrainedModel model = requireUsable(modelId);
        List<TrainingRecord> labeled = labeled(records);
        if (labeled.isEmpty()) {
            throw new ModelDataException("Нет размеченных записей для оценки модели " + modelId);
        }
        GradientTreeBoost decoded = ModelCodec.decode(model.getPayload());
        List<String> featureNames = model.getFeatureNames();
        int[] truth = new int[labeled.size()];
        int[] predicted = new int[labeled.size()];
        double[] probabilities = new double[labeled.size()];
        for (int i = 0; i < labeled.size(); i++) {
            TrainingRecord record = labeled.get(i);
            truth[i] = record.label(settings.getLabelThreshold());
            probabilities[i] = SmileFrames.urgentProbability(decoded,
                featureExtractor.vectorize(record.getVulnerability(), featureNames), featureNames);
            predicted[i] = probabilities[i] >= 0.5 ? 1 : 0;
        }
        ModelMetrics metrics = metrics(truth, predicted, probabilities);
        metrics.setDatasetSize(labeled.size());
        metrics.setTestSize(labeled.size());
        log.info("Оценка модели {}: accuracy={}, f1={}", modelId, metrics.getAccuracy(), metrics.getF1Score());
        return metrics;
    }

    /**
     * Важность признаков не ниже порога, по убыванию, с описаниями
     */
    public List<FeatureImportance> featureImportance(String modelId) {
        TrainedModel model = requireUsable(modelId);
        double threshold = settings.getImportanceThreshold();
        return model.getFeatureImportance().stream()
            .filter(item -> item.getImportance() >= threshold)
            .sorted(Comparator.comparingDouble(FeatureImportance::getImportance).reversed())
            .collect(Collectors.toList());
    }

    private TrainedModel requireUsable(String modelId) {
        TrainedModel model = modelRepository.findById(modelId)
            .orElseThrow(() -> new EntityNotFoundException("Модель", modelId));
        if (!model.isUsable()) {
            throw new InvalidOperationException("Модель " + modelId + " не обучена (статус " + model.getStatus().value() + ")");
        }
        return model;
    }

    private TrainedModel claim(String modelId, Map<String, Object> overrides) {
        List<String> featureNames = featureExtractor.featureNames();
        return modelRepository.update(modelId, model -> {
            if (model.getStatus() == ModelStatus.TRAINING) {
                throw new InvalidOperationException("Модель " + modelId + " уже обучается");
            }
            if (model.hasPayload() && !featureNames.equals(model.getFeatureNames())) {
                throw new InvalidOperationException("Набор признаков модели " + modelId
                    + " отличается от текущего; создайте новую модель");
            }
            Hyperparameters resolved = Hyperparameters.resolve(model.getHyperparameters(), overrides);
            model.setHyperparameters(resolved.toMap());
            model.setStatus(ModelStatus.TRAINING);
            model.setStatusMessage("Обучение запущено");
            model.setUpdatedAt(LocalDateTime.now());
            return model;
        });
    }

    private TrainedModel fit(TrainedModel claimed, List<TrainingRecord> records, Hyperparameters hyperparameters) {
        String modelId = claimed.getId();
        long started = System.currentTimeMillis();
        try {
            Outcome outcome = fitAndEvaluate(records, hyperparameters);
            byte[] payload = ModelCodec.encode(outcome.model);
            LocalDateTime now = LocalDateTime.now();

            TrainedModel candidate = claimed.copy();
            candidate.setFeatureNames(new ArrayList<>(featureExtractor.featureNames()));
            candidate.setHyperparameters(hyperparameters.toMap());
            candidate.setMetrics(outcome.metrics);
            candidate.setFeatureImportance(outcome.importance);
            candidate.setPayload(payload);
            candidate.setStatus(ModelStatus.TRAINED);
            candidate.setStatusMessage("Модель обучена");
            candidate.setTrainingDate(now);
            candidate.setUpdatedAt(now);
            if (artifactStore != null) {
                artifactStore.store(candidate);
            }

            TrainedModel trained = modelRepository.update(modelId, model -> candidate);
            log.info("Модель {} обучена за {} мс: accuracy={}, f1={}", modelId,
                System.currentTimeMillis() - started, outcome.metrics.getAccuracy(), outcome.metrics.getF1Score());
            return trained;
        } catch (Exception e) {
            log.error("Ошибка обучения модели {}", modelId, e);
            return markError(modelId, "Ошибка обучения: " + e.getMessage());
        }
    }

    /**
     * Перевести модель в error. Payload и признаки прежнего обучения не меняются.
     */
    private TrainedModel markError(String modelId, String message) {
        return modelRepository.update(modelId, model -> {
            model.setStatus(ModelStatus.ERROR);
            model.setStatusMessage(message);
            model.setUpdatedAt(LocalDateTime.now());
            return model;
        });
    }

    private Outcome fitAndEvaluate(List<TrainingRecord> records, Hyperparameters hyperparameters) {
        List<TrainingRecord> labeled = labeled(records);
        if (labeled.isEmpty()) {
            throw new ModelDataException("Пустая обучающая выборка");
        }
        if (labeled.size() < settings.getMinTrainingRecords()) {
            throw new ModelDataException("Недостаточно записей для обучения: " + labeled.size()
                + " (минимум " + settings.getMinTrainingRecords() + ")");
        }

        List<String> featureNames = featureExtractor.featureNames();
        double[][] x = new double[labeled.size()][];
        int[] y = new int[labeled.size()];
        for (int i = 0; i < labeled.size(); i++) {
            x[i] = featureExtractor.vectorize(labeled.get(i).getVulnerability(), featureNames);
            y[i] = labeled.get(i).label(settings.getLabelThreshold());
        }

        Split split = stratifiedSplit(y, settings.getTestSize(), settings.getRandomSeed());
        int[] trainLabels = select(y, split.train);
        if (distinct(trainLabels) < 2) {
            throw new ModelDataException("Обучающая выборка содержит только один класс");
        }

        MathEx.setSeed(settings.getRandomSeed());
        GradientTreeBoost model = GradientTreeBoost.fit(SmileFrames.FORMULA,
            SmileFrames.frame(select(x, split.train), trainLabels, featureNames),
            hyperparameters.getNEstimators(),
            hyperparameters.getMaxDepth(),
            hyperparameters.getMaxNodes(),
            hyperparameters.getNodeSize(),
            hyperparameters.getLearningRate(),
            hyperparameters.getSubsample());

        // без отложенной выборки метрики считаются на обучающей
        int[] evalIndex = split.test.length > 0 ? split.test : split.train;
        int[] truth = select(y, evalIndex);
        int[] predicted = new int[evalIndex.length];
        double[] probabilities = new double[evalIndex.length];
        for (int i = 0; i < evalIndex.length; i++) {
            probabilities[i] = SmileFrames.urgentProbability(model, x[evalIndex[i]], featureNames);
            predicted[i] = probabilities[i] >= 0.5 ? 1 : 0;
        }
        ModelMetrics metrics = metrics(truth, predicted, probabilities);
        metrics.setDatasetSize(labeled.size());
        metrics.setTrainingSize(split.train.length);
        metrics.setTestSize(split.test.length);

        return new Outcome(model, metrics, importance(model.importance(), featureNames));
    }

    static ModelMetrics metrics(int[] truth, int[] predicted, double[] probabilities) {
        Double auc = null;
        if (distinct(truth) == 2) {
            auc = finite(AUC.of(truth, probabilities));
        }
        return ModelMetrics.builder()
            .accuracy(finite(Accuracy.of(truth, predicted)))
            .precision(finite(Precision.of(truth, predicted)))
            .recall(finite(Recall.of(truth, predicted)))
            .f1Score(finite(FScore.F1.score(truth, predicted)))
            .confusionMatrix(confusionMatrix(truth, predicted))
            .rocAuc(auc)
            .build();
    }

    private static int[][] confusionMatrix(int[] truth, int[] predicted) {
        int[][] matrix = new int[2][2];
        ConfusionMatrix confusion = ConfusionMatrix.of(truth, predicted);
        int[][] raw = confusion.matrix;
        // Smile строит матрицу только по встреченным классам; приводим к 2x2
        if (raw.length == 2) {
            for (int i = 0; i < 2; i++) {
                System.arraycopy(raw[i], 0, matrix[i], 0, 2);
            }
            return matrix;
        }
        for (int i = 0; i < truth.length; i++) {
            matrix[truth[i]][predicted[i]]++;
        }
        return matrix;
    }

    /**
     * Нормированная важность (сумма равна 1) с описаниями признаков
     */
    static List<FeatureImportance> importance(double[] raw, List<String> featureNames) {
        double total = 0.0;
        for (double value : raw) {
            total += Math.max(0.0, value);
        }
        List<FeatureImportance> result = new ArrayList<>();
        for (int i = 0; i < featureNames.size(); i++) {
            double value = i < raw.length ? Math.max(0.0, raw[i]) : 0.0;
            String feature = featureNames.get(i);
            result.add(new FeatureImportance(feature, total > 0.0 ? value / total : 0.0,
                FeatureExtractor.describe(feature)));
        }
        return result;
    }

    /**
     * Стратифицированное разбиение с фиксированным seed. В обучающей части остается
     * хотя бы одна запись каждого класса.
     */
    static Split stratifiedSplit(int[] labels, double testSize, long seed) {
        Map<Integer, List<Integer>> byClass = new LinkedHashMap<>();
        for (int i = 0; i < labels.length; i++) {
            byClass.computeIfAbsent(labels[i], key -> new ArrayList<>()).add(i);
        }
        Random random = new Random(seed);
        List<Integer> train = new ArrayList<>();
        List<Integer> test = new ArrayList<>();
        for (List<Integer> indices : byClass.values()) {
            Collections.shuffle(indices, random);
            int testCount = (int) Math.round(indices.size() * testSize);
            testCount = Math.min(testCount, indices.size() - 1);
            test.addAll(indices.subList(0, testCount));
            train.addAll(indices.subList(testCount, indices.size()));
        }
        Collections.sort(train);
        Collections.sort(test);
        return new Split(train.stream().mapToInt(Integer::intValue).toArray(),
            test.stream().mapToInt(Integer::intValue).toArray());
    }

    private List<TrainingRecord> labeled(List<TrainingRecord> records) {
        List<TrainingRecord> result = new ArrayList<>();
        if (records == null) {
            return result;
        }
        int skipped = 0;
        for (TrainingRecord record : records) {
            if (record != null && record.getVulnerability() != null && record.isLabeled()) {
                result.add(record);
            } else {
                skipped++;
            }
        }
        if (skipped > 0) {
            log.warn("Пропущено записей без метки: {}", skipped);
        }
        return result;
    }

    private static int[] select(int[] values, int[] index) {
        int[] result = new int[index.length];
        for (int i = 0; i < index.length; i++) {
            result[i] = values[index[i]];
        }
        return result;
    }

    private static double[][] select(double[][] values, int[] index) {
        double[][] result = new double[index.length][];
        for (int i = 0; i < index.length; i++) {
            result[i] = values[index[i]];
        }
        return result;
    }

    private static int distinct(int[] values) {
        return (int) java.util.Arrays.stream(values).distinct().count();
    }

    private static double finite(double value) {
        return Double.isNaN(value) || Double.isInfinite(value) ? 0.0 : value;
    }

    static final class Split {
        final int[] train;
        final int[] test;

        Split(int[] train, int[] test) {
            this.train = train;
            this.test = test;
        }
    }

    private static final class Outcome {
        final GradientTreeBoost model;
        final ModelMetrics metrics;
        final List<FeatureImportance> importance;

        Outcome(GradientTreeBoost model, ModelMetrics metrics, List<FeatureImportance> importance) {
            this.model = model;
            this.metrics = metrics;
            this.importance = importance;
        }
    }
}
