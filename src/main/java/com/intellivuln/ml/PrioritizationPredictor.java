package com.intellivuln.ml;

import com.intellivuln.errors.EntityNotFoundException;
import com.intellivuln.errors.ModelDataException;
import com.intellivuln.errors.NoTrainedModelException;
import com.intellivuln.models.PriorityClass;
import com.intellivuln.models.PriorityPrediction;
import com.intellivuln.models.TrainedModel;
import com.intellivuln.models.Vulnerability;
import com.intellivuln.normalization.FindingNormalizer;
import com.intellivuln.persistence.TrainedModelRepository;
import com.intellivuln.persistence.VulnerabilityRepository;
import lombok.extern.slf4j.Slf4j;
import smile.classification.GradientTreeBoost;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Оценка срочности устранения уязвимости обученной моделью с объяснением.
 *
 * <p>Каждый вызов работает с одним неизменяемым снимком модели (payload и список признаков),
 * поэтому замена модели новым обучением между чтением и использованием безопасна.</p>
 */
@Slf4j
public class PrioritizationPredictor {

    private static final int TOP_FACTORS = 3;

    private final TrainedModelRepository modelRepository;
    private final VulnerabilityRepository vulnerabilityRepository;
    private final FeatureExtractor featureExtractor;
    private final FindingNormalizer normalizer;

    private final ConcurrentHashMap<String, DecodedModel> decodedModels = new ConcurrentHashMap<>();

    public PrioritizationPredictor(TrainedModelRepository modelRepository,
                                   VulnerabilityRepository vulnerabilityRepository,
                                   FeatureExtractor featureExtractor,
                                   FindingNormalizer normalizer) {
        this.modelRepository = modelRepository;
        this.vulnerabilityRepository = vulnerabilityRepository;
        this.featureExtractor = featureExtractor;
        this.normalizer = normalizer;
    }

    /**
     * score &gt;= 0.8 critical, &gt;= 0.6 high, &gt;= 0.4 medium, иначе low
     */
    public static PriorityClass getPriorityClass(double score) {
        return PriorityClass.fromScore(score);
    }

    /**
     * Уверенность: насколько оценка удалена от 0.5
     */
    public static double getConfidence(double score) {
        return Math.min(1.0, Math.max(0.0, Math.abs(score - 0.5) * 2));
    }

    /**
     * Явная модель, если она обучена и имеет payload; иначе последняя обученная.
     *
     * @throws NoTrainedModelException если обученных моделей нет
     */
    public TrainedModel selectModel(String modelId) {
        if (modelId != null) {
            Optional<TrainedModel> explicit = modelRepository.findById(modelId);
            if (explicit.isPresent() && explicit.get().isUsable()) {
                return explicit.get();
            }
            log.warn("Модель {} недоступна для предсказания, используется последняя обученная", modelId);
        }
        return modelRepository.findLatestTrained()
            .orElseThrow(() -> new NoTrainedModelException("Нет обученной модели для приоритизации"));
    }

    public PriorityPrediction predict(Vulnerability vulnerability, String modelId) {
        TrainedModel model = selectModel(modelId);
        List<String> featureNames = model.getFeatureNames();
        if (featureNames == null || featureNames.isEmpty()) {
            throw new ModelDataException("У модели " + model.getId() + " нет списка признаков");
        }

        double[] vector = featureExtractor.vectorize(vulnerability, featureNames);
        double score = SmileFrames.urgentProbability(decode(model), vector, featureNames);
        PriorityClass priorityClass = getPriorityClass(score);

        Map<String, Double> contributions = new LinkedHashMap<>();
        for (int i = 0; i < featureNames.size(); i++) {
            contributions.put(featureNames.get(i), model.importanceOf(featureNames.get(i)) * vector[i]);
        }

        return PriorityPrediction.builder()
            .vulnerabilityId(vulnerability.getId())
            .modelId(model.getId())
            .priorityScore(score)
            .priorityClass(priorityClass)
            .confidence(getConfidence(score))
            .featureContributions(contributions)
            .explanation(explain(score, priorityClass, contributions, vulnerability))
            .recommendedAction(priorityClass.getRecommendedAction())
            .build();
    }

    /**
     * Предсказание для сырой находки без сохранения. Отсутствующие поля получают значения по умолчанию.
     */
    public PriorityPrediction predictAdHoc(Map<String, Object> rawFinding, String modelId) {
        Vulnerability vulnerability = normalizer.normalizeOne(rawFinding, null, null);
        return predict(vulnerability, modelId);
    }

    /**
     * Предсказать и сохранить оценку, класс и объяснение в уязвимости
     */
    public PriorityPrediction predictAndStore(String vulnerabilityId, String modelId) {
        Vulnerability vulnerability = vulnerabilityRepository.findById(vulnerabilityId)
            .orElseThrow(() -> new EntityNotFoundException("Уязвимость", vulnerabilityId));
        PriorityPrediction prediction = predict(vulnerability, modelId);
        vulnerabilityRepository.update(vulnerabilityId, stored -> {
            stored.setPriorityScore(prediction.getPriorityScore());
            stored.setPriorityClass(prediction.getPriorityClass());
            stored.setPriorityExplanation(prediction.getExplanation());
            stored.setUpdatedAt(LocalDateTime.now());
            return stored;
        });
        return prediction;
    }

    /**
     * Оценить все находки сканирования. Результат отсортирован по убыванию оценки.
     */
    public List<PriorityPrediction> prioritizeScan(String scanId, String modelId) {
        TrainedModel model = selectModel(modelId);
        List<PriorityPrediction> predictions = new ArrayList<>();
        for (Vulnerability vulnerability : vulnerabilityRepository.findByScanId(scanId)) {
            predictions.add(predictAndStore(vulnerability.getId(), model.getId()));
        }
        log.info("Сканирование {}: оценено находок {} моделью {}", scanId, predictions.size(), model.getId());
        return predictions.stream()
            .sorted(Comparator.comparingDouble(PriorityPrediction::getPriorityScore).reversed())
            .collect(Collectors.toList());
    }

    private GradientTreeBoost decode(TrainedModel model) {
        DecodedModel cached = decodedModels.get(model.getId());
        if (cached != null && Objects.equals(cached.trainingDate, model.getTrainingDate())) {
            return cached.model;
        }
        GradientTreeBoost decoded = ModelCodec.decode(model.getPayload());
        decodedModels.put(model.getId(), new DecodedModel(model.getTrainingDate(), decoded));
        return decoded;
    }

    static String explain(double score, PriorityClass priorityClass, Map<String, Double> contributions,
                          Vulnerability vulnerability) {
        StringBuilder explanation = new StringBuilder();
        explanation.append(String.format(Locale.ROOT,
            "Уязвимость отнесена к приоритету %s с оценкой %.2f.", priorityClass.value(), score));

        List<String> factors = contributions.entrySet().stream()
            .sorted(Comparator.comparingDouble((Map.Entry<String, Double> e) -> Math.abs(e.getValue())).reversed())
            .limit(TOP_FACTORS)
            .filter(entry -> entry.getValue() > 0.0)
            .map(entry -> describeFactor(entry.getKey(), vulnerability))
            .filter(Objects::nonNull)
            .collect(Collectors.toList());

        if (!factors.isEmpty()) {
            explanation.append(" Основные факторы: ").append(String.join(", ", factors)).append('.');
        }
        return explanation.toString();
    }

    private static String describeFactor(String feature, Vulnerability vulnerability) {
        if (FeatureExtractor.CVSS_SCORE.equals(feature)) {
            return String.format(Locale.ROOT, "оценка CVSS (%.1f)", vulnerability.getCvssScore());
        }
        if (FeatureExtractor.EXPLOIT_AVAILABLE.equals(feature)) {
            return "доступен публичный эксплойт";
        }
        if (FeatureExtractor.PATCH_AVAILABLE.equals(feature)) {
            return "доступно исправление";
        }
        if (feature.startsWith("severity_")) {
            return "уровень " + feature.substring("severity_".length());
        }
        if (feature.startsWith("exploit_maturity_")) {
            return "зрелость эксплойта " + feature.substring("exploit_maturity_".length());
        }
        if (feature.startsWith("business_impact_")) {
            return "влияние на бизнес " + feature.substring("business_impact_".length());
        }
        if (feature.startsWith("data_classification_")) {
            return "классификация данных " + feature.substring("data_classification_".length());
        }
        if (feature.startsWith("system_exposure_")) {
            return "доступность системы " + feature.substring("system_exposure_".length());
        }
        return null;
    }

    private static final class DecodedModel {
        final LocalDateTime trainingDate;
        final GradientTreeBoost model;

        DecodedModel(LocalDateTime trainingDate, GradientTreeBoost model) {
            this.trainingDate = trainingDate;
            this.model = model;
        }
    }
}
