package com.intellivuln.ml;

import com.intellivuln.models.BusinessImpact;
import com.intellivuln.models.CategoricalAttribute;
import com.intellivuln.models.DataClassification;
import com.intellivuln.models.ExploitMaturity;
import com.intellivuln.models.Severity;
import com.intellivuln.models.SystemExposure;
import com.intellivuln.models.Vulnerability;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Детерминированное отображение уязвимости в вектор признаков фиксированного порядка.
 *
 * <p>Категории кодируются one-hot, включая явный индикатор пустого значения (suffix _unknown).
 * Порядок признаков сохраняется в модели и воспроизводится при предсказании; неизвестные
 * или отсутствующие признаки дают 0.</p>
 */
public class FeatureExtractor {

    public static final String CVSS_SCORE = "cvss_score";
    public static final String EXPLOIT_AVAILABLE = "exploit_available";
    public static final String PATCH_AVAILABLE = "patch_available";

    private static final List<Severity> SEVERITY_ORDER =
        List.of(Severity.CRITICAL, Severity.HIGH, Severity.MEDIUM, Severity.LOW);
    private static final List<ExploitMaturity> MATURITY_ORDER = List.of(ExploitMaturity.HIGH,
        ExploitMaturity.FUNCTIONAL, ExploitMaturity.POC, ExploitMaturity.UNPROVEN, ExploitMaturity.UNKNOWN);
    private static final List<BusinessImpact> IMPACT_ORDER = List.of(BusinessImpact.CRITICAL,
        BusinessImpact.HIGH, BusinessImpact.MEDIUM, BusinessImpact.LOW, BusinessImpact.UNKNOWN);
    private static final List<DataClassification> CLASSIFICATION_ORDER = List.of(DataClassification.RESTRICTED,
        DataClassification.CONFIDENTIAL, DataClassification.INTERNAL, DataClassification.PUBLIC,
        DataClassification.UNKNOWN);
    private static final List<SystemExposure> EXPOSURE_ORDER = List.of(SystemExposure.INTERNET,
        SystemExposure.INTRANET, SystemExposure.INTERNAL, SystemExposure.ISOLATED, SystemExposure.UNKNOWN);

    private static final List<String> FEATURE_NAMES = buildFeatureNames();

    private static final Map<String, String> DESCRIPTIONS = buildDescriptions();

    /**
     * Порядок признаков, используемый при обучении новых моделей
     */
    public List<String> featureNames() {
        return FEATURE_NAMES;
    }

    /**
     * Признаки уязвимости в каноническом порядке
     */
    public Map<String, Double> extract(Vulnerability vulnerability) {
        Map<String, Double> features = new LinkedHashMap<>();
        features.put(CVSS_SCORE, vulnerability.getCvssScore());
        features.put(EXPLOIT_AVAILABLE, vulnerability.isExploitAvailable() ? 1.0 : 0.0);
        features.put(PATCH_AVAILABLE, vulnerability.isPatchAvailable() ? 1.0 : 0.0);

        Severity severity = vulnerability.getSeverity() != null ? vulnerability.getSeverity() : Severity.LOW;
        for (Severity value : SEVERITY_ORDER) {
            features.put("severity_" + value.value(), value == severity ? 1.0 : 0.0);
        }
        oneHot(features, "exploit_maturity_", MATURITY_ORDER,
            orUnknown(vulnerability.getExploitMaturity(), ExploitMaturity.UNKNOWN));
        oneHot(features, "business_impact_", IMPACT_ORDER,
            orUnknown(vulnerability.getBusinessImpact(), BusinessImpact.UNKNOWN));
        oneHot(features, "data_classification_", CLASSIFICATION_ORDER,
            orUnknown(vulnerability.getDataClassification(), DataClassification.UNKNOWN));
        oneHot(features, "system_exposure_", EXPOSURE_ORDER,
            orUnknown(vulnerability.getSystemExposure(), SystemExposure.UNKNOWN));
        return features;
    }

    public double[] vectorize(Vulnerability vulnerability) {
        return vectorize(vulnerability, FEATURE_NAMES);
    }

    /**
     * Вектор в порядке сохраненных имен признаков. Неизвестное имя дает 0.
     */
    public double[] vectorize(Vulnerability vulnerability, List<String> featureNames) {
        Map<String, Double> features = extract(vulnerability);
        double[] vector = new double[featureNames.size()];
        for (int i = 0; i < vector.length; i++) {
            Double value = features.get(featureNames.get(i));
            vector[i] = value != null ? value : 0.0;
        }
        return vector;
    }

    /**
     * Описание признака для отчетов о важности, пустая строка для неизвестного
     */
    public static String describe(String feature) {
        return DESCRIPTIONS.getOrDefault(feature, "");
    }

    private static <T extends CategoricalAttribute> void oneHot(Map<String, Double> features, String prefix,
                                                                 List<T> order, T actual) {
        for (T value : order) {
            features.put(prefix + suffix(value), value == actual ? 1.0 : 0.0);
        }
    }

    private static <T> T orUnknown(T value, T unknown) {
        return value != null ? value : unknown;
    }

    private static String suffix(CategoricalAttribute value) {
        return value.isUnknown() ? "unknown" : value.value();
    }

    private static List<String> buildFeatureNames() {
        List<String> names = new ArrayList<>();
        names.add(CVSS_SCORE);
        names.add(EXPLOIT_AVAILABLE);
        names.add(PATCH_AVAILABLE);
        SEVERITY_ORDER.forEach(value -> names.add("severity_" + value.value()));
        MATURITY_ORDER.forEach(value -> names.add("exploit_maturity_" + suffix(value)));
        IMPACT_ORDER.forEach(value -> names.add("business_impact_" + suffix(value)));
        CLASSIFICATION_ORDER.forEach(value -> names.add("data_classification_" + suffix(value)));
        EXPOSURE_ORDER.forEach(value -> names.add("system_exposure_" + suffix(value)));
        return Collections.unmodifiableList(names);
    }

    private static Map<String, String> buildDescriptions() {
        Map<String, String> descriptions = new LinkedHashMap<>();
        descriptions.put(CVSS_SCORE, "Оценка CVSS, отражающая серьезность уязвимости");
        descriptions.put(EXPLOIT_AVAILABLE, "Наличие публично доступного эксплойта");
        descriptions.put(PATCH_AVAILABLE, "Наличие исправления для уязвимости");
        descriptions.put("severity_critical", "Критический уровень уязвимости");
        descriptions.put("severity_high", "Высокий уровень уязвимости");
        descriptions.put("severity_medium", "Средний уровень уязвимости");
        descriptions.put("severity_low", "Низкий уровень уязвимости");
        descriptions.put("exploit_maturity_high", "Эксплойт активно применяется");
        descriptions.put("exploit_maturity_functional", "Существует работающий эксплойт");
        descriptions.put("exploit_maturity_poc", "Существует proof-of-concept эксплойт");
        descriptions.put("exploit_maturity_unproven", "Эксплуатация не подтверждена");
        descriptions.put("exploit_maturity_unknown", "Зрелость эксплойта неизвестна");
        descriptions.put("business_impact_critical", "Критическое влияние на бизнес");
        descriptions.put("business_impact_high", "Высокое влияние на бизнес");
        descriptions.put("business_impact_medium", "Среднее влияние на бизнес");
        descriptions.put("business_impact_low", "Низкое влияние на бизнес");
        descriptions.put("business_impact_unknown", "Влияние на бизнес не оценено");
        descriptions.put("data_classification_restricted", "Система обрабатывает данные ограниченного доступа");
        descriptions.put("data_classification_confidential", "Система обрабатывает конфиденциальные данные");
        descriptions.put("data_classification_internal", "Система обрабатывает внутренние данные");
        descriptions.put("data_classification_public", "Система обрабатывает публичные данные");
        descriptions.put("data_classification_unknown", "Классификация данных неизвестна");
        descriptions.put("system_exposure_internet", "Система доступна из интернета");
        descriptions.put("system_exposure_intranet", "Система доступна из корпоративной сети");
        descriptions.put("system_exposure_internal", "Система внутренняя");
        descriptions.put("system_exposure_isolated", "Система изолирована");
        descriptions.put("system_exposure_unknown", "Сетевая доступность системы неизвестна");
        return Collections.unmodifiableMap(descriptions);
    }
}
