package com.intellivuln.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.intellivuln.core.IntelliVulnEngine;
import com.intellivuln.errors.NoTrainedModelException;
import com.intellivuln.errors.VulnScanException;
import com.intellivuln.models.PriorityPrediction;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Оценка приоритета одной уязвимости без сохранения
 */
@Slf4j
@Command(
    name = "predict",
    mixinStandardHelpOptions = true,
    description = "Оценить срочность устранения уязвимости последней (или указанной) моделью"
)
public class PredictCommand implements Callable<Integer> {

    @ParentCommand
    private MainCommand parent;

    @Spec
    private CommandSpec spec;

    @Option(names = {"--input"}, description = "JSON файл с полями находки (cvss_score, severity, ...)")
    private Path input;

    @Option(names = {"--model"}, description = "Идентификатор модели")
    private String modelId;

    @Option(names = {"--cvss"}, description = "Оценка CVSS")
    private Double cvss;

    @Option(names = {"--severity"}, description = "critical, high, medium, low")
    private String severity;

    @Option(names = {"--exploit"}, description = "Доступен эксплойт")
    private boolean exploit;

    @Option(names = {"--patch"}, description = "Доступно исправление")
    private boolean patch;

    @Option(names = {"--exploit-maturity"}, description = "unproven, poc, functional, high")
    private String exploitMaturity;

    @Option(names = {"--business-impact"}, description = "critical, high, medium, low")
    private String businessImpact;

    @Option(names = {"--data-classification"}, description = "restricted, confidential, internal, public")
    private String dataClassification;

    @Option(names = {"--exposure"}, description = "internet, intranet, internal, isolated")
    private String systemExposure;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
        try (IntelliVulnEngine engine = IntelliVulnEngine.create(parent.loadConfig())) {
            Map<String, Object> finding = input != null ? readInput(mapper) : fromOptions();
            engine.restoreModels();
            PriorityPrediction prediction = engine.getPredictor().predictAdHoc(finding, modelId);
            out.println(mapper.writeValueAsString(prediction));
            out.flush();
            return 0;
        } catch (NoTrainedModelException e) {
            err.println("Нет обученной модели. Сначала выполните: intellivuln train");
            return 3;
        } catch (VulnScanException | IOException e) {
            err.println("Ошибка: " + e.getMessage());
            return 2;
        }
    }

    private Map<String, Object> readInput(ObjectMapper mapper) throws IOException {
        return mapper.readValue(input.toFile(), new TypeReference<Map<String, Object>>() { });
    }

    private Map<String, Object> fromOptions() {
        Map<String, Object> finding = new LinkedHashMap<>();
        finding.put("title", "Ad-hoc vulnerability");
        if (cvss != null) {
            finding.put("cvss_score", cvss);
        }
        finding.put("severity", severity);
        finding.put("exploit_available", exploit);
        finding.put("patch_available", patch);
        finding.put("exploit_maturity", exploitMaturity);
        finding.put("business_impact", businessImpact);
        finding.put("data_classification", dataClassification);
        finding.put("system_exposure", systemExposure);
        return finding;
    }
}
