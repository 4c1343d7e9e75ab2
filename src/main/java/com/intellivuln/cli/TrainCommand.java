package com.intellivuln.cli;

import com.intellivuln.core.IntelliVulnEngine;
import com.intellivuln.errors.VulnScanException;
import com.intellivuln.ml.SyntheticTrainingData;
import com.intellivuln.ml.TrainingDataset;
import com.intellivuln.models.FeatureImportance;
import com.intellivuln.models.ModelMetrics;
import com.intellivuln.models.ModelStatus;
import com.intellivuln.models.TrainedModel;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Обучение модели приоритизации
 */
@Slf4j
@Command(
    name = "train",
    mixinStandardHelpOptions = true,
    description = "Обучить модель приоритизации на JSON выборке или синтетических данных"
)
public class TrainCommand implements Callable<Integer> {

    @ParentCommand
    private MainCommand parent;

    @Spec
    private CommandSpec spec;

    @Option(names = {"--dataset"}, description = "JSON выборка размеченных уязвимостей")
    private Path dataset;

    @Option(names = {"--synthetic-size"}, description = "Размер синтетической выборки, если --dataset не указан (по умолчанию 1000)")
    private int syntheticSize = 1000;

    @Option(names = {"--name"}, description = "Название модели")
    private String name = "priority-model";

    @Option(names = {"--description"}, description = "Описание модели")
    private String description;

    @Option(names = {"-P", "--param"}, description = "Гиперпараметр key=value (n_estimators, max_depth, max_nodes, node_size, learning_rate, subsample)")
    private Map<String, String> hyperparameters = new LinkedHashMap<>();

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try (IntelliVulnEngine engine = IntelliVulnEngine.create(parent.loadConfig())) {
            TrainingDataset data = dataset != null
                ? TrainingDataset.load(dataset, engine.getNormalizer())
                : SyntheticTrainingData.generate(syntheticSize, engine.getConfig().getMl().getRandomSeed());

            Map<String, Object> overrides = new LinkedHashMap<>(hyperparameters);
            TrainedModel model = engine.getModelTrainer().createModel(name, description, overrides);
            TrainedModel trained = engine.getModelTrainer().train(model.getId(), data.getRecords(), null);

            if (trained.getStatus() != ModelStatus.TRAINED) {
                err.println("Обучение не удалось: " + trained.getStatusMessage());
                return 1;
            }
            printSummary(out, trained);
            return 0;
        } catch (VulnScanException e) {
            err.println("Ошибка: " + e.getMessage());
            return 2;
        }
    }

    private static void printSummary(PrintWriter out, TrainedModel model) {
        ModelMetrics metrics = model.getMetrics();
        out.println("Model: " + model.getId() + " (" + model.getName() + ")");
        out.printf(Locale.ROOT, "Accuracy:  %.3f%n", metrics.getAccuracy());
        out.printf(Locale.ROOT, "Precision: %.3f%n", metrics.getPrecision());
        out.printf(Locale.ROOT, "Recall:    %.3f%n", metrics.getRecall());
        out.printf(Locale.ROOT, "F1:        %.3f%n", metrics.getF1Score());
        if (metrics.getRocAuc() != null) {
            out.printf(Locale.ROOT, "ROC-AUC:   %.3f%n", metrics.getRocAuc());
        }
        out.println("Top features:");
        model.getFeatureImportance().stream()
            .sorted((a, b) -> Double.compare(b.getImportance(), a.getImportance()))
            .limit(5)
            .forEach(item -> out.printf(Locale.ROOT, "  %-32s %.3f%n", item.getFeature(), item.getImportance()));
        out.flush();
    }
}
