package com.intellivuln.persistence;

import com.intellivuln.models.ModelMetrics;
import com.intellivuln.models.ModelStatus;
import com.intellivuln.models.TrainedModel;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileSystemModelArtifactStoreTest {

    @TempDir
    Path directory;

    @Test
    void storesPayloadAndMetadataSeparately() throws Exception {
        FileSystemModelArtifactStore store = new FileSystemModelArtifactStore(directory.resolve("models"));
        TrainedModel model = model("m1");

        store.store(model);

        assertArrayEquals(new byte[]{10, 20, 30}, store.loadPayload("m1").orElseThrow());
        TrainedModel metadata = store.loadMetadata("m1").orElseThrow();
        assertEquals("m1", metadata.getId());
        assertEquals(ModelStatus.TRAINED, metadata.getStatus());
        assertEquals(List.of("cvss_score", "exploit_available"), metadata.getFeatureNames());
        assertEquals(0.9, metadata.getMetrics().getAccuracy(), 1e-9);
        assertNull(metadata.getPayload(), "Payload не пишется в метаданные");

        String json = Files.readString(directory.resolve("models/model-m1_metadata.json"));
        assertFalse(json.contains("payload"));
    }

    @Test
    void loadAllSkipsIncompleteArtifacts() throws Exception {
        FileSystemModelArtifactStore store = new FileSystemModelArtifactStore(directory);
        store.store(model("m1"));
        store.store(model("m2"));
        Files.delete(directory.resolve("model-m2.bin"));

        List<TrainedModel> models = store.loadAll();

        assertEquals(1, models.size());
        assertEquals("m1", models.get(0).getId());
        assertTrue(models.get(0).isUsable());
    }

    @Test
    void deleteRemovesBothFiles() throws Exception {
        FileSystemModelArtifactStore store = new FileSystemModelArtifactStore(directory);
        store.store(model("m1"));

        assertTrue(store.delete("m1"));
        assertTrue(store.loadPayload("m1").isEmpty());
        assertTrue(store.loadMetadata("m1").isEmpty());
        assertFalse(store.delete("m1"));
    }

    @Test
    void missingDirectoryMeansNoModels() throws Exception {
        assertTrue(new FileSystemModelArtifactStore(directory.resolve("absent")).loadAll().isEmpty());
    }

    private static TrainedModel model(String id) {
        return TrainedModel.builder()
            .id(id)
            .name("model " + id)
            .status(ModelStatus.TRAINED)
            .featureNames(List.of("cvss_score", "exploit_available"))
            .metrics(ModelMetrics.builder().accuracy(0.9).confusionMatrix(new int[][]{{5, 1}, {0, 4}}).build())
            .payload(new byte[]{10, 20, 30})
            .trainingDate(LocalDateTime.now())
            .updatedAt(LocalDateTime.now())
            .build();
    }
}
