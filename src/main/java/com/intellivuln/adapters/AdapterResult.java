package com.intellivuln.adapters;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Результат работы адаптера
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdapterResult {

    public enum Status {
        SUCCESS,
        FAILED
    }

    private Status status;
    private String message;

    /**
     * Находки с каноническими именами полей (title, cve_id, severity, cvss_score, ...)
     */
    @Builder.Default
    private List<Map<String, Object>> findings = new ArrayList<>();

    private JsonNode rawOutput;

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public static AdapterResult success(List<Map<String, Object>> findings, JsonNode rawOutput) {
        return AdapterResult.builder()
            .status(Status.SUCCESS)
            .message("Сканирование успешно завершено")
            .findings(findings != null ? findings : new ArrayList<>())
            .rawOutput(rawOutput)
            .build();
    }

    public static AdapterResult failed(String message) {
        return AdapterResult.builder()
            .status(Status.FAILED)
            .message(message)
            .build();
    }
}
