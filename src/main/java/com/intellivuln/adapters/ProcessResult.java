package com.intellivuln.adapters;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Итог запуска внешнего процесса
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProcessResult {
    private int exitCode;
    private String stdout;
    private String stderr;
    private boolean timedOut;
    private long durationMs;
}
