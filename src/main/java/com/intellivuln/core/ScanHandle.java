package com.intellivuln.core;

import com.intellivuln.models.Scan;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Результат запуска: снимок сканирования сразу после перехода и future его завершения
 */
public class ScanHandle {

    private final Scan scan;
    private final CompletableFuture<Scan> completion;

    public ScanHandle(Scan scan, CompletableFuture<Scan> completion) {
        this.scan = scan;
        this.completion = completion;
    }

    public Scan getScan() {
        return scan;
    }

    public CompletableFuture<Scan> getCompletion() {
        return completion;
    }

    /**
     * Дождаться терминального состояния
     */
    public Scan await(Duration timeout) throws InterruptedException, TimeoutException {
        try {
            return completion.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Обработка завершения сканирования упала: " + e.getCause().getMessage(), e.getCause());
        }
    }
}
