package com.intellivuln.async;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Диспетчер на фиксированном пуле именованных daemon-потоков
 */
@Slf4j
public class ExecutorAsyncDispatcher implements AsyncDispatcher {

    private final ExecutorService executorService;
    private final long shutdownTimeoutSec;

    public ExecutorAsyncDispatcher(int poolSize, long shutdownTimeoutSec) {
        if (poolSize <= 0) {
            throw new IllegalArgumentException("Размер пула должен быть положительным: " + poolSize);
        }
        this.executorService = Executors.newFixedThreadPool(poolSize, new NamedThreadFactory("intellivuln-worker"));
        this.shutdownTimeoutSec = shutdownTimeoutSec;
    }

    @Override
    public <T> CompletableFuture<T> submit(String taskName, Callable<T> task) {
        CompletableFuture<T> future = new CompletableFuture<>();
        try {
            executorService.execute(() -> {
                long started = System.currentTimeMillis();
                log.debug("Задача {} запущена в {}", taskName, Thread.currentThread().getName());
                try {
                    future.complete(task.call());
                    log.debug("Задача {} завершена за {} мс", taskName, System.currentTimeMillis() - started);
                } catch (Exception e) {
                    log.warn("Задача {} завершилась с ошибкой: {}", taskName, e.getMessage());
                    future.completeExceptionally(e);
                } catch (Error e) {
                    future.completeExceptionally(e);
                    throw e;
                }
            });
        } catch (RejectedExecutionException e) {
            log.error("Задача {} отклонена: диспетчер остановлен", taskName);
            future.completeExceptionally(e);
        }
        return future;
    }

    /**
     * КРИТИЧНО: закрываем пул при остановке, чтобы не оставлять висящих потоков
     */
    @Override
    public void close() {
        log.info("Закрытие пула задач...");
        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(shutdownTimeoutSec, TimeUnit.SECONDS)) {
                log.warn("Пул не завершился за {} с, принудительное закрытие...", shutdownTimeoutSec);
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            log.warn("Прервано ожидание завершения пула, принудительное закрытие...");
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        private NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
