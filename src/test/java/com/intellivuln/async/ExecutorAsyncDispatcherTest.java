package com.intellivuln.async;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ExecutorAsyncDispatcherTest {

    @Test
    void runsTasksOnNamedWorkerThreads() throws Exception {
        try (ExecutorAsyncDispatcher dispatcher = new ExecutorAsyncDispatcher(2, 5)) {
            String thread = dispatcher.submit("name", () -> Thread.currentThread().getName()).get(5, TimeUnit.SECONDS);

            assertTrue(thread.startsWith("intellivuln-worker"), thread);
        }
    }

    @Test
    void taskFailureCompletesFutureExceptionally() {
        try (ExecutorAsyncDispatcher dispatcher = new ExecutorAsyncDispatcher(1, 5)) {
            CompletableFuture<Object> future = dispatcher.submit("boom", () -> {
                throw new IllegalStateException("boom");
            });

            ExecutionException error = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
            assertInstanceOf(IllegalStateException.class, error.getCause());
        }
    }

    @Test
    void submitAfterCloseIsRejected() {
        ExecutorAsyncDispatcher dispatcher = new ExecutorAsyncDispatcher(1, 1);
        dispatcher.close();

        CompletableFuture<String> future = dispatcher.submit("late", () -> "never");

        assertTrue(future.isCompletedExceptionally());
        ExecutionException error = assertThrows(ExecutionException.class, future::get);
        assertInstanceOf(RejectedExecutionException.class, error.getCause());
    }

    @Test
    void rejectsNonPositivePoolSize() {
        assertThrows(IllegalArgumentException.class, () -> new ExecutorAsyncDispatcher(0, 1));
    }
}
