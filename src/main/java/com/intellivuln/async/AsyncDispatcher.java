package com.intellivuln.async;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;

/**
 * Граница асинхронного выполнения долгих задач (сканирование, обучение)
 */
public interface AsyncDispatcher extends AutoCloseable {

    /**
     * Отправить задачу на выполнение. Задача выполняется один раз; результат или исключение
     * доставляются через возвращаемый future.
     *
     * @param taskName имя задачи для логов
     * @param task работа
     */
    <T> CompletableFuture<T> submit(String taskName, Callable<T> task);

    @Override
    void close();
}
