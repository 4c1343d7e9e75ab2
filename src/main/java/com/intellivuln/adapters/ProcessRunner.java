package com.intellivuln.adapters;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Запуск внешних процессов. Выделен в интерфейс, чтобы адаптеры тестировались без реальных сканеров.
 */
public interface ProcessRunner {

    /**
     * Выполнить команду и дождаться завершения.
     * По истечении таймаута процесс принудительно уничтожается, а результат помечается timedOut.
     *
     * @param command команда и аргументы
     * @param environment дополнительные переменные окружения (может быть пустым)
     * @param timeout максимальное время работы
     */
    ProcessResult run(List<String> command, Map<String, String> environment, Duration timeout)
        throws IOException, InterruptedException;
}
