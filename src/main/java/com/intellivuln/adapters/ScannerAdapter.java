package com.intellivuln.adapters;

import com.intellivuln.models.Scan;
import com.intellivuln.models.ScannerKind;

/**
 * Адаптер внешнего сканера уязвимостей.
 * Реализации не выбрасывают исключений из run(): любые сбои возвращаются как AdapterResult.failed.
 */
public interface ScannerAdapter {

    /**
     * Вид сканера, который обслуживает адаптер
     */
    ScannerKind kind();

    /**
     * Запустить сканер для цели сканирования. Может блокироваться на время работы внешнего процесса.
     *
     * @param scan сканирование (цель, глубина, конфигурация сканера)
     * @return находки в каноническом виде или описание ошибки
     */
    AdapterResult run(Scan scan);
}
