package com.intellivuln.models;

/**
 * Категориальный атрибут уязвимости с пустой корзиной "" для неизвестного значения.
 * Используется при one-hot кодировании признаков.
 */
public interface CategoricalAttribute {

    /**
     * Каноническое значение ("" для неизвестного)
     */
    String value();

    default boolean isUnknown() {
        return value().isEmpty();
    }
}
