package com.intellivuln.errors;

/**
 * Сущность с указанным идентификатором не найдена
 */
public class EntityNotFoundException extends VulnScanException {

    private final String entityType;
    private final String entityId;

    public EntityNotFoundException(String entityType, String entityId) {
        super(entityType + " не найден: " + entityId);
        this.entityType = entityType;
        this.entityId = entityId;
    }

    public String getEntityType() {
        return entityType;
    }

    public String getEntityId() {
        return entityId;
    }
}
