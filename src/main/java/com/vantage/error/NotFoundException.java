package com.vantage.error;

/**
 * A mutation targeted an entity that does not exist or is not visible to the caller.
 *
 * Reads never throw this; a missing entity is returned as an absent value.
 */
public class NotFoundException extends RuntimeException {

    private final String entityType;
    private final String entityId;

    public NotFoundException(String entityType, String entityId) {
        super(entityType + " " + entityId + " not found");
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
