package com.gprintex.commission.exception;

public class EntityNotFoundException extends CommissionException {

    private final String entity;
    private final Object key;

    public EntityNotFoundException(String entity, Object key) {
        super("NOT_FOUND", entity + " " + key + " not found");
        this.entity = entity;
        this.key = key;
    }

    public String getEntity() {
        return entity;
    }

    public Object getKey() {
        return key;
    }
}
