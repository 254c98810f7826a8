package com.example.retrievalservice.entity;

public enum TokenStatus {
    ACTIVE,
    DISABLED,
    EXPIRED;

    public String dbValue() {
        return name().toLowerCase();
    }
}
