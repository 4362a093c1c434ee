package com.example.appruntime.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * 应用健康状态。
 */
public enum HealthStatus {
    HEALTHY("healthy"),
    UNHEALTHY("unhealthy"),
    UNKNOWN("unknown");

    private final String value;

    HealthStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static HealthStatus fromValue(String value) {
        for (HealthStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown health status: " + value);
    }

    @Converter(autoApply = true)
    public static class JpaConverter implements AttributeConverter<HealthStatus, String> {
        @Override
        public String convertToDatabaseColumn(HealthStatus attribute) {
            return attribute == null ? null : attribute.value;
        }

        @Override
        public HealthStatus convertToEntityAttribute(String dbData) {
            return dbData == null ? null : fromValue(dbData);
        }
    }
}
