package com.example.appruntime.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * 应用容器状态（缓存在 App 记录中）。
 */
public enum ContainerStatus {
    NOT_FOUND("not_found"),
    STOPPED("stopped"),
    RUNNING("running"),
    ERROR("error");

    private final String value;

    ContainerStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ContainerStatus fromValue(String value) {
        for (ContainerStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown container status: " + value);
    }

    @Converter(autoApply = true)
    public static class JpaConverter implements AttributeConverter<ContainerStatus, String> {
        @Override
        public String convertToDatabaseColumn(ContainerStatus attribute) {
            return attribute == null ? null : attribute.value;
        }

        @Override
        public ContainerStatus convertToEntityAttribute(String dbData) {
            return dbData == null ? null : fromValue(dbData);
        }
    }
}
