package io.salesops.core.model;

public enum MessageRole {
    SYSTEM,
    USER,
    ASSISTANT
}
