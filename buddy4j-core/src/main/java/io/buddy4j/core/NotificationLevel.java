package io.buddy4j.core;

public enum NotificationLevel {
    INFO,
    WARNING,
    CRITICAL,
    ERROR
}
