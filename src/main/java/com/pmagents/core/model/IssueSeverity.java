package com.pmagents.core.model;

public enum IssueSeverity {
    CRITICAL,
    ERROR,
    WARNING,
    INFO
}
