package com.example.apitest.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ProgressEventType {
    STARTED, STEP_PROGRESS, BLOCKED, RETRYING, ASSERTION_RESULT, FINISHED;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
