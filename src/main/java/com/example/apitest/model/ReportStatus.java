package com.example.apitest.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ReportStatus {
    PENDING, RUNNING, PASSED, FAILED, ERROR;

    public boolean isTerminal() {
        return this == PASSED || this == FAILED || this == ERROR;
    }

    /**
     * PENDING may start or error out, RUNNING may finish; terminal states never change.
     */
    public boolean canTransitionTo(ReportStatus next) {
        switch (this) {
            case PENDING:
                return next == RUNNING || next == ERROR;
            case RUNNING:
                return next.isTerminal();
            default:
                return false;
        }
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
