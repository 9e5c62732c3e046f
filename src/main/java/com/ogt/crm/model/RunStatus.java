package com.ogt.crm.model;

import java.util.EnumSet;
import java.util.Set;

public enum RunStatus {
    IDLE,
    RUNNING,
    PAUSED, // reservado: pause no está implementado
    ABORTED,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == ABORTED || this == COMPLETED || this == FAILED;
    }

    public boolean canTransitionTo(RunStatus next) {
        return allowedFrom(this).contains(next);
    }

    private static Set<RunStatus> allowedFrom(RunStatus status) {
        return switch (status) {
            case IDLE -> EnumSet.of(RUNNING, ABORTED, FAILED);
            case RUNNING -> EnumSet.of(ABORTED, COMPLETED, FAILED);
            default -> EnumSet.noneOf(RunStatus.class);
        };
    }
}
