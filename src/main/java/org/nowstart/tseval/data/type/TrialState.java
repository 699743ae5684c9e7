package org.nowstart.tseval.data.type;

import java.util.EnumSet;
import java.util.Set;

public enum TrialState {
    PENDING,
    LOADING,
    RUNNING,
    SCORING,
    DONE,
    ERROR;

    public boolean canMoveTo(TrialState next) {
        return allowedTargets().contains(next);
    }

    public boolean isTerminal() {
        return this == DONE || this == ERROR;
    }

    private Set<TrialState> allowedTargets() {
        return switch (this) {
            case PENDING -> EnumSet.of(LOADING);
            case LOADING -> EnumSet.of(RUNNING, ERROR);
            case RUNNING -> EnumSet.of(SCORING, ERROR);
            case SCORING -> EnumSet.of(DONE);
            case DONE, ERROR -> EnumSet.noneOf(TrialState.class);
        };
    }
}
