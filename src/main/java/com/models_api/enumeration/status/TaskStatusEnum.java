package com.models_api.enumeration.status;

import java.util.EnumSet;
import java.util.Set;

public enum TaskStatusEnum {
    NOT_PROCESSED,
    PROCESSING,
    SUCCESS,
    FAILURE,
    CANCELLED;

    private static final Set<TaskStatusEnum> TERMINAL = EnumSet.of(SUCCESS, FAILURE, CANCELLED);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    public static Set<TaskStatusEnum> terminalStates() {
        return EnumSet.copyOf(TERMINAL);
    }
}
