package com.rozet.orchestration.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum TaskBudget {
    SMALL, MEDIUM, LARGE;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static TaskBudget fromLabel(String label) {
        if (label == null) {
            return MEDIUM;
        }
        String normalized = label.trim().toUpperCase(Locale.ROOT);
        for (TaskBudget budget : values()) {
            if (budget.name().equals(normalized)) {
                return budget;
            }
        }
        return MEDIUM;
    }
}
