package com.gamepanel.scheduler.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Action performed by a single task in a schedule's chain.
 *
 * <p>The wire/storage code ({@code power_start}, {@code backup}, ...) is kept separate from the constant
 * name so that stored rows and API payloads stay stable.</p>
 */
public enum TaskAction {

    POWER_START("power_start"),
    POWER_STOP("power_stop"),
    POWER_RESTART("power_restart"),
    BACKUP("backup"),
    COMMAND("command");

    private final String code;

    TaskAction(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean requiresPayload() {
        return this == COMMAND;
    }

    @JsonCreator
    public static TaskAction fromCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("Task action is required");
        }
        return Arrays.stream(values())
                .filter(action -> action.code.equalsIgnoreCase(code.trim()) || action.name().equalsIgnoreCase(code.trim()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown task action: " + code));
    }
}
