package com.gamepanel.scheduler.model;

import java.util.Locale;

public enum PowerAction {
    START,
    STOP,
    RESTART;

    /**
     * Value the daemon expects in the power request body.
     */
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
