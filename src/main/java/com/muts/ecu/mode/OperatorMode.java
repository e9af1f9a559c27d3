package com.muts.ecu.mode;

import java.util.Locale;
import java.util.Optional;

/**
 * Operator mode of the process. Selected once at startup and immutable
 * afterwards.
 */
public enum OperatorMode
{
    DEV("Development Mode", new ModeConfig(true, false, false, false)),
    WORKSHOP("Workshop Mode", new ModeConfig(false, true, true, true)),
    LAB("Lab Mode", new ModeConfig(true, true, true, true));

    private final String displayName;
    private final ModeConfig config;

    OperatorMode(String displayName, ModeConfig config)
    {
        this.displayName = displayName;
        this.config = config;
    }

    public String displayName()
    {
        return displayName;
    }

    public ModeConfig config()
    {
        return config;
    }

    /**
     * Parses an external setting such as {@code "workshop"} (case-insensitive).
     *
     * @return the mode, or empty if the setting is missing or unrecognized
     */
    public static Optional<OperatorMode> fromSetting(String setting)
    {
        if (setting == null || setting.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(setting.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
