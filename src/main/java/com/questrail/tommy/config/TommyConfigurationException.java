package com.questrail.tommy.config;

import java.util.List;

/**
 * Raised at setup time when the bridge configuration is missing required
 * values or carries invalid ones.
 */
public final class TommyConfigurationException extends RuntimeException
{
    private final List<String> problems;

    public TommyConfigurationException(List<String> problems) {
        super("Invalid TOMMY configuration: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    /**
     * One entry per missing or invalid key.
     */
    public List<String> problems() {
        return problems;
    }
}
