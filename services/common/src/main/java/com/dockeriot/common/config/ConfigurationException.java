package com.dockeriot.common.config;

import java.util.List;

/**
 * Raised when the database configuration cannot be resolved.
 * Always fatal: the process must not start serving.
 */
public class ConfigurationException extends RuntimeException {

    private final List<String> problems;

    public ConfigurationException(List<String> problems) {
        super("Invalid database configuration: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}
