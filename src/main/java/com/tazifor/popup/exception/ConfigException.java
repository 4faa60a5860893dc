package com.tazifor.popup.exception;

import java.util.List;

/**
 * Campaign or experiment configuration rejected at activation time.
 */
public class ConfigException extends PopupEngineException {

    private final List<String> violations;

    public ConfigException(List<String> violations) {
        super("Invalid configuration: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public ConfigException(String violation) {
        this(List.of(violation));
    }

    public List<String> getViolations() {
        return violations;
    }
}
