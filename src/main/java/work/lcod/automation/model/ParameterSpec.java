package work.lcod.automation.model;

import java.util.Objects;

/**
 * Declared macro parameter. A required parameter without a default must be supplied by the caller.
 */
public record ParameterSpec(String name, String description, boolean required, String defaultValue) {
    public ParameterSpec {
        Objects.requireNonNull(name, "name");
        description = description == null ? "" : description;
    }

    public boolean mustBeSupplied() {
        return required && defaultValue == null;
    }
}
