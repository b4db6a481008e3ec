package io.taulite.server.catalog;

import java.util.List;
import java.util.Objects;

/**
 * Persistent description of a catalog lens, stored as JSON under
 * {@code lens:<label>}. Bindings refer to series by label; a lagged binding
 * reads the series shifted by one index.
 */
public record LensDefinition(
        String label,
        String description,
        String expression,
        List<Binding> inputs
) {
    public LensDefinition {
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(expression, "expression");
        inputs = List.copyOf(inputs);
    }

    public record Binding(String variable, String series, boolean lagged) {
        public Binding {
            Objects.requireNonNull(variable, "variable");
            Objects.requireNonNull(series, "series");
        }
    }
}
