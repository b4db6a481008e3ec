package io.taulite.core.expr;

import java.util.Objects;

/** A name bound to a numeric value for one evaluation. */
public record Variable(String name, double value) {
    public Variable {
        Objects.requireNonNull(name, "name");
    }
}
