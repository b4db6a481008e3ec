package io.taulite.server.dto;

import java.util.Map;

/**
 * JSON body for POST /lenses/{label}. Either a built-in transform over one
 * series:
 *   { "source": "temp", "transform": "celsius_to_fahrenheit" }
 * or an expression with explicit bindings (order is binding order):
 *   { "description": "sum", "expression": "a + b", "inputs": { "a": "s1", "b": "s2" } }
 */
public class LensRequest {
    public String source;
    public String transform;
    public String description;
    public String expression;
    public Map<String, String> inputs;

    public boolean isBuiltin() {
        return transform != null;
    }
}
