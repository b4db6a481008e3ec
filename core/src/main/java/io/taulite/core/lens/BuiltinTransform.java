package io.taulite.core.lens;

import io.taulite.core.expr.Expression;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Named single-source transforms.
 * <p>
 * Each expression reads the source as {@code x}; {@code vt}/{@code et} read
 * the source's interval bounds and {@code prev} the source shifted by one
 * index (see {@link SequenceHandle#lagged}).
 */
public enum BuiltinTransform {
    IDENTITY("identity", "x"),
    NEGATE("negate", "0 - x"),
    DOUBLE("double", "x * 2"),
    HALF("half", "x / 2"),
    CELSIUS_TO_FAHRENHEIT("celsius_to_fahrenheit", "x * 9 / 5 + 32"),
    FAHRENHEIT_TO_CELSIUS("fahrenheit_to_celsius", "(x - 32) * 5 / 9"),
    CELSIUS_TO_KELVIN("celsius_to_kelvin", "x + 273.15"),
    KELVIN_TO_CELSIUS("kelvin_to_celsius", "x - 273.15"),
    NS_TO_MS("ns_to_ms", "x / 1000000"),
    MS_TO_S("ms_to_s", "x / 1000"),
    S_TO_MS("s_to_ms", "x * 1000"),
    BYTES_TO_KIB("bytes_to_kib", "x / 1024"),
    KIB_TO_BYTES("kib_to_bytes", "x * 1024"),
    RATIO_TO_PERCENT("ratio_to_percent", "x * 100"),
    PERCENT_TO_RATIO("percent_to_ratio", "x / 100"),
    INTERVAL_SECONDS("interval_seconds", "(et - vt) / 1000000000"),
    RETURNS("returns", "(x - prev) / prev"),
    LOG_RETURN("log_return", "ln(x / prev)");

    public static final String SOURCE_VARIABLE = "x";
    public static final String PREVIOUS_VARIABLE = "prev";

    private final String transformName;
    private final String expression;

    BuiltinTransform(String transformName, String expression) {
        this.transformName = transformName;
        this.expression = expression;
    }

    public String transformName() {
        return transformName;
    }

    public String expression() {
        return expression;
    }

    /** Case-sensitive lookup by transform name. */
    public static Optional<BuiltinTransform> fromName(String name) {
        for (BuiltinTransform t : values()) {
            if (t.transformName.equals(name)) return Optional.of(t);
        }
        return Optional.empty();
    }

    /**
     * Variables a lens for this transform binds, in binding order: {@code x}
     * first so output intervals follow the source, then the others the
     * expression reads.
     */
    public List<String> inputVariables() {
        List<String> out = new ArrayList<>();
        out.add(SOURCE_VARIABLE);
        for (String variable : Expression.compile(expression).variables()) {
            if (!variable.equals(SOURCE_VARIABLE)) out.add(variable);
        }
        return out;
    }

    /** True for the variable that reads the source shifted by one index. */
    public static boolean isLagged(String variable) {
        return PREVIOUS_VARIABLE.equals(variable);
    }

    /** Build a lens applying this transform to {@code source}. */
    public Lens toLens(String lensName, SequenceHandle source) {
        Objects.requireNonNull(source, "source");
        Lens lens = Lens.create(lensName, transformName, expression);
        for (String variable : inputVariables()) {
            lens.bindInput(variable, isLagged(variable) ? SequenceHandle.lagged(source) : source);
        }
        return lens;
    }
}
