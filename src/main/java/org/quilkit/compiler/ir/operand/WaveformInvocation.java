package org.quilkit.compiler.ir.operand;

import org.quilkit.compiler.expression.Expression;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A reference to a waveform with named arguments, e.g. {@code flat(duration: 1e-6, iq: 1)}.
 *
 * @param name The waveform name.
 * @param parameters Argument name to value, in source order.
 */
public record WaveformInvocation(String name, Map<String, Expression> parameters) {

    public WaveformInvocation {
        Objects.requireNonNull(name, "name");
        parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public WaveformInvocation(String name) {
        this(name, Map.of());
    }
}
