package org.quilkit.compiler.ir.instruction;

import org.quilkit.compiler.ir.operand.FrameIdentifier;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Defines a frame and its attributes.
 *
 * @param frame The frame.
 * @param attributes Attribute name to value, in source order.
 */
public record FrameDefinition(
        FrameIdentifier frame,
        Map<String, AttributeValue> attributes
) implements Instruction {

    public FrameDefinition {
        Objects.requireNonNull(frame, "frame");
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
