package org.quilkit.compiler.frontend.parser.features.pulse;

import org.quilkit.compiler.api.ParseException;
import org.quilkit.compiler.frontend.command.ICommandHandler;
import org.quilkit.compiler.frontend.lexer.Keyword;
import org.quilkit.compiler.frontend.lexer.Token;
import org.quilkit.compiler.frontend.parser.OperandParser;
import org.quilkit.compiler.frontend.parser.ParsingContext;
import org.quilkit.compiler.ir.instruction.Capture;
import org.quilkit.compiler.ir.instruction.Instruction;
import org.quilkit.compiler.ir.instruction.Pulse;
import org.quilkit.compiler.ir.instruction.RawCapture;
import org.quilkit.compiler.ir.operand.FrameIdentifier;

import java.util.LinkedHashSet;
import java.util.List;

/**
 * Handles the waveform-playing commands, each optionally prefixed with {@code NONBLOCKING}:
 * <pre>
 * PULSE frame waveform
 * CAPTURE frame waveform memory
 * RAW-CAPTURE frame duration memory
 * </pre>
 */
public class PulseCommandHandler implements ICommandHandler {

    @Override
    public Instruction parse(ParsingContext context) throws ParseException {
        boolean blocking = !context.match(Keyword.NONBLOCKING);
        Token command = context.peek();
        if (command.is(Keyword.PULSE)) {
            context.advance();
            FrameIdentifier frame = OperandParser.frame(context);
            return new Pulse(blocking, frame, OperandParser.waveformInvocation(context));
        }
        if (command.is(Keyword.CAPTURE)) {
            context.advance();
            FrameIdentifier frame = OperandParser.frame(context);
            return new Capture(blocking, frame, OperandParser.waveformInvocation(context), OperandParser.memoryReference(context));
        }
        if (command.is(Keyword.RAW_CAPTURE)) {
            context.advance();
            FrameIdentifier frame = OperandParser.frame(context);
            return new RawCapture(blocking, frame, context.expression(), OperandParser.memoryReference(context));
        }
        throw new ParseException(new LinkedHashSet<>(List.of("PULSE", "CAPTURE", "RAW-CAPTURE")), command);
    }
}
