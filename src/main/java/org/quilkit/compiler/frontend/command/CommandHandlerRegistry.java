package org.quilkit.compiler.frontend.command;

import org.quilkit.compiler.frontend.lexer.Keyword;
import org.quilkit.compiler.frontend.parser.features.classical.ArithmeticCommandHandler;
import org.quilkit.compiler.frontend.parser.features.classical.ComparisonCommandHandler;
import org.quilkit.compiler.frontend.parser.features.classical.LogicCommandHandler;
import org.quilkit.compiler.frontend.parser.features.classical.TransferCommandHandler;
import org.quilkit.compiler.frontend.parser.features.control.JumpCommandHandler;
import org.quilkit.compiler.frontend.parser.features.control.LabelCommandHandler;
import org.quilkit.compiler.frontend.parser.features.control.SimpleCommandHandler;
import org.quilkit.compiler.frontend.parser.features.declare.DeclareCommandHandler;
import org.quilkit.compiler.frontend.parser.features.defcal.DefCalCommandHandler;
import org.quilkit.compiler.frontend.parser.features.defcircuit.DefCircuitCommandHandler;
import org.quilkit.compiler.frontend.parser.features.defframe.DefFrameCommandHandler;
import org.quilkit.compiler.frontend.parser.features.defgate.DefGateCommandHandler;
import org.quilkit.compiler.frontend.parser.features.defwaveform.DefWaveformCommandHandler;
import org.quilkit.compiler.frontend.parser.features.pragma.PragmaCommandHandler;
import org.quilkit.compiler.frontend.parser.features.pulse.DelayCommandHandler;
import org.quilkit.compiler.frontend.parser.features.pulse.FenceCommandHandler;
import org.quilkit.compiler.frontend.parser.features.pulse.FrameMutationCommandHandler;
import org.quilkit.compiler.frontend.parser.features.pulse.PulseCommandHandler;
import org.quilkit.compiler.frontend.parser.features.quantum.MeasureCommandHandler;
import org.quilkit.compiler.frontend.parser.features.quantum.ResetCommandHandler;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * A registry for command handlers. This class holds a map of command keywords
 * to their corresponding handlers.
 */
public class CommandHandlerRegistry {
    private final Map<Keyword, ICommandHandler> handlers = new EnumMap<>(Keyword.class);

    /**
     * Registers a new command handler, replacing any earlier one for the keyword.
     * @param keyword The command keyword (e.g., {@link Keyword#DEFGATE}).
     * @param handler The handler for the command.
     */
    public void register(Keyword keyword, ICommandHandler handler) {
        handlers.put(keyword, handler);
    }

    /**
     * Gets the handler for a given command keyword.
     * @param keyword The command keyword.
     * @return An {@link Optional} containing the handler if it exists, otherwise empty.
     */
    public Optional<ICommandHandler> get(Keyword keyword) {
        return Optional.ofNullable(handlers.get(keyword));
    }

    /**
     * Initializes the command handler registry with all the built-in handlers.
     * The gate modifiers are not registered; they start a gate application.
     * @return A new instance of {@link CommandHandlerRegistry} with all handlers registered.
     */
    public static CommandHandlerRegistry initialize() {
        CommandHandlerRegistry registry = new CommandHandlerRegistry();
        registry.register(Keyword.DECLARE, new DeclareCommandHandler());
        registry.register(Keyword.MEASURE, new MeasureCommandHandler());
        registry.register(Keyword.RESET, new ResetCommandHandler());

        registry.register(Keyword.LABEL, new LabelCommandHandler());
        JumpCommandHandler jump = new JumpCommandHandler();
        registry.register(Keyword.JUMP, jump);
        registry.register(Keyword.JUMP_WHEN, jump);
        registry.register(Keyword.JUMP_UNLESS, jump);
        SimpleCommandHandler simple = new SimpleCommandHandler();
        registry.register(Keyword.HALT, simple);
        registry.register(Keyword.WAIT, simple);
        registry.register(Keyword.NOP, simple);

        ArithmeticCommandHandler arithmetic = new ArithmeticCommandHandler();
        registry.register(Keyword.ADD, arithmetic);
        registry.register(Keyword.SUB, arithmetic);
        registry.register(Keyword.MUL, arithmetic);
        registry.register(Keyword.DIV, arithmetic);
        LogicCommandHandler logic = new LogicCommandHandler();
        registry.register(Keyword.NEG, logic);
        registry.register(Keyword.NOT, logic);
        registry.register(Keyword.AND, logic);
        registry.register(Keyword.IOR, logic);
        registry.register(Keyword.XOR, logic);
        ComparisonCommandHandler comparison = new ComparisonCommandHandler();
        registry.register(Keyword.EQ, comparison);
        registry.register(Keyword.GT, comparison);
        registry.register(Keyword.GE, comparison);
        registry.register(Keyword.LT, comparison);
        registry.register(Keyword.LE, comparison);
        TransferCommandHandler transfer = new TransferCommandHandler();
        registry.register(Keyword.MOVE, transfer);
        registry.register(Keyword.EXCHANGE, transfer);
        registry.register(Keyword.CONVERT, transfer);
        registry.register(Keyword.LOAD, transfer);
        registry.register(Keyword.STORE, transfer);

        registry.register(Keyword.PRAGMA, new PragmaCommandHandler());

        registry.register(Keyword.DEFGATE, new DefGateCommandHandler());
        registry.register(Keyword.DEFCIRCUIT, new DefCircuitCommandHandler());
        registry.register(Keyword.DEFCAL, new DefCalCommandHandler());
        registry.register(Keyword.DEFFRAME, new DefFrameCommandHandler());
        registry.register(Keyword.DEFWAVEFORM, new DefWaveformCommandHandler());

        PulseCommandHandler pulse = new PulseCommandHandler();
        registry.register(Keyword.NONBLOCKING, pulse);
        registry.register(Keyword.PULSE, pulse);
        registry.register(Keyword.CAPTURE, pulse);
        registry.register(Keyword.RAW_CAPTURE, pulse);
        registry.register(Keyword.DELAY, new DelayCommandHandler());
        registry.register(Keyword.FENCE, new FenceCommandHandler());
        FrameMutationCommandHandler frames = new FrameMutationCommandHandler();
        registry.register(Keyword.SET_FREQUENCY, frames);
        registry.register(Keyword.SHIFT_FREQUENCY, frames);
        registry.register(Keyword.SET_PHASE, frames);
        registry.register(Keyword.SHIFT_PHASE, frames);
        registry.register(Keyword.SET_SCALE, frames);
        registry.register(Keyword.SWAP_PHASES, frames);
        return registry;
    }
}
