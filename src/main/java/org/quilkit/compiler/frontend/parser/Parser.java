package org.quilkit.compiler.frontend.parser;

import org.quilkit.compiler.api.ParseException;
import org.quilkit.compiler.api.SourceInfo;
import org.quilkit.compiler.diagnostics.CompilerLogger;
import org.quilkit.compiler.expression.Expression;
import org.quilkit.compiler.frontend.command.CommandHandlerRegistry;
import org.quilkit.compiler.frontend.command.ICommandHandler;
import org.quilkit.compiler.frontend.lexer.Keyword;
import org.quilkit.compiler.frontend.lexer.Token;
import org.quilkit.compiler.frontend.lexer.TokenType;
import org.quilkit.compiler.ir.Program;
import org.quilkit.compiler.ir.instruction.GateApplication;
import org.quilkit.compiler.ir.instruction.Instruction;
import org.quilkit.compiler.ir.operand.GateModifier;
import org.quilkit.compiler.ir.operand.Qubit;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * The main parser for Quil. It consumes a list of tokens from the
 * {@link org.quilkit.compiler.frontend.lexer.Lexer} and produces a {@link Program}.
 * <p>
 * Commands are dispatched by keyword through the {@link CommandHandlerRegistry}; an identifier
 * or a gate modifier at the start of an instruction begins a gate application. Parsing stops
 * at the first error and no partial program is returned.
 */
public class Parser implements ParsingContext {

    private static final Set<Keyword> DEFINITION_KEYWORDS = EnumSet.of(
            Keyword.DECLARE, Keyword.DEFGATE, Keyword.DEFCIRCUIT, Keyword.DEFCAL, Keyword.DEFFRAME, Keyword.DEFWAVEFORM);

    private final List<Token> tokens;
    private final String programName;
    private final CommandHandlerRegistry commandRegistry;
    private Program program;
    private int current = 0;

    /**
     * Constructs a new Parser.
     * @param tokens The list of tokens to parse, ending with {@link TokenType#END_OF_FILE}.
     */
    public Parser(List<Token> tokens) {
        this(tokens, "<memory>");
    }

    /**
     * Constructs a new Parser.
     * @param tokens The list of tokens to parse, ending with {@link TokenType#END_OF_FILE}.
     * @param programName The logical name of the resulting program.
     */
    public Parser(List<Token> tokens, String programName) {
        this(tokens, programName, CommandHandlerRegistry.initialize());
    }

    /**
     * Constructs a new Parser with a custom command registry.
     * @param tokens The list of tokens to parse, ending with {@link TokenType#END_OF_FILE}.
     * @param programName The logical name of the resulting program.
     * @param commandRegistry The handlers for command keywords.
     */
    public Parser(List<Token> tokens, String programName, CommandHandlerRegistry commandRegistry) {
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).type() != TokenType.END_OF_FILE) {
            throw new IllegalArgumentException("Token list must end with END_OF_FILE");
        }
        this.tokens = tokens;
        this.programName = programName;
        this.commandRegistry = commandRegistry;
    }

    /**
     * Parses the entire token stream.
     * @return The program with every top-level item in source order.
     * @throws ParseException at the first syntax error.
     */
    public Program parse() throws ParseException {
        program = new Program(programName);
        while (true) {
            while (match(TokenType.NEWLINE, TokenType.INDENTATION)) {
                // Blank lines and stray indentation between top-level items.
            }
            if (isAtEnd()) {
                break;
            }
            Token first = peek();
            Instruction instruction = instruction();
            expectEndOfInstruction();
            program.add(instruction, first.location());
            CompilerLogger.trace("Parsed " + instruction.getClass().getSimpleName() + " at " + first.location());
        }
        return program;
    }

    /**
     * Parses the whole token stream as a single expression.
     * @return The expression.
     * @throws ParseException if the tokens are not exactly one expression.
     */
    public Expression parseStandaloneExpression() throws ParseException {
        Expression expression = expression();
        while (match(TokenType.NEWLINE)) {
            // Trailing line breaks are allowed.
        }
        if (!isAtEnd()) {
            throw new ParseException("end of input", peek());
        }
        return expression;
    }

    /**
     * Parses one instruction starting at the current token.
     * @return The instruction.
     * @throws ParseException if no instruction starts here or it is malformed.
     */
    public Instruction instruction() throws ParseException {
        Token token = peek();
        if (token.type() == TokenType.KEYWORD) {
            Keyword keyword = (Keyword) token.value();
            if (keyword.isModifier()) {
                return gateApplication();
            }
            ICommandHandler handler = commandRegistry.get(keyword)
                    .orElseThrow(() -> new IllegalStateException("No handler registered for " + keyword.text()));
            return handler.parse(this);
        }
        if (token.type() == TokenType.IDENTIFIER) {
            return gateApplication();
        }
        throw new ParseException("instruction", token);
    }

    private Instruction gateApplication() throws ParseException {
        List<GateModifier> modifiers = new ArrayList<>();
        while (check(TokenType.KEYWORD) && ((Keyword) peek().value()).isModifier()) {
            modifiers.add(GateModifier.valueOf(((Keyword) advance().value()).name()));
        }
        Token name = consume(TokenType.IDENTIFIER, "gate name");
        List<Expression> parameters = OperandParser.optionalExpressionList(this);
        List<Qubit> qubits = OperandParser.qubits(this);
        if (qubits.isEmpty()) {
            throw new ParseException("qubit index", peek());
        }
        return new GateApplication(name.text(), modifiers, parameters, qubits);
    }

    @Override
    public List<Instruction> instructionBody() throws ParseException {
        List<Instruction> body = new ArrayList<>();
        while (enterBlockLine()) {
            Token first = peek();
            if (first.type() == TokenType.KEYWORD && DEFINITION_KEYWORDS.contains((Keyword) first.value())) {
                throw new ParseException("instruction", first);
            }
            Instruction instruction = instruction();
            expectEndOfInstruction();
            recordSource(instruction, first.location());
            body.add(instruction);
        }
        return body;
    }

    @Override
    public boolean enterBlockLine() {
        int mark = current;
        while (check(TokenType.NEWLINE)) {
            advance();
        }
        if (check(TokenType.INDENTATION)) {
            advance();
            return true;
        }
        current = mark;
        return false;
    }

    @Override
    public void expectEndOfInstruction() throws ParseException {
        if (!check(TokenType.NEWLINE) && !isAtEnd()) {
            throw new ParseException("end of line", peek());
        }
    }

    @Override
    public Expression expression() throws ParseException {
        return new ExpressionParser(this).parse();
    }

    @Override
    public void recordSource(Instruction instruction, SourceInfo location) {
        if (program != null) {
            program.recordSource(instruction, location);
        }
    }

    @Override
    public boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean match(Keyword keyword) {
        if (check(keyword)) {
            advance();
            return true;
        }
        return false;
    }

    @Override
    public boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type() == type;
    }

    @Override
    public boolean check(Keyword keyword) {
        return peek().is(keyword);
    }

    @Override
    public boolean checkNext(TokenType type) {
        return peekNext().type() == type;
    }

    @Override
    public Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    @Override
    public boolean isAtEnd() {
        return peek().type() == TokenType.END_OF_FILE;
    }

    @Override
    public Token peek() {
        return tokens.get(current);
    }

    @Override
    public Token peekNext() {
        if (current + 1 >= tokens.size()) return tokens.get(tokens.size() - 1);
        return tokens.get(current + 1);
    }

    @Override
    public Token previous() {
        return tokens.get(current - 1);
    }

    @Override
    public Token consume(TokenType type, String expectation) throws ParseException {
        if (check(type)) return advance();
        throw new ParseException(expectation, peek());
    }
}
