package org.quilkit.compiler.frontend.parser;

import org.quilkit.compiler.api.CompilationException;
import org.quilkit.compiler.api.ParseException;
import org.quilkit.compiler.expression.Expression;
import org.quilkit.compiler.expression.ExpressionFunction;
import org.quilkit.compiler.expression.InfixOperator;
import org.quilkit.compiler.expression.MathConstant;
import org.quilkit.compiler.expression.PrefixOperator;
import org.quilkit.compiler.frontend.lexer.Lexer;
import org.quilkit.compiler.frontend.lexer.Token;
import org.quilkit.compiler.frontend.lexer.TokenType;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Recursive-descent parser for arithmetic expressions.
 * <p>
 * Precedence from loosest to tightest: {@code + -} (left), {@code * /} (left),
 * {@code ^} (right), unary sign, then function calls and atoms.
 */
public final class ExpressionParser {

    private final ParsingContext context;

    /**
     * @param context The token stream, positioned at the start of the expression.
     */
    public ExpressionParser(ParsingContext context) {
        this.context = context;
    }

    /**
     * Parses a complete expression from text.
     * @param text The expression, e.g. {@code 2*pi*%theta}.
     * @return The expression tree.
     * @throws CompilationException if the text is not exactly one expression.
     */
    public static Expression parse(String text) throws CompilationException {
        List<Token> tokens = new Lexer(text, "<expression>").scanTokens();
        return new Parser(tokens, "<expression>").parseStandaloneExpression();
    }

    /**
     * Parses one expression and leaves the position on the first token after it.
     * @return The expression tree.
     * @throws ParseException if no expression starts at the current token.
     */
    public Expression parse() throws ParseException {
        return additive();
    }

    private Expression additive() throws ParseException {
        Expression left = multiplicative();
        while (context.match(TokenType.PLUS, TokenType.MINUS)) {
            InfixOperator operator = context.previous().type() == TokenType.PLUS ? InfixOperator.PLUS : InfixOperator.MINUS;
            left = new Expression.Infix(left, operator, multiplicative());
        }
        return left;
    }

    private Expression multiplicative() throws ParseException {
        Expression left = power();
        while (context.match(TokenType.STAR, TokenType.SLASH)) {
            InfixOperator operator = context.previous().type() == TokenType.STAR ? InfixOperator.STAR : InfixOperator.SLASH;
            left = new Expression.Infix(left, operator, power());
        }
        return left;
    }

    private Expression power() throws ParseException {
        Expression base = unary();
        if (context.match(TokenType.CARET)) {
            return new Expression.Infix(base, InfixOperator.CARET, power());
        }
        return base;
    }

    private Expression unary() throws ParseException {
        if (context.match(TokenType.MINUS)) {
            return new Expression.Prefix(PrefixOperator.MINUS, unary());
        }
        if (context.match(TokenType.PLUS)) {
            return new Expression.Prefix(PrefixOperator.PLUS, unary());
        }
        return primary();
    }

    private Expression primary() throws ParseException {
        if (context.match(TokenType.INTEGER)) {
            return new Expression.Number(((Long) context.previous().value()).doubleValue());
        }
        if (context.match(TokenType.FLOAT)) {
            return new Expression.Number((Double) context.previous().value());
        }
        if (context.match(TokenType.VARIABLE)) {
            return new Expression.Variable((String) context.previous().value());
        }
        if (context.match(TokenType.LEFT_PAREN)) {
            Expression inner = additive();
            context.consume(TokenType.RIGHT_PAREN, "')'");
            return inner;
        }
        if (context.check(TokenType.IDENTIFIER)) {
            return named(context.advance());
        }
        throw new ParseException(Set.of("expression"), context.peek());
    }

    private Expression named(Token name) throws ParseException {
        Optional<ExpressionFunction> function = ExpressionFunction.fromName(name.text());
        if (function.isPresent() && context.match(TokenType.LEFT_PAREN)) {
            Expression argument = additive();
            context.consume(TokenType.RIGHT_PAREN, "')'");
            return new Expression.FunctionCall(function.get(), argument);
        }
        if (context.match(TokenType.LEFT_BRACKET)) {
            Expression index = additive();
            context.consume(TokenType.RIGHT_BRACKET, "']'");
            return new Expression.Address(name.text(), index);
        }
        Optional<MathConstant> constant = MathConstant.fromName(name.text());
        if (constant.isPresent()) {
            return new Expression.Constant(constant.get());
        }
        return new Expression.Address(name.text(), 0);
    }
}
