package org.quilkit.compiler.frontend;

import org.quilkit.compiler.api.LexException;
import org.quilkit.compiler.frontend.lexer.Keyword;
import org.quilkit.compiler.frontend.lexer.Lexer;
import org.quilkit.compiler.frontend.lexer.Token;
import org.quilkit.compiler.frontend.lexer.TokenType;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link Lexer}.
 * These tests verify that the lexer correctly converts Quil source text into a stream of tokens,
 * including keywords, numbers, labels, indentation and source positions.
 */
public class LexerTest {

    private static List<TokenType> types(List<Token> tokens) {
        return tokens.stream().map(Token::type).toList();
    }

    @Test
    @Tag("unit")
    void testGateApplicationTokenization() throws LexException {
        // Arrange
        Lexer lexer = new Lexer("RX(pi/2) 0 # rotate");

        // Act
        List<Token> tokens = lexer.scanTokens();

        // Assert
        assertThat(types(tokens)).containsExactly(
                TokenType.IDENTIFIER, TokenType.LEFT_PAREN, TokenType.IDENTIFIER, TokenType.SLASH,
                TokenType.INTEGER, TokenType.RIGHT_PAREN, TokenType.INTEGER, TokenType.END_OF_FILE);
        assertThat(tokens.get(0).text()).isEqualTo("RX");
        assertThat(tokens.get(4).value()).isEqualTo(2L);
    }

    @Test
    @Tag("unit")
    void testKeywordsLabelsAndVariables() throws LexException {
        // Arrange
        Lexer lexer = new Lexer("JUMP-WHEN @loop ro[0]\nRX(%theta) q");

        // Act
        List<Token> tokens = lexer.scanTokens();

        // Assert
        assertThat(tokens.get(0).type()).isEqualTo(TokenType.KEYWORD);
        assertThat(tokens.get(0).is(Keyword.JUMP_WHEN)).isTrue();
        assertThat(tokens.get(1)).extracting(Token::type, Token::text, Token::value)
                .containsExactly(TokenType.LABEL, "@loop", "loop");
        assertThat(tokens.get(2)).extracting(Token::type, Token::text).containsExactly(TokenType.IDENTIFIER, "ro");
        assertThat(tokens.get(6).type()).isEqualTo(TokenType.NEWLINE);
        assertThat(tokens.get(9)).extracting(Token::type, Token::value).containsExactly(TokenType.VARIABLE, "theta");
    }

    @Test
    @Tag("unit")
    void testContextualWordsStayIdentifiers() throws LexException {
        // Arrange
        Lexer lexer = new Lexer("DEFGATE X AS PERMUTATION:");

        // Act
        List<Token> tokens = lexer.scanTokens();

        // Assert
        assertThat(types(tokens)).containsExactly(
                TokenType.KEYWORD, TokenType.IDENTIFIER, TokenType.IDENTIFIER, TokenType.IDENTIFIER,
                TokenType.COLON, TokenType.END_OF_FILE);
    }

    @Test
    @Tag("unit")
    void testNumericLiterals() throws LexException {
        // Arrange
        Lexer lexer = new Lexer("42 1.5 .5 2e9 1.0E-6");

        // Act
        List<Token> tokens = lexer.scanTokens();

        // Assert
        assertThat(tokens.get(0)).extracting(Token::type, Token::value).containsExactly(TokenType.INTEGER, 42L);
        assertThat(tokens.get(1)).extracting(Token::type, Token::value).containsExactly(TokenType.FLOAT, 1.5);
        assertThat(tokens.get(2)).extracting(Token::type, Token::value).containsExactly(TokenType.FLOAT, 0.5);
        assertThat(tokens.get(3)).extracting(Token::type, Token::value).containsExactly(TokenType.FLOAT, 2e9);
        assertThat(tokens.get(4)).extracting(Token::type, Token::value).containsExactly(TokenType.FLOAT, 1.0e-6);
    }

    @Test
    @Tag("unit")
    void testSemicolonSeparatesInstructionsAndCommentsAreSkipped() throws LexException {
        // Arrange
        Lexer lexer = new Lexer("H 0; X 1 # both\n# only a comment\n");

        // Act
        List<Token> tokens = lexer.scanTokens();

        // Assert
        assertThat(types(tokens)).containsExactly(
                TokenType.IDENTIFIER, TokenType.INTEGER, TokenType.NEWLINE,
                TokenType.IDENTIFIER, TokenType.INTEGER, TokenType.NEWLINE,
                TokenType.NEWLINE, TokenType.END_OF_FILE);
    }

    @Test
    @Tag("unit")
    void testIndentationOnlyForLinesWithCode() throws LexException {
        // Arrange
        String source = String.join("\n",
                "DEFCIRCUIT BELL q p:",
                "    H q",
                "      ",
                "    # comment",
                "\tCNOT q p",
                "  X 0");
        Lexer lexer = new Lexer(source);

        // Act
        List<Token> tokens = lexer.scanTokens();

        // Assert
        List<Token> indents = tokens.stream().filter(t -> t.type() == TokenType.INDENTATION).toList();
        assertThat(indents).extracting(Token::line).containsExactly(2, 5);
    }

    @Test
    @Tag("unit")
    void testCustomIndentWidth() throws LexException {
        // Arrange
        Lexer lexer = new Lexer("  H 0", "<memory>", 2);

        // Act
        List<Token> tokens = lexer.scanTokens();

        // Assert
        assertThat(tokens.get(0).type()).isEqualTo(TokenType.INDENTATION);
    }

    @Test
    @Tag("unit")
    void testTrailingHyphenIsNotPartOfIdentifier() throws LexException {
        // Arrange
        Lexer lexer = new Lexer("a-b a- 1");

        // Act
        List<Token> tokens = lexer.scanTokens();

        // Assert
        assertThat(tokens.get(0).text()).isEqualTo("a-b");
        assertThat(tokens.get(1).text()).isEqualTo("a");
        assertThat(tokens.get(2).type()).isEqualTo(TokenType.MINUS);
    }

    @Test
    @Tag("unit")
    void testStringEscapes() throws LexException {
        // Arrange
        Lexer lexer = new Lexer("PRAGMA X \"a \\\"b\\\" \\\\c\"");

        // Act
        List<Token> tokens = lexer.scanTokens();

        // Assert
        assertThat(tokens.get(2)).extracting(Token::type, Token::value)
                .containsExactly(TokenType.STRING, "a \"b\" \\c");
    }

    @Test
    @Tag("unit")
    void testPositionsCountUtf8Bytes() throws LexException {
        // Arrange
        Lexer lexer = new Lexer("\"é\" X\nY", "prog.quil");

        // Act
        List<Token> tokens = lexer.scanTokens();

        // Assert
        Token x = tokens.get(1);
        assertThat(x.text()).isEqualTo("X");
        assertThat(x.line()).isEqualTo(1);
        assertThat(x.column()).isEqualTo(5);
        assertThat(x.byteOffset()).isEqualTo(5);
        Token y = tokens.get(3);
        assertThat(y.line()).isEqualTo(2);
        assertThat(y.column()).isEqualTo(1);
        assertThat(y.byteOffset()).isEqualTo(7);
        assertThat(y.fileName()).isEqualTo("prog.quil");
    }

    @Test
    @Tag("unit")
    void testUnexpectedCharacterIsReported() {
        // Arrange
        Lexer lexer = new Lexer("H 0\nX $");

        // Act & Assert
        assertThatThrownBy(lexer::scanTokens)
                .isInstanceOf(LexException.class)
                .satisfies(e -> {
                    LexException error = (LexException) e;
                    assertThat(error.getUnexpected()).isEqualTo("$");
                    assertThat(error.getLocation().lineNumber()).isEqualTo(2);
                    assertThat(error.getLocation().columnNumber()).isEqualTo(3);
                });
    }

    @Test
    @Tag("unit")
    void testUnterminatedStringIsReported() {
        // Arrange
        Lexer lexer = new Lexer("PRAGMA X \"open");

        // Act & Assert
        assertThatThrownBy(lexer::scanTokens)
                .isInstanceOf(LexException.class)
                .hasMessageContaining("Unterminated string");
    }

    @Test
    @Tag("unit")
    void testOversizedIntegerIsReported() {
        // Arrange
        Lexer lexer = new Lexer("X 99999999999999999999");

        // Act & Assert
        assertThatThrownBy(lexer::scanTokens)
                .isInstanceOf(LexException.class)
                .hasMessageContaining("out of range");
    }

    @Test
    @Tag("unit")
    void testOverflowingRealIsReported() {
        // Arrange
        Lexer lexer = new Lexer("RX(1e400) 0");

        // Act & Assert
        assertThatThrownBy(lexer::scanTokens)
                .isInstanceOf(LexException.class)
                .hasMessageContaining("Real literal out of range");
    }
}
