package org.quilkit.compiler.frontend.command;

import org.quilkit.compiler.frontend.lexer.Keyword;
import org.quilkit.compiler.frontend.lexer.Lexer;
import org.quilkit.compiler.frontend.lexer.TokenType;
import org.quilkit.compiler.frontend.parser.Parser;
import org.quilkit.compiler.frontend.parser.ParsingContext;
import org.quilkit.compiler.ir.Program;
import org.quilkit.compiler.ir.instruction.Nop;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests the keyword dispatch of the {@link CommandHandlerRegistry}.
 */
@ExtendWith(MockitoExtension.class)
public class CommandHandlerRegistryTest {

    @Mock
    private ICommandHandler pragmaHandler;

    @Test
    @Tag("unit")
    void testEveryCommandKeywordHasAHandler() {
        // Arrange
        CommandHandlerRegistry registry = CommandHandlerRegistry.initialize();

        // Act & Assert
        for (Keyword keyword : Keyword.values()) {
            if (keyword.isModifier()) {
                assertThat(registry.get(keyword)).as(keyword.name()).isEmpty();
            } else {
                assertThat(registry.get(keyword)).as(keyword.name()).isPresent();
            }
        }
    }

    @Test
    @Tag("unit")
    void testRegisteredHandlerReplacesBuiltIn() throws Exception {
        // Arrange
        when(pragmaHandler.parse(any())).thenAnswer(invocation -> {
            ParsingContext context = invocation.getArgument(0);
            while (!context.check(TokenType.NEWLINE) && !context.isAtEnd()) {
                context.advance();
            }
            return new Nop();
        });
        CommandHandlerRegistry registry = CommandHandlerRegistry.initialize();
        registry.register(Keyword.PRAGMA, pragmaHandler);

        // Act
        Program program = new Parser(new Lexer("PRAGMA A\nH 0\nPRAGMA B \"x\"").scanTokens(), "test", registry).parse();

        // Assert
        verify(pragmaHandler, times(2)).parse(any());
        assertThat(program.items()).hasSize(3);
        assertThat(program.items().get(0)).isInstanceOf(Nop.class);
        assertThat(program.items().get(2)).isInstanceOf(Nop.class);
    }
}
