package io.github.cyfko.proplogic.core.lexer;

import io.github.cyfko.proplogic.core.exception.LexicalException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.NoSuchElementException;

import static io.github.cyfko.proplogic.core.lexer.TokenKind.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for {@link Lexer}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@DisplayName("Lexer Tests")
class LexerTest {

    private static List<TokenKind> kinds(String source) {
        return new Lexer(source).tokenize().stream().map(Token::kind).toList();
    }

    @Nested
    @DisplayName("Token recognition")
    class Recognition {

        @Test
        @DisplayName("Literals and every operator symbol")
        void testAllSymbols() {
            assertEquals(
                    List.of(LITERAL_0, LITERAL_1, NOT, AND, OR, IMPLIES, IFF, LPAREN, RPAREN, EOF),
                    kinds("0 1 ~ ^ v => <=> ( )"));
        }

        @Test
        @DisplayName("Symbols need no surrounding whitespace")
        void testCompactExpression() {
            assertEquals(List.of(NOT, LPAREN, LITERAL_1, AND, LITERAL_0, RPAREN, IFF, LITERAL_1, EOF),
                    kinds("~(1^0)<=>1"));
        }

        @Test
        @DisplayName("Assignment lines followed by an expression")
        void testAssignmentProgram() {
            List<Token> tokens = new Lexer("p := 1\nq := 0\n~p v ~q").tokenize();

            assertEquals(List.of(IDENT, ASSIGN, LITERAL_1, NEWLINE, IDENT, ASSIGN, LITERAL_0, NEWLINE,
                    NOT, IDENT, OR, NOT, IDENT, EOF), tokens.stream().map(Token::kind).toList());
            assertEquals("p", tokens.get(0).text());
            assertEquals("q", tokens.get(4).text());
        }

        @ParameterizedTest(name = "''{0}'' lexes as {1}")
        @CsvSource({
                "v, OR",
                "var, IDENT",
                "vv, IDENT",
                "V, IDENT",
                "pvq, IDENT",
                "Alpha, IDENT"
        })
        @DisplayName("Letter runs are identifiers except the lone 'v'")
        void testIdentifierVersusOr(String source, TokenKind expected) {
            List<Token> tokens = new Lexer(source).tokenize();
            assertEquals(2, tokens.size());
            assertEquals(expected, tokens.get(0).kind());
            assertEquals(source, tokens.get(0).text());
        }

        @Test
        @DisplayName("Identifiers are separated from operators")
        void testIdentifierBoundaries() {
            assertEquals(List.of(IDENT, OR, IDENT, AND, NOT, IDENT, EOF), kinds("p v q^~r"));
        }

        @Test
        @DisplayName("Blank lines collapse into a single NEWLINE")
        void testNewlineCollapse() {
            List<Token> tokens = new Lexer("1\n\n  \n0").tokenize();

            assertEquals(List.of(LITERAL_1, NEWLINE, LITERAL_0, EOF), tokens.stream().map(Token::kind).toList());
            assertEquals(new SourcePosition(6, 4, 1), tokens.get(2).position());
        }

        @Test
        @DisplayName("Carriage returns and tabs are ignored")
        void testWindowsLineEndings() {
            assertEquals(List.of(IDENT, ASSIGN, LITERAL_1, NEWLINE, IDENT, EOF), kinds("p\t:= 1\r\np"));
        }

        @Test
        @DisplayName("Empty source yields only EOF")
        void testEmptySource() {
            assertEquals(List.of(EOF), kinds(""));
        }
    }

    @Nested
    @DisplayName("Positions")
    class Positions {

        @Test
        @DisplayName("Tokens report offset, line and column of their first character")
        void testPositionsAcrossLines() {
            List<Token> tokens = new Lexer("p := 1\nq := 0\n~p v ~q").tokenize();

            assertEquals(new SourcePosition(0, 1, 1), tokens.get(0).position());
            assertEquals(new SourcePosition(2, 1, 3), tokens.get(1).position());
            assertEquals(new SourcePosition(5, 1, 6), tokens.get(2).position());
            assertEquals(new SourcePosition(7, 2, 1), tokens.get(4).position());
            assertEquals(new SourcePosition(14, 3, 1), tokens.get(8).position());
            assertEquals(new SourcePosition(17, 3, 4), tokens.get(10).position());
        }

        @Test
        @DisplayName("EOF sits just after the last character")
        void testEofPosition() {
            List<Token> tokens = new Lexer("p := 1\nq := 0\n~p v ~q").tokenize();
            assertEquals(new SourcePosition(21, 3, 8), tokens.get(tokens.size() - 1).position());
        }
    }

    @Nested
    @DisplayName("Lexical errors")
    class Errors {

        @Test
        @DisplayName("Unknown character is reported with its position")
        void testUnknownCharacter() {
            LexicalException e = assertThrows(LexicalException.class, () -> new Lexer("1 & 0").tokenize());

            assertEquals('&', e.getUnexpectedChar());
            assertEquals(new SourcePosition(2, 1, 3), e.getPosition());
            assertEquals("Lexical error at line 1, column 3: unexpected character '&'", e.getMessage());
        }

        @Test
        @DisplayName("Digits other than 0 and 1 are rejected")
        void testOtherDigit() {
            LexicalException e = assertThrows(LexicalException.class, () -> new Lexer("2").tokenize());
            assertEquals('2', e.getUnexpectedChar());
        }

        @Test
        @DisplayName("Broken '<=>' reports the first mismatching character")
        void testBrokenIff() {
            LexicalException e = assertThrows(LexicalException.class, () -> new Lexer("1 <= 0").tokenize());

            assertEquals(' ', e.getUnexpectedChar());
            assertEquals(new SourcePosition(4, 1, 5), e.getPosition());
        }

        @Test
        @DisplayName("Symbol cut by end of input reports its leading character")
        void testTruncatedSymbol() {
            LexicalException e = assertThrows(LexicalException.class, () -> new Lexer("1 <").tokenize());

            assertEquals('<', e.getUnexpectedChar());
            assertEquals(new SourcePosition(2, 1, 3), e.getPosition());
        }

        @Test
        @DisplayName("Assignment written with '=' instead of ':='")
        void testPlainEquals() {
            LexicalException e = assertThrows(LexicalException.class, () -> new Lexer("p = 1").tokenize());
            assertEquals(' ', e.getUnexpectedChar());
            assertEquals(3, e.getPosition().offset());
        }

        @Test
        @DisplayName("Lone ':' is rejected")
        void testLoneColon() {
            assertThrows(LexicalException.class, () -> new Lexer("p :1").tokenize());
        }
    }

    @Nested
    @DisplayName("Lazy iteration")
    class Iteration {

        @Test
        @DisplayName("Characters are only checked when reached")
        void testErrorIsDeferred() {
            Lexer lexer = new Lexer("1 $");

            assertEquals(LITERAL_1, lexer.next().kind());
            assertThrows(LexicalException.class, lexer::next);
        }

        @Test
        @DisplayName("EOF is produced exactly once")
        void testSingleEof() {
            Lexer lexer = new Lexer("1");

            assertEquals(LITERAL_1, lexer.next().kind());
            assertTrue(lexer.hasNext());
            assertEquals(EOF, lexer.next().kind());
            assertFalse(lexer.hasNext());
            assertThrows(NoSuchElementException.class, lexer::next);
        }

        @Test
        @DisplayName("A new lexer over the same text restarts the sequence")
        void testRestartByReinvoking() {
            String source = "p := 1\np ^ ~p";
            assertEquals(new Lexer(source).tokenize(), new Lexer(source).tokenize());
        }
    }
}
