package io.github.cyfko.proplogic.core.parser;

import io.github.cyfko.proplogic.core.ast.And;
import io.github.cyfko.proplogic.core.ast.Iff;
import io.github.cyfko.proplogic.core.ast.Implies;
import io.github.cyfko.proplogic.core.ast.Literal;
import io.github.cyfko.proplogic.core.ast.Node;
import io.github.cyfko.proplogic.core.ast.Not;
import io.github.cyfko.proplogic.core.ast.Or;
import io.github.cyfko.proplogic.core.ast.Variable;
import io.github.cyfko.proplogic.core.config.LogicPolicy;
import io.github.cyfko.proplogic.core.env.Environment;
import io.github.cyfko.proplogic.core.exception.LexicalException;
import io.github.cyfko.proplogic.core.exception.SyntaxException;
import io.github.cyfko.proplogic.core.lexer.Lexer;
import io.github.cyfko.proplogic.core.lexer.SourcePosition;
import io.github.cyfko.proplogic.core.lexer.TokenKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for {@link Parser}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@DisplayName("Parser Tests")
class ParserTest {

    private static final Node P = new Variable("p");
    private static final Node Q = new Variable("q");
    private static final Node R = new Variable("r");

    private static Program parse(String source) {
        return new Parser(new Lexer(source), new Environment()).parse();
    }

    private static Node expression(String source) {
        return parse(source).expression();
    }

    private static SyntaxException syntaxError(String source) {
        return assertThrows(SyntaxException.class, () -> parse(source));
    }

    @Nested
    @DisplayName("Precedence and associativity")
    class Precedence {

        @Test
        @DisplayName("AND binds tighter than OR")
        void testAndOverOr() {
            assertEquals(new Or(Literal.TRUE, new And(Literal.FALSE, Literal.FALSE)), expression("1 v 0 ^ 0"));
            assertEquals(new Or(new And(Literal.TRUE, Literal.FALSE), Literal.FALSE), expression("1 ^ 0 v 0"));
        }

        @Test
        @DisplayName("NOT binds tighter than AND")
        void testNotOverAnd() {
            assertEquals(new And(new Not(Literal.FALSE), Literal.FALSE), expression("~0 ^ 0"));
        }

        @Test
        @DisplayName("IFF is the loosest operator")
        void testIffLowest() {
            assertEquals(new Iff(P, new Or(Q, R)), expression("p <=> q v r"));
        }

        @Test
        @DisplayName("Implication sits between IFF and OR")
        void testImplicationLevel() {
            Node expected = new Iff(P, new Implies(Q, new Or(R, new And(P, new Not(Q)))));
            assertEquals(expected, expression("p <=> q => r v p ^ ~q"));
        }

        @Test
        @DisplayName("Binary operators associate to the left")
        void testLeftAssociativity() {
            assertEquals(new Or(new Or(P, Q), R), expression("p v q v r"));
            assertEquals(new And(new And(P, Q), R), expression("p ^ q ^ r"));
            assertEquals(new Iff(new Iff(P, Q), R), expression("p <=> q <=> r"));
            assertEquals(new Implies(new Implies(P, Q), R), expression("p => q => r"));
        }

        @Test
        @DisplayName("Repeated negation nests")
        void testDoubleNegation() {
            assertEquals(new Not(new Not(P)), expression("~~p"));
        }

        @Test
        @DisplayName("Parentheses override precedence and leave no node behind")
        void testParentheses() {
            assertEquals(new And(new Or(P, Q), R), expression("(p v q) ^ r"));
            assertEquals(new Not(new And(Literal.TRUE, Literal.TRUE)), expression("~(1 ^ 1)"));
            assertEquals(Literal.TRUE, expression("((1))"));
        }

        @Test
        @DisplayName("Parsing the same text twice yields equal trees")
        void testDeterministic() {
            String source = "a := 1\n~(a ^ b) => c <=> 0";
            assertEquals(parse(source).expression(), parse(source).expression());
        }
    }

    @Nested
    @DisplayName("Assignments")
    class Assignments {

        @Test
        @DisplayName("Assignment lines fill the environment")
        void testAssignmentsBound() {
            Program program = parse("p := 1\nq := 0\n~p v ~q");

            assertEquals(Map.of("p", true, "q", false), program.environment().snapshot());
            assertEquals(new Or(new Not(P), new Not(Q)), program.expression());
        }

        @Test
        @DisplayName("Blank lines around statements are ignored")
        void testBlankLines() {
            Program program = parse("\n\np := 1\n\n\np\n\n");

            assertEquals(Map.of("p", true), program.environment().snapshot());
            assertEquals(P, program.expression());
        }

        @Test
        @DisplayName("Unassigned variables are accepted by the parser")
        void testUnboundAllowed() {
            Program program = parse("p := 1\np ^ q");
            assertFalse(program.environment().isBound("q"));
        }

        @Test
        @DisplayName("Reassigning a variable is rejected at the second assignment")
        void testDuplicateAssignment() {
            SyntaxException e = syntaxError("p := 1\np := 0\np");

            assertEquals(SyntaxException.Kind.DUPLICATE_ASSIGNMENT, e.getKind());
            assertEquals("p", e.getName().orElseThrow());
            assertEquals(new SourcePosition(7, 2, 1), e.getPosition().orElseThrow());
        }

        @Test
        @DisplayName("Assigned value must be a literal")
        void testNonLiteralValue() {
            SyntaxException e = syntaxError("p := q\np");

            assertEquals(SyntaxException.Kind.UNEXPECTED_TOKEN, e.getKind());
            assertEquals("'0' or '1'", e.getExpected().orElseThrow());
            assertEquals(TokenKind.IDENT, e.getFound().orElseThrow().kind());
        }

        @Test
        @DisplayName("Assignment must end its line")
        void testAssignmentSharingLine() {
            SyntaxException e = syntaxError("p := 1 q := 0\np");

            assertEquals("end of line", e.getExpected().orElseThrow());
            assertEquals(new SourcePosition(7, 1, 8), e.getPosition().orElseThrow());
        }

        @Test
        @DisplayName("Assignment after the expression is rejected")
        void testAssignmentAfterExpression() {
            SyntaxException e = syntaxError("p\nq := 1");

            assertEquals(SyntaxException.Kind.UNEXPECTED_TOKEN, e.getKind());
            assertEquals("end of input", e.getExpected().orElseThrow());
            assertEquals(new SourcePosition(2, 2, 1), e.getPosition().orElseThrow());
        }
    }

    @Nested
    @DisplayName("Syntax errors")
    class Errors {

        @Test
        @DisplayName("Unclosed parenthesis reports the missing ')' at end of input")
        void testUnclosedParenthesis() {
            SyntaxException e = syntaxError("(1 v 0");

            assertEquals(SyntaxException.Kind.UNEXPECTED_TOKEN, e.getKind());
            assertEquals("')'", e.getExpected().orElseThrow());
            assertEquals(TokenKind.EOF, e.getFound().orElseThrow().kind());
            assertEquals(new SourcePosition(6, 1, 7), e.getPosition().orElseThrow());
            assertEquals("Syntax error at line 1, column 7: expected ')' but found end of input", e.getMessage());
        }

        @ParameterizedTest(name = "[{index}] {0}")
        @ValueSource(strings = {"", "\n\n", "p := 1", "p := 1\n", "p := 1\nq := 0\n\n"})
        @DisplayName("Programs without an expression are empty")
        void testEmptyProgram(String source) {
            assertEquals(SyntaxException.Kind.EMPTY_PROGRAM, syntaxError(source).getKind());
        }

        @ParameterizedTest(name = "[{index}] {0}")
        @ValueSource(strings = {"1 v", "^ 1", ")", "1 0", "()", "p q", "1 v\n0", "~", "(1))", "1 :="})
        @DisplayName("Malformed expressions are rejected")
        void testMalformed(String source) {
            assertEquals(SyntaxException.Kind.UNEXPECTED_TOKEN, syntaxError(source).getKind());
        }

        @Test
        @DisplayName("Dangling operator expects an operand")
        void testDanglingOperator() {
            SyntaxException e = syntaxError("1 v");

            assertEquals("'0', '1', identifier, '~' or '('", e.getExpected().orElseThrow());
            assertEquals(TokenKind.EOF, e.getFound().orElseThrow().kind());
        }

        @Test
        @DisplayName("Lexical errors propagate unchanged")
        void testLexicalErrorPropagates() {
            assertThrows(LexicalException.class, () -> parse("p := 1\n1 & 0"));
        }

        @Test
        @DisplayName("Tokens are only read as far as the parser needs")
        void testStopsAtFirstError() {
            // the second literal is rejected before the lexer reaches '$'
            assertThrows(SyntaxException.class, () -> parse("1 1 $"));
        }
    }

    @Nested
    @DisplayName("Nesting limit")
    class Nesting {

        private final LogicPolicy shallow = LogicPolicy.builder().maxNestingDepth(3).build();

        private Program parseShallow(String source) {
            return new Parser(new Lexer(source), new Environment(), shallow).parse();
        }

        @ParameterizedTest(name = "[{index}] {0}")
        @ValueSource(strings = {"(((1)))", "~~~1", "a v b v c v d", "~(a ^ b)", "a v b ^ c v d"})
        @DisplayName("Expressions within the limit parse")
        void testWithinLimit(String source) {
            assertDoesNotThrow(() -> parseShallow(source));
        }

        @ParameterizedTest(name = "[{index}] {0}")
        @ValueSource(strings = {"((((1))))", "~~~~1", "a v b v c v d v e", "~(~(a ^ b))"})
        @DisplayName("Expressions beyond the limit are rejected")
        void testBeyondLimit(String source) {
            SyntaxException e = assertThrows(SyntaxException.class, () -> parseShallow(source));

            assertEquals(SyntaxException.Kind.NESTING_TOO_DEEP, e.getKind());
            assertTrue(e.getMessage().contains("3 levels"));
        }

        @Test
        @DisplayName("Default policy accepts parentheses up to its limit")
        void testDefaultDepth() {
            int limit = LogicPolicy.defaults().maxNestingDepth();

            assertEquals(P, expression("(".repeat(limit) + "p" + ")".repeat(limit)));
            assertThrows(SyntaxException.class,
                    () -> expression("(".repeat(limit + 1) + "p" + ")".repeat(limit + 1)));
        }

        @Test
        @DisplayName("A flat operator chain counts one level per operator")
        void testFlatChainMessage() {
            SyntaxException e = assertThrows(SyntaxException.class, () -> parseShallow("1 v 0 v 0 v 0 v 0"));

            assertEquals(new SourcePosition(14, 1, 15), e.getPosition().orElseThrow());
            assertEquals("Syntax error at line 1, column 15: expression nests deeper than 3 levels "
                    + "(each '~', '(' and chained binary operator counts as one)", e.getMessage());
        }
    }
}
