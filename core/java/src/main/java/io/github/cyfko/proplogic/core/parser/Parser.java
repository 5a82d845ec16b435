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
import io.github.cyfko.proplogic.core.lexer.Token;
import io.github.cyfko.proplogic.core.lexer.TokenKind;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Recursive-descent parser turning a token stream into a {@link Program}.
 *
 * <h2>Grammar (EBNF, lowest to highest precedence)</h2>
 * <pre>
 * program       := { assignment } expression { NEWLINE } EOF
 * assignment    := IDENT ':=' ( '0' | '1' ) ( NEWLINE | EOF )
 * expression    := biconditional
 * biconditional := implication { '&lt;=&gt;' implication }
 * implication   := or_expr { '=&gt;' or_expr }
 * or_expr       := and_expr { 'v' and_expr }
 * and_expr      := not_expr { '^' not_expr }
 * not_expr      := { '~' } atom
 * atom          := '0' | '1' | IDENT | '(' expression ')'
 * </pre>
 *
 * <p>
 * Binary operators associate to the left, so {@code a v b v c} parses as {@code (a v b) v c}.
 * Repeated negation nests to the right: {@code ~~a} is {@code Not(Not(a))}.
 * </p>
 *
 * <h2>Assignments</h2>
 * <p>
 * Assignment lines form a contiguous prefix. A line is an assignment when it starts with an
 * identifier immediately followed by {@code :=}; the first line that is not commits the parser to the
 * final expression. Each assignment is recorded in the {@link Environment} as it is read. Rebinding a
 * name fails with {@link SyntaxException.Kind#DUPLICATE_ASSIGNMENT}. Variables used by the expression
 * are not checked here; that happens at evaluation time.
 * </p>
 *
 * <h2>Nesting limit</h2>
 * <p>
 * Each negation, parenthesis and chained binary operator adds one level of nesting, so a flat
 * chain such as {@code a v b v c} counts two levels: its left-leaning tree is that deep. Exceeding
 * {@link LogicPolicy#maxNestingDepth()} fails with {@link SyntaxException.Kind#NESTING_TOO_DEEP}.
 * One parenthesis level costs six stack frames here; {@link LogicPolicy#MAX_NESTING_DEPTH} keeps
 * that within a default thread stack.
 * </p>
 *
 * <p>
 * Tokens are pulled lazily from the iterator, at most two ahead. A parser instance parses one program.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class Parser {

    private static final Logger log = Logger.getLogger(Parser.class.getName());

    private static final String ATOM_EXPECTATION = "'0', '1', identifier, '~' or '('";

    private final Iterator<Token> tokens;
    private final Environment environment;
    private final int maxNestingDepth;
    private final List<Token> lookahead = new ArrayList<>(2);
    private int depth = 0;

    public Parser(Iterator<Token> tokens, Environment environment) {
        this(tokens, environment, LogicPolicy.defaults());
    }

    public Parser(Iterator<Token> tokens, Environment environment, LogicPolicy policy) {
        this.tokens = Objects.requireNonNull(tokens, "tokens cannot be null");
        this.environment = Objects.requireNonNull(environment, "environment cannot be null");
        this.maxNestingDepth = Objects.requireNonNull(policy, "policy cannot be null").maxNestingDepth();
    }

    /**
     * Parses the assignment prefix and the final expression.
     *
     * @return the parsed program, sharing this parser's environment
     * @throws SyntaxException  if the tokens do not form a valid program
     * @throws LexicalException if the underlying lexer meets an invalid character
     */
    public Program parse() {
        skipNewlines();
        while (check(TokenKind.IDENT) && checkNext(TokenKind.ASSIGN)) {
            parseAssignment();
            skipNewlines();
        }

        if (check(TokenKind.EOF)) {
            throw SyntaxException.emptyProgram(peek().position());
        }

        Node expression = parseExpression();

        skipNewlines();
        if (!check(TokenKind.EOF)) {
            throw SyntaxException.unexpectedToken(TokenKind.EOF.description(), peek());
        }

        log.fine(() -> String.format("Parsed %d assignment(s) and an expression of %d node(s)",
                environment.size(), expression.size()));

        return new Program(expression, environment);
    }

    private void parseAssignment() {
        Token name = advance();
        if (environment.isBound(name.text())) {
            throw SyntaxException.duplicateAssignment(name.text(), name.position());
        }
        expect(TokenKind.ASSIGN);

        Token value = peek();
        boolean bound = switch (value.kind()) {
            case LITERAL_1 -> true;
            case LITERAL_0 -> false;
            default -> throw SyntaxException.unexpectedToken("'0' or '1'", value);
        };
        advance();

        if (!check(TokenKind.NEWLINE) && !check(TokenKind.EOF)) {
            throw SyntaxException.unexpectedToken(TokenKind.NEWLINE.description(), peek());
        }

        environment.bind(name.text(), bound);
        log.finer(() -> "Bound " + name.text() + " := " + (bound ? 1 : 0));
    }

    private Node parseExpression() {
        Node left = parseImplication();
        int chained = 0;
        while (check(TokenKind.IFF)) {
            enterNesting(advance());
            chained++;
            left = new Iff(left, parseImplication());
        }
        depth -= chained;
        return left;
    }

    private Node parseImplication() {
        Node left = parseOr();
        int chained = 0;
        while (check(TokenKind.IMPLIES)) {
            enterNesting(advance());
            chained++;
            left = new Implies(left, parseOr());
        }
        depth -= chained;
        return left;
    }

    private Node parseOr() {
        Node left = parseAnd();
        int chained = 0;
        while (check(TokenKind.OR)) {
            enterNesting(advance());
            chained++;
            left = new Or(left, parseAnd());
        }
        depth -= chained;
        return left;
    }

    private Node parseAnd() {
        Node left = parseNot();
        int chained = 0;
        while (check(TokenKind.AND)) {
            enterNesting(advance());
            chained++;
            left = new And(left, parseNot());
        }
        depth -= chained;
        return left;
    }

    private Node parseNot() {
        int negations = 0;
        while (check(TokenKind.NOT)) {
            enterNesting(advance());
            negations++;
        }

        Node node = parseAtom();
        for (int i = 0; i < negations; i++) {
            node = new Not(node);
        }
        depth -= negations;
        return node;
    }

    private Node parseAtom() {
        Token token = peek();
        switch (token.kind()) {
            case LITERAL_1:
                advance();
                return Literal.TRUE;
            case LITERAL_0:
                advance();
                return Literal.FALSE;
            case IDENT:
                advance();
                return new Variable(token.text());
            case LPAREN:
                enterNesting(advance());
                Node inner = parseExpression();
                expect(TokenKind.RPAREN);
                depth--;
                return inner;
            default:
                throw SyntaxException.unexpectedToken(ATOM_EXPECTATION, token);
        }
    }

    // --- token helpers ---

    private void enterNesting(Token token) {
        if (++depth > maxNestingDepth) {
            throw SyntaxException.nestingTooDeep(maxNestingDepth, token.position());
        }
    }

    private void skipNewlines() {
        while (check(TokenKind.NEWLINE)) {
            advance();
        }
    }

    private Token expect(TokenKind kind) {
        if (!check(kind)) {
            throw SyntaxException.unexpectedToken(kind.description(), peek());
        }
        return advance();
    }

    private boolean check(TokenKind kind) {
        return peek().is(kind);
    }

    private boolean checkNext(TokenKind kind) {
        return peek(1).is(kind);
    }

    private Token peek() {
        return peek(0);
    }

    private Token peek(int distance) {
        fill(distance);
        // past EOF the stream keeps answering EOF
        return lookahead.get(Math.min(distance, lookahead.size() - 1));
    }

    private Token advance() {
        Token token = peek();
        if (!token.is(TokenKind.EOF)) {
            lookahead.remove(0);
        }
        return token;
    }

    private void fill(int distance) {
        while (lookahead.size() <= distance) {
            if (!lookahead.isEmpty() && lookahead.get(lookahead.size() - 1).is(TokenKind.EOF)) {
                return;
            }
            if (!tokens.hasNext()) {
                throw new IllegalStateException("Token stream ended without an EOF token");
            }
            lookahead.add(tokens.next());
        }
    }
}
