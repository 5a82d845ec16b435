package io.github.cyfko.proplogic.core.api;

import io.github.cyfko.proplogic.core.exception.EvaluationException;
import io.github.cyfko.proplogic.core.exception.LexicalException;
import io.github.cyfko.proplogic.core.exception.LogicException;
import io.github.cyfko.proplogic.core.exception.SyntaxException;
import io.github.cyfko.proplogic.core.parser.Program;

/**
 * Entry point running a propositional-logic statement through the lex, parse and evaluate pipeline.
 * <p>
 * A statement is zero or more assignment lines followed by exactly one expression line. Its result
 * is the truth value of the expression.
 * </p>
 *
 * <h2>Language Reference</h2>
 * <table border="1">
 * <caption>Operators, loosest binding first</caption>
 * <thead>
 * <tr><th>Operator</th><th>Symbol</th><th>Associativity</th><th>Example</th></tr>
 * </thead>
 * <tbody>
 * <tr><td>Biconditional</td><td>&lt;=&gt;</td><td>Left</td><td>p &lt;=&gt; q</td></tr>
 * <tr><td>Implication</td><td>=&gt;</td><td>Left</td><td>p =&gt; q</td></tr>
 * <tr><td>OR</td><td>v</td><td>Left</td><td>p v q</td></tr>
 * <tr><td>AND</td><td>^</td><td>Left</td><td>p ^ q</td></tr>
 * <tr><td>NOT</td><td>~</td><td>Right (prefix)</td><td>~p</td></tr>
 * <tr><td>Parentheses</td><td>( )</td><td>N/A</td><td>(p v q) ^ r</td></tr>
 * </tbody>
 * </table>
 *
 * <h2>Usage Examples</h2>
 * <pre>{@code
 * LogicInterpreter interpreter = new BasicLogicInterpreter();
 *
 * interpreter.evaluate("1 v 0 ^ 0");              // true: AND binds tighter than OR
 * interpreter.evaluate("p := 1\nq := 0\n~p v ~q"); // true
 *
 * // Result variant, no exception
 * EvaluationResult result = interpreter.run("p v q");
 * result.isSuccess();             // false
 * result.getStage();              // Optional[EVAL]
 * }</pre>
 *
 * <h2>Error Detection</h2>
 * <ul>
 *   <li>{@link LexicalException}: a character matches no token</li>
 *   <li>{@link SyntaxException}: token mismatch, empty program, duplicate assignment, policy limit</li>
 *   <li>{@link EvaluationException}: reference to an unbound variable</li>
 * </ul>
 * <p>
 * Stages run strictly in order: a lexical or syntax error means nothing is evaluated.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see EvaluationResult
 */
public interface LogicInterpreter {

    /**
     * Lexes and parses a statement without evaluating it.
     * <p>
     * The returned program owns a fresh environment holding the statement's assignments.
     * </p>
     *
     * @param source the statement text
     * @return the parsed program
     * @throws LexicalException if the source contains an invalid character
     * @throws SyntaxException  if the statement is malformed or exceeds the policy limits
     * @throws NullPointerException if source is null
     */
    Program parse(String source);

    /**
     * Evaluates an already parsed program against its own environment.
     *
     * @param program the parsed program
     * @return the truth value of the program's expression
     * @throws EvaluationException if the expression references an unbound variable
     */
    boolean evaluate(Program program);

    /**
     * Parses and evaluates a statement.
     *
     * @param source the statement text
     * @return the truth value of the final expression
     * @throws LogicException on any lexical, syntax or evaluation failure
     */
    default boolean evaluate(String source) {
        return evaluate(parse(source));
    }

    /**
     * Parses and evaluates a statement, reporting failures as a value instead of throwing.
     *
     * @param source the statement text
     * @return a success holding the truth value, or a failure holding the error
     * @throws NullPointerException if source is null
     */
    EvaluationResult run(String source);
}
