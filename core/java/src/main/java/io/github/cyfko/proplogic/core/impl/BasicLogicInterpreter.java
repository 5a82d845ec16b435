package io.github.cyfko.proplogic.core.impl;

import io.github.cyfko.proplogic.core.api.EvaluationResult;
import io.github.cyfko.proplogic.core.api.LogicInterpreter;
import io.github.cyfko.proplogic.core.config.LogicPolicy;
import io.github.cyfko.proplogic.core.env.Environment;
import io.github.cyfko.proplogic.core.eval.Evaluator;
import io.github.cyfko.proplogic.core.exception.LogicException;
import io.github.cyfko.proplogic.core.exception.SyntaxException;
import io.github.cyfko.proplogic.core.lexer.Lexer;
import io.github.cyfko.proplogic.core.parser.Parser;
import io.github.cyfko.proplogic.core.parser.Program;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * Default {@link LogicInterpreter}: a lazy {@link Lexer} feeding a {@link Parser}, then an {@link Evaluator}.
 *
 * <h2>Pipeline</h2>
 * <ol>
 *   <li><strong>Guard</strong>: sources longer than {@link LogicPolicy#maxSourceLength()} are rejected before lexing</li>
 *   <li><strong>Lex + Parse</strong>: tokens are pulled on demand; assignments populate a fresh {@link Environment}</li>
 *   <li><strong>Evaluate</strong>: post-order walk of the expression against that environment</li>
 * </ol>
 *
 * <p>
 * The interpreter holds no per-run state, so one instance can serve concurrent callers; each call gets its
 * own lexer, parser and environment.
 * </p>
 *
 * <pre>{@code
 * // Default limits
 * LogicInterpreter interpreter = new BasicLogicInterpreter();
 *
 * // Strict limits for untrusted input
 * LogicInterpreter strict = new BasicLogicInterpreter(LogicPolicy.strict());
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class BasicLogicInterpreter implements LogicInterpreter {

    private static final Logger log = Logger.getLogger(BasicLogicInterpreter.class.getName());

    private final LogicPolicy policy;

    /**
     * Creates an interpreter using {@link LogicPolicy#defaults()}.
     */
    public BasicLogicInterpreter() {
        this(LogicPolicy.defaults());
    }

    /**
     * @param policy the limits applied to every statement
     * @throws IllegalArgumentException if policy is null
     */
    public BasicLogicInterpreter(LogicPolicy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("Logic policy is required");
        }
        this.policy = policy;
    }

    public LogicPolicy getPolicy() {
        return policy;
    }

    @Override
    public Program parse(String source) {
        Objects.requireNonNull(source, "source cannot be null");

        if (source.length() > policy.maxSourceLength()) {
            throw SyntaxException.sourceTooLong(source.length(), policy);
        }

        Program program = new Parser(new Lexer(source), new Environment(), policy).parse();

        log.fine(() -> String.format("Parsed statement of %d character(s) under %s: %d binding(s), %d node(s)",
                source.length(), policy.policyName(), program.environment().size(), program.expression().size()));

        return program;
    }

    @Override
    public boolean evaluate(Program program) {
        Objects.requireNonNull(program, "program cannot be null");

        boolean value = new Evaluator(program.environment()).evaluate(program.expression());

        log.fine(() -> "Statement evaluated to " + value);
        return value;
    }

    @Override
    public EvaluationResult run(String source) {
        Objects.requireNonNull(source, "source cannot be null");
        try {
            Program program = parse(source);
            boolean value = evaluate(program);
            return EvaluationResult.success(value, program.expression(), program.environment().snapshot());
        } catch (LogicException e) {
            log.fine(() -> "Statement rejected at stage " + e.getStage() + ": " + e.getMessage());
            return EvaluationResult.failure(e);
        }
    }
}
