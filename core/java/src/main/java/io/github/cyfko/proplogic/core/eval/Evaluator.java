package io.github.cyfko.proplogic.core.eval;

import io.github.cyfko.proplogic.core.ast.And;
import io.github.cyfko.proplogic.core.ast.Iff;
import io.github.cyfko.proplogic.core.ast.Implies;
import io.github.cyfko.proplogic.core.ast.Literal;
import io.github.cyfko.proplogic.core.ast.Node;
import io.github.cyfko.proplogic.core.ast.NodeVisitor;
import io.github.cyfko.proplogic.core.ast.Not;
import io.github.cyfko.proplogic.core.ast.Or;
import io.github.cyfko.proplogic.core.ast.Variable;
import io.github.cyfko.proplogic.core.env.Environment;
import io.github.cyfko.proplogic.core.exception.EvaluationException;

import java.util.Objects;

/**
 * Reduces a syntax tree to its truth value by a post-order walk.
 *
 * <h2>Algorithm</h2>
 * <pre>
 * Literal(b)      → b
 * Variable(name)  → environment lookup, EvaluationException if unbound
 * Not(c)          → !eval(c)
 * And(l, r)       → eval(l) &amp; eval(r)
 * Or(l, r)        → eval(l) | eval(r)
 * Implies(l, r)   → !eval(l) | eval(r)
 * Iff(l, r)       → eval(l) == eval(r)
 * </pre>
 *
 * <p>
 * Both operands are always evaluated, left before right, so the first unbound variable reported is
 * the leftmost one in the source. Each node is visited once.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class Evaluator implements NodeVisitor<Boolean> {

    private final Environment environment;

    public Evaluator(Environment environment) {
        this.environment = Objects.requireNonNull(environment, "environment cannot be null");
    }

    /**
     * Evaluates the tree rooted at {@code node}.
     *
     * @param node the root node
     * @return the truth value
     * @throws EvaluationException if a variable has no binding
     */
    public boolean evaluate(Node node) {
        Objects.requireNonNull(node, "node cannot be null");
        return node.accept(this);
    }

    @Override
    public Boolean visitLiteral(Literal node) {
        return node.value();
    }

    @Override
    public Boolean visitVariable(Variable node) {
        return environment.lookup(node.name())
                .orElseThrow(() -> EvaluationException.unboundVariable(node.name()));
    }

    @Override
    public Boolean visitNot(Not node) {
        return !evaluate(node.operand());
    }

    @Override
    public Boolean visitAnd(And node) {
        boolean left = evaluate(node.left());
        boolean right = evaluate(node.right());
        return left & right;
    }

    @Override
    public Boolean visitOr(Or node) {
        boolean left = evaluate(node.left());
        boolean right = evaluate(node.right());
        return left | right;
    }

    @Override
    public Boolean visitImplies(Implies node) {
        boolean left = evaluate(node.left());
        boolean right = evaluate(node.right());
        return !left | right;
    }

    @Override
    public Boolean visitIff(Iff node) {
        boolean left = evaluate(node.left());
        boolean right = evaluate(node.right());
        return left == right;
    }
}
