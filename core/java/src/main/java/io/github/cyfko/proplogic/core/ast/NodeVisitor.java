package io.github.cyfko.proplogic.core.ast;

/**
 * Operation over every {@link Node} kind.
 * <p>
 * Implementations are expected to be exhaustive: one method per node kind, no default fallback.
 * </p>
 *
 * <pre>{@code
 * int leaves = root.accept(new NodeVisitor<Integer>() {
 *     public Integer visitLiteral(Literal node)   { return 1; }
 *     public Integer visitVariable(Variable node) { return 1; }
 *     public Integer visitNot(Not node)           { return node.operand().accept(this); }
 *     public Integer visitAnd(And node)           { return node.left().accept(this) + node.right().accept(this); }
 *     // ...
 * });
 * }</pre>
 *
 * @param <R> result type of the operation
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface NodeVisitor<R> {

    R visitLiteral(Literal node);

    R visitVariable(Variable node);

    R visitNot(Not node);

    R visitAnd(And node);

    R visitOr(Or node);

    R visitImplies(Implies node);

    R visitIff(Iff node);
}
