package io.github.cyfko.proplogic.core.ast;

import java.util.List;

/**
 * Node of the abstract syntax tree built by the parser.
 * <p>
 * The tree is immutable: nodes are created once during parsing, each node is owned by exactly one
 * parent, and evaluation and export only read it. Node kinds form a closed set; every consumer
 * handles them through a {@link NodeVisitor}, so adding a kind breaks every visitor at compile time
 * instead of slipping through a runtime type check.
 * </p>
 *
 * <h2>Node kinds</h2>
 * <ul>
 *   <li>leaves: {@link Literal}, {@link Variable}</li>
 *   <li>unary: {@link Not}</li>
 *   <li>binary ({@link BinaryNode}): {@link And}, {@link Or}, {@link Implies}, {@link Iff}</li>
 * </ul>
 *
 * <p>
 * Nodes are records, so two trees parsed from the same text are {@code equals}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see NodeVisitor
 */
public sealed interface Node permits Literal, Variable, Not, BinaryNode {

    /**
     * Dispatches to the visitor method matching this node kind.
     *
     * @param visitor the visitor
     * @param <R>     the visitor result type
     * @return the visitor result
     */
    <R> R accept(NodeVisitor<R> visitor);

    /**
     * @return the direct children, left to right; empty for leaves
     */
    List<Node> children();

    /**
     * @return the number of nodes in the subtree rooted here, this node included
     */
    default int size() {
        int size = 1;
        for (Node child : children()) {
            size += child.size();
        }
        return size;
    }
}
