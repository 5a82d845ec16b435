package io.github.cyfko.proplogic.core.export;

import io.github.cyfko.proplogic.core.ast.And;
import io.github.cyfko.proplogic.core.ast.Iff;
import io.github.cyfko.proplogic.core.ast.Implies;
import io.github.cyfko.proplogic.core.ast.Literal;
import io.github.cyfko.proplogic.core.ast.Node;
import io.github.cyfko.proplogic.core.ast.NodeVisitor;
import io.github.cyfko.proplogic.core.ast.Not;
import io.github.cyfko.proplogic.core.ast.Or;
import io.github.cyfko.proplogic.core.ast.Variable;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * {@link GraphExporter} emitting the Graphviz DOT language.
 * <p>
 * Nodes are numbered from {@code 0} in breadth-first order. Operators are drawn as boxes and labelled
 * with their source symbol; literals are labelled {@code 1}/{@code 0} and variables by name. All node
 * declarations come first, followed by the undirected edges.
 * </p>
 *
 * <p><strong>Example</strong> for {@code ~p v 0}:</p>
 * <pre>
 * graph G {
 *     0 [label="v" shape="box"]
 *     1 [label="~" shape="box"]
 *     2 [label="0"]
 *     3 [label="p"]
 *     0 -- 1
 *     0 -- 2
 *     1 -- 3
 * }
 * </pre>
 *
 * <p>Render with {@code dot -Tpng ast.dot -o ast.png}.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class DotGraphExporter implements GraphExporter {

    private static final String INDENT = "    ";

    @Override
    public String export(Node root) {
        Objects.requireNonNull(root, "root cannot be null");

        StringBuilder declarations = new StringBuilder();
        StringBuilder edges = new StringBuilder();

        Deque<Numbered> queue = new ArrayDeque<>();
        queue.add(new Numbered(root, 0));
        int next = 1;

        while (!queue.isEmpty()) {
            Numbered current = queue.poll();
            declarations.append(INDENT).append(current.id()).append(' ')
                    .append(current.node().accept(NodeStyle.INSTANCE)).append('\n');

            for (Node child : current.node().children()) {
                int childId = next++;
                edges.append(INDENT).append(current.id()).append(" -- ").append(childId).append('\n');
                queue.add(new Numbered(child, childId));
            }
        }

        return "graph G {\n" + declarations + edges + "}\n";
    }

    private record Numbered(Node node, int id) {}

    /**
     * Attribute list of a node declaration, e.g. {@code [label="^" shape="box"]}.
     */
    private enum NodeStyle implements NodeVisitor<String> {
        INSTANCE;

        @Override
        public String visitLiteral(Literal node) {
            return leaf(node.value() ? "1" : "0");
        }

        @Override
        public String visitVariable(Variable node) {
            return leaf(node.name());
        }

        @Override
        public String visitNot(Not node) {
            return operator("~");
        }

        @Override
        public String visitAnd(And node) {
            return operator("^");
        }

        @Override
        public String visitOr(Or node) {
            return operator("v");
        }

        @Override
        public String visitImplies(Implies node) {
            return operator("=>");
        }

        @Override
        public String visitIff(Iff node) {
            return operator("<=>");
        }

        private static String leaf(String label) {
            return "[label=\"" + escape(label) + "\"]";
        }

        private static String operator(String label) {
            return "[label=\"" + escape(label) + "\" shape=\"box\"]";
        }

        private static String escape(String label) {
            return label.replace("\\", "\\\\").replace("\"", "\\\"");
        }
    }
}
