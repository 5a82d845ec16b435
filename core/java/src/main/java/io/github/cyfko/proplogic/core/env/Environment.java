package io.github.cyfko.proplogic.core.env;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Variable bindings of a single statement run.
 * <p>
 * The parser records each assignment here in source order; the evaluator then reads the bindings to
 * resolve {@code Variable} nodes. Names are case-sensitive and bound at most once. An environment is
 * created per run and discarded with the result, it is never shared between runs or threads.
 * </p>
 *
 * <pre>{@code
 * Environment env = new Environment();
 * env.bind("p", true);
 * env.lookup("p");   // Optional[true]
 * env.lookup("q");   // Optional.empty
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class Environment {

    private final Map<String, Boolean> bindings = new HashMap<>();

    /**
     * Binds a name to a value.
     *
     * @param name  the variable name
     * @param value the truth value
     * @throws IllegalStateException if the name is already bound
     * @throws NullPointerException if name is null
     */
    public void bind(String name, boolean value) {
        Objects.requireNonNull(name, "name cannot be null");
        if (bindings.putIfAbsent(name, value) != null) {
            throw new IllegalStateException("Variable '" + name + "' is already bound");
        }
    }

    public boolean isBound(String name) {
        return bindings.containsKey(name);
    }

    /**
     * Resolves a name.
     *
     * @param name the variable name
     * @return the bound value, or empty if the name was never assigned
     */
    public Optional<Boolean> lookup(String name) {
        return Optional.ofNullable(bindings.get(name));
    }

    public Set<String> names() {
        return Set.copyOf(bindings.keySet());
    }

    public int size() {
        return bindings.size();
    }

    /**
     * @return an immutable copy of the current bindings
     */
    public Map<String, Boolean> snapshot() {
        return Map.copyOf(bindings);
    }

    @Override
    public String toString() {
        return "Environment" + bindings;
    }
}
