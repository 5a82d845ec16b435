package io.github.cyfko.proplogic.core.config;

import java.util.Locale;

/**
 * Limits applied while reading a statement, guarding against oversized or pathologically nested input.
 *
 * <h2>Configurable Limits</h2>
 * <ul>
 *   <li><strong>maxSourceLength</strong>: Maximum character length of the whole statement (default: 10000)</li>
 *   <li><strong>maxNestingDepth</strong>: Maximum depth of negations, parentheses and operator chains (default: 100,
 *       at most {@value #MAX_NESTING_DEPTH})</li>
 * </ul>
 *
 * <p>
 * Nesting counts one level per {@code ~}, per open parenthesis and per binary operator of a chain still
 * being read, so the flat {@code 1 v 0 v 0} is two levels deep. The parser and evaluator recurse once
 * per level, which is why the depth has a hard ceiling whatever the policy.
 * </p>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * // Default (balanced for most use cases)
 * LogicPolicy policy = LogicPolicy.defaults();
 *
 * // Strict (for untrusted input)
 * LogicPolicy policy = LogicPolicy.strict();
 *
 * // Relaxed (for generated or trusted input)
 * LogicPolicy policy = LogicPolicy.relaxed();
 *
 * // Custom
 * LogicPolicy policy = LogicPolicy.builder()
 *     .maxSourceLength(50_000)
 *     .build();
 * }</pre>
 *
 * @param policyName      name reported in limit violations
 * @param maxSourceLength maximum character length of the source
 * @param maxNestingDepth maximum nesting depth accepted by the parser
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record LogicPolicy(
    String policyName,
    int maxSourceLength,
    int maxNestingDepth
) {

    /**
     * Deepest nesting any policy may allow. Deeper input would overflow a default 1 MB thread stack.
     */
    public static final int MAX_NESTING_DEPTH = 500;

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if the name is blank, a limit is not positive or the depth exceeds
     *                                  {@link #MAX_NESTING_DEPTH}
     */
    public LogicPolicy {
        if (policyName == null || policyName.isBlank()) {
            throw new IllegalArgumentException("Policy name is required");
        }
        if (maxSourceLength <= 0) {
            throw new IllegalArgumentException("maxSourceLength must be positive, got: " + maxSourceLength);
        }
        if (maxNestingDepth <= 0 || maxNestingDepth > MAX_NESTING_DEPTH) {
            throw new IllegalArgumentException(String.format(
                    "maxNestingDepth must be between 1 and %d, got: %d", MAX_NESTING_DEPTH, maxNestingDepth));
        }
    }

    /**
     * Default configuration.
     * <ul>
     *   <li>Max Source Length: 10000 characters</li>
     *   <li>Max Nesting Depth: 100</li>
     * </ul>
     *
     * @return default configuration
     */
    public static LogicPolicy defaults() {
        return new LogicPolicy(PolicyName.DEFAULT_POLICY.name(), 10_000, 100);
    }

    /**
     * Strict configuration for statements coming from untrusted sources.
     * <ul>
     *   <li>Max Source Length: 1000 characters</li>
     *   <li>Max Nesting Depth: 64</li>
     * </ul>
     *
     * @return strict configuration
     */
    public static LogicPolicy strict() {
        return new LogicPolicy(PolicyName.STRICT_POLICY.name(), 1_000, 64);
    }

    /**
     * Relaxed configuration for large generated statements.
     * <ul>
     *   <li>Max Source Length: 100000 characters</li>
     *   <li>Max Nesting Depth: 250</li>
     * </ul>
     *
     * @return relaxed configuration
     */
    public static LogicPolicy relaxed() {
        return new LogicPolicy(PolicyName.RELAXED_POLICY.name(), 100_000, 250);
    }

    /**
     * Resolves a preset by its short name: {@code default}, {@code strict} or {@code relaxed}, case-insensitive.
     *
     * @param name preset name
     * @return the preset
     * @throws IllegalArgumentException if no preset has that name
     */
    public static LogicPolicy named(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Policy name is required");
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "default" -> defaults();
            case "strict" -> strict();
            case "relaxed" -> relaxed();
            default -> throw new IllegalArgumentException(
                    "Unknown policy '" + name + "'. Expected one of: default, strict, relaxed");
        };
    }

    /**
     * Creates a custom configuration. Builder parameters start from the default preset values.
     *
     * @return the {@link Builder} instance
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String _policyName = PolicyName.CUSTOM_POLICY.name();
        private int _maxSourceLength = 10_000;
        private int _maxNestingDepth = 100;

        private Builder() {}

        public LogicPolicy build() {
            return new LogicPolicy(_policyName, _maxSourceLength, _maxNestingDepth);
        }

        public Builder policyName(String policyName) { this._policyName = policyName; return this; }
        public Builder maxSourceLength(int maxSourceLength) { this._maxSourceLength = maxSourceLength; return this; }
        public Builder maxNestingDepth(int maxNestingDepth) { this._maxNestingDepth = maxNestingDepth; return this; }
    }

    public enum PolicyName {
        DEFAULT_POLICY,
        STRICT_POLICY,
        RELAXED_POLICY,
        CUSTOM_POLICY
    }
}
