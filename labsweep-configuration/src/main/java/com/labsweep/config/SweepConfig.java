package com.labsweep.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Configuration loaded from environment variables for the sweep sequencer.
 * <p>
 * Tree shape: LABSWEEP_MAX_DEPTH. Evaluation: LABSWEEP_MAX_VALUES_PER_EXPRESSION.
 * Loading: LABSWEEP_ALLOWED_PARAMETERS (comma-separated), LABSWEEP_SEQUENCE_DIR.
 * Expansion: LABSWEEP_EXPANDER ({@code FOLD} or {@code TREE}), LABSWEEP_PARAMETER_NAMES
 * (comma-separated {@code Display Name=key} pairs).
 */
public final class SweepConfig {

    private static final String ENV_MAX_DEPTH = "LABSWEEP_MAX_DEPTH";
    private static final String ENV_MAX_VALUES_PER_EXPRESSION = "LABSWEEP_MAX_VALUES_PER_EXPRESSION";
    private static final String ENV_ALLOWED_PARAMETERS = "LABSWEEP_ALLOWED_PARAMETERS";
    private static final String ENV_SEQUENCE_DIR = "LABSWEEP_SEQUENCE_DIR";
    private static final String ENV_EXPANDER = "LABSWEEP_EXPANDER";
    private static final String ENV_PARAMETER_NAMES = "LABSWEEP_PARAMETER_NAMES";

    public static final int DEFAULT_MAX_DEPTH = 10;
    public static final int DEFAULT_MAX_VALUES_PER_EXPRESSION = 1_000_000;
    private static final String DEFAULT_SEQUENCE_DIR = "sequences";

    /** Which expansion algorithm the sequencer uses. Both produce identical run specs. */
    public enum ExpanderKind {
        /** Single pass over the pre-order list with depth-indexed buffers. */
        FOLD,
        /** Materializes the tree first, then expands recursively. */
        TREE
    }

    private final int maxDepth;
    private final int maxValuesPerExpression;
    private final Set<String> allowedParameters;
    private final String sequenceDir;
    private final ExpanderKind expander;
    private final Map<String, String> parameterNames;

    private SweepConfig(Builder b) {
        this.maxDepth = b.maxDepth;
        this.maxValuesPerExpression = b.maxValuesPerExpression;
        this.allowedParameters = Collections.unmodifiableSet(new LinkedHashSet<>(b.allowedParameters));
        this.sequenceDir = b.sequenceDir;
        this.expander = b.expander;
        this.parameterNames = Collections.unmodifiableMap(new LinkedHashMap<>(b.parameterNames));
    }

    /** Maximum tree depth; nodes may sit at levels {@code 0..maxDepth-1}. Default {@value #DEFAULT_MAX_DEPTH}. */
    public int getMaxDepth() {
        return maxDepth;
    }

    /** Upper bound on the number of values one expression may produce. Default {@value #DEFAULT_MAX_VALUES_PER_EXPRESSION}. */
    public int getMaxValuesPerExpression() {
        return maxValuesPerExpression;
    }

    /** Parameter names accepted when loading a sequence file. Empty means any name is accepted. */
    public Set<String> getAllowedParameters() {
        return allowedParameters;
    }

    /** Directory that bare sequence file names are resolved against. Default {@code sequences}. */
    public String getSequenceDir() {
        return sequenceDir;
    }

    public ExpanderKind getExpander() {
        return expander;
    }

    /** Display name to procedure key; applied to every mapping during expansion. Unmodifiable. */
    public Map<String, String> getParameterNames() {
        return parameterNames;
    }

    public static SweepConfig fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    /**
     * Same as {@link #fromEnvironment()} but reads variables through the given lookup (returns null when unset).
     */
    public static SweepConfig fromEnvironment(Function<String, String> env) {
        Objects.requireNonNull(env, "env");
        return builder()
                .maxDepth(parseInt(env.apply(ENV_MAX_DEPTH), DEFAULT_MAX_DEPTH))
                .maxValuesPerExpression(parseInt(env.apply(ENV_MAX_VALUES_PER_EXPRESSION), DEFAULT_MAX_VALUES_PER_EXPRESSION))
                .allowedParameters(parseCommaSeparated(env.apply(ENV_ALLOWED_PARAMETERS)))
                .sequenceDir(getEnv(env, ENV_SEQUENCE_DIR, DEFAULT_SEQUENCE_DIR))
                .expander(parseExpander(env.apply(ENV_EXPANDER)))
                .parameterNames(parseNamePairs(env.apply(ENV_PARAMETER_NAMES)))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static List<String> parseCommaSeparated(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Stream.of(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    /** {@code "Delay Time=delay, Random Seed=seed"} → {Delay Time → delay, Random Seed → seed}; entries without '=' are ignored. */
    private static Map<String, String> parseNamePairs(String value) {
        Map<String, String> names = new LinkedHashMap<>();
        for (String pair : parseCommaSeparated(value)) {
            int eq = pair.indexOf('=');
            if (eq <= 0 || eq == pair.length() - 1) continue;
            names.put(pair.substring(0, eq).trim(), pair.substring(eq + 1).trim());
        }
        return names;
    }

    private static ExpanderKind parseExpander(String value) {
        if (value == null || value.isBlank()) {
            return ExpanderKind.FOLD;
        }
        try {
            return ExpanderKind.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return ExpanderKind.FOLD;
        }
    }

    private static int parseInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            return parsed > 0 ? parsed : defaultValue;
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static String getEnv(Function<String, String> env, String key, String defaultValue) {
        String v = env.apply(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    public static final class Builder {
        private int maxDepth = DEFAULT_MAX_DEPTH;
        private int maxValuesPerExpression = DEFAULT_MAX_VALUES_PER_EXPRESSION;
        private Set<String> allowedParameters = Set.of();
        private String sequenceDir = DEFAULT_SEQUENCE_DIR;
        private ExpanderKind expander = ExpanderKind.FOLD;
        private Map<String, String> parameterNames = Map.of();

        public Builder maxDepth(int maxDepth) {
            this.maxDepth = requirePositive(maxDepth, "maxDepth");
            return this;
        }

        public Builder maxValuesPerExpression(int maxValuesPerExpression) {
            this.maxValuesPerExpression = requirePositive(maxValuesPerExpression, "maxValuesPerExpression");
            return this;
        }

        public Builder allowedParameters(Iterable<String> allowedParameters) {
            Set<String> names = new LinkedHashSet<>();
            if (allowedParameters != null) {
                allowedParameters.forEach(names::add);
            }
            this.allowedParameters = names;
            return this;
        }

        public Builder sequenceDir(String sequenceDir) {
            this.sequenceDir = sequenceDir != null ? sequenceDir : DEFAULT_SEQUENCE_DIR;
            return this;
        }

        public Builder expander(ExpanderKind expander) {
            this.expander = expander != null ? expander : ExpanderKind.FOLD;
            return this;
        }

        public Builder parameterNames(Map<String, String> parameterNames) {
            this.parameterNames = parameterNames != null ? parameterNames : Map.of();
            return this;
        }

        public SweepConfig build() {
            return new SweepConfig(this);
        }

        private static int requirePositive(int value, String name) {
            if (value <= 0) {
                throw new IllegalArgumentException(name + " must be positive, got: " + value);
            }
            return value;
        }
    }
}
