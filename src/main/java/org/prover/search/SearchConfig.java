package org.prover.search;

import org.prover.evaluator.Evaluator;
import org.prover.resolution.ResolutionEngine;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * CONFIGURAZIONE DI RICERCA - Parametri immutabili di un tentativo di prova
 *
 * PARAMETRI:
 * - strategy: strategia di ricerca (default FORWARD)
 * - maxSteps: iterazioni massime della ricerca in avanti (default 100)
 * - maxDepth: profondità massima della ricerca all'indietro (default 20)
 * - maxBranching: nuove conclusioni accettate per iterazione (default 10)
 * - useSemanticCheck: verifica preliminare con tavola di verità (default true)
 * - rulePriorities: priorità per nome di regola (default 1.0)
 * - excludedRules: regole da non usare
 * - refutationFallback: refutazione per risoluzione se la ricerca fallisce (default true)
 * - maxResolutionIterations: giri di saturazione della refutazione (default 100)
 * - maxVariables: variabili ammesse dalla verifica semantica (default 20)
 */
public final class SearchConfig {

    public static final int DEFAULT_MAX_STEPS = 100;
    public static final int DEFAULT_MAX_DEPTH = 20;
    public static final int DEFAULT_MAX_BRANCHING = 10;
    public static final double DEFAULT_RULE_PRIORITY = 1.0;

    private final SearchStrategy strategy;
    private final int maxSteps;
    private final int maxDepth;
    private final int maxBranching;
    private final boolean useSemanticCheck;
    private final Map<String, Double> rulePriorities;
    private final Set<String> excludedRules;
    private final boolean refutationFallback;
    private final int maxResolutionIterations;
    private final int maxVariables;

    private SearchConfig(Builder builder) {
        this.strategy = builder.strategy;
        this.maxSteps = builder.maxSteps;
        this.maxDepth = builder.maxDepth;
        this.maxBranching = builder.maxBranching;
        this.useSemanticCheck = builder.useSemanticCheck;
        this.rulePriorities = Collections.unmodifiableMap(new HashMap<>(builder.rulePriorities));
        this.excludedRules = Collections.unmodifiableSet(new HashSet<>(builder.excludedRules));
        this.refutationFallback = builder.refutationFallback;
        this.maxResolutionIterations = builder.maxResolutionIterations;
        this.maxVariables = builder.maxVariables;
    }

    /** Configurazione con tutti i valori di default. */
    public static SearchConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder inizializzato con i valori di questa configurazione. */
    public Builder toBuilder() {
        Builder builder = new Builder()
                .strategy(strategy)
                .maxSteps(maxSteps)
                .maxDepth(maxDepth)
                .maxBranching(maxBranching)
                .useSemanticCheck(useSemanticCheck)
                .refutationFallback(refutationFallback)
                .maxResolutionIterations(maxResolutionIterations)
                .maxVariables(maxVariables);
        builder.rulePriorities.putAll(rulePriorities);
        builder.excludedRules.addAll(excludedRules);
        return builder;
    }

    //region GETTERS

    public SearchStrategy getStrategy() {
        return strategy;
    }

    public int getMaxSteps() {
        return maxSteps;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public int getMaxBranching() {
        return maxBranching;
    }

    public boolean isUseSemanticCheck() {
        return useSemanticCheck;
    }

    public Map<String, Double> getRulePriorities() {
        return rulePriorities;
    }

    /** Priorità della regola; le regole non configurate valgono 1.0. */
    public double getRulePriority(String ruleName) {
        return rulePriorities.getOrDefault(ruleName, DEFAULT_RULE_PRIORITY);
    }

    public Set<String> getExcludedRules() {
        return excludedRules;
    }

    public boolean isExcluded(String ruleName) {
        return excludedRules.contains(ruleName);
    }

    public boolean isRefutationFallback() {
        return refutationFallback;
    }

    public int getMaxResolutionIterations() {
        return maxResolutionIterations;
    }

    public int getMaxVariables() {
        return maxVariables;
    }

    //endregion

    @Override
    public String toString() {
        return String.format("SearchConfig[strategy=%s, maxSteps=%d, maxDepth=%d, maxBranching=%d, "
                        + "semanticCheck=%s, excluded=%s, fallback=%s]",
                strategy, maxSteps, maxDepth, maxBranching, useSemanticCheck, excludedRules, refutationFallback);
    }

    /**
     * Costruzione incrementale con validazione finale in {@link #build()}.
     */
    public static final class Builder {

        private SearchStrategy strategy = SearchStrategy.FORWARD;
        private int maxSteps = DEFAULT_MAX_STEPS;
        private int maxDepth = DEFAULT_MAX_DEPTH;
        private int maxBranching = DEFAULT_MAX_BRANCHING;
        private boolean useSemanticCheck = true;
        private final Map<String, Double> rulePriorities = new HashMap<>();
        private final Set<String> excludedRules = new HashSet<>();
        private boolean refutationFallback = true;
        private int maxResolutionIterations = ResolutionEngine.DEFAULT_MAX_ITERATIONS;
        private int maxVariables = Evaluator.DEFAULT_MAX_VARIABLES;

        private Builder() {
        }

        public Builder strategy(SearchStrategy strategy) {
            this.strategy = strategy;
            return this;
        }

        public Builder maxSteps(int maxSteps) {
            this.maxSteps = maxSteps;
            return this;
        }

        public Builder maxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder maxBranching(int maxBranching) {
            this.maxBranching = maxBranching;
            return this;
        }

        public Builder useSemanticCheck(boolean useSemanticCheck) {
            this.useSemanticCheck = useSemanticCheck;
            return this;
        }

        public Builder rulePriority(String ruleName, double priority) {
            if (ruleName == null) {
                throw new IllegalArgumentException("Nome regola non può essere null");
            }
            rulePriorities.put(ruleName, priority);
            return this;
        }

        public Builder excludeRule(String ruleName) {
            if (ruleName == null) {
                throw new IllegalArgumentException("Nome regola non può essere null");
            }
            excludedRules.add(ruleName);
            return this;
        }

        public Builder refutationFallback(boolean refutationFallback) {
            this.refutationFallback = refutationFallback;
            return this;
        }

        public Builder maxResolutionIterations(int maxResolutionIterations) {
            this.maxResolutionIterations = maxResolutionIterations;
            return this;
        }

        public Builder maxVariables(int maxVariables) {
            this.maxVariables = maxVariables;
            return this;
        }

        /**
         * @throws IllegalArgumentException se la strategia è null, un limite non è positivo o
         *         maxVariables supera {@link Evaluator#MAX_SUPPORTED_VARIABLES}
         */
        public SearchConfig build() {
            if (strategy == null) {
                throw new IllegalArgumentException("Strategia di ricerca non può essere null");
            }
            requirePositive("maxSteps", maxSteps);
            requirePositive("maxDepth", maxDepth);
            requirePositive("maxBranching", maxBranching);
            requirePositive("maxResolutionIterations", maxResolutionIterations);
            requirePositive("maxVariables", maxVariables);
            if (maxVariables > Evaluator.MAX_SUPPORTED_VARIABLES) {
                throw new IllegalArgumentException("maxVariables non può superare "
                        + Evaluator.MAX_SUPPORTED_VARIABLES + ": " + maxVariables);
            }
            return new SearchConfig(this);
        }

        private static void requirePositive(String name, int value) {
            if (value <= 0) {
                throw new IllegalArgumentException(name + " deve essere positivo: " + value);
            }
        }
    }
}
