package org.prover.search;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

/** Verifica valori predefiniti e validazione della configurazione di ricerca. */
public class SearchConfigTest {

    @Test void testDefaults() {
        SearchConfig config = SearchConfig.defaults();
        assertThat(config.getStrategy(), is(SearchStrategy.FORWARD));
        assertThat(config.getMaxSteps(), is(100));
        assertThat(config.getMaxDepth(), is(20));
        assertThat(config.getMaxBranching(), is(10));
        assertThat(config.isUseSemanticCheck(), is(true));
        assertThat(config.isRefutationFallback(), is(true));
        assertThat(config.getMaxResolutionIterations(), is(100));
        assertThat(config.getMaxVariables(), is(20));
        assertThat(config.getRulePriority("modus_ponens"), is(1.0));
        assertThat(config.getExcludedRules().isEmpty(), is(true));
    }

    @Test void testBuilder() {
        SearchConfig config = SearchConfig.builder()
                .strategy(SearchStrategy.HYBRID)
                .maxSteps(7)
                .rulePriority("resolution", 0.5)
                .excludeRule("contradiction")
                .build();
        assertThat(config.getStrategy(), is(SearchStrategy.HYBRID));
        assertThat(config.getMaxSteps(), is(7));
        assertThat(config.getRulePriority("resolution"), is(0.5));
        assertThat(config.isExcluded("contradiction"), is(true));
        assertThat(config.getRulePriorities(), is(Map.of("resolution", 0.5)));
        assertThrows(UnsupportedOperationException.class, () -> config.getRulePriorities().put("x", 2.0));

        SearchConfig copy = config.toBuilder().maxDepth(3).build();
        assertThat(copy.getMaxSteps(), is(7));
        assertThat(copy.getMaxDepth(), is(3));
        assertThat(copy.isExcluded("contradiction"), is(true));
        assertThat(config.getMaxDepth(), is(20));
    }

    @Test void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> SearchConfig.builder().maxSteps(0).build());
        assertThrows(IllegalArgumentException.class, () -> SearchConfig.builder().maxDepth(-1).build());
        assertThrows(IllegalArgumentException.class, () -> SearchConfig.builder().maxBranching(0).build());
        assertThrows(IllegalArgumentException.class, () -> SearchConfig.builder().strategy(null).build());
        assertThrows(IllegalArgumentException.class, () -> SearchConfig.builder().excludeRule(null));
        assertThrows(UnsupportedOperationException.class,
                () -> SearchConfig.defaults().getExcludedRules().add("x"));
        assertThrows(IllegalArgumentException.class, () -> SearchConfig.builder().maxVariables(63).build());
        assertThat(SearchConfig.builder().maxVariables(62).build().getMaxVariables(), is(62));
    }
}
