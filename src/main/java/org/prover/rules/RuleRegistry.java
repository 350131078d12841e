package org.prover.rules;

import org.prover.logic.Expr;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * REGISTRO REGOLE - Insieme ordinato e immutabile di regole di inferenza
 *
 * Viene costruito una volta e passato esplicitamente alla ricerca: non esiste
 * alcun registro globale. L'ordine delle regole determina l'ordine in cui le
 * loro applicazioni vengono proposte.
 */
public final class RuleRegistry {

    private static final Logger LOGGER = Logger.getLogger(RuleRegistry.class.getName());

    private final List<Rule> rules;

    /**
     * @param rules regole in ordine di consultazione
     * @throws IllegalArgumentException se la lista contiene null o nomi duplicati
     */
    public RuleRegistry(List<Rule> rules) {
        if (rules == null || rules.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("Le regole non possono essere null");
        }
        Set<String> names = new HashSet<>();
        for (Rule rule : rules) {
            if (!names.add(rule.name())) {
                throw new IllegalArgumentException("Nome di regola duplicato: " + rule.name());
            }
        }
        this.rules = List.copyOf(rules);
    }

    /**
     * Registro con tutte le regole standard di deduzione naturale.
     */
    public static RuleRegistry standard() {
        return new RuleRegistry(List.of(
                new ModusPonens(),
                new ModusTollens(),
                new AndIntro(),
                AndElimination.left(),
                AndElimination.right(),
                OrIntroduction.left(),
                OrIntroduction.right(),
                new OrElimination(),
                new DoubleNegationElimination(),
                new ResolutionRule(),
                new ImplyIntro(),
                new Contradiction()));
    }

    public List<Rule> rules() {
        return rules;
    }

    public Optional<Rule> get(String name) {
        return rules.stream().filter(rule -> rule.name().equals(name)).findFirst();
    }

    public List<String> names() {
        return rules.stream().map(Rule::name).collect(Collectors.toList());
    }

    public int size() {
        return rules.size();
    }

    /**
     * Nuovo registro senza le regole indicate; i nomi sconosciuti sono ignorati.
     */
    public RuleRegistry without(Collection<String> excluded) {
        if (excluded == null || excluded.isEmpty()) {
            return this;
        }
        return new RuleRegistry(rules.stream()
                .filter(rule -> !excluded.contains(rule.name()))
                .collect(Collectors.toList()));
    }

    /**
     * Applica tutte le regole non escluse alla base di conoscenza.
     *
     * @param knowledge formule note
     * @param goal      obiettivo di filtro, oppure null
     * @param excluded  nomi delle regole da saltare (può essere vuoto)
     * @return applicazioni nell'ordine delle regole
     */
    public List<RuleResult> applyAll(Set<Expr> knowledge, Expr goal, Set<String> excluded) {
        List<RuleResult> results = new ArrayList<>();
        for (Rule rule : rules) {
            if (excluded.contains(rule.name())) {
                continue;
            }
            List<RuleResult> firings = rule.apply(knowledge, goal);
            if (!firings.isEmpty()) {
                LOGGER.finest("Regola " + rule.name() + ": " + firings.size() + " applicazioni");
            }
            results.addAll(firings);
        }
        return results;
    }

    @Override
    public String toString() {
        return "RuleRegistry" + names();
    }
}
