package org.prover.search;

import org.prover.axiom.Axiom;
import org.prover.axiom.AxiomSystem;
import org.prover.axiom.InferenceRule;
import org.prover.formula.Formula;
import org.prover.formula.FormulaKey;
import org.prover.support.PropertyResult;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * MOTORE DI RICERCA DI PROVE - Punto d'ingresso unico per le quattro strategie
 *
 * Per ogni chiamata:
 * 1. Consultazione della cache dei risultati (se abilitata) per strategia e chiave strutturale;
 *    la cache tiene al più {@code cacheCapacity} risultati e scarta il meno usato di recente
 * 2. Creazione di un {@link SearchContext} nuovo, mai condiviso tra chiamate
 * 3. Esecuzione della strategia entro i limiti di profondità, passi e tempo
 * 4. Estrazione dei soli passi necessari alla conclusione e controllo con {@link ProofChecker}
 * 5. Classificazione: prova valida PROVEN, limite o esaurimento UNKNOWN, prova incoerente ERROR
 *
 * La ricerca interna non produce mai DISPROVEN: la refutazione di una proprietà
 * si ottiene provandone la negazione.
 *
 * Assiomi e regole sono condivisi in sola lettura, quindi il motore può servire
 * ricerche concorrenti.
 */
public class ProofSearchEngine {

    private static final Logger LOGGER = Logger.getLogger(ProofSearchEngine.class.getName());

    public static final int DEFAULT_CACHE_CAPACITY = 1_000;

    private record CacheKey(SearchStrategyType strategy, FormulaKey goal) {}

    private final List<Axiom> axioms;
    private final List<InferenceRule> rules;
    private final SearchConfig config;
    private final ProofChecker checker;
    private final Map<SearchStrategyType, ProofStrategy> strategies = new EnumMap<>(SearchStrategyType.class);
    private final int cacheCapacity;
    private final Map<CacheKey, ProofSearchResult> cache;

    //region INIZIALIZZAZIONE

    public ProofSearchEngine(List<Axiom> axioms, List<InferenceRule> rules, SearchConfig config) {
        this(axioms, rules, config, CandidateOrdering.weighted(config.heuristicWeights()));
    }

    public ProofSearchEngine(AxiomSystem system, SearchConfig config) {
        this(system.axioms(), system.rules(), config);
    }

    /**
     * @param ordering ordinamento dei candidati usato da deduzione naturale e concatenamento all'indietro
     */
    public ProofSearchEngine(List<Axiom> axioms, List<InferenceRule> rules, SearchConfig config,
                             CandidateOrdering ordering) {
        this(axioms, rules, config, ordering, DEFAULT_CACHE_CAPACITY);
    }

    /**
     * @param cacheCapacity numero massimo di risultati tenuti in cache
     */
    public ProofSearchEngine(List<Axiom> axioms, List<InferenceRule> rules, SearchConfig config,
                             CandidateOrdering ordering, int cacheCapacity) {
        if (axioms == null || rules == null || config == null || ordering == null) {
            throw new IllegalArgumentException("Assiomi, regole, configurazione e ordinamento sono obbligatori");
        }
        if (cacheCapacity <= 0) {
            throw new IllegalArgumentException("Capacità della cache deve essere positiva: " + cacheCapacity);
        }
        this.axioms = List.copyOf(axioms);
        this.rules = List.copyOf(rules);
        this.config = config;
        this.checker = new ProofChecker(this.axioms, this.rules);
        this.cacheCapacity = cacheCapacity;
        this.cache = Collections.synchronizedMap(new LinkedHashMap<CacheKey, ProofSearchResult>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<CacheKey, ProofSearchResult> eldest) {
                return size() > ProofSearchEngine.this.cacheCapacity;
            }
        });

        strategies.put(SearchStrategyType.NATURAL_DEDUCTION, new NaturalDeduction(this.axioms, this.rules, ordering));
        strategies.put(SearchStrategyType.BACKWARD_CHAINING, new BackwardChaining(this.axioms, this.rules, ordering));
        strategies.put(SearchStrategyType.FORWARD_CHAINING, new ForwardChaining(this.axioms, this.rules));
        strategies.put(SearchStrategyType.RESOLUTION, new ResolutionProver(this.axioms));

        LOGGER.fine(() -> "Motore inizializzato con " + this.axioms.size() + " assiomi e "
                + this.rules.size() + " regole");
    }

    //endregion

    //region STRATEGIE

    public ProofSearchResult naturalDeduction(Formula goal) {
        return prove(goal, SearchStrategyType.NATURAL_DEDUCTION);
    }

    public ProofSearchResult backwardChaining(Formula goal) {
        return prove(goal, SearchStrategyType.BACKWARD_CHAINING);
    }

    public ProofSearchResult forwardChaining(Formula goal) {
        return prove(goal, SearchStrategyType.FORWARD_CHAINING);
    }

    public ProofSearchResult resolution(Formula goal) {
        return prove(goal, SearchStrategyType.RESOLUTION);
    }

    /**
     * Cerca una prova dell'obiettivo con la strategia indicata.
     *
     * @param goal formula da provare
     * @param type strategia
     * @return esito con verdetto PROVEN, UNKNOWN o ERROR, mai DISPROVEN
     */
    public ProofSearchResult prove(Formula goal, SearchStrategyType type) {
        return prove(goal, type, config.timeout());
    }

    /**
     * Come {@link #prove(Formula, SearchStrategyType)} con un tempo massimo
     * ulteriore: vale il minore tra questo e il timeout della configurazione.
     *
     * @param budget tempo ancora disponibile per la ricerca; se non positivo
     *               l'esito è UNKNOWN per tempo scaduto senza avviare la strategia
     */
    public ProofSearchResult prove(Formula goal, SearchStrategyType type, Duration budget) {
        if (goal == null || type == null || budget == null) {
            throw new IllegalArgumentException("Obiettivo, strategia e tempo disponibile sono obbligatori");
        }

        CacheKey cacheKey = new CacheKey(type, FormulaKey.of(goal));
        ProofSearchStatistics statistics = new ProofSearchStatistics();

        if (config.enableCaching()) {
            ProofSearchResult cached = cache.get(cacheKey);
            if (cached != null) {
                statistics.incrementCacheHits();
                statistics.setTerminationReason(cached.statistics().getTerminationReason());
                statistics.stopTimer();
                LOGGER.fine(() -> "Risultato in cache per " + goal + " (" + type + ")");
                return new ProofSearchResult(type, cached.verdict(), cached.steps(), statistics);
            }
            statistics.incrementCacheMisses();
        }

        if (budget.isNegative() || budget.isZero()) {
            statistics.setTerminationReason(TerminationReason.TIMEOUT);
            statistics.stopTimer();
            return new ProofSearchResult(type, PropertyResult.unknown(describe(TerminationReason.TIMEOUT)),
                    List.of(), statistics);
        }
        SearchConfig bounded = budget.compareTo(config.timeout()) < 0 ? config.withTimeout(budget) : config;
        ProofSearchResult result = execute(goal, type, bounded, statistics);

        if (config.enableCaching() && isReusable(result)) {
            cache.putIfAbsent(cacheKey, result);
        }
        return result;
    }

    private ProofSearchResult execute(Formula goal, SearchStrategyType type, SearchConfig bounded,
                                      ProofSearchStatistics statistics) {
        SearchContext context = new SearchContext(goal, bounded, statistics);
        ProofStrategy strategy = strategies.get(type);
        LOGGER.fine(() -> "Ricerca " + type + " per " + goal);

        try {
            int conclusion = strategy.search(goal, context);

            if (conclusion < 0) {
                TerminationReason reason = context.isDepthLimitReached()
                        ? TerminationReason.DEPTH_LIMIT : TerminationReason.EXHAUSTED;
                statistics.setTerminationReason(reason);
                return new ProofSearchResult(type, PropertyResult.unknown(describe(reason)), List.of(), statistics);
            }

            List<ProofStep> proof = extractProof(context.getSteps(), conclusion);
            checker.check(goal, type, proof);
            statistics.setTerminationReason(TerminationReason.PROOF_FOUND);
            LOGGER.fine(() -> "Prova trovata con " + type + " in " + proof.size() + " passi");
            return new ProofSearchResult(type, PropertyResult.proven(), proof, statistics);

        } catch (SearchAbortedException e) {
            statistics.setTerminationReason(e.reason());
            LOGGER.fine(() -> "Ricerca " + type + " interrotta: " + e.reason());
            return new ProofSearchResult(type, PropertyResult.unknown(describe(e.reason())), List.of(), statistics);

        } catch (ProofInconsistencyException e) {
            statistics.setTerminationReason(TerminationReason.INCONSISTENT_PROOF);
            LOGGER.log(Level.SEVERE, "Prova incoerente prodotta da " + type + " per " + goal, e);
            return new ProofSearchResult(type, PropertyResult.error("Prova incoerente: " + e.getMessage()),
                    List.of(), statistics);

        } finally {
            statistics.stopTimer();
        }
    }

    //endregion

    //region SUPPORTO

    /**
     * Passi da cui dipende transitivamente la conclusione, rinumerati da 0
     * mantenendo l'ordine relativo.
     */
    static List<ProofStep> extractProof(List<ProofStep> steps, int conclusion) {
        TreeSet<Integer> needed = new TreeSet<>();
        List<Integer> pending = new ArrayList<>();
        pending.add(conclusion);
        while (!pending.isEmpty()) {
            int index = pending.remove(pending.size() - 1);
            if (needed.add(index)) {
                pending.addAll(steps.get(index).dependencies());
            }
        }

        Map<Integer, Integer> renumbering = new HashMap<>();
        List<ProofStep> proof = new ArrayList<>();
        for (int index : needed) {
            ProofStep step = steps.get(index);
            List<Integer> dependencies = new ArrayList<>();
            for (int dependency : step.dependencies()) {
                dependencies.add(renumbering.get(dependency));
            }
            renumbering.put(index, proof.size());
            proof.add(new ProofStep(proof.size(), step.formula(), step.justification(), dependencies,
                    step.dischargeLevel()));
        }
        return proof;
    }

    /** Solo esiti deterministici: una prova o uno spazio esaurito entro i limiti strutturali */
    private static boolean isReusable(ProofSearchResult result) {
        TerminationReason reason = result.statistics().getTerminationReason();
        return reason == TerminationReason.PROOF_FOUND || reason == TerminationReason.EXHAUSTED
                || reason == TerminationReason.DEPTH_LIMIT;
    }

    private static String describe(TerminationReason reason) {
        return switch (reason) {
            case TIMEOUT -> "limite di tempo raggiunto";
            case STEP_LIMIT -> "limite di passi raggiunto";
            case DEPTH_LIMIT -> "limite di profondità raggiunto";
            case EXHAUSTED -> "nessuna prova trovata";
            case PROOF_FOUND, INCONSISTENT_PROOF -> reason.name().toLowerCase();
        };
    }

    public SearchConfig getConfig() {
        return config;
    }

    public List<Axiom> getAxioms() {
        return axioms;
    }

    public List<InferenceRule> getRules() {
        return rules;
    }

    /** Svuota la cache dei risultati */
    public void clearCache() {
        cache.clear();
    }

    public int getCacheSize() {
        return cache.size();
    }

    //endregion
}
