package org.prover.verify;

import org.junit.jupiter.api.Test;
import org.prover.formula.Formula;
import org.prover.formula.FormulaKey;
import org.prover.formula.Term;
import org.prover.support.PropertyResult;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class VerdictCacheTest {

    private static final FormulaKey P = FormulaKey.of(Formula.atom("P"));
    private static final FormulaKey Q = FormulaKey.of(Formula.atom("Q"));
    private static final FormulaKey R = FormulaKey.of(Formula.atom("R"));

    private final long[] now = {0};

    private VerdictCache cache(int maxSize, Duration ttl) {
        return new VerdictCache(maxSize, ttl, () -> now[0]);
    }

    @Test
    void returnsStoredVerdict() {
        VerdictCache cache = cache(10, Duration.ofSeconds(1));

        cache.put(P, PropertyResult.proven());

        assertEquals(PropertyResult.proven(), cache.get(P).orElseThrow());
        assertTrue(cache.get(Q).isEmpty());
    }

    @Test
    void entriesExpireAfterTtl() {
        VerdictCache cache = cache(10, Duration.ofSeconds(1));
        cache.put(P, PropertyResult.disproven());

        now[0] = Duration.ofMillis(1_000).toNanos();
        assertTrue(cache.get(P).isPresent());

        now[0] = Duration.ofMillis(1_001).toNanos();
        assertTrue(cache.get(P).isEmpty());
        assertEquals(0, cache.size());
    }

    @Test
    void oldestEntryIsEvictedWhenFull() {
        VerdictCache cache = cache(2, Duration.ofMinutes(1));

        cache.put(P, PropertyResult.proven());
        now[0] = 1;
        cache.put(Q, PropertyResult.proven());
        now[0] = 2;
        cache.put(R, PropertyResult.proven());

        assertEquals(2, cache.size());
        assertTrue(cache.get(P).isEmpty());
        assertTrue(cache.get(R).isPresent());
    }

    @Test
    void overwrittenEntryCountsFromItsLatestInsertion() {
        VerdictCache cache = cache(2, Duration.ofMinutes(1));

        cache.put(P, PropertyResult.proven());
        now[0] = 1;
        cache.put(Q, PropertyResult.proven());
        now[0] = 2;
        cache.put(P, PropertyResult.disproven());
        now[0] = 3;
        cache.put(R, PropertyResult.proven());

        assertEquals(2, cache.size());
        assertTrue(cache.get(Q).isEmpty());
        assertEquals(PropertyResult.disproven(), cache.get(P).orElseThrow());
        assertTrue(cache.get(R).isPresent());
    }

    @Test
    void concurrentWritersRespectMaximumSize() throws Exception {
        VerdictCache cache = new VerdictCache(16, Duration.ofMinutes(1));
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> writers = new ArrayList<>();
            for (int w = 0; w < 4; w++) {
                int writer = w;
                writers.add(pool.submit(() -> {
                    for (int i = 0; i < 500; i++) {
                        cache.put(FormulaKey.of(Formula.atom("P" + writer + "_" + i)), PropertyResult.proven());
                    }
                }));
            }
            for (Future<?> writer : writers) {
                writer.get();
            }
        } finally {
            pool.shutdownNow();
        }

        assertTrue(cache.size() <= 16, "dimensione " + cache.size());
        assertTrue(cache.size() > 0);
    }

    @Test
    void alphaEquivalentFormulasShareEntry() {
        VerdictCache cache = cache(10, Duration.ofMinutes(1));
        Formula first = Formula.forall("x", Formula.atom("P", Term.var("x")));
        Formula second = Formula.forall("y", Formula.atom("P", Term.var("y")));

        cache.put(FormulaKey.of(first), PropertyResult.proven());

        assertTrue(cache.get(FormulaKey.of(second)).isPresent());
    }

    @Test
    void rejectsInvalidLimits() {
        assertThrows(IllegalArgumentException.class, () -> new VerdictCache(0, Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class, () -> new VerdictCache(1, Duration.ZERO));
    }
}
