package org.prover.verify;

import org.junit.jupiter.api.Test;
import org.prover.axiom.Axiom;
import org.prover.formula.Formula;
import org.prover.smt.SmtInterface;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FormalVerifierTest {

    private static final Formula P = Formula.atom("P");
    private static final Formula Q = Formula.atom("Q");
    private static final Formula R = Formula.atom("R");
    private static final Formula S = Formula.atom("S");
    private static final Formula T = Formula.atom("T");

    private static final List<Axiom> AXIOMS = List.of(Axiom.of("p", P), Axiom.of("q", Q), Axiom.of("r", R));

    private static VerificationConfig.Builder searchOnly() {
        return VerificationConfig.builder()
                .methods(VerificationMethod.NATURAL_DEDUCTION, VerificationMethod.BACKWARD_CHAINING)
                .parallel(false);
    }

    private static FormalVerifier verifier(List<Axiom> axioms, VerificationConfig config) {
        return new FormalVerifier(axioms, List.of(), config, SmtInterface.disabled());
    }

    //region LOTTI

    @Test
    void batchWithSomeUnprovenPropertiesIsPartiallyVerified() {
        List<PropertyTask> tasks = List.of(
                PropertyTask.of("p", P), PropertyTask.of("q", Q), PropertyTask.of("r", R),
                PropertyTask.of("s", S), PropertyTask.of("t", T));

        VerificationReport report = verifier(AXIOMS, searchOnly().build()).verifyBatch(tasks);

        VerificationStatus.PartiallyVerified status = (VerificationStatus.PartiallyVerified) report.status();
        assertEquals(3, status.verifiedCount());
        assertEquals(5, status.totalCount());
        assertEquals(List.of("s", "t"), status.failures().stream().map(VerificationFailure::propertyName).toList());
        assertEquals(5, report.results().size());
        assertEquals(3, report.statistics().getPropertiesVerified());
    }

    @Test
    void parallelBatchKeepsInputOrder() {
        List<PropertyTask> tasks = List.of(PropertyTask.of("s", S), PropertyTask.of("p", P), PropertyTask.of("q", Q));
        VerificationConfig config = searchOnly().parallel(true).workerThreads(2).build();

        VerificationReport report = verifier(AXIOMS, config).verifyBatch(tasks);

        assertEquals(List.of("s", "p", "q"), report.results().stream().map(PropertyVerification::name).toList());
        assertTrue(report.results().get(1).verdict().isProven());
        assertTrue(report.status() instanceof VerificationStatus.PartiallyVerified);
    }

    @Test
    void allProvenBatchIsVerified() {
        VerificationReport report = verifier(AXIOMS, searchOnly().build())
                .verifyBatch(List.of(PropertyTask.of("p", P), PropertyTask.of("q", Q)));

        assertTrue(report.isVerified());
    }

    @Test
    void noProvenPropertyMeansFailed() {
        VerificationReport report = verifier(AXIOMS, searchOnly().build())
                .verifyBatch(List.of(PropertyTask.of("s", S)));

        VerificationStatus.Failed status = (VerificationStatus.Failed) report.status();
        VerificationFailure failure = status.failures().get(0);
        assertTrue(failure.verdict().isUnknown());
        assertFalse(failure.suggestions().isEmpty());
    }

    @Test
    void emptyBatchIsVerified() {
        VerificationReport report = verifier(AXIOMS, searchOnly().build()).verifyBatch(List.of());

        assertTrue(report.isVerified());
        assertTrue(report.results().isEmpty());
    }

    @Test
    void requiredSolverMissingIsEnvironmentError() {
        VerificationConfig config = searchOnly().requireSolver(true).build();

        VerificationReport report = verifier(AXIOMS, config).verifyBatch(List.of(PropertyTask.of("p", P)));

        assertTrue(report.status() instanceof VerificationStatus.Error);
    }

    @Test
    void missingOptionalSolverProducesWarning() {
        VerificationConfig config = searchOnly().methods(VerificationMethod.SMT_SOLVER).build();

        VerificationReport report = verifier(AXIOMS, config).verifyBatch(List.of(PropertyTask.of("p", P)));

        assertFalse(report.warnings().isEmpty());
        assertTrue(report.results().get(0).verdict().isUnknown());
    }

    //endregion

    //region SINGOLA PROPRIETÀ

    @Test
    void provenPropertyRecordsDecidingMethod() {
        PropertyVerification result = verifier(AXIOMS, searchOnly().build()).verifyProperty("p", P);

        assertTrue(result.verdict().isProven());
        assertEquals(VerificationMethod.NATURAL_DEDUCTION, result.method());
        assertFalse(result.proof().isEmpty());
    }

    @Test
    void taskMethodsOverrideConfiguredOnes() {
        PropertyVerification result = verifier(AXIOMS, searchOnly().build())
                .verifyProperty(PropertyTask.of("p", P, VerificationMethod.FORWARD_CHAINING));

        assertEquals(VerificationMethod.FORWARD_CHAINING, result.method());
    }

    @Test
    void provingNegationDisprovesProperty() {
        List<Axiom> axioms = List.of(Axiom.of("not_p", Formula.not(P)));

        PropertyVerification result = verifier(axioms, searchOnly().build()).verifyProperty("p", P);

        assertTrue(result.verdict().isDisproven());
        assertEquals(Formula.not(P), result.proof().get(result.proof().size() - 1).formula());
    }

    @Test
    void disproofCanBeTurnedOff() {
        List<Axiom> axioms = List.of(Axiom.of("not_p", Formula.not(P)));
        VerificationConfig config = searchOnly().attemptDisproof(false).build();

        PropertyVerification result = verifier(axioms, config).verifyProperty("p", P);

        assertTrue(result.verdict().isUnknown());
        assertNull(result.method());
    }

    @Test
    void conclusiveVerdictIsCached() {
        FormalVerifier verifier = verifier(AXIOMS, searchOnly().build());

        PropertyVerification first = verifier.verifyProperty("p", P);
        PropertyVerification second = verifier.verifyProperty("p_again", P);

        assertFalse(first.fromCache());
        assertTrue(second.fromCache());
        assertEquals(first.verdict(), second.verdict());
    }

    @Test
    void unknownVerdictIsNotCached() {
        FormalVerifier verifier = verifier(AXIOMS, searchOnly().build());

        verifier.verifyProperty("s", S);
        PropertyVerification second = verifier.verifyProperty("s", S);

        assertFalse(second.fromCache());
    }

    //endregion

    //region LIMITI DI TEMPO E MEMORIA

    @Test
    void memoryCeilingLeavesBatchIncomplete() {
        VerificationReport report = verifier(AXIOMS, searchOnly().maxMemoryBytes(1).build())
                .verifyBatch(List.of(PropertyTask.of("p", P), PropertyTask.of("q", Q)));

        VerificationStatus.Incomplete status = (VerificationStatus.Incomplete) report.status();
        assertTrue(status.reason().contains("memoria"), status.reason());
        assertEquals(2, report.results().size());
        assertFalse(report.results().get(0).verdict().isProven());
    }

    @Test
    void totalTimeoutLeavesBatchIncomplete() {
        List<PropertyTask> tasks = List.of(PropertyTask.of("p", P), PropertyTask.of("q", Q), PropertyTask.of("r", R));

        for (boolean parallel : new boolean[] {false, true}) {
            VerificationConfig config = searchOnly().parallel(parallel).workerThreads(2)
                    .totalTimeout(Duration.ofNanos(1)).build();

            VerificationReport report = verifier(AXIOMS, config).verifyBatch(tasks);

            VerificationStatus.Incomplete status = (VerificationStatus.Incomplete) report.status();
            assertTrue(status.reason().contains("tempo totale"), status.reason());
            assertEquals(List.of("p", "q", "r"), report.results().stream().map(PropertyVerification::name).toList());
        }
    }

    @Test
    void propertyTimeoutCoversEveryMethod() {
        VerificationConfig config = searchOnly().propertyTimeout(Duration.ofNanos(1)).build();

        PropertyVerification result = verifier(AXIOMS, config).verifyProperty("s", S);

        assertTrue(result.verdict().isUnknown());
        String reason = result.verdict().reason();
        assertTrue(reason.contains("timeout") || reason.contains("tempo"), reason);
        assertNull(result.method());
    }

    //endregion
}
