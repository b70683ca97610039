package org.prover.smt;

import org.junit.jupiter.api.Test;
import org.prover.support.PropertyResult;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SmtInterfaceTest {

    private static final String VALID = "(declare-const x Int)\n(assert (not (> x 0)))\n(check-sat)\n";

    /** Backend controllato dal test: risposta fissa e conteggio delle chiamate */
    private static final class StubBackend implements SolverBackend {
        private final boolean available;
        private final SolverStatus status;
        private final boolean failing;
        private int calls = 0;

        StubBackend(boolean available, SolverStatus status, boolean failing) {
            this.available = available;
            this.status = status;
            this.failing = failing;
        }

        @Override
        public String name() {
            return "stub";
        }

        @Override
        public boolean isAvailable() {
            return available;
        }

        @Override
        public SolverStatus check(String script, long timeoutMs) {
            calls++;
            if (failing) {
                throw new SolverException("risposta non valida");
            }
            return status;
        }
    }

    private static SmtInterface interfaceFor(StubBackend backend, boolean required) {
        return new SmtInterface(backend, SmtConfig.defaults().withRequireSolver(required));
    }

    @Test
    void unsatNegationMeansProven() {
        StubBackend backend = new StubBackend(true, SolverStatus.UNSAT, false);
        SmtInterface smt = interfaceFor(backend, false);

        assertTrue(smt.verify(VALID).isProven());
        assertEquals(1, smt.getStatistics().getProvenCount());
    }

    @Test
    void satNegationMeansDisproven() {
        SmtInterface smt = interfaceFor(new StubBackend(true, SolverStatus.SAT, false), false);

        assertTrue(smt.verify(VALID).isDisproven());
    }

    @Test
    void solverUnknownIsPropagated() {
        SmtInterface smt = interfaceFor(new StubBackend(true, SolverStatus.UNKNOWN, false), false);

        assertTrue(smt.verify(VALID).isUnknown());
    }

    @Test
    void syntaxErrorNeverReachesSolver() {
        StubBackend backend = new StubBackend(true, SolverStatus.UNSAT, false);
        SmtInterface smt = interfaceFor(backend, false);

        PropertyResult result = smt.verify("(assert (> y 0))\n(check-sat)\n");

        assertTrue(result.isError());
        assertEquals(0, backend.calls);
        assertEquals(1, smt.getStatistics().getSyntaxErrors());
        assertEquals(1, smt.getStatistics().getQueriesExecuted());
    }

    @Test
    void missingOptionalSolverGivesUnknown() {
        SmtInterface smt = interfaceFor(new StubBackend(false, SolverStatus.UNSAT, false), false);

        assertTrue(smt.verify(VALID).isUnknown());
    }

    @Test
    void missingRequiredSolverFails() {
        SmtInterface smt = interfaceFor(new StubBackend(false, SolverStatus.UNSAT, false), true);

        assertThrows(SolverUnavailableException.class, () -> smt.verify(VALID));
    }

    @Test
    void solverFailureBecomesError() {
        SmtInterface smt = interfaceFor(new StubBackend(true, SolverStatus.UNSAT, true), false);

        PropertyResult result = smt.verify(VALID);

        assertTrue(result.isError());
        assertEquals(1, smt.getStatistics().getSolverErrors());
    }

    @Test
    void disabledInterfaceAnswersUnknown() {
        assertTrue(SmtInterface.disabled().verify(VALID).isUnknown());
    }
}
