package org.prover.smt;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ProcessSolverBackendTest {

    private static ProcessSolverBackend.OutputDrain drained(String output) {
        ProcessSolverBackend.OutputDrain drain = new ProcessSolverBackend.OutputDrain(
                new ByteArrayInputStream(output.getBytes(StandardCharsets.UTF_8)));
        drain.run();
        return drain;
    }

    //region LETTURA DELL'USCITA

    @Test
    void firstStatusLineWinsOverFollowingModel() {
        StringBuilder output = new StringBuilder("sat\n(\n");
        for (int i = 0; i < 50_000; i++) {
            output.append("  (define-fun x").append(i).append(" () Int 0)\n");
        }
        output.append(")\n");

        assertEquals(SolverStatus.SAT, drained(output.toString()).result());
    }

    @Test
    void errorLineBecomesSolverException() {
        assertThrows(SolverException.class, () -> drained("(error \"line 1: unknown constant x\")\n").result());
    }

    @Test
    void timeoutOrSilenceIsUnknown() {
        assertEquals(SolverStatus.UNKNOWN, drained("timeout\n").result());
        assertEquals(SolverStatus.UNKNOWN, drained("").result());
    }

    //endregion

    //region PROCESSO ESTERNO

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void longOutputBeforeStatusDoesNotBlockProcess() {
        // più righe di quante ne contenga il buffer della pipe, poi l'esito
        ProcessSolverBackend backend = new ProcessSolverBackend(List.of("sh", "-c",
                "cat > /dev/null; yes '(define-fun x () Int 0)' | head -n 20000; echo unsat"));

        assertEquals(SolverStatus.UNSAT, backend.check("(check-sat)\n", 5_000));
    }

    @Test
    void missingExecutableIsUnavailable() {
        assertFalse(new ProcessSolverBackend("solutore-inesistente-per-prova").isAvailable());
    }

    //endregion
}
