package org.prover.smt;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Params;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import com.microsoft.z3.Z3Exception;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Backend Z3 in-process tramite l'API Java (librerie native fornite da z3-turnkey).
 *
 * Ogni interrogazione usa un proprio {@link Context}, chiuso al termine: nessuno
 * stato del solutore è condiviso tra proprietà verificate in parallelo.
 * Il timeout è passato al solutore come parametro, unico modo per interrompere
 * una chiamata nativa in corso.
 */
public class Z3Backend implements SolverBackend {

    private static final Logger LOGGER = Logger.getLogger(Z3Backend.class.getName());

    /** Esito del caricamento delle librerie native, calcolato una sola volta */
    private volatile Boolean available;

    @Override
    public String name() {
        return "z3";
    }

    @Override
    public boolean isAvailable() {
        Boolean cached = available;
        if (cached == null) {
            synchronized (this) {
                if (available == null) {
                    available = probe();
                }
                cached = available;
            }
        }
        return cached;
    }

    private static boolean probe() {
        try (Context ctx = new Context()) {
            ctx.mkSolver();
            return true;
        } catch (LinkageError | Z3Exception e) {
            LOGGER.log(Level.WARNING, "Librerie native Z3 non disponibili", e);
            return false;
        }
    }

    @Override
    public SolverStatus check(String script, long timeoutMs) {
        try (Context ctx = new Context()) {
            Solver solver = ctx.mkSolver();
            Params params = ctx.mkParams();
            params.add("timeout", (int) Math.min(Integer.MAX_VALUE, Math.max(1, timeoutMs)));
            solver.setParameters(params);

            BoolExpr[] assertions = ctx.parseSMTLIB2String(assertionsOnly(script), null, null, null, null);
            solver.add(assertions);

            Status status = solver.check();
            LOGGER.fine("Z3: " + status + " (" + assertions.length + " asserzioni)");
            return switch (status) {
                case SATISFIABLE -> SolverStatus.SAT;
                case UNSATISFIABLE -> SolverStatus.UNSAT;
                default -> SolverStatus.UNKNOWN;
            };
        } catch (Z3Exception e) {
            throw new SolverException("Z3 ha rifiutato lo script: " + e.getMessage(), e);
        }
    }

    /**
     * Rimuove i comandi che il parser dell'API non esegue: la verifica di
     * soddisfacibilità è invocata direttamente sul solver.
     */
    static String assertionsOnly(String script) {
        StringBuilder sb = new StringBuilder();
        for (String line : script.split("\n")) {
            String trimmed = line.trim();
            if (trimmed.equals("(check-sat)") || trimmed.equals("(get-model)") || trimmed.equals("(exit)")) {
                continue;
            }
            sb.append(line).append('\n');
        }
        return sb.toString();
    }
}
