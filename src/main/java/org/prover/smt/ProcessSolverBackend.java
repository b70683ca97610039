package org.prover.smt;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Writer;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Backend che invoca un eseguibile SMT-LIB esterno (di default {@code z3 -in -smt2}).
 *
 * Lo script viene scritto sullo standard input del processo; la prima riga di
 * risposta è l'esito di (check-sat). Il timeout è imposto sia al solutore
 * (opzione -T) sia all'attesa del processo, che viene terminato se lo supera.
 * L'uscita del processo è consumata da un thread dedicato mentre si attende la
 * sua terminazione, così un modello lungo non riempie la pipe.
 */
public class ProcessSolverBackend implements SolverBackend {

    private static final Logger LOGGER = Logger.getLogger(ProcessSolverBackend.class.getName());

    /** Margine concesso al processo oltre il timeout del solutore */
    private static final long GRACE_MS = 2_000;

    private final List<String> command;
    private final String executable;
    private volatile Boolean available;

    public ProcessSolverBackend(String executable) {
        this(executable == null ? List.of() : List.of(executable));
    }

    /**
     * @param command eseguibile seguito da eventuali opzioni fisse; le opzioni
     *                {@code -in -smt2 -T:n} sono aggiunte a ogni invocazione
     */
    public ProcessSolverBackend(List<String> command) {
        if (command == null || command.isEmpty() || command.get(0) == null || command.get(0).isBlank()) {
            throw new IllegalArgumentException("Eseguibile del solutore non può essere null o vuoto");
        }
        this.command = List.copyOf(command);
        this.executable = command.get(0);
    }

    public ProcessSolverBackend() {
        this("z3");
    }

    @Override
    public String name() {
        return "processo:" + executable;
    }

    @Override
    public boolean isAvailable() {
        if (available == null) {
            available = probe();
        }
        return available;
    }

    private boolean probe() {
        try {
            Process process = new ProcessBuilder(executable, "-version").redirectErrorStream(true).start();
            if (!process.waitFor(5, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                return false;
            }
            return process.exitValue() == 0;
        } catch (IOException e) {
            LOGGER.fine("Solutore esterno non trovato: " + executable);
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public SolverStatus check(String script, long timeoutMs) {
        long seconds = Math.max(1, (timeoutMs + 999) / 1000);
        List<String> invocation = new ArrayList<>(command);
        invocation.add("-in");
        invocation.add("-smt2");
        invocation.add("-T:" + seconds);
        Process process;
        try {
            process = new ProcessBuilder(invocation)
                    .redirectErrorStream(true)
                    .start();
        } catch (IOException e) {
            throw new SolverException("Impossibile avviare " + executable + ": " + e.getMessage(), e);
        }

        OutputDrain drain = new OutputDrain(process.getInputStream());
        Thread reader = new Thread(drain, "solutore-uscita");
        reader.setDaemon(true);
        reader.start();

        try {
            try (Writer input = new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8)) {
                input.write(script);
                input.write("\n(exit)\n");
            }

            if (!process.waitFor(timeoutMs + GRACE_MS, TimeUnit.MILLISECONDS)) {
                LOGGER.warning("Solutore esterno oltre il timeout, processo terminato");
                process.destroyForcibly();
                return SolverStatus.UNKNOWN;
            }
            reader.join(GRACE_MS);
            return drain.result();

        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Comunicazione con il solutore esterno fallita", e);
            process.destroyForcibly();
            throw new SolverException("Comunicazione con " + executable + " fallita: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            return SolverStatus.UNKNOWN;
        }
    }

    //region LETTURA DELL'USCITA

    /**
     * Consuma l'uscita del processo fino alla fine, ricordando solo la prima riga
     * significativa: l'esito di (check-sat) oppure un errore.
     */
    static final class OutputDrain implements Runnable {
        private final InputStream stream;
        private volatile String response;
        private volatile IOException failure;

        OutputDrain(InputStream stream) {
            this.stream = stream;
        }

        @Override
        public void run() {
            try (BufferedReader output = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = output.readLine()) != null) {
                    String trimmed = line.trim();
                    if (response == null && isResponse(trimmed)) {
                        response = trimmed;
                    }
                }
            } catch (IOException e) {
                failure = e;
            }
        }

        private static boolean isResponse(String line) {
            return line.startsWith("(error") || line.equals("sat") || line.equals("unsat")
                    || line.equals("unknown") || line.equals("timeout");
        }

        /**
         * @throws SolverException se il solutore ha risposto con un errore o l'uscita non era leggibile
         */
        SolverStatus result() {
            String line = response;
            if (line == null) {
                if (failure != null) {
                    throw new SolverException("Lettura dell'uscita del solutore fallita: " + failure.getMessage(),
                            failure);
                }
                return SolverStatus.UNKNOWN;
            }
            if (line.startsWith("(error")) {
                throw new SolverException("Il solutore ha segnalato un errore: " + line);
            }
            if (line.equals("timeout")) {
                return SolverStatus.UNKNOWN;
            }
            return SolverStatus.fromResponse(line);
        }
    }

    //endregion
}
