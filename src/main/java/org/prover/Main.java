package org.prover;

import org.prover.axiom.AxiomSystem;
import org.prover.axiom.AxiomSystemBuilder;
import org.prover.parser.FormulaParseException;
import org.prover.parser.FormulaParser;
import org.prover.parser.ProblemFile;
import org.prover.search.ProofStep;
import org.prover.smt.DisabledBackend;
import org.prover.smt.ProcessSolverBackend;
import org.prover.smt.SmtConfig;
import org.prover.smt.SmtInterface;
import org.prover.smt.SolverBackend;
import org.prover.smt.Z3Backend;
import org.prover.verify.FormalVerifier;
import org.prover.verify.PropertyVerification;
import org.prover.verify.VerificationConfig;
import org.prover.verify.VerificationFailure;
import org.prover.verify.VerificationMethod;
import org.prover.verify.VerificationReport;
import org.prover.verify.VerificationStatistics;
import org.prover.verify.VerificationStatus;

import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * DIMOSTRATORE FORMALE - Verifica di proprietà logiche e temporali
 *
 * PIPELINE DI ELABORAZIONE:
 * 1. INPUT: file di problema (.proof) con assiomi, regole e obiettivi
 * 2. PARSING: notazione testuale -> albero sintattico (ANTLR) -> formule
 * 3. SISTEMA ASSIOMATICO: libreria standard + assiomi e regole del file
 * 4. VERIFICA: per ogni obiettivo i metodi richiesti in ordine
 *    (deduzione naturale, backward chaining, forward chaining, risoluzione, solutore SMT)
 * 5. OUTPUT: esiti per obiettivo con prove, statistiche del lotto
 *
 * MODALITÀ OPERATIVE:
 * - File singolo (-f): verifica degli obiettivi di un file
 * - Directory (-d): verifica di tutti i file .proof di una cartella
 * - Metodi (-m=nd,bc,fc,res,smt): metodi di default per gli obiettivi senza clausola "by"
 * - Timeout complessivo (-t secondi) e lavoratori paralleli (-w numero)
 * - Solutore (-solver=z3|process|none) e obbligatorietà (-require-solver)
 *
 * ORGANIZZAZIONE DEGLI OUTPUT:
 * - RESULT/: esito di ogni obiettivo con la prova trovata
 * - STATS/: statistiche del lotto
 */
public final class Main {
    //region CONFIGURAZIONE PARAMETRI APPLICAZIONE

    /**
     * Parametri linea di comando supportati
     * */
    private static final String HELP_PARAM = "-h";
    private static final String FILE_PARAM = "-f";
    private static final String DIR_PARAM = "-d";
    private static final String OUTPUT_PARAM = "-o";
    private static final String TIMEOUT_PARAM = "-t";
    private static final String WORKERS_PARAM = "-w";
    private static final String METHODS_PARAM = "-m=";
    private static final String SOLVER_PARAM = "-solver=";
    private static final String REQUIRE_SOLVER_PARAM = "-require-solver";
    private static final String SEQUENTIAL_PARAM = "-seq";

    /**
     * Solutori disponibili
     * */
    private static final String SOLVER_Z3 = "z3";
    private static final String SOLVER_PROCESS = "process";
    private static final String SOLVER_NONE = "none";

    /**
     * Estensione dei file di problema
     * */
    private static final String PROBLEM_EXTENSION = ".proof";

    /**
     * Configurazioni timeout di default e limiti
     * */
    private static final int DEFAULT_TIMEOUT_SECONDS = 300;
    private static final int MIN_TIMEOUT_SECONDS = 1;
    private static final int MAX_WORKERS = 64;

    /**
     * Previene istanziazione - classe utility
     * */
    private Main() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //endregion

    //region PUNTO PRINCIPALE

    /**
     * Punto principale del dimostratore.
     *
     * FLUSSO ESECUZIONE:
     * 1. Parsing e validazione parametri linea di comando
     * 2. Elaborazione del file o della directory
     * 3. Gestione errori globali
     *
     * @param args parametri linea di comando forniti dall'utente
     */
    public static void main(String[] args) {
        System.out.println("---> AVVIO DIMOSTRATORE FORMALE <---");

        try {
            if (args.length == 0) {
                System.out.println("[E] Nessun parametro fornito. Usa -h per visualizzare l'help.");
                return;
            }

            ProverConfiguration config = parseAndValidateArguments(args);
            if (config == null) return; // Help mostrato o errore

            displayConfigurationSummary(config);
            if (config.isFileMode) {
                System.out.println("[I] Modalità: Elaborazione file singolo");
                processSingleFile(config);
            } else {
                System.out.println("[I] Modalità: Elaborazione della directory");
                processDirectoryBatch(config);
            }

        } catch (Exception e) {
            System.out.println("[E] Errore critico nell'applicazione: " + e.getMessage());
            System.out.println("Controllare i log per dettagli completi.");
            System.exit(1);
        } finally {
            System.out.println("---> FINE ESECUZIONE DIMOSTRATORE <---");
        }
    }

    //endregion

    //region PARSING E VALIDAZIONE PARAMETRI

    private static ProverConfiguration parseAndValidateArguments(String[] args) {
        try {
            return new ArgumentParser().parse(args);
        } catch (IllegalArgumentException e) {
            System.out.println("[E] Errore nella validazione dei parametri: " + e.getMessage());
            System.out.println("Usa -h per visualizzare l'help completo.");
            return null;
        }
    }

    private static void displayConfigurationSummary(ProverConfiguration config) {
        System.out.println("\n-->> CONFIGURAZIONE DIMOSTRATORE <<--");
        System.out.println("Modalità: " + (config.isFileMode ? "File singolo" : "Directory"));
        System.out.println("Input: " + config.inputPath);
        System.out.println("Timeout complessivo: " + config.timeoutSeconds + " secondi");
        System.out.println("Metodi: " + describeMethods(config.methods));
        System.out.println("Esecuzione: " + (config.parallel ? config.workers + " lavoratori paralleli" : "sequenziale"));
        System.out.println("Solutore: " + config.solver + (config.requireSolver ? " (obbligatorio)" : ""));
        System.out.println("Output: " + (config.outputPath != null ? config.outputPath : "Directory input"));
        System.out.println("====================================\n");
    }

    private static String describeMethods(List<VerificationMethod> methods) {
        List<String> names = new ArrayList<>();
        for (VerificationMethod method : methods) {
            names.add(method.shortName());
        }
        return String.join(", ", names);
    }

    //endregion

    //region ELABORAZIONE DEL SINGOLO FILE

    /**
     * Elabora un file di problema completo.
     *
     * PIPELINE:
     * 1. Lettura e parsing del file
     * 2. Costruzione del sistema assiomatico e del verificatore
     * 3. Verifica in lotto degli obiettivi
     * 4. Salvataggio di esiti e statistiche
     *
     * @param config configurazione con il file da elaborare
     */
    private static void processSingleFile(ProverConfiguration config) {
        System.out.println("[I] Inizio elaborazione: " + config.inputPath);

        try {
            ProblemFile problem = readProblem(config.inputPath);
            if (problem.goals().isEmpty()) {
                System.out.println("[W] Nessun obiettivo dichiarato nel file.");
            }

            VerificationReport report = executeVerification(problem, config);
            displayReport(report);
            saveResults(report, config);
            saveStatistics(report, config);

        } catch (FormulaParseException e) {
            System.out.println("[E] Errore di sintassi nel file " + config.inputPath + ": " + e.getMessage());
        } catch (IllegalArgumentException e) {
            System.out.println("[E] Problema non valido " + config.inputPath + ": " + e.getMessage());
        } catch (IOException e) {
            System.out.println("[E] Errore di I/O su " + config.inputPath + ": " + e.getMessage());
        }
    }

    private static ProblemFile readProblem(String filePath) throws IOException {
        System.out.println("Lettura del problema dal file...");
        String content = Files.readString(Paths.get(filePath), StandardCharsets.UTF_8);
        ProblemFile problem = FormulaParser.parseProblem(content);
        System.out.printf("[I] Problema letto: %d assiomi, %d regole, %d obiettivi%n",
                problem.axioms().size(), problem.rules().size(), problem.goals().size());
        return problem;
    }

    private static VerificationReport executeVerification(ProblemFile problem, ProverConfiguration config) {
        AxiomSystem system = AxiomSystemBuilder.standard()
                .addAll(problem.toAxiomSystem())
                .build();

        Duration total = Duration.ofSeconds(config.timeoutSeconds);
        Duration property = total.compareTo(VerificationConfig.DEFAULT_PROPERTY_TIMEOUT) < 0
                ? total : VerificationConfig.DEFAULT_PROPERTY_TIMEOUT;

        SmtConfig smtConfig = new SmtConfig(property.toMillis(), config.requireSolver, false);
        VerificationConfig verificationConfig = VerificationConfig.builder()
                .totalTimeout(total)
                .propertyTimeout(property)
                .methods(config.methods)
                .parallel(config.parallel)
                .workerThreads(config.workers)
                .requireSolver(config.requireSolver)
                .smtConfig(smtConfig)
                .build();

        SmtInterface smt = new SmtInterface(createBackend(config.solver), smtConfig);
        if (config.methods.contains(VerificationMethod.SMT_SOLVER) && !smt.isSolverAvailable()) {
            System.out.println("[W] Solutore '" + smt.getBackendName() + "' non disponibile");
        }

        System.out.println("Verifica di " + problem.goals().size() + " obiettivi...");
        FormalVerifier verifier = new FormalVerifier(system, verificationConfig, smt);
        return verifier.verifyBatch(problem.toTasks());
    }

    private static SolverBackend createBackend(String solver) {
        return switch (solver) {
            case SOLVER_Z3 -> new Z3Backend();
            case SOLVER_PROCESS -> new ProcessSolverBackend();
            default -> new DisabledBackend();
        };
    }

    private static void displayReport(VerificationReport report) {
        System.out.println("\n-->> ESITO DELLA VERIFICA <<--");
        for (PropertyVerification result : report.results()) {
            System.out.printf("%-24s %s%s%n", result.name(), result.verdict(),
                    result.method() != null ? " [" + result.method().shortName() + "]" : "");
        }
        System.out.println("Stato: " + report.status().describe());
        for (String warning : report.warnings()) {
            System.out.println("[W] " + warning);
        }
        System.out.println("==============================\n");
    }

    //endregion

    //region ELABORAZIONE DELLA DIRECTORY

    private static void processDirectoryBatch(ProverConfiguration config) {
        System.out.println("[I] Inizio elaborazione directory: " + config.inputPath);

        File dir = new File(config.inputPath);
        if (!dir.exists() || !dir.isDirectory()) {
            System.out.println("[E] Errore: directory non esistente: " + config.inputPath);
            return;
        }

        try {
            List<File> files = findAllProblemFiles(config.inputPath);
            if (files.isEmpty()) {
                System.out.println("[W] Nessun file " + PROBLEM_EXTENSION + " trovato nella directory specificata.");
                return;
            }

            int processed = 0;
            for (File file : files) {
                System.out.println("Elaborazione: " + file.getName());
                processSingleFile(config.forFile(file));
                processed++;
                System.out.println();
            }

            System.out.println("\n-->> RIEPILOGO ELABORAZIONE DIRECTORY <<--");
            System.out.println("File elaborati: " + processed + "/" + files.size());
            System.out.println("=========================================\n");

        } catch (IOException e) {
            System.out.println("[E] Errore durante l'accesso alla directory: " + e.getMessage());
        }
    }

    private static List<File> findAllProblemFiles(String dirPath) throws IOException {
        try (Stream<Path> paths = Files.list(Paths.get(dirPath))) {
            return paths.filter(path -> path.toString().toLowerCase().endsWith(PROBLEM_EXTENSION))
                    .map(Path::toFile)
                    .sorted(Comparator.comparing(File::getName))
                    .toList();
        }
    }

    //endregion

    //region GESTIONE DELL'OUTPUT E SALVATAGGIO DEI FILE

    /**
     * Salva in RESULT/ l'esito di ogni obiettivo, con la prova se disponibile.
     */
    private static void saveResults(VerificationReport report, ProverConfiguration config) throws IOException {
        Path outputDir = getOutputDirectory(config, "RESULT");
        Files.createDirectories(outputDir);
        Path resultPath = outputDir.resolve(getBaseFileName(config.inputPath) + ".result");

        try (FileWriter writer = new FileWriter(resultPath.toFile(), StandardCharsets.UTF_8)) {
            writer.write("=== ESITO DELLA VERIFICA ===\n\n");
            writer.write("Stato: " + report.status().describe() + "\n\n");

            for (PropertyVerification result : report.results()) {
                writer.write("Obiettivo: " + result.name() + "\n");
                writer.write("Verdetto: " + result.verdict() + "\n");
                if (result.method() != null) {
                    writer.write("Metodo: " + result.method().shortName() + (result.fromCache() ? " (cache)" : "") + "\n");
                }
                writer.write("Tempo: " + result.timeMs() + " ms\n");
                if (!result.proof().isEmpty()) {
                    writer.write("Prova" + (result.verdict().isDisproven() ? " della negazione" : "") + ":\n");
                    for (ProofStep step : result.proof()) {
                        writer.write("  " + step + "\n");
                    }
                }
                writer.write("\n");
            }

            List<VerificationFailure> failures = failuresOf(report.status());
            if (!failures.isEmpty()) {
                writer.write("=== PROPRIETÀ NON VERIFICATE ===\n\n");
                for (VerificationFailure failure : failures) {
                    writer.write(failure + "\n");
                    for (String suggestion : failure.suggestions()) {
                        writer.write("  -> " + suggestion + "\n");
                    }
                }
            }
        }

        System.out.println("[I] Esito salvato: " + resultPath);
    }

    private static void saveStatistics(VerificationReport report, ProverConfiguration config) throws IOException {
        Path statsDir = getOutputDirectory(config, "STATS");
        Files.createDirectories(statsDir);
        Path statsPath = statsDir.resolve(getBaseFileName(config.inputPath) + ".stats");

        VerificationStatistics statistics = report.statistics();
        try (FileWriter writer = new FileWriter(statsPath.toFile(), StandardCharsets.UTF_8)) {
            writer.write("=== STATISTICHE DI VERIFICA ===\n\n");
            writer.write(statistics + "\n\n");
            writer.write("Tasso di successo per metodo:\n");
            for (VerificationMethod method : VerificationMethod.values()) {
                if (statistics.getAttempts(method) > 0) {
                    writer.write(String.format("  %-4s %d/%d (%.1f%%)%n", method.shortName(),
                            statistics.getSuccesses(method), statistics.getAttempts(method),
                            statistics.getSuccessRate(method) * 100));
                }
            }
        }

        System.out.println("[I] Statistiche salvate: " + statsPath);
    }

    private static List<VerificationFailure> failuresOf(VerificationStatus status) {
        if (status instanceof VerificationStatus.PartiallyVerified partial) {
            return partial.failures();
        }
        if (status instanceof VerificationStatus.Failed failed) {
            return failed.failures();
        }
        return List.of();
    }

    //endregion

    //region GESTIONE DEI PERCORSI

    private static Path getOutputDirectory(ProverConfiguration config, String subdirName) {
        if (config.outputPath != null) {
            return Paths.get(config.outputPath).resolve(subdirName);
        }
        Path parentDir = Paths.get(config.inputPath).getParent();
        return parentDir != null ? parentDir.resolve(subdirName) : Paths.get(subdirName);
    }

    private static String getBaseFileName(String filePath) {
        String fileName = Paths.get(filePath).getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(0, lastDot) : fileName;
    }

    //endregion

    //region HELP E DOCUMENTAZIONE

    private static void printApplicationHelp() {
        System.out.println("""
                UTILIZZO:
                  java -jar dimostratore-formale.jar [-f <file> | -d <dir>] [opzioni]

                PARAMETRI:
                  -f <file>            File di problema da verificare
                  -d <dir>             Directory con file .proof da verificare
                  -o <dir>             Directory di output (default: directory dell'input)
                  -t <secondi>         Timeout complessivo del lotto (default: 300)
                  -w <numero>          Lavoratori paralleli (default: 4)
                  -seq                 Verifica sequenziale degli obiettivi
                  -m=<metodi>          Metodi di default separati da virgola: nd, bc, fc, res, smt
                  -solver=<nome>       Solutore SMT: z3, process, none (default: none)
                  -require-solver      Il solutore è obbligatorio: se assente il lotto termina in errore
                  -h                   Mostra questo help

                FORMATO DEL FILE:
                  axiom nome: formula.
                  rule nome: premessa1, premessa2 |- conclusione.
                  goal nome [by nd, res]: formula.

                ESEMPIO:
                  axiom pioggia: piove -> bagnato.
                  axiom fatto: piove.
                  goal strada by nd: bagnato.
                """);
    }

    //endregion

    //region CLASSI DI SUPPORTO E CONFIGURAZIONE

    /**
     * Configurazione validata dell'applicazione.
     */
    private static class ProverConfiguration {
        final String inputPath;
        final String outputPath;
        final boolean isFileMode;
        final int timeoutSeconds;
        final int workers;
        final boolean parallel;
        final List<VerificationMethod> methods;
        final String solver;
        final boolean requireSolver;

        ProverConfiguration(String inputPath, String outputPath, boolean isFileMode, int timeoutSeconds,
                            int workers, boolean parallel, List<VerificationMethod> methods,
                            String solver, boolean requireSolver) {
            this.inputPath = inputPath;
            this.outputPath = outputPath;
            this.isFileMode = isFileMode;
            this.timeoutSeconds = timeoutSeconds;
            this.workers = workers;
            this.parallel = parallel;
            this.methods = methods;
            this.solver = solver;
            this.requireSolver = requireSolver;
        }

        ProverConfiguration forFile(File file) {
            return new ProverConfiguration(file.getAbsolutePath(), outputPath, true, timeoutSeconds,
                    workers, parallel, methods, solver, requireSolver);
        }
    }

    /**
     * Parser dei parametri della linea di comando.
     */
    private static class ArgumentParser {

        private String inputPath = null;
        private String outputPath = null;
        private boolean isFileMode = false;
        private int timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;
        private int workers = VerificationConfig.DEFAULT_WORKER_THREADS;
        private boolean parallel = true;
        private List<VerificationMethod> methods = VerificationConfig.DEFAULT_METHODS;
        private String solver = SOLVER_NONE;
        private boolean requireSolver = false;

        /**
         * @return configurazione validata, null se è stato richiesto l'help
         * @throws IllegalArgumentException se i parametri non sono validi
         */
        ProverConfiguration parse(String[] args) {
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];

                if (arg.equals(HELP_PARAM)) {
                    printApplicationHelp();
                    return null;
                } else if (arg.equals(FILE_PARAM) || arg.equals(DIR_PARAM)) {
                    if (inputPath != null) {
                        throw new IllegalArgumentException("Specificare un solo input tra -f e -d");
                    }
                    inputPath = requireValue(args, ++i, arg);
                    isFileMode = arg.equals(FILE_PARAM);
                } else if (arg.equals(OUTPUT_PARAM)) {
                    outputPath = requireValue(args, ++i, arg);
                } else if (arg.equals(TIMEOUT_PARAM)) {
                    timeoutSeconds = parseBounded(requireValue(args, ++i, arg), MIN_TIMEOUT_SECONDS, Integer.MAX_VALUE, arg);
                } else if (arg.equals(WORKERS_PARAM)) {
                    workers = parseBounded(requireValue(args, ++i, arg), 1, MAX_WORKERS, arg);
                } else if (arg.equals(SEQUENTIAL_PARAM)) {
                    parallel = false;
                } else if (arg.startsWith(METHODS_PARAM)) {
                    methods = parseMethods(arg.substring(METHODS_PARAM.length()));
                } else if (arg.startsWith(SOLVER_PARAM)) {
                    solver = parseSolver(arg.substring(SOLVER_PARAM.length()));
                } else if (arg.equals(REQUIRE_SOLVER_PARAM)) {
                    requireSolver = true;
                } else {
                    throw new IllegalArgumentException("Parametro sconosciuto: " + arg);
                }
            }

            if (inputPath == null) {
                throw new IllegalArgumentException("Specificare un file (-f) o una directory (-d)");
            }
            if (isFileMode && !new File(inputPath).isFile()) {
                throw new IllegalArgumentException("File non esistente: " + inputPath);
            }

            return new ProverConfiguration(inputPath, outputPath, isFileMode, timeoutSeconds,
                    workers, parallel, methods, solver, requireSolver);
        }

        private static String requireValue(String[] args, int index, String param) {
            if (index >= args.length || args[index].startsWith("-")) {
                throw new IllegalArgumentException("Valore mancante per " + param);
            }
            return args[index];
        }

        private static int parseBounded(String value, int min, int max, String param) {
            try {
                int parsed = Integer.parseInt(value);
                if (parsed < min || parsed > max) {
                    throw new IllegalArgumentException(param + " deve essere compreso tra " + min + " e " + max);
                }
                return parsed;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Valore numerico non valido per " + param + ": " + value);
            }
        }

        private static List<VerificationMethod> parseMethods(String value) {
            List<VerificationMethod> parsed = new ArrayList<>();
            for (String name : value.split(",")) {
                if (!name.isBlank()) {
                    VerificationMethod method = VerificationMethod.fromName(name);
                    if (!parsed.contains(method)) {
                        parsed.add(method);
                    }
                }
            }
            if (parsed.isEmpty()) {
                throw new IllegalArgumentException("Nessun metodo specificato in " + METHODS_PARAM);
            }
            return parsed;
        }

        private static String parseSolver(String value) {
            String normalized = value.trim().toLowerCase();
            if (!normalized.equals(SOLVER_Z3) && !normalized.equals(SOLVER_PROCESS) && !normalized.equals(SOLVER_NONE)) {
                throw new IllegalArgumentException("Solutore non supportato: " + value);
            }
            return normalized;
        }
    }

    //endregion
}
