package org.prover.smt;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * VALIDATORE SINTATTICO SMT-LIB - Controlli strutturali locali prima dell'invio al solutore
 *
 * Non è un parser SMT-LIB completo: rifiuta soltanto il testo malformato.
 *
 * CONTROLLI (in ordine, il primo fallito interrompe):
 * 1. Bilanciamento parentesi: la profondità non diventa mai negativa e termina a zero
 * 2. Presenza del comando (check-sat)
 * 3. Ogni identificatore dentro un (assert ...) è dichiarato prima nel testo
 *    (declare-const / declare-fun / declare-sort / define-fun), oppure legato da
 *    forall / exists / let, oppure è un letterale, una keyword o un simbolo predefinito
 *
 * I commenti iniziano con ';' e proseguono fino a fine riga; stringhe e simboli
 * tra barre verticali non contribuiscono al conteggio delle parentesi.
 */
public class SmtSyntaxValidator {

    private static final Logger LOGGER = Logger.getLogger(SmtSyntaxValidator.class.getName());

    private static final Pattern NUMERAL = Pattern.compile("-?[0-9]+(\\.[0-9]+)?");
    private static final Pattern BINARY_OR_HEX = Pattern.compile("#(b[01]+|x[0-9a-fA-F]+)");

    /** Operatori, sort, costanti e comandi che non richiedono dichiarazione */
    private static final Set<String> BUILTINS = Set.of(
            // comandi
            "assert", "check-sat", "get-model", "declare-const", "declare-fun", "declare-sort", "define-fun",
            "define-sort", "set-logic", "set-option", "set-info", "push", "pop", "exit", "echo", "get-value",
            // sort
            "Int", "Real", "Bool", "String", "Array",
            // logica
            "and", "or", "not", "=>", "iff", "xor", "ite", "distinct", "true", "false",
            "forall", "exists", "let", "!", "_", "as", "const",
            // aritmetica
            "+", "-", "*", "/", "div", "mod", "abs", "^", "=", "<", ">", "<=", ">=", "to_real", "to_int",
            // array e insiemi
            "select", "store",
            // risposte del solutore
            "sat", "unsat", "unknown");

    private static final Set<String> BINDERS = Set.of("forall", "exists");

    /**
     * Valida il testo SMT-LIB.
     *
     * @param text script da validare
     * @return OK oppure il primo errore trovato
     */
    public SmtValidationResult validate(String text) {
        if (text == null || text.isBlank()) {
            return SmtValidationResult.error(SyntaxErrorKind.MISSING_CHECK_SAT, "Testo SMT vuoto: comando (check-sat) mancante");
        }

        SmtValidationResult parentheses = checkParentheses(text);
        if (!parentheses.valid()) {
            LOGGER.fine("Validazione SMT fallita: " + parentheses.message());
            return parentheses;
        }

        List<SExpr> commands = parse(tokenize(text));
        boolean hasCheckSat = commands.stream().anyMatch(c -> "check-sat".equals(c.head()));
        if (!hasCheckSat) {
            return SmtValidationResult.error(SyntaxErrorKind.MISSING_CHECK_SAT, "Comando (check-sat) mancante");
        }

        SmtValidationResult symbols = checkDeclarations(commands);
        if (!symbols.valid()) {
            LOGGER.fine("Validazione SMT fallita: " + symbols.message());
        }
        return symbols;
    }

    //region BILANCIAMENTO PARENTESI

    private SmtValidationResult checkParentheses(String text) {
        String[] lines = text.split("\n", -1);
        int depth = 0;
        boolean inString = false;
        boolean inQuoted = false;

        for (int lineNumber = 1; lineNumber <= lines.length; lineNumber++) {
            String line = lines[lineNumber - 1];
            if (!inString && !inQuoted && (line.isBlank() || line.trim().startsWith(";;"))) {
                continue;
            }
            for (int i = 0; i < line.length(); i++) {
                char c = line.charAt(i);
                if (inString) {
                    if (c == '"') inString = false;
                } else if (inQuoted) {
                    if (c == '|') inQuoted = false;
                } else if (c == ';') {
                    break;
                } else if (c == '"') {
                    inString = true;
                } else if (c == '|') {
                    inQuoted = true;
                } else if (c == '(') {
                    depth++;
                } else if (c == ')') {
                    depth--;
                    if (depth < 0) {
                        return SmtValidationResult.error(SyntaxErrorKind.UNBALANCED_PARENTHESES,
                                "Riga " + lineNumber + ": parentesi di chiusura senza corrispondenza");
                    }
                }
            }
        }

        if (depth != 0) {
            return SmtValidationResult.error(SyntaxErrorKind.UNBALANCED_PARENTHESES,
                    "Parentesi sbilanciate: " + depth + " non chiuse");
        }
        return SmtValidationResult.ok();
    }

    //endregion

    //region TOKENIZZAZIONE E S-ESPRESSIONI

    /**
     * Nodo di S-espressione: atomo (lista null) oppure lista di nodi.
     */
    private record SExpr(String atom, List<SExpr> list) {
        boolean isAtom() {
            return list == null;
        }

        String head() {
            if (isAtom() || list.isEmpty() || !list.get(0).isAtom()) {
                return null;
            }
            return list.get(0).atom;
        }
    }

    private List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        int i = 0;
        int n = text.length();
        while (i < n) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == ';') {
                while (i < n && text.charAt(i) != '\n') i++;
            } else if (c == '(' || c == ')') {
                tokens.add(String.valueOf(c));
                i++;
            } else if (c == '"') {
                int end = i + 1;
                while (end < n) {
                    if (text.charAt(end) == '"') {
                        // "" è un apice escaped
                        if (end + 1 < n && text.charAt(end + 1) == '"') {
                            end += 2;
                            continue;
                        }
                        break;
                    }
                    end++;
                }
                tokens.add(text.substring(i, Math.min(end + 1, n)));
                i = end + 1;
            } else if (c == '|') {
                int end = text.indexOf('|', i + 1);
                end = end < 0 ? n - 1 : end;
                tokens.add(text.substring(i, end + 1));
                i = end + 1;
            } else {
                int start = i;
                while (i < n && !Character.isWhitespace(text.charAt(i)) && "();\"".indexOf(text.charAt(i)) < 0) {
                    i++;
                }
                tokens.add(text.substring(start, i));
            }
        }
        return tokens;
    }

    private List<SExpr> parse(List<String> tokens) {
        Deque<List<SExpr>> stack = new ArrayDeque<>();
        List<SExpr> top = new ArrayList<>();
        stack.push(top);
        for (String token : tokens) {
            if ("(".equals(token)) {
                stack.push(new ArrayList<>());
            } else if (")".equals(token)) {
                List<SExpr> closed = stack.pop();
                stack.peek().add(new SExpr(null, closed));
            } else {
                stack.peek().add(new SExpr(token, null));
            }
        }
        return top;
    }

    //endregion

    //region DICHIARAZIONI E RIFERIMENTI

    private SmtValidationResult checkDeclarations(List<SExpr> commands) {
        Set<String> declared = new HashSet<>();
        for (SExpr command : commands) {
            String head = command.head();
            if (head == null) {
                continue;
            }
            switch (head) {
                case "declare-const", "declare-fun", "declare-sort", "define-fun", "define-sort" -> {
                    if (command.list().size() > 1 && command.list().get(1).isAtom()) {
                        declared.add(normalize(command.list().get(1).atom()));
                    }
                }
                case "assert" -> {
                    for (int i = 1; i < command.list().size(); i++) {
                        String missing = findUndeclared(command.list().get(i), declared, new ArrayDeque<>());
                        if (missing != null) {
                            return SmtValidationResult.undeclared(missing);
                        }
                    }
                }
                default -> {
                    // altri comandi non referenziano simboli da verificare
                }
            }
        }
        return SmtValidationResult.ok();
    }

    /**
     * Cerca il primo identificatore non dichiarato in un'espressione.
     *
     * @return nome del simbolo mancante, null se tutti risolti
     */
    private String findUndeclared(SExpr expr, Set<String> declared, Deque<Set<String>> scopes) {
        if (expr.isAtom()) {
            return isResolved(expr.atom(), declared, scopes) ? null : normalize(expr.atom());
        }
        List<SExpr> list = expr.list();
        String head = expr.head();

        if (head != null && BINDERS.contains(head) && list.size() == 3 && !list.get(1).isAtom()) {
            Set<String> scope = new HashSet<>();
            for (SExpr binding : list.get(1).list()) {
                if (binding.isAtom() || binding.list().isEmpty()) {
                    continue;
                }
                scope.add(normalize(binding.list().get(0).atom()));
                for (int i = 1; i < binding.list().size(); i++) {
                    String missing = findUndeclared(binding.list().get(i), declared, scopes);
                    if (missing != null) return missing;
                }
            }
            scopes.push(scope);
            String missing = findUndeclared(list.get(2), declared, scopes);
            scopes.pop();
            return missing;
        }

        if ("let".equals(head) && list.size() == 3 && !list.get(1).isAtom()) {
            Set<String> scope = new HashSet<>();
            for (SExpr binding : list.get(1).list()) {
                if (binding.isAtom() || binding.list().size() != 2) {
                    continue;
                }
                String missing = findUndeclared(binding.list().get(1), declared, scopes);
                if (missing != null) return missing;
                scope.add(normalize(binding.list().get(0).atom()));
            }
            scopes.push(scope);
            String missing = findUndeclared(list.get(2), declared, scopes);
            scopes.pop();
            return missing;
        }

        for (SExpr child : list) {
            String missing = findUndeclared(child, declared, scopes);
            if (missing != null) return missing;
        }
        return null;
    }

    private boolean isResolved(String atom, Set<String> declared, Deque<Set<String>> scopes) {
        if (atom == null || atom.startsWith("\"") || atom.startsWith(":")) {
            return true;
        }
        if (NUMERAL.matcher(atom).matches() || BINARY_OR_HEX.matcher(atom).matches()) {
            return true;
        }
        String name = normalize(atom);
        if (BUILTINS.contains(name) || declared.contains(name)) {
            return true;
        }
        for (Set<String> scope : scopes) {
            if (scope.contains(name)) return true;
        }
        return false;
    }

    // |x| e x denotano lo stesso simbolo
    private static String normalize(String atom) {
        if (atom != null && atom.length() >= 2 && atom.startsWith("|") && atom.endsWith("|")) {
            return atom.substring(1, atom.length() - 1);
        }
        return atom;
    }

    //endregion
}
