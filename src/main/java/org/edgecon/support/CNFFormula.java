package org.edgecon.support;

import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * FORMULA CNF NUMERICA - Rappresentazione compatta per l'algoritmo CDCL
 *
 * Contiene le clausole in formato DIMACS (interi con segno) e il mapping dei
 * nomi simbolici verso gli ID numerici. Le variabili ausiliarie introdotte
 * dalla codifica di Tseitin hanno un ID ma nessun nome.
 *
 * INVARIANTI MANTENUTE:
 * - Ogni ID variabile è compreso in [1, variableCount]
 * - Nessun letterale vale 0
 * - Lista clausole immutabile dopo costruzione
 * - Una clausola vuota rende la formula banalmente insoddisfacibile
 */
public class CNFFormula {

    private static final Logger LOGGER = Logger.getLogger(CNFFormula.class.getName());

    //region STRUTTURE DATI CORE

    /** Clausole in formato DIMACS: positivo = letterale vero, negativo = letterale negato */
    private final List<List<Integer>> clauses;

    /** Numero totale di variabili (con nome e ausiliarie) */
    private final int variableCount;

    /** Mapping nome simbolico → ID numerico, in ordine di inserimento */
    private final Map<String, Integer> variableMapping;

    //endregion

    //region COSTRUZIONE E VALIDAZIONE

    /**
     * @param clauses clausole numeriche
     * @param variableMapping mapping nomi → ID delle variabili con nome
     * @param variableCount numero totale di variabili, ausiliarie comprese
     * @throws IllegalArgumentException se la struttura non rispetta gli invarianti
     */
    public CNFFormula(List<List<Integer>> clauses, Map<String, Integer> variableMapping, int variableCount) {
        if (clauses == null || variableMapping == null) {
            throw new IllegalArgumentException("Clausole e mapping non possono essere null");
        }

        List<List<Integer>> copy = new ArrayList<>(clauses.size());
        for (List<Integer> clause : clauses) {
            copy.add(Collections.unmodifiableList(new ArrayList<>(clause)));
        }

        this.clauses = Collections.unmodifiableList(copy);
        this.variableMapping = Collections.unmodifiableMap(new LinkedHashMap<>(variableMapping));
        this.variableCount = variableCount;

        validateVariableMapping();
        validateClauseLiterals();
        logConversionStatistics();
    }

    private void validateVariableMapping() {
        for (Map.Entry<String, Integer> entry : variableMapping.entrySet()) {
            Integer id = entry.getValue();
            if (id == null || id <= 0 || id > variableCount) {
                throw new IllegalArgumentException("ID variabile non valido per '" + entry.getKey() + "': " + id);
            }
        }
    }

    private void validateClauseLiterals() {
        for (int clauseIndex = 0; clauseIndex < clauses.size(); clauseIndex++) {
            List<Integer> clause = clauses.get(clauseIndex);

            for (int literalIndex = 0; literalIndex < clause.size(); literalIndex++) {
                Integer literal = clause.get(literalIndex);

                if (literal == null || literal == 0) {
                    throw new IllegalArgumentException("Letterale non valido in clausola " + clauseIndex +
                            "[" + literalIndex + "]: " + literal);
                }

                if (Math.abs(literal) > variableCount) {
                    throw new IllegalArgumentException("Letterale fuori range in clausola " + clauseIndex +
                            "[" + literalIndex + "]: |" + literal + "| > " + variableCount);
                }
            }
        }
    }

    //endregion

    //region STATISTICHE E LOGGING

    private void logConversionStatistics() {
        int totalLiterals = clauses.stream().mapToInt(List::size).sum();
        double avgClauseLength = clauses.isEmpty() ? 0.0 : (double) totalLiterals / clauses.size();

        LOGGER.fine(String.format("Formula CNF: %d clausole, %d variabili (%d con nome), %.1f letterali/clausola",
                clauses.size(), variableCount, variableMapping.size(), avgClauseLength));

        if (LOGGER.isLoggable(Level.FINER)) {
            Map<Integer, Long> lengthDistribution = clauses.stream()
                    .collect(Collectors.groupingBy(List::size, Collectors.counting()));
            LOGGER.finer("Distribuzione lunghezza clausole: " + lengthDistribution);
        }
    }

    //endregion

    //region INTERFACCIA PUBBLICA

    /**
     * @return clausole immutabili in formato numerico
     */
    public List<List<Integer>> getClauses() {
        return clauses;
    }

    public int getVariableCount() {
        return variableCount;
    }

    public int getClausesCount() {
        return clauses.size();
    }

    /**
     * @return mapping immutabile nomi simbolici → ID numerici
     */
    public Map<String, Integer> getVariableMapping() {
        return variableMapping;
    }

    /**
     * @return true se la formula contiene la clausola vuota
     */
    public boolean hasEmptyClause() {
        for (List<Integer> clause : clauses) {
            if (clause.isEmpty()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Esporta la formula nel formato DIMACS standard. Le variabili con nome
     * sono riportate in righe di commento {@code c <id> <nome>}.
     *
     * @return testo DIMACS completo
     */
    public String toDimacs() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, Integer> entry : variableMapping.entrySet()) {
            sb.append("c ").append(entry.getValue()).append(' ').append(entry.getKey()).append('\n');
        }
        sb.append("p cnf ").append(variableCount).append(' ').append(clauses.size()).append('\n');
        for (List<Integer> clause : clauses) {
            for (Integer literal : clause) {
                sb.append(literal).append(' ');
            }
            sb.append("0\n");
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return String.format("CNFFormula{clausole=%d, variabili=%d, con_nome=%d}",
                clauses.size(), variableCount, variableMapping.size());
    }

    //endregion
}
