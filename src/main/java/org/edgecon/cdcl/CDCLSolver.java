package org.edgecon.cdcl;

import org.edgecon.support.AssignedLiteral;
import org.edgecon.support.CNFFormula;
import org.edgecon.support.DecisionStack;

import java.util.*;
import java.util.logging.Logger;

/**
 * SOLUTORE CDCL - Conflict-Driven Clause Learning
 *
 * Ciclo in 3 fasi:
 * 1. Propagazione unitaria: propaga le conseguenze obbligate
 * 2. Analisi dei conflitti: clausola appresa al primo UIP + backjump non-cronologico
 * 3. Decisione: letterale non assegnato con contatore VSIDS più alto
 *
 * Le formule non in CNF sono codificate con {@link org.edgecon.cnf.TseitinEncoder}; il
 * modello restituito contiene solo le variabili con nome. Un'istanza non è
 * thread-safe: ogni chiamata a solve() reinizializza lo stato di ricerca.
 */
public class CDCLSolver implements SatSolver {

    private static final Logger LOGGER = Logger.getLogger(CDCLSolver.class.getName());

    /** Numero di conflitti dopo cui i contatori VSIDS vengono dimezzati */
    private static final int VSIDS_DECAY_INTERVAL = 256;

    //region STRUTTURE DATI CORE - ALGORITMO CDCL

    /** Clausole originali seguite da quelle apprese */
    private List<List<Integer>> clauses;

    /** Indici delle clausole che contengono ciascun letterale (indicizzato con literalIndex) */
    private List<List<Integer>> occurrences;

    /** Valore per variabile: 0 non assegnata, 1 vera, -1 falsa */
    private int[] values;

    /** Livello di decisione di ogni variabile assegnata */
    private int[] levels;

    /** Contatori VSIDS per letterale */
    private double[] vsidsCounter;

    private DecisionStack decisionStack;

    /** Letterali resi veri e non ancora propagati */
    private Deque<Integer> propagationQueue;

    private int variableCount;

    private SATStatistics statistics;

    //endregion

    //region INTERFACCIA PUBBLICA

    @Override
    public SATResult solve(CNFFormula formula) throws InterruptedException {
        if (formula == null) {
            throw new IllegalArgumentException("Formula CNF non può essere null");
        }

        initialize(formula);
        statistics.startTimer();
        try {
            boolean satisfiable = executeCDCLMainAlgorithm();
            statistics.stopTimer();

            LOGGER.info("Risoluzione CDCL completata: " + (satisfiable ? "SAT" : "UNSAT") + " - " + statistics);
            return satisfiable
                    ? SATResult.satisfiable(extractModel(formula), statistics)
                    : SATResult.unsatisfiable(statistics);
        } finally {
            statistics.stopTimer();
        }
    }

    //endregion

    //region INIZIALIZZAZIONE

    private void initialize(CNFFormula formula) {
        this.variableCount = formula.getVariableCount();
        this.clauses = new ArrayList<>(formula.getClauses());
        this.values = new int[variableCount + 1];
        this.levels = new int[variableCount + 1];
        this.vsidsCounter = new double[2 * (variableCount + 1)];
        this.decisionStack = new DecisionStack();
        this.propagationQueue = new ArrayDeque<>();
        this.statistics = new SATStatistics();

        this.occurrences = new ArrayList<>(2 * (variableCount + 1));
        for (int i = 0; i < 2 * (variableCount + 1); i++) {
            occurrences.add(new ArrayList<>());
        }
        for (int index = 0; index < clauses.size(); index++) {
            registerClause(index);
        }

        LOGGER.fine(String.format("Solutore CDCL inizializzato: %d clausole, %d variabili",
                clauses.size(), variableCount));
    }

    private void registerClause(int index) {
        for (int literal : clauses.get(index)) {
            occurrences.get(literalIndex(literal)).add(index);
            vsidsCounter[literalIndex(literal)] += 1;
        }
    }

    private static int literalIndex(int literal) {
        return literal > 0 ? 2 * literal : 2 * (-literal) + 1;
    }

    //endregion

    //region ALGORITMO CDCL PRINCIPALE

    private boolean executeCDCLMainAlgorithm() throws InterruptedException {
        if (!initializeLevel0WithUnitClauses()) {
            LOGGER.fine("UNSAT immediato al livello 0");
            return false;
        }

        while (true) {
            if (Thread.interrupted()) {
                throw new InterruptedException("Risoluzione CDCL interrotta");
            }

            int conflict = executeUnitPropagation();
            if (conflict >= 0) {
                statistics.incrementConflicts();
                if (decisionStack.getCurrentLevel() == 0) {
                    return false;
                }
                learnAndBackjump(conflict);
                continue;
            }

            int literal = chooseDecisionLiteral();
            if (literal == 0) {
                return true; // Tutte le variabili assegnate senza conflitti
            }
            statistics.incrementDecisions();
            assign(decisionStack.addDecision(Math.abs(literal), literal > 0));
        }
    }

    /**
     * Assegna al livello 0 i letterali delle clausole unitarie.
     *
     * @return false se la formula è banalmente UNSAT (clausola vuota o unitarie contraddittorie)
     */
    private boolean initializeLevel0WithUnitClauses() {
        for (List<Integer> clause : clauses) {
            if (clause.isEmpty()) {
                return false;
            }
            if (clause.size() == 1) {
                int literal = clause.get(0);
                int current = literalValue(literal);
                if (current < 0) {
                    return false;
                }
                if (current == 0) {
                    assign(decisionStack.addImpliedLiteral(Math.abs(literal), literal > 0, clause));
                }
            }
        }
        return true;
    }

    //endregion

    //region PROPAGAZIONE UNITARIA

    /**
     * Propaga tutti i letterali in coda.
     *
     * @return indice della clausola in conflitto, -1 se nessun conflitto
     */
    private int executeUnitPropagation() {
        while (!propagationQueue.isEmpty()) {
            int trueLiteral = propagationQueue.poll();

            for (int clauseIndex : occurrences.get(literalIndex(-trueLiteral))) {
                List<Integer> clause = clauses.get(clauseIndex);

                boolean satisfied = false;
                int unassigned = 0;
                int lastUnassigned = 0;
                for (int literal : clause) {
                    int value = literalValue(literal);
                    if (value > 0) {
                        satisfied = true;
                        break;
                    }
                    if (value == 0) {
                        unassigned++;
                        lastUnassigned = literal;
                    }
                }

                if (satisfied) {
                    continue;
                }
                if (unassigned == 0) {
                    propagationQueue.clear();
                    return clauseIndex;
                }
                if (unassigned == 1) {
                    statistics.incrementPropagations();
                    assign(decisionStack.addImpliedLiteral(Math.abs(lastUnassigned), lastUnassigned > 0, clause));
                }
            }
        }
        return -1;
    }

    private void assign(AssignedLiteral assignment) {
        int variable = assignment.getVariable();
        values[variable] = assignment.getValue() ? 1 : -1;
        levels[variable] = decisionStack.getCurrentLevel();
        propagationQueue.add(assignment.toLiteral());
    }

    private int literalValue(int literal) {
        int value = values[Math.abs(literal)];
        return literal > 0 ? value : -value;
    }

    //endregion

    //region ANALISI DEI CONFLITTI E APPRENDIMENTO

    /**
     * Analisi al primo UIP: risolve la clausola in conflitto con le clausole
     * ancestrali dei letterali del livello corrente, a ritroso, finché ne
     * resta uno solo.
     */
    private void learnAndBackjump(int conflictIndex) {
        int currentLevel = decisionStack.getCurrentLevel();
        List<AssignedLiteral> levelTrail = decisionStack.getLevel(currentLevel);
        boolean[] seen = new boolean[variableCount + 1];

        List<Integer> learned = new ArrayList<>();
        learned.add(0); // Posto riservato al letterale UIP

        int pending = 0;
        int uipLiteral = 0;
        int trailIndex = levelTrail.size() - 1;
        List<Integer> clause = clauses.get(conflictIndex);

        while (true) {
            for (int literal : clause) {
                int variable = Math.abs(literal);
                if (uipLiteral != 0 && variable == Math.abs(uipLiteral)) {
                    continue;
                }
                if (!seen[variable] && levels[variable] > 0) {
                    seen[variable] = true;
                    if (levels[variable] == currentLevel) {
                        pending++;
                    } else {
                        learned.add(literal);
                    }
                }
            }

            AssignedLiteral next;
            do {
                next = levelTrail.get(trailIndex--);
            } while (!seen[next.getVariable()]);

            uipLiteral = next.toLiteral();
            seen[next.getVariable()] = false;
            pending--;

            if (pending == 0) {
                break;
            }
            clause = next.getAncestorClause();
        }

        learned.set(0, -uipLiteral);

        int backjumpLevel = 0;
        for (int i = 1; i < learned.size(); i++) {
            backjumpLevel = Math.max(backjumpLevel, levels[Math.abs(learned.get(i))]);
        }

        bumpVsids(learned);
        backjump(backjumpLevel);

        clauses.add(Collections.unmodifiableList(learned));
        registerClause(clauses.size() - 1);
        statistics.incrementLearnedClauses();

        int asserting = learned.get(0);
        assign(decisionStack.addImpliedLiteral(Math.abs(asserting), asserting > 0, clauses.get(clauses.size() - 1)));

        final int targetLevel = backjumpLevel;
        LOGGER.finest(() -> "Clausola appresa " + learned + ", backjump al livello " + targetLevel);
    }

    private void backjump(int targetLevel) {
        for (AssignedLiteral removed : decisionStack.backjumpToLevel(targetLevel)) {
            int variable = removed.getVariable();
            values[variable] = 0;
            levels[variable] = 0;
        }
        propagationQueue.clear();
        statistics.incrementBackjumps();
    }

    private void bumpVsids(List<Integer> learned) {
        for (int literal : learned) {
            vsidsCounter[literalIndex(literal)] += 1;
        }
        if (statistics.getConflicts() % VSIDS_DECAY_INTERVAL == 0) {
            for (int i = 0; i < vsidsCounter.length; i++) {
                vsidsCounter[i] /= 2;
            }
        }
    }

    //endregion

    //region DECISIONE EURISTICA

    /**
     * @return letterale non assegnato con contatore VSIDS più alto, 0 se tutte le variabili sono assegnate
     */
    private int chooseDecisionLiteral() {
        int best = 0;
        double bestScore = -1;
        for (int variable = 1; variable <= variableCount; variable++) {
            if (values[variable] != 0) {
                continue;
            }
            // A parità di punteggio si preferisce la polarità negativa
            double negative = vsidsCounter[literalIndex(-variable)];
            double positive = vsidsCounter[literalIndex(variable)];
            if (negative > bestScore) {
                bestScore = negative;
                best = -variable;
            }
            if (positive > bestScore) {
                bestScore = positive;
                best = variable;
            }
        }
        return best;
    }

    //endregion

    //region COSTRUZIONE MODELLO

    private Map<String, Boolean> extractModel(CNFFormula formula) {
        Map<String, Boolean> model = new LinkedHashMap<>();
        for (Map.Entry<String, Integer> entry : formula.getVariableMapping().entrySet()) {
            model.put(entry.getKey(), values[entry.getValue()] > 0);
        }
        return model;
    }

    /**
     * @return statistiche dell'ultima risoluzione (null se solve() non è mai stato chiamato)
     */
    public SATStatistics getStatistics() {
        return statistics;
    }

    //endregion
}
