package org.edgecon.support;

import java.util.*;
import java.util.logging.Logger;

/**
 * DECISION STACK - Stack gerarchico dei livelli di decisione per l'algoritmo CDCL
 *
 * ORGANIZZAZIONE GERARCHICA:
 * • Livello 0: implicazioni da clausole unitarie (sempre presente, mai rimosso)
 * • Livello i (i>0): decisione i seguita dalle implicazioni che ha generato
 * • All'interno di ogni livello gli assegnamenti sono in ordine cronologico
 *
 * L'ordine cronologico è quello che l'analisi dei conflitti percorre a ritroso
 * per individuare il primo punto di implicazione unico.
 */
public class DecisionStack {

    private static final Logger LOGGER = Logger.getLogger(DecisionStack.class.getName());

    /**
     * Stack dei livelli. Invariante: size() >= 1, l'indice 0 è il livello 0.
     */
    private final Stack<ArrayList<AssignedLiteral>> levelStack;

    public DecisionStack() {
        this.levelStack = new Stack<>();
        this.levelStack.push(new ArrayList<>());
    }

    //region OPERAZIONI DI AGGIUNTA

    /**
     * Aggiunge una decisione euristica aprendo un nuovo livello.
     *
     * @return l'assegnamento creato
     */
    public AssignedLiteral addDecision(int variable, boolean value) {
        AssignedLiteral decision = new AssignedLiteral(variable, value, true, null);

        ArrayList<AssignedLiteral> newDecisionLevel = new ArrayList<>();
        newDecisionLevel.add(decision);
        levelStack.push(newDecisionLevel);

        LOGGER.finest(() -> String.format("Decisione: var=%d, val=%s, livello=%d",
                variable, value, levelStack.size() - 1));
        return decision;
    }

    /**
     * Aggiunge un'implicazione al livello corrente.
     *
     * @return l'assegnamento creato
     */
    public AssignedLiteral addImpliedLiteral(int variable, boolean value, List<Integer> ancestorClause) {
        AssignedLiteral implication = new AssignedLiteral(variable, value, false, ancestorClause);
        levelStack.peek().add(implication);
        return implication;
    }

    //endregion

    //region BACKTRACKING

    /**
     * Backjump non-cronologico: rimuove tutti i livelli sopra targetLevel.
     *
     * @param targetLevel livello da mantenere (0 ≤ targetLevel ≤ livello corrente)
     * @return assegnamenti rimossi, dal livello più alto al più basso
     * @throws IllegalArgumentException se targetLevel fuori range
     */
    public List<AssignedLiteral> backjumpToLevel(int targetLevel) {
        if (targetLevel < 0 || targetLevel > getCurrentLevel()) {
            throw new IllegalArgumentException("Livello di backjump non valido: " + targetLevel +
                    " (corrente: " + getCurrentLevel() + ")");
        }

        List<AssignedLiteral> removed = new ArrayList<>();
        while (getCurrentLevel() > targetLevel) {
            removed.addAll(levelStack.pop());
        }

        LOGGER.finest(() -> String.format("Backjump al livello %d: %d assegnamenti rimossi",
                targetLevel, removed.size()));
        return removed;
    }

    //endregion

    //region INTERROGAZIONE

    public int getCurrentLevel() {
        return levelStack.size() - 1;
    }

    /**
     * @return assegnamenti del livello indicato in ordine cronologico (vista non modificabile)
     */
    public List<AssignedLiteral> getLevel(int level) {
        if (level < 0 || level > getCurrentLevel()) {
            throw new IllegalArgumentException("Livello inesistente: " + level);
        }
        return Collections.unmodifiableList(levelStack.get(level));
    }

    public int size() {
        int total = 0;
        for (ArrayList<AssignedLiteral> level : levelStack) {
            total += level.size();
        }
        return total;
    }

    @Override
    public String toString() {
        return "DecisionStack" + levelStack;
    }

    //endregion
}
