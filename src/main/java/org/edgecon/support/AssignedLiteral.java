package org.edgecon.support;

import java.util.*;

/**
 * LETTERALE ASSEGNATO - Variabile assegnata durante la ricerca CDCL
 *
 * Memorizza variabile, valore, tipo di assegnamento (decisione o implicazione)
 * e la clausola ancestrale che ha forzato l'implicazione. La clausola
 * ancestrale è usata dall'analisi dei conflitti per risalire la catena delle
 * implicazioni fino al primo punto di implicazione unico.
 *
 * INVARIANTI:
 * - variabile > 0
 * - le decisioni non hanno clausola ancestrale
 * - le implicazioni hanno una clausola ancestrale non vuota che contiene il letterale implicato
 */
public class AssignedLiteral {

    //region ATTRIBUTI CORE

    /** ID numerico della variabile (sempre > 0) */
    private final int variable;

    /** Valore assegnato */
    private final boolean value;

    /** true per decisioni euristiche, false per implicazioni da propagazione */
    private final boolean isDecision;

    /** Clausola che ha causato l'implicazione (null per le decisioni) */
    private final List<Integer> ancestorClause;

    //endregion

    //region COSTRUZIONE CON VALIDAZIONE

    /**
     * @param variable ID numerico variabile (> 0)
     * @param value valore booleano assegnato
     * @param isDecision true se decisione, false se implicazione
     * @param ancestorClause clausola causante (richiesta per implicazioni, null per decisioni)
     * @throws IllegalArgumentException se parametri inconsistenti
     */
    public AssignedLiteral(int variable, boolean value, boolean isDecision, List<Integer> ancestorClause) {
        if (variable <= 0) {
            throw new IllegalArgumentException("Variable ID deve essere > 0, ricevuto: " + variable);
        }
        if (isDecision && ancestorClause != null) {
            throw new IllegalArgumentException("Le decisioni non possono avere clausola ancestrale");
        }
        if (!isDecision) {
            validateAncestorClause(variable, value, ancestorClause);
        }

        this.variable = variable;
        this.value = value;
        this.isDecision = isDecision;
        this.ancestorClause = ancestorClause != null ? Collections.unmodifiableList(ancestorClause) : null;
    }

    private static void validateAncestorClause(int variable, boolean value, List<Integer> ancestorClause) {
        if (ancestorClause == null || ancestorClause.isEmpty()) {
            throw new IllegalArgumentException("Implicazione della variabile " + variable + " senza clausola ancestrale");
        }
        int literal = value ? variable : -variable;
        if (!ancestorClause.contains(literal)) {
            throw new IllegalArgumentException("Clausola ancestrale " + ancestorClause +
                    " non contiene il letterale implicato " + literal);
        }
    }

    //endregion

    //region INTERFACCIA PUBBLICA

    public int getVariable() {
        return variable;
    }

    public boolean getValue() {
        return value;
    }

    public boolean isDecision() {
        return isDecision;
    }

    /**
     * @return letterale DIMACS corrispondente all'assegnamento (+var se vero, -var se falso)
     */
    public int toLiteral() {
        return value ? variable : -variable;
    }

    /**
     * @return clausola ancestrale immutabile, null per le decisioni
     */
    public List<Integer> getAncestorClause() {
        return ancestorClause;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof AssignedLiteral)) return false;
        AssignedLiteral other = (AssignedLiteral) obj;
        return variable == other.variable && value == other.value && isDecision == other.isDecision
                && Objects.equals(ancestorClause, other.ancestorClause);
    }

    @Override
    public int hashCode() {
        return Objects.hash(variable, value, isDecision, ancestorClause);
    }

    @Override
    public String toString() {
        String type = isDecision ? "D" : "I";
        return String.format("%s:%s%d", type, value ? "" : "!", variable);
    }

    //endregion
}
