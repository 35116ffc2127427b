package org.edgecon.formula;

import java.util.List;

/**
 * Fabbrica di variabili e connettivi booleani.
 *
 * È il confine tra chi costruisce le formule (la riduzione) e la libreria che
 * le rappresenta. Le operazioni n-arie richiedono almeno un operando: gli
 * intervalli vuoti vanno risolti dal chiamante con {@link #mkTrue()} o
 * {@link #mkFalse()}, mai delegati alla convenzione della libreria.
 */
public interface FormulaFactory {

    /**
     * Dichiara (o recupera) la variabile booleana con il nome indicato.
     * Chiamate ripetute con lo stesso nome restituiscono lo stesso nodo.
     *
     * @param name nome della variabile (non null, non vuoto)
     * @return nodo variabile
     */
    Formula declareBoolVariable(String name);

    Formula not(Formula operand);

    /**
     * @param operands congiunti (almeno uno)
     * @throws IllegalArgumentException se la lista è vuota o contiene null
     */
    Formula and(List<Formula> operands);

    /**
     * @param operands disgiunti (almeno uno)
     * @throws IllegalArgumentException se la lista è vuota o contiene null
     */
    Formula or(List<Formula> operands);

    Formula mkTrue();

    Formula mkFalse();

    default Formula and(Formula... operands) {
        return and(List.of(operands));
    }

    default Formula or(Formula... operands) {
        return or(List.of(operands));
    }
}
