package org.edgecon.formula;

/**
 * Modello di sola lettura prodotto da un solutore: associa a ogni variabile
 * un valore di verità. Le variabili mai viste dal solutore valgono false.
 */
@FunctionalInterface
public interface Model {

    /**
     * @param variableName nome della variabile
     * @return valore assegnato (false se la variabile non compare nel modello)
     */
    boolean valueOf(String variableName);

    /**
     * @param variable nodo variabile dichiarato tramite {@link FormulaFactory}
     * @return valore assegnato alla variabile
     * @throws IllegalArgumentException se il nodo non è una variabile
     */
    default boolean valueOf(Formula variable) {
        if (variable == null || !variable.isVariable()) {
            throw new IllegalArgumentException("Il modello si interroga solo su variabili: " + variable);
        }
        return valueOf(variable.getName());
    }
}
