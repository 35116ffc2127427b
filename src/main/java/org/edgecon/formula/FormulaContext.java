package org.edgecon.formula;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * CONTESTO FORMULE - Implementazione di riferimento di {@link FormulaFactory}
 *
 * Mantiene la tabella dei simboli delle variabili dichiarate: ogni nome è
 * associato a un unico nodo {@link Formula}, creato alla prima richiesta e
 * riutilizzato in seguito. L'ordine di dichiarazione è preservato.
 *
 * Un contesto non è thread-safe: ogni riduzione usa il proprio.
 */
public class FormulaContext implements FormulaFactory {

    private static final Logger LOGGER = Logger.getLogger(FormulaContext.class.getName());

    /**
     * Tabella dei simboli: nome → nodo variabile.
     * Invariante: un solo nodo per nome.
     */
    private final Map<String, Formula> variables = new LinkedHashMap<>();

    //region DICHIARAZIONE VARIABILI

    @Override
    public Formula declareBoolVariable(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Nome variabile non può essere null o vuoto");
        }

        return variables.computeIfAbsent(name, n -> {
            LOGGER.finest("Nuova variabile dichiarata: " + n);
            return Formula.variable(n);
        });
    }

    /**
     * @return true se la variabile è già stata dichiarata in questo contesto
     */
    public boolean isDeclared(String name) {
        return variables.containsKey(name);
    }

    public int getVariableCount() {
        return variables.size();
    }

    //endregion

    //region CONNETTIVI

    @Override
    public Formula not(Formula operand) {
        if (operand == null) {
            throw new IllegalArgumentException("Operando per negazione non può essere null");
        }
        return Formula.negation(operand);
    }

    @Override
    public Formula and(List<Formula> operands) {
        validateOperands(operands, "AND");
        return operands.size() == 1 ? operands.get(0) : Formula.nary(Formula.Type.AND, operands);
    }

    @Override
    public Formula or(List<Formula> operands) {
        validateOperands(operands, "OR");
        return operands.size() == 1 ? operands.get(0) : Formula.nary(Formula.Type.OR, operands);
    }

    @Override
    public Formula mkTrue() {
        return Formula.TRUE;
    }

    @Override
    public Formula mkFalse() {
        return Formula.FALSE;
    }

    private static void validateOperands(List<Formula> operands, String connective) {
        if (operands == null || operands.isEmpty()) {
            throw new IllegalArgumentException("Lista operandi " + connective + " non può essere null o vuota");
        }
        for (Formula operand : operands) {
            if (operand == null) {
                throw new IllegalArgumentException("Lista operandi " + connective + " non può contenere elementi null");
            }
        }
    }

    //endregion

    @Override
    public String toString() {
        return String.format("FormulaContext[variabili=%d]", variables.size());
    }
}
