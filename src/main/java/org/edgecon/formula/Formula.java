package org.edgecon.formula;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * FORMULA PROPOSIZIONALE - Albero sintattico immutabile
 *
 * Rappresenta una formula booleana costruita per composizione tramite
 * {@link FormulaFactory}. I nodi sono immutabili: una volta costruita, la
 * formula può essere condivisa liberamente tra più congiunzioni e passata
 * al solutore senza copie.
 *
 * TIPI DI NODO:
 * - VAR: variabile booleana identificata dal nome
 * - NOT: negazione di una sottoformula
 * - AND / OR: congiunzione / disgiunzione n-aria (almeno un operando)
 * - TRUE / FALSE: costanti logiche
 */
public final class Formula {

    //region TIPI E STRUTTURA DATI

    /**
     * Tipi di nodi supportati nella rappresentazione ad albero.
     */
    public enum Type {
        VAR,    // Variabile atomica: x_[(0,1),0]
        NOT,    // Negazione: !A
        AND,    // Congiunzione: A & B & ...
        OR,     // Disgiunzione: A | B | ...
        TRUE,   // Costante vera
        FALSE   // Costante falsa
    }

    static final Formula TRUE = new Formula(Type.TRUE, null, null, List.of());
    static final Formula FALSE = new Formula(Type.FALSE, null, null, List.of());

    /** Tipo del nodo corrente */
    private final Type type;

    /** Nome della variabile (solo per nodi VAR) */
    private final String name;

    /** Operando singolo (solo per nodi NOT) */
    private final Formula operand;

    /** Operandi (solo per nodi AND e OR) */
    private final List<Formula> operands;

    //endregion

    //region COSTRUZIONE

    private Formula(Type type, String name, Formula operand, List<Formula> operands) {
        this.type = type;
        this.name = name;
        this.operand = operand;
        this.operands = operands;
    }

    static Formula variable(String name) {
        return new Formula(Type.VAR, name, null, List.of());
    }

    static Formula negation(Formula operand) {
        return new Formula(Type.NOT, null, Objects.requireNonNull(operand), List.of());
    }

    static Formula nary(Type type, List<Formula> operands) {
        return new Formula(type, null, null, Collections.unmodifiableList(new ArrayList<>(operands)));
    }

    //endregion

    //region INTERROGAZIONE

    public Type getType() {
        return type;
    }

    public boolean isVariable() {
        return type == Type.VAR;
    }

    /**
     * @return nome della variabile
     * @throws IllegalStateException se il nodo non è una variabile
     */
    public String getName() {
        if (type != Type.VAR) {
            throw new IllegalStateException("Nodo " + type + " non è una variabile");
        }
        return name;
    }

    /**
     * @return operando della negazione
     * @throws IllegalStateException se il nodo non è una negazione
     */
    public Formula getOperand() {
        if (type != Type.NOT) {
            throw new IllegalStateException("Nodo " + type + " non è una negazione");
        }
        return operand;
    }

    /**
     * @return operandi immutabili (vuoti per nodi diversi da AND/OR)
     */
    public List<Formula> getOperands() {
        return operands;
    }

    //endregion

    //region VALUTAZIONE

    /**
     * Valuta la formula rispetto a un modello.
     *
     * @param model assegnamento delle variabili
     * @return valore di verità della formula nel modello
     */
    public boolean evaluate(Model model) {
        switch (type) {
            case VAR:
                return model.valueOf(name);
            case NOT:
                return !operand.evaluate(model);
            case AND:
                for (Formula f : operands) {
                    if (!f.evaluate(model)) {
                        return false;
                    }
                }
                return true;
            case OR:
                for (Formula f : operands) {
                    if (f.evaluate(model)) {
                        return true;
                    }
                }
                return false;
            case TRUE:
                return true;
            default:
                return false;
        }
    }

    //endregion

    //region RAPPRESENTAZIONE

    @Override
    public String toString() {
        return switch (type) {
            case VAR -> name;
            case NOT -> "!" + operand;
            case AND -> join(" & ");
            case OR -> join(" | ");
            case TRUE -> "TRUE";
            case FALSE -> "FALSE";
        };
    }

    private String join(String separator) {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < operands.size(); i++) {
            if (i > 0) sb.append(separator);
            sb.append(operands.get(i));
        }
        return sb.append(")").toString();
    }

    //endregion
}
