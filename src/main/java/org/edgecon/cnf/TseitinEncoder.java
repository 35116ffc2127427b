package org.edgecon.cnf;

import org.edgecon.formula.Formula;
import org.edgecon.support.CNFFormula;

import java.util.*;
import java.util.logging.Logger;

/**
 * CODIFICA DI TSEITIN - Da albero {@link Formula} a {@link CNFFormula} equisoddisfacibile
 *
 * La congiunzione di primo livello viene appiattita: ogni congiunto che ha già
 * forma di clausola (letterale o disgiunzione di letterali) è emesso
 * direttamente, senza variabili ausiliarie. Le sottostrutture annidate
 * ricevono una variabile ausiliaria t e le clausole di equivalenza
 * t ↔ sottostruttura.
 *
 * CLAUSOLE DI EQUIVALENZA:
 * - t ↔ (a1 ∧ ... ∧ an): (¬t ∨ ai) per ogni i, (t ∨ ¬a1 ∨ ... ∨ ¬an)
 * - t ↔ (a1 ∨ ... ∨ an): (¬t ∨ a1 ∨ ... ∨ an), (t ∨ ¬ai) per ogni i
 * - ¬ non introduce variabili: il letterale viene negato
 *
 * COSTANTI:
 * - TRUE come congiunto viene ignorato, FALSE produce la clausola vuota
 * - dentro una clausola TRUE la soddisfa (clausola scartata), FALSE viene rimosso
 * - annidate, le costanti usano una variabile dedicata forzata a vero
 *
 * Ogni nodo condiviso (stesso oggetto) è codificato una sola volta.
 */
public class TseitinEncoder {

    private static final Logger LOGGER = Logger.getLogger(TseitinEncoder.class.getName());

    //region STATO CODIFICA

    /** Mapping nome variabile → ID numerico */
    private final Map<String, Integer> variableMapping = new LinkedHashMap<>();

    /** Letterale già assegnato a ogni sottostruttura codificata */
    private final Map<Formula, Integer> encodedSubformulas = new IdentityHashMap<>();

    private final List<List<Integer>> clauses = new ArrayList<>();

    /** Prossimo ID libero (con nome o ausiliario) */
    private int nextId = 1;

    /** ID della variabile forzata a vero, 0 se non ancora creata */
    private int trueVariable = 0;

    private int auxiliaryCount = 0;

    //endregion

    //region INTERFACCIA PUBBLICA

    /**
     * Codifica una formula in CNF.
     *
     * @param formula formula da codificare (non null)
     * @return formula CNF equisoddisfacibile; le variabili con nome mantengono il proprio valore
     */
    public static CNFFormula encode(Formula formula) {
        if (formula == null) {
            throw new IllegalArgumentException("Formula da codificare non può essere null");
        }
        return new TseitinEncoder().run(formula);
    }

    //endregion

    //region CODIFICA DI PRIMO LIVELLO

    private CNFFormula run(Formula root) {
        List<Formula> conjuncts = new ArrayList<>();
        flattenConjunction(root, conjuncts);

        for (Formula conjunct : conjuncts) {
            encodeConjunct(conjunct);
        }

        LOGGER.fine(String.format("Codifica Tseitin: %d congiunti, %d clausole, %d variabili ausiliarie",
                conjuncts.size(), clauses.size(), auxiliaryCount));

        return new CNFFormula(clauses, variableMapping, nextId - 1);
    }

    private static void flattenConjunction(Formula formula, List<Formula> out) {
        Deque<Formula> stack = new ArrayDeque<>();
        stack.push(formula);
        while (!stack.isEmpty()) {
            Formula current = stack.pop();
            if (current.getType() == Formula.Type.AND) {
                List<Formula> operands = current.getOperands();
                // Ordine originale preservato sullo stack
                for (int i = operands.size() - 1; i >= 0; i--) {
                    stack.push(operands.get(i));
                }
            } else {
                out.add(current);
            }
        }
    }

    private void encodeConjunct(Formula conjunct) {
        switch (conjunct.getType()) {
            case TRUE -> {
                // Nessun vincolo
            }
            case FALSE -> clauses.add(new ArrayList<>());
            case OR -> encodeClause(conjunct.getOperands());
            default -> addClause(List.of(literalOf(conjunct)));
        }
    }

    /**
     * Emette una disgiunzione come clausola: i letterali entrano direttamente,
     * le sottostrutture tramite la loro variabile ausiliaria.
     */
    private void encodeClause(List<Formula> disjuncts) {
        List<Integer> literals = new ArrayList<>();
        for (Formula disjunct : disjuncts) {
            if (disjunct.getType() == Formula.Type.TRUE) {
                return; // Clausola soddisfatta
            }
            if (disjunct.getType() == Formula.Type.FALSE) {
                continue;
            }
            if (disjunct.getType() == Formula.Type.OR) {
                // Disgiunzioni annidate: appiattite nella stessa clausola
                for (Formula inner : disjunct.getOperands()) {
                    if (inner.getType() == Formula.Type.TRUE) {
                        return;
                    }
                    if (inner.getType() != Formula.Type.FALSE) {
                        literals.add(literalOf(inner));
                    }
                }
                continue;
            }
            literals.add(literalOf(disjunct));
        }
        addClause(literals);
    }

    //endregion

    //region CODIFICA SOTTOSTRUTTURE

    /**
     * Restituisce il letterale che rappresenta la sottoformula, generando le
     * clausole di equivalenza alla prima visita.
     */
    private int literalOf(Formula formula) {
        switch (formula.getType()) {
            case VAR:
                return variableId(formula.getName());
            case NOT:
                return -literalOf(formula.getOperand());
            case TRUE:
                return trueLiteral();
            case FALSE:
                return -trueLiteral();
            default:
                break;
        }

        Integer cached = encodedSubformulas.get(formula);
        if (cached != null) {
            return cached;
        }

        List<Integer> operandLiterals = new ArrayList<>();
        for (Formula operand : formula.getOperands()) {
            operandLiterals.add(literalOf(operand));
        }

        int t = nextId++;
        auxiliaryCount++;

        if (formula.getType() == Formula.Type.AND) {
            // t → ai
            for (int literal : operandLiterals) {
                addClause(List.of(-t, literal));
            }
            // (a1 ∧ ... ∧ an) → t
            List<Integer> back = new ArrayList<>();
            for (int literal : operandLiterals) {
                back.add(-literal);
            }
            back.add(t);
            addClause(back);
        } else {
            // t → (a1 ∨ ... ∨ an)
            List<Integer> forward = new ArrayList<>();
            forward.add(-t);
            forward.addAll(operandLiterals);
            addClause(forward);
            // ai → t
            for (int literal : operandLiterals) {
                addClause(List.of(-literal, t));
            }
        }

        encodedSubformulas.put(formula, t);
        return t;
    }

    private int variableId(String name) {
        return variableMapping.computeIfAbsent(name, n -> nextId++);
    }

    private int trueLiteral() {
        if (trueVariable == 0) {
            trueVariable = nextId++;
            auxiliaryCount++;
            clauses.add(new ArrayList<>(List.of(trueVariable)));
        }
        return trueVariable;
    }

    /**
     * Aggiunge una clausola eliminando letterali duplicati; le tautologie
     * (x ∨ ¬x) vengono scartate.
     */
    private void addClause(List<Integer> literals) {
        LinkedHashSet<Integer> unique = new LinkedHashSet<>(literals);
        for (Integer literal : unique) {
            if (unique.contains(-literal)) {
                return;
            }
        }
        clauses.add(new ArrayList<>(unique));
    }

    //endregion
}
