package org.edgecon.cdcl;

import org.edgecon.formula.Model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * RISULTATO SAT - Contenitore immutabile per esiti di risoluzione booleana
 *
 * COMPONENTI:
 * • Esito: SAT (soddisfacibile) vs UNSAT (insoddisfacibile)
 * • Modello: assegnamento delle variabili con nome (solo per SAT)
 * • Statistiche: metriche dell'esecuzione CDCL
 */
public class SATResult {

    //region ATTRIBUTI CORE

    private final boolean satisfiable;

    /** Assegnamento delle variabili con nome. Non null per SAT, null per UNSAT. */
    private final Map<String, Boolean> assignment;

    private final SATStatistics statistics;

    //endregion

    //region COSTRUZIONE E VALIDAZIONE

    private SATResult(boolean satisfiable, Map<String, Boolean> assignment, SATStatistics statistics) {
        if (satisfiable && assignment == null) {
            throw new IllegalArgumentException("Risultato SAT richiede un assegnamento variabili");
        }
        if (!satisfiable && assignment != null) {
            throw new IllegalArgumentException("Risultato UNSAT non può avere assegnamento variabili");
        }

        this.satisfiable = satisfiable;
        this.assignment = assignment != null ? Collections.unmodifiableMap(new LinkedHashMap<>(assignment)) : null;
        this.statistics = statistics != null ? statistics : new SATStatistics();
    }

    /**
     * @param assignment modello completo delle variabili con nome (non null)
     * @param statistics metriche di esecuzione
     * @return risultato SAT validato
     */
    public static SATResult satisfiable(Map<String, Boolean> assignment, SATStatistics statistics) {
        return new SATResult(true, assignment, statistics);
    }

    /**
     * @param statistics metriche di esecuzione
     * @return risultato UNSAT
     */
    public static SATResult unsatisfiable(SATStatistics statistics) {
        return new SATResult(false, null, statistics);
    }

    //endregion

    //region INTERFACCIA PUBBLICA

    public boolean isSatisfiable() {
        return satisfiable;
    }

    /**
     * @return assegnamento immutabile (null per UNSAT)
     */
    public Map<String, Boolean> getAssignment() {
        return assignment;
    }

    /**
     * @return modello di sola lettura sull'assegnamento
     * @throws IllegalStateException se la formula è insoddisfacibile
     */
    public Model getModel() {
        if (!satisfiable) {
            throw new IllegalStateException("Nessun modello disponibile per una formula UNSAT");
        }
        return name -> assignment.getOrDefault(name, Boolean.FALSE);
    }

    public SATStatistics getStatistics() {
        return statistics;
    }

    @Override
    public String toString() {
        return satisfiable
                ? "SAT (" + assignment.size() + " variabili assegnate)"
                : "UNSAT";
    }

    //endregion
}
