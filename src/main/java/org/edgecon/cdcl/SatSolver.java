package org.edgecon.cdcl;

import org.edgecon.cnf.TseitinEncoder;
import org.edgecon.formula.Formula;
import org.edgecon.support.CNFFormula;

/**
 * Motore di soddisfacibilità iniettabile. La riduzione non dipende dai
 * dettagli interni del motore: riceve solo l'esito e, se SAT, il modello.
 */
public interface SatSolver {

    /**
     * @param cnf formula già codificata in CNF
     * @return esito con modello delle variabili con nome (SAT) o senza (UNSAT)
     * @throws InterruptedException se il thread viene interrotto durante la ricerca
     */
    SATResult solve(CNFFormula cnf) throws InterruptedException;

    /**
     * Codifica la formula con {@link TseitinEncoder} e la risolve.
     */
    default SATResult solve(Formula formula) throws InterruptedException {
        return solve(TseitinEncoder.encode(formula));
    }
}
