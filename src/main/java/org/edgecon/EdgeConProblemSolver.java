package org.edgecon;

import org.edgecon.cdcl.CDCLSolver;
import org.edgecon.cdcl.SATResult;
import org.edgecon.cdcl.SatSolver;
import org.edgecon.cnf.TseitinEncoder;
import org.edgecon.formula.Formula;
import org.edgecon.formula.FormulaContext;
import org.edgecon.graph.Edge;
import org.edgecon.graph.EdgeConGraph;
import org.edgecon.reduction.EdgeConReduction;
import org.edgecon.reduction.ReductionException;
import org.edgecon.reduction.TranslatorDecoder;
import org.edgecon.support.CNFFormula;

import java.util.Map;
import java.util.concurrent.*;
import java.util.logging.Logger;

/**
 * PIPELINE EDGECON - Riduzione, risoluzione con timeout, decodifica
 *
 * Le fasi sono strettamente sequenziali: il modello è valido solo per la
 * formula da cui è stato prodotto, quindi la decodifica avviene dopo il
 * ritorno del solutore. La risoluzione gira su un executor a thread singolo
 * solo per poter imporre il timeout.
 */
public class EdgeConProblemSolver {

    private static final Logger LOGGER = Logger.getLogger(EdgeConProblemSolver.class.getName());

    public static final int DEFAULT_TIMEOUT_SECONDS = 10;

    /** Attesa massima della terminazione del solutore dopo l'interruzione */
    private static final int SHUTDOWN_GRACE_SECONDS = 5;

    private final SatSolver solver;
    private final int timeoutSeconds;

    public EdgeConProblemSolver() {
        this(new CDCLSolver(), DEFAULT_TIMEOUT_SECONDS);
    }

    /**
     * @param solver motore di soddisfacibilità
     * @param timeoutSeconds tempo massimo di risoluzione (≥ 1)
     */
    public EdgeConProblemSolver(SatSolver solver, int timeoutSeconds) {
        if (solver == null) {
            throw new IllegalArgumentException("Solutore non può essere null");
        }
        if (timeoutSeconds < 1) {
            throw new IllegalArgumentException("Timeout deve essere almeno 1 secondo: " + timeoutSeconds);
        }
        this.solver = solver;
        this.timeoutSeconds = timeoutSeconds;
    }

    /**
     * Esegue la pipeline completa. In caso SAT il grafo riceve i traduttori
     * decodificati e la gerarchia ricalcolata.
     *
     * @throws ReductionException se il grafo o k violano le precondizioni della riduzione
     * @throws InterruptedException se il thread chiamante viene interrotto durante l'attesa
     */
    public EdgeConResult solve(EdgeConGraph graph, int k) throws ReductionException, InterruptedException {
        long start = System.currentTimeMillis();
        FormulaContext context = new FormulaContext();
        Formula reduction = EdgeConReduction.buildReduction(context, graph, k);
        CNFFormula cnf = TseitinEncoder.encode(reduction);
        long reductionTimeMs = System.currentTimeMillis() - start;

        LOGGER.info(String.format("Riduzione pronta in %d ms: %d variabili dichiarate, %d clausole CNF",
                reductionTimeMs, context.getVariableCount(), cnf.getClausesCount()));

        SATResult satResult = solveWithTimeout(cnf);
        int components = graph.numComponents();

        if (satResult == null) {
            return new EdgeConResult(EdgeConResult.Status.TIMEOUT, k, components, cnf, null, -1, null, reductionTimeMs);
        }
        if (!satResult.isSatisfiable()) {
            return new EdgeConResult(EdgeConResult.Status.UNSAT, k, components, cnf, null, -1,
                    satResult.getStatistics(), reductionTimeMs);
        }

        Map<Edge, Integer> placement = TranslatorDecoder.decodeModel(satResult.getModel(), graph);
        return new EdgeConResult(EdgeConResult.Status.SAT, k, components, cnf, placement,
                graph.hierarchyDepth(), satResult.getStatistics(), reductionTimeMs);
    }

    /**
     * Risolve la stessa CNF esportata nel risultato.
     *
     * @return risultato del solutore, null se scade il timeout
     */
    private SATResult solveWithTimeout(CNFFormula cnf) throws InterruptedException {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<SATResult> future = executor.submit(() -> solver.solve(cnf));
            return future.get(timeoutSeconds, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            LOGGER.warning("Timeout raggiunto dopo " + timeoutSeconds + " secondi");
            executor.shutdownNow();
            // Il risultato TIMEOUT viene restituito solo a ricerca terminata
            if (!executor.awaitTermination(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
                LOGGER.warning("Il solutore non ha risposto all'interruzione entro "
                        + SHUTDOWN_GRACE_SECONDS + " secondi");
            }
            return null;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException("Errore nella risoluzione SAT", cause);
        } finally {
            executor.shutdownNow();
        }
    }
}
