package org.edgecon;

import org.edgecon.cdcl.SATStatistics;
import org.edgecon.graph.Edge;
import org.edgecon.support.CNFFormula;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * RISULTATO EDGECON - Esito della pipeline riduzione → risoluzione → decodifica
 *
 * SAT: esiste un posizionamento di al più N traduttori che rende la
 * gerarchia più profonda di k; posizionamento e profondità sono disponibili.
 * UNSAT: nessun posizionamento di questo tipo. TIMEOUT: ricerca interrotta.
 */
public class EdgeConResult {

    public enum Status {
        SAT, UNSAT, TIMEOUT
    }

    private final Status status;
    private final int costBound;
    private final int componentCount;
    private final CNFFormula cnf;
    private final Map<Edge, Integer> placement;
    private final int hierarchyDepth;
    private final SATStatistics statistics;
    private final long reductionTimeMs;

    EdgeConResult(Status status, int costBound, int componentCount, CNFFormula cnf,
                  Map<Edge, Integer> placement, int hierarchyDepth,
                  SATStatistics statistics, long reductionTimeMs) {
        this.status = status;
        this.costBound = costBound;
        this.componentCount = componentCount;
        this.cnf = cnf;
        this.placement = placement != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(placement))
                : Collections.emptyMap();
        this.hierarchyDepth = hierarchyDepth;
        this.statistics = statistics;
        this.reductionTimeMs = reductionTimeMs;
    }

    //region INTERFACCIA PUBBLICA

    public Status getStatus() {
        return status;
    }

    public boolean isSatisfiable() {
        return status == Status.SAT;
    }

    public int getCostBound() {
        return costBound;
    }

    public int getComponentCount() {
        return componentCount;
    }

    /**
     * @return codifica CNF della riduzione (sempre disponibile, anche in caso di timeout)
     */
    public CNFFormula getCnf() {
        return cnf;
    }

    /**
     * @return arco → indice di traduttore (vuoto se non SAT)
     */
    public Map<Edge, Integer> getPlacement() {
        return placement;
    }

    /**
     * @return profondità della gerarchia decodificata, -1 se non SAT
     */
    public int getHierarchyDepth() {
        return hierarchyDepth;
    }

    /**
     * @return statistiche CDCL, null in caso di timeout
     */
    public SATStatistics getStatistics() {
        return statistics;
    }

    public long getReductionTimeMs() {
        return reductionTimeMs;
    }

    /**
     * @return report testuale multi-riga per console e file di risultato
     */
    public String toReport() {
        StringBuilder report = new StringBuilder();
        report.append("RISULTATO: ").append(status).append('\n');
        report.append("Bound di costo k: ").append(costBound).append('\n');
        report.append("Componenti omogenee: ").append(componentCount).append('\n');
        report.append("Variabili CNF: ").append(cnf.getVariableCount())
                .append(" (con nome: ").append(cnf.getVariableMapping().size()).append(")\n");
        report.append("Clausole CNF: ").append(cnf.getClausesCount()).append('\n');
        report.append("Tempo di riduzione: ").append(reductionTimeMs).append(" ms\n");

        switch (status) {
            case SAT -> {
                report.append("\nTraduttori posizionati (").append(placement.size()).append("):\n");
                placement.forEach((edge, index) ->
                        report.append("  ").append(edge).append(" -> traduttore ").append(index).append('\n'));
                report.append("Profondità gerarchia: ").append(hierarchyDepth).append('\n');
            }
            case UNSAT -> report.append("\nNessun posizionamento rende la gerarchia più profonda di k\n");
            case TIMEOUT -> report.append("\nRicerca interrotta per timeout\n");
        }

        if (statistics != null) {
            report.append('\n').append(statistics.toReport());
        }
        return report.toString();
    }

    @Override
    public String toString() {
        return "EdgeConResult[" + status + ", k=" + costBound + ", traduttori=" + placement.size() + "]";
    }

    //endregion
}
