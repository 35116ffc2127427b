package org.edgecon.cdcl;

/**
 * STATISTICHE SAT - Metriche di esecuzione dell'algoritmo CDCL
 *
 * Contatori di decisioni, propagazioni, conflitti, clausole apprese e
 * backjump, più il tempo di esecuzione del solo ciclo CDCL.
 */
public class SATStatistics {

    //region CONTATORI METRICHE CORE

    private int decisions = 0;
    private int propagations = 0;
    private int conflicts = 0;
    private int learnedClauses = 0;
    private int backjumps = 0;

    //endregion

    //region TIMING

    private long executionTimeMs = 0;
    private long startTime = 0;
    private boolean timerStopped = true;

    /**
     * Avvia la misurazione del ciclo CDCL.
     */
    public void startTimer() {
        this.startTime = System.currentTimeMillis();
        this.timerStopped = false;
    }

    /**
     * Ferma la misurazione; chiamate successive non hanno effetto.
     */
    public void stopTimer() {
        if (!timerStopped) {
            executionTimeMs = System.currentTimeMillis() - startTime;
            timerStopped = true;
        }
    }

    //endregion

    //region OPERAZIONI DI INCREMENTO CONTATORI

    public void incrementDecisions() {
        decisions++;
    }

    public void incrementPropagations() {
        propagations++;
    }

    public void incrementConflicts() {
        conflicts++;
    }

    public void incrementLearnedClauses() {
        learnedClauses++;
    }

    public void incrementBackjumps() {
        backjumps++;
    }

    //endregion

    //region INTERFACCIA PUBBLICA

    public int getDecisions() {
        return decisions;
    }

    public int getPropagations() {
        return propagations;
    }

    public int getConflicts() {
        return conflicts;
    }

    public int getLearnedClauses() {
        return learnedClauses;
    }

    public int getBackjumps() {
        return backjumps;
    }

    public long getExecutionTimeMs() {
        return executionTimeMs;
    }

    /**
     * @return report testuale multi-riga per output utente
     */
    public String toReport() {
        return "Decisioni: " + decisions + "\n"
                + "Propagazioni: " + propagations + "\n"
                + "Conflitti: " + conflicts + "\n"
                + "Clausole apprese: " + learnedClauses + "\n"
                + "Backjump: " + backjumps + "\n"
                + "Tempo CDCL: " + executionTimeMs + " ms\n";
    }

    @Override
    public String toString() {
        return String.format("SATStatistics[decisioni=%d, propagazioni=%d, conflitti=%d, apprese=%d, backjump=%d, tempo=%dms]",
                decisions, propagations, conflicts, learnedClauses, backjumps, executionTimeMs);
    }

    //endregion
}
