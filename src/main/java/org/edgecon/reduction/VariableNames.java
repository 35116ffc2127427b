package org.edgecon.reduction;

/**
 * SCHEMA DI NOMI DELLE VARIABILI
 *
 * Tre famiglie con prefissi distinti, quindi nessuna collisione tra famiglie:
 * • x_[(a,b),i]  arco (a,b), a < b, con traduttore di indice i
 * • p_[c,g]      la componente c ha come genitore la componente g
 * • l_[c,h]      la componente c si trova al livello h
 *
 * Ogni indice deve stare in 0..{@link #MAX_INDEX}.
 */
public final class VariableNames {

    /** Massimo indice codificabile in un nome di variabile */
    public static final int MAX_INDEX = 999_999;

    private VariableNames() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Nome della variabile X(e,i). L'arco è canonicalizzato: (u,v) e (v,u)
     * producono lo stesso nome.
     *
     * @throws IllegalArgumentException per indici fuori range o u == v
     */
    public static String edgeVariable(int u, int v, int index) {
        checkIndex(u, "vertice");
        checkIndex(v, "vertice");
        checkIndex(index, "indice traduttore");
        if (u == v) {
            throw new IllegalArgumentException("Arco degenere (" + u + "," + v + ")");
        }
        return "x_[(" + Math.min(u, v) + "," + Math.max(u, v) + ")," + index + "]";
    }

    public static String parentVariable(int child, int parent) {
        checkIndex(child, "componente figlia");
        checkIndex(parent, "componente genitore");
        return "p_[" + child + "," + parent + "]";
    }

    public static String levelVariable(int component, int level) {
        checkIndex(component, "componente");
        checkIndex(level, "livello");
        return "l_[" + component + "," + level + "]";
    }

    private static void checkIndex(int value, String role) {
        if (value < 0 || value > MAX_INDEX) {
            throw new IllegalArgumentException("Valore di " + role + " fuori range 0.." + MAX_INDEX + ": " + value);
        }
    }
}
