package org.edgecon.graph;

import java.util.Objects;

/**
 * Arco non orientato in forma canonica: il vertice minore è sempre il primo.
 * Le coppie (u,v) e (v,u) producono lo stesso arco.
 */
public final class Edge implements Comparable<Edge> {

    private final int first;
    private final int second;

    private Edge(int first, int second) {
        this.first = first;
        this.second = second;
    }

    /**
     * @throws IllegalArgumentException per vertici negativi o cappi (u == v)
     */
    public static Edge of(int u, int v) {
        if (u < 0 || v < 0) {
            throw new IllegalArgumentException("Vertici negativi non ammessi: (" + u + "," + v + ")");
        }
        if (u == v) {
            throw new IllegalArgumentException("Cappio non ammesso sul vertice " + u);
        }
        return new Edge(Math.min(u, v), Math.max(u, v));
    }

    public int getFirst() {
        return first;
    }

    public int getSecond() {
        return second;
    }

    /**
     * @return l'estremo opposto a vertex
     * @throws IllegalArgumentException se vertex non è un estremo dell'arco
     */
    public int opposite(int vertex) {
        if (vertex == first) return second;
        if (vertex == second) return first;
        throw new IllegalArgumentException("Il vertice " + vertex + " non appartiene all'arco " + this);
    }

    @Override
    public int compareTo(Edge other) {
        int cmp = Integer.compare(first, other.first);
        return cmp != 0 ? cmp : Integer.compare(second, other.second);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Edge)) return false;
        Edge other = (Edge) obj;
        return first == other.first && second == other.second;
    }

    @Override
    public int hashCode() {
        return Objects.hash(first, second);
    }

    @Override
    public String toString() {
        return "(" + first + "," + second + ")";
    }
}
