package org.edgecon.graph;

import java.util.*;
import java.util.logging.Logger;

/**
 * GRAFO NON ORIENTATO - Struttura immutabile su vertici 0..n-1
 *
 * Gli archi sono memorizzati in forma canonica e ordinati; archi duplicati
 * vengono fusi. Le liste di adiacenza sono ordinate per vertice.
 */
public class Graph {

    private static final Logger LOGGER = Logger.getLogger(Graph.class.getName());

    private final int numVertices;

    /** Archi canonici in ordine lessicografico */
    private final List<Edge> edges;

    private final Set<Edge> edgeSet;

    private final List<List<Integer>> adjacency;

    /**
     * @param numVertices numero di vertici (≥ 0)
     * @param edges archi; ogni estremo deve essere in 0..numVertices-1
     * @throws IllegalArgumentException per conteggi negativi o estremi fuori range
     */
    public Graph(int numVertices, Collection<Edge> edges) {
        if (numVertices < 0) {
            throw new IllegalArgumentException("Numero di vertici negativo: " + numVertices);
        }
        Objects.requireNonNull(edges, "Lista archi non può essere null");

        this.numVertices = numVertices;
        this.edgeSet = new TreeSet<>();
        for (Edge edge : edges) {
            if (edge.getSecond() >= numVertices) {
                throw new IllegalArgumentException("Arco " + edge + " fuori dal range 0.." + (numVertices - 1));
            }
            edgeSet.add(edge);
        }
        this.edges = List.copyOf(edgeSet);

        List<List<Integer>> neighbours = new ArrayList<>(numVertices);
        for (int v = 0; v < numVertices; v++) {
            neighbours.add(new ArrayList<>());
        }
        for (Edge edge : this.edges) {
            neighbours.get(edge.getFirst()).add(edge.getSecond());
            neighbours.get(edge.getSecond()).add(edge.getFirst());
        }
        List<List<Integer>> frozen = new ArrayList<>(numVertices);
        for (List<Integer> list : neighbours) {
            Collections.sort(list);
            frozen.add(Collections.unmodifiableList(list));
        }
        this.adjacency = Collections.unmodifiableList(frozen);

        LOGGER.fine(String.format("Grafo creato: %d vertici, %d archi", numVertices, this.edges.size()));
    }

    //region INTERROGAZIONE

    public int numVertices() {
        return numVertices;
    }

    public int numEdges() {
        return edges.size();
    }

    /**
     * @return true se (u,v) è un arco; false per vertici fuori range o u == v
     */
    public boolean isEdge(int u, int v) {
        if (u == v || u < 0 || v < 0 || u >= numVertices || v >= numVertices) {
            return false;
        }
        return edgeSet.contains(Edge.of(u, v));
    }

    /**
     * @return archi canonici in ordine lessicografico (lista immutabile)
     */
    public List<Edge> getEdges() {
        return edges;
    }

    public List<Integer> neighbours(int vertex) {
        if (vertex < 0 || vertex >= numVertices) {
            throw new IllegalArgumentException("Vertice inesistente: " + vertex);
        }
        return adjacency.get(vertex);
    }

    @Override
    public String toString() {
        return "Graph[n=" + numVertices + ", m=" + edges.size() + ", archi=" + edges + "]";
    }

    //endregion
}
