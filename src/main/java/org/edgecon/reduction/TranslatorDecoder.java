package org.edgecon.reduction;

import org.edgecon.formula.Model;
import org.edgecon.graph.Edge;
import org.edgecon.graph.EdgeConGraph;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Logger;

/**
 * DECODIFICA DEL MODELLO - Da assegnamento soddisfacente a posizionamento dei traduttori
 *
 * Per ogni arco e ogni indice interroga X(arco,indice); gli archi veri
 * ricevono un traduttore. Al termine la gerarchia delle componenti viene
 * ricalcolata sul grafo.
 */
public final class TranslatorDecoder {

    private static final Logger LOGGER = Logger.getLogger(TranslatorDecoder.class.getName());

    private TranslatorDecoder() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Decodifica il modello e aggiorna il grafo (traduttori e gerarchia).
     * Il grafo deve avere la stessa partizione usata per costruire la riduzione.
     *
     * @param model modello di una formula prodotta da {@link EdgeConReduction#buildReduction}
     * @param graph grafo partizionato da aggiornare
     * @return posizionamento decodificato, arco → indice di traduttore, in ordine di arco
     * @throws IllegalStateException se un arco porta due indici o un indice sta su due archi
     */
    public static Map<Edge, Integer> decodeModel(Model model, EdgeConGraph graph) {
        if (model == null || graph == null) {
            throw new IllegalArgumentException("Modello e grafo non possono essere null");
        }

        int translatorCount = graph.numComponents() - 1;
        Map<Edge, Integer> placement = new LinkedHashMap<>();
        Map<Integer, Edge> owners = new HashMap<>();

        for (Edge edge : graph.getGraph().getEdges()) {
            for (int i = 0; i < translatorCount; i++) {
                if (!model.valueOf(VariableNames.edgeVariable(edge.getFirst(), edge.getSecond(), i))) {
                    continue;
                }

                Integer previousIndex = placement.putIfAbsent(edge, i);
                if (previousIndex != null) {
                    throw new IllegalStateException("Modello incoerente: l'arco " + edge
                            + " porta gli indici " + previousIndex + " e " + i);
                }
                Edge previousEdge = owners.putIfAbsent(i, edge);
                if (previousEdge != null) {
                    throw new IllegalStateException("Modello incoerente: l'indice " + i
                            + " è assegnato agli archi " + previousEdge + " e " + edge);
                }
            }
        }

        // Il grafo viene modificato solo dopo che l'intero modello è risultato coerente
        for (Edge edge : placement.keySet()) {
            graph.addTranslator(edge.getFirst(), edge.getSecond());
        }
        graph.recomputeComponents();
        LOGGER.info(String.format("Modello decodificato: %d traduttori, profondità gerarchia %d",
                placement.size(), graph.hierarchyDepth()));
        return Collections.unmodifiableMap(placement);
    }
}
