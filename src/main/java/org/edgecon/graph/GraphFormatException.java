package org.edgecon.graph;

/**
 * Errore di formato nella descrizione testuale di un grafo partizionato:
 * sintassi non riconosciuta, identificatori non contigui, cappi.
 */
public class GraphFormatException extends Exception {

    public GraphFormatException(String message) {
        super(message);
    }

    public GraphFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
