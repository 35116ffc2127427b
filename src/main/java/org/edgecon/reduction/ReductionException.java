package org.edgecon.reduction;

/**
 * Violazione di una precondizione della riduzione, rilevata prima di
 * costruire qualsiasi vincolo.
 */
public class ReductionException extends Exception {

    public ReductionException(String message) {
        super(message);
    }
}
