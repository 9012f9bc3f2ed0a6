package com.phillippitts.tempokey.service.resolve;

/**
 * Operator change to a record's selection or manual values. Null fields are left unchanged.
 */
public record SelectionCommand(
        String trackId,
        String tempoSelected,
        String keySelected,
        Double manualTempo,
        String manualKey,
        String manualScale
) {
    boolean isEmpty() {
        return tempoSelected == null && keySelected == null && manualTempo == null
                && manualKey == null && manualScale == null;
    }
}
