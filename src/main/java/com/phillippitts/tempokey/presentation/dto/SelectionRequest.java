package com.phillippitts.tempokey.presentation.dto;

import com.phillippitts.tempokey.service.resolve.SelectionCommand;

public record SelectionRequest(
        String trackId,
        String tempoSelected,
        String keySelected,
        Double manualTempo,
        String manualKey,
        String manualScale
) {
    public SelectionCommand toCommand() {
        return new SelectionCommand(trackId, tempoSelected, keySelected, manualTempo, manualKey, manualScale);
    }
}
