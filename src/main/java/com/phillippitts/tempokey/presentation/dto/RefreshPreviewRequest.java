package com.phillippitts.tempokey.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record RefreshPreviewRequest(@NotBlank String trackId, String country) { }
