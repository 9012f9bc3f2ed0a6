package com.phillippitts.tempokey.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record ReviewRequest(@NotBlank String trackId, @NotBlank String action) { }
