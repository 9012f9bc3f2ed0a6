package com.phillippitts.tempokey.presentation.dto;

import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record InvalidateRequest(@NotEmpty List<String> trackIds) { }
