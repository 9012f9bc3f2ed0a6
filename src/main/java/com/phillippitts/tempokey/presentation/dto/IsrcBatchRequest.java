package com.phillippitts.tempokey.presentation.dto;

import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record IsrcBatchRequest(@NotEmpty List<String> isrcs) { }
