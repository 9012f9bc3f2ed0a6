package com.phillippitts.tempokey.presentation.dto;

import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record UrlBatchRequest(@NotEmpty List<String> urls) { }
