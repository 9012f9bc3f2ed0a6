package com.phillippitts.tempokey.presentation.dto;

import com.phillippitts.tempokey.domain.CatalogTrack;
import jakarta.validation.constraints.NotNull;

/** Body of {@code POST /api/tempo/resolve}. */
public record ResolveRequest(@NotNull CatalogTrack track, String country) { }
