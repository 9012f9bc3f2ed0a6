package com.phillippitts.tempokey.presentation.dto;

import com.phillippitts.tempokey.domain.CatalogTrack;

import java.util.List;

/** Body of {@code POST /api/tempo/bulk}; either or both lists may be given. */
public record BulkRequest(List<CatalogTrack> tracks, List<String> trackIds, String country) { }
