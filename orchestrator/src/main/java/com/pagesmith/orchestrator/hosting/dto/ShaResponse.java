package com.pagesmith.orchestrator.hosting.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Any GitHub response we only need the "sha" of (e.g. POST .../git/blobs).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ShaResponse(String sha) {}
