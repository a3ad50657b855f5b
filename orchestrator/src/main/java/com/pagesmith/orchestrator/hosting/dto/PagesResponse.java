package com.pagesmith.orchestrator.hosting.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * GET /repos/{owner}/{repo}/pages.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PagesResponse(String html_url, String status) {}
