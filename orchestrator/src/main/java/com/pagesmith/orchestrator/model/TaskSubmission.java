package com.pagesmith.orchestrator.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A validated task handed over by the front door.
 *
 * Attachments are already decoded (filename → bytes); checks are opaque strings
 * that only ever get embedded into prompts, pages and READMEs.
 */
public record TaskSubmission(
        String email,
        String taskName,
        int    round,
        String nonce,
        String brief,
        Map<String, byte[]> attachments,
        List<String> checks,
        String evaluationUrl,
        String callerEndpoint
) {
    public TaskSubmission {
        // Keep the caller's ordering: prompts and fallback pages list attachments in it.
        attachments = attachments == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attachments));
        checks      = checks == null ? List.of() : List.copyOf(checks);
    }
}
