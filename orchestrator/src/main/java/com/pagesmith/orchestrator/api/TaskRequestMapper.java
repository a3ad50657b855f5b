package com.pagesmith.orchestrator.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.pagesmith.orchestrator.api.dto.SubmitTaskRequest;
import com.pagesmith.orchestrator.model.TaskSubmission;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Validates a {@link SubmitTaskRequest} and turns it into a {@link TaskSubmission}.
 *
 * Attachments are decoded here, once, so the pipeline only ever sees bytes.
 * An attachment that is not a decodable data URL is dropped with a warning
 * rather than failing the whole submission.
 */
final class TaskRequestMapper {

    private static final Logger log = LoggerFactory.getLogger(TaskRequestMapper.class);

    private TaskRequestMapper() {}

    static TaskSubmission toSubmission(SubmitTaskRequest req) {
        requireText(req.task(),  "task");
        requireText(req.nonce(), "nonce");
        requireText(req.brief(), "brief");
        requireText(req.evaluationUrl(), "evaluation_url");
        if (req.round() < 1) {
            throw TaskRejectedException.invalid("round must be >= 1, was " + req.round());
        }
        requireHttpUrl(req.evaluationUrl());

        return new TaskSubmission(
                req.email(),
                req.task().strip(),
                req.round(),
                req.nonce().strip(),
                req.brief(),
                decodeAttachments(req.attachments()),
                checks(req.checks()),
                req.evaluationUrl().strip(),
                req.endpoint());
    }

    static Map<String, byte[]> decodeAttachments(List<SubmitTaskRequest.Attachment> attachments) {
        Map<String, byte[]> decoded = new LinkedHashMap<>();
        for (SubmitTaskRequest.Attachment attachment : attachments) {
            if (attachment == null || attachment.name() == null || attachment.name().isBlank()) {
                log.warn("Skipping attachment without a name");
                continue;
            }
            Optional<byte[]> content = decodeDataUrl(attachment.url());
            if (content.isEmpty()) {
                log.warn("Skipping attachment '{}': not a decodable data URL", attachment.name());
                continue;
            }
            decoded.put(attachment.name(), content.get());
        }
        return decoded;
    }

    /** Payload of a {@code data:[<mime>][;base64],<payload>} URL. */
    static Optional<byte[]> decodeDataUrl(String url) {
        if (url == null || !url.regionMatches(true, 0, "data:", 0, 5)) {
            return Optional.empty();
        }
        int comma = url.indexOf(',');
        if (comma < 0) {
            return Optional.empty();
        }
        String meta    = url.substring(5, comma);
        String payload = url.substring(comma + 1);
        try {
            if (meta.toLowerCase(Locale.ROOT).endsWith(";base64")) {
                return Optional.of(Base64.getMimeDecoder().decode(payload));
            }
            return Optional.of(URLDecoder.decode(payload, StandardCharsets.UTF_8).getBytes(StandardCharsets.UTF_8));
        } catch (IllegalArgumentException e) {
            log.debug("Undecodable data URL payload: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /** Objects with a {@code js} field contribute it; anything else its JSON text. */
    static List<String> checks(List<JsonNode> checks) {
        List<String> out = new ArrayList<>();
        for (JsonNode check : checks) {
            if (check == null || check.isNull()) {
                continue;
            }
            if (check.isTextual()) {
                out.add(check.asText());
            } else if (check.isObject() && check.hasNonNull("js")) {
                out.add(check.get("js").asText());
            } else {
                out.add(check.toString());
            }
        }
        return out;
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw TaskRejectedException.invalid(field + " is required");
        }
    }

    private static void requireHttpUrl(String url) {
        try {
            URI uri = new URI(url.strip());
            String scheme = uri.getScheme();
            if (uri.getHost() == null || scheme == null
                    || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
                throw TaskRejectedException.invalid("evaluation_url must be an absolute http(s) URL");
            }
        } catch (URISyntaxException e) {
            throw TaskRejectedException.invalid("evaluation_url is not a valid URL: " + e.getReason());
        }
    }
}
