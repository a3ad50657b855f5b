package com.pagesmith.orchestrator.generation;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the single prompt sent to the generative provider.
 *
 * The prompt carries the brief, the element ids the checks look for, the
 * attachment contents (CSV summarised, other text verbatim up to a ceiling),
 * the checks themselves, and the rules for a self-contained page.
 */
public final class PromptBuilder {

    /** Longest attachment text embedded verbatim. */
    static final int TEXT_CEILING = 1000;

    /** CSV rows shown after the header. */
    static final int CSV_SAMPLE_ROWS = 5;

    private static final String TEMPLATE = """
            Create a COMPLETE, WORKING HTML page. Return ONLY the HTML document, nothing else.

            TASK: {{TASK}}

            BRIEF:
            {{BRIEF}}

            ELEMENT IDS REQUIRED:
            {{IDS}}

            DATA FILES:
            {{ATTACHMENTS}}

            CHECKS THAT MUST PASS:
            {{CHECKS}}

            RULES:
            - Single HTML file with embedded CSS and JavaScript.
            - Embed all attachment data directly in the file; do not fetch it.
            - Put scripts before </body> and run them on DOMContentLoaded.
            - Every element id listed above must exist with exactly that id.
            - Start the reply with <!DOCTYPE html> and end it with </html>.
            """;

    private PromptBuilder() {}

    public static String build(String taskName, String brief,
                               Map<String, byte[]> attachments, List<String> checks) {
        return TEMPLATE
                .replace("{{TASK}}",        nullToEmpty(taskName))
                .replace("{{IDS}}",         describeIds(brief, checks))
                .replace("{{ATTACHMENTS}}", describeAttachments(attachments))
                .replace("{{CHECKS}}",      describeChecks(checks))
                // Brief last so text inside it is never mistaken for a placeholder.
                .replace("{{BRIEF}}",       nullToEmpty(brief));
    }

    // ------------------------------------------------------------------
    // Sections
    // ------------------------------------------------------------------

    private static String describeIds(String brief, List<String> checks) {
        Map<String, String> ids = ElementIds.required(brief, checks);
        if (ids.isEmpty()) {
            return "- (none listed; follow the brief)";
        }
        StringBuilder sb = new StringBuilder();
        ids.forEach((id, tag) -> sb.append("- #").append(id)
                .append("div".equals(tag) ? "" : " (a <" + tag + ">)")
                .append('\n'));
        return sb.toString().stripTrailing();
    }

    static String describeAttachments(Map<String, byte[]> attachments) {
        if (attachments.isEmpty()) {
            return "(no attachments)";
        }
        StringBuilder sb = new StringBuilder();
        attachments.forEach((name, content) -> {
            sb.append("File: ").append(name).append('\n');
            Optional<String> text = AttachmentText.asText(content);
            if (text.isEmpty()) {
                sb.append("(binary, ").append(content.length).append(" bytes)\n");
            } else if (AttachmentText.isCsv(name)) {
                sb.append(summariseCsv(text.get()));
            } else {
                sb.append(truncate(text.get())).append('\n');
            }
            sb.append('\n');
        });
        return sb.toString().stripTrailing();
    }

    private static String summariseCsv(String csv) {
        List<List<String>> rows = AttachmentText.parseCsv(csv);
        if (rows.isEmpty()) {
            return "(empty CSV)\n";
        }
        StringBuilder sb = new StringBuilder();
        sb.append("CSV with ").append(rows.size() - 1).append(" data rows.\n");
        sb.append("Columns: ").append(String.join(", ", rows.get(0))).append('\n');
        int shown = Math.min(CSV_SAMPLE_ROWS, rows.size() - 1);
        for (int i = 1; i <= shown; i++) {
            sb.append(String.join(",", rows.get(i))).append('\n');
        }
        if (rows.size() - 1 > shown) {
            sb.append("... (").append(rows.size() - 1 - shown).append(" more rows)\n");
        }
        return sb.toString();
    }

    private static String describeChecks(List<String> checks) {
        if (checks.isEmpty()) {
            return "- (none)";
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < checks.size(); i++) {
            sb.append(i + 1).append(". ").append(checks.get(i)).append('\n');
        }
        return sb.toString().stripTrailing();
    }

    private static String truncate(String text) {
        return text.length() <= TEXT_CEILING
                ? text
                : text.substring(0, TEXT_CEILING) + "\n... (truncated)";
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
