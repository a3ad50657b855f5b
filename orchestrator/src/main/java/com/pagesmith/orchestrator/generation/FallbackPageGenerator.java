package com.pagesmith.orchestrator.generation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.util.HtmlUtils;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Deterministic page generator used when the model cannot deliver.
 *
 * Produces a self-contained page (no CDN links, no fetches) from the brief,
 * attachments and checks alone:
 * <ul>
 *   <li>every required element id, rendered as the tag the brief names for it</li>
 *   <li>CSV attachments as tables with a client-side filter box</li>
 *   <li>other text attachments in {@code <pre>} blocks</li>
 *   <li>the brief and the checks, HTML-escaped</li>
 * </ul>
 * {@link #generate} never throws: if rendering blows up on some odd input we
 * return {@link #MINIMAL_PAGE} instead.
 */
public class FallbackPageGenerator {

    private static final Logger log = LoggerFactory.getLogger(FallbackPageGenerator.class);

    static final String MINIMAL_PAGE = """
            <!DOCTYPE html>
            <html lang="en">
            <head>
            <meta charset="UTF-8">
            <meta name="viewport" content="width=device-width, initial-scale=1.0">
            <title>Generated page</title>
            </head>
            <body>
            <main id="output"><p>This page was generated without any task-specific content.</p></main>
            </body>
            </html>
            """;

    private static final Set<String> VOID_TAGS = Set.of("input");

    private static final String STYLE = """
            body { font-family: system-ui, -apple-system, "Segoe UI", Roboto, sans-serif;
                   margin: 0; padding: 24px; background: #f5f6fa; color: #1f2933; }
            .container { max-width: 1100px; margin: 0 auto; background: #fff;
                         border-radius: 8px; padding: 24px; box-shadow: 0 2px 8px rgba(0,0,0,.08); }
            .required > * { display: block; margin: 12px 0; }
            table { border-collapse: collapse; width: 100%; margin-top: 8px; }
            th, td { border: 1px solid #d9dde3; padding: 6px 10px; text-align: left; }
            th { background: #eef1f6; }
            pre { background: #f0f2f5; padding: 12px; overflow-x: auto; white-space: pre-wrap; }
            .brief { white-space: pre-wrap; color: #52606d; }
            """;

    // Filters every table marked data-filterable by the text typed into its paired input.
    private static final String SCRIPT = """
            document.addEventListener('DOMContentLoaded', function () {
              document.querySelectorAll('input[data-filter-for]').forEach(function (box) {
                var table = document.getElementById(box.getAttribute('data-filter-for'));
                box.addEventListener('input', function () {
                  var needle = box.value.toLowerCase();
                  table.querySelectorAll('tbody tr').forEach(function (row) {
                    row.style.display = row.textContent.toLowerCase().indexOf(needle) >= 0 ? '' : 'none';
                  });
                });
              });
              document.querySelectorAll('button').forEach(function (button) {
                button.addEventListener('click', function () {
                  var clicks = Number(button.getAttribute('data-clicks') || '0') + 1;
                  button.setAttribute('data-clicks', String(clicks));
                });
              });
            });
            """;

    public String generate(String taskName, String brief,
                           Map<String, byte[]> attachments, List<String> checks) {
        try {
            return render(taskName == null ? "" : taskName,
                          brief == null ? "" : brief,
                          attachments == null ? Map.of() : attachments,
                          checks == null ? List.of() : checks);
        } catch (RuntimeException e) {
            log.error("Template rendering failed for task '{}', using the minimal page", taskName, e);
            return MINIMAL_PAGE;
        }
    }

    private String render(String taskName, String brief,
                          Map<String, byte[]> attachments, List<String> checks) {
        String title = taskName.isBlank() ? "Generated page" : taskName;

        StringBuilder body = new StringBuilder();
        body.append("<div class=\"container\">\n");
        body.append("<h2 class=\"page-title\">").append(esc(title)).append("</h2>\n");

        Map<String, String> ids = ElementIds.required(brief, checks);
        if (!ids.isEmpty()) {
            body.append("<section class=\"required\">\n");
            ids.forEach((id, tag) -> body.append(element(tag, id, title)).append('\n'));
            body.append("</section>\n");
        }

        int index = 0;
        for (Map.Entry<String, byte[]> attachment : attachments.entrySet()) {
            body.append(attachmentSection(attachment.getKey(), attachment.getValue(), index++));
        }

        body.append("<section>\n<h3>Brief</h3>\n<p class=\"brief\">")
            .append(esc(brief)).append("</p>\n</section>\n");

        if (!checks.isEmpty()) {
            body.append("<section>\n<h3>Checks</h3>\n<ol class=\"checks\">\n");
            for (String check : checks) {
                body.append("<li><code>").append(esc(check)).append("</code></li>\n");
            }
            body.append("</ol>\n</section>\n");
        }
        body.append("</div>\n");

        return "<!DOCTYPE html>\n"
                + "<html lang=\"en\">\n"
                + "<head>\n"
                + "<meta charset=\"UTF-8\">\n"
                + "<meta name=\"viewport\" content=\"width=device-width, initial-scale=1.0\">\n"
                + "<title>" + esc(title) + "</title>\n"
                + "<style>\n" + STYLE + "</style>\n"
                + "</head>\n"
                + "<body>\n"
                + body
                + "<script>\n" + SCRIPT + "</script>\n"
                + "</body>\n"
                + "</html>\n";
    }

    /** One required element; headings get the page title, everything else its id as text. */
    private String element(String tag, String id, String title) {
        String safeId = esc(id);
        if (VOID_TAGS.contains(tag)) {
            return "<input id=\"" + safeId + "\" type=\"text\" placeholder=\"" + safeId + "\">";
        }
        String text = tag.matches("h[1-6]") ? esc(title) : safeId;
        String attrs = "button".equals(tag) ? " type=\"button\"" : "";
        return switch (tag) {
            case "table"  -> "<table id=\"" + safeId + "\"><tbody></tbody></table>";
            case "select" -> "<select id=\"" + safeId + "\"><option value=\"\">" + safeId + "</option></select>";
            case "ul", "ol" -> "<" + tag + " id=\"" + safeId + "\"><li>" + safeId + "</li></" + tag + ">";
            default -> "<" + tag + " id=\"" + safeId + "\"" + attrs + ">" + text + "</" + tag + ">";
        };
    }

    private String attachmentSection(String name, byte[] content, int index) {
        StringBuilder sb = new StringBuilder();
        sb.append("<section class=\"attachment\">\n<h3>").append(esc(name)).append("</h3>\n");
        Optional<String> text = AttachmentText.asText(content);
        if (text.isEmpty()) {
            sb.append("<p>Binary file, ").append(content.length).append(" bytes.</p>\n");
        } else if (AttachmentText.isCsv(name)) {
            sb.append(csvTable(text.get(), index));
        } else {
            sb.append("<pre>").append(esc(text.get())).append("</pre>\n");
        }
        return sb.append("</section>\n").toString();
    }

    private String csvTable(String csv, int index) {
        List<List<String>> rows = AttachmentText.parseCsv(csv);
        if (rows.isEmpty()) {
            return "<p>Empty file.</p>\n";
        }
        String tableId = "ps-data-" + index;
        StringBuilder sb = new StringBuilder();
        sb.append("<input id=\"ps-filter-").append(index)
          .append("\" type=\"search\" placeholder=\"Filter rows\" data-filter-for=\"")
          .append(tableId).append("\">\n");
        sb.append("<table id=\"").append(tableId).append("\" data-filterable=\"true\">\n<thead><tr>");
        for (String header : rows.get(0)) {
            sb.append("<th>").append(esc(header)).append("</th>");
        }
        sb.append("</tr></thead>\n<tbody>\n");
        for (List<String> row : rows.subList(1, rows.size())) {
            sb.append("<tr>");
            for (String cell : row) {
                sb.append("<td>").append(esc(cell)).append("</td>");
            }
            sb.append("</tr>\n");
        }
        return sb.append("</tbody>\n</table>\n").toString();
    }

    private static String esc(String s) {
        return HtmlUtils.htmlEscape(s);
    }
}
