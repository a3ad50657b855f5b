package com.pagesmith.orchestrator.service;

import com.pagesmith.orchestrator.model.RepositoryHandle;

import java.time.Year;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders the files committed alongside the generated page.
 *
 * Output depends only on the arguments (the LICENSE year is passed in), so a
 * retried commit produces byte-identical files and can be recognised as already done.
 */
public final class ProjectFiles {

    static final int SUBJECT_LENGTH = 50;

    private ProjectFiles() {}

    /** {@code index.html}, {@code README.md}, {@code LICENSE} and, from round 2 on, the round notes. */
    public static Map<String, String> render(String taskName, int round, String brief,
                                             List<String> checks, String html,
                                             RepositoryHandle repo, String pagesUrl,
                                             String licenseHolder, Year year) {
        Map<String, String> files = new LinkedHashMap<>();
        files.put("index.html", html);
        files.put("README.md",  readme(taskName, round, brief, checks, repo, pagesUrl));
        files.put("LICENSE",    license(licenseHolder, year));
        if (round >= 2) {
            files.put(roundNotesPath(round), roundNotes(round, brief));
        }
        return files;
    }

    /** {@code Round <n>: <first 50 chars of the brief>}. */
    public static String commitMessage(int round, String brief) {
        String subject = brief == null ? "" : brief.strip().replaceAll("\\s+", " ");
        if (subject.length() > SUBJECT_LENGTH) {
            subject = subject.substring(0, SUBJECT_LENGTH);
        }
        return "Round " + round + ": " + subject;
    }

    static String roundNotesPath(int round) {
        return "round-" + round + "-updates.md";
    }

    static String readme(String taskName, int round, String brief, List<String> checks,
                         RepositoryHandle repo, String pagesUrl) {
        StringBuilder sb = new StringBuilder();
        sb.append("# ").append(taskName).append("\n\n");
        sb.append("Generated single-page web application.\n\n");

        sb.append("## Summary\n\n").append(brief == null ? "" : brief.strip()).append("\n\n");

        sb.append("## Links\n\n");
        sb.append("- Repository: ").append(repo.htmlUrl()).append('\n');
        if (pagesUrl != null) {
            sb.append("- Live page: ").append(pagesUrl).append('\n');
        }
        sb.append('\n');

        sb.append("## Usage\n\n");
        sb.append("Open `index.html` in a browser, or visit the live page. ");
        sb.append("Everything runs client-side; no build step is needed.\n\n");

        if (checks != null && !checks.isEmpty()) {
            sb.append("## Checks\n\n");
            for (String check : checks) {
                sb.append("- `").append(check.replace('\n', ' ').replace("`", "'")).append("`\n");
            }
            sb.append('\n');
        }

        sb.append("## Round\n\n").append("Current round: ").append(round).append("\n\n");
        sb.append("## License\n\nMIT, see `LICENSE`.\n");
        return sb.toString();
    }

    static String license(String holder, Year year) {
        return """
                MIT License

                Copyright (c) %d %s

                Permission is hereby granted, free of charge, to any person obtaining a copy
                of this software and associated documentation files (the "Software"), to deal
                in the Software without restriction, including without limitation the rights
                to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
                copies of the Software, and to permit persons to whom the Software is
                furnished to do so, subject to the following conditions:

                The above copyright notice and this permission notice shall be included in all
                copies or substantial portions of the Software.

                THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
                IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
                FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
                AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
                LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
                OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
                SOFTWARE.
                """.formatted(year.getValue(), holder);
    }

    static String roundNotes(int round, String brief) {
        return "# Round " + round + " updates\n\n" + (brief == null ? "" : brief.strip()) + "\n";
    }
}
