package com.codesmith.orchestrator.engine.budget;

import com.codesmith.orchestrator.model.Attempt;
import com.codesmith.orchestrator.model.Issue;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Renders attempts as prompt text. The only place attempt data becomes prose.
 */
public class HistoryFormatter {

    static final int MAX_ISSUES      = 10;
    static final int MAX_BUILD_CHARS = 1000;

    private static final DateTimeFormatter TIME =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

    public String format(Attempt attempt) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format(Locale.ROOT, "### Attempt #%d (%s, %s) - score %.1f/10\n",
                attempt.number(), attempt.tier(), attempt.model(), attempt.score()));
        sb.append("Time: ").append(TIME.format(attempt.timestamp())).append('\n');

        if (attempt.hasBuildErrors()) {
            String errors = attempt.buildErrors();
            sb.append("\nBuild errors:\n```\n");
            if (errors.length() > MAX_BUILD_CHARS) {
                sb.append(errors, 0, MAX_BUILD_CHARS).append("\n... (truncated)");
            } else {
                sb.append(errors);
            }
            sb.append("\n```\n");
        }

        List<Issue> issues = attempt.issues();
        if (!issues.isEmpty()) {
            sb.append("\nValidation issues:\n");
            issues.stream().limit(MAX_ISSUES).forEach(issue -> {
                sb.append("- [").append(issue.severity()).append("] ");
                if (issue.location() != null && !issue.location().isBlank()) {
                    sb.append(issue.location()).append(": ");
                }
                sb.append(issue.message()).append('\n');
                if (issue.suggestedFix() != null && !issue.suggestedFix().isBlank()) {
                    sb.append("  Suggested fix: ").append(issue.suggestedFix()).append('\n');
                }
            });
            if (issues.size() > MAX_ISSUES) {
                sb.append("... and ").append(issues.size() - MAX_ISSUES).append(" more issues\n");
            }
        }

        if (attempt.summary() != null && !attempt.summary().isBlank()) {
            sb.append("\nSummary: ").append(attempt.summary()).append('\n');
        }
        return sb.toString();
    }
}
