package com.codesmith.orchestrator.engine.budget;

import com.codesmith.orchestrator.model.Attempt;
import com.codesmith.orchestrator.model.Issue;
import com.codesmith.orchestrator.model.Tier;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

class HistoryFormatterTest {

    private final HistoryFormatter formatter = new HistoryFormatter();

    @Test
    void format_includesHeaderIssuesAndFix() {
        Attempt attempt = new Attempt(2, Tier.LOCAL_PLUS, "qwen", 5.5,
                List.of(new Issue("high", "Parser.java:12", "NPE on empty input", "check for null")),
                null, "Mostly works", "code", Duration.ofSeconds(3), Instant.parse("2026-01-15T10:00:00Z"));

        String text = formatter.format(attempt);

        assertThat(text).startsWith("### Attempt #2 (LOCAL_PLUS, qwen) - score 5.5/10");
        assertThat(text).contains("- [high] Parser.java:12: NPE on empty input");
        assertThat(text).contains("Suggested fix: check for null");
        assertThat(text).contains("Summary: Mostly works");
        assertThat(text).doesNotContain("Build errors");
    }

    @Test
    void format_capsIssuesAtTen() {
        List<Issue> issues = IntStream.rangeClosed(1, 14)
                .mapToObj(i -> new Issue("warning", null, "issue-" + i, null))
                .toList();
        Attempt attempt = new Attempt(1, Tier.LOCAL, "m", 3.0, issues, null, null, "code",
                Duration.ZERO, Instant.EPOCH);

        String text = formatter.format(attempt);

        assertThat(text).contains("issue-10").doesNotContain("issue-11");
        assertThat(text).contains("... and 4 more issues");
    }

    @Test
    void format_truncatesLongBuildErrors() {
        String errors = "E".repeat(HistoryFormatter.MAX_BUILD_CHARS + 500);
        Attempt attempt = new Attempt(1, Tier.LOCAL, "m", 0.0, List.of(), errors, null, null,
                Duration.ZERO, Instant.EPOCH);

        String text = formatter.format(attempt);

        assertThat(text).contains("Build errors:");
        assertThat(text).contains("... (truncated)");
        assertThat(text).doesNotContain("E".repeat(HistoryFormatter.MAX_BUILD_CHARS + 1));
    }
}
