package com.codesmith.orchestrator.service;

import com.codesmith.orchestrator.model.Attempt;
import com.codesmith.orchestrator.model.Issue;
import com.codesmith.orchestrator.model.JobResult;
import com.codesmith.orchestrator.model.JobSnapshot;
import com.codesmith.orchestrator.model.JobStatus;
import org.springframework.stereotype.Component;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Renders a job snapshot as a markdown report for human review.
 *
 * Sections: header, task, attempt history, score progression, recurring
 * issues and recommended next steps. Recurring issues are the issue messages
 * reported by more than one attempt, most frequent first.
 */
@Component
public class FailureReportGenerator {

    static final int ISSUES_PER_ATTEMPT = 5;
    static final int BAR_WIDTH          = 30;
    static final int RECURRING_LIMIT    = 5;

    private static final DateTimeFormatter TIME =
            DateTimeFormatter.ofPattern("HH:mm:ss").withZone(ZoneOffset.UTC);

    public String generate(JobSnapshot job) {
        StringBuilder sb = new StringBuilder();
        List<Attempt> attempts = job.attempts();

        sb.append("# Job Report: ").append(job.id()).append("\n\n");
        sb.append("**Language:** ").append(job.language()).append("  \n");
        sb.append("**Status:** ").append(statusLine(job)).append("  \n");
        sb.append("**Total Attempts:** ").append(attempts.size())
          .append(" of ").append(job.maxIterations()).append("  \n");
        if (job.bestScore() != null) {
            sb.append("**Best Score:** ").append(score(job.bestScore())).append("/10  \n");
        }
        sb.append("**Current Tier:** ").append(job.currentTier()).append("\n\n");

        sb.append("---\n\n## Task\n\n> ").append(job.task().replace("\n", "\n> ")).append("\n\n");

        sb.append("---\n\n## Attempt History\n\n");
        if (attempts.isEmpty()) {
            sb.append("*No attempts yet.*\n\n");
        }
        for (Attempt a : attempts) {
            sb.append("### Attempt ").append(a.number()).append(": ")
              .append(a.model()).append(" (").append(a.tier()).append(")\n\n");
            sb.append("- **Score:** ").append(score(a.score())).append("/10\n");
            sb.append("- **Duration:** ")
              .append(String.format(Locale.ROOT, "%.1f", a.duration().toMillis() / 1000.0)).append("s\n");
            sb.append("- **Time:** ").append(TIME.format(a.timestamp())).append(" UTC\n");
            if (a.hasBuildErrors()) {
                sb.append("- **Build errors:** ").append(firstLine(a.buildErrors())).append("\n");
            }
            if (!a.issues().isEmpty()) {
                sb.append("- **Issues:**\n");
                a.issues().stream().limit(ISSUES_PER_ATTEMPT)
                        .forEach(i -> sb.append("  - ").append(describe(i)).append("\n"));
            }
            sb.append("\n");
        }

        if (attempts.size() > 1) {
            sb.append("### Score Progression\n\n```\n");
            for (Attempt a : attempts) {
                int filled = (int) (a.score() / 10.0 * BAR_WIDTH);
                sb.append(String.format(Locale.ROOT, "Attempt %2d: [%s%s] %s/10 (%s)\n",
                        a.number(), "#".repeat(filled), ".".repeat(BAR_WIDTH - filled),
                        score(a.score()), a.model()));
            }
            sb.append("```\n\n");
        }

        List<String> recurring = recurringIssues(attempts);
        sb.append("---\n\n## Recurring Issues\n\n");
        if (recurring.isEmpty()) {
            sb.append("*No issue was reported by more than one attempt.*\n\n");
        } else {
            recurring.forEach(r -> sb.append("- ").append(r).append("\n"));
            sb.append("\n");
        }

        sb.append("---\n\n## Recommended Actions\n\n");
        List<String> actions = recommendations(job);
        for (int i = 0; i < actions.size(); i++) {
            sb.append(i + 1).append(". ").append(actions.get(i)).append("\n");
        }
        return sb.toString();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static String statusLine(JobSnapshot job) {
        JobResult result = job.result();
        if (result == null) {
            return job.status().name();
        }
        return job.status() + " (" + result.reason() + ": " + result.message() + ")";
    }

    static List<String> recurringIssues(List<Attempt> attempts) {
        Map<String, Long> counts = attempts.stream()
                .flatMap(a -> a.issues().stream().map(Issue::message).distinct())
                .collect(Collectors.groupingBy(Function.identity(), LinkedHashMap::new, Collectors.counting()));
        return counts.entrySet().stream()
                .filter(e -> e.getValue() > 1)
                .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder()))
                .limit(RECURRING_LIMIT)
                .map(e -> e.getKey() + " (" + e.getValue() + " attempts)")
                .toList();
    }

    private static List<String> recommendations(JobSnapshot job) {
        List<String> actions = new ArrayList<>();
        if (job.status() == JobStatus.COMPLETED) {
            actions.add("Review the accepted artifact before merging.");
            return actions;
        }
        if (!job.status().isTerminal()) {
            actions.add("Wait for the job to finish; this report covers the attempts so far.");
            if (!job.pendingQuestions().isEmpty()) {
                actions.add("Answer the " + job.pendingQuestions().size() + " pending question(s).");
            }
            return actions;
        }
        switch (job.result().reason()) {
            case NO_ANSWER -> actions.add("Resubmit the task with the missing decision spelled out.");
            case CANCELLED -> actions.add("Resubmit the task if the cancellation was not intended.");
            case INTERNAL_ERROR -> actions.add("Check the orchestrator logs for job " + job.id() + ".");
            default -> {
                actions.add("Split the task into smaller pieces.");
                actions.add("Add guidance through the feedback endpoint and resubmit.");
                if (job.attempts().stream().anyMatch(Attempt::hasBuildErrors)) {
                    actions.add("Fix the build errors in the best attempt by hand.");
                }
            }
        }
        return actions;
    }

    private static String describe(Issue issue) {
        StringBuilder sb = new StringBuilder();
        if (issue.severity() != null) sb.append("[").append(issue.severity()).append("] ");
        if (issue.location() != null) sb.append(issue.location()).append(": ");
        return sb.append(issue.message()).toString();
    }

    private static String firstLine(String text) {
        int nl = text.indexOf('\n');
        return nl < 0 ? text : text.substring(0, nl) + " ...";
    }

    private static String score(double score) {
        return String.format(Locale.ROOT, "%.1f", score);
    }
}
