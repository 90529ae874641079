package com.codesmith.orchestrator.engine.budget;

import com.codesmith.orchestrator.engine.budget.AssembledPrompt.Bucket;
import com.codesmith.orchestrator.model.RankedSnippet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Fits prompt inputs into a {@link ContextBudget}.
 *
 * Fill order:
 * <ol>
 *   <li>Overview: truncated to its bucket, never dropped.</li>
 *   <li>Summaries: snippets in rank order; the first one that does not fit
 *       is dropped together with everything ranked below it. Unused overview
 *       space is added to this bucket.</li>
 *   <li>Exploration: newest entries are kept, oldest are dropped first. If
 *       even the newest entry alone is too large it is truncated. Unused
 *       summary space is added to this bucket.</li>
 * </ol>
 * Generation and reserve buckets are left empty.
 *
 * <p>Every section is measured with its separator and heading included, so
 * the prompt can never exceed the ceiling.
 */
public class BudgetAllocator {

    private static final Logger log = LoggerFactory.getLogger(BudgetAllocator.class);

    static final String SEPARATOR           = "\n\n";
    static final String SUMMARIES_HEADING   = "## Relevant code from the knowledge base\n\n";
    static final String EXPLORATION_HEADING = "## Previous attempts (most recent first)\n\n";

    private final TokenCounter counter;

    public BudgetAllocator(TokenCounter counter) {
        this.counter = counter;
    }

    public AssembledPrompt allocate(ContextBudget budget, PromptInputs inputs) {
        Map<Bucket, Integer> usage = new EnumMap<>(Bucket.class);
        List<String> dropped = new ArrayList<>();
        StringBuilder prompt = new StringBuilder();

        // Overview
        String overview = fitSection(inputs.overview().strip(), budget.overviewTokens(), "overview", dropped);
        prompt.append(overview);
        int overviewUsed = counter.count(overview);
        usage.put(Bucket.OVERVIEW, overviewUsed);

        // Summaries
        int summaryBucket = budget.summaryTokens() + (budget.overviewTokens() - overviewUsed);
        String summaries = fitSnippets(inputs.snippets(), summaryBucket, dropped);
        prompt.append(summaries);
        int summaryUsed = counter.count(summaries);
        usage.put(Bucket.SUMMARIES, summaryUsed);

        // Exploration
        int explorationBucket = budget.explorationTokens() + (summaryBucket - summaryUsed);
        String exploration = fitExploration(inputs.exploration(), explorationBucket, dropped);
        prompt.append(exploration);
        usage.put(Bucket.EXPLORATION, counter.count(exploration));

        usage.put(Bucket.GENERATION, 0);
        usage.put(Bucket.RESERVE, 0);

        String text = prompt.toString();
        int tokens = counter.count(text);
        if (tokens > budget.totalTokens()) {
            throw new IllegalStateException("Assembled prompt (" + tokens
                    + " tokens) exceeds the ceiling of " + budget.totalTokens());
        }
        if (!dropped.isEmpty()) {
            log.debug("Prompt budget {} tokens: used {}, dropped {}", budget.promptCeiling(), tokens, dropped);
        }
        return new AssembledPrompt(text, tokens, usage, dropped);
    }

    // ------------------------------------------------------------------
    // Sections
    // ------------------------------------------------------------------

    /** Body plus separator, truncating the body when needed. */
    private String fitSection(String body, int bucket, String label, List<String> dropped) {
        if (body.isEmpty() || bucket <= 0) {
            if (!body.isEmpty()) dropped.add(label + " (no budget)");
            return "";
        }
        String full = body + SEPARATOR;
        if (counter.count(full) <= bucket) {
            return full;
        }
        int sepTokens = counter.count(SEPARATOR);
        String cut = bucket > sepTokens
                ? counter.truncate(body, bucket - sepTokens) + SEPARATOR
                : counter.truncate(body, bucket);
        dropped.add(String.format(Locale.ROOT, "%s truncated from %d to %d tokens",
                label, counter.count(body), counter.count(cut)));
        return cut;
    }

    private String fitSnippets(List<RankedSnippet> snippets, int bucket, List<String> dropped) {
        if (snippets.isEmpty()) return "";
        List<RankedSnippet> ranked = snippets.stream()
                .sorted(Comparator.comparingDouble(RankedSnippet::score).reversed())
                .toList();

        StringBuilder sb = new StringBuilder(SUMMARIES_HEADING);
        int used = counter.count(SUMMARIES_HEADING);
        int kept = 0;
        for (int i = 0; i < ranked.size(); i++) {
            String block = renderSnippet(ranked.get(i));
            int cost = counter.count(block);
            if (used + cost > bucket) {
                for (int j = i; j < ranked.size(); j++) {
                    dropped.add("snippet " + ranked.get(j).source());
                }
                break;
            }
            sb.append(block);
            used += cost;
            kept++;
        }
        return kept == 0 ? "" : sb.toString();
    }

    private String fitExploration(List<String> entries, int bucket, List<String> dropped) {
        if (entries.isEmpty()) return "";
        int headingTokens = counter.count(EXPLORATION_HEADING);

        // Walk newest to oldest and stop at the first entry that does not fit.
        List<String> keptNewestFirst = new ArrayList<>();
        int used = headingTokens;
        int firstDropped = -1;
        for (int i = entries.size() - 1; i >= 0; i--) {
            String block = entries.get(i).strip() + SEPARATOR;
            int cost = counter.count(block);
            if (used + cost > bucket) {
                firstDropped = i;
                break;
            }
            keptNewestFirst.add(block);
            used += cost;
        }

        if (keptNewestFirst.isEmpty()) {
            String newest = entries.get(entries.size() - 1).strip();
            int room = bucket - headingTokens - counter.count(SEPARATOR);
            if (room <= 0) {
                dropped.add("exploration: all " + entries.size() + " entries (no budget)");
                return "";
            }
            String cut = counter.truncate(newest, room);
            dropped.add(String.format(Locale.ROOT, "exploration: newest entry truncated from %d to %d tokens",
                    counter.count(newest), counter.count(cut)));
            if (entries.size() > 1) {
                dropped.add("exploration: " + (entries.size() - 1) + " older entries");
            }
            return EXPLORATION_HEADING + cut + SEPARATOR;
        }

        if (firstDropped >= 0) {
            dropped.add("exploration: " + (firstDropped + 1) + " oldest entries");
        }
        StringBuilder sb = new StringBuilder(EXPLORATION_HEADING);
        keptNewestFirst.forEach(sb::append);
        return sb.toString();
    }

    private static String renderSnippet(RankedSnippet s) {
        return String.format(Locale.ROOT, "### %s (relevance %.2f)\n%s%s",
                s.source(), s.score(), s.content().strip(), SEPARATOR);
    }
}
