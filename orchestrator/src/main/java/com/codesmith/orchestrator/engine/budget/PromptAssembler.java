package com.codesmith.orchestrator.engine.budget;

import com.codesmith.orchestrator.client.KnowledgeSearch;
import com.codesmith.orchestrator.model.Attempt;
import com.codesmith.orchestrator.model.ConversationState;
import com.codesmith.orchestrator.model.Feedback;
import com.codesmith.orchestrator.model.Job;
import com.codesmith.orchestrator.model.RankedSnippet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Collects everything a generation prompt may contain and hands it to the
 * {@link BudgetAllocator}.
 *
 * The overview carries the task, target language, clarification answers and
 * user feedback. Summaries come from the knowledge base. Exploration is the
 * formatted history of the last few attempts.
 */
public class PromptAssembler {

    private static final Logger log = LoggerFactory.getLogger(PromptAssembler.class);

    private final KnowledgeSearch  search;
    private final BudgetAllocator  allocator;
    private final HistoryFormatter formatter;
    private final ContextBudget    budget;
    private final int              historyWindow;
    private final int              searchLimit;

    public PromptAssembler(KnowledgeSearch search,
                           BudgetAllocator allocator,
                           HistoryFormatter formatter,
                           ContextBudget budget,
                           int historyWindow,
                           int searchLimit) {
        this.search        = search;
        this.allocator     = allocator;
        this.formatter     = formatter;
        this.budget        = budget;
        this.historyWindow = historyWindow;
        this.searchLimit   = searchLimit;
    }

    /**
     * @param clarifications question → answer pairs collected before the first attempt
     */
    public AssembledPrompt assemble(Job job, Map<String, String> clarifications) {
        String overview = buildOverview(job, clarifications);

        // Oldest first; the allocator drops from the front.
        List<Attempt> recent = new ArrayList<>(job.getHistory().recent(historyWindow));
        Collections.reverse(recent);
        List<String> exploration = recent.stream().map(formatter::format).toList();

        AssembledPrompt prompt = allocator.allocate(budget,
                new PromptInputs(overview, searchKnowledge(job.getTask()), exploration));
        log.debug("Assembled prompt: {} tokens (ceiling {}), usage={}",
                prompt.tokens(), budget.promptCeiling(), prompt.usage());
        return prompt;
    }

    private List<RankedSnippet> searchKnowledge(String task) {
        try {
            List<RankedSnippet> hits = search.search(task, searchLimit);
            return hits == null ? List.of() : hits;
        } catch (Exception e) {
            // The prompt is still usable without snippets.
            log.warn("Knowledge search failed, continuing without snippets: {}", e.getMessage());
            return List.of();
        }
    }

    private static String buildOverview(Job job, Map<String, String> clarifications) {
        StringBuilder sb = new StringBuilder();
        sb.append("# Task\n").append(job.getTask().strip()).append("\n\n");
        if (job.getLanguage() != null && !job.getLanguage().isBlank()) {
            sb.append("Target language: ").append(job.getLanguage()).append("\n\n");
        }

        if (!clarifications.isEmpty()) {
            sb.append("## Clarifications\n");
            clarifications.forEach((q, a) -> sb.append("- ").append(q).append(" ").append(a).append('\n'));
            sb.append('\n');
        }

        List<Feedback> feedback = job.existingConversation()
                .map(ConversationState::feedback)
                .orElse(List.of());
        if (!feedback.isEmpty()) {
            sb.append("## Guidance from the user\n");
            feedback.forEach(f -> sb.append("- ").append(f.message()).append('\n'));
            sb.append('\n');
        }

        if (!job.getHistory().isEmpty()) {
            sb.append("Earlier attempts are listed below. Keep what worked and fix every reported issue.\n\n");
        }
        sb.append("Return the complete source in fenced code blocks.");
        return sb.toString();
    }
}
