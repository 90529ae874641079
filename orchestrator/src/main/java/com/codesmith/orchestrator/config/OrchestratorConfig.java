package com.codesmith.orchestrator.config;

import com.codesmith.orchestrator.client.CodeGenerator;
import com.codesmith.orchestrator.client.CodeValidator;
import com.codesmith.orchestrator.client.KnowledgeSearch;
import com.codesmith.orchestrator.engine.JobOrchestrator;
import com.codesmith.orchestrator.engine.budget.ApproximateTokenCounter;
import com.codesmith.orchestrator.engine.budget.BudgetAllocator;
import com.codesmith.orchestrator.engine.budget.ContextBudget;
import com.codesmith.orchestrator.engine.budget.HistoryFormatter;
import com.codesmith.orchestrator.engine.budget.PromptAssembler;
import com.codesmith.orchestrator.engine.budget.TokenCounter;
import com.codesmith.orchestrator.engine.conversation.AmbiguityDetector;
import com.codesmith.orchestrator.engine.conversation.ApplicationEventQuestionChannel;
import com.codesmith.orchestrator.engine.conversation.ConversationGate;
import com.codesmith.orchestrator.engine.conversation.KeywordAmbiguityDetector;
import com.codesmith.orchestrator.engine.conversation.QuestionChannel;
import com.codesmith.orchestrator.engine.escalation.EscalationPolicy;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the engine. Engine classes carry no Spring annotations so they can be
 * built directly in unit tests; this is the only place they meet the container.
 */
@Configuration
@EnableScheduling
@EnableConfigurationProperties(CodesmithProperties.class)
public class OrchestratorConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * One thread per concurrently running job. Shut down by JobService
     * after it has cancelled every job.
     */
    @Bean(name = "jobWorkers", destroyMethod = "")
    public ExecutorService jobWorkers(CodesmithProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = r -> {
            Thread t = new Thread(r, "job-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return Executors.newFixedThreadPool(properties.getJobs().getWorkerThreads(), factory);
    }

    // ------------------------------------------------------------------
    // Escalation
    // ------------------------------------------------------------------

    @Bean
    public EscalationPolicy escalationPolicy(CodesmithProperties properties) {
        return EscalationPolicy.from(properties.getEscalation());
    }

    // ------------------------------------------------------------------
    // Prompt budget
    // ------------------------------------------------------------------

    @Bean
    public TokenCounter tokenCounter(CodesmithProperties properties) {
        return new ApproximateTokenCounter(properties.getBudget().getCharsPerToken());
    }

    @Bean
    public PromptAssembler promptAssembler(KnowledgeSearch knowledgeSearch,
                                           TokenCounter tokenCounter,
                                           CodesmithProperties properties) {
        return new PromptAssembler(knowledgeSearch,
                new BudgetAllocator(tokenCounter),
                new HistoryFormatter(),
                ContextBudget.from(properties.getBudget()),
                properties.getJobs().getHistoryWindow(),
                properties.getBudget().getSearchLimit());
    }

    // ------------------------------------------------------------------
    // Conversation
    // ------------------------------------------------------------------

    @Bean
    public QuestionChannel questionChannel(ApplicationEventPublisher publisher) {
        return new ApplicationEventQuestionChannel(publisher);
    }

    @Bean
    public AmbiguityDetector ambiguityDetector() {
        return new KeywordAmbiguityDetector();
    }

    @Bean
    public ConversationGate conversationGate(QuestionChannel channel, MeterRegistry meterRegistry,
                                             Clock clock, CodesmithProperties properties) {
        return new ConversationGate(channel, meterRegistry, clock,
                properties.getConversation().getAnswerTimeout());
    }

    // ------------------------------------------------------------------
    // Orchestrator
    // ------------------------------------------------------------------

    @Bean
    public JobOrchestrator jobOrchestrator(CodeGenerator generator,
                                           CodeValidator validator,
                                           PromptAssembler promptAssembler,
                                           EscalationPolicy escalationPolicy,
                                           ConversationGate conversationGate,
                                           AmbiguityDetector ambiguityDetector,
                                           MeterRegistry meterRegistry,
                                           Clock clock,
                                           CodesmithProperties properties) {
        CodesmithProperties.Conversation conversation = properties.getConversation();
        int maxQuestions = conversation.isEnabled() ? conversation.getMaxQuestions() : 0;
        return new JobOrchestrator(generator, validator, promptAssembler, escalationPolicy,
                conversationGate, ambiguityDetector, meterRegistry, clock, maxQuestions);
    }
}
