package com.codesmith.orchestrator.engine;

import com.codesmith.orchestrator.client.CodeGenerator;
import com.codesmith.orchestrator.client.CodeGenerator.Generation;
import com.codesmith.orchestrator.client.CodeValidator;
import com.codesmith.orchestrator.client.CodeValidator.ValidationReport;
import com.codesmith.orchestrator.engine.budget.AssembledPrompt;
import com.codesmith.orchestrator.engine.budget.PromptAssembler;
import com.codesmith.orchestrator.engine.conversation.Ambiguity;
import com.codesmith.orchestrator.engine.conversation.AmbiguityDetector;
import com.codesmith.orchestrator.engine.conversation.ConversationGate;
import com.codesmith.orchestrator.engine.escalation.EscalationPolicy;
import com.codesmith.orchestrator.logging.MdcContext;
import com.codesmith.orchestrator.model.Attempt;
import com.codesmith.orchestrator.model.CancellationToken;
import com.codesmith.orchestrator.model.EscalationDecision;
import com.codesmith.orchestrator.model.EscalationDecision.Abort;
import com.codesmith.orchestrator.model.EscalationDecision.Accept;
import com.codesmith.orchestrator.model.EscalationDecision.Retry;
import com.codesmith.orchestrator.model.Job;
import com.codesmith.orchestrator.model.JobCancelledException;
import com.codesmith.orchestrator.model.JobResult;
import com.codesmith.orchestrator.model.JobStatus;
import com.codesmith.orchestrator.model.TerminalReason;
import com.codesmith.orchestrator.model.Tier;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The attempt loop for one job.
 *
 * For each attempt:
 *   1. Stop if the job was cancelled
 *   2. (first attempt only) ask clarifying questions and wait for answers
 *   3. Assemble a budgeted prompt from task, history and knowledge search
 *   4. Generate on the current tier, then validate the artifact
 *   5. Append the attempt and ask the escalation policy what to do next
 *
 * Generation and validation failures become zero-score attempts and the loop
 * carries on. Whatever happens, the job ends in exactly one terminal state
 * with a structured {@link JobResult}; no exception escapes {@link #run}.
 *
 * <pre>
 *   codesmith.attempts{tier, outcome="scored|failed"}
 *   codesmith.attempt.duration{tier}
 *   codesmith.jobs.finished{status, reason}
 * </pre>
 */
public class JobOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(JobOrchestrator.class);

    private final CodeGenerator     generator;
    private final CodeValidator     validator;
    private final PromptAssembler   promptAssembler;
    private final EscalationPolicy  policy;
    private final ConversationGate  gate;
    private final AmbiguityDetector ambiguityDetector;
    private final MeterRegistry     meterRegistry;
    private final Clock             clock;
    private final int               maxQuestions;

    /**
     * @param maxQuestions clarifying questions asked per job; 0 turns clarification off
     */
    public JobOrchestrator(CodeGenerator generator,
                           CodeValidator validator,
                           PromptAssembler promptAssembler,
                           EscalationPolicy policy,
                           ConversationGate gate,
                           AmbiguityDetector ambiguityDetector,
                           MeterRegistry meterRegistry,
                           Clock clock,
                           int maxQuestions) {
        this.generator         = generator;
        this.validator         = validator;
        this.promptAssembler   = promptAssembler;
        this.policy            = policy;
        this.gate              = gate;
        this.ambiguityDetector = ambiguityDetector;
        this.meterRegistry     = meterRegistry;
        this.clock             = clock;
        this.maxQuestions      = maxQuestions;
    }

    // ------------------------------------------------------------------
    // Entry point, called on a worker thread by JobService
    // ------------------------------------------------------------------

    /**
     * Run a job to completion. Blocks until the job is terminal.
     */
    public void run(Job job) {
        MdcContext.setJob(job.getId());
        try {
            if (!job.markRunning()) {
                log.info("Job {} is {} and will not run", job.getId(), job.getStatus());
                return;
            }
            log.info("Job {} started (language={}, maxIterations={})",
                    job.getId(), job.getLanguage(), job.getMaxIterations());

            JobResult result;
            try {
                result = attemptLoop(job);
            } catch (JobCancelledException e) {
                result = new JobResult(TerminalReason.CANCELLED, TerminalReason.CANCELLED.description(),
                        job.getHistory().best().orElse(null));
            } catch (RuntimeException e) {
                // Includes invariant violations: a bug in the engine, not a job outcome.
                log.error("Job {} stopped by an internal error", job.getId(), e);
                result = new JobResult(TerminalReason.INTERNAL_ERROR,
                        e.getClass().getSimpleName() + ": " + e.getMessage(),
                        job.getHistory().best().orElse(null));
            }
            finish(job, result);
        } finally {
            MdcContext.clear();
        }
    }

    // ------------------------------------------------------------------
    // Loop
    // ------------------------------------------------------------------

    private JobResult attemptLoop(Job job) {
        CancellationToken cancellation = job.getCancellation();
        Map<String, String> clarifications = new LinkedHashMap<>();

        for (int number = 1; number <= job.getMaxIterations(); number++) {
            cancellation.throwIfCancellationRequested();
            MdcContext.setAttempt(number, job.getCurrentTier());

            if (number == 1) {
                Optional<JobResult> stop = clarify(job, clarifications);
                if (stop.isPresent()) {
                    return stop.get();
                }
            }

            AssembledPrompt prompt = promptAssembler.assemble(job, clarifications);
            if (!prompt.dropped().isEmpty()) {
                log.info("Attempt {} prompt trimmed to {} tokens, dropped {}",
                        number, prompt.tokens(), prompt.dropped());
            }

            Attempt attempt = runAttempt(job, number, prompt.text());
            job.getHistory().append(attempt);
            log.info("Attempt {}/{} on {} ({}) scored {}/10 with {} issues",
                    number, job.getMaxIterations(), attempt.tier(), attempt.model(),
                    attempt.score(), attempt.issues().size());

            EscalationDecision decision = policy.decide(number, attempt.score(),
                    job.getHistory().snapshot(), job.getMaxIterations());

            if (decision instanceof Accept accept) {
                return JobResult.of(accept.reason(), attempt);
            }
            if (decision instanceof Abort abort) {
                Attempt best = job.getHistory().best().orElse(attempt);
                return new JobResult(abort.reason(), abort.message(), best);
            }
            Tier next = ((Retry) decision).nextTier();
            if (next != job.getCurrentTier()) {
                log.warn("Escalating job {} from {} to {} after attempt {}",
                        job.getId(), job.getCurrentTier(), next, number);
            }
            job.escalateTo(next);
        }
        throw new IllegalStateException("Attempt loop ended without a terminal decision after "
                + job.getMaxIterations() + " attempts");
    }

    /**
     * Generate and validate once. Any failure except cancellation becomes a
     * zero-score attempt carrying the error text.
     */
    private Attempt runAttempt(Job job, int number, String prompt) {
        CancellationToken cancellation = job.getCancellation();
        Tier tier = job.getCurrentTier();
        Instant started = clock.instant();
        String model = tier.name();
        String outcome = "scored";
        Attempt attempt;
        try {
            cancellation.throwIfCancellationRequested();
            Generation generation = generator.generate(prompt, job.getLanguage(), tier, cancellation);
            model = generation.modelUsed();

            cancellation.throwIfCancellationRequested();
            ValidationReport report = validator.validate(generation.artifact(), job.getLanguage());

            attempt = new Attempt(number, tier, model, report.score(), report.issues(),
                    report.buildErrors(), report.summary(), generation.artifact(),
                    Duration.between(started, clock.instant()), clock.instant());
        } catch (JobCancelledException e) {
            throw e;
        } catch (Exception e) {
            log.warn("Attempt {} on {} failed: {}", number, tier, e.getMessage());
            outcome = "failed";
            attempt = Attempt.failed(number, tier, model,
                    e.getClass().getSimpleName() + ": " + e.getMessage(),
                    Duration.between(started, clock.instant()), clock.instant());
        }

        meterRegistry.counter("codesmith.attempts",
                "tier", tier.name().toLowerCase(),
                "outcome", outcome).increment();
        meterRegistry.timer("codesmith.attempt.duration", "tier", tier.name().toLowerCase())
                .record(attempt.duration());
        return attempt;
    }

    /**
     * Ask about ambiguities in the task before the first attempt.
     *
     * @return a terminal result if the job cannot continue without an answer
     */
    private Optional<JobResult> clarify(Job job, Map<String, String> clarifications) {
        if (maxQuestions <= 0) {
            return Optional.empty();
        }
        List<Ambiguity> ambiguities;
        try {
            ambiguities = ambiguityDetector.detect(job.getTask(), job.getLanguage());
        } catch (Exception e) {
            log.warn("Ambiguity detection failed, continuing without questions: {}", e.getMessage());
            return Optional.empty();
        }

        for (Ambiguity ambiguity : ambiguities.stream().limit(maxQuestions).toList()) {
            ConversationGate.Outcome outcome = gate.ask(job, ambiguity);
            switch (outcome.kind()) {
                case ANSWERED, DEFAULTED -> clarifications.put(ambiguity.question(), outcome.answer().text());
                case CANCELLED -> throw new JobCancelledException();
                case TIMED_OUT -> {
                    return Optional.of(new JobResult(TerminalReason.NO_ANSWER,
                            "no answer to: " + ambiguity.question(), null));
                }
            }
        }
        return Optional.empty();
    }

    private void finish(Job job, JobResult result) {
        if (!job.finish(result)) {
            log.debug("Job {} was already {}, dropping result {}", job.getId(), job.getStatus(), result.reason());
            return;
        }
        meterRegistry.counter("codesmith.jobs.finished",
                "status", result.status().name().toLowerCase(),
                "reason", result.reason().name().toLowerCase()).increment();
        if (result.status() == JobStatus.COMPLETED) {
            log.info("Job {} COMPLETED after {} attempts: {} (score {})",
                    job.getId(), job.getHistory().size(), result.message(), result.score());
        } else {
            log.warn("Job {} {} after {} attempts: {} (best score {})",
                    job.getId(), result.status(), job.getHistory().size(), result.message(), result.score());
        }
    }
}
