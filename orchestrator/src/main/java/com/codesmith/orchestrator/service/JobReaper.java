package com.codesmith.orchestrator.service;

import com.codesmith.orchestrator.config.CodesmithProperties;
import com.codesmith.orchestrator.engine.JobRegistry;
import com.codesmith.orchestrator.model.ConversationState;
import com.codesmith.orchestrator.model.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Periodic cleanup of finished jobs.
 *
 * Two passes per tick:
 *   - terminal jobs older than the retention period leave the registry
 *     (skipped when retention is zero)
 *   - terminal jobs whose conversation has been idle past the idle timeout
 *     drop their conversation state
 *
 * Running jobs are never touched.
 */
@Component
public class JobReaper {

    private static final Logger log = LoggerFactory.getLogger(JobReaper.class);

    private final JobRegistry registry;
    private final Duration    retention;
    private final Duration    idleTimeout;
    private final Clock       clock;

    public JobReaper(JobRegistry registry, CodesmithProperties properties, Clock clock) {
        this.registry    = registry;
        this.retention   = properties.getJobs().getRetention();
        this.idleTimeout = properties.getConversation().getIdleTimeout();
        this.clock       = clock;
    }

    @Scheduled(fixedDelayString = "${codesmith.jobs.reap-interval-ms:60000}")
    public void reap() {
        Instant now = clock.instant();

        if (!retention.isZero() && !retention.isNegative()) {
            int evicted = registry.evictFinishedBefore(now.minus(retention));
            if (evicted > 0) {
                log.info("Evicted {} finished jobs older than {}", evicted, retention);
            }
        }

        Instant idleCutoff = now.minus(idleTimeout);
        for (Job job : registry.all()) {
            if (!job.getStatus().isTerminal()) continue;
            Optional<ConversationState> conversation = job.existingConversation();
            if (conversation.isPresent() && conversation.get().lastActivity().isBefore(idleCutoff)) {
                job.clearConversation();
                log.debug("Dropped idle conversation of job {}", job.getId());
            }
        }
    }
}
