package com.codesmith.orchestrator.api;

import com.codesmith.orchestrator.api.dto.AnswerRequest;
import com.codesmith.orchestrator.api.dto.AttemptResponse;
import com.codesmith.orchestrator.api.dto.FeedbackRequest;
import com.codesmith.orchestrator.api.dto.JobResponse;
import com.codesmith.orchestrator.api.dto.QuestionResponse;
import com.codesmith.orchestrator.api.dto.StartJobRequest;
import com.codesmith.orchestrator.model.ConversationState.AnswerOutcome;
import com.codesmith.orchestrator.model.JobSnapshot;
import com.codesmith.orchestrator.service.JobService;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.UUID;

/**
 * REST API for the job lifecycle.
 *
 * POST   /jobs                                  start a job
 * GET    /jobs                                  list jobs, oldest first
 * GET    /jobs/{id}                             poll status and progress
 * GET    /jobs/{id}/attempts                    attempt history with artifacts
 * POST   /jobs/{id}/cancel                      request cancellation
 * DELETE /jobs/{id}                             remove a finished job
 * GET    /jobs/{id}/questions                   clarifying questions, pending and answered
 * POST   /jobs/{id}/questions/{qid}/answer      answer a question
 * POST   /jobs/{id}/feedback                    guidance for later attempts
 * GET    /jobs/{id}/report                      markdown report
 */
@RestController
@RequestMapping("/jobs")
public class JobController {

    private final JobService jobService;

    public JobController(JobService jobService) {
        this.jobService = jobService;
    }

    /**
     * Start a new job.
     *
     * Example:
     *   curl -X POST http://localhost:8080/jobs \
     *     -H "Content-Type: application/json" \
     *     -d '{"task":"Add a REST endpoint that returns the server time","language":"java"}'
     */
    @PostMapping
    public ResponseEntity<JobResponse> start(@RequestBody StartJobRequest req) {
        try {
            JobSnapshot job = jobService.startJob(req.task(), req.language(), req.maxIterations());
            return ResponseEntity.status(HttpStatus.CREATED).body(JobResponse.from(job));
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
        } catch (IllegalStateException e) {
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage());
        }
    }

    @GetMapping
    public List<JobResponse> list() {
        return jobService.listJobs().stream().map(JobResponse::from).toList();
    }

    @GetMapping("/{id}")
    public JobResponse get(@PathVariable UUID id) {
        return JobResponse.from(snapshot(id));
    }

    @GetMapping("/{id}/attempts")
    public List<AttemptResponse> attempts(@PathVariable UUID id) {
        return snapshot(id).attempts().stream().map(AttemptResponse::from).toList();
    }

    /**
     * Cancellation is cooperative: a running job stops at its next
     * suspension point, so the returned status may still be RUNNING.
     */
    @PostMapping("/{id}/cancel")
    public ResponseEntity<JobResponse> cancel(@PathVariable UUID id) {
        if (!jobService.cancelJob(id)) {
            throw notFound(id);
        }
        return ResponseEntity.accepted().body(JobResponse.from(snapshot(id)));
    }

    /**
     * HTTP 204 - removed
     * HTTP 404 - job ID not found
     * HTTP 409 - job has not finished; cancel it first
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable UUID id) {
        try {
            jobService.cleanup(id).orElseThrow(() -> notFound(id));
            return ResponseEntity.noContent().build();
        } catch (IllegalStateException e) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, e.getMessage());
        }
    }

    // ------------------------------------------------------------------
    // Conversation
    // ------------------------------------------------------------------

    @GetMapping("/{id}/questions")
    public List<QuestionResponse> questions(@PathVariable UUID id) {
        return snapshot(id).questions().stream().map(QuestionResponse::from).toList();
    }

    /**
     * HTTP 200 - answer accepted
     * HTTP 404 - unknown job or question
     * HTTP 409 - question was already answered (by the user or by its default) or has expired
     */
    @PostMapping("/{id}/questions/{questionId}/answer")
    public ResponseEntity<Void> answer(@PathVariable UUID id,
                                       @PathVariable String questionId,
                                       @RequestBody AnswerRequest req) {
        AnswerOutcome outcome;
        try {
            outcome = jobService.submitAnswer(id, questionId, req.answer()).orElseThrow(() -> notFound(id));
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
        }
        return switch (outcome) {
            case ACCEPTED -> ResponseEntity.ok().build();
            case IGNORED -> throw new ResponseStatusException(HttpStatus.CONFLICT,
                    "Question " + questionId + " is already answered");
            case EXPIRED -> throw new ResponseStatusException(HttpStatus.CONFLICT,
                    "Question " + questionId + " expired without an answer");
            case UNKNOWN_QUESTION -> throw new ResponseStatusException(HttpStatus.NOT_FOUND,
                    "Question not found: " + questionId);
        };
    }

    @PostMapping("/{id}/feedback")
    public ResponseEntity<Void> feedback(@PathVariable UUID id, @RequestBody FeedbackRequest req) {
        boolean found;
        try {
            found = jobService.submitFeedback(id, req.message());
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
        }
        if (!found) {
            throw notFound(id);
        }
        return ResponseEntity.accepted().build();
    }

    // ------------------------------------------------------------------
    // Report
    // ------------------------------------------------------------------

    /**
     * HTTP 200 - job is finished, report is final
     * HTTP 202 - job is still running, report covers the attempts so far
     * HTTP 404 - job ID not found
     */
    @GetMapping(value = "/{id}/report", produces = MediaType.TEXT_MARKDOWN_VALUE)
    public ResponseEntity<String> report(@PathVariable UUID id) {
        JobSnapshot job = snapshot(id);
        String report = jobService.report(id).orElseThrow(() -> notFound(id));
        HttpStatus status = job.status().isTerminal() ? HttpStatus.OK : HttpStatus.ACCEPTED;
        return ResponseEntity.status(status).body(report);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private JobSnapshot snapshot(UUID id) {
        return jobService.getStatus(id).orElseThrow(() -> notFound(id));
    }

    private static ResponseStatusException notFound(UUID id) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, "Job not found: " + id);
    }
}
