package com.simforge.orchestrator.stage.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.simforge.orchestrator.error.FailureKind;
import com.simforge.orchestrator.error.StageException;
import com.simforge.orchestrator.generative.GenerativeService;
import com.simforge.orchestrator.generative.GenerativeServiceException;
import com.simforge.orchestrator.generative.PromptContext;
import com.simforge.orchestrator.model.Plan;
import com.simforge.orchestrator.model.StageName;
import com.simforge.orchestrator.stage.CallDeadline;
import com.simforge.orchestrator.stage.PlanningInput;
import com.simforge.orchestrator.stage.Stage;
import com.simforge.orchestrator.stage.StageContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.time.Duration;

/**
 * Turns a free-text request (or a previous plan plus quality feedback) into a
 * validated {@link Plan} by calling the generative service.
 */
public class PlanningStage implements Stage<PlanningInput, Plan> {

    private static final Logger log = LoggerFactory.getLogger(PlanningStage.class);

    private final GenerativeService generative;
    private final CallDeadline      deadline;
    private final Duration          timeout;
    private final ObjectMapper      objectMapper;
    private final JsonNode          toolSchema;

    public PlanningStage(GenerativeService generative, CallDeadline deadline,
                         Duration timeout, ObjectMapper objectMapper) {
        this.generative   = generative;
        this.deadline     = deadline;
        this.timeout      = timeout;
        this.objectMapper = objectMapper;
        try {
            this.toolSchema = objectMapper.readTree(PlanningPrompts.TOOL_SCHEMA);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Planning tool schema is not valid JSON", e);
        }
    }

    @Override
    public StageName name() {
        return StageName.PLAN;
    }

    @Override
    public Plan execute(PlanningInput input, StageContext ctx) {
        PromptContext prompt = new PromptContext(
                PlanningPrompts.SYSTEM,
                buildPrompt(input),
                PlanningPrompts.TOOL_NAME,
                PlanningPrompts.TOOL_DESCRIPTION,
                toolSchema);

        JsonNode output;
        try {
            output = deadline.call("Planning call", timeout, () -> generative.generate(prompt));
        } catch (GenerativeServiceException e) {
            FailureKind kind = e.timedOut() ? FailureKind.TIMEOUT : FailureKind.PLANNING_FAILURE;
            throw new StageException(kind, "Generative service failed: " + e.getMessage(), e);
        }

        Plan plan = PlanParser.parse(output, input.request());
        log.info("Plan created: {} with {} entity group(s), {} frames{}",
                plan.simulationType().wireValue(), plan.entities().size(), plan.durationFrames(),
                input.isRefinement() ? " (refined)" : "");
        return plan;
    }

    private String buildPrompt(PlanningInput input) {
        if (!input.isRefinement()) {
            return PlanningPrompts.INITIAL.replace("{{REQUEST}}", input.request());
        }
        String previous;
        try {
            previous = objectMapper.writerWithDefaultPrettyPrinter()
                    .writeValueAsString(PlanParser.toToolInput(input.previousPlan()));
        } catch (JsonProcessingException e) {
            throw new StageException(FailureKind.PLANNING_FAILURE, "Could not serialise previous plan", e);
        }
        String feedback = input.feedback() == null || input.feedback().isBlank()
                ? "(no specific issues reported)" : input.feedback();
        return PlanningPrompts.REFINEMENT
                .replace("{{REQUEST}}", input.request())
                .replace("{{PLAN}}", previous)
                .replace("{{FEEDBACK}}", feedback);
    }
}
