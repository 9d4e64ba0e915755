package com.simforge.orchestrator.stage.impl;

import com.simforge.orchestrator.error.FailureKind;
import com.simforge.orchestrator.error.StageException;
import com.simforge.orchestrator.model.Artifact;
import com.simforge.orchestrator.model.StageName;
import com.simforge.orchestrator.model.ValidatedArtifact;
import com.simforge.orchestrator.model.ValidationOutcome;
import com.simforge.orchestrator.stage.Stage;
import com.simforge.orchestrator.stage.StageContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks an artifact before it is handed to the execution environment.
 *
 * The first attempt validates the script as generated. A retry validates the
 * auto-fixed script instead; if that still fails the failure is final.
 */
public class ArtifactValidationStage implements Stage<Artifact, ValidatedArtifact> {

    private static final Logger log = LoggerFactory.getLogger(ArtifactValidationStage.class);

    @Override
    public StageName name() {
        return StageName.VALIDATE_ARTIFACT;
    }

    @Override
    public ValidatedArtifact execute(Artifact artifact, StageContext ctx) {
        Artifact candidate = artifact;
        boolean fixed = false;
        if (ctx.isRetry()) {
            String script = ScriptValidator.autoFix(artifact.script());
            fixed = !script.equals(artifact.script());
            if (fixed) {
                candidate = artifact.withScript(script);
                log.info("Applied auto-fix to artifact before revalidation");
            }
        }

        ValidationOutcome outcome = ScriptValidator.validate(candidate.script(), fixed);
        if (!outcome.valid()) {
            throw new StageException(FailureKind.VALIDATION_FAILURE,
                    "Artifact failed validation: " + String.join("; ", outcome.issues()));
        }
        return new ValidatedArtifact(candidate, outcome);
    }
}
