package com.simforge.orchestrator.stage.impl;

import com.simforge.orchestrator.error.FailureKind;
import com.simforge.orchestrator.error.StageException;
import com.simforge.orchestrator.model.QualityMetrics;
import com.simforge.orchestrator.model.SceneInspection;
import com.simforge.orchestrator.model.StageName;
import com.simforge.orchestrator.stage.ScoringInput;
import com.simforge.orchestrator.stage.Stage;
import com.simforge.orchestrator.stage.StageContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Scores the scene inspected by the execution stage with {@link QualityScorer}. */
public class QualityScoringStage implements Stage<ScoringInput, QualityMetrics> {

    private static final Logger log = LoggerFactory.getLogger(QualityScoringStage.class);

    @Override
    public StageName name() {
        return StageName.SCORE_QUALITY;
    }

    @Override
    public QualityMetrics execute(ScoringInput input, StageContext ctx) {
        SceneInspection scene = input.execution().inspection();
        if (scene == null) {
            throw new StageException(FailureKind.EXECUTION_FAILURE,
                    "Execution record carries no scene inspection", input.execution().diagnostics(), null);
        }
        QualityMetrics metrics = QualityScorer.score(scene, input.plan().plan());
        log.info("Quality score {} ({} issue(s))", String.format("%.2f", metrics.score()), metrics.issues().size());
        return metrics;
    }
}
