package com.simforge.orchestrator.stage;

import com.simforge.orchestrator.model.Plan;

/**
 * Input of the planning stage.
 *
 * For the initial attempt only {@code request} is set; during refinement the
 * plan of the best attempt so far and the feedback derived from its quality
 * issues are added.
 */
public record PlanningInput(String request, Plan previousPlan, String feedback) {

    public static PlanningInput initial(String request) {
        return new PlanningInput(request, null, null);
    }

    public static PlanningInput refinement(String request, Plan previousPlan, String feedback) {
        return new PlanningInput(request, previousPlan, feedback);
    }

    public boolean isRefinement() {
        return previousPlan != null;
    }
}
