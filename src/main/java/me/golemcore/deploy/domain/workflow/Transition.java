package me.golemcore.deploy.domain.workflow;

import me.golemcore.deploy.domain.model.Stage;

import java.util.EnumSet;
import java.util.Set;

/**
 * Legal stage edges of a deployment session. Any move not listed here is
 * rejected by {@link StageMachine}.
 */
public enum Transition {

    REQUIREMENTS_COMPLETE(Stage.CONTEXT_SYNC, Stage.INTAKE),
    CONTEXT_SUMMARISED(Stage.PREFLIGHT, Stage.CONTEXT_SYNC),
    PREFLIGHT_PASSED(Stage.PLAN_DRAFT, Stage.PREFLIGHT),
    PREFLIGHT_FAILED(Stage.FAILED, Stage.PREFLIGHT),
    PLAN_COMPOSED(Stage.COMPLIANCE_REVIEW, Stage.PLAN_DRAFT),
    COMPLIANCE_APPROVED(Stage.DRY_RUN, Stage.COMPLIANCE_REVIEW),
    COMPLIANCE_VETOED(Stage.PLAN_DRAFT, Stage.COMPLIANCE_REVIEW),
    DRY_RUN_PASSED(Stage.EXECUTION, Stage.DRY_RUN),
    DRY_RUN_FAILED(Stage.PLAN_DRAFT, Stage.DRY_RUN),
    DRY_RUN_VETOED(Stage.PLAN_DRAFT, Stage.DRY_RUN),
    EXECUTION_SUCCEEDED(Stage.VALIDATION, Stage.EXECUTION),
    EXECUTION_FAILED(Stage.ROLLBACK, Stage.EXECUTION),
    CANCEL_WITH_ROLLBACK(Stage.ROLLBACK, Stage.EXECUTION),
    VALIDATION_PASSED(Stage.CLOSURE, Stage.VALIDATION),
    VALIDATION_FAILED(Stage.FAILED, Stage.VALIDATION),
    ROLLBACK_COMPLETED(Stage.FAILED, Stage.ROLLBACK),
    CANCELLED(Stage.FAILED, Stage.INTAKE, Stage.CONTEXT_SYNC, Stage.PREFLIGHT, Stage.PLAN_DRAFT,
            Stage.COMPLIANCE_REVIEW, Stage.DRY_RUN, Stage.EXECUTION),
    NEW_INTENT(Stage.INTAKE, Stage.CLOSURE, Stage.FAILED);

    private final Stage target;
    private final Set<Stage> sources;

    Transition(Stage target, Stage first, Stage... rest) {
        this.target = target;
        this.sources = EnumSet.of(first, rest);
    }

    public Stage getTarget() {
        return target;
    }

    public boolean allowedFrom(Stage stage) {
        return sources.contains(stage);
    }
}
