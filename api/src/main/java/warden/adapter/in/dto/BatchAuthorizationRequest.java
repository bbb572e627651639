package warden.adapter.in.dto;

import java.util.List;

import warden.core.model.session.ExecutionStep;

/**
 * DTO for multi-step agent authorization requests.
 *
 * @param steps steps in execution order
 */
public record BatchAuthorizationRequest(List<AuthorizationRequest> steps) {

    public List<ExecutionStep> toSteps() {
        return steps.stream()
                .map(step -> new ExecutionStep(step.action(), step.amount()))
                .toList();
    }
}
