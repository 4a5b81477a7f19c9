package com.taskflow.engine.step;

import com.taskflow.core.exception.StepExecutionException;
import com.taskflow.core.model.Notification;
import com.taskflow.core.model.WorkflowStep;
import com.taskflow.core.repository.NotificationRepository;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Requests approval from the step's approvers.
 *
 * The step suspends until a decision is submitted to the orchestrator, unless its
 * configuration sets {@code auto_approve}, in which case it approves immediately on
 * behalf of the first approver.
 */
public class ApprovalStepHandler implements StepHandler {

    public static final String NO_APPROVERS = "NO_APPROVERS";

    private final NotificationRepository notificationRepository;

    public ApprovalStepHandler(NotificationRepository notificationRepository) {
        this.notificationRepository = notificationRepository;
    }

    @Override
    public StepOutput execute(StepContext context) {
        WorkflowStep step = context.step();
        List<UUID> approvers = step.approverIds();
        if (approvers.isEmpty()) {
            throw StepExecutionException.permanent(NO_APPROVERS,
                "Approval step '" + step.name() + "' has no approvers");
        }

        for (UUID approver : approvers) {
            notificationRepository.create(Notification.create(
                approver,
                Notification.TYPE_APPROVAL,
                "Approval required: " + step.name(),
                step.description() != null ? step.description() : "A workflow step is waiting for your approval",
                Map.of(
                    "execution_id", String.valueOf(context.executionId()),
                    "step_id", step.id().toString()
                )
            ));
        }

        List<String> approverIds = approvers.stream().map(UUID::toString).toList();
        if (step.config().bool("auto_approve").orElse(false)) {
            return StepOutput.completed(Map.of(
                "approved", true,
                "approved_by", approverIds.get(0),
                "approved_at", Instant.now().toString(),
                "approvers", approverIds
            ));
        }
        return StepOutput.waitingFor(approvers.get(0), Map.of("approvers", approverIds));
    }
}
