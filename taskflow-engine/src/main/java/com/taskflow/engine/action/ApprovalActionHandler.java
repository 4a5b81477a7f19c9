package com.taskflow.engine.action;

import com.taskflow.core.exception.ActionExecutionException;
import com.taskflow.core.model.ActionType;
import com.taskflow.core.model.Notification;
import com.taskflow.core.model.WorkflowAction;
import com.taskflow.core.repository.NotificationRepository;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Records an approval request by notifying {@code approver_ids}. The decision itself
 * belongs to approval steps.
 */
public class ApprovalActionHandler implements ActionHandler {

    private final NotificationRepository notificationRepository;

    public ApprovalActionHandler(NotificationRepository notificationRepository) {
        this.notificationRepository = notificationRepository;
    }

    @Override
    public ActionType type() {
        return ActionType.APPROVAL;
    }

    @Override
    public Map<String, Object> execute(WorkflowAction action, ActionContext context) {
        List<UUID> approvers = action.params().uuidList("approver_ids").orElse(List.of());
        if (approvers.isEmpty()) {
            throw new ActionExecutionException(type(), "parameter 'approver_ids' is required", false);
        }

        String message = action.params().string("message").orElse("Your approval is requested");
        for (UUID approver : approvers) {
            notificationRepository.create(Notification.create(approver, Notification.TYPE_APPROVAL,
                "Approval requested", message,
                Map.of("execution_id", String.valueOf(context.executionId()))));
        }

        return Map.of(
            "approval_requested", true,
            "approvers", approvers.stream().map(UUID::toString).toList()
        );
    }
}
