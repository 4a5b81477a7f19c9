package com.taskflow.engine.action;

import com.taskflow.core.exception.ActionExecutionException;
import com.taskflow.core.model.ActionType;
import com.taskflow.core.model.Notification;
import com.taskflow.core.model.VariableMap;
import com.taskflow.core.model.WorkflowAction;
import com.taskflow.core.repository.NotificationRepository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Notifies the users named by the target (comma separated ids) or by the {@code user_ids} parameter.
 */
public class SendNotificationActionHandler implements ActionHandler {

    private final NotificationRepository notificationRepository;

    public SendNotificationActionHandler(NotificationRepository notificationRepository) {
        this.notificationRepository = notificationRepository;
    }

    @Override
    public ActionType type() {
        return ActionType.SEND_NOTIFICATION;
    }

    @Override
    public Map<String, Object> execute(WorkflowAction action, ActionContext context) {
        VariableMap params = action.params();
        List<UUID> recipients = recipients(action);
        if (recipients.isEmpty()) {
            throw new ActionExecutionException(type(), "no recipients given", false);
        }

        String title = params.string("title").orElse("Workflow notification");
        String message = params.string("message").orElse("");
        for (UUID userId : recipients) {
            notificationRepository.create(Notification.create(userId, Notification.TYPE_WORKFLOW, title, message,
                Map.of("execution_id", String.valueOf(context.executionId()))));
        }

        return Map.of("notifications_sent", recipients.size());
    }

    private List<UUID> recipients(WorkflowAction action) {
        if (!action.hasTarget()) {
            return action.params().uuidList("user_ids").orElse(List.of());
        }
        List<UUID> ids = new ArrayList<>();
        for (String part : action.target().split(",")) {
            if (part.isBlank()) {
                continue;
            }
            try {
                ids.add(UUID.fromString(part.trim()));
            } catch (IllegalArgumentException e) {
                throw new ActionExecutionException(type(), "invalid recipient id '" + part.trim() + "'", false);
            }
        }
        return ids;
    }
}
