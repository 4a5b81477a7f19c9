package com.taskflow.engine.step;

import com.taskflow.core.model.Notification;
import com.taskflow.core.model.VariableMap;
import com.taskflow.core.model.WorkflowStep;
import com.taskflow.core.repository.NotificationRepository;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Sends one notification per configured recipient.
 * A recipient that is not a UUID fails the step through {@link VariableMap#uuidList(String)}.
 */
public class NotificationStepHandler implements StepHandler {

    private final NotificationRepository notificationRepository;

    public NotificationStepHandler(NotificationRepository notificationRepository) {
        this.notificationRepository = notificationRepository;
    }

    @Override
    public StepOutput execute(StepContext context) {
        WorkflowStep step = context.step();
        VariableMap config = step.config();
        String message = config.string("message").orElse(step.description());
        List<UUID> recipients = config.uuidList("recipients").orElse(List.of());

        for (UUID recipient : recipients) {
            notificationRepository.create(Notification.create(
                recipient,
                Notification.TYPE_WORKFLOW,
                config.string("title").orElse(step.name()),
                message,
                Map.of("execution_id", String.valueOf(context.executionId()))
            ));
        }
        return StepOutput.completed(Map.of("notifications_sent", recipients.size()));
    }
}
