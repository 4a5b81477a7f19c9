package com.taskflow.engine.action;

import com.taskflow.core.exception.ActionExecutionException;
import com.taskflow.core.exception.ExecutionCancelledException;
import com.taskflow.core.exception.StepExecutionException;
import com.taskflow.core.exception.TaskflowException;
import com.taskflow.core.exception.UnsupportedActionException;
import com.taskflow.core.model.ActionType;
import com.taskflow.core.model.WorkflowAction;
import com.taskflow.core.repository.NotificationRepository;
import com.taskflow.core.repository.TaskRepository;
import com.taskflow.engine.condition.ConditionEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Registry of action handlers keyed by action type.
 * An action type without a handler is a configuration error and fails immediately.
 */
public class DefaultActionDispatcher implements ActionDispatcher {

    private static final Logger log = LoggerFactory.getLogger(DefaultActionDispatcher.class);

    private final Map<ActionType, ActionHandler> handlers = new EnumMap<>(ActionType.class);

    public DefaultActionDispatcher(List<? extends ActionHandler> handlers) {
        for (ActionHandler handler : handlers) {
            ActionHandler previous = this.handlers.put(handler.type(), handler);
            if (previous != null) {
                throw new IllegalArgumentException("Duplicate handler for action type " + handler.type().value());
            }
        }
        log.info("Registered action handlers: {}", this.handlers.keySet());
    }

    /**
     * Dispatcher with a handler for every action type, wired to the given collaborators.
     */
    public static DefaultActionDispatcher standard(
            TaskRepository taskRepository,
            NotificationRepository notificationRepository,
            EmailSender emailSender,
            WebhookClient webhookClient,
            ConditionEvaluator conditionEvaluator) {
        return new DefaultActionDispatcher(List.of(
            new CreateTaskActionHandler(taskRepository),
            new UpdateTaskActionHandler(taskRepository),
            new AssignTaskActionHandler(taskRepository),
            new SendNotificationActionHandler(notificationRepository),
            new SendEmailActionHandler(emailSender),
            new WebhookActionHandler(ActionType.WEBHOOK, "POST", webhookClient),
            new WebhookActionHandler(ActionType.API, "GET", webhookClient),
            new ScriptActionHandler(conditionEvaluator),
            new ApprovalActionHandler(notificationRepository),
            new DelayActionHandler()
        ));
    }

    @Override
    public boolean supports(ActionType type) {
        return handlers.containsKey(type);
    }

    @Override
    public Set<ActionType> supportedActions() {
        return Collections.unmodifiableSet(handlers.keySet());
    }

    @Override
    public Map<String, Object> execute(WorkflowAction action, ActionContext context) {
        ActionHandler handler = handlers.get(action.type());
        if (handler == null) {
            throw new UnsupportedActionException(action.type());
        }

        log.debug("Executing action {} target={}", action.type().value(), action.target());
        try {
            WorkflowAction resolved = new VariableResolver(context.variables()).resolve(action);
            Map<String, Object> output = handler.execute(resolved, context);
            return output != null ? output : Map.of();
        } catch (StepExecutionException | ExecutionCancelledException e) {
            throw e;
        } catch (TaskflowException e) {
            // Deterministic failures such as missing variables or wrong parameter types
            throw new ActionExecutionException(action.type(), e.getMessage(), e, false);
        } catch (RuntimeException e) {
            throw new ActionExecutionException(action.type(), e.getMessage(), e, true);
        }
    }
}
