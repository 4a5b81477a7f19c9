package com.taskflow.engine.action;

import com.taskflow.core.exception.ActionExecutionException;
import com.taskflow.core.model.ActionType;
import com.taskflow.core.model.VariableMap;
import com.taskflow.core.model.WorkflowAction;

import java.util.Map;

public class SendEmailActionHandler implements ActionHandler {

    private final EmailSender emailSender;

    public SendEmailActionHandler(EmailSender emailSender) {
        this.emailSender = emailSender;
    }

    @Override
    public ActionType type() {
        return ActionType.SEND_EMAIL;
    }

    @Override
    public Map<String, Object> execute(WorkflowAction action, ActionContext context) {
        VariableMap params = action.params();
        String to = action.hasTarget() ? action.target() : params.string("to").orElse(null);
        if (to == null || !to.contains("@")) {
            throw new ActionExecutionException(type(), "invalid recipient address '" + to + "'", false);
        }

        emailSender.send(to, params.string("subject").orElse(""), params.string("body").orElse(""));

        return Map.of(
            "email_sent", true,
            "email_to", to
        );
    }
}
