package com.taskflow.engine.action;

import com.taskflow.core.exception.ActionExecutionException;
import com.taskflow.core.exception.StepExecutionException;
import com.taskflow.core.exception.UnsupportedActionException;
import com.taskflow.core.model.*;
import com.taskflow.engine.condition.DefaultConditionEvaluator;
import com.taskflow.engine.persistence.InMemoryNotificationRepository;
import com.taskflow.engine.persistence.InMemoryTaskRepository;
import com.taskflow.engine.support.FakeWebhookClient;
import com.taskflow.engine.support.RecordingEmailSender;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

class DefaultActionDispatcherTest {

    private InMemoryTaskRepository taskRepository;
    private InMemoryNotificationRepository notificationRepository;
    private RecordingEmailSender emailSender;
    private FakeWebhookClient webhookClient;
    private DefaultActionDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        taskRepository = new InMemoryTaskRepository();
        notificationRepository = new InMemoryNotificationRepository();
        emailSender = new RecordingEmailSender();
        webhookClient = new FakeWebhookClient();
        dispatcher = DefaultActionDispatcher.standard(
            taskRepository, notificationRepository, emailSender, webhookClient, new DefaultConditionEvaluator());
    }

    private Map<String, Object> run(WorkflowAction action, Map<String, ?> variables) {
        return dispatcher.execute(action, ActionContext.standalone(VariableMap.of(variables)));
    }

    // ========== Registry ==========

    @Test
    @DisplayName("The standard dispatcher supports every action type")
    void supportsEveryType() {
        assertThat(dispatcher.supportedActions()).containsExactlyInAnyOrder(ActionType.values());
    }

    @Test
    @DisplayName("A type without a handler is rejected without retry")
    void unsupportedType() {
        DefaultActionDispatcher empty = new DefaultActionDispatcher(List.of(new DelayActionHandler()));

        assertThat(empty.supports(ActionType.WEBHOOK)).isFalse();
        assertThatThrownBy(() -> empty.execute(WorkflowAction.of(ActionType.WEBHOOK, "http://x", Map.of()),
                ActionContext.standalone(VariableMap.empty())))
            .isInstanceOf(UnsupportedActionException.class)
            .satisfies(e -> assertThat(((StepExecutionException) e).isRetryable()).isFalse());
    }

    @Test
    @DisplayName("Registering two handlers for one type fails")
    void duplicateHandler() {
        assertThatThrownBy(() -> new DefaultActionDispatcher(List.of(new DelayActionHandler(), new DelayActionHandler())))
            .isInstanceOf(IllegalArgumentException.class);
    }

    // ========== Tasks ==========

    @Test
    @DisplayName("create_task stores a task built from resolved parameters")
    void createTask() {
        UUID assignee = UUID.randomUUID();
        Map<String, Object> output = run(WorkflowAction.of(ActionType.CREATE_TASK, Map.of(
            "title", "Review {{doc}}",
            "priority", "high",
            "assignee_id", assignee.toString())), Map.of("doc", "contract"));

        Task task = taskRepository.findById(UUID.fromString((String) output.get("task_id"))).orElseThrow();
        assertThat(task.title()).isEqualTo("Review contract");
        assertThat(task.priority()).isEqualTo("high");
        assertThat(task.assigneeId()).isEqualTo(assignee);
        assertThat(output).containsEntry("task_title", "Review contract");
    }

    @Test
    @DisplayName("create_task without a title is a permanent failure")
    void createTaskWithoutTitle() {
        assertThatThrownBy(() -> run(WorkflowAction.of(ActionType.CREATE_TASK, Map.of()), Map.of()))
            .isInstanceOf(ActionExecutionException.class)
            .hasMessageContaining("title")
            .satisfies(e -> assertThat(((ActionExecutionException) e).isRetryable()).isFalse());
    }

    @Test
    @DisplayName("assign_task finds the task through the task_id variable")
    void assignTask() {
        Task task = taskRepository.create(Task.create("t", null, null, null, null, null, null, Map.of()));
        UUID assignee = UUID.randomUUID();

        Map<String, Object> output = run(
            WorkflowAction.of(ActionType.ASSIGN_TASK, Map.of("assignee_id", assignee.toString())),
            Map.of("task_id", task.id().toString()));

        assertThat(output).containsEntry("assigned_to", assignee.toString());
        assertThat(taskRepository.findById(task.id()).orElseThrow().assigneeId()).isEqualTo(assignee);
    }

    // ========== Messaging ==========

    @Test
    @DisplayName("send_notification notifies every listed user")
    void sendNotification() {
        UUID first = UUID.randomUUID();
        UUID second = UUID.randomUUID();

        Map<String, Object> output = run(WorkflowAction.of(ActionType.SEND_NOTIFICATION,
            first + "," + second, Map.of("message", "Hello {{name}}")), Map.of("name", "Bo"));

        assertThat(output).containsEntry("notifications_sent", 2);
        assertThat(notificationRepository.findByUser(first))
            .singleElement()
            .satisfies(n -> assertThat(n.message()).isEqualTo("Hello Bo"));
        assertThat(notificationRepository.findByUser(second)).hasSize(1);
    }

    @Test
    @DisplayName("send_email hands the resolved message to the sender")
    void sendEmail() {
        run(WorkflowAction.of(ActionType.SEND_EMAIL, "{{email}}",
            Map.of("subject", "Order {{order}}", "body", "Shipped")), Map.of("email", "a@b.c", "order", 42));

        assertThat(emailSender.sent())
            .singleElement()
            .isEqualTo(new RecordingEmailSender.SentEmail("a@b.c", "Order 42", "Shipped"));
    }

    @Test
    @DisplayName("A missing template variable is a permanent failure")
    void missingVariableIsPermanent() {
        assertThatThrownBy(() -> run(WorkflowAction.of(ActionType.SEND_EMAIL, "{{email}}", Map.of()), Map.of()))
            .isInstanceOf(ActionExecutionException.class)
            .hasMessageContaining("email")
            .satisfies(e -> assertThat(((ActionExecutionException) e).isRetryable()).isFalse());
        assertThat(emailSender.sent()).isEmpty();
    }

    // ========== HTTP ==========

    @Test
    @DisplayName("webhook posts to the target and returns the response")
    void webhookSuccess() {
        webhookClient.respondWith(201, "{\"id\":1}");

        Map<String, Object> output = run(WorkflowAction.of(ActionType.WEBHOOK, "https://hooks.example.com/{{path}}",
            Map.of("body", Map.of("amount", "{{amount}}"))), Map.of("path", "orders", "amount", 10));

        assertThat(output).containsEntry("status_code", 201).containsEntry("response_body", "{\"id\":1}");
        assertThat(webhookClient.requests()).singleElement().satisfies(request -> {
            assertThat(request.method()).isEqualTo("POST");
            assertThat(request.uri().toString()).isEqualTo("https://hooks.example.com/orders");
            assertThat(request.body()).isEqualTo(Map.of("amount", 10));
        });
    }

    @Test
    @DisplayName("api defaults to GET")
    void apiDefaultsToGet() {
        run(WorkflowAction.of(ActionType.API, "https://api.example.com/status", Map.of()), Map.of());

        assertThat(webhookClient.requests()).singleElement()
            .satisfies(request -> assertThat(request.method()).isEqualTo("GET"));
    }

    @Test
    @DisplayName("Server errors are retryable, client errors are not")
    void httpErrorClassification() {
        WorkflowAction action = WorkflowAction.of(ActionType.WEBHOOK, "https://hooks.example.com", Map.of());

        webhookClient.respondWith(503, "busy");
        assertThatThrownBy(() -> run(action, Map.of()))
            .isInstanceOf(ActionExecutionException.class)
            .hasMessageContaining("503")
            .satisfies(e -> assertThat(((ActionExecutionException) e).isRetryable()).isTrue());

        webhookClient.respondWith(404, "missing");
        assertThatThrownBy(() -> run(action, Map.of()))
            .isInstanceOf(ActionExecutionException.class)
            .satisfies(e -> assertThat(((ActionExecutionException) e).isRetryable()).isFalse());
    }

    @Test
    @DisplayName("Transport failures are retryable")
    void transportFailure() {
        webhookClient.failWith(new UncheckedIOException(new IOException("connection refused")));

        assertThatThrownBy(() -> run(WorkflowAction.of(ActionType.WEBHOOK, "https://hooks.example.com", Map.of()),
                Map.of()))
            .isInstanceOf(ActionExecutionException.class)
            .satisfies(e -> assertThat(((ActionExecutionException) e).isRetryable()).isTrue());
    }

    @Test
    @DisplayName("webhook without a target fails without retry")
    void webhookWithoutTarget() {
        assertThatThrownBy(() -> run(WorkflowAction.of(ActionType.WEBHOOK, Map.of()), Map.of()))
            .isInstanceOf(ActionExecutionException.class)
            .satisfies(e -> assertThat(((ActionExecutionException) e).isRetryable()).isFalse());
        assertThat(webhookClient.requests()).isEmpty();
    }

    // ========== Script and delay ==========

    @Test
    @DisplayName("script evaluates a condition against the variables")
    void script() {
        Map<String, Object> output = run(WorkflowAction.of(ActionType.SCRIPT, "is_large",
            Map.of("field", "amount", "operator", "greater_than", "value", 1000)), Map.of("amount", 1500));

        assertThat(output).containsEntry("is_large", true);
    }

    @Test
    @DisplayName("delay of zero returns immediately")
    void zeroDelay() {
        Map<String, Object> output = run(WorkflowAction.of(ActionType.DELAY, Map.of()), Map.of());

        assertThat(output).containsKey("delayed");
    }
}
