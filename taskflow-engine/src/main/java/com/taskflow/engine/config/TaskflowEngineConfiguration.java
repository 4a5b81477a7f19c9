package com.taskflow.engine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.taskflow.core.event.EventPublisher;
import com.taskflow.core.repository.*;
import com.taskflow.engine.action.*;
import com.taskflow.engine.condition.ConditionEvaluator;
import com.taskflow.engine.condition.DefaultConditionEvaluator;
import com.taskflow.engine.coordinator.*;
import com.taskflow.engine.event.LoggingEventPublisher;
import com.taskflow.engine.health.TaskflowHealthIndicator;
import com.taskflow.engine.lifecycle.GracefulShutdownHandler;
import com.taskflow.engine.metrics.MetricsConfiguration;
import com.taskflow.engine.metrics.WorkflowMetrics;
import com.taskflow.engine.persistence.*;
import com.taskflow.engine.service.WorkflowService;
import com.taskflow.engine.step.StepRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

/**
 * Wires the workflow engine.
 *
 * Every collaborator the engine talks to (stores, event publisher, email, webhooks) has an
 * in-process default that an application replaces by declaring its own bean.
 */
@AutoConfiguration
@EnableConfigurationProperties(EngineProperties.class)
@ConditionalOnProperty(prefix = "taskflow.engine", name = "enabled", havingValue = "true", matchIfMissing = true)
@Import(MetricsConfiguration.class)
public class TaskflowEngineConfiguration {

    private static final Logger log = LoggerFactory.getLogger(TaskflowEngineConfiguration.class);

    // ========== Stores ==========

    @Bean
    @ConditionalOnMissingBean
    public WorkflowRepository workflowRepository() {
        return new InMemoryWorkflowRepository();
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkflowExecutionRepository workflowExecutionRepository() {
        return new InMemoryWorkflowExecutionRepository();
    }

    @Bean
    @ConditionalOnMissingBean
    public StepExecutionRepository stepExecutionRepository() {
        return new InMemoryStepExecutionRepository();
    }

    @Bean
    @ConditionalOnMissingBean
    public TaskRepository taskRepository() {
        log.info("No TaskRepository provided, using in-memory task store");
        return new InMemoryTaskRepository();
    }

    @Bean
    @ConditionalOnMissingBean
    public NotificationRepository notificationRepository() {
        log.info("No NotificationRepository provided, using in-memory notification store");
        return new InMemoryNotificationRepository();
    }

    // ========== Collaborators ==========

    @Bean
    @ConditionalOnMissingBean
    public EventPublisher eventPublisher(ObjectProvider<ObjectMapper> objectMapper) {
        return new LoggingEventPublisher(objectMapper.getIfAvailable(TaskflowEngineConfiguration::defaultObjectMapper));
    }

    @Bean
    @ConditionalOnMissingBean
    public EmailSender emailSender() {
        return new LoggingEmailSender();
    }

    @Bean
    @ConditionalOnMissingBean
    public WebhookClient webhookClient(ObjectProvider<ObjectMapper> objectMapper) {
        return new HttpWebhookClient(objectMapper.getIfAvailable(TaskflowEngineConfiguration::defaultObjectMapper));
    }

    // ========== Engine ==========

    @Bean
    @ConditionalOnMissingBean
    public ConditionEvaluator conditionEvaluator() {
        return new DefaultConditionEvaluator();
    }

    @Bean
    @ConditionalOnMissingBean
    public ActionDispatcher actionDispatcher(
            TaskRepository taskRepository,
            NotificationRepository notificationRepository,
            EmailSender emailSender,
            WebhookClient webhookClient,
            ConditionEvaluator conditionEvaluator) {
        return DefaultActionDispatcher.standard(
            taskRepository, notificationRepository, emailSender, webhookClient, conditionEvaluator);
    }

    @Bean
    @ConditionalOnMissingBean
    public StepRunner stepRunner(
            StepExecutionRepository stepExecutionRepository,
            ConditionEvaluator conditionEvaluator,
            ActionDispatcher actionDispatcher,
            TaskRepository taskRepository,
            NotificationRepository notificationRepository,
            EngineProperties properties) {
        return StepRunner.standard(stepExecutionRepository, conditionEvaluator, actionDispatcher,
            taskRepository, notificationRepository, properties.maxRetryAttempts());
    }

    @Bean
    @ConditionalOnMissingBean
    public ExecutionSupervisor executionSupervisor(EngineProperties properties) {
        log.info("Creating execution supervisor with {} execution threads and {} step threads",
            properties.executionThreads(), properties.stepThreads());
        return new ExecutionSupervisor(properties.executionThreads(), properties.stepThreads());
    }

    @Bean
    @ConditionalOnMissingBean
    public ExecutionReporter executionReporter(
            EventPublisher eventPublisher,
            NotificationRepository notificationRepository,
            WorkflowMetrics workflowMetrics) {
        return new ExecutionReporter(eventPublisher, notificationRepository, workflowMetrics);
    }

    @Bean
    @ConditionalOnMissingBean
    public ExecutionDriver executionDriver(
            WorkflowExecutionRepository executionRepository,
            StepRunner stepRunner,
            ExecutionReporter executionReporter,
            WorkflowMetrics workflowMetrics,
            ExecutionSupervisor executionSupervisor) {
        return new ExecutionDriver(executionRepository, stepRunner, executionReporter,
            workflowMetrics, executionSupervisor.stepPool());
    }

    @Bean
    @ConditionalOnMissingBean(WorkflowService.class)
    public WorkflowOrchestrator workflowOrchestrator(
            WorkflowRepository workflowRepository,
            WorkflowExecutionRepository executionRepository,
            StepExecutionRepository stepExecutionRepository,
            ExecutionSupervisor executionSupervisor,
            ExecutionDriver executionDriver,
            ExecutionReporter executionReporter) {
        return new WorkflowOrchestrator(workflowRepository, executionRepository, stepExecutionRepository,
            executionSupervisor, executionDriver, executionReporter);
    }

    @Bean
    @ConditionalOnMissingBean
    public TriggerDispatcher triggerDispatcher(
            WorkflowRepository workflowRepository,
            ConditionEvaluator conditionEvaluator,
            WorkflowService workflowService) {
        return new TriggerDispatcher(workflowRepository, conditionEvaluator, workflowService);
    }

    // ========== Operations ==========

    @Bean
    @ConditionalOnMissingBean
    public GracefulShutdownHandler gracefulShutdownHandler(
            ExecutionSupervisor executionSupervisor,
            EngineProperties properties) {
        return new GracefulShutdownHandler(executionSupervisor, properties.shutdownTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public TaskflowHealthIndicator taskflowHealthIndicator(
            ExecutionSupervisor executionSupervisor,
            WorkflowExecutionRepository executionRepository,
            StepExecutionRepository stepExecutionRepository) {
        return new TaskflowHealthIndicator(executionSupervisor, executionRepository, stepExecutionRepository);
    }

    static ObjectMapper defaultObjectMapper() {
        return new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }
}
