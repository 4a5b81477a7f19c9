package com.taskflow.engine.health;

import com.taskflow.core.model.ExecutionStatus;
import com.taskflow.core.repository.StepExecutionRepository;
import com.taskflow.core.repository.WorkflowExecutionRepository;
import com.taskflow.engine.coordinator.ExecutionSupervisor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.util.HashMap;
import java.util.Map;

/**
 * Health indicator for the workflow engine.
 * Reports health status based on:
 * - Whether the supervisor still accepts executions
 * - Live runs
 * - Paused executions and steps waiting on a decision
 */
public class TaskflowHealthIndicator implements HealthIndicator {

    private static final int SAMPLE_LIMIT = 1000;

    private final ExecutionSupervisor supervisor;
    private final WorkflowExecutionRepository executionRepository;
    private final StepExecutionRepository stepExecutionRepository;

    public TaskflowHealthIndicator(
            ExecutionSupervisor supervisor,
            WorkflowExecutionRepository executionRepository,
            StepExecutionRepository stepExecutionRepository) {
        this.supervisor = supervisor;
        this.executionRepository = executionRepository;
        this.stepExecutionRepository = stepExecutionRepository;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new HashMap<>();
        details.put("activeExecutions", supervisor.activeCount());
        details.put("accepting", supervisor.isAccepting());

        if (!supervisor.isAccepting()) {
            return Health.outOfService()
                .withDetails(details)
                .build();
        }

        try {
            details.put("pausedExecutions",
                executionRepository.findByStatus(ExecutionStatus.PAUSED, SAMPLE_LIMIT).size());
            details.put("waitingSteps", stepExecutionRepository.findWaiting(SAMPLE_LIMIT).size());
        } catch (RuntimeException e) {
            return Health.down()
                .withException(e)
                .withDetails(details)
                .build();
        }

        return Health.up()
            .withDetails(details)
            .build();
    }
}
