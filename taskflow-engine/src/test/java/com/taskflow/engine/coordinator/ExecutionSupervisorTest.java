package com.taskflow.engine.coordinator;

import com.taskflow.core.exception.ExecutionCancelledException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.await;

class ExecutionSupervisorTest {

    private final ExecutionSupervisor supervisor = new ExecutionSupervisor(2, 2);

    @AfterEach
    void tearDown() {
        supervisor.shutdown(Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("A finished run releases its handle")
    void handleReleased() {
        CountDownLatch release = new CountDownLatch(1);
        UUID executionId = UUID.randomUUID();

        supervisor.submit(executionId, token -> awaitQuietly(release));

        assertThat(supervisor.handle(executionId)).isPresent();
        release.countDown();
        await().atMost(Duration.ofSeconds(5)).until(() -> supervisor.handle(executionId).isEmpty());
        assertThat(supervisor.activeCount()).isZero();
    }

    @Test
    @DisplayName("cancel() signals the live run's token")
    void cancelSignalsToken() {
        UUID executionId = UUID.randomUUID();
        AtomicReference<String> observed = new AtomicReference<>();

        supervisor.submit(executionId, token -> {
            try {
                token.sleep(Duration.ofMinutes(1));
            } catch (ExecutionCancelledException e) {
                observed.set(token.reason());
            }
        });

        assertThat(supervisor.cancel(executionId, "user request")).isTrue();
        await().atMost(Duration.ofSeconds(5)).until(() -> observed.get() != null);
        assertThat(observed.get()).isEqualTo("user request");
        assertThat(supervisor.cancel(UUID.randomUUID(), "unknown")).isFalse();
    }

    @Test
    @DisplayName("Shutdown cancels live runs and refuses new ones")
    void shutdown() {
        UUID executionId = UUID.randomUUID();
        CountDownLatch started = new CountDownLatch(1);
        AtomicReference<String> observed = new AtomicReference<>();

        supervisor.submit(executionId, token -> {
            started.countDown();
            try {
                token.sleep(Duration.ofMinutes(1));
            } catch (ExecutionCancelledException e) {
                observed.set(token.reason());
            }
        });
        awaitQuietly(started);

        supervisor.shutdown(Duration.ofSeconds(5));

        assertThat(observed.get()).isEqualTo("engine shutdown");
        assertThat(supervisor.isAccepting()).isFalse();
        assertThatThrownBy(() -> supervisor.submit(UUID.randomUUID(), token -> { }))
            .isInstanceOf(IllegalStateException.class);
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
