package com.example.backupscheduler.service.scheduler;

import com.example.backupscheduler.exception.ExternalCollaboratorException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CollaboratorCalls Tests")
class CollaboratorCallsTest {

    private ExecutorService executor;
    private CollaboratorCalls collaboratorCalls;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
        collaboratorCalls = new CollaboratorCalls(executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("Should return result of a fast call")
    void shouldReturnResult() {
        var result = collaboratorCalls.call("Server Manager", "status lookup", () -> true, Duration.ofSeconds(1));

        assertThat(result).isTrue();
    }

    @Test
    @DisplayName("Should rethrow runtime failures of the call unchanged")
    void shouldRethrowRuntimeFailures() {
        assertThatThrownBy(() -> collaboratorCalls.call("Backup Service", "create", () -> {
            throw new ExternalCollaboratorException("Backup Service", 503, "unavailable");
        }, Duration.ofSeconds(1)))
                .isInstanceOf(ExternalCollaboratorException.class)
                .hasMessageContaining("HTTP 503");
    }

    @Test
    @DisplayName("Should cancel a call that outlives its timeout")
    void shouldCancelSlowCall() throws InterruptedException {
        // Given
        var interrupted = new CountDownLatch(1);

        // When / Then
        assertThatThrownBy(() -> collaboratorCalls.call("Backup Service", "Backup creation for server srv-1", () -> {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
                Thread.currentThread().interrupt();
            }
            return "late";
        }, Duration.ofMillis(100)))
                .isInstanceOf(ExternalCollaboratorException.class)
                .hasMessageContaining("timed out");

        assertThat(interrupted.await(2, TimeUnit.SECONDS)).isTrue();
    }
}
