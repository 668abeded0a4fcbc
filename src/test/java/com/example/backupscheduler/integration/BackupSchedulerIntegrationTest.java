package com.example.backupscheduler.integration;

import com.example.backupscheduler.TestClockConfiguration;
import com.example.backupscheduler.TestClockConfiguration.MutableClock;
import com.example.backupscheduler.client.AuditSink;
import com.example.backupscheduler.client.BackupCatalogClient;
import com.example.backupscheduler.client.ClientModels.BackupHandle;
import com.example.backupscheduler.client.ClientModels.BackupStatus;
import com.example.backupscheduler.client.ResourceStateClient;
import com.example.backupscheduler.domain.enums.ScheduleAction;
import com.example.backupscheduler.domain.repository.BackupScheduleRepository;
import com.example.backupscheduler.domain.repository.ScheduleEventRepository;
import com.example.backupscheduler.dto.CreateScheduleRequest;
import com.example.backupscheduler.service.scheduler.BackupSchedulerLoop;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.MOCK)
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Import(TestClockConfiguration.class)
@DisplayName("Backup Scheduler Integration Tests")
class BackupSchedulerIntegrationTest {

    private static final Instant START = Instant.parse("2024-05-01T00:00:00Z");
    private static final String BASE_URL = "/api/v1/backup-schedules/resources/";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private BackupScheduleRepository scheduleRepository;

    @Autowired
    private ScheduleEventRepository eventRepository;

    @Autowired
    private BackupSchedulerLoop schedulerLoop;

    @Autowired
    private MutableClock clock;

    @MockBean
    private ResourceStateClient resourceStateClient;

    @MockBean
    private BackupCatalogClient backupCatalogClient;

    @MockBean
    private AuditSink auditSink;

    @BeforeEach
    void setUp() {
        eventRepository.deleteAll();
        scheduleRepository.deleteAll();
        clock.set(START);
        when(resourceStateClient.resourceExists(anyString())).thenReturn(true);
    }

    private void createSchedule(String resourceId, CreateScheduleRequest request) throws Exception {
        mockMvc.perform(post(BASE_URL + resourceId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("X-User-Id", 42)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isCreated());
    }

    @Nested
    @DisplayName("Schedule API")
    class ScheduleApiTests {

        @Test
        @DisplayName("Should create schedule via API")
        void shouldCreateScheduleViaApi() throws Exception {
            var request = CreateScheduleRequest.builder().intervalHours(6).maxBackups(10).build();

            mockMvc.perform(post(BASE_URL + "srv-api-1")
                            .contentType(MediaType.APPLICATION_JSON)
                            .header("X-User-Id", 42)
                            .content(objectMapper.writeValueAsString(request)))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.success").value(true))
                    .andExpect(jsonPath("$.data.resourceId").value("srv-api-1"))
                    .andExpect(jsonPath("$.data.intervalHours").value(6))
                    .andExpect(jsonPath("$.data.maxBackups").value(10))
                    .andExpect(jsonPath("$.data.enabled").value(true))
                    .andExpect(jsonPath("$.data.onlyWhenActive").value(true))
                    .andExpect(jsonPath("$.data.id").isNotEmpty());

            var stored = scheduleRepository.findByResourceId("srv-api-1").orElseThrow();
            assertThat(stored.getNextTriggerAt()).isEqualTo(START.plus(Duration.ofHours(6)));
            assertThat(stored.getCreatedAt()).isEqualTo(START);
            assertThat(stored.getUpdatedAt()).isEqualTo(START);

            var created = eventRepository.findByResourceIdAndActionOrderByCreatedAtAscIdAsc("srv-api-1", ScheduleAction.CREATED);
            assertThat(created).hasSize(1);
            assertThat(created.get(0).getActorUserId()).isEqualTo(42L);
            assertThat(created.get(0).getCreatedAt()).isEqualTo(START);
        }

        @Test
        @DisplayName("Should reject second schedule for the same server")
        void shouldRejectDuplicateSchedule() throws Exception {
            var request = CreateScheduleRequest.builder().intervalHours(6).maxBackups(10).build();
            createSchedule("srv-api-2", request);

            mockMvc.perform(post(BASE_URL + "srv-api-2")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(request)))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.success").value(false));

            assertThat(scheduleRepository.count()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should reject out of bounds settings")
        void shouldRejectOutOfBoundsSettings() throws Exception {
            var json = """
                    {"intervalHours": 0, "maxBackups": 31}
                    """;

            mockMvc.perform(post(BASE_URL + "srv-api-3")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(json))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.errors", hasSize(2)));

            assertThat(scheduleRepository.count()).isZero();
        }

        @Test
        @DisplayName("Should reject schedule for unknown server")
        void shouldRejectUnknownServer() throws Exception {
            when(resourceStateClient.resourceExists("srv-missing")).thenReturn(false);

            mockMvc.perform(post(BASE_URL + "srv-missing")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(
                                    CreateScheduleRequest.builder().intervalHours(6).maxBackups(10).build())))
                    .andExpect(status().isNotFound());
        }

        @Test
        @DisplayName("Should update and delete schedule with events")
        void shouldUpdateAndDeleteSchedule() throws Exception {
            // Given
            createSchedule("srv-api-4", CreateScheduleRequest.builder().intervalHours(6).maxBackups(10).build());
            clock.advance(Duration.ofHours(1));

            // When
            mockMvc.perform(put(BASE_URL + "srv-api-4")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"intervalHours\": 24}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.intervalHours").value(24))
                    .andExpect(jsonPath("$.data.maxBackups").value(10));

            var updated = scheduleRepository.findByResourceId("srv-api-4").orElseThrow();
            assertThat(updated.getCreatedAt()).isEqualTo(START);
            assertThat(updated.getUpdatedAt()).isEqualTo(START.plus(Duration.ofHours(1)));

            // delete at the same instant as the update
            mockMvc.perform(delete(BASE_URL + "srv-api-4"))
                    .andExpect(status().isOk());

            // Then
            assertThat(scheduleRepository.existsByResourceId("srv-api-4")).isFalse();
            mockMvc.perform(get(BASE_URL + "srv-api-4"))
                    .andExpect(status().isNotFound());

            mockMvc.perform(get(BASE_URL + "srv-api-4/events"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.content", hasSize(3)))
                    .andExpect(jsonPath("$.data.content[0].action").value("DELETED"))
                    .andExpect(jsonPath("$.data.content[1].action").value("UPDATED"))
                    .andExpect(jsonPath("$.data.content[2].action").value("CREATED"));
        }

        @Test
        @DisplayName("Should report scheduler status")
        void shouldReportSchedulerStatus() throws Exception {
            createSchedule("srv-api-5", CreateScheduleRequest.builder().intervalHours(6).maxBackups(10).enabled(false).build());

            mockMvc.perform(get("/api/v1/backup-scheduler/status"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.running").value(false))
                    .andExpect(jsonPath("$.data.state").value("STOPPED"))
                    .andExpect(jsonPath("$.data.totalSchedules").value(1))
                    .andExpect(jsonPath("$.data.enabledSchedules").value(0));
        }
    }

    @Nested
    @DisplayName("Scheduled Backups")
    class ScheduledBackupTests {

        @Test
        @DisplayName("Due schedule should produce one backup and move its due marker")
        void dueScheduleShouldProduceBackup() throws Exception {
            // Given
            createSchedule("srv-run-1", CreateScheduleRequest.builder().intervalHours(6).maxBackups(10).onlyWhenActive(false).build());
            clock.advance(Duration.ofHours(6));
            var tickAt = clock.instant();
            when(backupCatalogClient.createBackup("srv-run-1")).thenReturn(BackupHandle.builder()
                    .id("b-1").resourceId("srv-run-1").status(BackupStatus.CREATING).createdAt(tickAt).build());
            when(backupCatalogClient.listCompletedBackups("srv-run-1")).thenReturn(List.of());

            // When
            var summary = schedulerLoop.runTick(tickAt);

            // Then
            assertThat(summary.getExecuted()).isEqualTo(1);
            verify(backupCatalogClient, times(1)).createBackup("srv-run-1");

            var stored = scheduleRepository.findByResourceId("srv-run-1").orElseThrow();
            assertThat(stored.getLastTriggeredAt()).isEqualTo(tickAt);
            assertThat(stored.getNextTriggerAt()).isEqualTo(tickAt.plus(Duration.ofHours(6)));

            var executed = eventRepository.findByResourceIdAndActionOrderByCreatedAtAscIdAsc("srv-run-1", ScheduleAction.EXECUTED);
            assertThat(executed).hasSize(1);
            assertThat(executed.get(0).getReason()).isEqualTo("Backup created: b-1");

            // a second tick at the same instant finds nothing due
            assertThat(schedulerLoop.runTick(tickAt).getDue()).isZero();
            verify(backupCatalogClient, times(1)).createBackup("srv-run-1");
        }

        @Test
        @DisplayName("Stopped server should be skipped with its due marker unchanged")
        void stoppedServerShouldBeSkipped() throws Exception {
            // Given
            createSchedule("srv-run-2", CreateScheduleRequest.builder().intervalHours(6).maxBackups(10).build());
            var dueAt = START.plus(Duration.ofHours(6));
            clock.set(dueAt.plus(Duration.ofMinutes(10)));
            when(resourceStateClient.isResourceActive("srv-run-2")).thenReturn(false);

            // When
            var summary = schedulerLoop.runTick(clock.instant());

            // Then
            assertThat(summary.getSkipped()).isEqualTo(1);
            verify(backupCatalogClient, never()).createBackup(anyString());

            var stored = scheduleRepository.findByResourceId("srv-run-2").orElseThrow();
            assertThat(stored.getNextTriggerAt()).isEqualTo(dueAt);
            assertThat(stored.getLastTriggeredAt()).isNull();

            var skipped = eventRepository.findByResourceIdAndActionOrderByCreatedAtAscIdAsc("srv-run-2", ScheduleAction.SKIPPED);
            assertThat(skipped).hasSize(1);
            assertThat(skipped.get(0).getReason()).isEqualTo("resource not running");
        }

        @Test
        @DisplayName("Deleted server should lose its schedule")
        void deletedServerShouldLoseSchedule() throws Exception {
            // Given
            createSchedule("srv-run-3", CreateScheduleRequest.builder().intervalHours(6).maxBackups(10).build());

            // When
            mockMvc.perform(post(BASE_URL + "srv-run-3/resource-deleted"))
                    .andExpect(status().isOk());

            // Then
            mockMvc.perform(get(BASE_URL + "srv-run-3"))
                    .andExpect(status().isNotFound());

            var deleted = eventRepository.findByResourceIdAndActionOrderByCreatedAtAscIdAsc("srv-run-3", ScheduleAction.DELETED);
            assertThat(deleted).hasSize(1);
            assertThat(deleted.get(0).getReason()).isEqualTo("Resource deleted");
            assertThat(deleted.get(0).getActorUserId()).isNull();
        }
    }
}
