package com.example.jobscheduler.service.reconciliation;

import com.example.jobscheduler.config.JobSchedulerProperties;
import com.example.jobscheduler.config.MetricsConfig;
import com.example.jobscheduler.domain.entity.ScheduledJob;
import com.example.jobscheduler.domain.model.JobSchedule;
import com.example.jobscheduler.domain.model.ScheduledJobRecord;
import com.example.jobscheduler.exception.StoreUnavailableException;
import com.example.jobscheduler.mapper.ScheduledJobRecordMapper;
import com.example.jobscheduler.service.dispatch.ExecutionDispatcher;
import com.example.jobscheduler.service.engine.SchedulerEngine;
import com.example.jobscheduler.service.store.JobStoreAccessor;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.availability.AvailabilityChangeEvent;
import org.springframework.boot.availability.ReadinessState;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("ReconciliationController Tests")
class ReconciliationControllerTest {

    private static final String NIGHTLY = "{\"hour\": 1, \"minute\": 15}";

    @Mock
    private SchedulerEngine engine;

    @Mock
    private JobStoreAccessor store;

    @Mock
    private ExecutionDispatcher dispatcher;

    @Mock
    private MetricsConfig metricsConfig;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private ReconciliationController controller;

    @BeforeEach
    void setUp() {
        var properties = new JobSchedulerProperties();
        properties.setPollIntervalMs(100);
        controller = new ReconciliationController(engine, store, new ScheduledJobRecordMapper(new ObjectMapper()),
                dispatcher, metricsConfig, eventPublisher, properties);
    }

    private static ScheduledJob row(String id, String schedule, boolean enabled, String opts) {
        return ScheduledJob.builder()
                .id(id)
                .name("Job " + id)
                .jobClass("test.Stub")
                .schedule(schedule)
                .enabled(enabled)
                .opts(opts)
                .build();
    }

    private static ScheduledJob row(String id, String schedule, boolean enabled) {
        return row(id, schedule, enabled, "{}");
    }

    private static JobSchedule schedule(String json) throws Exception {
        @SuppressWarnings("unchecked")
        Map<String, Object> values = new ObjectMapper().readValue(json, Map.class);
        return JobSchedule.fromMap(values);
    }

    /**
     * Run one refresh pass over the given rows
     */
    private void pass(ScheduledJob... rows) {
        when(store.loadAll()).thenReturn(List.of(rows));
        controller.refreshJobs();
    }

    @Nested
    @DisplayName("New jobs")
    class NewJobTests {

        @Test
        @DisplayName("Should register an enabled recurring job active")
        void shouldRegisterEnabledRecurringJob() throws Exception {
            pass(row("a", NIGHTLY, true));

            verify(engine).addRecurring(eq("a"), eq("Job a"), eq(schedule(NIGHTLY)), any(Runnable.class), eq(false));
            verifyNoMoreInteractions(engine);
        }

        @Test
        @DisplayName("Should register a disabled recurring job suspended")
        void shouldRegisterDisabledRecurringJobSuspended() throws Exception {
            pass(row("a", NIGHTLY, false));

            verify(engine).addRecurring(eq("a"), eq("Job a"), eq(schedule(NIGHTLY)), any(Runnable.class), eq(true));
            verifyNoMoreInteractions(engine);
        }

        @Test
        @DisplayName("Should fire an enabled unscheduled job once and delete its row")
        void shouldFireOneShotAndDelete() {
            when(store.delete("a")).thenReturn(true);

            pass(row("a", null, true));

            verify(engine).addOneShot(eq("Job a"), any(Runnable.class));
            verify(store).delete("a");
            verifyNoMoreInteractions(engine);

            clearInvocations(engine, store);
            pass();
            verifyNoInteractions(engine);
            verify(store, never()).delete(anyString());
        }

        @Test
        @DisplayName("Should ignore a disabled unscheduled job")
        void shouldIgnoreDisabledUnscheduledJob() {
            pass(row("a", null, false));

            verifyNoInteractions(engine);
            verify(store, never()).delete(anyString());
        }

        @Test
        @DisplayName("Registered callback should dispatch the record with the controller")
        void callbackShouldDispatch() {
            var callback = ArgumentCaptor.forClass(Runnable.class);
            pass(row("a", NIGHTLY, true, "{\"stooge\": \"Larry\"}"));
            verify(engine).addRecurring(eq("a"), any(), any(), callback.capture(), eq(false));

            callback.getValue().run();

            var record = ArgumentCaptor.forClass(ScheduledJobRecord.class);
            verify(dispatcher).dispatch(record.capture(), same(controller));
            assertThat(record.getValue().getId()).isEqualTo("a");
            assertThat(record.getValue().getOpts()).containsEntry("stooge", "Larry");
        }
    }

    @Nested
    @DisplayName("Existing jobs")
    class ExistingJobTests {

        @Test
        @DisplayName("An unchanged table should cause no engine calls")
        void unchangedTableShouldBeIdempotent() {
            var rows = new ScheduledJob[]{row("a", NIGHTLY, true), row("b", "{\"minute\": \"*/5\"}", false)};
            pass(rows);
            clearInvocations(engine);

            pass(rows);
            pass(rows);

            verifyNoInteractions(engine);
        }

        @Test
        @DisplayName("Disabling should only pause and enabling should only resume")
        void togglingShouldOnlyPauseAndResume() {
            pass(row("a", NIGHTLY, true));
            clearInvocations(engine);

            pass(row("a", NIGHTLY, false));
            verify(engine).pause("a");
            verifyNoMoreInteractions(engine);

            pass(row("a", NIGHTLY, true));
            verify(engine).resume("a");
            verifyNoMoreInteractions(engine);
        }

        @Test
        @DisplayName("Changed options should only modify the registration")
        void changedOptionsShouldModify() {
            pass(row("a", NIGHTLY, true, "{\"recips\": \"x@example.com\"}"));
            clearInvocations(engine);

            pass(row("a", NIGHTLY, true, "{\"recips\": \"y@example.com\"}"));

            verify(engine).modify(eq("a"), eq("Job a"), any(Runnable.class));
            verifyNoMoreInteractions(engine);
        }

        @Test
        @DisplayName("Changed schedule should only reschedule")
        void changedScheduleShouldReschedule() throws Exception {
            pass(row("a", NIGHTLY, true));
            clearInvocations(engine);

            pass(row("a", "{\"hour\": 2}", true));

            verify(engine).reschedule("a", schedule("{\"hour\": 2}"));
            verifyNoMoreInteractions(engine);
        }

        @Test
        @DisplayName("Should remove registrations whose rows are gone")
        void shouldRemoveDeletedRows() {
            pass(row("a", NIGHTLY, true), row("b", NIGHTLY, true));
            clearInvocations(engine);

            pass(row("b", NIGHTLY, true));

            verify(engine).remove("a");
            verifyNoMoreInteractions(engine);
        }

        @Test
        @DisplayName("Removing the schedule of an enabled job should unregister it and run it once")
        void removingScheduleOfEnabledJobShouldRunOnce() {
            when(store.delete("a")).thenReturn(true);
            pass(row("a", NIGHTLY, true));
            clearInvocations(engine);

            pass(row("a", null, true));

            InOrder inOrder = inOrder(engine, store);
            inOrder.verify(engine).remove("a");
            inOrder.verify(engine).addOneShot(eq("Job a"), any(Runnable.class));
            inOrder.verify(store).delete("a");
            verifyNoMoreInteractions(engine);
        }

        @Test
        @ExtendWith(OutputCaptureExtension.class)
        @DisplayName("A new unscheduled job and a job losing its schedule should log their run differently")
        void oneShotRunsShouldBeLoggedByCause(CapturedOutput output) {
            when(store.delete(anyString())).thenReturn(true);
            pass(row("a", NIGHTLY, true));

            pass(row("a", null, true), row("b", null, true));

            assertThat(output).contains("Manual run of Job a");
            assertThat(output).contains("Unscheduled run of Job b");
            assertThat(output).doesNotContain("Manual run of Job b");
            assertThat(output).doesNotContain("Unscheduled run of Job a");
        }

        @Test
        @DisplayName("Removing the schedule of a disabled job should only unregister it")
        void removingScheduleOfDisabledJobShouldOnlyRemove() {
            pass(row("a", NIGHTLY, false));
            clearInvocations(engine);

            pass(row("a", null, false));

            verify(engine).remove("a");
            verifyNoMoreInteractions(engine);
            verify(store, never()).delete(anyString());
        }

        @Test
        @DisplayName("A disabled recurring job becoming enabled and unscheduled should run once")
        void disabledRecurringToEnabledUnscheduledShouldRunOnce() {
            when(store.delete("a")).thenReturn(true);
            pass(row("a", NIGHTLY, false));
            clearInvocations(engine);

            pass(row("a", null, true));

            verify(engine).remove("a");
            verify(engine).addOneShot(eq("Job a"), any(Runnable.class));
            verify(store).delete("a");
            verifyNoMoreInteractions(engine);
        }
    }

    @Nested
    @DisplayName("Failures")
    class FailureTests {

        @Test
        @DisplayName("Malformed rows should be skipped without affecting others")
        void malformedRowsShouldBeSkipped() {
            pass(row("bad", "{\"year\": 2030}", true), row("good", NIGHTLY, true));

            verify(engine).addRecurring(eq("good"), any(), any(), any(Runnable.class), eq(false));
            verifyNoMoreInteractions(engine);
            verify(metricsConfig).recordMalformedRecord();
        }

        @Test
        @DisplayName("A row turning malformed should keep its registration")
        void malformedEditShouldKeepRegistration() {
            pass(row("a", NIGHTLY, true));
            clearInvocations(engine);

            pass(row("a", NIGHTLY, true, "{broken"));
            verifyNoInteractions(engine);

            // Fixed again, identical to what is registered
            pass(row("a", NIGHTLY, true));
            verifyNoInteractions(engine);
        }

        @Test
        @DisplayName("Store failure on refresh should keep current registrations")
        void storeFailureShouldKeepState() {
            pass(row("a", NIGHTLY, true));
            clearInvocations(engine);

            when(store.loadAll()).thenThrow(new StoreUnavailableException("down", null));
            controller.refreshJobs();
            verifyNoInteractions(engine);
            verify(metricsConfig).recordReconciliationPass(false);

            reset(store);
            pass(row("a", NIGHTLY, true));
            verifyNoInteractions(engine);
        }

        @Test
        @DisplayName("Store failure on initial load should propagate")
        void storeFailureOnLoadShouldPropagate() {
            when(store.loadAll()).thenThrow(new StoreUnavailableException("down", null));

            assertThatThrownBy(() -> controller.loadJobs()).isInstanceOf(StoreUnavailableException.class);
        }

        @Test
        @DisplayName("A failed one-shot delete should be retried without firing again")
        void failedOneShotDeleteShouldNotRefire() {
            when(store.delete("a")).thenReturn(false, false, true);

            pass(row("a", null, true));
            pass(row("a", null, true));
            pass(row("a", null, true));
            pass();

            verify(engine, times(1)).addOneShot(eq("Job a"), any(Runnable.class));
            verify(store, times(3)).delete("a");
        }

        @Test
        @DisplayName("An edited one-shot row should fire again")
        void editedOneShotShouldFireAgain() {
            when(store.delete("a")).thenReturn(false, true);

            pass(row("a", null, true, "{\"n\": 1}"));
            pass(row("a", null, true, "{\"n\": 2}"));

            verify(engine, times(2)).addOneShot(eq("Job a"), any(Runnable.class));
        }

        @Test
        @DisplayName("Engine errors for one job should not stop the pass")
        void engineErrorsShouldBeContained() {
            doThrow(new IllegalArgumentException("bad")).when(engine)
                    .addRecurring(eq("a"), any(), any(), any(Runnable.class), anyBoolean());

            pass(row("a", NIGHTLY, true), row("b", NIGHTLY, true));

            verify(engine).addRecurring(eq("b"), any(), any(), any(Runnable.class), eq(false));
        }
    }

    @Nested
    @DisplayName("Lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("Should load, start, poll until stopped and then drain")
        void shouldRunUntilStopped() {
            var rows = List.of(row("a", NIGHTLY, true));
            when(store.loadAll())
                    .thenReturn(rows)
                    .thenReturn(rows)
                    .thenAnswer(inv -> {
                        controller.stop();
                        return rows;
                    });
            var statesDuringShutdown = new ArrayList<ControllerState>();
            doAnswer(inv -> statesDuringShutdown.add(controller.getState())).when(engine).shutdown();

            controller.run();

            InOrder inOrder = inOrder(engine);
            inOrder.verify(engine).addRecurring(eq("a"), any(), any(), any(Runnable.class), eq(false));
            inOrder.verify(engine).start();
            inOrder.verify(engine).shutdown();
            verify(store, times(3)).loadAll();
            assertThat(statesDuringShutdown).containsExactly(ControllerState.DRAINING);
            assertThat(controller.getState()).isEqualTo(ControllerState.STOPPED);
        }

        @Test
        @DisplayName("A stop requested while starting should end the loop without polling")
        void stopDuringStartShouldEndLoop() {
            when(store.loadAll()).thenReturn(List.of());
            doAnswer(inv -> {
                controller.stop();
                return null;
            }).when(engine).start();

            controller.run();

            verify(store, times(1)).loadAll();
            verify(engine).shutdown();
        }

        @Test
        @DisplayName("Should report RUNNING while polling")
        void shouldReportRunning() {
            var states = new ArrayList<ControllerState>();
            when(store.loadAll())
                    .thenReturn(List.of())
                    .thenAnswer(inv -> {
                        states.add(controller.getState());
                        controller.stop();
                        return List.of();
                    });

            assertThat(controller.getState()).isEqualTo(ControllerState.STOPPED);
            controller.run();

            assertThat(states).containsExactly(ControllerState.RUNNING);
        }

        @Test
        @DisplayName("Should report readiness while running and withdraw it when draining")
        void shouldPublishReadiness() {
            when(store.loadAll())
                    .thenReturn(List.of())
                    .thenAnswer(inv -> {
                        controller.stop();
                        return List.of();
                    });

            controller.run();

            var captor = ArgumentCaptor.forClass(AvailabilityChangeEvent.class);
            InOrder inOrder = inOrder(engine, eventPublisher);
            inOrder.verify(engine).start();
            inOrder.verify(eventPublisher).publishEvent(captor.capture());
            inOrder.verify(eventPublisher).publishEvent(captor.capture());
            inOrder.verify(engine).shutdown();
            assertThat(captor.getAllValues())
                    .extracting(AvailabilityChangeEvent::getState)
                    .containsExactly(ReadinessState.ACCEPTING_TRAFFIC, ReadinessState.REFUSING_TRAFFIC);
        }

        @Test
        @DisplayName("Should expose the engine's registered jobs")
        void shouldExposeRegisteredJobs() {
            when(engine.getRegisteredJobs()).thenReturn(List.of());

            assertThat(controller.getRegisteredJobs()).isEmpty();
        }
    }
}
