package com.example.procloner.service;

import com.example.procloner.config.SessionProperties;
import com.example.procloner.event.EventBus;
import com.example.procloner.event.EventType;
import com.example.procloner.event.SessionEvent;
import com.example.procloner.model.CloneOptions;
import com.example.procloner.model.CloneSession;
import com.example.procloner.model.CloningResult;
import com.example.procloner.model.DiscoveredAsset;
import com.example.procloner.model.AssetType;
import com.example.procloner.model.SessionStatus;
import com.example.procloner.repo.CloneSessionRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

class SessionStateMachineTest {

    private SessionRegistry store;
    private SessionStateMachine machine;
    private final List<SessionEvent> events = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        store = new SessionRegistry(mock(CloneSessionRepository.class), new SessionProperties(),
                new ObjectMapper().findAndRegisterModules());
        EventBus bus = new EventBus();
        bus.subscribeAll(events::add);
        machine = new SessionStateMachine(store, bus);
    }

    private String newSession() {
        return machine.create(UUID.randomUUID().toString(), "https://example.com/", new CloneOptions(), "out").getId();
    }

    private List<Integer> progressValues(String id) {
        List<Integer> values = new ArrayList<>();
        for (SessionEvent e : events) {
            if (id.equals(e.getSessionId()) && e.getPayload().containsKey("progress")) {
                values.add((Integer) e.getPayload().get("progress"));
            }
        }
        return values;
    }

    @Nested
    @DisplayName("transition table")
    class Table {

        @Test
        void terminalStatesHaveNoExits() {
            assertThat(SessionStateMachine.allowedFrom(SessionStatus.COMPLETED)).isEmpty();
            assertThat(SessionStateMachine.allowedFrom(SessionStatus.ERROR)).isEmpty();
            assertThat(SessionStateMachine.allowedFrom(SessionStatus.TIMEOUT)).isEmpty();
        }

        @Test
        void interruptedOnlyResumes() {
            assertThat(SessionStateMachine.allowedFrom(SessionStatus.INTERRUPTED)).containsExactly(SessionStatus.RESUMING);
            assertThat(SessionStateMachine.isAllowed(SessionStatus.RESUMING, SessionStatus.CRAWLING)).isTrue();
            assertThat(SessionStateMachine.isAllowed(SessionStatus.INTERRUPTED, SessionStatus.CRAWLING)).isFalse();
        }

        @Test
        void skippingAStateIsRejected() {
            String id = newSession();

            assertThatThrownBy(() -> machine.transition(id, SessionStatus.COMPLETED, null))
                    .isInstanceOf(IllegalSessionTransitionException.class);
            assertThat(store.require(id).getStatus()).isEqualTo(SessionStatus.STARTING);
        }
    }

    @Nested
    @DisplayName("lifecycle")
    class Lifecycle {

        @Test
        void createPublishesStarting() {
            String id = newSession();

            assertThat(events).hasSize(1);
            assertThat(events.get(0).getType()).isEqualTo(EventType.STATUS_UPDATE);
            assertThat(events.get(0).getPayload().get("status")).isEqualTo("starting");
            assertThat(store.require(id).getStatus()).isEqualTo(SessionStatus.STARTING);
        }

        @Test
        void happyPathForcesProgressTo100() {
            String id = newSession();
            machine.startCrawling(id);
            machine.updateProgress(id, 45, 10);
            assertThat(machine.startProcessing(id)).isTrue();
            CloningResult result = new CloningResult(id);
            result.setSuccess(true);

            assertThat(machine.complete(id, result)).isTrue();

            CloneSession s = store.require(id);
            assertThat(s.getStatus()).isEqualTo(SessionStatus.COMPLETED);
            assertThat(s.getProgress()).isEqualTo(100);
            assertThat(s.getCompletedAt()).isNotNull();
            assertThat(s.getExecutionStartedAt()).isNotNull();
        }

        @Test
        void terminalSessionIgnoresProgressAndAssets() {
            String id = newSession();
            machine.startCrawling(id);
            machine.fail(id, "Root page unreachable", CloningResult.failure(id, "x"));
            int before = events.size();

            assertThat(machine.updateProgress(id, 80, 5)).isFalse();
            assertThat(machine.assetFound(id, new DiscoveredAsset("https://example.com/a.png", AssetType.IMAGE, null)))
                    .isFalse();
            assertThat(events).hasSize(before);
            assertThat(store.require(id).getError()).isEqualTo("Root page unreachable");
        }

        @Test
        void timeoutIsDistinctFromError() {
            String id = newSession();
            machine.startCrawling(id);
            CloningResult result = new CloningResult(id);

            machine.timeout(id, "Session exceeded time limit", result);

            CloneSession s = store.require(id);
            assertThat(s.getStatus()).isEqualTo(SessionStatus.TIMEOUT);
            assertThat(s.getResult().isSuccess()).isFalse();
            assertThat(s.getResult().getError()).isEqualTo("Session exceeded time limit");
        }

        @Test
        @DisplayName("resume continues from the last recorded progress")
        void resumeKeepsProgress() {
            String id = newSession();
            machine.startCrawling(id);
            machine.updateProgress(id, 37, 12);
            machine.interrupt(id, "connection lost");
            assertThat(store.require(id).getInterruptedAt()).isNotNull();

            machine.beginResume(id);
            assertThat(store.require(id).getStatus()).isEqualTo(SessionStatus.RESUMING);
            machine.startCrawling(id);
            machine.updateProgress(id, 10, 12);

            CloneSession s = store.require(id);
            assertThat(s.getStatus()).isEqualTo(SessionStatus.CRAWLING);
            assertThat(s.getProgress()).isEqualTo(37);
            assertThat(s.getError()).isNull();
            assertThat(s.getInterruptedAt()).isNull();
        }

        @Test
        void tryTransitionReportsInsteadOfThrowing() {
            String id = newSession();
            machine.startCrawling(id);
            machine.fail(id, "boom", null);

            assertThat(machine.interrupt(id, "late")).isFalse();
            assertThat(store.require(id).getStatus()).isEqualTo(SessionStatus.ERROR);
        }
    }

    @Nested
    @DisplayName("progress")
    class Progress {

        @Test
        void neverDecreases() {
            String id = newSession();
            machine.startCrawling(id);
            machine.updateProgress(id, 40, 3);
            machine.updateProgress(id, 30, 3);
            machine.updateProgress(id, 55, 4);

            assertThat(store.require(id).getProgress()).isEqualTo(55);
            assertThat(progressValues(id)).isSorted();
        }

        @Test
        void observedValuesStayOrderedUnderConcurrency() throws Exception {
            final String id = newSession();
            machine.startCrawling(id);
            ExecutorService pool = Executors.newFixedThreadPool(6);
            final CountDownLatch done = new CountDownLatch(300);
            for (int i = 0; i < 300; i++) {
                final int value = (i * 37) % 91;
                pool.submit(new Runnable() {
                    public void run() {
                        try {
                            machine.updateProgress(id, value, value);
                        } finally {
                            done.countDown();
                        }
                    }
                });
            }
            assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
            pool.shutdownNow();

            assertThat(progressValues(id)).isSorted();
            assertThat(store.require(id).getProgress()).isEqualTo(90);
        }

        @Test
        void crawlShareIsCapped() {
            assertThat(SessionStateMachine.crawlProgress(0, 0)).isZero();
            assertThat(SessionStateMachine.crawlProgress(5, 10)).isEqualTo(45);
            assertThat(SessionStateMachine.crawlProgress(10, 10)).isEqualTo(SessionStateMachine.CRAWL_PHASE_WEIGHT);
        }
    }
}
