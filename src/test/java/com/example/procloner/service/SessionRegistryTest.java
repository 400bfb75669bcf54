package com.example.procloner.service;

import com.example.procloner.config.SessionProperties;
import com.example.procloner.model.CloneOptions;
import com.example.procloner.model.CloneSession;
import com.example.procloner.model.CloneSessionEntity;
import com.example.procloner.model.SessionStatus;
import com.example.procloner.repo.CloneSessionRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SessionRegistryTest {

    @TempDir
    Path outputDir;

    private CloneSessionRepository repo;
    private SessionRegistry registry;

    @BeforeEach
    void setUp() {
        repo = mock(CloneSessionRepository.class);
        SessionProperties properties = new SessionProperties();
        properties.setRetention(Duration.ofHours(1));
        registry = new SessionRegistry(repo, properties, new ObjectMapper().findAndRegisterModules());
    }

    private static CloneSessionEntity entity(String id, String status) {
        CloneSessionEntity e = new CloneSessionEntity();
        e.setSessionId(id);
        e.setStatus(status);
        e.setSourceUrl("https://site.test/");
        e.setProgress(35);
        e.setStartTime(Instant.now().minus(Duration.ofMinutes(5)));
        return e;
    }

    @Test
    void restartInterruptsActiveSessionsAndDropsExpiredOnes() {
        CloneSessionEntity crawling = entity("a", "crawling");
        crawling.setOutputDir(outputDir.toString());
        CloneSessionEntity expired = entity("b", "completed");
        expired.setCompletedAt(Instant.now().minus(Duration.ofHours(2)));
        CloneSessionEntity recent = entity("c", "error");
        recent.setCompletedAt(Instant.now().minus(Duration.ofMinutes(1)));
        when(repo.findAll()).thenReturn(Arrays.asList(crawling, expired, recent));

        registry.restore();

        CloneSession a = registry.require("a");
        assertThat(a.getStatus()).isEqualTo(SessionStatus.INTERRUPTED);
        assertThat(a.getError()).isEqualTo(SessionRegistry.RESTART_MESSAGE);
        assertThat(a.getProgress()).isEqualTo(35);
        assertThat(registry.canRecover(a)).isTrue();
        assertThat(registry.find("b")).isNull();
        assertThat(registry.find("c").getStatus()).isEqualTo(SessionStatus.ERROR);
        verify(repo).delete(expired);
    }

    @Test
    void duplicateIdsAreRejected() {
        registry.register(new CloneSession("x", "https://site.test/", new CloneOptions()));

        assertThatThrownBy(() -> registry.register(new CloneSession("x", "https://other.test/", null)))
                .isInstanceOf(IllegalArgumentException.class);
        verify(repo).save(any(CloneSessionEntity.class));
    }

    @Test
    void unknownSessionThrows() {
        assertThat(registry.find(null)).isNull();
        assertThatThrownBy(() -> registry.require("missing"))
                .isInstanceOf(SessionNotFoundException.class);
    }

    @Test
    void evictsOnlyFinishedSessionsPastRetention() {
        CloneSession running = new CloneSession("run", "https://site.test/", null);
        running.setStatus(SessionStatus.CRAWLING);
        CloneSession done = new CloneSession("done", "https://site.test/", null);
        done.setStatus(SessionStatus.COMPLETED);
        done.setCompletedAt(Instant.now().minus(Duration.ofMinutes(90)));
        CloneSession paused = new CloneSession("paused", "https://site.test/", null);
        paused.setStatus(SessionStatus.INTERRUPTED);
        paused.setInterruptedAt(Instant.now().minus(Duration.ofMinutes(10)));
        registry.register(running);
        registry.register(done);
        registry.register(paused);

        assertThat(registry.evictExpired(Instant.now())).containsExactly("done");
        assertThat(registry.list()).extracting(CloneSession::getId).containsExactlyInAnyOrder("run", "paused");
    }

    @Test
    void recoveryNeedsInterruptedStatusAndOutput() {
        CloneSession session = new CloneSession("r", "https://site.test/", null);
        session.setStatus(SessionStatus.INTERRUPTED);
        session.setInterruptedAt(Instant.now());
        session.setOutputDir(outputDir.resolve("gone").toString());
        assertThat(registry.canRecover(session)).isFalse();

        session.setOutputDir(outputDir.toString());
        assertThat(registry.canRecover(session)).isTrue();

        session.setStatus(SessionStatus.COMPLETED);
        assertThat(registry.canRecover(session)).isFalse();
    }
}
