package com.fleetgate.plugin.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fleetgate.common.infra.Backoff;
import com.fleetgate.common.infra.BackgroundTaskQueue;
import com.fleetgate.common.json.JsonMapper;
import com.fleetgate.store.Database;
import com.fleetgate.store.PluginRepository;
import com.fleetgate.store.model.PluginEvent;
import com.fleetgate.store.model.PluginInstance;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class CrashGuardTest {

    private static final String PLUGIN = "builtin.telegram";

    private final AtomicLong now = new AtomicLong(1_000_000);
    private final AtomicInteger persisted = new AtomicInteger();
    private BackgroundTaskQueue tasks;
    private CrashGuard guard;

    @BeforeEach
    void setUp() {
        tasks = new BackgroundTaskQueue(100, 3, new Backoff.Policy(5, 20, 2.0, 0.0));
        guard = new CrashGuard(3, 60_000, (pluginId, count, windowMs, threshold) -> persisted.incrementAndGet(),
                tasks, now::get);
    }

    @AfterEach
    void tearDown() {
        tasks.close();
    }

    @Test
    void thresholdWithinWindow_disablesAndPersistsOnce() throws Exception {
        assertFalse(guard.recordFailure(PLUGIN));
        assertFalse(guard.recordFailure(PLUGIN));
        assertTrue(guard.recordFailure(PLUGIN));

        assertTrue(guard.isDisabled(PLUGIN));
        assertTrue(guard.recordFailure(PLUGIN));
        assertTrue(guard.recordFailure(PLUGIN));

        assertTrue(tasks.awaitIdle(Duration.ofSeconds(2)));
        assertEquals(1, persisted.get());
    }

    @Test
    void successBeforeThreshold_resetsBudget() {
        guard.recordFailure(PLUGIN);
        guard.recordFailure(PLUGIN);
        guard.recordSuccess(PLUGIN);

        assertFalse(guard.recordFailure(PLUGIN));
        assertFalse(guard.isDisabled(PLUGIN));
        assertEquals(1, guard.failureCount(PLUGIN));
    }

    @Test
    void failuresOutsideWindow_pruned() {
        guard.recordFailure(PLUGIN);
        guard.recordFailure(PLUGIN);
        now.addAndGet(60_001);

        assertFalse(guard.recordFailure(PLUGIN));
        assertEquals(1, guard.failureCount(PLUGIN));
    }

    @Test
    void pluginsTrackedIndependently() {
        guard.recordFailure(PLUGIN);
        guard.recordFailure(PLUGIN);
        guard.recordFailure("builtin.slack");

        assertFalse(guard.recordFailure("builtin.slack"));
        assertTrue(guard.recordFailure(PLUGIN));
        assertFalse(guard.isDisabled("builtin.slack"));
    }

    @Test
    void resetPlugin_reenables() {
        for (int i = 0; i < 3; i++) {
            guard.recordFailure(PLUGIN);
        }
        guard.resetPlugin(PLUGIN);

        assertFalse(guard.isDisabled(PLUGIN));
        assertFalse(guard.recordFailure(PLUGIN));
    }

    @Test
    void persistenceFailure_doesNotUndoDisable() throws Exception {
        guard = new CrashGuard(1, 60_000, (pluginId, count, windowMs, threshold) -> {
            throw new IllegalStateException("store down");
        }, tasks, now::get);

        assertTrue(guard.recordFailure(PLUGIN));
        assertTrue(tasks.awaitIdle(Duration.ofSeconds(5)));
        assertTrue(guard.isDisabled(PLUGIN));
    }

    @Nested
    class WithStore {

        @TempDir
        Path tempDir;

        @Test
        void autoDisable_writesFlagAndAuditEvent() throws Exception {
            Database database = new Database(tempDir.resolve("store.db"), 5_000);
            database.init();
            PluginRepository plugins = new PluginRepository(database);
            plugins.createInstance(PluginInstance.builder()
                    .pluginId(PLUGIN).type("telegram").name("bot").enabled(true).config("{}").build());
            guard = new CrashGuard(2, 60_000, new StoreAutoDisableRecorder(plugins), tasks, now::get);

            guard.recordFailure(PLUGIN);
            guard.recordFailure(PLUGIN);
            assertTrue(tasks.awaitIdle(Duration.ofSeconds(2)));

            assertFalse(plugins.isPluginEnabled(PLUGIN));
            List<PluginEvent> events = plugins.listEvents(PLUGIN);
            assertEquals(1, events.size());
            assertEquals("auto_disable", events.get(0).getKind());
            assertEquals("error", events.get(0).getStatus());
            JsonNode detail = JsonMapper.read(events.get(0).getDetail());
            assertEquals("crash_loop", detail.get("reason").asText());
            assertEquals(2, detail.get("failureCount").asInt());
            assertEquals(60_000, detail.get("windowMs").asLong());
            assertEquals(2, detail.get("threshold").asInt());
        }
    }
}
