package com.eainde.knowledge.thread;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MdcAwareExecutorTest {

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    @DisplayName("tasks see the submitting thread's MDC")
    void propagatesMdc() {
        MDC.put("runId", "run-42");
        try (MdcAwareExecutor executor = new MdcAwareExecutor(1, "mdc-test")) {
            String seen = CompletableFuture.supplyAsync(() -> MDC.get("runId"), executor).join();

            assertThat(seen).isEqualTo("run-42");
        }
    }

    @Test
    @DisplayName("pooled threads do not keep a previous task's MDC")
    void clearsAfterTask() {
        try (MdcAwareExecutor executor = new MdcAwareExecutor(1, "mdc-test")) {
            MDC.put("runId", "first");
            CompletableFuture.runAsync(() -> { }, executor).join();
            MDC.clear();

            String seen = CompletableFuture.supplyAsync(() -> MDC.get("runId"), executor).join();

            assertThat(seen).isNull();
        }
    }

    @Test
    @DisplayName("threads are named after the prefix")
    void threadNames() {
        try (MdcAwareExecutor executor = new MdcAwareExecutor(2, "extract-abc")) {
            String name = CompletableFuture.supplyAsync(() -> Thread.currentThread().getName(), executor).join();

            assertThat(name).startsWith("extract-abc-");
        }
    }

    @Test
    @DisplayName("at least one worker is required")
    void invalidWorkers() {
        assertThatThrownBy(() -> new MdcAwareExecutor(0, "x")).isInstanceOf(IllegalArgumentException.class);
    }
}
