package com.bastion.observability;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CorrelationContextHolder")
class CorrelationContextHolderTest {

    private static final CorrelationContext CTX =
            new CorrelationContext("corr-1", "inst-1", "org-1", "user-1", "req-1");

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    @Nested
    @DisplayName("set / get / clear")
    class SetGetClear {

        @Test
        @DisplayName("populates MDC on set")
        void populatesMdc() {
            CorrelationContextHolder.set(CTX);

            assertThat(CorrelationContextHolder.get()).contains(CTX);
            assertThat(MDC.get("correlationId")).isEqualTo("corr-1");
            assertThat(MDC.get("instanceId")).isEqualTo("inst-1");
            assertThat(MDC.get("orgId")).isEqualTo("org-1");
            assertThat(MDC.get("userId")).isEqualTo("user-1");
        }

        @Test
        @DisplayName("null values remove the MDC key")
        void nullValues() {
            CorrelationContextHolder.set(CTX);
            CorrelationContextHolder.set(new CorrelationContext("corr-2", "inst-1", null, null, null));

            assertThat(MDC.get("orgId")).isNull();
            assertThat(MDC.get("correlationId")).isEqualTo("corr-2");
        }

        @Test
        @DisplayName("clear removes context and MDC keys")
        void clear() {
            CorrelationContextHolder.set(CTX);
            CorrelationContextHolder.clear();

            assertThat(CorrelationContextHolder.get()).isEmpty();
            assertThat(CorrelationContextHolder.currentCorrelationId()).isNull();
            assertThat(MDC.get("correlationId")).isNull();
        }

        @Test
        @DisplayName("rejects null context")
        void rejectsNull() {
            assertThatThrownBy(() -> CorrelationContextHolder.set(null))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    @DisplayName("callWithContext restores the previous context")
    void callWithContextRestores() {
        CorrelationContextHolder.set(CTX);
        var inner = new CorrelationContext("corr-inner", "inst-1", "org-2", "user-2", null);

        String seen = CorrelationContextHolder.callWithContext(inner, CorrelationContextHolder::currentCorrelationId);

        assertThat(seen).isEqualTo("corr-inner");
        assertThat(CorrelationContextHolder.currentCorrelationId()).isEqualTo("corr-1");
    }

    @Test
    @DisplayName("wrap carries the context to another thread")
    void wrapCarriesContext() throws Exception {
        CorrelationContextHolder.set(CTX);
        var seen = new AtomicReference<String>();
        var executor = Executors.newSingleThreadExecutor();
        try {
            CompletableFuture.runAsync(
                    CorrelationContextHolder.wrap(() -> seen.set(MDC.get("correlationId"))), executor)
                    .get(5, TimeUnit.SECONDS);
        } finally {
            executor.shutdownNow();
        }

        assertThat(seen.get()).isEqualTo("corr-1");
    }

    @Test
    @DisplayName("blank correlation id is rejected")
    void blankCorrelationId() {
        assertThatThrownBy(() -> new CorrelationContext(" ", "inst-1", null, null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("correlationId");
    }
}
