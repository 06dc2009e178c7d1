package com.shiv.pdfredact.service;

import com.shiv.pdfredact.exception.RedactionCancelledException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CancellationRegistryTest {

    private final CancellationRegistry registry = new CancellationRegistry();

    @Test
    @DisplayName("cancel flags the registered token")
    void cancel() {
        CancellationToken token = registry.register("run-1");

        assertThat(registry.cancel("run-1")).isTrue();
        assertThat(token.isCancelled()).isTrue();
        assertThatThrownBy(() -> token.checkpoint("ocr"))
                .isInstanceOf(RedactionCancelledException.class)
                .hasMessageContaining("ocr");
    }

    @Test
    @DisplayName("unknown and removed runs cannot be cancelled")
    void unknown() {
        registry.register("run-2");
        registry.remove("run-2");

        assertThat(registry.cancel("run-2")).isFalse();
        assertThat(registry.cancel("nope")).isFalse();
        assertThat(registry.find("run-2")).isEmpty();
    }

    @Test
    @DisplayName("a run id can only be registered once while live")
    void duplicate() {
        registry.register("run-3");

        assertThatThrownBy(() -> registry.register("run-3")).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("tokens of other runs are not affected")
    void isolation() {
        CancellationToken a = registry.register("a");
        CancellationToken b = registry.register("b");

        registry.cancel("a");

        assertThat(a.isCancelled()).isTrue();
        assertThat(b.isCancelled()).isFalse();
        b.checkpoint("load");
    }
}
