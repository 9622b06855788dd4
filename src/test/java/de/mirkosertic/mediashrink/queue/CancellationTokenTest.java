package de.mirkosertic.mediashrink.queue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CancellationToken Tests")
class CancellationTokenTest {

    @Test
    @DisplayName("First cancel wins and keeps its reason")
    void firstCancelWins() {
        final CancellationToken token = new CancellationToken();

        assertThat(token.cancel("Cancelled by user")).isTrue();
        assertThat(token.cancel("Interrupted by shutdown")).isFalse();
        assertThat(token.isCancelled()).isTrue();
        assertThat(token.reason()).isEqualTo("Cancelled by user");
    }

    @Test
    @DisplayName("Callbacks run on cancel, immediately when registered late, and not after close")
    void callbacks() {
        // Given
        final CancellationToken token = new CancellationToken();
        final AtomicInteger early = new AtomicInteger();
        final AtomicInteger removed = new AtomicInteger();
        token.onCancel(early::incrementAndGet);
        token.onCancel(removed::incrementAndGet).close();

        // When
        token.cancel("stop");

        // Then
        assertThat(early).hasValue(1);
        assertThat(removed).hasValue(0);

        final AtomicInteger late = new AtomicInteger();
        token.onCancel(late::incrementAndGet);
        assertThat(late).as("Late registration runs right away").hasValue(1);
    }

    @Test
    @DisplayName("A failing callback does not prevent the others")
    void failingCallback() {
        final CancellationToken token = new CancellationToken();
        final AtomicInteger called = new AtomicInteger();
        token.onCancel(() -> {
            throw new IllegalStateException("boom");
        });
        token.onCancel(called::incrementAndGet);

        token.cancel("stop");

        assertThat(called).hasValue(1);
    }
}
