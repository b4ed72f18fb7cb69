package fr.lapetina.tr064.monitor;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;

class EventHandOffTest {

    private static final Duration POLL = Duration.ofMillis(10);

    @Test
    @DisplayName("should drop lines when the queue is full")
    void shouldDropWhenFull() throws Exception {
        BlockingQueue<String> queue = new ArrayBlockingQueue<>(1);
        EventHandOff handOff = new EventHandOff(queue, QueueFullPolicy.DROP, () -> false, POLL);

        assertThat(handOff.offer("first")).isTrue();
        assertThat(handOff.offer("second")).isFalse();
        assertThat(queue).containsExactly("first");
    }

    @Test
    @DisplayName("should wait for free space when blocking")
    void shouldBlockUntilSpace() throws Exception {
        BlockingQueue<String> queue = new ArrayBlockingQueue<>(1);
        EventHandOff handOff = new EventHandOff(queue, QueueFullPolicy.BLOCK, () -> false, POLL);
        handOff.offer("first");

        CompletableFuture<Boolean> pending = CompletableFuture.supplyAsync(() -> {
            try {
                return handOff.offer("second");
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        });
        Thread.sleep(50);
        assertThat(pending).isNotDone();

        assertThat(queue.take()).isEqualTo("first");

        assertThat(pending.get(2, TimeUnit.SECONDS)).isTrue();
        assertThat(queue).containsExactly("second");
    }

    @Test
    @DisplayName("should give up blocking once stop is requested")
    void shouldStopBlocking() throws Exception {
        BlockingQueue<String> queue = new ArrayBlockingQueue<>(1);
        AtomicBoolean stopped = new AtomicBoolean();
        EventHandOff handOff = new EventHandOff(queue, QueueFullPolicy.BLOCK, stopped::get, POLL);
        handOff.offer("first");

        CompletableFuture<Boolean> pending = CompletableFuture.supplyAsync(() -> {
            try {
                return handOff.offer("second");
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return true;
            }
        });
        stopped.set(true);

        assertThat(pending.get(2, TimeUnit.SECONDS)).isFalse();
        assertThat(queue).containsExactly("first");
    }
}
