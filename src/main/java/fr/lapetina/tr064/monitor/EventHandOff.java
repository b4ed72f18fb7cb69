package fr.lapetina.tr064.monitor;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

/**
 * Passes lines from the reader thread to the consumer queue.
 */
final class EventHandOff {

    private final BlockingQueue<String> queue;
    private final QueueFullPolicy policy;
    private final BooleanSupplier stopRequested;
    private final long pollMillis;

    EventHandOff(BlockingQueue<String> queue, QueueFullPolicy policy, BooleanSupplier stopRequested,
                 Duration pollInterval) {
        this.queue = queue;
        this.policy = policy;
        this.stopRequested = stopRequested;
        this.pollMillis = pollInterval.toMillis();
    }

    /**
     * @return true if the line was queued; false if it was dropped or the monitor is stopping
     */
    boolean offer(String line) throws InterruptedException {
        if (policy == QueueFullPolicy.DROP) {
            return queue.offer(line);
        }
        while (!stopRequested.getAsBoolean()) {
            if (queue.offer(line, pollMillis, TimeUnit.MILLISECONDS)) {
                return true;
            }
        }
        return false;
    }
}
