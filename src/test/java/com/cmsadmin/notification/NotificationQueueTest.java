package com.cmsadmin.notification;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;

class NotificationQueueTest {

    private final NotificationQueue queue = new NotificationQueue();

    @Test
    void drainReturnsAppendOrderAndEmptiesTheQueue() {
        queue.append(1, "first", "");
        queue.append(2, "second", "");
        queue.append(3, "third", "");

        assertThat(queue.drainAll()).extracting(Notification::getTimestamp).containsExactly(1L, 2L, 3L);

        queue.append(4, "fourth", "");
        assertThat(queue.drainAll()).extracting(Notification::getTimestamp).containsExactly(4L);
    }

    @Test
    void secondDrainWithoutAppendIsEmpty() {
        queue.append(new Notification(10, "Testcase storage failed", "disk full"));

        assertThat(queue.drainAll()).containsExactly(new Notification(10, "Testcase storage failed", "disk full"));
        assertThat(queue.drainAll()).isEmpty();
        assertThat(queue.size()).isZero();
    }

    @Test
    void drainedListIsNotAffectedByLaterAppends() {
        queue.append(1, "a", "");
        List<Notification> drained = queue.drainAll();

        queue.append(2, "b", "");

        assertThat(drained).hasSize(1);
        assertThat(queue.size()).isEqualTo(1);
    }

    @Test
    void concurrentAppendsAreDeliveredExactlyOnce() throws Exception {
        int writers = 4;
        int perWriter = 2_000;
        ExecutorService pool = Executors.newFixedThreadPool(writers + 1);
        CountDownLatch start = new CountDownLatch(1);
        AtomicBoolean writing = new AtomicBoolean(true);
        try {
            List<Future<?>> writerTasks = new ArrayList<>();
            for (int w = 0; w < writers; w++) {
                int writer = w;
                writerTasks.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perWriter; i++) {
                        queue.append(writer * perWriter + i, "n", "");
                    }
                    return null;
                }));
            }
            Future<List<Notification>> drainer = pool.submit(() -> {
                List<Notification> all = new ArrayList<>();
                start.await();
                while (writing.get()) {
                    all.addAll(queue.drainAll());
                }
                return all;
            });

            start.countDown();
            for (Future<?> task : writerTasks) {
                task.get(10, TimeUnit.SECONDS);
            }
            writing.set(false);
            List<Notification> drained = new ArrayList<>(drainer.get(10, TimeUnit.SECONDS));
            drained.addAll(queue.drainAll());

            Set<Long> seen = new HashSet<>();
            for (Notification n : drained) {
                assertThat(seen.add(n.getTimestamp())).as("duplicate %s", n.getTimestamp()).isTrue();
            }
            assertThat(seen).hasSize(writers * perWriter);
        } finally {
            pool.shutdownNow();
        }
    }
}
