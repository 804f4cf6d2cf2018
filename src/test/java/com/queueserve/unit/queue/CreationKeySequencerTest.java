package com.queueserve.unit.queue;

import static org.assertj.core.api.Assertions.assertThat;

import com.queueserve.queue.CreationKeySequencer;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for CreationKeySequencer: strict monotonicity within a millisecond, across clock
 * regressions, on sequence overflow and under concurrent callers.
 */
class CreationKeySequencerTest {

    private static final long BASE_MILLIS = 1_760_000_000_000L;

    @Nested
    @DisplayName("Single caller")
    class SingleCaller {

        @Test
        @DisplayName("keys issued in the same millisecond are strictly increasing")
        void sameMillisecond_strictlyIncreasing() {
            CreationKeySequencer sequencer = new CreationKeySequencer(fixedAt(BASE_MILLIS));

            long first = sequencer.next();
            long second = sequencer.next();
            long third = sequencer.next();

            assertThat(second).isGreaterThan(first);
            assertThat(third).isGreaterThan(second);
            assertThat(CreationKeySequencer.timestampOf(first)).isEqualTo(BASE_MILLIS);
            assertThat(CreationKeySequencer.timestampOf(third)).isEqualTo(BASE_MILLIS);
        }

        @Test
        @DisplayName("a later millisecond always sorts after an earlier one")
        void laterMillisecond_sortsAfter() {
            MutableClock clock = new MutableClock(BASE_MILLIS);
            CreationKeySequencer sequencer = new CreationKeySequencer(clock);

            long early = sequencer.next();
            sequencer.next();
            clock.set(BASE_MILLIS + 1);
            long late = sequencer.next();

            assertThat(late).isGreaterThan(early);
            assertThat(CreationKeySequencer.timestampOf(late)).isEqualTo(BASE_MILLIS + 1);
        }

        @Test
        @DisplayName("clock stepping backwards does not produce a smaller key")
        void clockGoesBackwards_keysStillIncrease() {
            MutableClock clock = new MutableClock(BASE_MILLIS);
            CreationKeySequencer sequencer = new CreationKeySequencer(clock);

            long before = sequencer.next();
            clock.set(BASE_MILLIS - 5_000);
            long after = sequencer.next();

            assertThat(after).isGreaterThan(before);
        }

        @Test
        @DisplayName("sequence overflow borrows the next millisecond instead of wrapping")
        void sequenceOverflow_borrowsNextMillisecond() {
            CreationKeySequencer sequencer = new CreationKeySequencer(fixedAt(BASE_MILLIS));

            long previous = sequencer.next();
            for (int i = 0; i < 5000; i++) {
                long key = sequencer.next();
                assertThat(key).isGreaterThan(previous);
                previous = key;
            }
            assertThat(CreationKeySequencer.timestampOf(previous)).isEqualTo(BASE_MILLIS + 1);
        }

        @Test
        @DisplayName("advancePast moves the sequencer beyond a stored key from a faster clock")
        void advancePast_keysSortAfterStoredKey() {
            CreationKeySequencer sequencer = new CreationKeySequencer(fixedAt(BASE_MILLIS));
            long storedKey = ((BASE_MILLIS + 60_000) << 12) | 7;

            sequencer.advancePast(storedKey);

            assertThat(sequencer.next()).isGreaterThan(storedKey);
        }

        @Test
        @DisplayName("advancePast with an older key changes nothing")
        void advancePast_olderKey_noEffect() {
            MutableClock clock = new MutableClock(BASE_MILLIS);
            CreationKeySequencer sequencer = new CreationKeySequencer(clock);
            long issued = sequencer.next();

            sequencer.advancePast(((BASE_MILLIS - 1000) << 12));

            clock.set(BASE_MILLIS + 1);
            assertThat(CreationKeySequencer.timestampOf(sequencer.next())).isEqualTo(BASE_MILLIS + 1);
            assertThat(issued).isLessThan(sequencer.next());
        }
    }

    @Nested
    @DisplayName("Concurrent callers")
    class ConcurrentCallers {

        @Test
        @DisplayName("50 threads never receive the same key and each sees increasing keys")
        void concurrentCallers_distinctAndMonotonic() throws InterruptedException {
            CreationKeySequencer sequencer = new CreationKeySequencer(fixedAt(BASE_MILLIS));
            int threadCount = 50;
            int keysPerThread = 200;

            ExecutorService executorService = Executors.newFixedThreadPool(threadCount);
            CountDownLatch start = new CountDownLatch(1);
            CountDownLatch done = new CountDownLatch(threadCount);
            List<List<Long>> perThread = Collections.synchronizedList(new ArrayList<>());

            for (int t = 0; t < threadCount; t++) {
                executorService.submit(() -> {
                    List<Long> keys = new ArrayList<>(keysPerThread);
                    try {
                        start.await();
                        for (int i = 0; i < keysPerThread; i++) {
                            keys.add(sequencer.next());
                        }
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } finally {
                        perThread.add(keys);
                        done.countDown();
                    }
                });
            }

            start.countDown();
            assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
            executorService.shutdown();

            Set<Long> all = new HashSet<>();
            for (List<Long> keys : perThread) {
                assertThat(keys).hasSize(keysPerThread).isSorted();
                all.addAll(keys);
            }
            assertThat(all).hasSize(threadCount * keysPerThread);
        }
    }

    private static Clock fixedAt(long millis) {
        return Clock.fixed(Instant.ofEpochMilli(millis), ZoneOffset.UTC);
    }

    /** Clock whose instant can be moved in either direction. */
    static class MutableClock extends Clock {

        private volatile long millis;

        MutableClock(long millis) {
            this.millis = millis;
        }

        void set(long millis) {
            this.millis = millis;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return Instant.ofEpochMilli(millis);
        }

        @Override
        public long millis() {
            return millis;
        }
    }
}
