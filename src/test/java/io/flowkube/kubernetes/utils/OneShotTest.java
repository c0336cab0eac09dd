package io.flowkube.kubernetes.utils;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

class OneShotTest {
    @Test
    void firstCompletionWins() throws InterruptedException {
        OneShot<String> shot = new OneShot<>();

        assertThat(shot.isDone(), is(false));
        assertThat(shot.complete("first"), is(true));
        assertThat(shot.complete("second"), is(false));
        assertThat(shot.fail(new IllegalStateException("late")), is(false));

        assertThat(shot.isDone(), is(true));
        assertThat(shot.get(), is("first"));
    }

    @Test
    void failureIsRethrown() {
        OneShot<String> shot = new OneShot<>();

        assertThat(shot.fail(new IllegalStateException("boom")), is(true));
        assertThat(shot.complete("ignored"), is(false));

        IllegalStateException e = assertThrows(IllegalStateException.class, shot::get);
        assertThat(e.getMessage(), is("boom"));
    }

    @Test
    void getWithTimeoutIsEmptyWhenUnresolved() throws InterruptedException {
        OneShot<String> shot = new OneShot<>();

        assertThat(shot.get(Duration.ofMillis(50)).isPresent(), is(false));
    }

    @Test
    void onlyOneOfManyConcurrentCallersWins() throws InterruptedException {
        OneShot<Integer> shot = new OneShot<>();
        AtomicInteger winners = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(8);

        for (int i = 0; i < 8; i++) {
            int value = i;
            executor.submit(() -> {
                start.await();
                if (shot.complete(value)) {
                    winners.incrementAndGet();
                }
                return null;
            });
        }

        start.countDown();
        executor.shutdown();
        assertThat(executor.awaitTermination(5, TimeUnit.SECONDS), is(true));

        assertThat(winners.get(), is(1));
        assertThat(shot.isDone(), is(true));
    }
}
