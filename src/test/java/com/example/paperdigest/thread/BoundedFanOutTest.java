package com.example.paperdigest.thread;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class BoundedFanOutTest {

    private final ExecutorService pool = Executors.newFixedThreadPool(3);
    private final Clock clock = Clock.systemUTC();

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
        MDC.clear();
    }

    @Test
    void outcomesFollowInputOrderNotCompletionOrder() {
        List<BoundedFanOut.Outcome<String>> out = BoundedFanOut.run(List.of(60, 5, 30), ms -> {
            sleep(ms);
            return "done-" + ms;
        }, pool, null, clock);

        assertThat(out).extracting(BoundedFanOut.Outcome::value).containsExactly("done-60", "done-5", "done-30");
    }

    @Test
    void failureOfOneTaskDoesNotAffectOthers() {
        List<BoundedFanOut.Outcome<Integer>> out = BoundedFanOut.run(List.of(1, 0, 4), n -> 8 / n, pool, null, clock);

        assertThat(out.get(0).value()).isEqualTo(8);
        assertThat(out.get(1).isSuccess()).isFalse();
        assertThat(out.get(1).error()).isInstanceOf(ArithmeticException.class);
        assertThat(out.get(2).value()).isEqualTo(2);
    }

    @Test
    void tasksPendingAtDeadlineAreCancelledAndFinishedOnesKept() throws InterruptedException {
        CountDownLatch release = new CountDownLatch(1);
        List<BoundedFanOut.Outcome<String>> out = BoundedFanOut.run(List.of("fast", "stuck"), s -> {
            if (s.equals("stuck")) {
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return s;
        }, pool, clock.instant().plus(Duration.ofMillis(300)), clock);
        release.countDown();

        assertThat(out.get(0).value()).isEqualTo("fast");
        assertThat(out.get(1).cancelled()).isTrue();
    }

    @Test
    void callerMdcIsVisibleInWorkers() {
        MDC.put("runId", "run-42");

        List<BoundedFanOut.Outcome<String>> out = BoundedFanOut.run(List.of(1, 2), i -> MDC.get("runId"),
                pool, null, clock);

        assertThat(out).extracting(BoundedFanOut.Outcome::value).containsOnly("run-42");
    }

    private static void sleep(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
