package com.example.paperdigest.thread;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Runs one task per input on a bounded pool and returns the outcomes in input order,
 * whatever order the tasks complete in. Tasks still pending at the deadline are cancelled
 * and reported as such; completed ones are kept.
 */
public final class BoundedFanOut {

    private BoundedFanOut() {
    }

    /**
     * Outcome of one task: exactly one of value, error or cancelled is meaningful.
     */
    public record Outcome<O>(O value, Throwable error, boolean cancelled) {

        static <O> Outcome<O> ok(O value) {
            return new Outcome<>(value, null, false);
        }

        static <O> Outcome<O> failed(Throwable error) {
            return new Outcome<>(null, error, false);
        }

        static <O> Outcome<O> timedOut() {
            return new Outcome<>(null, null, true);
        }

        public boolean isSuccess() {
            return !cancelled && error == null;
        }
    }

    /**
     * @param deadline absolute deadline, or null for none
     */
    public static <I, O> List<Outcome<O>> run(List<I> inputs, Function<I, O> task, ExecutorService pool,
                                              Instant deadline, Clock clock) {
        List<Future<O>> futures = new ArrayList<>(inputs.size());
        for (I input : inputs) {
            futures.add(pool.submit(MdcContext.wrap(() -> task.apply(input))));
        }

        List<Outcome<O>> outcomes = new ArrayList<>(inputs.size());
        boolean interrupted = false;
        for (Future<O> future : futures) {
            if (interrupted) {
                future.cancel(true);
                outcomes.add(Outcome.timedOut());
                continue;
            }
            try {
                if (deadline == null) {
                    outcomes.add(Outcome.ok(future.get()));
                } else {
                    long remaining = Duration.between(clock.instant(), deadline).toMillis();
                    if (remaining <= 0 && !future.isDone()) {
                        future.cancel(true);
                        outcomes.add(Outcome.timedOut());
                    } else {
                        outcomes.add(Outcome.ok(future.get(Math.max(remaining, 0), TimeUnit.MILLISECONDS)));
                    }
                }
            } catch (TimeoutException | CancellationException e) {
                future.cancel(true);
                outcomes.add(Outcome.timedOut());
            } catch (ExecutionException e) {
                outcomes.add(Outcome.failed(e.getCause() != null ? e.getCause() : e));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                interrupted = true;
                future.cancel(true);
                outcomes.add(Outcome.timedOut());
            }
        }
        return outcomes;
    }
}
