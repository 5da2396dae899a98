package com.vtb.vulnpolicy.util;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Сигнал отмены, который передается через все блокирующие вызовы резолвера.
 * Может иметь дедлайн: в этот момент общий таймер сам вызывает cancel(),
 * так что подписчики (например, HTTP-вызов в полете) прерываются без опроса.
 * Потокобезопасен, один сигнал можно разделять между воркерами.
 */
public final class CancellationSignal {

    private static final ScheduledThreadPoolExecutor DEADLINES = deadlineTimer();

    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();
    private final Instant deadline;
    private volatile ScheduledFuture<?> deadlineTask;

    private CancellationSignal(Instant deadline) {
        this.deadline = deadline;
    }

    /**
     * Сигнал, который срабатывает только по явному cancel().
     */
    public static CancellationSignal create() {
        return new CancellationSignal(null);
    }

    public static CancellationSignal withTimeout(Duration timeout) {
        CancellationSignal signal = new CancellationSignal(Instant.now().plus(timeout));
        if (timeout.isNegative() || timeout.isZero()) {
            signal.cancel();
        } else {
            signal.deadlineTask = DEADLINES.schedule(signal::cancel, timeout.toNanos(), TimeUnit.NANOSECONDS);
        }
        return signal;
    }

    public synchronized void cancel() {
        if (cancelled.getCount() == 0) {
            return;
        }
        cancelled.countDown();
        ScheduledFuture<?> task = deadlineTask;
        if (task != null) {
            task.cancel(false);
        }
        for (Runnable listener : listeners) {
            listener.run();
        }
    }

    /**
     * Остаток времени до дедлайна, null если дедлайна нет.
     */
    public Duration remaining() {
        if (deadline == null) {
            return null;
        }
        Duration left = Duration.between(Instant.now(), deadline);
        return left.isNegative() ? Duration.ZERO : left;
    }

    public boolean isCancelled() {
        if (cancelled.getCount() == 0) {
            return true;
        }
        if (deadline != null && !Instant.now().isBefore(deadline)) {
            cancel();
            return true;
        }
        return false;
    }

    /**
     * Подписка на отмену (например, чтобы прервать HTTP-вызов).
     * Если сигнал уже сработал, listener вызывается сразу.
     */
    public Registration onCancel(Runnable listener) {
        listeners.add(listener);
        if (isCancelled()) {
            listener.run();
        }
        return () -> listeners.remove(listener);
    }

    /**
     * Ждет delay либо отмену, что наступит раньше.
     *
     * @return true, если ожидание прервано отменой (или прерыванием потока)
     */
    public boolean sleep(Duration delay) {
        if (isCancelled()) {
            return true;
        }
        Duration wait = delay;
        boolean hitsDeadline = false;
        Duration remaining = remaining();
        if (remaining != null && remaining.compareTo(wait) <= 0) {
            wait = remaining;
            hitsDeadline = true;
        }
        try {
            if (cancelled.await(wait.toNanos(), TimeUnit.NANOSECONDS)) {
                return true;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel();
            return true;
        }
        if (hitsDeadline) {
            cancel();
            return true;
        }
        return false;
    }

    private static ScheduledThreadPoolExecutor deadlineTimer() {
        ScheduledThreadPoolExecutor timer = new ScheduledThreadPoolExecutor(1, runnable -> {
            Thread thread = new Thread(runnable, "cancellation-deadline");
            thread.setDaemon(true);
            return thread;
        });
        timer.setRemoveOnCancelPolicy(true);
        return timer;
    }

    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
