package com.example.trafficgate;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

/**
 * 一定間隔でタスクを回すバックグラウンドワーカー。
 * アプリケーションのライフサイクルに合わせて start/stop される。
 *
 * 失敗時の振る舞いは {@link FailurePolicy} で決める。
 * STOP で止まった場合は {@link #isHalted()} が true になり、ヘルスチェックから見える。
 */
public class PeriodicSweeper implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(PeriodicSweeper.class);

    public enum State {
        RUNNING,
        STOPPED
    }

    @FunctionalInterface
    public interface Task {
        void run() throws Exception;
    }

    private final String name;
    private final TaskScheduler scheduler;
    private final Duration interval;
    private final Task task;
    private final FailurePolicy failurePolicy;
    private final Task shutdownTask;
    private final Counter failureCounter;

    private State state = State.STOPPED;
    private ScheduledFuture<?> future;
    private boolean halted;
    private Exception lastFailure;

    public PeriodicSweeper(String name, TaskScheduler scheduler, Duration interval, Task task,
                           FailurePolicy failurePolicy, Task shutdownTask, MeterRegistry registry) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException(name + ": interval must be positive");
        }
        this.name = name;
        this.scheduler = scheduler;
        this.interval = interval;
        this.task = task;
        this.failurePolicy = failurePolicy;
        this.shutdownTask = shutdownTask;
        this.failureCounter = Counter.builder("sweeper_failures_total")
                .tag("sweeper", name)
                .register(registry);
    }

    @Override
    public synchronized void start() {
        if (state == State.RUNNING || halted) {
            return;
        }
        future = scheduler.scheduleAtFixedRate(this::runOnce, Instant.now().plus(interval), interval);
        state = State.RUNNING;
        log.info("{} started, interval={}, failurePolicy={}", name, interval, failurePolicy);
    }

    @Override
    public void stop() {
        synchronized (this) {
            if (state != State.RUNNING) {
                return;
            }
            cancel();
        }
        log.info("{} stopped", name);
        if (shutdownTask != null) {
            try {
                shutdownTask.run();
            } catch (Exception e) {
                log.error("{} final run on shutdown failed", name, e);
            }
        }
    }

    @Override
    public synchronized boolean isRunning() {
        return state == State.RUNNING;
    }

    /**
     * タスクを1回だけ同期実行する。タイマーからもテストからもここを通る。
     *
     * @return 成功したら true。止まっている・失敗したら false
     */
    public boolean runOnce() {
        synchronized (this) {
            if (state != State.RUNNING) {
                return false;
            }
        }
        try {
            task.run();
            return true;
        } catch (Exception e) {
            failureCounter.increment();
            onFailure(e);
            return false;
        }
    }

    private void onFailure(Exception e) {
        synchronized (this) {
            lastFailure = e;
            if (failurePolicy == FailurePolicy.STOP) {
                halted = true;
                cancel();
            }
        }
        if (failurePolicy == FailurePolicy.STOP) {
            log.error("{} failed and is halted until restart", name, e);
        } else {
            log.warn("{} failed, will retry on next tick: {}", name, e.toString());
        }
    }

    private void cancel() {
        if (future != null) {
            future.cancel(false);
            future = null;
        }
        state = State.STOPPED;
    }

    public String getName() { return name; }

    public synchronized State getState() { return state; }

    public synchronized boolean isHalted() { return halted; }

    public synchronized Exception getLastFailure() { return lastFailure; }
}
