package com.questrail.courier.time;

import java.util.Comparator;
import java.util.PriorityQueue;

/**
 * Scheduler for tests: nothing runs until {@link #runDueTasks()} is called,
 * and then only tasks whose deadline the clock has reached, earliest first.
 */
public final class DeterministicScheduler implements MonotonicScheduler {

    private record Entry(long deadlineNanos, long order, Runnable task) {
    }

    private final MonotonicClock clock;
    private final PriorityQueue<Entry> queue = new PriorityQueue<>(
            Comparator.comparingLong(Entry::deadlineNanos).thenComparingLong(Entry::order));
    private long sequence;

    public DeterministicScheduler(MonotonicClock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized void scheduleAtNanos(long deadlineNanos, Runnable task) {
        queue.add(new Entry(deadlineNanos, sequence++, task));
    }

    /**
     * @return number of tasks run
     */
    public int runDueTasks() {
        int ran = 0;
        Entry next;
        while ((next = pollDue()) != null) {
            next.task().run();
            ran++;
        }
        return ran;
    }

    public synchronized int pending() {
        return queue.size();
    }

    private synchronized Entry pollDue() {
        Entry head = queue.peek();
        return head != null && head.deadlineNanos() <= clock.nowNanos() ? queue.poll() : null;
    }
}
