/*
 * LookupLoop.java
 * Copyright (C) 2026 Chris Burdess
 *
 * This file is part of lookupcache, a caching DNS lookup library.
 *
 * lookupcache is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * lookupcache is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Lesser General Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with lookupcache.  If not, see <http://www.gnu.org/licenses/>.
 */

package org.bluezoo.lookupcache;

import java.text.MessageFormat;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Single-threaded task loop on which all lookup state lives.
 *
 * <p>{@link DNSLookup} posts its work here with {@link #invokeLater}, and
 * resolver answers are posted back here before they touch the cache or
 * the in-flight registry. Since only the loop thread reads or writes that
 * state, no further locking is required.
 *
 * <p>A loop can run on its own thread ({@link #start()}) or be driven by
 * its owner through {@link #runPendingTasks()}; the latter gives tests a
 * deterministic ordering.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class LookupLoop implements Runnable {

    private static final Logger LOGGER = Logger.getLogger(LookupLoop.class.getName());

    private final String name;
    private final ConcurrentLinkedQueue<Runnable> pendingTasks;
    private final Lock lock;
    private final Condition condition;
    private volatile Thread thread;
    private volatile boolean active;

    /**
     * Creates a new loop.
     *
     * @param name the thread name
     */
    public LookupLoop(String name) {
        this.name = name;
        this.pendingTasks = new ConcurrentLinkedQueue<Runnable>();
        this.lock = new ReentrantLock();
        this.condition = lock.newCondition();
    }

    /**
     * Creates a new loop named "LookupLoop".
     */
    public LookupLoop() {
        this("LookupLoop");
    }

    /**
     * Starts this loop on a new daemon thread.
     */
    public synchronized void start() {
        if (thread != null && thread.isAlive()) {
            return; // Already running
        }
        active = true;
        thread = new Thread(this, name);
        thread.setDaemon(true);
        thread.start();
    }

    /**
     * Returns whether this loop's thread is running.
     *
     * @return true if the thread is alive
     */
    public synchronized boolean isRunning() {
        return thread != null && thread.isAlive();
    }

    /**
     * Returns whether the calling thread is this loop's thread.
     *
     * @return true if called from the loop
     */
    public boolean inLoop() {
        return Thread.currentThread() == thread;
    }

    /**
     * Stops the loop thread after the task it is running, if any.
     * Tasks still queued are discarded.
     */
    public void shutdown() {
        active = false;
        lock.lock();
        try {
            condition.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Queues a task to run on the loop. May be called from any thread.
     *
     * @param task the task
     */
    public void invokeLater(Runnable task) {
        pendingTasks.offer(task);
        lock.lock();
        try {
            condition.signal();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs queued tasks on the calling thread until the queue is empty,
     * including tasks queued by the tasks being run.
     *
     * <p>For owners that drive the loop themselves instead of calling
     * {@link #start()}. While the loop's own thread is running, only that
     * thread may drain the queue.
     *
     * @return the number of tasks run
     * @throws IllegalStateException if called from another thread while
     *         the loop thread is running
     */
    public int runPendingTasks() {
        Thread loopThread = thread;
        if (loopThread != null && loopThread.isAlive() && loopThread != Thread.currentThread()) {
            throw new IllegalStateException(MessageFormat.format(
                    DNSLookup.L10N.getString("err.not_loop_thread"), name));
        }
        int count = 0;
        Runnable task;
        while ((task = pendingTasks.poll()) != null) {
            try {
                task.run();
            } catch (Exception e) {
                LOGGER.log(Level.WARNING, DNSLookup.L10N.getString("warn.task_failed"), e);
            }
            count++;
        }
        return count;
    }

    /**
     * Returns the number of queued tasks.
     *
     * @return the queue length
     */
    public int getPendingTaskCount() {
        return pendingTasks.size();
    }

    @Override
    public void run() {
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(MessageFormat.format(DNSLookup.L10N.getString("debug.loop_started"), name));
        }
        while (active) {
            lock.lock();
            try {
                while (active && pendingTasks.isEmpty()) {
                    condition.await();
                }
            } catch (InterruptedException e) {
                if (!active) {
                    break;
                }
            } finally {
                lock.unlock();
            }
            if (active) {
                runPendingTasks();
            }
        }
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(MessageFormat.format(DNSLookup.L10N.getString("debug.loop_stopped"), name));
        }
    }

}
