package com.edgen.postfetch.source.render;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Caps concurrent browser sessions. Sessions handed out by {@link #acquire(Duration)}
 * return their permit when closed; closing twice is a no-op.
 */
public class RenderingSessionPool {

    private static final Logger log = LoggerFactory.getLogger(RenderingSessionPool.class);

    private final RenderingEngine engine;
    private final Semaphore permits;
    private final int maxSessions;

    public RenderingSessionPool(RenderingEngine engine, int maxSessions) {
        if (maxSessions < 1) {
            throw new IllegalArgumentException("maxSessions must be at least 1");
        }
        this.engine = engine;
        this.maxSessions = maxSessions;
        this.permits = new Semaphore(maxSessions, true);
    }

    public RenderingSession acquire(Duration timeout) {
        boolean acquired;
        try {
            acquired = permits.tryAcquire(Math.max(0, timeout.toMillis()), TimeUnit.MILLISECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new SessionPoolExhaustedException("Interrupted while waiting for a rendering session");
        }
        if (!acquired) {
            throw new SessionPoolExhaustedException(
                    "No rendering session available within " + timeout.toMillis() + "ms");
        }

        RenderingSession delegate;
        try {
            delegate = engine.openSession();
        } catch (RuntimeException ex) {
            permits.release();
            throw ex;
        }
        return new PooledSession(delegate);
    }

    public int activeSessions() {
        return maxSessions - permits.availablePermits();
    }

    public int maxSessions() {
        return maxSessions;
    }

    private final class PooledSession implements RenderingSession {

        private final RenderingSession delegate;
        private final AtomicBoolean closed = new AtomicBoolean(false);

        private PooledSession(RenderingSession delegate) {
            this.delegate = delegate;
        }

        @Override
        public String navigate(String url, String waitForSelector, Duration timeout) {
            if (closed.get()) {
                throw new IllegalStateException("Rendering session already closed");
            }
            return delegate.navigate(url, waitForSelector, timeout);
        }

        @Override
        public void close() {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            try {
                delegate.close();
            } catch (RuntimeException ex) {
                log.warn("Failed to close rendering session cleanly: {}", ex.getMessage());
            } finally {
                permits.release();
            }
        }
    }
}
