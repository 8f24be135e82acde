package com.edgen.postfetch.source.render;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RenderingSessionPoolTest {

    private final AtomicInteger opened = new AtomicInteger();
    private final AtomicInteger closed = new AtomicInteger();

    private final RenderingEngine engine = () -> {
        opened.incrementAndGet();
        return new RenderingSession() {
            @Override
            public String navigate(String url, String waitForSelector, Duration timeout) {
                return "<html></html>";
            }

            @Override
            public void close() {
                closed.incrementAndGet();
            }
        };
    };

    @Test
    void acquireFailsWhenAllSessionsAreInUse() {
        RenderingSessionPool pool = new RenderingSessionPool(engine, 2);
        RenderingSession first = pool.acquire(Duration.ofMillis(10));
        RenderingSession second = pool.acquire(Duration.ofMillis(10));

        assertEquals(2, pool.activeSessions());
        assertThrows(SessionPoolExhaustedException.class, () -> pool.acquire(Duration.ofMillis(20)));

        first.close();
        second.close();
        assertEquals(0, pool.activeSessions());
    }

    @Test
    void closeIsIdempotent() {
        RenderingSessionPool pool = new RenderingSessionPool(engine, 1);
        RenderingSession session = pool.acquire(Duration.ofMillis(10));

        session.close();
        session.close();

        assertEquals(1, closed.get());
        assertEquals(0, pool.activeSessions());
        pool.acquire(Duration.ofMillis(10)).close();
        assertEquals(2, opened.get());
    }

    @Test
    void failedOpenReturnsPermit() {
        RenderingSessionPool pool = new RenderingSessionPool(() -> {
            throw RenderingException.io("renderer unreachable", null);
        }, 1);

        assertThrows(RenderingException.class, () -> pool.acquire(Duration.ofMillis(10)));

        assertEquals(0, pool.activeSessions());
    }

    @Test
    void closedSessionRejectsNavigation() {
        RenderingSessionPool pool = new RenderingSessionPool(engine, 1);
        RenderingSession session = pool.acquire(Duration.ofMillis(10));
        session.close();

        assertThrows(IllegalStateException.class,
                () -> session.navigate("https://x.com/a/status/1", "article", Duration.ofSeconds(1)));
    }
}
