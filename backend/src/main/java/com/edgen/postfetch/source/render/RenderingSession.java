package com.edgen.postfetch.source.render;

import java.time.Duration;

/**
 * One browser page. Must be closed on every exit path.
 */
public interface RenderingSession extends AutoCloseable {

    /**
     * Loads {@code url} and waits until {@code waitForSelector} matches or {@code timeout} elapses.
     *
     * @return the rendered document markup
     * @throws RenderingException when the page cannot be rendered in time
     */
    String navigate(String url, String waitForSelector, Duration timeout);

    @Override
    void close();
}
