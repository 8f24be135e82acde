package com.edgen.postfetch.source.render;

/**
 * Headless-browser backend used by the scraper source.
 */
public interface RenderingEngine {

    RenderingSession openSession();
}
