package com.edgen.postfetch.source.render;

import lombok.Getter;

@Getter
public class RenderingException extends RuntimeException {

    /**
     * HTTP status reported by the rendering service, or 0 when none was received.
     */
    private final int status;
    private final boolean timeout;

    public RenderingException(String message, int status, boolean timeout, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.timeout = timeout;
    }

    public static RenderingException timeout(String message) {
        return new RenderingException(message, 0, true, null);
    }

    public static RenderingException status(int status, String message) {
        return new RenderingException(message, status, false, null);
    }

    public static RenderingException io(String message, Throwable cause) {
        return new RenderingException(message, 0, false, cause);
    }
}
