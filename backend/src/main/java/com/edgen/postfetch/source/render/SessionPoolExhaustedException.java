package com.edgen.postfetch.source.render;

public class SessionPoolExhaustedException extends RuntimeException {

    public SessionPoolExhaustedException(String message) {
        super(message);
    }
}
