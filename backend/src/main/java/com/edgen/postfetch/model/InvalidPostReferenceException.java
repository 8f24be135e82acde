package com.edgen.postfetch.model;

public class InvalidPostReferenceException extends IllegalArgumentException {

    public InvalidPostReferenceException(String message) {
        super(message);
    }
}
