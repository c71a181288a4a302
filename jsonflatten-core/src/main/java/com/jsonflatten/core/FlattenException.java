package com.jsonflatten.core;

/**
 * Base type of the errors raised while flattening.
 */
public class FlattenException extends RuntimeException {
    public FlattenException(String message) { super(message); }
    public FlattenException(String message, Throwable cause) { super(message, cause); }
}
