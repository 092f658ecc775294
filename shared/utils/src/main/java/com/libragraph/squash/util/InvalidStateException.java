package com.libragraph.squash.util;

/**
 * Thrown when an operation targets a handle that has already been released.
 * Always a programming error on the caller's side.
 */
public class InvalidStateException extends IllegalStateException {

    public InvalidStateException(String message) {
        super(message);
    }
}
