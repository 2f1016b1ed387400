package com.proxymirror.json;

/**
 * A tree could not be written as JSON, or JSON did not describe a tree of the expected type.
 */
public class TreeJsonException extends RuntimeException {

    public TreeJsonException(String message) {
        super(message);
    }

    public TreeJsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
