package com.proxymirror.host;

/**
 * Thrown when an intention fails part way. The document has been restored to its text
 * from before the invocation.
 */
public class IntentionFailedException extends RuntimeException {

    public IntentionFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
