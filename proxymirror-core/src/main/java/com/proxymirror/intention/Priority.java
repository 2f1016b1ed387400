package com.proxymirror.intention;

/**
 * Ordering hint for the list of intentions offered at a caret. Declared from most to
 * least prominent.
 */
public enum Priority {
    TOP,
    HIGH,
    NORMAL,
    LOW
}
