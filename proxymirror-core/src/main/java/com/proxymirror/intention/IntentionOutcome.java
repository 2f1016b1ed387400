package com.proxymirror.intention;

/**
 * Result of invoking an intention. Only {@link #INSERTED} changes the tree.
 */
public enum IntentionOutcome {
    /** The caret is not on a property name inside the state class. */
    NOT_APPLICABLE,
    /** The file declares no presenter class. */
    NO_PRESENTER_CLASS,
    /** The presenter class has no view-state proxy property. */
    NO_PROXY_PROPERTY,
    /** The proxy object already declares a member with that name. */
    ALREADY_MIRRORED,
    INSERTED;

    public boolean changedTree() {
        return this == INSERTED;
    }
}
