package com.proxymirror.host;

public interface WriteScopeProvider {

    /**
     * Blocks until no other thread reads or writes, then returns the held scope.
     */
    WriteScope acquireWrite();
}
