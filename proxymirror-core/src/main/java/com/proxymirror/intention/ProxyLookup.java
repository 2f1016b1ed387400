package com.proxymirror.intention;

import com.proxymirror.ast.ClassBody;

/**
 * Result of searching a file for the proxy object body.
 */
public sealed interface ProxyLookup permits ProxyLookup.Found, ProxyLookup.Missing {

    record Found(ClassBody body, String propertyName) implements ProxyLookup {
    }

    record Missing(LocateError error) implements ProxyLookup {
    }
}
