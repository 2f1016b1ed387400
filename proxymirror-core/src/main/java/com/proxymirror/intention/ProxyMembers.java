package com.proxymirror.intention;

import com.proxymirror.ast.ClassBody;
import com.proxymirror.ast.PropertyDeclaration;

public final class ProxyMembers {

    private ProxyMembers() {
        // Utility class
    }

    /**
     * Whether {@code body} declares a property called {@code name}. Backticks around a
     * declared name are ignored.
     */
    public static boolean hasMember(ClassBody body, String name) {
        for (PropertyDeclaration property : body.properties()) {
            if (name.equals(property.name())) {
                return true;
            }
        }
        return false;
    }
}
