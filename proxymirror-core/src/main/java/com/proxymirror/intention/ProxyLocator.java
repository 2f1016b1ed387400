package com.proxymirror.intention;

import com.proxymirror.ast.ClassBody;
import com.proxymirror.ast.ClassDeclaration;
import com.proxymirror.ast.NodeKind;
import com.proxymirror.ast.ObjectDeclaration;
import com.proxymirror.ast.ObjectLiteralExpression;
import com.proxymirror.ast.PropertyDeclaration;
import com.proxymirror.ast.SourceFile;
import com.proxymirror.ast.SyntaxNode;
import com.proxymirror.ast.TreeUtil;

import java.util.Optional;

/**
 * Finds the nodes the intention works on: the state property under the caret and the
 * body of the object literal assigned to the presenter's proxy property.
 *
 * <p>When several classes or properties match, the first in document order wins.</p>
 */
public class ProxyLocator {

    private final MirrorConventions conventions;

    public ProxyLocator(MirrorConventions conventions) {
        this.conventions = conventions;
    }

    /**
     * Returns the property whose name identifier is {@code caret}, provided the property
     * is declared directly in the body of the state class.
     */
    public Optional<PropertyDeclaration> findStateProperty(SyntaxNode caret) {
        if (caret == null || caret.kind() != NodeKind.IDENTIFIER) {
            return Optional.empty();
        }
        Optional<PropertyDeclaration> property = parentAs(caret, PropertyDeclaration.class);
        boolean inStateClass = property
            .flatMap(p -> parentAs(p, ClassBody.class))
            .flatMap(body -> parentAs(body, ClassDeclaration.class))
            .map(ClassDeclaration::name)
            .filter(conventions.stateClassName()::equals)
            .isPresent();
        return inStateClass ? property : Optional.empty();
    }

    public Optional<ClassDeclaration> findPresenterClass(SourceFile file) {
        for (ClassDeclaration candidate : file.classes()) {
            String name = candidate.name();
            if (name != null && name.contains(conventions.presenterNameMarker())) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    public Optional<PropertyDeclaration> findProxyProperty(ClassDeclaration presenter) {
        ClassBody body = presenter.body();
        if (body == null) {
            return Optional.empty();
        }
        for (PropertyDeclaration property : body.properties()) {
            if (conventions.proxyPropertyName().equals(property.name())) {
                return Optional.of(property);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the body of the object literal initializing {@code proxyProperty}.
     *
     * @throws StructuralAssumptionException if the initializer is not an object literal
     *         with a body
     */
    public ClassBody proxyObjectBody(PropertyDeclaration proxyProperty) {
        ObjectLiteralExpression literal = TreeUtil.firstChildOfType(proxyProperty, ObjectLiteralExpression.class);
        if (literal == null) {
            throw new StructuralAssumptionException(
                "'" + proxyProperty.name() + "' is not initialized with an object literal");
        }
        ObjectDeclaration declaration = literal.objectDeclaration();
        ClassBody body = declaration == null ? null : declaration.body();
        if (body == null) {
            throw new StructuralAssumptionException(
                "Object literal assigned to '" + proxyProperty.name() + "' has no body");
        }
        return body;
    }

    /**
     * Looks up where a mirror of state property {@code propertyName} belongs.
     */
    public ProxyLookup locateTargets(SourceFile file, String propertyName) {
        Optional<ClassDeclaration> presenter = findPresenterClass(file);
        if (presenter.isEmpty()) {
            return new ProxyLookup.Missing(LocateError.NO_PRESENTER_CLASS);
        }
        Optional<PropertyDeclaration> proxy = findProxyProperty(presenter.get());
        if (proxy.isEmpty()) {
            return new ProxyLookup.Missing(LocateError.NO_PROXY_PROPERTY);
        }
        return new ProxyLookup.Found(proxyObjectBody(proxy.get()), propertyName);
    }

    private static <T extends SyntaxNode> Optional<T> parentAs(SyntaxNode node, Class<T> type) {
        return Optional.ofNullable(node.parent()).flatMap(parent -> parent.as(type));
    }
}
