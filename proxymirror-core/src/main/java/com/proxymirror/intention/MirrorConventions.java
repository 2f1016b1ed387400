package com.proxymirror.intention;

/**
 * Naming conventions of the presenter / view-state pattern. Components left null
 * take their default.
 *
 * @param stateClassName      exact name of the class whose properties can be mirrored
 * @param presenterNameMarker substring identifying the presenter class
 * @param proxyPropertyName   exact name of the presenter property holding the proxy object
 * @param delegateTemplate    text of the mirrored property; {@code {identifier}} is the
 *                            property name as written, {@code {name}} the same without backticks
 * @param indentUnit          indentation added for the first member of an empty body; a
 *                            single tab replaces it when the enclosing line is tab-indented
 */
public record MirrorConventions(
    String stateClassName,
    String presenterNameMarker,
    String proxyPropertyName,
    String delegateTemplate,
    String indentUnit
) {
    public static final String DEFAULT_STATE_CLASS_NAME = "State";
    public static final String DEFAULT_PRESENTER_NAME_MARKER = "Presenter";
    public static final String DEFAULT_PROXY_PROPERTY_NAME = "viewStateProxy";
    public static final String DEFAULT_DELEGATE_TEMPLATE = "override val {identifier} by owner.delegateFor(\"{name}\")";
    public static final String DEFAULT_INDENT_UNIT = "    ";

    public static final MirrorConventions DEFAULTS = new MirrorConventions(null, null, null, null, null);

    public MirrorConventions {
        if (stateClassName == null) {
            stateClassName = DEFAULT_STATE_CLASS_NAME;
        }
        if (presenterNameMarker == null) {
            presenterNameMarker = DEFAULT_PRESENTER_NAME_MARKER;
        }
        if (proxyPropertyName == null) {
            proxyPropertyName = DEFAULT_PROXY_PROPERTY_NAME;
        }
        if (delegateTemplate == null) {
            delegateTemplate = DEFAULT_DELEGATE_TEMPLATE;
        }
        if (indentUnit == null) {
            indentUnit = DEFAULT_INDENT_UNIT;
        }
        if (!indentUnit.isBlank()) {
            throw new IllegalArgumentException("indentUnit must be whitespace, got '" + indentUnit + "'");
        }
    }
}
