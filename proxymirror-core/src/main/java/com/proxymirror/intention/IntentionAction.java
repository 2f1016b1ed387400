package com.proxymirror.intention;

import com.proxymirror.ast.SyntaxNode;

/**
 * An action offered at a caret position.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader} and must have a
 * public no-argument constructor to be registered that way.</p>
 */
public interface IntentionAction {

    /**
     * Label shown in the list of available actions.
     */
    String getText();

    /**
     * Stable name of the action family, used for registration and diagnostics.
     */
    String getFamilyName();

    Priority getPriority();

    /**
     * Whether the host must hold the write scope for the whole of {@link #invoke}.
     */
    boolean startInWriteAction();

    /**
     * Checks whether the action applies to the leaf under the caret. Never throws and
     * never modifies the tree.
     */
    boolean isAvailable(SyntaxNode element);

    /**
     * Performs the action.
     *
     * @return what happened; no-op outcomes leave the tree untouched
     * @throws StructuralAssumptionException if the source does not follow the expected
     *         pattern; the tree is left untouched in that case as well
     */
    IntentionOutcome invoke(SyntaxNode element);
}
