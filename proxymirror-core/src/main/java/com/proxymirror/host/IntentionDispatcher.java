package com.proxymirror.host;

import com.proxymirror.ast.LeafElement;
import com.proxymirror.ast.SourceFile;
import com.proxymirror.ast.SyntaxNode;
import com.proxymirror.intention.IntentionAction;
import com.proxymirror.intention.IntentionOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.ServiceLoader;

/**
 * Offers intentions at a caret offset and runs them against a {@link Document}.
 */
public class IntentionDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(IntentionDispatcher.class);

    private final List<IntentionAction> intentions;

    public IntentionDispatcher(List<? extends IntentionAction> intentions) {
        List<IntentionAction> sorted = new ArrayList<>(intentions);
        sorted.sort(Comparator.comparing(IntentionAction::getPriority));
        this.intentions = List.copyOf(sorted);
    }

    /**
     * Creates a dispatcher over every {@link IntentionAction} registered with
     * {@link ServiceLoader}.
     *
     * @throws IllegalStateException if none is registered
     */
    public static IntentionDispatcher withRegisteredIntentions() {
        List<IntentionAction> found = new ArrayList<>();
        ServiceLoader.load(IntentionAction.class).forEach(found::add);
        if (found.isEmpty()) {
            throw new IllegalStateException(
                "No IntentionAction registered in META-INF/services/" + IntentionAction.class.getName());
        }
        logger.debug("Loaded {} intention(s)", found.size());
        return new IntentionDispatcher(found);
    }

    public List<IntentionAction> intentions() {
        return intentions;
    }

    public List<IntentionAction> availableAt(Document document, int offset) {
        return document.read(file -> {
            List<IntentionAction> available = new ArrayList<>();
            for (IntentionAction intention : intentions) {
                if (elementFor(file, offset, intention) != null) {
                    available.add(intention);
                }
            }
            return available;
        });
    }

    /**
     * Runs {@code intention} at {@code offset}. Intentions that start in a write action
     * run inside the document's write scope; if one throws, the document is restored.
     *
     * @throws IntentionFailedException if the intention throws
     */
    public IntentionOutcome invoke(Document document, int offset, IntentionAction intention) {
        if (!intention.startInWriteAction()) {
            return document.read(file -> invokeAt(file, offset, intention));
        }
        try (WriteScope ignored = document.acquireWrite()) {
            String snapshot = document.file().text();
            try {
                IntentionOutcome outcome = invokeAt(document.file(), offset, intention);
                logger.debug("{} at offset {}: {}", intention.getFamilyName(), offset, outcome);
                return outcome;
            } catch (RuntimeException e) {
                document.restore(snapshot);
                logger.warn("{} failed at offset {}, document restored", intention.getFamilyName(), offset, e);
                throw new IntentionFailedException(intention.getFamilyName() + " failed: " + e.getMessage(), e);
            }
        }
    }

    private static IntentionOutcome invokeAt(SourceFile file, int offset, IntentionAction intention) {
        SyntaxNode element = elementFor(file, offset, intention);
        if (element == null) {
            return IntentionOutcome.NOT_APPLICABLE;
        }
        return intention.invoke(element);
    }

    // A caret right after an identifier still refers to it
    private static SyntaxNode elementFor(SourceFile file, int offset, IntentionAction intention) {
        LeafElement leaf = file.findLeafAt(offset);
        if (leaf != null && intention.isAvailable(leaf)) {
            return leaf;
        }
        if (offset > 0) {
            LeafElement before = file.findLeafAt(offset - 1);
            if (before != null && intention.isAvailable(before)) {
                return before;
            }
        }
        return null;
    }
}
