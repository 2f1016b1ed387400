package com.proxymirror.intention;

import com.proxymirror.ast.ClassBody;
import com.proxymirror.ast.Declaration;
import com.proxymirror.ast.PropertyDeclaration;
import com.proxymirror.ast.SourceFile;
import com.proxymirror.ast.SyntaxNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Mirrors a property of the {@code State} class into the presenter's view-state proxy
 * as {@code override val name by owner.delegateFor("name")}.
 *
 * <p>Invoking it again for the same property does nothing.</p>
 */
public class ProxyDelegateIntention implements IntentionAction {

    private static final Logger logger = LoggerFactory.getLogger(ProxyDelegateIntention.class);

    public static final String TEXT = "storeByOwner";
    public static final String FAMILY_NAME = "ProxyDelegateIntention";

    private final MirrorConventions conventions;
    private final ProxyLocator locator;
    private final DelegatedPropertySynthesizer synthesizer;
    private final ProxyBodyMutator mutator;

    public ProxyDelegateIntention() {
        this(MirrorConventions.DEFAULTS);
    }

    public ProxyDelegateIntention(MirrorConventions conventions) {
        this.conventions = conventions;
        this.locator = new ProxyLocator(conventions);
        this.synthesizer = new DelegatedPropertySynthesizer(conventions);
        this.mutator = new ProxyBodyMutator(conventions);
    }

    @Override
    public String getText() {
        return TEXT;
    }

    @Override
    public String getFamilyName() {
        return FAMILY_NAME;
    }

    @Override
    public Priority getPriority() {
        return Priority.TOP;
    }

    @Override
    public boolean startInWriteAction() {
        return true;
    }

    @Override
    public boolean isAvailable(SyntaxNode element) {
        return locator.findStateProperty(element).isPresent();
    }

    @Override
    public IntentionOutcome invoke(SyntaxNode element) {
        PropertyDeclaration stateProperty = locator.findStateProperty(element).orElse(null);
        SourceFile file = element == null ? null : element.containingFile();
        if (stateProperty == null || file == null) {
            logger.debug("Not applicable at {}", element);
            return IntentionOutcome.NOT_APPLICABLE;
        }

        String identifier = element.text();
        String name = Declaration.unquote(identifier);
        ProxyLookup lookup = locator.locateTargets(file, name);
        if (lookup instanceof ProxyLookup.Missing missing) {
            logger.debug("Cannot mirror '{}': {}", name, missing.error());
            return missing.error().outcome();
        }

        ClassBody body = ((ProxyLookup.Found) lookup).body();
        if (ProxyMembers.hasMember(body, name)) {
            logger.debug("'{}' is already mirrored in {}", name, conventions.proxyPropertyName());
            return IntentionOutcome.ALREADY_MIRRORED;
        }

        mutator.insert(body, synthesizer.build(identifier));
        logger.info("Mirrored state property '{}' into {}", name, conventions.proxyPropertyName());
        return IntentionOutcome.INSERTED;
    }
}
