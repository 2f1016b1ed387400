package com.proxymirror.intention;

import com.proxymirror.Parser;
import com.proxymirror.ast.ClassBody;
import com.proxymirror.ast.LeafElement;
import com.proxymirror.ast.SourceFile;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ProxyLocatorTest {

    private final ProxyLocator locator = new ProxyLocator(MirrorConventions.DEFAULTS);

    private static LeafElement leafAt(SourceFile file, String source, String marker) {
        return file.findLeafAt(source.indexOf(marker));
    }

    @Test
    void testFindStateProperty() {
        String source = """
            class State {
                val loading: Boolean = false
                fun reset() {}
            }
            """;
        SourceFile file = Parser.parse(source);
        assertEquals("loading", locator.findStateProperty(leafAt(file, source, "loading")).orElseThrow().name());
        assertTrue(locator.findStateProperty(leafAt(file, source, "Boolean")).isEmpty());
        assertTrue(locator.findStateProperty(leafAt(file, source, "val")).isEmpty());
        assertTrue(locator.findStateProperty(leafAt(file, source, "reset")).isEmpty());
        assertTrue(locator.findStateProperty(leafAt(file, source, "State")).isEmpty());
        assertTrue(locator.findStateProperty(null).isEmpty());
    }

    @Test
    void testStateClassNameMustMatchExactly() {
        String source = """
            class ViewState {
                val loading = false
            }
            class state {
                val busy = false
            }
            """;
        SourceFile file = Parser.parse(source);
        assertTrue(locator.findStateProperty(leafAt(file, source, "loading")).isEmpty());
        assertTrue(locator.findStateProperty(leafAt(file, source, "busy")).isEmpty());
    }

    @Test
    void testInterfaceNamedStateQualifies() {
        String source = """
            interface State {
                val loading: Boolean
            }
            """;
        SourceFile file = Parser.parse(source);
        assertTrue(file.classes().get(0).isInterface());
        assertEquals("loading", locator.findStateProperty(leafAt(file, source, "loading")).orElseThrow().name());
    }

    @Test
    void testConstructorParametersAreNotStateProperties() {
        String source = "data class State(val loading: Boolean)\n";
        SourceFile file = Parser.parse(source);
        assertTrue(locator.findStateProperty(leafAt(file, source, "loading")).isEmpty());
    }

    @Test
    void testLocateTargetsFindsProxyBody() {
        String source = """
            class LoginPresenter {
                val other = object : Runnable { override fun run() {} }
                override val viewStateProxy = object : LoginView {
                }
            }
            """;
        ProxyLookup lookup = locator.locateTargets(Parser.parse(source), "loading");
        ProxyLookup.Found found = assertInstanceOf(ProxyLookup.Found.class, lookup);
        assertEquals("loading", found.propertyName());
        assertEquals("{\n    }", found.body().text());
    }

    @Test
    void testNoPresenterClass() {
        ProxyLookup lookup = locator.locateTargets(Parser.parse("class State\nclass LoginScreen\n"), "loading");
        assertEquals(new ProxyLookup.Missing(LocateError.NO_PRESENTER_CLASS), lookup);
    }

    @Test
    void testNoProxyProperty() {
        ProxyLookup lookup = locator.locateTargets(Parser.parse("class LoginPresenter {\n    val proxy = 1\n}\n"), "x");
        assertEquals(new ProxyLookup.Missing(LocateError.NO_PROXY_PROPERTY), lookup);
    }

    @Test
    void testPresenterWithoutBodyHasNoProxyProperty() {
        ProxyLookup lookup = locator.locateTargets(Parser.parse("class LoginPresenter\n"), "x");
        assertEquals(new ProxyLookup.Missing(LocateError.NO_PROXY_PROPERTY), lookup);
    }

    @Test
    void testFirstPresenterWins() {
        String source = """
            class APresenter
            class BPresenter {
                val viewStateProxy = object : View {}
            }
            """;
        // The first presenter has no proxy, later ones are not consulted
        ProxyLookup lookup = locator.locateTargets(Parser.parse(source), "x");
        assertEquals(new ProxyLookup.Missing(LocateError.NO_PROXY_PROPERTY), lookup);
    }

    @Test
    void testNestedPresenterIsNotFound() {
        String source = """
            object Screens {
                class LoginPresenter {
                    val viewStateProxy = object : View {}
                }
            }
            """;
        assertTrue(locator.findPresenterClass(Parser.parse(source)).isEmpty());
    }

    @Test
    void testProxyNotInitializedWithObjectLiteral() {
        String source = """
            class LoginPresenter {
                val viewStateProxy = createProxy()
            }
            """;
        StructuralAssumptionException e = assertThrows(StructuralAssumptionException.class,
            () -> locator.locateTargets(Parser.parse(source), "x"));
        assertTrue(e.getMessage().contains("viewStateProxy"));
    }

    @Test
    void testProxyObjectBody() {
        String source = """
            class LoginPresenter {
                val viewStateProxy = object : View {
                    override val a by owner.delegateFor("a")
                }
            }
            """;
        SourceFile file = Parser.parse(source);
        ClassBody body = locator.proxyObjectBody(
            locator.findProxyProperty(locator.findPresenterClass(file).orElseThrow()).orElseThrow());
        assertTrue(ProxyMembers.hasMember(body, "a"));
        assertFalse(ProxyMembers.hasMember(body, "A"));
        assertFalse(ProxyMembers.hasMember(body, "b"));
    }

    @Test
    void testCustomConventions() {
        MirrorConventions conventions = new MirrorConventions("UiState", "ViewModel", "proxy", null, null);
        ProxyLocator custom = new ProxyLocator(conventions);
        String source = """
            class UiState {
                val count = 0
            }
            class CounterViewModel {
                val proxy = object : CounterView {
                }
            }
            """;
        SourceFile file = Parser.parse(source);
        assertTrue(custom.findStateProperty(leafAt(file, source, "count")).isPresent());
        assertInstanceOf(ProxyLookup.Found.class, custom.locateTargets(file, "count"));
    }
}
