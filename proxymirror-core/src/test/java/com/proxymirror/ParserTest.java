package com.proxymirror;

import com.proxymirror.ast.ClassBody;
import com.proxymirror.ast.ClassDeclaration;
import com.proxymirror.ast.CompositeElement;
import com.proxymirror.ast.FunctionDeclaration;
import com.proxymirror.ast.NodeKind;
import com.proxymirror.ast.ObjectDeclaration;
import com.proxymirror.ast.ObjectLiteralExpression;
import com.proxymirror.ast.PropertyDeclaration;
import com.proxymirror.ast.SourceFile;
import com.proxymirror.ast.SyntaxNode;
import com.proxymirror.ast.TreeUtil;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ParserTest {

    static final String PRESENTER_FILE = """
        package com.example.login

        import com.example.base.BasePresenter
        import kotlinx.coroutines.*

        /**
         * Login screen.
         */
        @Suppress("unused")
        class LoginPresenter(
            private val api: LoginApi,
        ) : BasePresenter<LoginView>(), Closeable {

            override val viewStateProxy = object : LoginView {
                override val loading by owner.delegateFor("loading")
            }

            private var attempts: Int = 0
                private set

            val title: String
                get() = "Login #$attempts"

            init {
                println("created")
            }

            fun String.masked(): String = "*".repeat(length)

            fun <T : Any> submit(value: T?, callback: (T) -> Unit) {
                if (value != null) {
                    callback(value)
                } else {
                    attempts++
                }
            }

            companion object {
                const val MAX = 3
            }
        }

        typealias Handler = (String) -> Unit

        data class State(val loading: Boolean = false) {
            val message: String? = null
        }
        """;

    private static ClassBody presenterBody(SourceFile file) {
        return file.classes().get(0).body();
    }

    private static PropertyDeclaration property(ClassBody body, String name) {
        return body.properties().stream()
            .filter(p -> name.equals(p.name()))
            .findFirst()
            .orElseThrow(() -> new AssertionError("No property " + name));
    }

    @Test
    @DisplayName("Parsing reproduces the source text exactly")
    void testLossless() {
        assertEquals(PRESENTER_FILE, Parser.parse(PRESENTER_FILE).text());
    }

    @Test
    void testLosslessForOddInputs() {
        List<String> sources = List.of(
            "",
            "   \n\t",
            "// only a comment",
            "class A",
            "class A\nclass B",
            "fun main() { println(\"hi\") }\n",
            "val x = listOf(1, 2)\n    .map { it * 2 }\n    .filter { it > 2 }\n",
            "object Registry : Map<String, Int> by emptyMap()\n",
            "val (a, b) = pair\n",
            "class C { ; }\n");
        for (String source : sources) {
            assertEquals(source, Parser.parse(source).text(), () -> "round trip of: " + source);
        }
    }

    @Test
    void testTopLevelStructure() {
        SourceFile file = Parser.parse(PRESENTER_FILE);
        List<NodeKind> kinds = file.compositeChildren().stream().map(SyntaxNode::kind).toList();
        assertEquals(List.of(NodeKind.PACKAGE_DIRECTIVE, NodeKind.IMPORT_LIST, NodeKind.CLASS,
            NodeKind.TYPEALIAS, NodeKind.CLASS), kinds);
        assertEquals(List.of("LoginPresenter", "State"),
            file.classes().stream().map(ClassDeclaration::name).toList());
    }

    @Test
    void testModifiersAndAnnotationsAreNotNames() {
        SourceFile file = Parser.parse(PRESENTER_FILE);
        ClassDeclaration presenter = file.classes().get(0);
        assertEquals("LoginPresenter", presenter.nameIdentifier().text());
        assertNotNull(presenter.modifierList());
        assertNotNull(TreeUtil.firstChildOfType(presenter.modifierList(), CompositeElement.class));

        ClassDeclaration state = file.classes().get(1);
        assertTrue(state.hasModifier("data"));
        assertEquals("State", state.name());
    }

    @Test
    void testClassBodyMembers() {
        ClassBody body = presenterBody(Parser.parse(PRESENTER_FILE));
        assertEquals(List.of("viewStateProxy", "attempts", "title"),
            body.properties().stream().map(PropertyDeclaration::name).toList());
        assertEquals(NodeKind.LBRACE, body.firstChild().kind());
        assertNotNull(body.rBrace());

        List<NodeKind> kinds = body.declarations().stream().map(SyntaxNode::kind).toList();
        assertEquals(List.of(NodeKind.PROPERTY, NodeKind.PROPERTY, NodeKind.PROPERTY,
            NodeKind.FUNCTION, NodeKind.FUNCTION, NodeKind.OBJECT_DECLARATION), kinds);
        assertTrue(body.compositeChildren().stream().anyMatch(c -> c.kind() == NodeKind.CLASS_INITIALIZER));
    }

    @Test
    void testObjectLiteralInitializer() {
        PropertyDeclaration proxy = property(presenterBody(Parser.parse(PRESENTER_FILE)), "viewStateProxy");
        assertTrue(proxy.hasModifier("override"));

        ObjectLiteralExpression literal = TreeUtil.firstChildOfType(proxy, ObjectLiteralExpression.class);
        assertNotNull(literal);
        assertSame(literal, proxy.initializer());

        ObjectDeclaration declaration = literal.objectDeclaration();
        assertTrue(declaration.isAnonymous());
        ClassBody objectBody = declaration.body();
        PropertyDeclaration loading = property(objectBody, "loading");
        assertNotNull(loading.delegate());
        assertEquals("owner.delegateFor(\"loading\")", loading.delegateExpression().text());
    }

    @Test
    @DisplayName("Whitespace before a member belongs to the enclosing body")
    void testTriviaPlacement() {
        PropertyDeclaration proxy = property(presenterBody(Parser.parse(PRESENTER_FILE)), "viewStateProxy");
        ClassBody objectBody = TreeUtil.firstChildOfType(proxy, ObjectLiteralExpression.class).objectDeclaration().body();

        List<SyntaxNode> children = objectBody.children();
        assertEquals(NodeKind.LBRACE, children.get(0).kind());
        assertEquals(NodeKind.WHITE_SPACE, children.get(1).kind());
        assertEquals("\n        ", children.get(1).text());
        assertEquals(NodeKind.PROPERTY, children.get(2).kind());
        assertTrue(children.get(2).text().startsWith("override"));
        assertEquals("\n    ", children.get(3).text());
        assertEquals(NodeKind.RBRACE, children.get(4).kind());
    }

    @Test
    void testAccessors() {
        ClassBody body = presenterBody(Parser.parse(PRESENTER_FILE));
        PropertyDeclaration attempts = property(body, "attempts");
        assertTrue(attempts.isVar());
        assertEquals(1, attempts.accessors().size());
        assertEquals("Int", attempts.typeReference().text());

        PropertyDeclaration title = property(body, "title");
        assertFalse(title.isVar());
        assertEquals(1, title.accessors().size());
        assertNull(title.initializer());
    }

    @Test
    void testExtensionFunctionReceiverIsNotTheName() {
        ClassBody body = presenterBody(Parser.parse(PRESENTER_FILE));
        List<FunctionDeclaration> functions = TreeUtil.childrenOfType(body, FunctionDeclaration.class);
        assertEquals(List.of("masked", "submit"), functions.stream().map(FunctionDeclaration::name).toList());
        assertNotNull(functions.get(1).bodyBlock());
    }

    @Test
    void testCompanionObject() {
        ClassBody body = presenterBody(Parser.parse(PRESENTER_FILE));
        ObjectDeclaration companion = TreeUtil.firstChildOfType(body, ObjectDeclaration.class);
        assertTrue(companion.isCompanion());
        assertEquals(List.of("MAX"), companion.body().properties().stream().map(PropertyDeclaration::name).toList());
    }

    @Test
    void testDelegateExpressionWithQualifiedCall() {
        // "owner.delegateFor" must not be read as a receiver type
        SourceFile file = Parser.parse("val x by foo.bar(\"x\")\n");
        PropertyDeclaration x = TreeUtil.firstChildOfType(file, PropertyDeclaration.class);
        assertEquals("x", x.name());
        assertNull(x.typeReference());
        assertEquals("foo.bar(\"x\")", x.delegateExpression().text());
    }

    @Test
    void testGenericExtensionProperty() {
        SourceFile file = Parser.parse("val List<String>.second: String get() = this[1]\n");
        PropertyDeclaration second = TreeUtil.firstChildOfType(file, PropertyDeclaration.class);
        assertEquals("second", second.name());
        assertEquals("List<String>", TreeUtil.firstChildOfType(second, CompositeElement.class).text());
    }

    @Test
    void testParseDeclarationDetachesResult() {
        SyntaxNode node = Parser.parseDeclaration("  override val loading by owner.delegateFor(\"loading\")\n");
        assertNull(node.parent());
        PropertyDeclaration property = node.as(PropertyDeclaration.class).orElseThrow();
        assertEquals("loading", property.name());
        assertEquals("override val loading by owner.delegateFor(\"loading\")", property.text());
    }

    @Test
    void testParseDeclarationRejectsTrailingInput() {
        assertThrows(ExpectedTokenException.class, () -> Parser.parseDeclaration("val a = 1\nval b = 2"));
    }

    @Test
    void testParseDeclarationRejectsExpressions() {
        assertThrows(ExpectedTokenException.class, () -> Parser.parseDeclaration("x + 1"));
    }

    @Test
    void testUnclosedClassBody() {
        ExpectedTokenException e = assertThrows(ExpectedTokenException.class,
            () -> Parser.parse("class A {\n    val x = 1\n"));
        assertTrue(e.getMessage().contains("'}'"), e.getMessage());
        assertEquals(TokenType.EOF, e.getActual().type());
    }

    @Test
    void testMissingPropertyName() {
        ExpectedTokenException e = assertThrows(ExpectedTokenException.class, () -> Parser.parse("val = 3"));
        assertTrue(e.getMessage().contains("property name"), e.getMessage());
        assertEquals(1, e.getLine());
        assertEquals(5, e.getColumn());
    }

    @Test
    void testUnbalancedBracket() {
        assertThrows(ParseException.class, () -> Parser.parse("fun f() { if (x) {\n}\n"));
    }
}
