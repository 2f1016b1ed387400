package com.proxymirror.host;

import com.proxymirror.ParseException;
import com.proxymirror.ast.SourceFile;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

public class DocumentTest {

    private static final String SOURCE = "class A {\n    val x = 1\n}\n";

    @Test
    void testParsesOnCreation() {
        Document document = new Document(SOURCE);
        assertEquals(SOURCE, document.text());
        assertEquals(1, document.read(SourceFile::classes).size());
    }

    @Test
    void testInvalidSourceIsRejected() {
        assertThrows(ParseException.class, () -> new Document("class A {"));
    }

    @Test
    void testOffsetOf() {
        Document document = new Document(SOURCE);
        assertEquals(0, document.offsetOf(1, 1));
        assertEquals(SOURCE.indexOf("x"), document.offsetOf(2, 9));
        assertEquals(SOURCE.indexOf("}"), document.offsetOf(3, 1));
        // End of a line is a valid caret position
        assertEquals(SOURCE.indexOf("\n"), document.offsetOf(1, 10));
        assertThrows(IllegalArgumentException.class, () -> document.offsetOf(1, 11));
        assertThrows(IllegalArgumentException.class, () -> document.offsetOf(6, 1));
        assertThrows(IllegalArgumentException.class, () -> document.offsetOf(0, 1));
    }

    @Test
    void testWriteScopeCloseIsIdempotent() {
        Document document = new Document(SOURCE);
        WriteScope scope = document.acquireWrite();
        assertTrue(document.isWriteLocked());
        scope.close();
        scope.close();
        assertFalse(document.isWriteLocked());

        try (WriteScope again = document.acquireWrite()) {
            assertTrue(document.isWriteLocked());
        }
        assertFalse(document.isWriteLocked());
    }

    @Test
    void testRestoreRequiresWriteScope() {
        Document document = new Document(SOURCE);
        assertThrows(IllegalStateException.class, () -> document.restore("class B\n"));

        try (WriteScope scope = document.acquireWrite()) {
            document.restore("class B\n");
        }
        assertEquals("class B\n", document.text());
    }

    @Test
    void testReadersWaitForWriter() throws Exception {
        Document document = new Document(SOURCE);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<String> read;
            try (WriteScope scope = document.acquireWrite()) {
                read = executor.submit(document::text);
                assertThrows(TimeoutException.class, () -> read.get(100, TimeUnit.MILLISECONDS));
            }
            assertEquals(SOURCE, read.get(5, TimeUnit.SECONDS));
        } finally {
            executor.shutdownNow();
        }
    }
}
