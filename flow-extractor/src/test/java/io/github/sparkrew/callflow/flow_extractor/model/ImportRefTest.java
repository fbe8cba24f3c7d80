package io.github.sparkrew.callflow.flow_extractor.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ImportRefTest {

    @Test
    void testSingleTypeImport() {
        ImportRef ref = new ImportRef("com.example.util.Helper", false, false);
        assertEquals("Helper", ref.simpleName());
        assertEquals("com.example.util", ref.packageName());
        assertEquals("import com.example.util.Helper;", ref.toStatement());
    }

    @Test
    void testWildcardImport() {
        ImportRef ref = new ImportRef("com.example.util", false, true);
        assertNull(ref.simpleName());
        assertEquals("com.example.util", ref.packageName());
        assertEquals("import com.example.util.*;", ref.toStatement());
    }

    @Test
    void testStaticImport() {
        ImportRef ref = new ImportRef("java.util.Objects.requireNonNull", true, false);
        assertEquals("import static java.util.Objects.requireNonNull;", ref.toStatement());
    }
}
