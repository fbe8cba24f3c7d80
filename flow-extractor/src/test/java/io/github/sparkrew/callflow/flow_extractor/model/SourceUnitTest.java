package io.github.sparkrew.callflow.flow_extractor.model;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SourceUnitTest {

    @Test
    void testQualifiedNameAndDefaultPackage() {
        SourceUnit packaged = unit("com.example", List.of());
        SourceUnit unpackaged = unit(null, List.of());
        assertEquals("com.example.Helper", packaged.qualifiedName());
        assertEquals("", unpackaged.packageName());
        assertEquals("Helper", unpackaged.qualifiedName());
    }

    @Test
    void testFindImport_IgnoresStaticAndWildcard() {
        SourceUnit unit = unit("com.example", List.of(
                new ImportRef("org.other.Helper", true, false),
                new ImportRef("org.lib", false, true),
                new ImportRef("org.lib.Helper", false, false)
        ));
        assertEquals("org.lib.Helper", unit.findImport("Helper").orElseThrow().qualifiedName());
        assertTrue(unit.findImport("Missing").isEmpty());
    }

    @Test
    void testFilePathUsesForwardSlashes() {
        assertEquals("com/example/Helper.java", unit("com.example", List.of()).filePath());
    }

    @Test
    void testListsAreCopied() {
        List<ImportRef> imports = new ArrayList<>();
        SourceUnit unit = unit("p", imports);
        imports.add(new ImportRef("a.B", false, false));
        assertTrue(unit.imports().isEmpty());
        assertThrows(UnsupportedOperationException.class, () -> unit.methods().add(null));
    }

    private static SourceUnit unit(String packageName, List<ImportRef> imports) {
        return new SourceUnit("Helper", packageName, Path.of("com", "example", "Helper.java"), "class", 1, 3,
                "class Helper {", "class Helper {\n}", imports, List.of(), List.of());
    }
}
