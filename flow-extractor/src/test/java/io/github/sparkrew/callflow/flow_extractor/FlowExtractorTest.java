package io.github.sparkrew.callflow.flow_extractor;

import io.github.sparkrew.callflow.flow_extractor.model.FlowEntry;
import io.github.sparkrew.callflow.flow_extractor.model.RenderedFlow;
import io.github.sparkrew.callflow.flow_extractor.model.SourceFile;
import io.github.sparkrew.callflow.flow_extractor.model.SourceUnit;
import io.github.sparkrew.callflow.flow_extractor.parser.ParserBackend;
import io.github.sparkrew.callflow.flow_extractor.parser.RegexSourceUnitParser;
import io.github.sparkrew.callflow.flow_extractor.parser.SourceParseException;
import io.github.sparkrew.callflow.flow_extractor.parser.SourceUnitParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

/**
 * Unit tests for FlowExtractor class.
 */
@ExtendWith(MockitoExtension.class)
class FlowExtractorTest {

    @TempDir
    Path tempDir;

    @Mock
    SourceUnitParser parser;

    @ParameterizedTest
    @EnumSource(ParserBackend.class)
    void testExtract_AccountScenarioWithEachBackend(ParserBackend backend) {
        ExtractionOptions options = new ExtractionOptions(tempDir, "CreateAccount", tempDir, backend, 0,
                RenderMode.REACHED_METHODS, false);

        RenderedFlow rendered = new FlowExtractor().extract(FixtureUnits.accountProject(), options);

        assertEquals(List.of("CreateAccount", "AccountService", "Helper"),
                rendered.manifest().sequence().stream().map(FlowEntry::className).toList());
        assertEquals("com/example/service/AccountService.java", rendered.manifest().sequence().get(1).file());
        // System.out is library code and never becomes an entry
        assertFalse(rendered.mergedSource().contains("// === 4."));
    }

    @Test
    void testExtract_SkipsFilesTheParserRejects() throws SourceParseException {
        List<SourceFile> files = FixtureUnits.files(
                "Bad.java", "this is not java",
                "Good.java", "class Good {\n}\n"
        );
        List<SourceUnit> good = new RegexSourceUnitParser().parse(Path.of("Good.java"), "class Good {\n}\n");
        when(parser.parse(eq(Path.of("Bad.java")), anyString()))
                .thenThrow(new SourceParseException(Path.of("Bad.java"), "no type declaration"));
        when(parser.parse(eq(Path.of("Good.java")), anyString())).thenReturn(good);
        FlowExtractor extractor = new FlowExtractor(new SourceScanner(), new FlowWriter(), backend -> parser);

        RenderedFlow rendered = extractor.extract(files, ExtractionOptions.of(tempDir, "Good", tempDir));

        assertEquals(1, rendered.manifest().sequence().size());
        assertEquals("Good", rendered.manifest().sequence().get(0).className());
    }

    @Test
    void testParseAll_SurvivesUnexpectedParserFailure() throws SourceParseException {
        when(parser.parse(eq(Path.of("Crash.java")), anyString())).thenThrow(new IllegalStateException("boom"));
        FlowExtractor extractor = new FlowExtractor(new SourceScanner(), new FlowWriter(), backend -> parser);

        List<SourceUnit> units = extractor.parseAll(FixtureUnits.files("Crash.java", "class Crash {}"), parser);

        assertTrue(units.isEmpty());
    }

    @Test
    void testRun_WritesOutputsFromDisk() throws IOException {
        Path project = tempDir.resolve("project");
        Path out = tempDir.resolve("out");
        for (SourceFile file : FixtureUnits.accountProject()) {
            Path target = project.resolve(file.path());
            Files.createDirectories(target.getParent());
            Files.writeString(target, file.text());
        }
        ExtractionOptions options = new ExtractionOptions(project, "CreateAccount", out, ParserBackend.REGEX, 0,
                RenderMode.REACHED_METHODS, false);

        new FlowExtractor().run(options);
        byte[] firstManifest = Files.readAllBytes(out.resolve("CreateAccount_flow.json"));
        new FlowExtractor().run(options);

        assertArrayEquals(firstManifest, Files.readAllBytes(out.resolve("CreateAccount_flow.json")));
        String merged = Files.readString(out.resolve("CreateAccount_flow.java"));
        assertTrue(merged.contains("// === 3. Helper  (from com/example/util/Helper.java lines 3-7)"));
        assertTrue(merged.contains("// ---- method: create"));
    }

    @Test
    void testRun_TargetNotFoundWritesNothing() throws IOException {
        Path project = Files.createDirectories(tempDir.resolve("project"));
        Files.writeString(project.resolve("Other.java"), "class Other {\n}\n");
        Path out = tempDir.resolve("out");
        ExtractionOptions options = ExtractionOptions.of(project, "CreateAccount", out);

        assertThrows(TargetNotFoundException.class, () -> new FlowExtractor().run(options));
        assertFalse(Files.exists(out.resolve("CreateAccount_flow.json")));
        assertFalse(Files.exists(out.resolve("CreateAccount_flow.java")));
    }

    @Test
    void testExtract_HonorsCeilingAndRenderMode() {
        ExtractionOptions options = new ExtractionOptions(tempDir, "CreateAccount", tempDir, ParserBackend.REGEX,
                2, RenderMode.FULL_CLASS, false);

        RenderedFlow rendered = new FlowExtractor().extract(FixtureUnits.accountProject(), options);

        assertEquals(2, rendered.manifest().sequence().size());
        assertTrue(rendered.mergedSource().contains("// The flow was cut at 2 classes."));
        assertFalse(rendered.mergedSource().contains("// ---- method:"));
    }
}
