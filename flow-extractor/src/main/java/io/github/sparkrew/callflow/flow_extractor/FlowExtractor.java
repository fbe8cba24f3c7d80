package io.github.sparkrew.callflow.flow_extractor;

import io.github.sparkrew.callflow.flow_extractor.model.FlowSequence;
import io.github.sparkrew.callflow.flow_extractor.model.RenderedFlow;
import io.github.sparkrew.callflow.flow_extractor.model.SourceFile;
import io.github.sparkrew.callflow.flow_extractor.model.SourceUnit;
import io.github.sparkrew.callflow.flow_extractor.parser.ParserBackend;
import io.github.sparkrew.callflow.flow_extractor.parser.SourceParseException;
import io.github.sparkrew.callflow.flow_extractor.parser.SourceUnitParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Runs the whole pipeline: scan, parse, catalog, traverse, render and write.
 */
public class FlowExtractor {

    private static final Logger log = LoggerFactory.getLogger(FlowExtractor.class);

    private final SourceScanner scanner;
    private final FlowWriter writer;
    private final Function<ParserBackend, SourceUnitParser> parsers;

    public FlowExtractor() {
        this(new SourceScanner(), new FlowWriter(), ParserBackend::create);
    }

    FlowExtractor(SourceScanner scanner, FlowWriter writer, Function<ParserBackend, SourceUnitParser> parsers) {
        this.scanner = scanner;
        this.writer = writer;
        this.parsers = parsers;
    }

    /**
     * Extracts the flow of the configured target and writes both outputs.
     * Nothing is written when the target cannot be found.
     *
     * @throws TargetNotFoundException if the target class is not declared in the project.
     * @throws IOException             if the tree cannot be walked or the outputs cannot be written.
     */
    public RenderedFlow run(ExtractionOptions options) throws IOException {
        log.info("Scanning project at {}", options.projectRoot());
        List<SourceFile> files = scanner.scan(options.projectRoot());
        RenderedFlow rendered = extract(files, options);
        writer.write(rendered, options.outputDir());
        return rendered;
    }

    /**
     * Extracts a flow from files already in memory. Does not touch the disk.
     */
    public RenderedFlow extract(List<SourceFile> files, ExtractionOptions options) {
        SourceUnitParser parser = parsers.apply(options.backend());
        SymbolCatalog catalog = SymbolCatalog.build(parseAll(files, parser));
        FlowSequence sequence = new FlowTraversal(options.maxClasses(), options.includeSupertypes())
                .extract(options.target(), catalog);
        log.info("Final sequence: {}", String.join(" -> ", sequence.classNames()));
        return new FlowRenderer(options.renderMode()).render(sequence);
    }

    /**
     * Parses every file, skipping the ones the parser rejects.
     */
    List<SourceUnit> parseAll(List<SourceFile> files, SourceUnitParser parser) {
        List<SourceUnit> units = new ArrayList<>();
        int skipped = 0;
        for (SourceFile file : files) {
            try {
                List<SourceUnit> parsed = parser.parse(file.path(), file.text());
                log.debug("Parsed {}: {}", file.path(), parsed.stream().map(SourceUnit::simpleName).toList());
                units.addAll(parsed);
            } catch (SourceParseException e) {
                skipped++;
                log.warn("Skipping file, {}", e.getMessage());
            } catch (RuntimeException e) {
                skipped++;
                log.warn("Failed to parse {}: {}", file.path(), e.getMessage(), e);
            }
        }
        log.info("Parsed {} files into {} types ({} skipped)", files.size() - skipped, units.size(), skipped);
        return units;
    }
}
