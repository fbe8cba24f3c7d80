package io.github.sparkrew.callflow.flow_extractor;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.github.sparkrew.callflow.flow_extractor.model.RenderedFlow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes {@code <target>_flow.java} and {@code <target>_flow.json} to an output directory.
 */
public class FlowWriter {

    private static final Logger log = LoggerFactory.getLogger(FlowWriter.class);

    private final ObjectMapper mapper;

    public FlowWriter() {
        mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public void write(RenderedFlow rendered, Path outputDir) throws IOException {
        Files.createDirectories(outputDir);
        String target = rendered.manifest().target();

        Path javaOut = javaFile(outputDir, target);
        Files.writeString(javaOut, rendered.mergedSource(), StandardCharsets.UTF_8);
        log.info("Wrote merged Java reference to {}", javaOut);

        Path jsonOut = jsonFile(outputDir, target);
        mapper.writeValue(jsonOut.toFile(), rendered.manifest());
        log.info("Wrote flow manifest with {} classes to {}", rendered.manifest().sequence().size(), jsonOut);
    }

    public static Path javaFile(Path outputDir, String target) {
        return outputDir.resolve(target + "_flow.java");
    }

    public static Path jsonFile(Path outputDir, String target) {
        return outputDir.resolve(target + "_flow.json");
    }
}
