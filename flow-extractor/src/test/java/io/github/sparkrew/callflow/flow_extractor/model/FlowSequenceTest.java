package io.github.sparkrew.callflow.flow_extractor.model;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FlowSequenceTest {

    @Test
    void testClassNamesAndScannedMethods() {
        SourceMethod run = new SourceMethod("A", "run", "", 2, 3, "void run() {\n}", List.of());
        Map<String, List<SourceMethod>> scanned = new LinkedHashMap<>();
        scanned.put("A", List.of(run));
        FlowSequence sequence = new FlowSequence("A",
                List.of(new FlowEntry(1, "A", "A.java", 1, 4), new FlowEntry(2, "B", "B.java", 1, 2)),
                List.of(), scanned, false);

        assertEquals(List.of("A", "B"), sequence.classNames());
        assertEquals(List.of(run), sequence.scannedMethods("A"));
        assertTrue(sequence.scannedMethods("B").isEmpty());
        scanned.clear();
        assertEquals(1, sequence.scannedMethods().size());
        assertThrows(UnsupportedOperationException.class, () -> sequence.scannedMethods().clear());
    }
}
