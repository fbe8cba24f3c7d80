package io.github.sparkrew.callflow.flow_extractor.parser;

import io.github.sparkrew.callflow.flow_extractor.model.SourceMethod;
import io.github.sparkrew.callflow.flow_extractor.model.SourceUnit;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * On well-formed input both backends must agree on types, methods and imports.
 */
class ParserBackendEquivalenceTest {

    private static final String ACCOUNT_SERVICE = """
            package com.example.service;

            import com.example.util.Helper;
            import java.util.List;
            import static java.util.Objects.requireNonNull;

            /**
             * Opens accounts.
             */
            public class AccountService implements Service {

                private final List<String> opened = new java.util.ArrayList<>();

                public AccountService() {
                    Helper.log("created");
                }

                @Deprecated
                public void openAccount() {
                    Helper.log("opening");
                    opened.add(requireNonNull("x"));
                }

                String describe(int verbosity) {
                    return verbosity > 0 ? "verbose" : "short";
                }

                static final class Audit {
                    void record(String event) {
                        Helper.log(event);
                    }
                }

                enum State {
                    OPEN, CLOSED;

                    boolean isOpen() {
                        return this == OPEN;
                    }
                }
            }
            """;

    @Test
    void testBackends_AgreeOnCleanInput() throws SourceParseException {
        Path file = Path.of("com/example/service/AccountService.java");
        List<SourceUnit> spoon = ParserBackend.SPOON.create().parse(file, ACCOUNT_SERVICE);
        List<SourceUnit> regex = ParserBackend.REGEX.create().parse(file, ACCOUNT_SERVICE);

        assertEquals(names(regex), names(spoon));
        assertEquals(List.of("AccountService", "Audit", "State"), names(spoon));
        for (int i = 0; i < spoon.size(); i++) {
            SourceUnit s = spoon.get(i);
            SourceUnit r = regex.get(i);
            assertEquals(r.packageName(), s.packageName());
            assertEquals(r.kind(), s.kind());
            assertEquals(methodNames(r), methodNames(s), "methods of " + s.simpleName());
            assertEquals(new HashSet<>(r.imports()), new HashSet<>(s.imports()), "imports of " + s.simpleName());
            assertEquals(r.endLine(), s.endLine(), "end line of " + s.simpleName());
        }
        assertEquals(List.of("AccountService", "openAccount", "describe"), methodNames(spoon.get(0)));
        assertEquals(List.of("Service"), spoon.get(0).supertypes());
        assertEquals(spoon.get(0).supertypes(), regex.get(0).supertypes());
    }

    private static List<String> names(List<SourceUnit> units) {
        return units.stream().map(SourceUnit::simpleName).toList();
    }

    private static List<String> methodNames(SourceUnit unit) {
        return unit.methods().stream().map(SourceMethod::name).toList();
    }
}
