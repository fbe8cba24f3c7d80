package io.github.sparkrew.callflow.flow_extractor;

import io.github.sparkrew.callflow.flow_extractor.model.SourceFile;
import io.github.sparkrew.callflow.flow_extractor.model.SourceUnit;
import io.github.sparkrew.callflow.flow_extractor.parser.RegexSourceUnitParser;
import io.github.sparkrew.callflow.flow_extractor.parser.SourceParseException;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds source files and parsed units from inline Java text.
 */
final class FixtureUnits {

    private FixtureUnits() {
    }

    /**
     * @param pathsAndTexts Alternating relative path and file text.
     */
    static List<SourceFile> files(String... pathsAndTexts) {
        List<SourceFile> files = new ArrayList<>();
        for (int i = 0; i < pathsAndTexts.length; i += 2) {
            files.add(new SourceFile(Path.of(pathsAndTexts[i]), pathsAndTexts[i + 1]));
        }
        return files;
    }

    static List<SourceUnit> units(String... pathsAndTexts) {
        RegexSourceUnitParser parser = new RegexSourceUnitParser();
        List<SourceUnit> units = new ArrayList<>();
        for (SourceFile file : files(pathsAndTexts)) {
            try {
                units.addAll(parser.parse(file.path(), file.text()));
            } catch (SourceParseException e) {
                throw new IllegalArgumentException(e);
            }
        }
        return units;
    }

    static SymbolCatalog catalog(String... pathsAndTexts) {
        return SymbolCatalog.build(units(pathsAndTexts));
    }

    static SourceUnit unit(SymbolCatalog catalog, String qualifiedName) {
        if (catalog.lookupQualified(qualifiedName) instanceof SymbolCatalog.Lookup.Resolved resolved) {
            return resolved.unit();
        }
        throw new IllegalArgumentException("No single declaration of " + qualifiedName);
    }

    static final String CREATE_ACCOUNT = """
            package com.example.app;

            import com.example.service.AccountService;

            public class CreateAccount {
                void create() {
                    AccountService svc = new AccountService();
                    svc.openAccount();
                }
            }
            """;

    static final String ACCOUNT_SERVICE = """
            package com.example.service;

            import com.example.util.Helper;

            public class AccountService {
                void openAccount() {
                    Helper.log("opening");
                }
            }
            """;

    static final String HELPER = """
            package com.example.util;

            public class Helper {
                static void log(String s) {
                    System.out.println(s);
                }
            }
            """;

    static List<SourceFile> accountProject() {
        return files(
                "com/example/app/CreateAccount.java", CREATE_ACCOUNT,
                "com/example/service/AccountService.java", ACCOUNT_SERVICE,
                "com/example/util/Helper.java", HELPER
        );
    }
}
