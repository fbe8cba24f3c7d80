package io.github.sparkrew.callflow.flow_extractor;

import io.github.sparkrew.callflow.flow_extractor.model.SourceUnit;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InvocationResolverTest {

    private static final String TARGETS = """
            package lib;

            class Helper {
                static void log(String s) {
                }
            }

            class Outer {
                static class Inner {
                    static void run() {
                    }
                }
            }

            enum Color {
                RED
            }

            class Printer {
                static void print(Object o) {
                }
            }

            class Widget {
            }
            """;

    @Test
    void testResolve_ReceiverShapes() {
        SymbolCatalog catalog = FixtureUnits.catalog(
                "lib/Targets.java", TARGETS,
                "app/Caller.java", """
                        package app;

                        class Caller {
                            private Helper helper;

                            void call(java.util.List<Object> items) {
                                Helper.log("a");
                                Outer.Inner.run();
                                Object c = Color.RED;
                                items.forEach(Printer::print);
                                new Widget();
                                helper.log("b");
                                this.helper.log("c");
                                make().log("d");
                                System.out.println("e");
                                Helper.log("again");
                            }
                        }
                        """
        );
        SourceUnit caller = FixtureUnits.unit(catalog, "app.Caller");

        List<SourceUnit> resolved = new InvocationResolver(catalog).resolve(caller.methods().get(0), caller);

        assertEquals(List.of("Helper", "Outer", "Color", "Printer", "Widget"),
                resolved.stream().map(SourceUnit::simpleName).toList());
    }

    @Test
    void testResolve_QualifiedReceiverUsesQualifiedLookup() {
        SymbolCatalog catalog = FixtureUnits.catalog(
                "one/Helper.java", "package one;\nclass Helper {\n}\n",
                "two/Helper.java", "package two;\nclass Helper {\n}\n",
                "app/Caller.java", """
                        package app;

                        class Caller {
                            void call() {
                                two.Helper.log("x");
                                new one.Helper();
                                missing.pkg.Helper.log("y");
                            }
                        }
                        """
        );
        SourceUnit caller = FixtureUnits.unit(catalog, "app.Caller");

        List<SourceUnit> resolved = new InvocationResolver(catalog).resolve(caller.methods().get(0), caller);

        // Both are named Helper, so only the first occurrence is kept
        assertEquals(1, resolved.size());
        assertEquals("two.Helper", resolved.get(0).qualifiedName());
    }

    @Test
    void testResolve_ExplicitImportWins() {
        SymbolCatalog catalog = collidingCatalog("import b.Util;\nimport c.*;");
        assertEquals("b.Util", resolveUtil(catalog));
    }

    @Test
    void testResolve_WildcardImportBeatsOwnPackage() {
        SymbolCatalog catalog = collidingCatalog("import c.*;");
        assertEquals("c.Util", resolveUtil(catalog));
    }

    @Test
    void testResolve_OwnPackageBeatsFileOrder() {
        SymbolCatalog catalog = collidingCatalog("");
        assertEquals("app.Util", resolveUtil(catalog));
    }

    @Test
    void testResolve_FileOrderIsTheLastResort() {
        SymbolCatalog catalog = FixtureUnits.catalog(
                "a/Util.java", "package a;\nclass Util {\n}\n",
                "b/Util.java", "package b;\nclass Util {\n}\n",
                "app/Caller.java", "package app;\nclass Caller {\n    void call() {\n        Util.run();\n    }\n}\n"
        );
        assertEquals("a.Util", resolveUtil(catalog));
    }

    @Test
    void testResolveSupertypes() {
        SymbolCatalog catalog = FixtureUnits.catalog(
                "p/Base.java", "package p;\nabstract class Base {\n}\n",
                "p/Api.java", "package p;\ninterface Api {\n}\n",
                "p/Impl.java", "package p;\nclass Impl extends Base implements Api, java.io.Serializable {\n}\n"
        );
        SourceUnit impl = FixtureUnits.unit(catalog, "p.Impl");

        List<SourceUnit> supertypes = new InvocationResolver(catalog).resolveSupertypes(impl);

        assertEquals(List.of("Base", "Api"), supertypes.stream().map(SourceUnit::simpleName).toList());
    }

    private static SymbolCatalog collidingCatalog(String callerImports) {
        return FixtureUnits.catalog(
                "a/Util.java", "package a;\nclass Util {\n}\n",
                "app/Caller.java", "package app;\n" + callerImports + "\nclass Caller {\n    void call() {\n"
                        + "        Util.run();\n    }\n}\n",
                "app/Util.java", "package app;\nclass Util {\n}\n",
                "b/Util.java", "package b;\nclass Util {\n}\n",
                "c/Util.java", "package c;\nclass Util {\n}\n"
        );
    }

    private static String resolveUtil(SymbolCatalog catalog) {
        SourceUnit caller = FixtureUnits.unit(catalog, "app.Caller");
        List<SourceUnit> resolved = new InvocationResolver(catalog).resolve(caller.methods().get(0), caller);
        assertEquals(1, resolved.size());
        return resolved.get(0).qualifiedName();
    }
}
