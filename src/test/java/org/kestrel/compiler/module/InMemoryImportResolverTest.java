package org.kestrel.compiler.module;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
public class InMemoryImportResolverTest {

    private InMemoryImportResolver resolver;
    private FileScope main;
    private FileScope util;

    @BeforeEach
    void setUp() {
        resolver = new InMemoryImportResolver();
        main = new FileScope("src/main.kes", "src");
        util = new FileScope("src/lib/util.kes", "src");
        resolver.register(main);
        resolver.register(util);
    }

    @Test
    void testResolvesRelativeToImportingFile() throws ImportException {
        assertThat(resolver.resolveImport(main, "lib/util.kes")).isSameAs(util);
        assertThat(resolver.resolveImport(util, "../main.kes")).isSameAs(main);
    }

    @Test
    void testNormalizesPath() throws ImportException {
        assertThat(resolver.resolveImport(main, "./lib/../lib/util.kes")).isSameAs(util);
    }

    @Test
    void testUnknownFileIsNotFound() {
        assertThatThrownBy(() -> resolver.resolveImport(main, "lib/missing.kes"))
                .isInstanceOf(ImportException.class)
                .satisfies(e -> {
                    ImportException ie = (ImportException) e;
                    assertThat(ie.getKind()).isEqualTo(ImportException.Kind.NOT_FOUND);
                    assertThat(ie.getImportPath()).isEqualTo("lib/missing.kes");
                });
    }

    @Test
    void testImportOutsidePackageRootIsRejected() {
        assertThatThrownBy(() -> resolver.resolveImport(main, "../other/file.kes"))
                .isInstanceOf(ImportException.class)
                .satisfies(e -> assertThat(((ImportException) e).getKind())
                        .isEqualTo(ImportException.Kind.OUTSIDE_PACKAGE));
    }
}
