package org.kestrel.compiler.frontend.semantics.analysis;

import org.kestrel.compiler.api.CompilerErrorCode;
import org.kestrel.compiler.frontend.semantics.SemaTestSupport;
import org.kestrel.compiler.frontend.untyped.Ref;
import org.kestrel.compiler.module.Decl;
import org.kestrel.compiler.module.FileScope;
import org.kestrel.compiler.module.ImportException;
import org.kestrel.compiler.module.ImportResolver;
import org.kestrel.compiler.types.PointerType;
import org.kestrel.compiler.types.SimpleType;
import org.kestrel.compiler.types.TypeValue;
import org.kestrel.compiler.types.Types;
import org.kestrel.compiler.types.Values;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.kestrel.compiler.frontend.untyped.Tag.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@Tag("unit")
@ExtendWith(MockitoExtension.class)
public class DeclAnalysisHandlerTest {

    @Mock
    private ImportResolver resolver;

    @Test
    void testDeclarationValueIsLoaded() {
        SemaTestSupport support = new SemaTestSupport();
        Decl a = support.declare("a", b -> b.bin(AS, Ref.U8_TYPE, b.intLit(7)));
        Decl c = support.declare("c", b -> b.bin(ADD, b.named(DECL_VAL, "a"), Ref.ONE));

        assertThat(support.analyze()).isTrue();
        assertThat(c.typedValue().type()).isEqualTo(Types.U8);
        assertThat(Values.toLong(c.typedValue().value())).isEqualTo(8);
        assertThat(c.dependencies()).containsExactly(a);
        assertThat(a.dependants()).containsExactly(c);
    }

    /**
     * Verifies that a declaration referenced before its own turn is analyzed on demand.
     */
    @Test
    void testForwardReferenceIsAnalyzedOnDemand() {
        SemaTestSupport support = new SemaTestSupport();
        Decl first = support.declare("first", b -> b.named(DECL_VAL, "second"));
        Decl second = support.declare("second", b -> b.bin(AS, Ref.U32_TYPE, b.intLit(9)));

        assertThat(support.analyze()).isTrue();
        assertThat(first.typedValue()).isEqualTo(second.typedValue());
    }

    @Test
    void testDeclRefIsConstPointer() {
        SemaTestSupport support = new SemaTestSupport();
        support.declare("a", b -> b.bin(AS, Ref.U8_TYPE, b.intLit(7)));
        Decl ref = support.declare("ref", b -> b.named(DECL_REF, "a"));

        assertThat(support.analyze()).isTrue();
        assertThat(ref.typedValue().type()).isEqualTo(Types.simplePtrType(Types.U8, false, PointerType.Size.ONE));
    }

    @Test
    void testUndeclaredIdentifierIsReported() {
        SemaTestSupport support = new SemaTestSupport();
        Decl x = support.declare("x", b -> b.named(DECL_VAL, "nope"));

        assertThat(support.analyze()).isFalse();
        assertThat(support.errors()).containsExactly("use of undeclared identifier 'nope'");
        assertThat(x.status()).isEqualTo(Decl.Status.SEMA_FAILURE);
    }

    @Test
    void testImportYieldsRootType() throws Exception {
        FileScope other = new FileScope("lib/other.kes", "");
        when(resolver.resolveImport(any(FileScope.class), eq("lib/other.kes"))).thenReturn(other);
        SemaTestSupport support = new SemaTestSupport(resolver);
        Decl x = support.declare("x", b -> b.named(IMPORT, "lib/other.kes"));

        assertThat(support.analyze()).isTrue();
        assertThat(x.typedValue().type()).isEqualTo(SimpleType.TYPE);
        assertThat(x.typedValue().value()).isEqualTo(new TypeValue(other.rootType()));
        verify(resolver).resolveImport(support.file(), "lib/other.kes");
    }

    @Test
    void testMissingImportIsReported() throws Exception {
        when(resolver.resolveImport(any(FileScope.class), eq("missing.kes")))
                .thenThrow(new ImportException(ImportException.Kind.NOT_FOUND, "missing.kes"));
        SemaTestSupport support = new SemaTestSupport(resolver);
        support.declare("x", b -> b.named(IMPORT, "missing.kes"));

        assertThat(support.analyze()).isFalse();
        assertThat(support.errors()).containsExactly("unable to find 'missing.kes'");
        assertThat(support.diagnostics().get(0).code()).isEqualTo(CompilerErrorCode.IMPORT_FAILED);
    }

    @Test
    void testImportOutsidePackageIsReported() {
        SemaTestSupport support = new SemaTestSupport();
        support.declare("x", b -> b.named(IMPORT, "../escape.kes"));

        assertThat(support.analyze()).isFalse();
        assertThat(support.errors()).containsExactly("import of file outside package path: '../escape.kes'");
    }
}
