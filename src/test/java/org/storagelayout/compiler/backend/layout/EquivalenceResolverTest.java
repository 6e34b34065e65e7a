package org.storagelayout.compiler.backend.layout;

import org.storagelayout.compiler.api.CompilerErrorCode;
import org.storagelayout.compiler.api.SourceInfo;
import org.storagelayout.compiler.diagnostics.Diagnostic;
import org.storagelayout.compiler.diagnostics.DiagnosticsEngine;
import org.storagelayout.compiler.semantics.ArraySpec;
import org.storagelayout.compiler.semantics.DeclaredType;
import org.storagelayout.compiler.semantics.EquivalenceObject;
import org.storagelayout.compiler.semantics.Scope;
import org.storagelayout.compiler.semantics.ShapeSpec;
import org.storagelayout.compiler.semantics.Symbol;
import org.storagelayout.compiler.semantics.SymbolTable;
import org.storagelayout.compiler.target.TargetCharacteristics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.OptionalLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
public class EquivalenceResolverTest {

    private DiagnosticsEngine diagnostics;
    private SymbolTable table;
    private Scope scope;
    private EquivalenceResolver resolver;

    @BeforeEach
    void setUp() {
        diagnostics = new DiagnosticsEngine();
        table = new SymbolTable(diagnostics);
        scope = table.enterScope(Scope.Kind.SUBPROGRAM, null);
        TypeSizeOracle oracle = new TypeSizeOracle(TargetCharacteristics.defaults(),
                new DefaultTypeCharacterizer(), new RuntimeDescriptorSizer());
        resolver = new EquivalenceResolver(oracle, diagnostics);
    }

    private static SourceInfo src(int line) {
        return new SourceInfo("equiv.f90", line, 1);
    }

    private Symbol object(String name, DeclaredType type, ShapeSpec... dims) {
        return table.declareObject(name, src(1), type, ArraySpec.of(dims));
    }

    @Test
    void scalarsShareTheLaterObjectAsBase() {
        Symbol x = object("X", DeclaredType.integer(4));
        Symbol y = object("Y", DeclaredType.integer(4));
        table.equivalence(EquivalenceObject.of(x, src(3)), EquivalenceObject.of(y, src(3)));

        EquivalenceResolution resolution = resolver.resolve(scope);

        assertThat(resolution.dependencyOf(x)).hasValueSatisfying(dep -> {
            assertThat(dep.symbol()).isSameAs(y);
            assertThat(dep.offset()).isZero();
        });
        assertThat(resolution.isBase(y)).isTrue();
        assertThat(resolution.isDependent(y)).isFalse();
        assertThat(resolution.blockOf(y)).contains(new SizeAndAlignment(4, 4));
        assertThat(x.size()).isEqualTo(4);
        assertThat(diagnostics.getDiagnostics()).isEmpty();
    }

    @Test
    void arrayElementOffsetsChooseTheLargestAsRepresentative() {
        Symbol a = object("A", DeclaredType.real(4), ShapeSpec.explicit(1, 10));
        Symbol b = object("B", DeclaredType.integer(4), ShapeSpec.explicit(1, 5));
        table.equivalence(EquivalenceObject.element(a, src(3), 3), EquivalenceObject.element(b, src(3), 1));

        EquivalenceResolution resolution = resolver.resolve(scope);

        SymbolAndOffset dep = resolution.dependencyOf(b).orElseThrow();
        assertThat(dep.symbol()).isSameAs(a);
        assertThat(dep.offset()).isEqualTo(8);
        assertThat(resolution.blockOf(a)).contains(new SizeAndAlignment(28, 4));
        assertThat(resolution.extendBlockBase(a)).isEqualTo(new SizeAndAlignment(28, 4));
    }

    @Test
    void computesOffsetsColumnMajorFromDeclaredLowerBounds() {
        Symbol m = object("M", DeclaredType.real(8), ShapeSpec.explicit(0, 3), ShapeSpec.explicit(2, 4));

        long offset = resolver.computeOffset(EquivalenceObject.element(m, src(1), 1, 3));

        // (1 - 0) + (3 - 2) * 4 = 5 elements
        assertThat(offset).isEqualTo(40);
    }

    @Test
    void substringOffsetsUseCharacterKindWidth() {
        Symbol c = object("C", DeclaredType.character(2, 10L));
        Symbol s = object("S", DeclaredType.character(1, 10L), ShapeSpec.explicit(1, 3));

        assertThat(resolver.computeOffset(EquivalenceObject.substring(c, src(1), 4))).isEqualTo(6);
        EquivalenceObject elementSubstring = new EquivalenceObject(s, List.of(2L), OptionalLong.of(3), src(1));
        assertThat(resolver.computeOffset(elementSubstring)).isEqualTo(12);
    }

    @Test
    void transitiveChainsResolveDirectlyToOneBase() {
        Symbol x = object("X", DeclaredType.integer(4), ShapeSpec.explicit(1, 4));
        Symbol y = object("Y", DeclaredType.integer(4), ShapeSpec.explicit(1, 4));
        Symbol z = object("Z", DeclaredType.integer(4), ShapeSpec.explicit(1, 4));
        table.equivalence(EquivalenceObject.element(y, src(2), 3), EquivalenceObject.element(z, src(2), 1));
        table.equivalence(EquivalenceObject.element(x, src(3), 2), EquivalenceObject.element(y, src(3), 1));

        EquivalenceResolution resolution = resolver.resolve(scope);

        assertThat(resolution.dependencyOf(y).orElseThrow()).extracting(SymbolAndOffset::symbol, SymbolAndOffset::offset)
                .containsExactly(x, 4L);
        assertThat(resolution.dependencyOf(z).orElseThrow()).extracting(SymbolAndOffset::symbol, SymbolAndOffset::offset)
                .containsExactly(x, 12L);
        assertThat(resolution.blocks()).containsOnlyKeys(x);
        assertThat(resolution.blockOf(x)).contains(new SizeAndAlignment(28, 4));
    }

    @Test
    void conflictingChainsAreReportedWithDesignators() {
        Symbol a = object("A", DeclaredType.real(4), ShapeSpec.explicit(1, 10));
        Symbol b = object("B", DeclaredType.integer(4), ShapeSpec.explicit(1, 4));
        table.equivalence(EquivalenceObject.element(a, src(3), 1), EquivalenceObject.element(b, src(3), 1));
        table.equivalence(EquivalenceObject.element(a, src(4), 2), EquivalenceObject.element(b, src(5), 1));

        EquivalenceResolution resolution = resolver.resolve(scope);

        assertThat(diagnostics.withCode(CompilerErrorCode.EQUIVALENCE_CONFLICTING_OFFSETS)).singleElement().satisfies(d -> {
            assertThat(d.type()).isEqualTo(Diagnostic.Type.ERROR);
            assertThat(d.message()).isEqualTo("'B(2)' and 'B(1)' cannot have the same first storage unit");
            assertThat(d.source()).isEqualTo(src(4));
            assertThat(d.notes()).singleElement().satisfies(n -> {
                assertThat(n.message()).isEqualTo("Incompatible reference to 'B(1)'");
                assertThat(n.source()).isEqualTo(src(5));
            });
        });
        // The first set still stands.
        assertThat(resolution.dependencyOf(a).orElseThrow()).extracting(SymbolAndOffset::symbol, SymbolAndOffset::offset)
                .containsExactly(b, 0L);
    }

    @Test
    void variableNamedTwiceInOneSetIsReported() {
        Symbol c = object("C", DeclaredType.real(4), ShapeSpec.explicit(1, 10));
        Symbol a = object("A", DeclaredType.real(4), ShapeSpec.explicit(1, 10));
        table.equivalence(EquivalenceObject.element(c, src(3), 3),
                EquivalenceObject.element(a, src(4), 1),
                EquivalenceObject.element(a, src(5), 2));

        EquivalenceResolution resolution = resolver.resolve(scope);

        assertThat(diagnostics.withCode(CompilerErrorCode.EQUIVALENCE_CONFLICTING_OFFSETS)).singleElement().satisfies(d -> {
            assertThat(d.message()).isEqualTo("'A(1)' and 'A(2)' cannot have the same first storage unit");
            assertThat(d.source()).isEqualTo(src(4));
            assertThat(d.notes()).singleElement().satisfies(n -> {
                assertThat(n.message()).isEqualTo("Incompatible reference to 'A(2)'");
                assertThat(n.source()).isEqualTo(src(5));
            });
        });
        // The first reference to A stands.
        assertThat(resolution.dependencyOf(a).orElseThrow()).extracting(SymbolAndOffset::symbol, SymbolAndOffset::offset)
                .containsExactly(c, 8L);
    }

    @Test
    void conflictWithoutDesignatorFallsBackToOffsets() {
        Symbol a = object("A", DeclaredType.real(4), ShapeSpec.explicit(1, 10));
        Symbol x = object("X", DeclaredType.integer(4));
        table.equivalence(EquivalenceObject.element(a, src(3), 1), EquivalenceObject.of(x, src(3)));
        table.equivalence(EquivalenceObject.element(a, src(4), 2), EquivalenceObject.of(x, src(5)));

        resolver.resolve(scope);

        assertThat(diagnostics.withCode(CompilerErrorCode.EQUIVALENCE_CONFLICTING_OFFSETS)).singleElement().satisfies(d -> {
            assertThat(d.message()).isEqualTo("'X' (offset 4 bytes and 0 bytes) cannot have the same first storage unit");
            assertThat(d.notes().get(0).message()).isEqualTo("Incompatible reference to 'X' offset 0 bytes");
        });
    }

    @Test
    void alreadySizedMemberIsAnInternalError() {
        Symbol x = object("X", DeclaredType.integer(4));
        Symbol y = object("Y", DeclaredType.integer(4));
        table.equivalence(EquivalenceObject.of(x, src(3)), EquivalenceObject.of(y, src(3)));
        x.setSize(4);

        assertThatThrownBy(() -> resolver.resolve(scope)).isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("X");
    }
}
