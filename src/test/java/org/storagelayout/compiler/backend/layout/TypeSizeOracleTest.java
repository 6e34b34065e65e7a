package org.storagelayout.compiler.backend.layout;

import org.storagelayout.compiler.api.SourceInfo;
import org.storagelayout.compiler.diagnostics.DiagnosticsEngine;
import org.storagelayout.compiler.semantics.ArraySpec;
import org.storagelayout.compiler.semantics.Attr;
import org.storagelayout.compiler.semantics.DeclaredType;
import org.storagelayout.compiler.semantics.DerivedTypeSpec;
import org.storagelayout.compiler.semantics.Scope;
import org.storagelayout.compiler.semantics.ShapeSpec;
import org.storagelayout.compiler.semantics.Symbol;
import org.storagelayout.compiler.semantics.SymbolDetails;
import org.storagelayout.compiler.semantics.SymbolTable;
import org.storagelayout.compiler.target.TargetCharacteristics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@Tag("unit")
@ExtendWith(MockitoExtension.class)
public class TypeSizeOracleTest {

    @Mock
    private ITypeCharacterizer characterizer;

    @Mock
    private IDescriptorSizer descriptorSizer;

    private SymbolTable table;
    private TypeSizeOracle oracle;

    @BeforeEach
    void setUp() {
        table = new SymbolTable(new DiagnosticsEngine());
        table.enterScope(Scope.Kind.SUBPROGRAM, null);
        TargetCharacteristics target = new TargetCharacteristics(16, 8, 8, 4, 1, TargetCharacteristics.defaults().operatingSystem());
        oracle = new TypeSizeOracle(target, characterizer, descriptorSizer);
    }

    private static SourceInfo src(int line) {
        return new SourceInfo("oracle.f90", line, 1);
    }

    @Test
    void descriptorEntitiesAreSizedByTheDescriptorSizer() {
        Symbol a = table.declareObject("a", src(1), DeclaredType.real(8), ArraySpec.of(ShapeSpec.deferred(), ShapeSpec.deferred()), Attr.ALLOCATABLE);
        when(descriptorSizer.descriptorSize(2, false, 0)).thenReturn(72L);

        assertThat(oracle.sizeAndAlignment(a, true)).isEqualTo(new SizeAndAlignment(72, 8));
        verify(characterizer, never()).characterize(any(), anyBoolean());
    }

    @Test
    void derivedDescriptorsRequestAnAddendumWithLengthParameters() {
        Symbol typeSymbol = table.declare("t", src(1), new SymbolDetails.DerivedType(List.of(), List.of("n", "m")));
        DerivedTypeSpec spec = new DerivedTypeSpec(typeSymbol, null);
        Symbol p = table.declareObject("p", src(2), DeclaredType.polymorphic(spec), ArraySpec.SCALAR, Attr.POINTER);
        Symbol star = table.declareObject("s", src(3), DeclaredType.unlimitedPolymorphic(), ArraySpec.of(ShapeSpec.deferred()), Attr.ALLOCATABLE);
        when(descriptorSizer.descriptorSize(0, true, 2)).thenReturn(48L);
        when(descriptorSizer.descriptorSize(1, true, 0)).thenReturn(64L);

        assertThat(oracle.sizeAndAlignment(p, true).size()).isEqualTo(48);
        assertThat(oracle.sizeAndAlignment(star, true).size()).isEqualTo(64);
    }

    @Test
    void procedurePointersUseTargetValues() {
        Symbol pp = table.declare("pp", src(1), new SymbolDetails.ProcEntity("iface"), Attr.POINTER);

        assertThat(oracle.sizeAndAlignment(pp, true)).isEqualTo(new SizeAndAlignment(8, 4));
    }

    @Test
    void plainProceduresOccupyNothing() {
        Symbol f = table.declare("f", src(1), new SymbolDetails.ProcEntity(null));
        Symbol sub = table.declare("sub", src(2), new SymbolDetails.Subprogram());

        assertThat(oracle.sizeAndAlignment(f, true).isEmpty()).isTrue();
        assertThat(oracle.sizeAndAlignment(sub, true).isEmpty()).isTrue();
        verify(characterizer, never()).characterize(any(), anyBoolean());
        verify(descriptorSizer, never()).descriptorSize(anyInt(), anyBoolean(), anyInt());
    }

    @Test
    void dataObjectsAreCharacterizedAndUnknownTypesAreEmpty() {
        Symbol x = table.declareObject("x", src(1), DeclaredType.integer(4), ArraySpec.SCALAR);
        Symbol y = table.declareObject("y", src(2), DeclaredType.character(1, null), ArraySpec.SCALAR);
        when(characterizer.characterize(x, true)).thenReturn(Optional.of(new SizeAndAlignment(4, 4)));
        when(characterizer.characterize(y, true)).thenReturn(Optional.empty());

        assertThat(oracle.sizeAndAlignment(x, true)).isEqualTo(new SizeAndAlignment(4, 4));
        assertThat(oracle.sizeAndAlignment(y, true)).isEqualTo(SizeAndAlignment.EMPTY);
    }

    @Test
    void characterKindWidthFallsBackToDefaultKind() {
        Symbol wide = table.declareObject("w", src(1), DeclaredType.character(4, 10L), ArraySpec.SCALAR);
        Symbol derived = table.declareObject("d", src(2), DeclaredType.unlimitedPolymorphic(), ArraySpec.SCALAR, Attr.POINTER);

        assertThat(oracle.characterKindWidth(wide)).isEqualTo(4);
        assertThat(oracle.characterKindWidth(derived)).isEqualTo(1);
    }
}
