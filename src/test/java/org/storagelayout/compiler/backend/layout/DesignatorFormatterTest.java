package org.storagelayout.compiler.backend.layout;

import org.storagelayout.compiler.api.SourceInfo;
import org.storagelayout.compiler.diagnostics.DiagnosticsEngine;
import org.storagelayout.compiler.semantics.ArraySpec;
import org.storagelayout.compiler.semantics.Attr;
import org.storagelayout.compiler.semantics.DeclaredType;
import org.storagelayout.compiler.semantics.Scope;
import org.storagelayout.compiler.semantics.ShapeSpec;
import org.storagelayout.compiler.semantics.Symbol;
import org.storagelayout.compiler.semantics.SymbolTable;
import org.storagelayout.compiler.target.TargetCharacteristics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
public class DesignatorFormatterTest {

    private SymbolTable table;
    private DesignatorFormatter formatter;

    @BeforeEach
    void setUp() {
        table = new SymbolTable(new DiagnosticsEngine());
        table.enterScope(Scope.Kind.SUBPROGRAM, null);
        formatter = new DesignatorFormatter(new TypeSizeOracle(TargetCharacteristics.defaults(),
                new DefaultTypeCharacterizer(), new RuntimeDescriptorSizer()));
    }

    private Symbol object(String name, DeclaredType type, ShapeSpec... dims) {
        return table.declareObject(name, new SourceInfo("d.f90", 1, 1), type, ArraySpec.of(dims));
    }

    @Test
    void scalarAtOffsetZeroIsItsName() {
        Symbol x = object("X", DeclaredType.integer(4));

        assertThat(formatter.toDesignator(x, 0)).contains("X");
        assertThat(formatter.toDesignator(x, 4)).isEmpty();
    }

    @Test
    void arrayElementsVaryFirstSubscriptFastest() {
        Symbol a = object("A", DeclaredType.real(4), ShapeSpec.explicit(1, 3), ShapeSpec.explicit(0, 1));

        assertThat(formatter.toDesignator(a, 0)).contains("A(1,0)");
        assertThat(formatter.toDesignator(a, 8)).contains("A(3,0)");
        assertThat(formatter.toDesignator(a, 12)).contains("A(1,1)");
        assertThat(formatter.toDesignator(a, 2)).isEmpty();
        assertThat(formatter.toDesignator(a, 24)).isEmpty();
    }

    @Test
    void characterOffsetsBecomeSubstrings() {
        Symbol c = object("C", DeclaredType.character(1, 8L));
        Symbol names = object("N", DeclaredType.character(1, 4L), ShapeSpec.explicit(1, 2));

        assertThat(formatter.toDesignator(c, 0)).contains("C(1:1)");
        assertThat(formatter.toDesignator(c, 3)).contains("C(4:4)");
        assertThat(formatter.toDesignator(names, 6)).contains("N(2)(3:3)");
    }

    @Test
    void nonExplicitShapesHaveNoDesignator() {
        Symbol d = table.declareObject("D", new SourceInfo("d.f90", 2, 1), DeclaredType.real(4),
                ArraySpec.of(ShapeSpec.deferred()), Attr.ALLOCATABLE);

        assertThat(formatter.toDesignator(d, 0)).isEmpty();
    }
}
