package org.storagelayout.compiler;

import com.typesafe.config.ConfigFactory;
import org.storagelayout.compiler.api.CompilationException;
import org.storagelayout.compiler.api.CompilerErrorCode;
import org.storagelayout.compiler.api.SourceInfo;
import org.storagelayout.compiler.config.LoggingConfigurator;
import org.storagelayout.compiler.diagnostics.CompilerLogger;
import org.storagelayout.compiler.semantics.ArraySpec;
import org.storagelayout.compiler.semantics.CommonBlock;
import org.storagelayout.compiler.semantics.DeclaredType;
import org.storagelayout.compiler.semantics.EquivalenceObject;
import org.storagelayout.compiler.semantics.Scope;
import org.storagelayout.compiler.semantics.Symbol;
import org.storagelayout.compiler.semantics.SymbolTable;
import org.storagelayout.compiler.target.TargetCharacteristics;
import org.storagelayout.junit.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
public class StorageLayoutPassTest {

    private final int originalLevel = CompilerLogger.getLevel();

    @AfterEach
    void tearDown() {
        CompilerLogger.setLevel(originalLevel);
        LoggingConfigurator.reset();
    }

    private static SourceInfo src(int line) {
        return new SourceInfo("pass.f90", line, 1);
    }

    @Test
    void warningsDoNotFailThePass() throws Exception {
        StorageLayoutPass pass = new StorageLayoutPass(TargetCharacteristics.defaults());
        SymbolTable table = new SymbolTable(pass.diagnostics());
        table.enterScope(Scope.Kind.SUBPROGRAM, null);
        Symbol a = table.declareObject("A", src(1), DeclaredType.integer(4), ArraySpec.SCALAR);
        Symbol b = table.declareObject("B", src(2), DeclaredType.real(8), ArraySpec.SCALAR);
        CommonBlock c = table.common("C", src(3), a, b);

        pass.run(table.rootScope());

        assertThat(c.size()).isEqualTo(16);
        assertThat(pass.diagnostics().withCode(CompilerErrorCode.COMMON_BLOCK_PADDING)).hasSize(1);
        assertThat(pass.commonBlocks().largestSize("C")).hasValue(16);
    }

    @Test
    void errorsFailThePassWithASummary() {
        StorageLayoutPass pass = new StorageLayoutPass(TargetCharacteristics.defaults());
        SymbolTable table = new SymbolTable(pass.diagnostics());
        table.enterScope(Scope.Kind.SUBPROGRAM, null);
        Symbol x = table.declareObject("X", src(1), DeclaredType.integer(4), ArraySpec.SCALAR);
        Symbol y = table.declareObject("Y", src(2), DeclaredType.integer(4), ArraySpec.SCALAR);
        table.common("C1", src(3), x);
        table.common("C2", src(4), y);
        table.equivalence(EquivalenceObject.of(x, src(5)), EquivalenceObject.of(y, src(5)));

        assertThatThrownBy(() -> pass.run(table.rootScope()))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("[ERROR] pass.f90:3")
                .hasMessageContaining("must not be storage associated");
    }

    @Test
    void commonBlocksAreComparedAcrossProgramUnits() throws Exception {
        StorageLayoutPass pass = new StorageLayoutPass(TargetCharacteristics.defaults());
        SymbolTable table = new SymbolTable(pass.diagnostics());
        table.enterScope(Scope.Kind.SUBPROGRAM, null);
        table.common("SHARED", src(1), table.declareObject("A", src(1), DeclaredType.integer(4), ArraySpec.SCALAR));
        table.leaveScope();
        table.enterScope(Scope.Kind.SUBPROGRAM, null);
        table.common("SHARED", src(2), table.declareObject("B", src(2), DeclaredType.real(8), ArraySpec.SCALAR));
        table.leaveScope();

        pass.run(table.rootScope());

        assertThat(pass.diagnostics().withCode(CompilerErrorCode.COMMON_BLOCK_SIZE_MISMATCH)).hasSize(1);
        assertThat(pass.commonBlocks().largestSize("shared")).hasValue(8);
    }

    @Test
    void verbosityIsAppliedOnRun() throws Exception {
        StorageLayoutPass pass = new StorageLayoutPass(TargetCharacteristics.defaults());
        pass.setVerbosity(CompilerLogger.ERROR);

        pass.run(new SymbolTable(pass.diagnostics()).rootScope());

        assertThat(CompilerLogger.getLevel()).isEqualTo(CompilerLogger.ERROR);
    }

    @Test
    void buildsFromConfiguration() throws Exception {
        StorageLayoutPass pass = StorageLayoutPass.fromConfig(ConfigFactory.parseString("""
            storage-layout.target {
              max-alignment = 4
              descriptor-alignment = 4
              procedure-pointer-size = 4
              procedure-pointer-alignment = 4
              default-character-kind = 1
              operating-system = "linux"
            }
            """));
        SymbolTable table = new SymbolTable(pass.diagnostics());
        Scope scope = table.enterScope(Scope.Kind.SUBPROGRAM, null);
        table.declareObject("I", src(1), DeclaredType.integer(4), ArraySpec.SCALAR);
        Symbol d = table.declareObject("D", src(2), DeclaredType.real(8), ArraySpec.SCALAR);

        pass.run(table.rootScope());

        assertThat(d.offset()).isEqualTo(4);
        assertThat(scope.alignment()).isEqualTo(4);
        assertThat(scope.size()).isEqualTo(12);
    }
}
