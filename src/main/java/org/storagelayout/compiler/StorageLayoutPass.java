package org.storagelayout.compiler;

import com.typesafe.config.Config;
import org.storagelayout.compiler.api.CompilationException;
import org.storagelayout.compiler.api.IOffsetComputer;
import org.storagelayout.compiler.backend.layout.CommonBlockRegistry;
import org.storagelayout.compiler.backend.layout.DefaultTypeCharacterizer;
import org.storagelayout.compiler.backend.layout.IDescriptorSizer;
import org.storagelayout.compiler.backend.layout.ITypeCharacterizer;
import org.storagelayout.compiler.backend.layout.OffsetComputer;
import org.storagelayout.compiler.backend.layout.RuntimeDescriptorSizer;
import org.storagelayout.compiler.backend.layout.TypeSizeOracle;
import org.storagelayout.compiler.backend.layout.alignment.AlignmentOverrideRules;
import org.storagelayout.compiler.config.ConfigLoader;
import org.storagelayout.compiler.config.LoggingConfigurator;
import org.storagelayout.compiler.diagnostics.CompilerLogger;
import org.storagelayout.compiler.diagnostics.DiagnosticsEngine;
import org.storagelayout.compiler.semantics.Scope;
import org.storagelayout.compiler.target.TargetCharacteristics;

/**
 * Entry point of the storage layout stage. Wires the size oracle, the target's alignment
 * rule and the COMMON block registry into an {@link OffsetComputer} and runs it over a
 * scope tree. The registry and the diagnostics live as long as the pass, so all program
 * units of one compilation should be laid out with the same instance. Not thread-safe.
 */
public class StorageLayoutPass {

    private final DiagnosticsEngine diagnostics;
    private final CommonBlockRegistry commonBlocks;
    private final IOffsetComputer offsetComputer;
    private int verbosity = -1;

    /**
     * Creates a pass with the default type characterizer and descriptor sizer.
     * @param target The target characteristics.
     */
    public StorageLayoutPass(TargetCharacteristics target) {
        this(target, new DefaultTypeCharacterizer(), new RuntimeDescriptorSizer(), new DiagnosticsEngine());
    }

    /**
     * @param target The target characteristics.
     * @param characterizer The type characterization service.
     * @param descriptorSizer The descriptor size service.
     * @param diagnostics The engine receiving all diagnostics of this pass.
     */
    public StorageLayoutPass(TargetCharacteristics target, ITypeCharacterizer characterizer,
                             IDescriptorSizer descriptorSizer, DiagnosticsEngine diagnostics) {
        this.diagnostics = diagnostics;
        this.commonBlocks = new CommonBlockRegistry(diagnostics);
        TypeSizeOracle oracle = new TypeSizeOracle(target, characterizer, descriptorSizer);
        this.offsetComputer = new OffsetComputer(oracle, AlignmentOverrideRules.forTarget(oracle), commonBlocks, diagnostics);
    }

    /**
     * Creates a pass for the target described in the {@code storage-layout.target} section
     * and applies the {@code storage-layout.logging} section to the logging backend.
     *
     * @param config The loaded configuration, see {@link ConfigLoader#load()}.
     * @return The pass.
     */
    public static StorageLayoutPass fromConfig(Config config) {
        LoggingConfigurator.configure(config);
        TargetCharacteristics target = TargetCharacteristics.fromConfig(config.getConfig(ConfigLoader.ROOT_PATH + ".target"));
        CompilerLogger.info("Storage layout target: " + target);
        return new StorageLayoutPass(target);
    }

    /**
     * Lays out the given scope and all nested scopes.
     *
     * @param scope The root of the scope tree.
     * @throws CompilationException if any errors were reported, by this or an earlier run.
     */
    public void run(Scope scope) throws CompilationException {
        if (verbosity >= 0) {
            CompilerLogger.setLevel(verbosity);
        }
        offsetComputer.compute(scope);
        if (diagnostics.hasErrors()) {
            throw new CompilationException(diagnostics.summary());
        }
    }

    public DiagnosticsEngine diagnostics() {
        return diagnostics;
    }

    /**
     * @return The registry of all COMMON blocks laid out by this pass.
     */
    public CommonBlockRegistry commonBlocks() {
        return commonBlocks;
    }

    /**
     * Sets the verbosity of the {@link CompilerLogger} for subsequent runs.
     * @param level 0=ERROR to 4=TRACE; a negative value leaves the level unchanged.
     */
    public void setVerbosity(int level) {
        this.verbosity = level;
    }
}
