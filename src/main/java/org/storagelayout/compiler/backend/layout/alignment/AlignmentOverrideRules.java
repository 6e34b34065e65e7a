package org.storagelayout.compiler.backend.layout.alignment;

import org.storagelayout.compiler.backend.layout.TypeSizeOracle;
import org.storagelayout.compiler.target.OperatingSystem;

/**
 * Selects the alignment override rule of a target once, so that layout code never
 * branches on the operating system itself.
 */
public final class AlignmentOverrideRules {

    private AlignmentOverrideRules() {}

    /**
     * @param oracle The size oracle, which also carries the target characteristics.
     * @return The rule for the oracle's target.
     */
    public static IAlignmentOverrideRule forTarget(TypeSizeOracle oracle) {
        if (oracle.target().operatingSystem() == OperatingSystem.AIX) {
            return new BindCComponentAlignmentRule(oracle);
        }
        return IAlignmentOverrideRule.NATURAL;
    }
}
