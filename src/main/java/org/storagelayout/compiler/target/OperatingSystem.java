package org.storagelayout.compiler.target;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * The operating system of the compilation target, as far as it affects storage layout.
 */
public enum OperatingSystem {
    LINUX,
    AIX,
    DARWIN,
    WINDOWS,
    OTHER;

    private static final Logger LOG = LoggerFactory.getLogger(OperatingSystem.class);

    /**
     * Parses a configured operating system name, case-insensitively.
     * @param name The configured name.
     * @return The operating system, or {@link #OTHER} for unknown names.
     */
    public static OperatingSystem fromName(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            LOG.warn("Unknown target operating system '{}', using generic layout rules", name);
            return OTHER;
        }
    }
}
