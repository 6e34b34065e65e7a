package org.storagelayout.compiler.target;

import com.typesafe.config.Config;

/**
 * Immutable description of the compilation target as seen by the layout pass.
 * All sizes and alignments are in bytes.
 *
 * @param maxAlignment The largest alignment the target honors; larger natural alignments are clamped.
 * @param descriptorAlignment The alignment of runtime descriptors.
 * @param procedurePointerByteSize The size of a procedure pointer.
 * @param procedurePointerAlignment The alignment of a procedure pointer.
 * @param defaultCharacterKind The byte width of the default CHARACTER kind.
 * @param operatingSystem The target operating system.
 */
public record TargetCharacteristics(
        long maxAlignment,
        long descriptorAlignment,
        long procedurePointerByteSize,
        long procedurePointerAlignment,
        int defaultCharacterKind,
        OperatingSystem operatingSystem
) {

    public TargetCharacteristics {
        requirePowerOfTwo("maxAlignment", maxAlignment);
        requirePowerOfTwo("descriptorAlignment", descriptorAlignment);
        requirePowerOfTwo("procedurePointerAlignment", procedurePointerAlignment);
        if (procedurePointerByteSize <= 0) {
            throw new IllegalArgumentException("procedurePointerByteSize must be positive: " + procedurePointerByteSize);
        }
        if (defaultCharacterKind <= 0) {
            throw new IllegalArgumentException("defaultCharacterKind must be positive: " + defaultCharacterKind);
        }
    }

    /**
     * A typical 64-bit Linux target.
     * @return The default target characteristics.
     */
    public static TargetCharacteristics defaults() {
        return new TargetCharacteristics(16, 8, 8, 8, 1, OperatingSystem.LINUX);
    }

    /**
     * @param os The operating system.
     * @return A copy of these characteristics for another operating system.
     */
    public TargetCharacteristics withOperatingSystem(OperatingSystem os) {
        return new TargetCharacteristics(maxAlignment, descriptorAlignment, procedurePointerByteSize,
                procedurePointerAlignment, defaultCharacterKind, os);
    }

    /**
     * Reads target characteristics from a configuration section.
     * <pre>
     * max-alignment = 16
     * descriptor-alignment = 8
     * procedure-pointer-size = 8
     * procedure-pointer-alignment = 8
     * default-character-kind = 1
     * operating-system = "linux"
     * </pre>
     * @param config The {@code storage-layout.target} section.
     * @return The target characteristics.
     */
    public static TargetCharacteristics fromConfig(Config config) {
        return new TargetCharacteristics(
                config.getLong("max-alignment"),
                config.getLong("descriptor-alignment"),
                config.getLong("procedure-pointer-size"),
                config.getLong("procedure-pointer-alignment"),
                config.getInt("default-character-kind"),
                OperatingSystem.fromName(config.getString("operating-system")));
    }

    private static void requirePowerOfTwo(String name, long value) {
        if (value <= 0 || Long.bitCount(value) != 1) {
            throw new IllegalArgumentException(name + " must be a positive power of two: " + value);
        }
    }
}
