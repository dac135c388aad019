package com.tether.units;

/**
 * Converts lengths between the core's internal unit (metres) and the host's
 * internal unit (feet).
 */
public final class UnitConverter {
    
    private static final double METRES_PER_FOOT = 0.3048;
    
    private UnitConverter() {
    }
    
    /**
     * Factor turning a core length into a host length.
     */
    public static double coreToHostFactor() {
        return 1.0 / METRES_PER_FOOT;
    }
    
    /**
     * Factor turning a host length into a core length.
     */
    public static double hostToCoreFactor() {
        return METRES_PER_FOOT;
    }
    
    /**
     * @param metres length in core units
     * @return length in feet
     */
    public static double toHostUnits(double metres) {
        requireFinite(metres);
        return metres * coreToHostFactor();
    }
    
    /**
     * @param feet length in host units
     * @return length in metres
     */
    public static double toCoreUnits(double feet) {
        requireFinite(feet);
        return feet * hostToCoreFactor();
    }
    
    private static void requireFinite(double value) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Length must be finite, got " + value);
        }
    }
}
