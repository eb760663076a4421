package ou.capstone.rmr.codes;

/**
 * Parameters that carry a categorical field code in the code dictionary.
 */
public enum RmrParameter {
    STRENGTH,
    STRUCTURE_TYPE,
    SPACING,
    PERSISTENCE,
    APERTURE,
    ROUGHNESS,
    INFILL,
    WEATHERING,
    GROUNDWATER;

    /** The five sub-parameters summed into the condition-of-discontinuities rating. */
    public static final RmrParameter[] CONDITION = {PERSISTENCE, APERTURE, ROUGHNESS, INFILL, WEATHERING};
}
