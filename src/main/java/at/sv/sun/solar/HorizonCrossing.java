package at.sv.sun.solar;

/**
 * Whether the sun crosses a {@link Horizon} on a given day.
 * <p>
 * If it does not, the dawn and dusk times of that horizon are saturated: they both fall on solar noon for
 * {@link #ALWAYS_BELOW}, and on the solar midnights before and after noon for {@link #ALWAYS_ABOVE}.
 */
public enum HorizonCrossing {
    CROSSES,
    /**
     * The sun stays above the horizon all day, e.g. polar day or white nights for the twilight bands.
     */
    ALWAYS_ABOVE,
    /**
     * The sun never reaches the horizon, e.g. polar night.
     */
    ALWAYS_BELOW
}
