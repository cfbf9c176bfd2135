package at.sv.sun.solar;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Zenith angles the sun has to cross for rise/set and the three twilight bands, stored as their cosine.
 */
@Getter
@RequiredArgsConstructor
public enum Horizon {
    /**
     * 90.833°: the true horizon plus standard atmospheric refraction and the sun's radius.
     */
    OFFICIAL(-0.0145381),
    /**
     * 96°: sun 6° below the horizon.
     */
    CIVIL(-0.1045285),
    /**
     * 102°: sun 12° below the horizon.
     */
    NAUTICAL(-0.2079117),
    /**
     * 108°: sun 18° below the horizon.
     */
    ASTRONOMICAL(-0.309017);

    private final double zenithCosine;
}
