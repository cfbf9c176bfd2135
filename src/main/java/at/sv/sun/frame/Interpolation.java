package at.sv.sun.frame;

@FunctionalInterface
public interface Interpolation {

    /**
     * Hermite interpolation between 0 and 1, as known from shading languages.
     */
    Interpolation SMOOTH_STEP = (edge0, edge1, x) -> {
        if (edge0 == edge1) {
            return x < edge0 ? 0.0 : 1.0;
        }
        double t = Math.max(0.0, Math.min(1.0, (x - edge0) / (edge1 - edge0)));
        return t * t * (3.0 - 2.0 * t);
    };

    /**
     * @return 0 for {@code x <= edge0}, 1 for {@code x >= edge1}, and a smooth transition in between
     */
    double interpolate(double edge0, double edge1, double x);
}
