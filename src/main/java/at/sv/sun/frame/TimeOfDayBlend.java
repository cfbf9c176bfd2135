package at.sv.sun.frame;

import at.sv.sun.SunCalculator;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Blends between a night and a day look of a scene, following the real sunrise and sunset of the configured
 * location.
 * <p>
 * Returns a daylight factor on every frame: 0 at night, 1 during the day. The transition starts
 * {@code blendDuration} before sunrise and ends {@code blendDuration} after sunset.
 */
@Slf4j
public final class TimeOfDayBlend implements FrameHook<Double> {

    public static final Duration DEFAULT_BLEND_DURATION = Duration.ofMinutes(5);
    private static final double DAY_IN_NANOS = Duration.ofDays(1).toNanos();

    private final LocationSettings settings;
    private final Clock clock;
    private final Interpolation interpolation;
    private final double blendDuration;
    private SunCalculator calculator;

    public TimeOfDayBlend(LocationSettings settings, Clock clock) {
        this(settings, clock, Interpolation.SMOOTH_STEP, DEFAULT_BLEND_DURATION);
    }

    public TimeOfDayBlend(LocationSettings settings, Clock clock, Interpolation interpolation, Duration blendDuration) {
        this.settings = settings;
        this.clock = clock;
        this.interpolation = interpolation;
        this.blendDuration = blendDuration.toNanos() / DAY_IN_NANOS;
    }

    @Override
    public void init() {
        calculator = new SunCalculator(settings.toGeoLocation(), clock);
        log.debug("Initialized for {} with offset {} min", calculator.getLocation(), calculator.getTimezoneOffset());
    }

    @Override
    public Double update() {
        if (calculator == null) {
            throw new IllegalStateException("update() called before init()");
        }
        calculator.setLocation(settings.toGeoLocation());
        calculator.setTime(clock.instant());

        OffsetDateTime now = calculator.getReferenceTime();
        OffsetDateTime startOfDay = now.truncatedTo(ChronoUnit.DAYS);
        double timeOfDay = fractionOfDay(startOfDay, now);
        double sunrise = fractionOfDay(startOfDay, calculator.getSunrise());
        double sunset = fractionOfDay(startOfDay, calculator.getSunset());

        double afterSunrise = interpolation.interpolate(sunrise - blendDuration, sunrise, timeOfDay);
        double afterSunset = interpolation.interpolate(sunset, sunset + blendDuration, timeOfDay);
        return afterSunrise * (1.0 - afterSunset);
    }

    public SunCalculator getCalculator() {
        return calculator;
    }

    private static double fractionOfDay(OffsetDateTime startOfDay, OffsetDateTime time) {
        return Duration.between(startOfDay, time).toNanos() / DAY_IN_NANOS;
    }
}
