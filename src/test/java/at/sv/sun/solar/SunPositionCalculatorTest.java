package at.sv.sun.solar;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SunPositionCalculatorTest {

    private SunPositionCalculator calculator;
    private ObserverLocation location;

    @BeforeEach
    void setUp() {
        calculator = new SunPositionCalculator();
        location = ObserverLocation.fromDegrees(45.0, 0.0, 0.0);
    }

    private SunPosition calculate(String localDateTime, int timezoneOffset) {
        return calculator.calculate(LocalDateTime.parse(localDateTime), timezoneOffset, location);
    }

    private static void assertPosition(SunPosition position, double azimuth, double elevation) {
        assertThat(position.azimuth()).as("azimuth").isCloseTo(azimuth, within(0.01));
        assertThat(position.elevation()).as("elevation").isCloseTo(elevation, within(0.01));
    }

    @Test
    void calculate_atSolarNoon_sunDueSouth() {
        SunPosition position = calculate("2024-03-20T12:07:37", 0);

        assertPosition(position, 179.946, 45.031);
        assertThat(position.azimuth()).isCloseTo(180.0, within(0.5));
        assertThat(position.isAboveHorizon()).isTrue();
    }

    @Test
    void calculate_atSolarNoon_isMaximumElevationOfTheDay() {
        double noonElevation = calculate("2024-03-20T12:07:37", 0).elevation();

        LocalDateTime time = LocalDateTime.parse("2024-03-20T00:00:00");
        for (int minute = 0; minute < 24 * 60; minute += 5) {
            SunPosition position = calculator.calculate(time.plusMinutes(minute), 0, location);
            assertThat(position.elevation()).as("elevation at %s", time.plusMinutes(minute))
                                            .isLessThanOrEqualTo(noonElevation + 0.01);
        }
    }

    @Test
    void calculate_atSunrise_sunInTheEastAtTheHorizon() {
        SunPosition position = calculate("2024-03-20T06:01:56", 0);

        assertPosition(position, 88.991, -1.731);
    }

    @Test
    void calculate_atMidnight_sunBelowHorizonInTheNorth() {
        SunPosition position = calculate("2024-03-20T00:00:00", 0);

        assertPosition(position, 357.192, -45.846);
        assertThat(position.isAboveHorizon()).isFalse();
    }

    @Test
    void calculate_southernHemisphere_noonSunDueNorth() {
        location = ObserverLocation.fromDegrees(-33.87, 151.21, 0.0);

        SunPosition position = calculate("2024-03-20T12:02:46", 600);

        assertPosition(position, 0.073, 56.072);
    }

    @Test
    void calculate_localTimeAtOffset_sameInstantAsUtc_samePosition() {
        SunPosition utc = calculate("2024-03-20T12:07:37", 0);
        SunPosition cet = calculate("2024-03-20T13:07:37", 60);

        assertThat(cet.azimuth()).isCloseTo(utc.azimuth(), within(0.05));
        assertThat(cet.elevation()).isCloseTo(utc.elevation(), within(0.05));
    }

    @Test
    void calculate_withAltitude_raisesElevation() {
        location = ObserverLocation.fromDegrees(45.0, 0.0, 1000.0);

        SunPosition position = calculate("2024-03-20T12:07:37", 0);

        assertPosition(position, 179.946, 45.239);
    }

    @Test
    void calculate_ignoresFractionsOfASecond() {
        SunPosition position = calculate("2024-03-20T12:07:37", 0);

        assertThat(calculate("2024-03-20T12:07:37.999", 0)).isEqualTo(position);
    }

    @Test
    void calculate_wholeDay_azimuthAlwaysNormalized() {
        LocalDateTime time = LocalDateTime.parse("2024-06-21T00:00:00");
        for (int minute = 0; minute < 24 * 60; minute++) {
            SunPosition position = calculator.calculate(time.plusMinutes(minute), 0, location);
            assertThat(position.azimuth()).isGreaterThanOrEqualTo(0.0).isLessThan(360.0);
            assertThat(position.elevation()).isBetween(-90.0, 90.0);
        }
    }

    @Test
    void calculate_hourAfterSunset_elevationKeepsFalling() {
        LocalDateTime sunset = LocalDateTime.parse("2024-03-20T18:13:18");
        double previous = calculator.calculate(sunset, 0, location).elevation();

        for (int seconds = 10; seconds <= 3600; seconds += 10) {
            double elevation = calculator.calculate(sunset.plusSeconds(seconds), 0, location).elevation();
            assertThat(elevation).as("elevation at %s", sunset.plusSeconds(seconds)).isLessThan(previous);
            previous = elevation;
        }
    }

    @Test
    void refraction_belowMinimumElevation_heldConstant() {
        double atMinimum = SunPositionCalculator.refraction(SunPositionCalculator.MIN_REFRACTION_ELEVATION);

        assertThat(atMinimum).isCloseTo(-0.7292, within(1e-4));
        assertThat(SunPositionCalculator.refraction(-5.11)).isEqualTo(atMinimum);
        assertThat(SunPositionCalculator.refraction(-5.11 + 1e-12)).isEqualTo(atMinimum);
        assertThat(SunPositionCalculator.refraction(-90.0)).isEqualTo(atMinimum);
        assertThat(SunPositionCalculator.refraction(-1.999)).isCloseTo(atMinimum, within(1e-3));
    }

    @Test
    void refraction_appliedRange_isBounded() {
        for (double elevation = SunPositionCalculator.MIN_REFRACTION_ELEVATION; elevation <= 90.0; elevation += 0.01) {
            double refraction = SunPositionCalculator.refraction(elevation);
            assertThat(refraction).as("refraction at %s", elevation).isFinite();
            assertThat(Math.abs(refraction)).as("refraction at %s", elevation).isLessThan(0.75);
        }
    }

    @Test
    void refraction_shrinksWithElevation() {
        assertThat(Math.abs(SunPositionCalculator.refraction(0.0)))
                .isGreaterThan(Math.abs(SunPositionCalculator.refraction(10.0)));
        assertThat(Math.abs(SunPositionCalculator.refraction(10.0)))
                .isGreaterThan(Math.abs(SunPositionCalculator.refraction(45.0)));
    }
}
