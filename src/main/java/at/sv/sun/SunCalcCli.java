package at.sv.sun;

import at.sv.sun.time.EventTimeProvider;
import at.sv.sun.time.EventTimeProviderImpl;
import at.sv.sun.time.SolarEventsProviderImpl;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

@Command(name = "SunCalc", version = "0.3.0", mixinStandardHelpOptions = true, sortOptions = false,
        description = "Prints the position of the sun and the times of sunrise, sunset and twilight for a location.")
public final class SunCalcCli implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(SunCalcCli.class);

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Option(names = "--lat", required = true,
            defaultValue = "${env:LAT}",
            description = "The latitude of the location in degrees [-90..90]. Results are only reliable within [-65..65].")
    double latitude;
    @Option(names = "--long", required = true,
            defaultValue = "${env:LONG}",
            description = "The longitude of the location in degrees [-180..180].")
    double longitude;
    @Option(names = "--altitude", paramLabel = "<meters>",
            defaultValue = "${env:ALTITUDE:-0.0}",
            description = "The altitude of the observer in meters. Default: ${DEFAULT-VALUE}")
    double altitude;
    @Option(names = "--offset", paramLabel = "<minutes>",
            defaultValue = "${env:TIMEZONE_OFFSET}",
            description = "The offset from UTC of the location in minutes, e.g. 60 for CET. " +
                          "Default: the offset of the system timezone.")
    Integer timezoneOffset;
    @Option(names = "--time", paramLabel = "<time>",
            description = "The reference time as ISO-8601 instant or offset date-time, " +
                          "e.g. 2024-03-20T12:00:00Z. Default: now.")
    String time;
    @Option(names = "--at", paramLabel = "<expression>",
            description = "Use the time of a solar event on the reference day as reference time instead, " +
                          "e.g. 'sunrise', 'civil_dusk' or 'sunset-15'.")
    String eventExpression;
    @Option(names = "--format", paramLabel = "<format>",
            defaultValue = "text",
            description = "The output format: ${COMPLETION-CANDIDATES}. Default: ${DEFAULT-VALUE}")
    OutputFormat format;
    @Option(names = "--watch", paramLabel = "<seconds>",
            description = "Keep running and print the sun position every given number of seconds.")
    Integer watchIntervalInSeconds;

    private final Clock clock;
    private final ObjectMapper objectMapper;

    public SunCalcCli() {
        this(Clock.systemDefaultZone());
    }

    SunCalcCli(Clock clock) {
        this.clock = clock;
        objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public static void main(String[] args) {
        int execute = new CommandLine(new SunCalcCli()).execute(args);
        if (execute != 0) {
            System.exit(execute);
        }
    }

    @Override
    public void run() {
        MDC.put("context", "init");
        SunCalculator calculator;
        try {
            calculator = createCalculator();
            if (eventExpression != null) {
                calculator.setTime(resolveEventExpression(calculator));
            }
        } finally {
            MDC.remove("context");
        }
        print(calculator);
        if (watchIntervalInSeconds != null) {
            watch(calculator);
        }
    }

    private SunCalculator createCalculator() {
        GeoLocation location = new GeoLocation(latitude, longitude, altitude);
        if (time == null && timezoneOffset == null) {
            return new SunCalculator(location, clock);
        }
        Instant referenceTime = time == null ? clock.instant() : parseTime(time);
        int offset = timezoneOffset != null ? timezoneOffset : systemOffset(referenceTime);
        return new SunCalculator(location, referenceTime, offset);
    }

    private Instant resolveEventExpression(SunCalculator calculator) {
        ZoneOffset offset = calculator.getReferenceTime().getOffset();
        EventTimeProvider eventTimeProvider = new EventTimeProviderImpl(
                new SolarEventsProviderImpl(calculator.getLocation(), offset, 1), offset);
        OffsetDateTime eventTime = eventTimeProvider.getTime(eventExpression,
                calculator.getReferenceTime().toLocalDate());
        LOG.debug("Resolved '{}' to {}", eventExpression, eventTime);
        return eventTime.toInstant();
    }

    private void watch(SunCalculator calculator) {
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        CountDownLatch stopped = new CountDownLatch(1);
        scheduler.scheduleAtFixedRate(() -> {
            try {
                calculator.setTime(clock.instant());
                printPosition(calculator);
            } catch (Exception e) {
                LOG.error("Update failed: '{}'. Stopping.", e.getLocalizedMessage(), e);
                stopped.countDown();
            }
        }, watchIntervalInSeconds, watchIntervalInSeconds, TimeUnit.SECONDS);
        try {
            stopped.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            scheduler.shutdownNow();
        }
    }

    private void print(SunCalculator calculator) {
        PrintWriter out = spec.commandLine().getOut();
        if (format == OutputFormat.json) {
            out.println(toJson(SunReport.of(calculator)));
        } else {
            out.println(calculator.toDebugString());
        }
        out.flush();
    }

    private void printPosition(SunCalculator calculator) {
        PrintWriter out = spec.commandLine().getOut();
        if (format == OutputFormat.json) {
            out.println(toJson(calculator.getSunPosition()));
        } else {
            out.println(calculator.getReferenceTime() + " " + calculator.getSunPosition());
        }
        out.flush();
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    private Instant parseTime(String input) {
        try {
            return Instant.parse(input);
        } catch (DateTimeParseException ignore) {
            try {
                return OffsetDateTime.parse(input).toInstant();
            } catch (DateTimeParseException e) {
                throw new CommandLine.ParameterException(spec.commandLine(),
                        "Invalid --time '" + input + "': " + e.getMessage());
            }
        }
    }

    private int systemOffset(Instant instant) {
        return clock.getZone().getRules().getOffset(instant).getTotalSeconds() / 60;
    }

    enum OutputFormat {
        text, json
    }
}
