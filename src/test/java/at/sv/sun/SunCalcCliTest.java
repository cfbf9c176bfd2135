package at.sv.sun;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;

class SunCalcCliTest {

    private StringWriter out;
    private StringWriter err;
    private CommandLine commandLine;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-03-20T12:00:00Z"), ZoneId.of("Europe/Vienna"));
        out = new StringWriter();
        err = new StringWriter();
        commandLine = new CommandLine(new SunCalcCli(clock));
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
    }

    private int execute(String... args) {
        return commandLine.execute(args);
    }

    @Test
    void text_printsPositionAndEvents() {
        int exitCode = execute("--lat", "45", "--long", "0", "--offset", "0", "--time", "2024-03-20T12:07:37Z");

        assertThat(exitCode).isZero();
        assertThat(out.toString())
                .contains("time: 2024-03-20T12:07:37Z")
                .contains("position: [azimuth=179.9")
                .contains("sunrise: 06:01:5")
                .contains("sunset: 18:13:1")
                .contains("solar_noon: 12:07:3");
    }

    @Test
    void json_printsReport() throws Exception {
        int exitCode = execute("--lat", "45", "--long", "0", "--offset", "60", "--time", "2024-03-20T12:07:37Z",
                "--format", "json");

        assertThat(exitCode).isZero();
        JsonNode report = new ObjectMapper().readTree(out.toString());
        assertThat(report.get("location").get("latitude").asDouble()).isEqualTo(45.0);
        assertThat(report.get("time").asText()).isEqualTo("2024-03-20T13:07:37+01:00");
        assertThat(report.get("position").get("elevation").asDouble()).isBetween(44.9, 45.1);
        assertThat(report.get("events").get("sunrise").asText()).startsWith("2024-03-20T07:01:5");
        assertThat(report.get("horizons").get("official").asText()).isEqualTo("CROSSES");
        assertThat(report.get("dayLengthMinutes").asDouble()).isBetween(731.0, 732.0);
    }

    @Test
    void at_usesEventTimeAsReference() {
        int exitCode = execute("--lat", "45", "--long", "0", "--offset", "0", "--time", "2024-03-20T09:00:00Z",
                "--at", "sunset");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("time: 2024-03-20T18:13:1");
    }

    @Test
    void offsetDateTime_isAccepted() {
        int exitCode = execute("--lat", "45", "--long", "0", "--time", "2024-03-20T13:07:37+01:00");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("time: 2024-03-20T13:07:37+01:00");
    }

    @Test
    void noTime_usesClock() {
        int exitCode = execute("--lat", "45", "--long", "0");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("time: 2024-03-20T13:00+01:00");
    }

    @Test
    void invalidTime_usageError() {
        int exitCode = execute("--lat", "45", "--long", "0", "--time", "yesterday");

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(err.toString()).contains("Invalid --time 'yesterday'");
    }

    @Test
    void invalidTime_clearsLogContext() {
        MDC.remove("context");

        execute("--lat", "45", "--long", "0", "--time", "yesterday");

        assertThat(MDC.get("context")).isNull();
    }

    @Test
    void invalidEventExpression_failsAndClearsLogContext() {
        MDC.remove("context");

        int exitCode = execute("--lat", "45", "--long", "0", "--offset", "0", "--time", "2024-03-20T09:00:00Z",
                "--at", "golden_hour");

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.SOFTWARE);
        assertThat(err.toString()).contains("golden_hour");
        assertThat(MDC.get("context")).isNull();
    }

    @Test
    void missingLatitude_usageError() {
        int exitCode = execute("--long", "0", "--time", "2024-03-20T12:00:00Z");

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
    }
}
