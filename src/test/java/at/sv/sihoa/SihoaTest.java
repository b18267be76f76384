package at.sv.sihoa;

import at.sv.sihoa.mqtt.BrokerConnectionFailure;
import at.sv.sihoa.mqtt.ConnectionRefusedFailure;
import at.sv.sihoa.mqtt.MessageQueue;
import at.sv.sihoa.mqtt.MqttTransport;
import at.sv.sihoa.mqtt.TopicRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.assertThatNoException;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SihoaTest {

    @TempDir
    Path tempDir;

    private Path configFile;
    private StringWriter err;
    private CommandLine commandLine;

    @BeforeEach
    void setUp() throws Exception {
        configFile = Files.writeString(tempDir.resolve("actuators.txt"), "Lamp\t0x01\tlight\tsunset-sunrise\n");
        err = new StringWriter();
        commandLine = new CommandLine(new Sihoa());
        commandLine.setErr(new PrintWriter(err));
    }

    private int execute(String... args) {
        return commandLine.execute(args);
    }

    @Test
    void missingLocation_isRejected() {
        int exitCode = execute("--long", "16.4", configFile.toString());

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("--lat and --long are required");
    }

    @Test
    void invalidPort_isRejected() {
        int exitCode = execute("--lat", "48.2", "--long", "16.4", "--port", "70000", configFile.toString());

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("--port must be in [1..65535]");
    }

    @Test
    void latitudeOutOfRange_isRejected() {
        int exitCode = execute("--lat", "91", "--long", "16.4", configFile.toString());

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("--lat must be in [-90..90]");
    }

    @Test
    void longitudeOutOfRange_isRejected() {
        int exitCode = execute("--lat", "48.2", "--long", "-181", configFile.toString());

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("--long must be in [-180..180]");
    }

    @Test
    void nonPositiveTimeouts_areRejected() {
        assertThat(execute("--lat", "48.2", "--long", "16.4", "--connect-timeout", "0", configFile.toString()))
                .isEqualTo(2);
        assertThat(execute("--lat", "48.2", "--long", "16.4", "--loop-period", "0", configFile.toString()))
                .isEqualTo(2);
        assertThat(execute("--lat", "48.2", "--long", "16.4", "--pending-command-timeout", "-1",
                configFile.toString())).isEqualTo(2);
    }

    @Test
    void invalidTimeZone_isRejected() {
        int exitCode = execute("--lat", "48.2", "--long", "16.4", "--time-zone", "Mars/Olympus", configFile.toString());

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("Mars/Olympus");
    }

    @Test
    void missingConfigFile_isRejected() {
        int exitCode = execute("--lat", "48.2", "--long", "16.4", tempDir.resolve("missing.txt").toString());

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("does not exist or is not readable");
    }

    @Test
    void invalidConfigurationLine_isRejected_beforeConnecting() throws Exception {
        Files.writeString(configFile, "Lamp 0x01 light sunset-sunrise\n");

        int exitCode = execute("--lat", "48.2", "--long", "16.4", configFile.toString());

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("Invalid configuration line 'Lamp 0x01 light sunset-sunrise'");
    }

    @Test
    void awaitConnection_connected_returns() {
        MqttTransport transport = mock(MqttTransport.class);
        when(transport.isConnected()).thenReturn(false, false, true);
        TopicRegistry registry = new TopicRegistry(transport, new MessageQueue(), new MessageQueue());

        assertThatNoException().isThrownBy(() ->
                Sihoa.awaitConnection(transport, registry, () -> 0L, Duration.ofSeconds(5)));
    }

    @Test
    void awaitConnection_timeout_throwsBrokerConnectionFailure() {
        MqttTransport transport = mock(MqttTransport.class);
        TopicRegistry registry = new TopicRegistry(transport, new MessageQueue(), new MessageQueue());
        AtomicLong nanos = new AtomicLong();

        assertThatThrownBy(() -> Sihoa.awaitConnection(transport, registry,
                () -> nanos.getAndAdd(Duration.ofSeconds(1).toNanos()), Duration.ofSeconds(3)))
                .isInstanceOf(BrokerConnectionFailure.class);
    }

    @Test
    void awaitConnection_refused_failsWithoutWaitingForTimeout() {
        MqttTransport transport = mock(MqttTransport.class);
        TopicRegistry registry = new TopicRegistry(transport, new MessageQueue(), new MessageQueue());
        assertThatThrownBy(() -> registry.onConnect(5)).isInstanceOf(ConnectionRefusedFailure.class);

        assertThatThrownBy(() -> Sihoa.awaitConnection(transport, registry, () -> 0L, Duration.ofHours(1)))
                .isInstanceOf(ConnectionRefusedFailure.class);
    }
}
