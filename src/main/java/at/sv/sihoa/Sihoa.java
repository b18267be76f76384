package at.sv.sihoa;

import at.sv.sihoa.mqtt.BrokerConnectionFailure;
import at.sv.sihoa.mqtt.MessageQueue;
import at.sv.sihoa.mqtt.MqttTransport;
import at.sv.sihoa.mqtt.PahoMqttTransport;
import at.sv.sihoa.mqtt.TopicRegistry;
import at.sv.sihoa.time.SunTimesProvider;
import at.sv.sihoa.time.SunTimesProviderImpl;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;

@Command(name = "sihoa", version = "0.3.0", mixinStandardHelpOptions = true, sortOptions = false,
        subcommands = ImportDevicesCommand.class,
        description = "Switches Zigbee2MQTT lights and plugs according to sunset based schedules.")
public final class Sihoa implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(Sihoa.class);
    private static final long CONNECT_POLL_INTERVAL_MS = 100;
    private static final Duration QUEUE_POLL_TIMEOUT = Duration.ofMillis(100);

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Mixin
    BrokerOptions broker;

    @Parameters(
            index = "0",
            paramLabel = "CONFIG_FILE",
            defaultValue = "${env:CONFIG_FILE}",
            description = "The configuration file containing your actuators and their schedules.")
    Path configFile;
    @Option(names = "--lat",
            defaultValue = "${env:LAT}",
            description = "The latitude of your location in degrees [-90..90]. Required.")
    Double latitude;
    @Option(names = "--long",
            defaultValue = "${env:LONG}",
            description = "The longitude of your location in degrees [-180..180]. Required.")
    Double longitude;
    @Option(names = "--elevation", paramLabel = "<meters>",
            defaultValue = "${env:ELEVATION:-0.0}",
            description = "The optional elevation (in meters) of your location, " +
                          "used to provide more accurate sunrise and sunset times.")
    double elevation;
    @Option(names = "--time-zone",
            defaultValue = "${env:TIME_ZONE}",
            description = "The time zone for fixed off-times, e.g. Europe/Vienna. Default: the system time zone.")
    String timeZone;
    @Option(names = "--connect-timeout", paramLabel = "<seconds>",
            defaultValue = "${env:CONNECT_TIMEOUT:-5}",
            description = "How long to wait for the broker connection on startup. Default: ${DEFAULT-VALUE} seconds")
    int connectTimeoutInSeconds;
    @Option(names = "--loop-period", paramLabel = "<ms>",
            defaultValue = "${env:LOOP_PERIOD:-300}",
            description = "The pause between two iterations of the control loop. Default: ${DEFAULT-VALUE} ms")
    int loopPeriodInMs;
    @Option(names = "--pending-command-timeout", paramLabel = "<seconds>",
            defaultValue = "${env:PENDING_COMMAND_TIMEOUT:-0}",
            description = "After how many seconds an unconfirmed command is sent again. " +
                          "0 waits for a confirmation indefinitely. Default: ${DEFAULT-VALUE}")
    int pendingCommandTimeoutInSeconds;

    public static void main(String[] args) {
        int execute = new CommandLine(new Sihoa()).execute(args);
        if (execute != 0) {
            System.exit(execute);
        }
    }

    @Override
    public void run() {
        MDC.put("context", "init");
        assertConfigurationParameters();
        ZoneId zone = getZone();
        MessageQueue inboundQueue = new MessageQueue();
        MessageQueue outboundQueue = new MessageQueue();
        MqttTransport transport = new PahoMqttTransport(broker.toSettings("sihoa"),
                Duration.ofSeconds(connectTimeoutInSeconds).toMillis());
        TopicRegistry registry = new TopicRegistry(transport, inboundQueue, outboundQueue);
        transport.setListener(registry);
        ActuatorConfiguration configuration = parseConfiguration(zone, outboundQueue);
        LOG.info("Loaded {} actuator(s) in {} group(s)", configuration.actuators().size(),
                configuration.groups().size());
        transport.connect();
        try {
            awaitConnection(transport, registry, Ticker.systemTicker(), Duration.ofSeconds(connectTimeoutInSeconds));
            ControlLoop loop = new ControlLoop(registry, configuration.groups(), () -> ZonedDateTime.now(zone),
                    QUEUE_POLL_TIMEOUT, Duration.ofMillis(loopPeriodInMs));
            loop.registerTopics();
            loop.run();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            transport.disconnect();
        }
    }

    /**
     * Waits until the transport is connected. Fails early if the broker refused the connection.
     */
    static void awaitConnection(MqttTransport transport, TopicRegistry registry, Ticker ticker,
                                Duration timeout) throws InterruptedException {
        long deadline = ticker.read() + timeout.toNanos();
        while (!transport.isConnected()) {
            registry.rethrowCallbackFailure();
            if (ticker.read() >= deadline) {
                throw new BrokerConnectionFailure("No connection to the broker within " + timeout.toSeconds() + "s");
            }
            Thread.sleep(CONNECT_POLL_INTERVAL_MS);
        }
        registry.rethrowCallbackFailure();
    }

    private void assertConfigurationParameters() {
        String brokerError = broker.validate();
        if (brokerError != null) {
            fail(brokerError);
        }
        if (latitude == null || longitude == null) {
            fail("--lat and --long are required");
        }
        if (latitude < -90 || latitude > 90) {
            fail("--lat must be in [-90..90]");
        }
        if (longitude < -180 || longitude > 180) {
            fail("--long must be in [-180..180]");
        }
        if (connectTimeoutInSeconds <= 0) {
            fail("--connect-timeout must be > 0");
        }
        if (loopPeriodInMs <= 0) {
            fail("--loop-period must be > 0");
        }
        if (pendingCommandTimeoutInSeconds < 0) {
            fail("--pending-command-timeout must be >= 0");
        }
        getZone();
        if (configFile == null || !Files.isReadable(configFile)) {
            fail("Given config file '" + (configFile == null ? "" : configFile.toAbsolutePath()) +
                 "' does not exist or is not readable!");
        }
    }

    private ZoneId getZone() {
        if (timeZone == null || timeZone.isBlank()) {
            return ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(timeZone);
        } catch (DateTimeException e) {
            fail("--time-zone '" + timeZone + "' is not a valid time zone");
            return null;
        }
    }

    private void fail(String msg) {
        if (spec != null) {
            throw new CommandLine.ParameterException(spec.commandLine(), msg);
        }
        throw new IllegalArgumentException(msg);
    }

    private ActuatorConfiguration parseConfiguration(ZoneId zone, MessageQueue outboundQueue) {
        SunTimesProvider sunTimesProvider = new SunTimesProviderImpl(latitude, longitude, elevation);
        LOG.info("Sun times for today:\n{}", sunTimesProvider.toDebugString(ZonedDateTime.now(zone)));
        ActuatorConfigurationParser parser = new ActuatorConfigurationParser(
                sunTimesProvider, zone, broker.baseTopic, outboundQueue,
                Ticker.systemTicker(), Duration.ofSeconds(pendingCommandTimeoutInSeconds));
        try {
            return parser.parse(readConfigFile());
        } catch (InvalidConfigurationLine e) {
            fail(e.getMessage());
            return null;
        }
    }

    private List<String> readConfigFile() {
        try {
            return Files.readAllLines(configFile);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
