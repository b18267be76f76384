package at.sv.sihoa;

import at.sv.sihoa.inventory.BridgeDevicesReader;
import at.sv.sihoa.inventory.InventoryReconciler;
import at.sv.sihoa.inventory.ReconcileResult;
import at.sv.sihoa.inventory.SqliteInventoryStore;
import at.sv.sihoa.mqtt.MqttTransport;
import at.sv.sihoa.mqtt.PahoMqttTransport;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * Imports the device list published by the bridge into the inventory database.
 */
@Slf4j
@Command(name = "import-devices", mixinStandardHelpOptions = true, sortOptions = false,
        description = "Stores the devices known to Zigbee2MQTT in the inventory database and retires missing ones.")
public final class ImportDevicesCommand implements Callable<Integer> {

    static final int FAILURE = 2;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Mixin
    BrokerOptions broker;

    @Option(names = {"-d", "--database"},
            defaultValue = "${env:DATABASE:-sihoa.db}",
            description = "The SQLite database file. Default: ${DEFAULT-VALUE}")
    Path database;
    @Option(names = {"-t", "--topic"},
            description = "The devices topic. Default: <base-topic>/bridge/devices")
    String topic;
    @Option(names = {"-w", "--timeout"}, paramLabel = "<seconds>",
            defaultValue = "5",
            description = "How long to wait for the retained device list. Default: ${DEFAULT-VALUE} seconds")
    int timeoutInSeconds;
    @Option(names = "--print",
            description = "Print the received device list as JSON.")
    boolean print;

    private final Function<MqttTransport, BridgeDevicesReader> readerFactory;

    public ImportDevicesCommand() {
        this(transport -> new BridgeDevicesReader(transport, Ticker.systemTicker()));
    }

    ImportDevicesCommand(Function<MqttTransport, BridgeDevicesReader> readerFactory) {
        this.readerFactory = readerFactory;
    }

    @Override
    public Integer call() {
        MDC.put("context", "import");
        String brokerError = broker.validate();
        if (brokerError != null) {
            throw new CommandLine.ParameterException(spec.commandLine(), brokerError);
        }
        if (timeoutInSeconds <= 0) {
            throw new CommandLine.ParameterException(spec.commandLine(), "--timeout must be > 0");
        }
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            SqliteInventoryStore store = new SqliteInventoryStore(database);
            store.init();
            Duration timeout = Duration.ofSeconds(timeoutInSeconds);
            MqttTransport transport = new PahoMqttTransport(broker.toSettings("sihoa-import"), timeout.toMillis());
            List<JsonNode> devices = readerFactory.apply(transport).read(getTopic(), timeout);
            if (print) {
                out.println(toPrettyJson(devices));
            }
            ReconcileResult result = new InventoryReconciler(store, Instant::now).reconcile(devices);
            err.println("Stored/updated " + result.upserted() + " devices. Retired " + result.retired() + " devices");
            return 0;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            err.println("Error: interrupted while waiting for the device list");
            return FAILURE;
        } catch (RuntimeException e) {
            log.error("Device import failed", e);
            err.println("Error: " + e.getLocalizedMessage());
            return FAILURE;
        } finally {
            MDC.remove("context");
        }
    }

    String getTopic() {
        if (topic != null && !topic.isBlank()) {
            return topic;
        }
        if (broker.baseTopic == null || broker.baseTopic.isBlank()) {
            return "bridge/devices";
        }
        return broker.baseTopic + "/bridge/devices";
    }

    private static String toPrettyJson(List<JsonNode> devices) {
        try {
            return new ObjectMapper().writerWithDefaultPrettyPrinter().writeValueAsString(devices);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not print device list", e);
        }
    }
}
