package at.sv.sihoa;

import at.sv.sihoa.mqtt.BrokerSettings;
import picocli.CommandLine.Option;

/**
 * Broker connection options shared by all commands.
 */
public final class BrokerOptions {

    @Option(names = {"-H", "--host"},
            defaultValue = "${env:MQTT_HOST:-localhost}",
            description = "The host of the MQTT broker. Default: ${DEFAULT-VALUE}")
    String host;
    @Option(names = {"-p", "--port"},
            defaultValue = "${env:MQTT_PORT:-1883}",
            description = "The port of the MQTT broker. Default: ${DEFAULT-VALUE}")
    int port;
    @Option(names = {"-u", "--username"},
            defaultValue = "${env:MQTT_USERNAME}",
            description = "The optional username for the MQTT broker.")
    String username;
    @Option(names = {"-P", "--password"},
            defaultValue = "${env:MQTT_PASSWORD}",
            description = "The optional password for the MQTT broker. Only used together with a username.")
    String password;
    @Option(names = "--base-topic",
            defaultValue = "${env:BASE_TOPIC:-zigbee2mqtt}",
            description = "The Zigbee2MQTT base topic. Default: ${DEFAULT-VALUE}")
    String baseTopic;

    BrokerSettings toSettings(String clientIdPrefix) {
        return BrokerSettings.of(host, port, username, password, clientIdPrefix);
    }

    /**
     * @return an error message for invalid options, {@code null} if valid
     */
    String validate() {
        if (host == null || host.isBlank()) {
            return "--host must not be blank";
        }
        if (port < 1 || port > 65535) {
            return "--port must be in [1..65535]";
        }
        return null;
    }
}
