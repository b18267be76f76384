package at.sv.sihoa.mqtt;

import java.util.UUID;

public record BrokerSettings(String host, int port, String username, String password, String clientId) {

    public static BrokerSettings of(String host, int port, String username, String password, String clientIdPrefix) {
        return new BrokerSettings(host, port, username, password,
                clientIdPrefix + "-" + UUID.randomUUID().toString().substring(0, 8));
    }

    public String serverUri() {
        return "tcp://" + host + ":" + port;
    }

    /**
     * Credentials are only used if both, username and password, are given.
     */
    public boolean hasCredentials() {
        return username != null && password != null;
    }
}
