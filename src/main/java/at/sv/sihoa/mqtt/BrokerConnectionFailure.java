package at.sv.sihoa.mqtt;

/**
 * Exception to signal that no connection to the broker could be established, e.g. the client could not be created
 * or the connection was not up within the configured timeout.
 */
public final class BrokerConnectionFailure extends RuntimeException {

    public BrokerConnectionFailure(String message) {
        super(message);
    }

    public BrokerConnectionFailure(String message, Throwable cause) {
        super(message, cause);
    }
}
