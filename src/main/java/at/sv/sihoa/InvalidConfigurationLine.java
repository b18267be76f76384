package at.sv.sihoa;

public final class InvalidConfigurationLine extends RuntimeException {
    public InvalidConfigurationLine(String message) {
        super(message);
    }

    public InvalidConfigurationLine(String message, Throwable cause) {
        super(message, cause);
    }
}
