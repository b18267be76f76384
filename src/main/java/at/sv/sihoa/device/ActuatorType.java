package at.sv.sihoa.device;

import java.util.Locale;
import java.util.function.Supplier;

public enum ActuatorType {
    LIGHT(LightVariant::new),
    PLUG(PlugVariant::new);

    private final Supplier<ActuatorVariant> variantFactory;

    ActuatorType(Supplier<ActuatorVariant> variantFactory) {
        this.variantFactory = variantFactory;
    }

    public ActuatorVariant createVariant() {
        return variantFactory.get();
    }

    public static ActuatorType parse(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown actuator type '" + value + "'. Supported: light, plug", e);
        }
    }
}
