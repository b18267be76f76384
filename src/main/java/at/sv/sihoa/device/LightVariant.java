package at.sv.sihoa.device;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Getter;

import java.util.List;

@Getter
public final class LightVariant implements ActuatorVariant {

    private Integer brightness;
    private String colorMode;
    private Integer colorTemp;
    private Integer linkQuality;
    private String powerOnBehavior;
    private Integer colorTempStartup;

    @Override
    public ActuatorType getType() {
        return ActuatorType.LIGHT;
    }

    @Override
    public List<String> getOnlineReadKeys() {
        return List.of("power_on_behavior", "color_temp_startup");
    }

    @Override
    public void onReport(JsonNode report) {
        brightness = keep(brightness, ReportFields.readInteger(report, "brightness"));
        colorMode = keep(colorMode, ReportFields.readText(report, "color_mode"));
        colorTemp = keep(colorTemp, ReportFields.readInteger(report, "color_temp"));
        linkQuality = keep(linkQuality, ReportFields.readInteger(report, "linkquality"));
        powerOnBehavior = keep(powerOnBehavior, ReportFields.readText(report, "power_on_behavior"));
        colorTempStartup = keep(colorTempStartup, ReportFields.readInteger(report, "color_temp_startup"));
    }

    /**
     * Switch instantly instead of using the default transition of the light.
     */
    @Override
    public void decorateCommand(ObjectNode command) {
        command.put("transition", 0);
    }

    private static <T> T keep(T current, T reported) {
        return reported != null ? reported : current;
    }
}
