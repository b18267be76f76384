package at.sv.sihoa.device;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Getter;

import java.util.List;

@Getter
public final class PlugVariant implements ActuatorVariant {

    private Integer linkQuality;

    @Override
    public ActuatorType getType() {
        return ActuatorType.PLUG;
    }

    @Override
    public List<String> getOnlineReadKeys() {
        return List.of("state");
    }

    @Override
    public void onReport(JsonNode report) {
        Integer reportedLinkQuality = ReportFields.readInteger(report, "linkquality");
        if (reportedLinkQuality != null) {
            linkQuality = reportedLinkQuality;
        }
    }
}
