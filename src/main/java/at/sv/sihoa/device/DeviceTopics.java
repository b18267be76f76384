package at.sv.sihoa.device;

public record DeviceTopics(String state) {

    public static DeviceTopics of(String baseTopic, String friendlyName) {
        if (baseTopic == null || baseTopic.isBlank()) {
            return new DeviceTopics(friendlyName);
        }
        return new DeviceTopics(baseTopic + "/" + friendlyName);
    }

    public String availability() {
        return state + "/availability";
    }

    public String get() {
        return state + "/get";
    }

    public String set() {
        return state + "/set";
    }
}
