package nl.bytesoflife.lanterncad.circuit;

public enum LaunchType implements IndKeyword {
    GAUSSIAN("LAUNCH_GAUSSIAN"),
    RECTANGLE("LAUNCH_RECTANGLE"),
    FIBER_MODE("LAUNCH_FIBERMODE"),
    WG_MODE("LAUNCH_WGMODE"),
    MULTIMODE("LAUNCH_MULTIMODE"),
    PLANE_WAVE("LAUNCH_PLANEWAVE"),
    FILE("LAUNCH_FILE");

    private final String keyword;

    LaunchType(String keyword) {
        this.keyword = keyword;
    }

    @Override
    public String keyword() {
        return keyword;
    }
}
