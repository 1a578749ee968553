package nl.bytesoflife.lanterncad.circuit;

public enum MonitorType implements IndKeyword {
    FIBER_POWER("MONITOR_FIBER_POWER"),
    PARTIAL_POWER("MONITOR_PARTIAL_POWER"),
    TOTAL_POWER("MONITOR_TOTAL_POWER"),
    WG_POWER("MONITOR_WG_POWER"),
    GAUSS_POWER("MONITOR_GAUSS_POWER"),
    FIELD_NEFF("MONITOR_FIELD_NEFF");

    private final String keyword;

    MonitorType(String keyword) {
        this.keyword = keyword;
    }

    @Override
    public String keyword() {
        return keyword;
    }
}
