package nl.bytesoflife.lanterncad.circuit;

public final class MonitorId extends EntryId {

    MonitorId(int sequence) {
        super(sequence);
    }

    @Override
    String kind() {
        return "monitor";
    }
}
