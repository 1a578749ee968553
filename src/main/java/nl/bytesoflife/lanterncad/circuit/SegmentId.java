package nl.bytesoflife.lanterncad.circuit;

public final class SegmentId extends EntryId {

    SegmentId(int sequence) {
        super(sequence);
    }

    @Override
    String kind() {
        return "segment";
    }
}
