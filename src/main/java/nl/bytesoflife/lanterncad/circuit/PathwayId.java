package nl.bytesoflife.lanterncad.circuit;

public final class PathwayId extends EntryId {

    PathwayId(int sequence) {
        super(sequence);
    }

    @Override
    String kind() {
        return "pathway";
    }
}
