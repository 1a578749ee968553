package nl.bytesoflife.lanterncad.circuit;

public final class LaunchFieldId extends EntryId {

    LaunchFieldId(int sequence) {
        super(sequence);
    }

    @Override
    String kind() {
        return "launch_field";
    }
}
