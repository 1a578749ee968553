package nl.bytesoflife.lanterncad.circuit;

/**
 * Opaque handle of a circuit entry. Handles compare by identity, so a handle issued by one
 * circuit never resolves in another. The file index of an entry is derived from its position
 * when the circuit is written, not from the handle.
 */
public abstract class EntryId {

    private final int sequence;

    EntryId(int sequence) {
        this.sequence = sequence;
    }

    abstract String kind();

    @Override
    public final boolean equals(Object o) {
        return this == o;
    }

    @Override
    public final int hashCode() {
        return System.identityHashCode(this);
    }

    @Override
    public String toString() {
        return kind() + "#" + sequence;
    }
}
