package nl.bytesoflife.lanterncad.circuit;

/**
 * A position measured from the beginning of another segment, written as
 * {@code <variable> rel begin segment <n>}.
 */
public record RelativePosition(String variable, SegmentId segment) {
}
