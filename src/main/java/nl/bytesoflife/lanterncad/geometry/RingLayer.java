package nl.bytesoflife.lanterncad.geometry;

import java.util.List;

/**
 * One concentric layer of a layered circular layout: {@code count} claddings on a ring whose
 * tightest radius is multiplied by {@code scale}. An innermost layer of one core sits on the
 * axis.
 */
public record RingLayer(int count, double scale) {

    public RingLayer {
        if (count < 0) {
            throw new LayoutException("Layer core count must not be negative, got " + count);
        }
        if (!Double.isFinite(scale) || scale <= 0) {
            throw new LayoutException("Layer scale must be positive, got " + scale);
        }
    }

    public static RingLayer of(int count) {
        return new RingLayer(count, 1);
    }

    public static int totalCount(List<RingLayer> layers) {
        int total = 0;
        for (RingLayer layer : layers) {
            total += layer.count();
        }
        return total;
    }
}
