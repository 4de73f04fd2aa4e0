package org.janelia.imagefilters.image;

/**
 * Random displacement of up to half the spread in each direction. The
 * displacement is a function of the seed and the position only, so the same
 * image always produces the same result.
 */
public class GlassTransform implements GeomTransform {
    static final double SPREAD = 10;

    private final long seed;

    public GlassTransform(long seed) {
        this.seed = seed;
    }

    @Override
    public void apply(long[] currentPos, long[] originPos) {
        double rx = random(currentPos[0], currentPos[1], 0);
        double ry = random(currentPos[0], currentPos[1], 1);
        originPos[0] = currentPos[0] + (long) ((rx - 0.5) * SPREAD);
        originPos[1] = currentPos[1] + (long) ((ry - 0.5) * SPREAD);
    }

    /**
     * @return a value in [0, 1) derived from the seed, the position and the axis.
     */
    private double random(long x, long y, int axis) {
        long h = seed;
        h = mix(h ^ x);
        h = mix(h ^ y);
        h = mix(h ^ axis);
        return (h >>> 11) * 0x1.0p-53;
    }

    // splitmix64 finalizer
    private static long mix(long z) {
        z = (z ^ (z >>> 30)) * 0xbf58476d1ce4e5b9L;
        z = (z ^ (z >>> 27)) * 0x94d049bb133111ebL;
        return z ^ (z >>> 31);
    }
}
