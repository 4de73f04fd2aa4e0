package org.janelia.imagefilters.image;

/**
 * Sinusoidal displacement along one axis, modulated by the position on the other axis.
 */
public class WavesTransform implements GeomTransform {

    public enum WavesAxis {
        X, Y
    }

    static final double AMPLITUDE = 20;

    private final double period;
    private final WavesAxis axis;

    /**
     * @param sigma half of the wave period in pixels
     * @param axis displacement axis
     */
    public WavesTransform(double sigma, WavesAxis axis) {
        if (sigma <= 0) {
            throw new IllegalArgumentException("Waves sigma must be positive: " + sigma);
        }
        this.period = 2 * sigma;
        this.axis = axis;
    }

    @Override
    public void apply(long[] currentPos, long[] originPos) {
        System.arraycopy(currentPos, 0, originPos, 0, currentPos.length);
        if (axis == WavesAxis.X) {
            originPos[0] = currentPos[0] + Math.round(AMPLITUDE * Math.sin(2 * Math.PI * currentPos[1] / period));
        } else {
            originPos[1] = currentPos[1] + Math.round(AMPLITUDE * Math.sin(2 * Math.PI * currentPos[0] / period));
        }
    }
}
