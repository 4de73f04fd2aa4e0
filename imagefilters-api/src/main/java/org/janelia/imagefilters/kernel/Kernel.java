package org.janelia.imagefilters.kernel;

import java.util.Arrays;

import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Square matrix of weights centered on the processed pixel. The side of the
 * kernel is always 2 * radius + 1 and the weights are stored row-major, so
 * the weight for the offset (j, i) from the center is at
 * {@code (i + radius) * side + (j + radius)}.
 */
public final class Kernel {

    // largest side whose square still fits in an int
    private static final int MAX_SIDE = 46340;

    private final int radius;
    private final int side;
    private final float[] weights;

    /**
     * @param radius kernel radius
     * @param weights row-major weights; the array is copied
     */
    public Kernel(int radius, float... weights) {
        int size = sizeForRadius(radius);
        if (weights == null || weights.length != size) {
            throw new IllegalArgumentException("A kernel of radius " + radius + " requires " + size +
                    " weights but got " + (weights == null ? 0 : weights.length));
        }
        this.radius = radius;
        this.side = sideForRadius(radius);
        this.weights = Arrays.copyOf(weights, weights.length);
    }

    public static int sideForRadius(int radius) {
        return 2 * radius + 1;
    }

    /**
     * @return the number of weights of a kernel with the given radius
     * @throws IllegalArgumentException if the radius is negative or the weights would not fit in an array
     */
    public static int sizeForRadius(int radius) {
        if (radius < 0) {
            throw new IllegalArgumentException("Kernel radius must not be negative: " + radius);
        }
        long side = 2L * radius + 1;
        if (side > MAX_SIDE) {
            throw new IllegalArgumentException("Kernel radius is too large: " + radius);
        }
        return (int) (side * side);
    }

    public static int idx(int j, int i, int radius) {
        return (i + radius) * sideForRadius(radius) + (j + radius);
    }

    public int getRadius() {
        return radius;
    }

    public int getSide() {
        return side;
    }

    public int getSize() {
        return weights.length;
    }

    /**
     * @param j horizontal offset from the center in [-radius, radius]
     * @param i vertical offset from the center in [-radius, radius]
     */
    public float get(int j, int i) {
        return weights[idx(j, i, radius)];
    }

    public float getAt(int index) {
        return weights[index];
    }

    /**
     * @return a copy of the row-major weights.
     */
    public float[] getWeights() {
        return Arrays.copyOf(weights, weights.length);
    }

    public double sum() {
        double s = 0;
        for (float w : weights) {
            s += w;
        }
        return s;
    }

    public long countNonZero() {
        long n = 0;
        for (float w : weights) {
            if (w != 0) n++;
        }
        return n;
    }

    /**
     * @return a new kernel with every weight multiplied by the given factor.
     */
    public Kernel scale(double factor) {
        float[] scaledWeights = new float[weights.length];
        for (int k = 0; k < weights.length; k++) {
            scaledWeights[k] = (float) (weights[k] * factor);
        }
        return new Kernel(radius, scaledWeights);
    }

    /**
     * @return the weights formatted as a matrix, one row per line.
     */
    public String toMatrixString() {
        StringBuilder sb = new StringBuilder();
        for (int i = -radius; i <= radius; i++) {
            for (int j = -radius; j <= radius; j++) {
                if (j > -radius) sb.append(' ');
                sb.append(get(j, i));
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;

        if (o == null || getClass() != o.getClass()) return false;

        Kernel kernel = (Kernel) o;

        return new EqualsBuilder()
                .append(radius, kernel.radius)
                .append(weights, kernel.weights)
                .isEquals();
    }

    @Override
    public int hashCode() {
        return new HashCodeBuilder(17, 37)
                .append(radius)
                .append(weights)
                .toHashCode();
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("radius", radius)
                .append("weights", weights)
                .toString();
    }
}
