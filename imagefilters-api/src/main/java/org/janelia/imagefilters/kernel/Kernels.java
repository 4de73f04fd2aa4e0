package org.janelia.imagefilters.kernel;

import java.util.Arrays;

/**
 * Kernel presets used by the convolution, gradient and morphological filters.
 */
public class Kernels {

    public static final int DEFAULT_BLUR_RADIUS = 2;
    public static final int DEFAULT_GAUSSIAN_RADIUS = 2;
    public static final float DEFAULT_GAUSSIAN_SIGMA = 3.f;
    public static final int DEFAULT_MOTION_BLUR_SIZE = 10;

    /**
     * @return a kernel with 1 at the center and 0 everywhere else.
     */
    public static Kernel identity(int radius) {
        float[] weights = new float[Kernel.sizeForRadius(radius)];
        weights[Kernel.idx(0, 0, radius)] = 1;
        return new Kernel(radius, weights);
    }

    public static Kernel box(int radius) {
        return constant(radius, 1.f / Kernel.sizeForRadius(radius));
    }

    public static Kernel gaussian(int radius, float sigma) {
        if (sigma <= 0) {
            throw new IllegalArgumentException("Gaussian sigma must be positive: " + sigma);
        }
        float[] weights = new float[Kernel.sizeForRadius(radius)];
        double norm = 0;
        for (int i = -radius; i <= radius; i++) {
            for (int j = -radius; j <= radius; j++) {
                double w = Math.exp(-(j * j + i * i) / (2. * sigma * sigma));
                weights[Kernel.idx(j, i, radius)] = (float) w;
                norm += w;
            }
        }
        for (int k = 0; k < weights.length; k++) {
            weights[k] = (float) (weights[k] / norm);
        }
        return new Kernel(radius, weights);
    }

    public static Kernel sobelX() {
        return new Kernel(1,
                -1, 0, 1,
                -2, 0, 2,
                -1, 0, 1);
    }

    public static Kernel sobelY() {
        return new Kernel(1,
                -1, -2, -1,
                0, 0, 0,
                1, 2, 1);
    }

    public static Kernel scharrX() {
        return new Kernel(1,
                -3, 0, 3,
                -10, 0, 10,
                -3, 0, 3);
    }

    public static Kernel scharrY() {
        return new Kernel(1,
                -3, -10, -3,
                0, 0, 0,
                3, 10, 3);
    }

    public static Kernel prewittX() {
        return new Kernel(1,
                -1, 0, 1,
                -1, 0, 1,
                -1, 0, 1);
    }

    public static Kernel prewittY() {
        return new Kernel(1,
                -1, -1, -1,
                0, 0, 0,
                1, 1, 1);
    }

    /**
     * Identity plus the negated 4-neighborhood.
     */
    public static Kernel sharpen() {
        return new Kernel(1,
                0, -1, 0,
                -1, 5, -1,
                0, -1, 0);
    }

    /**
     * Identity plus the negated 8-neighborhood.
     */
    public static Kernel sharpen2() {
        return new Kernel(1,
                -1, -1, -1,
                -1, 9, -1,
                -1, -1, -1);
    }

    /**
     * Averages the pixels along the main diagonal.
     */
    public static Kernel motionBlur(int n) {
        if (n < 0) {
            throw new IllegalArgumentException("Motion blur size must not be negative: " + n);
        }
        float[] weights = new float[Kernel.sizeForRadius(n)];
        int side = Kernel.sideForRadius(n);
        for (int d = -n; d <= n; d++) {
            weights[Kernel.idx(d, d, n)] = 1.f / side;
        }
        return new Kernel(n, weights);
    }

    /**
     * Structuring element covering the whole square neighborhood.
     */
    public static Kernel square(int radius) {
        return constant(radius, 1);
    }

    /**
     * Structuring element covering the center row and the center column.
     */
    public static Kernel cross(int radius) {
        float[] weights = new float[Kernel.sizeForRadius(radius)];
        for (int d = -radius; d <= radius; d++) {
            weights[Kernel.idx(d, 0, radius)] = 1;
            weights[Kernel.idx(0, d, radius)] = 1;
        }
        return new Kernel(radius, weights);
    }

    /**
     * Structuring element covering the disk inscribed in the kernel square.
     */
    public static Kernel disk(int radius) {
        float[] weights = new float[Kernel.sizeForRadius(radius)];
        if (radius == 0) {
            weights[0] = 1;
            return new Kernel(radius, weights);
        }
        for (int i = -radius; i <= radius; i++) {
            for (int j = -radius; j <= radius; j++) {
                double dist = (double) (j * j + i * i) / (radius * radius);
                if (dist <= 1) {
                    weights[Kernel.idx(j, i, radius)] = 1;
                }
            }
        }
        return new Kernel(radius, weights);
    }

    public static Kernel constant(int radius, float value) {
        float[] weights = new float[Kernel.sizeForRadius(radius)];
        Arrays.fill(weights, value);
        return new Kernel(radius, weights);
    }
}
