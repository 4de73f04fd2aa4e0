package org.janelia.imagefilters.kernel;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class KernelsTest {

    @Test
    public void boxKernel() {
        for (int radius = 0; radius < 4; radius++) {
            Kernel box = Kernels.box(radius);
            int side = 2 * radius + 1;
            assertEquals(side, box.getSide());
            assertEquals(1., box.sum(), 1e-5);
            for (float w : box.getWeights()) {
                assertEquals(1.f / (side * side), w, 0);
            }
        }
    }

    @Test
    public void gaussianKernel() {
        Kernel gaussian = Kernels.gaussian(2, 3.f);
        assertEquals(5, gaussian.getSide());
        assertEquals(1., gaussian.sum(), 1e-5);
        float center = gaussian.get(0, 0);
        for (int i = -2; i <= 2; i++) {
            for (int j = -2; j <= 2; j++) {
                // symmetric in both axes and never larger than the center
                assertEquals(gaussian.get(j, i), gaussian.get(-j, i), 1e-7);
                assertEquals(gaussian.get(j, i), gaussian.get(j, -i), 1e-7);
                assertEquals(gaussian.get(j, i), gaussian.get(i, j), 1e-7);
                assertTrue(gaussian.get(j, i) <= center);
            }
        }
        double expectedRatio = Math.exp(-1 / 18.);
        assertEquals(expectedRatio, gaussian.get(1, 0) / center, 1e-5);
        assertEquals(Math.exp(-8 / 18.), gaussian.get(-2, -2) / center, 1e-5);
    }

    @Test(expected = IllegalArgumentException.class)
    public void gaussianRequiresPositiveSigma() {
        Kernels.gaussian(1, 0);
    }

    @Test
    public void gradientKernelsHaveZeroGain() {
        Kernel[] gradientKernels = new Kernel[] {
                Kernels.sobelX(), Kernels.sobelY(),
                Kernels.scharrX(), Kernels.scharrY(),
                Kernels.prewittX(), Kernels.prewittY()
        };
        for (Kernel k : gradientKernels) {
            assertEquals(1, k.getRadius());
            assertEquals(0, k.sum(), 0);
        }
        assertEquals(2, Kernels.sobelX().get(1, 0), 0);
        assertEquals(-2, Kernels.sobelY().get(0, -1), 0);
        assertEquals(10, Kernels.scharrX().get(1, 0), 0);
        assertEquals(1, Kernels.prewittY().get(-1, 1), 0);
    }

    @Test
    public void sharpenKernelsHaveUnitGain() {
        assertEquals(1, Kernels.sharpen().sum(), 0);
        assertEquals(5, Kernels.sharpen().get(0, 0), 0);
        assertEquals(0, Kernels.sharpen().get(1, 1), 0);
        assertEquals(1, Kernels.sharpen2().sum(), 0);
        assertEquals(-1, Kernels.sharpen2().get(1, 1), 0);
    }

    @Test
    public void motionBlurKernel() {
        Kernel motionBlur = Kernels.motionBlur(2);
        assertEquals(2, motionBlur.getRadius());
        assertEquals(5, motionBlur.countNonZero());
        assertEquals(1., motionBlur.sum(), 1e-6);
        for (int d = -2; d <= 2; d++) {
            assertEquals(0.2f, motionBlur.get(d, d), 0);
        }
        assertEquals(0, motionBlur.get(1, -1), 0);
    }

    @Test
    public void structuringElements() {
        assertEquals(9, Kernels.square(1).countNonZero());
        assertEquals(25, Kernels.square(2).countNonZero());

        Kernel cross = Kernels.cross(2);
        assertEquals(9, cross.countNonZero());
        assertEquals(1, cross.get(0, -2), 0);
        assertEquals(1, cross.get(2, 0), 0);
        assertEquals(0, cross.get(1, 1), 0);

        Kernel disk = Kernels.disk(2);
        assertEquals(13, disk.countNonZero());
        assertEquals(1, disk.get(1, 1), 0);
        assertEquals(0, disk.get(2, 1), 0);
        assertEquals(0, disk.get(-2, -2), 0);

        assertEquals(1, Kernels.disk(0).countNonZero());
        assertEquals(Kernels.identity(0), Kernels.disk(0));
    }

    @Test
    public void identityKernel() {
        Kernel identity = Kernels.identity(2);
        assertEquals(1, identity.countNonZero());
        assertEquals(1, identity.get(0, 0), 0);
    }
}
