package org.janelia.imagefilters.kernel;

import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class KernelTest {

    @Test
    public void kernelIndexing() {
        Kernel kernel = new Kernel(1,
                1, 2, 3,
                4, 5, 6,
                7, 8, 9);
        assertEquals(3, kernel.getSide());
        assertEquals(9, kernel.getSize());
        assertEquals(1, kernel.get(-1, -1), 0);
        assertEquals(3, kernel.get(1, -1), 0);
        assertEquals(5, kernel.get(0, 0), 0);
        assertEquals(7, kernel.get(-1, 1), 0);
        assertEquals(6, kernel.get(1, 0), 0);
        assertEquals(Kernel.idx(1, 0, 1), 5);
        assertEquals(Kernel.idx(-2, -2, 2), 0);
        assertEquals(Kernel.idx(2, 2, 2), 24);
    }

    @Test
    public void radiusZeroKernel() {
        Kernel kernel = new Kernel(0, 2.5f);
        assertEquals(1, kernel.getSide());
        assertEquals(2.5f, kernel.get(0, 0), 0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void negativeRadius() {
        new Kernel(-1, 1);
    }

    @Test(expected = IllegalArgumentException.class)
    public void radiusWhoseSizeOverflowsAnIntIsRejected() {
        // side 65537: side^2 wraps around to 131073 in int arithmetic
        new Kernel(32768, new float[131073]);
    }

    @Test
    public void sizeForRadius() {
        assertEquals(1, Kernel.sizeForRadius(0));
        assertEquals(25, Kernel.sizeForRadius(2));
        try {
            Kernel.sizeForRadius(Integer.MAX_VALUE);
            fail("Expected the kernel size check to fail");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("too large"));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void wrongNumberOfWeights() {
        new Kernel(1, 1, 2, 3, 4);
    }

    @Test
    public void weightsAreNotShared() {
        float[] weights = new float[] {0, 0, 0, 0, 1, 0, 0, 0, 0};
        Kernel kernel = new Kernel(1, weights);
        weights[4] = 7;
        assertEquals(1, kernel.get(0, 0), 0);

        float[] kernelWeights = kernel.getWeights();
        assertNotSame(kernelWeights, kernel.getWeights());
        kernelWeights[4] = 7;
        assertEquals(1, kernel.get(0, 0), 0);
    }

    @Test
    public void scaleCreatesANewKernel() {
        Kernel kernel = Kernels.square(1);
        Kernel scaled = kernel.scale(-2);
        assertEquals(9, kernel.sum(), 1e-6);
        assertEquals(-18, scaled.sum(), 1e-6);
        assertNotEquals(kernel, scaled);
        assertEquals(kernel, Kernels.square(1));
        assertEquals(kernel.hashCode(), Kernels.square(1).hashCode());
    }

    @Test
    public void matrixString() {
        Kernel kernel = new Kernel(1,
                1, 2, 3,
                4, 5, 6,
                7, 8, 9);
        assertEquals("1.0 2.0 3.0\n4.0 5.0 6.0\n7.0 8.0 9.0\n", kernel.toMatrixString());
        assertArrayEquals(new float[] {1, 2, 3, 4, 5, 6, 7, 8, 9}, kernel.getWeights(), 0);
    }
}
