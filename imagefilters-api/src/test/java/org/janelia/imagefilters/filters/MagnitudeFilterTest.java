package org.janelia.imagefilters.filters;

import net.imglib2.img.Img;
import net.imglib2.type.numeric.ARGBType;
import org.janelia.imagefilters.image.ImageAccessUtils;
import org.janelia.imagefilters.image.PixelOps;
import org.janelia.imagefilters.image.TestUtils;
import org.janelia.imagefilters.kernel.Kernels;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class MagnitudeFilterTest {

    private static final int BLACK = PixelOps.rgb(0, 0, 0);
    private static final int WHITE = PixelOps.rgb(255, 255, 255);

    @Test
    public void sobelRespondsOnlyAtTheVerticalStepEdge() {
        Img<ARGBType> stepImage = TestUtils.createImage(8, 6, (x, y) -> x < 4 ? BLACK : WHITE);
        MagnitudeFilter[] edgeFilters = new MagnitudeFilter[] {
                MagnitudeFilter.sobel(), MagnitudeFilter.scharr(), MagnitudeFilter.prewitt()
        };
        for (MagnitudeFilter edgeFilter : edgeFilters) {
            Img<ARGBType> edgeImage = edgeFilter.process(stepImage);
            for (int y = 0; y < 6; y++) {
                for (int x = 0; x < 8; x++) {
                    int edgeResponse = PixelOps.red(TestUtils.getPixel(edgeImage, x, y));
                    if (x == 3 || x == 4) {
                        // the columns on both sides of the step
                        assertEquals(255, edgeResponse);
                    } else {
                        assertEquals(0, edgeResponse);
                    }
                }
            }
        }
    }

    @Test
    public void sobelOnAHorizontalRamp() {
        Img<ARGBType> rampImage = TestUtils.createImage(5, 3, (x, y) -> PixelOps.rgb(10 * x, 5 * x, 0));
        Img<ARGBType> edgeImage = MagnitudeFilter.sobel().process(rampImage);
        // interior: (1 + 2 + 1) * 2 * step
        TestUtils.assertPixelEquals(80, 40, 0, TestUtils.getPixel(edgeImage, 2, 1));
        // left border: the clamped neighbor halves the difference
        TestUtils.assertPixelEquals(40, 20, 0, TestUtils.getPixel(edgeImage, 0, 1));
    }

    @Test
    public void intermediateResponsesAreNotClamped() {
        Img<ARGBType> testImage = TestUtils.createUniformImage(3, 3, PixelOps.rgb(30, 40, 0));
        MagnitudeFilter magnitudeFilter = new MagnitudeFilter(
                Kernels.identity(1).scale(-1),
                Kernels.identity(1)
        );
        Img<ARGBType> magnitudeImage = magnitudeFilter.process(testImage);
        TestUtils.assertPixelEquals(42, 57, 0, TestUtils.getPixel(magnitudeImage, 1, 1));
    }

    @Test
    public void kernelsMayHaveDifferentRadii() {
        Img<ARGBType> testImage = TestUtils.createRandomImage(6, 6, 7L);
        MagnitudeFilter magnitudeFilter = new MagnitudeFilter(Kernels.identity(0), Kernels.box(2).scale(0));
        TestUtils.assertImagesEqual(testImage, magnitudeFilter.process(testImage));
    }

    @Test
    public void magnitudeIsNeverNegative() {
        Img<ARGBType> testImage = TestUtils.createRandomImage(10, 10, 99L);
        Img<ARGBType> edgeImage = MagnitudeFilter.scharr().process(testImage);
        for (int rgb : ImageAccessUtils.getRGBPixels(edgeImage)) {
            assertTrue(PixelOps.red(rgb) >= 0 && PixelOps.green(rgb) >= 0 && PixelOps.blue(rgb) >= 0);
        }
    }
}
