package org.janelia.imagefilters.filters;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import net.imglib2.img.Img;
import net.imglib2.type.numeric.ARGBType;
import org.janelia.imagefilters.image.ClampedPixelAccess;
import org.janelia.imagefilters.image.PixelOps;
import org.janelia.imagefilters.image.TestUtils;
import org.janelia.imagefilters.kernel.Kernels;
import org.janelia.imagefilters.morphology.MorphologicalFilter;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class AbstractPixelFilterTest {

    private ExecutorService executorService;

    @Before
    public void setUp() {
        executorService = Executors.newFixedThreadPool(3);
    }

    @After
    public void tearDown() {
        executorService.shutdownNow();
    }

    @Test
    public void parallelProcessingMatchesSequentialProcessing() {
        Img<ARGBType> testImage = TestUtils.createRandomImage(37, 29, 31L);
        ImageFilter[] testFilters = new ImageFilter[] {
                ConvolutionFilter.gaussian(Kernels.DEFAULT_GAUSSIAN_RADIUS, Kernels.DEFAULT_GAUSSIAN_SIGMA),
                MagnitudeFilter.sobel(),
                new MedianFilter(),
                new GrayWorldFilter(),
                new GlassFilter(3L),
                MorphologicalFilter.opening(Kernels.disk(2))
        };
        for (ImageFilter testFilter : testFilters) {
            Img<ARGBType> sequentialResult = testFilter.process(testImage);
            Img<ARGBType> parallelResult = testFilter.process(testImage, executorService);
            assertEquals(testFilter.getClass().getSimpleName(), 0, TestUtils.countDiffs(sequentialResult, parallelResult));
        }
    }

    @Test
    public void nullExecutorProcessesSequentially() {
        Img<ARGBType> testImage = TestUtils.createRandomImage(8, 8, 37L);
        TestUtils.assertImagesEqual(ColorFilters.invert().process(testImage), ColorFilters.invert().process(testImage, null));
    }

    @Test
    public void taskFailuresArePropagated() {
        AbstractPixelFilter failingFilter = new AbstractPixelFilter() {
            @Override
            protected int calcNewPixelColor(ClampedPixelAccess img, int x, int y) {
                if (y == 5) {
                    throw new IllegalStateException("Cannot process row " + y);
                }
                return img.get(x, y);
            }
        };
        try {
            failingFilter.process(TestUtils.createRandomImage(4, 10, 41L), executorService);
            fail("Expected the row failure to be propagated");
        } catch (IllegalStateException e) {
            assertTrue(e.getMessage().contains("row 5"));
        }
    }

    @Test
    public void filtersCanBeChained() {
        Img<ARGBType> testImage = TestUtils.createUniformImage(3, 3, PixelOps.rgb(10, 20, 30));
        ImageFilter chainedFilter = ColorFilters.invert().andThen(ColorFilters.brightness(-5));
        Img<ARGBType> chainedResult = chainedFilter.process(testImage);
        TestUtils.assertPixelEquals(240, 230, 220, TestUtils.getPixel(chainedResult, 2, 2));
        TestUtils.assertImagesEqual(chainedResult, chainedFilter.process(testImage, executorService));
    }

    @Test
    public void singleRowImage() {
        Img<ARGBType> testImage = TestUtils.createRandomImage(50, 1, 43L);
        TestUtils.assertImagesEqual(
                ConvolutionFilter.blur(1).process(testImage),
                ConvolutionFilter.blur(1).process(testImage, executorService));
    }
}
