package org.janelia.imagefilters.filters;

import net.imglib2.img.Img;
import net.imglib2.type.numeric.ARGBType;
import org.janelia.imagefilters.image.ImageAccessUtils;
import org.janelia.imagefilters.image.PixelOps;
import org.janelia.imagefilters.image.TestUtils;
import org.junit.Test;

public class StatisticsFiltersTest {

    @Test
    public void grayWorldBalancesTheChannelMeans() {
        Img<ARGBType> testImage = ImageAccessUtils.createRGBImage(2, 1,
                PixelOps.rgb(200, 100, 0),
                PixelOps.rgb(100, 50, 30));
        Img<ARGBType> balancedImage = new GrayWorldFilter().process(testImage);
        TestUtils.assertPixelEquals(107, 107, 0, TestUtils.getPixel(balancedImage, 0, 0));
        TestUtils.assertPixelEquals(53, 53, 160, TestUtils.getPixel(balancedImage, 1, 0));
    }

    @Test
    public void grayWorldKeepsABlackImage() {
        Img<ARGBType> testImage = TestUtils.createUniformImage(3, 3, 0);
        TestUtils.assertImagesEqual(testImage, new GrayWorldFilter().process(testImage));
    }

    @Test
    public void perfectReflectorMapsTheChannelMaximumToWhite() {
        Img<ARGBType> testImage = ImageAccessUtils.createRGBImage(2, 1,
                PixelOps.rgb(100, 50, 0),
                PixelOps.rgb(200, 25, 0));
        Img<ARGBType> balancedImage = new PerfectReflectorFilter().process(testImage);
        TestUtils.assertPixelEquals(128, 255, 0, TestUtils.getPixel(balancedImage, 0, 0));
        TestUtils.assertPixelEquals(255, 128, 0, TestUtils.getPixel(balancedImage, 1, 0));
    }

    @Test
    public void linearStretchCoversTheFullRange() {
        Img<ARGBType> testImage = ImageAccessUtils.createRGBImage(3, 1,
                PixelOps.rgb(50, 100, 7),
                PixelOps.rgb(150, 100, 7),
                PixelOps.rgb(100, 100, 7));
        Img<ARGBType> stretchedImage = new LinearHistogramStretchFilter().process(testImage);
        TestUtils.assertPixelEquals(0, 100, 7, TestUtils.getPixel(stretchedImage, 0, 0));
        TestUtils.assertPixelEquals(255, 100, 7, TestUtils.getPixel(stretchedImage, 1, 0));
        TestUtils.assertPixelEquals(128, 100, 7, TestUtils.getPixel(stretchedImage, 2, 0));
    }

    @Test
    public void statisticsAreNotKeptBetweenImages() {
        LinearHistogramStretchFilter stretchFilter = new LinearHistogramStretchFilter();
        stretchFilter.process(ImageAccessUtils.createRGBImage(2, 1, PixelOps.rgb(0, 0, 0), PixelOps.rgb(10, 10, 10)));

        Img<ARGBType> secondImage = ImageAccessUtils.createRGBImage(2, 1, PixelOps.rgb(100, 0, 0), PixelOps.rgb(200, 0, 0));
        Img<ARGBType> stretchedImage = stretchFilter.process(secondImage);
        TestUtils.assertPixelEquals(0, 0, 0, TestUtils.getPixel(stretchedImage, 0, 0));
        TestUtils.assertPixelEquals(255, 0, 0, TestUtils.getPixel(stretchedImage, 1, 0));
    }
}
