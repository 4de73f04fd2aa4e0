package org.janelia.imagefilters.image;

import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.type.numeric.ARGBType;
import net.imglib2.view.Views;

/**
 * One-sided per channel difference of two images of the same shape.
 * Negative differences saturate to 0.
 */
public class ImageDifference {

    public static Img<ARGBType> difference(RandomAccessibleInterval<ARGBType> img1,
                                           RandomAccessibleInterval<ARGBType> img2) {
        if (!ImageAccessUtils.sameShape(img1, img2)) {
            throw new DimensionMismatchException(img1, img2);
        }
        Img<ARGBType> result = ImageAccessUtils.createRGBImage(img1.dimension(0), img1.dimension(1));
        Cursor<ARGBType> img1Cursor = Views.flatIterable(img1).cursor();
        Cursor<ARGBType> img2Cursor = Views.flatIterable(img2).cursor();
        Cursor<ARGBType> resultCursor = Views.flatIterable(result).cursor();
        while (resultCursor.hasNext()) {
            resultCursor.next().set(subtract(img1Cursor.next().get(), img2Cursor.next().get()));
        }
        return result;
    }

    static int subtract(int rgb1, int rgb2) {
        return PixelOps.rgb(
                PixelOps.red(rgb1) - PixelOps.red(rgb2),
                PixelOps.green(rgb1) - PixelOps.green(rgb2),
                PixelOps.blue(rgb1) - PixelOps.blue(rgb2)
        );
    }
}
