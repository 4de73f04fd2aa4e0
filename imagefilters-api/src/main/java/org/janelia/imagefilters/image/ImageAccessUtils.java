package org.janelia.imagefilters.image;

import net.imglib2.Cursor;
import net.imglib2.FinalInterval;
import net.imglib2.Interval;
import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.ARGBType;
import net.imglib2.util.Intervals;
import net.imglib2.view.Views;

public class ImageAccessUtils {

    public static Img<ARGBType> createRGBImage(long width, long height) {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Invalid image shape: " + width + "x" + height);
        }
        return ArrayImgs.argbs(width, height);
    }

    /**
     * Create an RGB image from packed row-major colors.
     */
    public static Img<ARGBType> createRGBImage(int width, int height, int... rgbPixels) {
        if (rgbPixels.length != width * height) {
            throw new IllegalArgumentException("Expected " + (width * height) + " pixels but got " + rgbPixels.length);
        }
        Img<ARGBType> img = createRGBImage(width, height);
        Cursor<ARGBType> imgCursor = Views.flatIterable(img).cursor();
        int i = 0;
        while (imgCursor.hasNext()) {
            int p = rgbPixels[i++];
            imgCursor.next().set(PixelOps.rgb(PixelOps.red(p), PixelOps.green(p), PixelOps.blue(p)));
        }
        return img;
    }

    public static int getWidth(Interval img) {
        return (int) img.dimension(0);
    }

    public static int getHeight(Interval img) {
        return (int) img.dimension(1);
    }

    public static boolean sameShape(Interval ref, Interval img) {
        return Intervals.equalDimensions(ref, img);
    }

    public static int getRGB(RandomAccessibleInterval<ARGBType> img, int x, int y) {
        RandomAccess<ARGBType> ra = img.randomAccess();
        ra.setPosition(img.min(0) + x, 0);
        ra.setPosition(img.min(1) + y, 1);
        return ra.get().get();
    }

    public static void setRGB(RandomAccessibleInterval<ARGBType> img, int x, int y, int rgb) {
        RandomAccess<ARGBType> ra = img.randomAccess();
        ra.setPosition(img.min(0) + x, 0);
        ra.setPosition(img.min(1) + y, 1);
        ra.get().set(rgb);
    }

    /**
     * @return an independent, zero-origin copy of the image.
     */
    public static Img<ARGBType> copyImage(RandomAccessibleInterval<ARGBType> img) {
        Img<ARGBType> imgCopy = createRGBImage(img.dimension(0), img.dimension(1));
        Cursor<ARGBType> sourceCursor = Views.flatIterable(img).cursor();
        Cursor<ARGBType> targetCursor = Views.flatIterable(imgCopy).cursor();
        while (targetCursor.hasNext()) {
            targetCursor.next().set(sourceCursor.next());
        }
        return imgCopy;
    }

    /**
     * Crop a region of the image into a new buffer. The region is clamped to the image bounds.
     */
    public static Img<ARGBType> cropImage(RandomAccessibleInterval<ARGBType> img, long x, long y, long width, long height) {
        RandomAccessibleInterval<ARGBType> zeroMinImg = Views.zeroMin(img);
        Interval region = Intervals.intersect(
                zeroMinImg,
                FinalInterval.createMinSize(x, y, width, height)
        );
        if (Intervals.isEmpty(region)) {
            throw new IllegalArgumentException("Crop region " + x + "," + y + " " + width + "x" + height +
                    " does not intersect the image " + img.dimension(0) + "x" + img.dimension(1));
        }
        return copyImage(Views.interval(zeroMinImg, region));
    }

    public static int[] getRGBPixels(RandomAccessibleInterval<ARGBType> img) {
        int[] pixels = new int[(int) Intervals.numElements(img)];
        Cursor<ARGBType> imgCursor = Views.flatIterable(img).cursor();
        int i = 0;
        while (imgCursor.hasNext()) {
            pixels[i++] = imgCursor.next().get();
        }
        return pixels;
    }
}
