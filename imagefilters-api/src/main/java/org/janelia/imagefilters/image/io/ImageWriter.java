package org.janelia.imagefilters.image.io;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import javax.imageio.ImageIO;

import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.ARGBType;
import net.imglib2.view.Views;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;
import org.janelia.imagefilters.image.ImageAccessUtils;

public class ImageWriter {

    public static final String DEFAULT_FORMAT = "png";

    /**
     * Write the image using the format given by the file extension, or PNG if there is no extension.
     */
    public static void writeRGBImage(RandomAccessibleInterval<ARGBType> img, Path target) {
        String format = StringUtils.defaultIfBlank(FilenameUtils.getExtension(target.toString()), DEFAULT_FORMAT);
        writeRGBImage(img, target, format);
    }

    public static void writeRGBImage(RandomAccessibleInterval<ARGBType> img, Path target, String format) {
        try {
            if (target.getParent() != null) {
                Files.createDirectories(target.getParent());
            }
            try (OutputStream targetStream = Files.newOutputStream(target)) {
                writeRGBImageToStream(img, targetStream, format);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Error writing " + target, e);
        }
    }

    public static void writeRGBImageToStream(RandomAccessibleInterval<ARGBType> img, OutputStream target, String format) throws IOException {
        if (!ImageIO.write(toBufferedImage(img), format.toLowerCase(), target)) {
            throw new IOException("No image writer found for " + format);
        }
    }

    public static BufferedImage toBufferedImage(RandomAccessibleInterval<ARGBType> img) {
        BufferedImage bufferedImage = new BufferedImage(
                ImageAccessUtils.getWidth(img),
                ImageAccessUtils.getHeight(img),
                BufferedImage.TYPE_INT_RGB);
        Cursor<ARGBType> imgCursor = Views.flatIterable(Views.zeroMin(img)).localizingCursor();
        while (imgCursor.hasNext()) {
            imgCursor.fwd();
            bufferedImage.setRGB(imgCursor.getIntPosition(0), imgCursor.getIntPosition(1), imgCursor.get().get());
        }
        return bufferedImage;
    }
}
