package org.janelia.imagefilters.image.io;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import javax.imageio.ImageIO;

import net.imglib2.Cursor;
import net.imglib2.img.Img;
import net.imglib2.type.numeric.ARGBType;
import net.imglib2.view.Views;
import org.janelia.imagefilters.image.ImageAccessUtils;
import org.janelia.imagefilters.image.PixelOps;

public class ImageReader {

    public static Img<ARGBType> readRGBImage(String source) {
        return readRGBImage(Paths.get(source));
    }

    public static Img<ARGBType> readRGBImage(Path source) {
        if (!Files.exists(source)) {
            throw new UncheckedIOException(new IOException("Image file " + source + " not found"));
        }
        try (InputStream sourceStream = Files.newInputStream(source)) {
            return readRGBImageFromStream(sourceStream, source.toString());
        } catch (IOException e) {
            throw new UncheckedIOException("Error reading " + source, e);
        }
    }

    public static Img<ARGBType> readRGBImageFromStream(InputStream source, String sourceName) {
        BufferedImage bufferedImage;
        try {
            bufferedImage = ImageIO.read(source);
        } catch (IOException e) {
            throw new UncheckedIOException("Error decoding " + sourceName, e);
        }
        if (bufferedImage == null) {
            throw new UncheckedIOException(new IOException("Unsupported or corrupt image " + sourceName));
        }
        return fromBufferedImage(bufferedImage);
    }

    public static Img<ARGBType> fromBufferedImage(BufferedImage bufferedImage) {
        int width = bufferedImage.getWidth();
        int height = bufferedImage.getHeight();
        Img<ARGBType> img = ImageAccessUtils.createRGBImage(width, height);
        Cursor<ARGBType> imgCursor = Views.flatIterable(img).localizingCursor();
        while (imgCursor.hasNext()) {
            imgCursor.fwd();
            int rgb = bufferedImage.getRGB(imgCursor.getIntPosition(0), imgCursor.getIntPosition(1));
            imgCursor.get().set(PixelOps.rgb(PixelOps.red(rgb), PixelOps.green(rgb), PixelOps.blue(rgb)));
        }
        return img;
    }
}
