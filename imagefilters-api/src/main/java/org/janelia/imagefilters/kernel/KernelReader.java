package org.janelia.imagefilters.kernel;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.apache.commons.io.IOUtils;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads kernels from whitespace separated text: the first token is the side
 * of the square matrix, followed by side * side row-major weights.
 */
public class KernelReader {
    private static final Logger LOG = LoggerFactory.getLogger(KernelReader.class);

    public static Kernel readKernel(Path kernelPath) {
        try (InputStream kernelStream = Files.newInputStream(kernelPath)) {
            Kernel kernel = readKernel(kernelStream);
            LOG.debug("Read kernel of radius {} from {}", kernel.getRadius(), kernelPath);
            return kernel;
        } catch (IOException e) {
            throw new UncheckedIOException("Error reading kernel from " + kernelPath, e);
        }
    }

    public static Kernel readKernel(InputStream kernelStream) {
        try {
            return parseKernel(IOUtils.toString(kernelStream, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static Kernel parseKernel(String kernelSource) {
        String[] tokens = StringUtils.split(kernelSource);
        if (tokens == null || tokens.length == 0) {
            throw new MalformedKernelSourceException("Empty kernel source");
        }
        int side;
        try {
            side = Integer.parseInt(tokens[0]);
        } catch (NumberFormatException e) {
            throw new MalformedKernelSourceException("Invalid kernel side: " + tokens[0], e);
        }
        if (side <= 0) {
            throw new MalformedKernelSourceException("Kernel side must be positive: " + side);
        }
        if (side % 2 == 0) {
            // an even side has no center pixel
            throw new MalformedKernelSourceException("Kernel side must be odd: " + side);
        }
        long nweights = (long) side * side;
        if (tokens.length - 1 != nweights) {
            throw new MalformedKernelSourceException("A " + side + "x" + side + " kernel requires " + nweights +
                    " weights but found " + (tokens.length - 1));
        }
        float[] weights = new float[(int) nweights];
        for (int k = 0; k < nweights; k++) {
            String token = tokens[k + 1];
            try {
                weights[k] = Float.parseFloat(token);
            } catch (NumberFormatException e) {
                throw new MalformedKernelSourceException("Invalid kernel weight at position " + k + ": " + token, e);
            }
            if (!Float.isFinite(weights[k])) {
                throw new MalformedKernelSourceException("Kernel weight at position " + k + " is not finite: " + token);
            }
        }
        return new Kernel(side / 2, weights);
    }

    public static String formatKernel(Kernel kernel) {
        return kernel.getSide() + "\n" + kernel.toMatrixString();
    }
}
