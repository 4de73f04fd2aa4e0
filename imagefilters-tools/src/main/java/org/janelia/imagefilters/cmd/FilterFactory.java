package org.janelia.imagefilters.cmd;

import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.janelia.imagefilters.config.Config;
import org.janelia.imagefilters.filters.ColorFilters;
import org.janelia.imagefilters.filters.ConvolutionFilter;
import org.janelia.imagefilters.filters.GlassFilter;
import org.janelia.imagefilters.filters.GrayWorldFilter;
import org.janelia.imagefilters.filters.ImageFilter;
import org.janelia.imagefilters.filters.LinearHistogramStretchFilter;
import org.janelia.imagefilters.filters.MagnitudeFilter;
import org.janelia.imagefilters.filters.MedianFilter;
import org.janelia.imagefilters.filters.MoveFilter;
import org.janelia.imagefilters.filters.PerfectReflectorFilter;
import org.janelia.imagefilters.filters.RotateFilter;
import org.janelia.imagefilters.filters.WavesFilter;
import org.janelia.imagefilters.kernel.Kernel;
import org.janelia.imagefilters.kernel.KernelReader;
import org.janelia.imagefilters.kernel.Kernels;
import org.janelia.imagefilters.morphology.MorphologicalFilter;
import org.janelia.imagefilters.morphology.MorphologicalOperation;
import org.janelia.imagefilters.morphology.StructuringElementFilter;

/**
 * Creates filters by name. Explicit command line arguments take precedence
 * over the configured defaults.
 */
class FilterFactory {

    static final String CONVOLVE = "convolve";

    static final List<String> FILTER_NAMES = Collections.unmodifiableList(Arrays.asList(
            "invert", "grayscale", "sepia", "brightness",
            "blur", "gaussian", "sharpen", "sharpen2", "motion-blur", CONVOLVE,
            "sobel-x", "sobel-y", "sobel", "scharr", "prewitt",
            "median", "gray-world", "perfect-reflector", "histogram-stretch",
            "move", "rotate", "waves", "glass",
            "dilation", "erosion", "opening", "closing", "gradient", "top-hat", "black-hat"
    ));

    static boolean isKnownFilter(String filterName) {
        return FILTER_NAMES.contains(filterName);
    }

    private final Config config;

    FilterFactory(Config config) {
        this.config = config;
    }

    ImageFilter createFilter(ApplyFilterCmd.ApplyFilterArgs args) {
        String filterName = StringUtils.defaultString(args.filterName);
        switch (filterName) {
            case "invert":
                return ColorFilters.invert();
            case "grayscale":
                return ColorFilters.grayScale();
            case "sepia":
                return ColorFilters.sepia(floatArg(args.coefficient, "Sepia.Coefficient", ColorFilters.DEFAULT_SEPIA_COEFFICIENT));
            case "brightness":
                return ColorFilters.brightness(floatArg(args.coefficient, "Brightness.Coefficient", ColorFilters.DEFAULT_BRIGHTNESS_COEFFICIENT));
            case "blur":
                return ConvolutionFilter.blur(intArg(args.radius, "Blur.Radius", Kernels.DEFAULT_BLUR_RADIUS));
            case "gaussian":
                return ConvolutionFilter.gaussian(
                        intArg(args.radius, "Gaussian.Radius", Kernels.DEFAULT_GAUSSIAN_RADIUS),
                        floatArg(args.sigma, "Gaussian.Sigma", Kernels.DEFAULT_GAUSSIAN_SIGMA));
            case "sharpen":
                return ConvolutionFilter.sharpen();
            case "sharpen2":
                return ConvolutionFilter.sharpen2();
            case "motion-blur":
                return ConvolutionFilter.motionBlur(intArg(args.radius, "MotionBlur.Size", Kernels.DEFAULT_MOTION_BLUR_SIZE));
            case CONVOLVE:
                return new ConvolutionFilter(KernelReader.readKernel(Paths.get(args.kernelFileName)));
            case "sobel-x":
                return ConvolutionFilter.sobelX();
            case "sobel-y":
                return ConvolutionFilter.sobelY();
            case "sobel":
                return MagnitudeFilter.sobel();
            case "scharr":
                return MagnitudeFilter.scharr();
            case "prewitt":
                return MagnitudeFilter.prewitt();
            case "median":
                return new MedianFilter(intArg(args.radius, "Median.Radius", MedianFilter.DEFAULT_RADIUS));
            case "gray-world":
                return new GrayWorldFilter();
            case "perfect-reflector":
                return new PerfectReflectorFilter();
            case "histogram-stretch":
                return new LinearHistogramStretchFilter();
            case "move":
                return new MoveFilter(args.deltaX, args.deltaY);
            case "rotate":
                return new RotateFilter(args.centerX, args.centerY, Math.toRadians(args.angle));
            case "waves":
                return new WavesFilter(floatArg(args.sigma, "Waves.Period", WavesFilter.DEFAULT_SIGMA), args.wavesAxis);
            case "glass":
                return new GlassFilter(args.seed != null
                        ? args.seed
                        : config.getLongPropertyValue("Glass.Seed", GlassFilter.DEFAULT_SEED));
            case "dilation":
                return StructuringElementFilter.dilation(getStructuringElement(args));
            case "erosion":
                return StructuringElementFilter.erosion(getStructuringElement(args));
            case "opening":
                return new MorphologicalFilter(MorphologicalOperation.OPENING, getStructuringElement(args));
            case "closing":
                return new MorphologicalFilter(MorphologicalOperation.CLOSING, getStructuringElement(args));
            case "gradient":
                return new MorphologicalFilter(MorphologicalOperation.GRADIENT, getStructuringElement(args));
            case "top-hat":
                return new MorphologicalFilter(MorphologicalOperation.TOP_HAT, getStructuringElement(args));
            case "black-hat":
                return new MorphologicalFilter(MorphologicalOperation.BLACK_HAT, getStructuringElement(args));
            default:
                throw new IllegalArgumentException("Unknown filter: " + filterName);
        }
    }

    Kernel getStructuringElement(ApplyFilterCmd.ApplyFilterArgs args) {
        if (StringUtils.isNotBlank(args.kernelFileName)) {
            return KernelReader.readKernel(Paths.get(args.kernelFileName));
        }
        int radius = intArg(args.radius, "Morphology.Radius", 1);
        String shape = StringUtils.defaultIfBlank(args.structuringElementShape, "square");
        switch (shape.toLowerCase()) {
            case "square":
                return Kernels.square(radius);
            case "cross":
                return Kernels.cross(radius);
            case "disk":
                return Kernels.disk(radius);
            default:
                throw new IllegalArgumentException("Unknown structuring element shape: " + shape);
        }
    }

    private int intArg(Integer argValue, String configProperty, int defaultValue) {
        return argValue != null ? argValue : config.getIntegerPropertyValue(configProperty, defaultValue);
    }

    private float floatArg(Float argValue, String configProperty, float defaultValue) {
        return argValue != null ? argValue : config.getFloatPropertyValue(configProperty, defaultValue);
    }
}
