package org.janelia.imagefilters.cmd;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;

import net.imglib2.img.Img;
import net.imglib2.type.numeric.ARGBType;
import org.apache.commons.lang3.StringUtils;
import org.janelia.imagefilters.filters.ImageFilter;
import org.janelia.imagefilters.image.WavesTransform;
import org.janelia.imagefilters.image.io.ImageReader;
import org.janelia.imagefilters.image.io.ImageWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command to apply one filter to an image file.
 */
class ApplyFilterCmd extends AbstractCmd {

    private static final Logger LOG = LoggerFactory.getLogger(ApplyFilterCmd.class);

    @Parameters(commandDescription = "Apply a filter to an image")
    static class ApplyFilterArgs extends AbstractCmdArgs {
        @Parameter(names = {"-i", "-p", "--input"}, description = "Input image", required = true)
        String inputImage;

        @Parameter(names = {"-o", "--output"}, description = "Output image", required = true)
        String outputImage;

        @Parameter(names = {"-f", "--filter"}, description = "Filter name - use the list command to see all filters", required = true)
        String filterName;

        @Parameter(names = {"--format"}, description = "Output image format; by default it is derived from the output file extension")
        String outputFormat;

        @Parameter(names = {"--kernel"}, description = "Kernel file: the matrix side followed by the row-major weights")
        String kernelFileName;

        @Parameter(names = {"--structuringElement", "-se"}, description = "Structuring element shape used when no kernel file is given: square, cross or disk")
        String structuringElementShape = "square";

        @Parameter(names = {"--radius"}, description = "Kernel radius")
        Integer radius;

        @Parameter(names = {"--sigma"}, description = "Gaussian sigma or waves half period")
        Float sigma;

        @Parameter(names = {"--coefficient"}, description = "Brightness or sepia coefficient")
        Float coefficient;

        @Parameter(names = {"--dx"}, description = "Horizontal shift")
        int deltaX = 0;

        @Parameter(names = {"--dy"}, description = "Vertical shift")
        int deltaY = 0;

        @Parameter(names = {"--cx"}, description = "Rotation center X")
        int centerX = 0;

        @Parameter(names = {"--cy"}, description = "Rotation center Y")
        int centerY = 0;

        @Parameter(names = {"--angle"}, description = "Rotation angle in degrees")
        double angle = 0;

        @Parameter(names = {"--axis"}, description = "Waves axis: X or Y")
        WavesTransform.WavesAxis wavesAxis = WavesTransform.WavesAxis.X;

        @Parameter(names = {"--seed"}, description = "Glass filter seed")
        Long seed;

        ApplyFilterArgs(CommonArgs commonArgs) {
            super(commonArgs);
        }

        Path getInputPath() {
            return Paths.get(inputImage);
        }

        Path getOutputPath() {
            return Paths.get(outputImage);
        }

        @Override
        List<String> validate() {
            List<String> errors = new ArrayList<>();
            if (!FilterFactory.isKnownFilter(filterName)) {
                errors.add("Unknown filter: " + filterName);
            }
            if (radius != null && radius < 0) {
                errors.add("Radius must not be negative: " + radius);
            }
            if (sigma != null && sigma <= 0) {
                errors.add("Sigma must be positive: " + sigma);
            }
            if (StringUtils.equals(filterName, FilterFactory.CONVOLVE) && StringUtils.isBlank(kernelFileName)) {
                errors.add("The " + FilterFactory.CONVOLVE + " filter requires a kernel file");
            }
            return errors;
        }
    }

    private final ApplyFilterArgs args;

    ApplyFilterCmd(String commandName, CommonArgs commonArgs) {
        super(commandName);
        this.args = new ApplyFilterArgs(commonArgs);
    }

    @Override
    ApplyFilterArgs getArgs() {
        return args;
    }

    @Override
    void execute() {
        long startTime = System.currentTimeMillis();
        ImageFilter filter = new FilterFactory(getConfig()).createFilter(args);
        Img<ARGBType> inputImage = ImageReader.readRGBImage(args.getInputPath());
        LOG.info("Read {}x{} image from {}", inputImage.dimension(0), inputImage.dimension(1), args.inputImage);
        checkMemoryUsage();
        Img<ARGBType> outputImage;
        if (CmdUtils.useMultipleThreads(args.commonArgs)) {
            ExecutorService executorService = CmdUtils.createCmdExecutor(args.commonArgs);
            try {
                outputImage = filter.process(inputImage, executorService);
            } finally {
                executorService.shutdown();
            }
        } else {
            outputImage = filter.process(inputImage);
        }
        if (StringUtils.isBlank(args.outputFormat)) {
            ImageWriter.writeRGBImage(outputImage, args.getOutputPath());
        } else {
            ImageWriter.writeRGBImage(outputImage, args.getOutputPath(), args.outputFormat);
        }
        LOG.info("Applied {} filter and wrote the result to {} in {}s - memory usage {}",
                args.filterName, args.outputImage,
                (System.currentTimeMillis() - startTime) / 1000.,
                memoryUsage());
    }
}
