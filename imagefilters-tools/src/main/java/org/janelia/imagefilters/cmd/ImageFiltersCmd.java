package org.janelia.imagefilters.cmd;

import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.List;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line entry point.
 */
public class ImageFiltersCmd {
    private static final Logger LOG = LoggerFactory.getLogger(ImageFiltersCmd.class);

    public static void main(String[] argv) {
        System.exit(run(argv));
    }

    /**
     * @return the process exit code
     */
    static int run(String... argv) {
        CommonArgs commonArgs = new CommonArgs();
        List<AbstractCmd> cmds = Arrays.asList(
                new ApplyFilterCmd("apply", commonArgs),
                new ListFiltersCmd("list", commonArgs)
        );
        JCommander.Builder cmdlineBuilder = JCommander.newBuilder()
                .programName("imagefilters")
                .addObject(commonArgs);
        cmds.forEach(cmd -> cmdlineBuilder.addCommand(cmd.getCommandName(), cmd.getArgs()));
        JCommander cmdline = cmdlineBuilder.build();

        try {
            cmdline.parse(argv);
        } catch (ParameterException e) {
            LOG.error("Invalid arguments: {}", e.getMessage());
            cmdline.usage();
            return 1;
        }
        if (commonArgs.displayHelpMessage) {
            cmdline.usage();
            return 0;
        }
        String parsedCommand = cmdline.getParsedCommand();
        AbstractCmd cmd = cmds.stream()
                .filter(c -> c.matches(parsedCommand))
                .findFirst()
                .orElse(null);
        if (cmd == null) {
            LOG.error("Missing or unsupported command: {}", parsedCommand);
            cmdline.usage();
            return 1;
        }
        List<String> validationErrors = cmd.getArgs().validate();
        if (!validationErrors.isEmpty()) {
            validationErrors.forEach(err -> LOG.error("{}", err));
            cmdline.usage();
            return 1;
        }
        try {
            cmd.execute();
            return 0;
        } catch (IllegalArgumentException | UncheckedIOException e) {
            LOG.error("Command {} failed", cmd.getCommandName(), e);
            return 1;
        }
    }
}
