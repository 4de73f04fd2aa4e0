package org.janelia.imagefilters.cmd;

import com.beust.jcommander.Parameter;

class CommonArgs {
    @Parameter(names = {"-h", "--help"}, description = "Display the help message", help = true, arity = 0)
    boolean displayHelpMessage = false;

    @Parameter(names = {"--config"}, description = "Configuration file overriding the default settings")
    String configFileName;

    @Parameter(names = {"--taskConcurrency"},
            description = "Number of worker threads: 1 processes the image on the main thread, 0 uses a work stealing pool")
    int taskConcurrency = 1;
}
