package org.janelia.imagefilters.cmd;

import org.apache.commons.lang3.StringUtils;
import org.janelia.imagefilters.config.Config;
import org.janelia.imagefilters.config.ConfigProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

abstract class AbstractCmd {
    private static final Logger LOG = LoggerFactory.getLogger(AbstractCmd.class);
    private static final long ONE_MB = 1024 * 1024;
    private static final int DEFAULT_LOW_MEMORY_PERC = 20;

    private final String commandName;
    private Config config;

    AbstractCmd(String commandName) {
        this.commandName = commandName;
    }

    public String getCommandName() {
        return commandName;
    }

    boolean matches(String name) {
        return StringUtils.isNotBlank(name) && StringUtils.equals(commandName, name);
    }

    abstract AbstractCmdArgs getArgs();

    abstract void execute();

    /**
     * The default settings overridden by the file passed with --config, if any.
     */
    Config getConfig() {
        if (config == null) {
            config = ConfigProvider.getInstance()
                    .fromDefaultResources()
                    .fromFile(getArgs().getConfigFileName())
                    .get();
        }
        return config;
    }

    /**
     * Warn and request a GC when the free heap drops below the configured percentage.
     */
    void checkMemoryUsage() {
        Runtime runtime = Runtime.getRuntime();
        int lowMemoryPerc = getConfig().getIntegerPropertyValue("Memory.LowPercThreshold", DEFAULT_LOW_MEMORY_PERC);
        long freeMemory = runtime.freeMemory();
        if (freeMemory < runtime.maxMemory() / 100 * lowMemoryPerc) {
            LOG.warn("Free memory {}M is below {}% of the {}M heap",
                    freeMemory / ONE_MB, lowMemoryPerc, runtime.maxMemory() / ONE_MB);
            System.gc();
        }
    }

    String memoryUsage() {
        Runtime runtime = Runtime.getRuntime();
        long usedMB = (runtime.totalMemory() - runtime.freeMemory()) / ONE_MB + 1;
        return usedMB + "M out of " + runtime.maxMemory() / ONE_MB + "M";
    }
}
