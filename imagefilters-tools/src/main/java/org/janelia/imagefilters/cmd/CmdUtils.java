package org.janelia.imagefilters.cmd;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class CmdUtils {
    private static final Logger LOG = LoggerFactory.getLogger(CmdUtils.class);

    /**
     * A concurrency of 1 keeps the filtering on the calling thread.
     */
    static boolean useMultipleThreads(CommonArgs args) {
        return args.taskConcurrency != 1;
    }

    /**
     * @return a fixed pool for a positive concurrency, otherwise a work stealing pool sized to the processors
     */
    static ExecutorService createCmdExecutor(CommonArgs args) {
        int nProcessors = Runtime.getRuntime().availableProcessors();
        if (args.taskConcurrency > 0) {
            LOG.info("Filter rows using {} worker threads", args.taskConcurrency);
            return Executors.newFixedThreadPool(
                    args.taskConcurrency,
                    new ThreadFactoryBuilder()
                            .setNameFormat("FILTER-ROWS-%d")
                            .setDaemon(true)
                            .build());
        }
        int parallelism = Math.max(1, nProcessors - 1);
        LOG.info("Filter rows using a work stealing pool of {} threads", parallelism);
        return Executors.newWorkStealingPool(parallelism);
    }
}
