package org.janelia.imagefilters.cmd;

import java.util.Collections;
import java.util.List;

class AbstractCmdArgs {
    final CommonArgs commonArgs;

    AbstractCmdArgs(CommonArgs commonArgs) {
        this.commonArgs = commonArgs;
    }

    String getConfigFileName() {
        return commonArgs.configFileName;
    }

    List<String> validate() {
        return Collections.emptyList();
    }
}
