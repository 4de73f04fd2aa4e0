package org.janelia.imagefilters.cmd;

import com.beust.jcommander.Parameters;

class ListFiltersCmd extends AbstractCmd {

    @Parameters(commandDescription = "List the available filters")
    static class ListFiltersArgs extends AbstractCmdArgs {
        ListFiltersArgs(CommonArgs commonArgs) {
            super(commonArgs);
        }
    }

    private final ListFiltersArgs args;

    ListFiltersCmd(String commandName, CommonArgs commonArgs) {
        super(commandName);
        this.args = new ListFiltersArgs(commonArgs);
    }

    @Override
    ListFiltersArgs getArgs() {
        return args;
    }

    @Override
    void execute() {
        FilterFactory.FILTER_NAMES.forEach(System.out::println);
    }
}
