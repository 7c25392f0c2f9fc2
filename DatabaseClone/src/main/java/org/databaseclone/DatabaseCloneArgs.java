package org.databaseclone;

import com.beust.jcommander.Parameter;

public class DatabaseCloneArgs {
    @Parameter(names = {"--help", "-h"}, help = true, description = "Displays information about how to use this tool")
    public boolean help;
}
