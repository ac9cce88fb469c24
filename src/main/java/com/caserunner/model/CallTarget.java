package com.caserunner.model;

import java.nio.file.Path;

/**
 * A call target resolved by the {@link com.caserunner.core.Environment}: the
 * command line to hand to the shell and the directory to run it in.
 *
 * A null working directory means the current directory of the JVM.
 */
public class CallTarget {

    private final String commandLine;
    private final Path   workingDirectory;

    public CallTarget(String commandLine, Path workingDirectory) {
        this.commandLine      = commandLine;
        this.workingDirectory = workingDirectory;
    }

    public CallTarget(String commandLine) {
        this(commandLine, null);
    }

    public String getCommandLine()    { return commandLine; }
    public Path   getWorkingDirectory() { return workingDirectory; }

    @Override
    public String toString() {
        return workingDirectory != null
            ? String.format("CallTarget{command='%s', dir=%s}", commandLine, workingDirectory)
            : String.format("CallTarget{command='%s'}", commandLine);
    }
}
