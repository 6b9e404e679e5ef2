package com.forgemind.dispatch.cli;

import com.forgemind.core.error.ForgemindException;
import picocli.CommandLine;
import picocli.CommandLine.IExecutionExceptionHandler;
import picocli.CommandLine.ParseResult;

/**
 * Prints Forgemind errors in red instead of a stack trace. Other exceptions propagate.
 */
public class ConsoleExceptionHandler implements IExecutionExceptionHandler {

    @Override
    public int handleExecutionException(Exception ex, CommandLine commandLine, ParseResult parseResult)
            throws Exception {
        if (ex instanceof ForgemindException) {
            ConsoleOutput.error(ex.getMessage());
            return 1;
        }
        throw ex;
    }
}
