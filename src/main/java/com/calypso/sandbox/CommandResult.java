package com.calypso.sandbox;

/**
 * Outcome of one sandboxed command.
 *
 * @param exitCode    process exit code, {@code -1} when the command was killed
 * @param output      merged stdout and stderr
 * @param timedOut    whether the command was killed at its timeout
 * @param outOfMemory whether the runtime killed the command for exceeding its memory limit
 */
public record CommandResult(int exitCode, String output, boolean timedOut, boolean outOfMemory) {

    public static CommandResult completed(int exitCode, String output) {
        return new CommandResult(exitCode, output, false, false);
    }

    public static CommandResult timedOut(String output) {
        return new CommandResult(-1, output, true, false);
    }

    public boolean succeeded() {
        return !timedOut && !outOfMemory && exitCode == 0;
    }
}
