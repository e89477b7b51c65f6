package dev.pairreview.exception;

import java.util.List;

/**
 * A git invocation that exited with an unexpected code, timed out or could not be started.
 */
public class GitCommandException extends RuntimeException {

    private final List<String> command;
    private final int exitCode;
    private final String stderr;

    public GitCommandException(List<String> command, int exitCode, String stderr) {
        super("git %s exited with %d: %s".formatted(String.join(" ", command), exitCode, stderr.strip()));
        this.command = List.copyOf(command);
        this.exitCode = exitCode;
        this.stderr = stderr;
    }

    public GitCommandException(List<String> command, String message, Throwable cause) {
        super("git %s failed: %s".formatted(String.join(" ", command), message), cause);
        this.command = List.copyOf(command);
        this.exitCode = -1;
        this.stderr = "";
    }

    public List<String> getCommand() {
        return command;
    }

    public int getExitCode() {
        return exitCode;
    }

    public String getStderr() {
        return stderr;
    }
}
