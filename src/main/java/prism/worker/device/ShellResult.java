package prism.worker.device;

/**
 * Exit code and captured output of a device command.
 */
public record ShellResult(int exitCode, String output) {

    public boolean succeeded() {
        return exitCode == 0;
    }
}
