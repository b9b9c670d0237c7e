package com.hartwig.alignpipe.tool;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Wraps a tool command line in <code>docker run</code>, mounting the work directory of a stage at {@value #MOUNT_POINT}.
 */
public class DockerCommand {
    public static final String MOUNT_POINT = "/data";
    public static final List<String> DEFAULT_RUN_OPTIONS = List.of("--rm", "--log-driver=none");

    private final boolean sudo;

    public DockerCommand(final boolean sudo) {
        this.sudo = sudo;
    }

    public List<String> wrap(String image, Path workDirectory, List<String> arguments) {
        return wrap(image, workDirectory, DEFAULT_RUN_OPTIONS, arguments);
    }

    public List<String> wrap(String image, Path workDirectory, List<String> runOptions, List<String> arguments) {
        var command = docker();
        command.add("run");
        command.addAll(runOptions);
        command.add("-v");
        command.add(workDirectory.toAbsolutePath() + ":" + MOUNT_POINT);
        command.add(image);
        command.addAll(arguments);
        return command;
    }

    /**
     * The docker executable, prefixed with <code>sudo</code> where docker needs it.
     */
    public List<String> docker() {
        var command = new ArrayList<String>();
        if (sudo) {
            command.add("sudo");
        }
        command.add("docker");
        return command;
    }

    /**
     * Path of a host file as seen from inside the container. Files outside the work directory are not mounted and keep
     * their host path.
     */
    public static String containerPath(Path workDirectory, Path hostPath) {
        var root = workDirectory.toAbsolutePath().normalize();
        var absolute = hostPath.toAbsolutePath().normalize();
        if (!absolute.startsWith(root)) {
            return absolute.toString();
        }
        var relative = root.relativize(absolute).toString();
        return relative.isEmpty() ? MOUNT_POINT : MOUNT_POINT + "/" + relative;
    }
}
