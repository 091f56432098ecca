package com.queuectl.engine;

import com.queuectl.config.QueueConfig;

import java.io.IOException;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Launches each worker as a fresh JVM running {@code com.queuectl.app.WorkerProcess},
 * with the current classpath, working directory and console.
 */
public class JvmWorkerLauncher implements WorkerLauncher {

    static final String WORKER_MAIN_CLASS = "com.queuectl.app.WorkerProcess";

    private final String javaBinary;
    private final String classPath;

    public JvmWorkerLauncher() {
        this(currentJavaBinary(), System.getProperty("java.class.path"));
    }

    public JvmWorkerLauncher(String javaBinary, String classPath) {
        this.javaBinary = javaBinary;
        this.classPath = classPath;
    }

    @Override
    public Process launch(String workerId) throws IOException {
        return new ProcessBuilder(command(workerId))
                .inheritIO()
                .start();
    }

    List<String> command(String workerId) {
        List<String> command = new ArrayList<>();
        command.add(javaBinary);
        String dbUrl = System.getProperty(QueueConfig.DB_URL_PROPERTY);
        if (dbUrl != null) {
            command.add("-D" + QueueConfig.DB_URL_PROPERTY + "=" + dbUrl);
        }
        String logConfig = System.getProperty("java.util.logging.config.file");
        if (logConfig != null) {
            command.add("-Djava.util.logging.config.file=" + logConfig);
        }
        command.add("-cp");
        command.add(classPath);
        command.add(WORKER_MAIN_CLASS);
        command.add(workerId);
        return command;
    }

    private static String currentJavaBinary() {
        return Paths.get(System.getProperty("java.home"), "bin", "java").toString();
    }
}
