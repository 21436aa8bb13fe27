package com.di.logsift.group;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Runs a sliced grouping as N child JVMs of this application, one per slice. Children share
 * nothing but the store; the parent waits for all of them.
 *
 * <p>Workers get the parent's {@code -D} system properties and its {@code --logsift.*} and
 * {@code --spring.*} command-line overrides, so they talk to the same store with the same settings.
 */
@Slf4j
@Component
public class SliceWorkerLauncher {

    private static final String MAIN_CLASS = "com.di.logsift.LogSiftApplication";
    private static final List<String> FORWARDED_OPTION_PREFIXES = List.of("--logsift.", "--spring.");

    private final String mainClass;
    private final List<String> jvmOptions;
    private final List<String> forwardedOptions;

    public SliceWorkerLauncher() {
        this(MAIN_CLASS);
    }

    @Autowired
    public SliceWorkerLauncher(ApplicationArguments arguments) {
        this(MAIN_CLASS, systemPropertyOptions(ManagementFactory.getRuntimeMXBean().getInputArguments()),
                forwardedOptions(Arrays.asList(arguments.getSourceArgs())));
    }

    SliceWorkerLauncher(String mainClass) {
        this(mainClass, List.of(), List.of());
    }

    SliceWorkerLauncher(String mainClass, List<String> jvmOptions, List<String> forwardedOptions) {
        this.mainClass = mainClass;
        this.jvmOptions = List.copyOf(jvmOptions);
        this.forwardedOptions = List.copyOf(forwardedOptions);
    }

    /** The {@code -Dname=value} options among the parent JVM's input arguments. */
    static List<String> systemPropertyOptions(List<String> jvmArguments) {
        return jvmArguments.stream().filter(argument -> argument.startsWith("-D")).toList();
    }

    /** The parent's {@code --logsift.*} and {@code --spring.*} property overrides. */
    static List<String> forwardedOptions(List<String> sourceArgs) {
        return sourceArgs.stream()
                .filter(argument -> FORWARDED_OPTION_PREFIXES.stream().anyMatch(argument::startsWith))
                .toList();
    }

    /**
     * @return exit code per slice, in slice order
     */
    public List<Integer> launch(int workers, AggregationRequest request) throws IOException, InterruptedException {
        if (workers < 2) {
            throw new IllegalArgumentException("at least 2 workers are needed for a sliced run, got " + workers);
        }
        log.info("[GROUP] launching {} slice worker(s); the checkpoint is not advanced in sliced mode", workers);
        List<Process> processes = new ArrayList<>(workers);
        for (int slice = 0; slice < workers; slice++) {
            ProcessBuilder builder = new ProcessBuilder(buildCommand(slice, workers, request)).inheritIO();
            processes.add(builder.start());
        }

        List<Integer> exitCodes = new ArrayList<>(workers);
        for (int slice = 0; slice < workers; slice++) {
            int exitCode = processes.get(slice).waitFor();
            exitCodes.add(exitCode);
            if (exitCode == 0) {
                log.info("[GROUP] worker {}/{} finished", slice, workers);
            } else {
                log.error("[GROUP] worker {}/{} exited with code {}", slice, workers, exitCode);
            }
        }
        return exitCodes;
    }

    List<String> buildCommand(int sliceId, int sliceMax, AggregationRequest request) {
        List<String> command = new ArrayList<>();
        command.add(Path.of(System.getProperty("java.home"), "bin", "java").toString());
        command.addAll(jvmOptions);
        String classPath = System.getProperty("java.class.path");
        if (isExecutableJar(classPath)) {
            command.add("-jar");
            command.add(classPath);
        } else {
            command.add("-cp");
            command.add(classPath);
            command.add(mainClass);
        }
        command.add("group");
        command.add("--slice-id=" + sliceId);
        command.add("--slice-max=" + sliceMax);
        if (request.getLimit() != null) {
            command.add("--limit=" + request.getLimit());
        }
        if (request.getBatchSize() != null) {
            command.add("--batch-size=" + request.getBatchSize());
        }
        if (request.isIgnoreCheckpoint()) {
            command.add("--ignore-checkpoint");
        }
        if (request.getSessionId() != null) {
            command.add("--session-id=" + request.getSessionId());
        }
        command.addAll(forwardedOptions);
        return command;
    }

    /** Packaged with spring-boot-maven-plugin the class path is the single repackaged jar. */
    static boolean isExecutableJar(String classPath) {
        return classPath != null && classPath.endsWith(".jar") && !classPath.contains(File.pathSeparator);
    }
}
