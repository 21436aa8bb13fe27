package com.di.logsift.group;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.File;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SliceWorkerLauncher Tests")
class SliceWorkerLauncherTest {

    private final SliceWorkerLauncher launcher = new SliceWorkerLauncher("com.example.Main");

    @Test
    @DisplayName("Should pass the slice and every request option to the worker")
    void testBuildCommand_AllOptions() {
        AggregationRequest request = AggregationRequest.builder()
                .limit(500)
                .batchSize(200)
                .ignoreCheckpoint(true)
                .sessionId("session-1")
                .build();

        List<String> command = launcher.buildCommand(1, 4, request);

        int group = command.indexOf("group");
        assertTrue(group > 0);
        assertEquals(List.of("group", "--slice-id=1", "--slice-max=4", "--limit=500", "--batch-size=200",
                "--ignore-checkpoint", "--session-id=session-1"), command.subList(group, command.size()));
        assertTrue(command.get(0).endsWith("java"));
    }

    @Test
    @DisplayName("Should pass only the slice for a default request")
    void testBuildCommand_Defaults() {
        List<String> command = launcher.buildCommand(0, 2, AggregationRequest.defaults());

        int group = command.indexOf("group");
        assertEquals(List.of("group", "--slice-id=0", "--slice-max=2"), command.subList(group, command.size()));
    }

    @Test
    @DisplayName("Should forward the parent's system properties and property overrides to the worker")
    void testBuildCommand_ForwardsOverrides() {
        List<String> jvmOptions = SliceWorkerLauncher.systemPropertyOptions(List.of(
                "-Xmx2g", "-Dlogsift.store.host=es.internal", "-javaagent:/opt/agent.jar", "-Dfile.encoding=UTF-8"));
        List<String> forwarded = SliceWorkerLauncher.forwardedOptions(List.of(
                "group", "--workers=4", "--logsift.store.port=9201", "--spring.profiles.active=prod", "--ignore-checkpoint"));
        SliceWorkerLauncher forwarding = new SliceWorkerLauncher("com.example.Main", jvmOptions, forwarded);

        List<String> command = forwarding.buildCommand(2, 4, AggregationRequest.defaults());

        assertEquals(List.of("-Dlogsift.store.host=es.internal", "-Dfile.encoding=UTF-8"), command.subList(1, 3));
        int group = command.indexOf("group");
        assertEquals(List.of("group", "--slice-id=2", "--slice-max=4",
                "--logsift.store.port=9201", "--spring.profiles.active=prod"), command.subList(group, command.size()));
        assertFalse(command.contains("--workers=4"));
        assertFalse(command.contains("-Xmx2g"));
    }

    @Test
    @DisplayName("Should recognise a repackaged jar class path")
    void testIsExecutableJar() {
        assertTrue(SliceWorkerLauncher.isExecutableJar("/opt/logsift/logsift.jar"));
        assertFalse(SliceWorkerLauncher.isExecutableJar("/opt/a.jar" + File.pathSeparator + "/opt/b.jar"));
        assertFalse(SliceWorkerLauncher.isExecutableJar("target/classes"));
        assertFalse(SliceWorkerLauncher.isExecutableJar(null));
    }

    @Test
    @DisplayName("Should refuse fewer than two workers")
    void testLaunch_TooFewWorkers() {
        assertThrows(IllegalArgumentException.class, () -> launcher.launch(1, AggregationRequest.defaults()));
    }
}
