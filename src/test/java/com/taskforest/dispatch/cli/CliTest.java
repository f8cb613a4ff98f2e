package com.taskforest.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.taskforest.core.engine.CycleDetectedException;
import com.taskforest.core.engine.ReconstructionOrchestrator;
import com.taskforest.core.engine.ReconstructionProperties;
import com.taskforest.core.events.EventBus;
import com.taskforest.core.metrics.ReconstructionMetrics;
import com.taskforest.storage.json.CorpusLoader;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Tests for the taskforest CLI command structure.
 * These tests exercise picocli directly without Spring context,
 * against a small corpus written to a temporary directory.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    @TempDir
    Path tempDir;

    private Path corpus;
    private EventBus eventBus;
    private final ObjectMapper objectMapper = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    @BeforeEach
    void writeCorpus() throws Exception {
        eventBus = new EventBus();
        corpus = tempDir.resolve("corpus.json");
        Files.writeString(corpus, """
                [
                  {"taskId": "P", "createdAt": "2025-01-01T00:00:00Z", "workspace": "/ws",
                   "instruction": "Plan the release", "childInstructions": ["Write the changelog and tag"]},
                  {"taskId": "C", "createdAt": "2025-01-01T00:01:00Z", "workspace": "/ws",
                   "instruction": "Write the changelog"},
                  {"taskId": "G", "createdAt": "2025-01-01T00:02:00Z", "workspace": "/ws",
                   "instruction": "Proofread", "parentTaskId": "C"},
                  {"taskId": "BROKEN", "instruction": "no timestamp"}
                ]
                """);
    }

    private ReconstructionOrchestrator realOrchestrator() {
        return new ReconstructionOrchestrator(new ReconstructionProperties(), eventBus,
                new ReconstructionMetrics(new SimpleMeterRegistry()));
    }

    private CommandLine.IFactory createFactory(ReconstructionOrchestrator orchestrator) {
        var loader = new CorpusLoader(objectMapper);
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == ReconstructCommand.class) {
                    return (K) new ReconstructCommand(loader, orchestrator, eventBus, objectMapper);
                }
                if (cls == InspectCommand.class) {
                    return (K) new InspectCommand(loader, orchestrator);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(ReconstructionOrchestrator orchestrator, String... args) {
        PrintStream originalOut = System.out;
        var baos = new ByteArrayOutputStream();
        var captureStream = new PrintStream(baos, true);
        try {
            System.setOut(captureStream);
            var cmd = new CommandLine(new TaskforestCommand(), createFactory(orchestrator));
            cmd.setOut(new PrintWriter(captureStream, true));
            int exitCode = cmd.execute(args);
            captureStream.flush();
            return new CliResult(exitCode, baos.toString());
        } finally {
            System.setOut(originalOut);
        }
    }

    private CliResult execute(String... args) {
        return execute(realOrchestrator(), args);
    }

    @Test
    @DisplayName("no subcommand prints usage")
    void usage() {
        var result = execute();
        assertEquals(0, result.exitCode());
        assertTrue(result.output().contains("TASKFOREST"));
        assertTrue(result.output().contains("reconstruct"));
        assertTrue(result.output().contains("inspect"));
    }

    @Nested
    @DisplayName("reconstruct")
    class Reconstruct {

        @Test
        @DisplayName("prints statistics and the malformed record")
        void stats() {
            var result = execute("reconstruct", corpus.toString());
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Reconstruction Stats"));
            assertTrue(result.output().contains("BROKEN"));
            assertTrue(result.output().contains("Declared:    1 edges"));
        }

        @Test
        @DisplayName("--tree prints the forest under its roots")
        void tree() {
            var result = execute("reconstruct", corpus.toString(), "--tree");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("G [declared]"));
            assertTrue(result.output().contains("P [unresolved]"));
        }

        @Test
        @DisplayName("--fallback resolves a shorter shared prefix and --json prints the result")
        void fallbackJson() throws Exception {
            var result = execute("reconstruct", corpus.toString(), "--fallback", "64,19", "--json");
            assertEquals(0, result.exitCode());

            var json = objectMapper.readTree(result.output());
            assertEquals(1, json.get("stats").get("resolvedEdges").asInt());
            assertEquals(1, json.get("stats").get("resolvedByPrefixLength").get("19").asInt());
            var child = findTask(json.get("skeletons"), "C");
            assertEquals("P", child.get("parentTaskId").asText());
            assertEquals("RECONSTRUCTED", child.get("resolution").asText());
            assertEquals(1, json.get("malformedRecords").size());
        }

        @Test
        @DisplayName("--audit prints edge decisions and leaves no subscriber behind")
        void audit() {
            var result = execute("reconstruct", corpus.toString(), "--fallback", "19", "--audit");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("edge.retained G -> C"));
            assertTrue(result.output().contains("edge.resolved C -> P (prefixLength=19)"));
            assertFalse(result.output().contains("run.started"));

            List<String> seen = new ArrayList<>();
            eventBus.subscribeAll(e -> seen.add(e.eventType()));
            var second = execute("reconstruct", corpus.toString());
            assertFalse(second.output().contains("edge.retained G -> C"));
            assertTrue(seen.contains("edge.retained"));
        }

        @Test
        @DisplayName("--fallback lists resolved lengths longest first")
        void resolvedLengthOrder() throws Exception {
            Files.writeString(corpus, """
                    [
                      {"taskId": "P", "createdAt": "2025-01-01T00:00:00Z", "workspace": "/ws",
                       "instruction": "Plan", "childInstructions": ["Write the changelog and tag", "Publish the notes"]},
                      {"taskId": "C", "createdAt": "2025-01-01T00:01:00Z", "workspace": "/ws",
                       "instruction": "Write the changelog"},
                      {"taskId": "N", "createdAt": "2025-01-01T00:02:00Z", "workspace": "/ws",
                       "instruction": "Publish the notes"}
                    ]
                    """);
            var result = execute("reconstruct", corpus.toString(), "--fallback", "19", "--json");
            var byLength = objectMapper.readTree(result.output()).get("stats").get("resolvedByPrefixLength");
            List<String> keys = new ArrayList<>();
            byLength.fieldNames().forEachRemaining(keys::add);
            assertEquals(List.of("192", "19"), keys);
        }

        @Test
        @DisplayName("without fallback the longer declaration does not match")
        void noFallbackJson() throws Exception {
            var result = execute("reconstruct", corpus.toString(), "--json");
            var json = objectMapper.readTree(result.output());
            assertEquals(0, json.get("stats").get("resolvedEdges").asInt());
        }

        @Test
        @DisplayName("--workspace filters out other workspaces")
        void workspaceFilter() throws Exception {
            var result = execute("reconstruct", corpus.toString(), "--workspace", "/elsewhere", "--json");
            var json = objectMapper.readTree(result.output());
            assertEquals(0, json.get("skeletons").size());
            assertEquals(3, json.get("stats").get("filteredOut").asInt());
        }

        @Test
        @DisplayName("an unreadable corpus exits with 1")
        void missingCorpus() {
            var result = execute("reconstruct", tempDir.resolve("missing.json").toString());
            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("Cannot load corpus"));
        }

        @Test
        @DisplayName("a cycle at finalize exits with 2")
        void cycleExit() {
            ReconstructionOrchestrator failing = mock(ReconstructionOrchestrator.class);
            when(failing.getProperties()).thenReturn(new ReconstructionProperties());
            when(failing.run(any(), any())).thenThrow(new CycleDetectedException(List.of("A", "B", "A")));

            var result = execute(failing, "reconstruct", corpus.toString());
            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("A -> B -> A"));
        }

        @Test
        @DisplayName("option overrides do not leak into the shared properties")
        void overridesAreLocal() {
            var orchestrator = realOrchestrator();
            execute(orchestrator, "reconstruct", corpus.toString(), "--tolerance-ms", "5", "--lenient-workspaces");
            assertEquals(1000, orchestrator.getProperties().getTemporalToleranceMs());
            assertTrue(orchestrator.getProperties().isStrictWorkspaceIsolation());
        }
    }

    @Nested
    @DisplayName("inspect")
    class Inspect {

        @Test
        @DisplayName("shows provenance, ancestors and children")
        void inspectTask() {
            var result = execute("inspect", corpus.toString(), "C");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("TASK C"));
            assertTrue(result.output().contains("ANCESTORS"));
            assertTrue(result.output().contains("CHILDREN"));
            assertTrue(result.output().contains("G [declared]"));
        }

        @Test
        @DisplayName("lists the full ancestor chain")
        void ancestorChain() {
            var result = execute("inspect", corpus.toString(), "G");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Declared Parent: C"));
            assertTrue(result.output().contains("Parent:          C"));
        }

        @Test
        @DisplayName("an unknown task exits with 1")
        void unknownTask() {
            var result = execute("inspect", corpus.toString(), "NOPE");
            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("NOPE not found"));
        }
    }

    private static JsonNode findTask(JsonNode skeletons, String id) {
        for (var node : skeletons) {
            if (id.equals(node.get("taskId").asText())) {
                return node;
            }
        }
        fail("task " + id + " not in output");
        return null;
    }
}
