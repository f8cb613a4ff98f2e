package com.taskforest.dispatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskforest.core.engine.CycleDetectedException;
import com.taskforest.core.engine.ReconstructionOrchestrator;
import com.taskforest.core.engine.ReconstructionProperties;
import com.taskforest.core.events.EventBus;
import com.taskforest.core.model.MalformedRecord;
import com.taskforest.core.model.ReconstructionResult;
import com.taskforest.core.model.Skeleton;
import com.taskforest.core.model.TaskRecord;
import com.taskforest.storage.json.CorpusLoadException;
import com.taskforest.storage.json.CorpusLoader;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: taskforest reconstruct &lt;corpus&gt;
 * <p>
 * Loads a corpus, runs the three reconstruction phases and prints the run
 * statistics. {@code --tree} adds an indented view of the forest,
 * {@code --audit} prints each edge decision as it is made and
 * {@code --json} replaces all output with the full result as JSON.
 */
@Command(name = "reconstruct", mixinStandardHelpOptions = true, description = "Reconstruct the task forest of a corpus")
@Component
public class ReconstructCommand implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_LOAD_FAILURE = 1;
    static final int EXIT_CYCLE = 2;

    static final List<String> AUDITED_EVENTS = List.of("edge.*", "match.*", "skeleton.unresolved");

    @Parameters(index = "0", description = "Corpus: a JSON array file or a directory of task transcripts")
    private Path corpus;

    @Option(names = "--max-prefix", description = "Full prefix length (default: configured value)")
    private Integer maxPrefix;

    @Option(names = "--fallback", split = ",", description = "Shorter prefix lengths to retry, e.g. 128,64")
    private List<Integer> fallback;

    @Option(names = "--tolerance-ms", description = "Clock-skew tolerance for the temporal check")
    private Long toleranceMs;

    @Option(names = "--lenient-workspaces", description = "Admit cross-workspace edges with a warning")
    private boolean lenientWorkspaces;

    @Option(names = "--workspace", description = "Only reconstruct tasks of this workspace")
    private String workspace;

    @Option(names = "--json", description = "Print the full result as JSON")
    private boolean json;

    @Option(names = "--tree", description = "Print the reconstructed forest")
    private boolean tree;

    @Option(names = "--audit", description = "Print every edge decision while the run executes")
    private boolean audit;

    private final CorpusLoader corpusLoader;
    private final ReconstructionOrchestrator orchestrator;
    private final EventBus eventBus;
    private final ObjectMapper objectMapper;

    public ReconstructCommand(CorpusLoader corpusLoader, ReconstructionOrchestrator orchestrator,
                              EventBus eventBus, ObjectMapper objectMapper) {
        this.corpusLoader = corpusLoader;
        this.orchestrator = orchestrator;
        this.eventBus = eventBus;
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() {
        if (!json) {
            ConsoleOutput.printBanner();
        }

        List<TaskRecord> records;
        try {
            records = corpusLoader.load(corpus);
        } catch (CorpusLoadException e) {
            ConsoleOutput.error("Cannot load corpus: " + e.getMessage());
            return EXIT_LOAD_FAILURE;
        }

        ReconstructionResult result;
        EventBus.Subscription auditTrail = audit && !json
                ? eventBus.subscribeTypes(AUDITED_EVENTS, ConsoleOutput::auditLine)
                : null;
        try {
            result = orchestrator.run(records, settings());
        } catch (CycleDetectedException e) {
            ConsoleOutput.error(e.getMessage());
            return EXIT_CYCLE;
        } finally {
            if (auditTrail != null) {
                auditTrail.unsubscribe();
            }
        }

        if (json) {
            try {
                System.out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(result));
            } catch (JsonProcessingException e) {
                ConsoleOutput.error("Cannot serialize result: " + e.getOriginalMessage());
                return EXIT_LOAD_FAILURE;
            }
            return EXIT_OK;
        }

        ConsoleOutput.success("Run " + result.runId() + " reconstructed " + result.skeletons().size() + " task(s)");
        for (MalformedRecord malformed : result.malformedRecords()) {
            ConsoleOutput.malformed(malformed.recordId(), malformed.reason());
        }
        if (tree) {
            System.out.println();
            printForest(result);
        }
        ConsoleOutput.stats(result.stats());
        return EXIT_OK;
    }

    ReconstructionProperties settings() {
        ReconstructionProperties settings = orchestrator.getProperties().copy();
        if (maxPrefix != null) {
            settings.setMaxPrefixLength(maxPrefix);
        }
        if (fallback != null) {
            settings.setFallbackPrefixLengths(fallback);
        }
        if (toleranceMs != null) {
            settings.setTemporalToleranceMs(toleranceMs);
        }
        if (lenientWorkspaces) {
            settings.setStrictWorkspaceIsolation(false);
        }
        if (workspace != null) {
            settings.setWorkspaceFilter(workspace);
        }
        return settings;
    }

    private static void printForest(ReconstructionResult result) {
        Map<String, List<Skeleton>> children = new LinkedHashMap<>();
        for (Skeleton s : result.skeletons()) {
            if (s.hasParent()) {
                children.computeIfAbsent(s.getParentTaskId(), k -> new ArrayList<>()).add(s);
            }
        }
        for (Skeleton root : result.roots()) {
            printSubtree(root, 0, children);
        }
    }

    private static void printSubtree(Skeleton node, int indent, Map<String, List<Skeleton>> children) {
        ConsoleOutput.treeLine(node, indent);
        for (Skeleton child : children.getOrDefault(node.getTaskId(), List.of())) {
            printSubtree(child, indent + 1, children);
        }
    }
}
