package com.taskforest.dispatch.cli;

import com.taskforest.core.engine.CycleDetectedException;
import com.taskforest.core.engine.ReconstructionOrchestrator;
import com.taskforest.core.model.ReconstructionResult;
import com.taskforest.core.model.Skeleton;
import com.taskforest.core.model.TaskRecord;
import com.taskforest.storage.json.CorpusLoadException;
import com.taskforest.storage.json.CorpusLoader;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: taskforest inspect &lt;corpus&gt; &lt;task-id&gt;
 * <p>
 * Reconstructs the corpus with the configured settings and shows how one task
 * got its parent, the chain of ancestors up to its root, and its direct children.
 */
@Command(name = "inspect", mixinStandardHelpOptions = true, description = "Inspect one task of a reconstructed corpus")
@Component
public class InspectCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Corpus: a JSON array file or a directory of task transcripts")
    private Path corpus;

    @Parameters(index = "1", description = "Task ID")
    private String taskId;

    private final CorpusLoader corpusLoader;
    private final ReconstructionOrchestrator orchestrator;

    public InspectCommand(CorpusLoader corpusLoader, ReconstructionOrchestrator orchestrator) {
        this.corpusLoader = corpusLoader;
        this.orchestrator = orchestrator;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        List<TaskRecord> records;
        try {
            records = corpusLoader.load(corpus);
        } catch (CorpusLoadException e) {
            ConsoleOutput.error("Cannot load corpus: " + e.getMessage());
            return ReconstructCommand.EXIT_LOAD_FAILURE;
        }

        ReconstructionResult result;
        try {
            result = orchestrator.run(records);
        } catch (CycleDetectedException e) {
            ConsoleOutput.error(e.getMessage());
            return ReconstructCommand.EXIT_CYCLE;
        }

        var found = result.find(taskId);
        if (found.isEmpty()) {
            ConsoleOutput.error("Task " + taskId + " not found in " + corpus);
            return ReconstructCommand.EXIT_LOAD_FAILURE;
        }
        Skeleton task = found.get();

        System.out.println();
        System.out.println("TASK " + task.getTaskId());
        System.out.println("──────────────────────────────────");
        System.out.println("  Created:         " + task.getCreatedAt());
        System.out.println("  Last Activity:   " + task.getLastActivity());
        System.out.println("  Workspace:       " + (task.hasWorkspace() ? task.getWorkspace() : "-"));
        System.out.println("  Instruction:     " + (task.getTruncatedInstruction().isEmpty() ? "-" : task.getTruncatedInstruction()));
        System.out.println("  Resolution:      " + task.getResolution());
        System.out.println("  Declared Parent: " + (task.getDeclaredParentId() != null ? task.getDeclaredParentId() : "-"));
        System.out.println("  Parent:          " + (task.hasParent() ? task.getParentTaskId() : "- (root)")
                + (task.getReconstructedParentId() != null
                        ? " via prefix length " + task.getResolvedPrefixLength() : ""));
        System.out.println("  Depth:           " + task.getDepth());
        System.out.println("  Declared Tasks:  " + task.getChildInstructionPrefixes().size());

        System.out.println();
        System.out.println("  ANCESTORS:");
        List<String> chain = ancestors(task, result);
        if (chain.isEmpty()) {
            System.out.println("    none");
        } else {
            System.out.println("    " + String.join(" -> ", chain));
        }

        System.out.println();
        System.out.println("  CHILDREN:");
        var children = result.childrenOf(task.getTaskId());
        if (children.isEmpty()) {
            System.out.println("    none");
        }
        for (Skeleton child : children) {
            ConsoleOutput.treeLine(child, 1);
        }
        return ReconstructCommand.EXIT_OK;
    }

    private static List<String> ancestors(Skeleton task, ReconstructionResult result) {
        var chain = new ArrayList<String>();
        String current = task.getParentTaskId();
        while (current != null) {
            chain.add(current);
            current = result.find(current).map(Skeleton::getParentTaskId).orElse(null);
        }
        return chain;
    }
}
