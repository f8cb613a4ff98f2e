package com.taskforest.core.engine;

import com.taskforest.core.events.EventBus;
import com.taskforest.core.events.ReconstructionEvent;
import com.taskforest.core.extract.MalformedRecordException;
import com.taskforest.core.extract.SkeletonExtractor;
import com.taskforest.core.logging.MdcContext;
import com.taskforest.core.metrics.ReconstructionMetrics;
import com.taskforest.core.model.MalformedRecord;
import com.taskforest.core.model.ReconstructionResult;
import com.taskforest.core.model.ReconstructionStats;
import com.taskforest.core.model.Resolution;
import com.taskforest.core.model.Skeleton;
import com.taskforest.core.model.TaskRecord;
import com.taskforest.core.prefix.IndexEntry;
import com.taskforest.core.prefix.LayeredPrefixIndex;
import com.taskforest.core.prefix.PrefixNormalizer;
import com.taskforest.core.validation.RejectionReason;
import com.taskforest.core.validation.ValidationEngine;
import com.taskforest.core.validation.ValidationOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Rebuilds the parent/child forest of a task corpus in three ordered phases.
 * <ol>
 *   <li><b>Build</b>: extract a skeleton per record and index every declared sub-task prefix.</li>
 *   <li><b>Re-validate</b>: re-check every parent pointer the raw records declared; clear invalid ones.</li>
 *   <li><b>Resolve</b>: look up each still-parentless skeleton's own instruction in the index,
 *       longest prefix length first, and commit the first admissible owner.</li>
 * </ol>
 * Depth and root status are computed afterwards by {@link ForestFinalizer}.
 * <p>
 * The prefix index keeps one key space per prefix length. It is created per
 * run and cleared when the run ends, so the bean itself holds no state
 * between runs.
 */
@Service
public class ReconstructionOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ReconstructionOrchestrator.class);

    /** Phase 2 and 3 walk skeletons oldest first, ties broken by id, whatever the input order. */
    static final Comparator<Skeleton> CANONICAL_ORDER =
            Comparator.comparing(Skeleton::getCreatedAt).thenComparing(Skeleton::getTaskId);

    private final ReconstructionProperties properties;
    private final EventBus eventBus;
    private final ReconstructionMetrics metrics;

    @Autowired
    public ReconstructionOrchestrator(ReconstructionProperties properties, EventBus eventBus,
                                      ReconstructionMetrics metrics) {
        this.properties = properties;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    ReconstructionOrchestrator(ReconstructionProperties properties) {
        this(properties, new EventBus(), null);
    }

    public ReconstructionProperties getProperties() {
        return properties;
    }

    public ReconstructionResult run(Iterable<? extends TaskRecord> records) {
        return run(records, properties);
    }

    /**
     * Runs all phases with the given settings instead of the bean's own.
     *
     * @throws CycleDetectedException if finalization finds a cycle; no result is produced
     */
    public ReconstructionResult run(Iterable<? extends TaskRecord> records, ReconstructionProperties settings) {
        String runId = "TF-" + UUID.randomUUID().toString().substring(0, 8);
        long startMs = System.currentTimeMillis();
        var run = new Run(runId, settings);

        MdcContext.setRun(runId);
        publish(runId, "run.started", null, Map.of(
                "maxPrefixLength", settings.getMaxPrefixLength(),
                "prefixLengths", run.prefixLengths,
                "temporalToleranceMs", settings.getTemporalToleranceMs(),
                "strictWorkspaceIsolation", settings.isStrictWorkspaceIsolation()));
        log.info("Starting reconstruction run {} (prefix lengths {}, tolerance {}ms, strict workspaces {})",
                runId, run.prefixLengths, settings.getTemporalToleranceMs(), settings.isStrictWorkspaceIsolation());

        try {
            build(run, records);
            revalidateDeclaredEdges(run);
            resolveRemaining(run);

            MdcContext.setPhase(runId, "finalize");
            ForestFinalizer.Summary summary = new ForestFinalizer().finalizeForest(run.skeletons, run.byId);

            long durationMs = System.currentTimeMillis() - startMs;
            ReconstructionStats stats = run.toStats(summary, durationMs);
            if (metrics != null) {
                metrics.recordRunDuration(durationMs, true);
                metrics.recordForestDepth(summary.maxDepth());
            }
            publish(runId, "run.completed", null, Map.of(
                    "skeletons", stats.totalSkeletons(),
                    "resolved", stats.resolvedEdges(),
                    "unresolved", stats.unresolved(),
                    "invalidated", stats.declaredEdgesInvalidated(),
                    "durationMs", durationMs));
            log.info("Run {} completed in {}ms: {} skeletons, {} declared kept, {} invalidated, {} resolved, {} unresolved ({} ambiguous), {} roots, max depth {}",
                    runId, durationMs, stats.totalSkeletons(), stats.declaredEdgesRetained(),
                    stats.declaredEdgesInvalidated(), stats.resolvedEdges(), stats.unresolved(),
                    stats.ambiguous(), stats.rootCount(), stats.maxDepth());

            return new ReconstructionResult(runId, List.copyOf(run.skeletons), stats, List.copyOf(run.malformed));
        } catch (RuntimeException e) {
            long durationMs = System.currentTimeMillis() - startMs;
            if (e instanceof CycleDetectedException) {
                log.error("Run {} aborted: {}", runId, e.getMessage());
            } else {
                log.error("Run {} failed: {}", runId, e.getMessage(), e);
            }
            if (metrics != null) {
                metrics.recordRunDuration(durationMs, false);
            }
            publish(runId, "run.failed", null, Map.of("error", String.valueOf(e.getMessage())));
            throw e;
        } finally {
            run.index.clear();
            MdcContext.clear();
        }
    }

    // -- Phase 1 ---------------------------------------------------------------

    private void build(Run run, Iterable<? extends TaskRecord> records) {
        MdcContext.setPhase(run.runId, "build");
        var input = new ArrayList<TaskRecord>();
        records.forEach(input::add);
        run.totalRecords = input.size();

        var extractor = new SkeletonExtractor(run.settings.getMaxPrefixLength(), run.settings.isSanitizeInstructions());
        List<Extraction> extractions = extractAll(run, extractor, input);

        for (Extraction extraction : extractions) {
            if (extraction.failure() != null) {
                recordMalformed(run, extraction.failure().getRecordId(), extraction.failure().getMessage());
                continue;
            }
            Skeleton skeleton = extraction.skeleton();
            if (run.byId.containsKey(skeleton.getTaskId())) {
                recordMalformed(run, skeleton.getTaskId(), "duplicate task id");
                continue;
            }
            if (run.settings.hasWorkspaceFilter()
                    && !run.settings.getWorkspaceFilter().strip().equals(skeleton.getWorkspace())) {
                run.filteredOut++;
                continue;
            }
            run.skeletons.add(skeleton);
            run.byId.put(skeleton.getTaskId(), skeleton);
        }

        for (Skeleton skeleton : run.skeletons) {
            for (String prefix : skeleton.getChildInstructionPrefixes()) {
                run.index.insert(prefix, skeleton.getTaskId());
            }
        }

        publish(run.runId, "phase.completed", null, Map.of(
                "phase", "build",
                "skeletons", run.skeletons.size(),
                "malformed", run.malformed.size(),
                "indexKeys", run.index.size()));
        log.info("Phase 1: {} record(s), {} skeleton(s), {} malformed, {} filtered out, {} index key(s)",
                run.totalRecords, run.skeletons.size(), run.malformed.size(), run.filteredOut, run.index.size());
    }

    private record Extraction(Skeleton skeleton, MalformedRecordException failure) {}

    private List<Extraction> extractAll(Run run, SkeletonExtractor extractor, List<TaskRecord> input) {
        int parallelism = Math.max(1, run.settings.getExtractionParallelism());
        if (parallelism == 1 || input.size() < 2) {
            return input.stream().map(r -> extractOne(extractor, r)).toList();
        }

        var threadCount = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(parallelism, input.size()), r -> {
            Thread t = new Thread(r, "extract-" + run.runId + "-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        try {
            var futures = new ArrayList<CompletableFuture<Extraction>>(input.size());
            for (TaskRecord record : input) {
                futures.add(CompletableFuture.supplyAsync(() -> {
                    MdcContext.setPhase(run.runId, "build");
                    try {
                        return extractOne(extractor, record);
                    } finally {
                        MdcContext.clear();
                    }
                }, executor));
            }
            var results = new ArrayList<Extraction>(futures.size());
            for (CompletableFuture<Extraction> future : futures) {
                results.add(future.join());
            }
            return results;
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        } finally {
            executor.shutdownNow();
        }
    }

    private static Extraction extractOne(SkeletonExtractor extractor, TaskRecord record) {
        try {
            return new Extraction(extractor.extract(record), null);
        } catch (MalformedRecordException e) {
            return new Extraction(null, e);
        }
    }

    private void recordMalformed(Run run, String recordId, String reason) {
        log.warn("Skipping malformed record {}: {}", recordId != null ? recordId : "<no id>", reason);
        run.malformed.add(new MalformedRecord(recordId, reason));
        if (metrics != null) {
            metrics.recordMalformedRecord();
        }
        var payload = new LinkedHashMap<String, Object>();
        payload.put("reason", reason);
        publish(run.runId, "record.malformed", recordId, payload);
    }

    // -- Phase 2 ---------------------------------------------------------------

    private void revalidateDeclaredEdges(Run run) {
        MdcContext.setPhase(run.runId, "revalidate");
        for (Skeleton child : run.canonical()) {
            if (child.getDeclaredParentId() == null) {
                continue;
            }
            MdcContext.setTask(child.getTaskId());
            run.declaredEdges++;
            String parentId = child.getDeclaredParentId();
            ValidationOutcome outcome = run.validation.revalidateDeclaredEdge(child, run.byId);

            if (outcome.admissible()) {
                run.declaredRetained++;
                claimDeclaredPrefix(run, run.byId.get(parentId), child);
                publish(run.runId, "edge.retained", child.getTaskId(), Map.of("parentId", parentId));
            } else {
                run.declaredInvalidated++;
                run.invalidatedByReason.merge(outcome.reason().code(), 1, Integer::sum);
                if (metrics != null) {
                    metrics.recordInvalidatedEdge(outcome.reason().code());
                }
                publish(run.runId, "edge.invalidated", child.getTaskId(), Map.of(
                        "parentId", parentId,
                        "reason", outcome.reason().code(),
                        "detail", outcome.detail()));
                log.info("Invalidated declared edge {} -> {}: {}", child.getTaskId(), parentId, outcome.detail());
            }
        }
        MdcContext.setTask(null);
        publish(run.runId, "phase.completed", null, Map.of(
                "phase", "revalidate",
                "declared", run.declaredEdges,
                "retained", run.declaredRetained,
                "invalidated", run.declaredInvalidated));
        log.info("Phase 2: {} declared edge(s), {} retained, {} invalidated {}",
                run.declaredEdges, run.declaredRetained, run.declaredInvalidated, run.invalidatedByReason);
    }

    /** A retained declared edge consumes the parent's matching sub-task declaration, if there is one. */
    private void claimDeclaredPrefix(Run run, Skeleton parent, Skeleton child) {
        if (parent == null || child.getTruncatedInstruction().isEmpty()) {
            return;
        }
        for (int length : run.prefixLengths) {
            String childKey = PrefixNormalizer.normalize(child.getTruncatedInstruction(), length);
            for (String declared : parent.getChildInstructionPrefixes()) {
                String claim = claimKey(parent.getTaskId(), declared);
                if (!run.claimed.contains(claim) && PrefixNormalizer.normalize(declared, length).equals(childKey)) {
                    run.claimed.add(claim);
                    return;
                }
            }
        }
    }

    // -- Phase 3 ---------------------------------------------------------------

    private void resolveRemaining(Run run) {
        MdcContext.setPhase(run.runId, "resolve");
        for (Skeleton child : run.canonical()) {
            if (child.hasParent()) {
                continue;
            }
            MdcContext.setTask(child.getTaskId());
            run.phase3Candidates++;
            resolve(run, child);
        }
        MdcContext.setTask(null);
        publish(run.runId, "phase.completed", null, Map.of(
                "phase", "resolve",
                "candidates", run.phase3Candidates,
                "resolved", run.resolved,
                "unresolved", run.unresolved,
                "ambiguous", run.ambiguous));
        log.info("Phase 3: {} parentless skeleton(s), {} resolved, {} unresolved ({} ambiguous)",
                run.phase3Candidates, run.resolved, run.unresolved, run.ambiguous);
    }

    private void resolve(Run run, Skeleton child) {
        if (child.getTruncatedInstruction().isEmpty()) {
            run.unresolved++;
            log.debug("{} has no opening instruction; left as root", child.getTaskId());
            return;
        }

        boolean lastAmbiguous = false;
        for (LayeredPrefixIndex.Match match : run.index.matchesDecreasing(child.getTruncatedInstruction())) {
            int length = match.prefixLength();

            // first unclaimed declaration per owner
            var byOwner = new LinkedHashMap<String, IndexEntry>();
            for (IndexEntry entry : match.entries()) {
                String owner = entry.ownerTaskId();
                if (owner.equals(child.getTaskId()) || !run.byId.containsKey(owner)
                        || run.claimed.contains(claimKey(owner, entry.declaredPrefix()))) {
                    continue;
                }
                byOwner.putIfAbsent(owner, entry);
            }
            if (byOwner.isEmpty()) {
                lastAmbiguous = false;
                log.debug("{}: every match at length {} is self, unknown or already claimed", child.getTaskId(), length);
                continue;
            }

            var candidates = byOwner.keySet().stream().map(run.byId::get).toList();
            ParentCandidateSelector.Selection selection = run.selector.select(child, candidates);
            if (selection.winner() == null) {
                lastAmbiguous = selection.ambiguous();
                publish(run.runId, "match.ambiguous", child.getTaskId(), Map.of(
                        "prefixLength", length,
                        "candidates", List.copyOf(byOwner.keySet())));
                log.debug("{}: {} candidates at length {} and no single winner", child.getTaskId(),
                        candidates.size(), length);
                continue;
            }

            Skeleton parent = selection.winner();
            ValidationOutcome outcome = run.validation.validate(parent, child, run.byId);
            if (!outcome.admissible()) {
                lastAmbiguous = false;
                publish(run.runId, "match.rejected", child.getTaskId(), Map.of(
                        "parentId", parent.getTaskId(),
                        "prefixLength", length,
                        "reason", outcome.reason().code(),
                        "detail", outcome.detail()));
                continue;
            }

            commit(run, child, parent, byOwner.get(parent.getTaskId()), length);
            return;
        }

        run.unresolved++;
        if (lastAmbiguous) {
            run.ambiguous++;
            child.setResolution(Resolution.AMBIGUOUS);
        } else if (child.getResolution() != Resolution.INVALIDATED) {
            child.setResolution(Resolution.UNRESOLVED);
        }
        if (metrics != null) {
            metrics.recordUnresolved(lastAmbiguous ? "ambiguous" : "unresolved");
        }
        publish(run.runId, "skeleton.unresolved", child.getTaskId(),
                Map.of("outcome", child.getResolution().name()));
    }

    private void commit(Run run, Skeleton child, Skeleton parent, IndexEntry entry, int length) {
        child.setReconstructedParentId(parent.getTaskId());
        child.setParentTaskId(parent.getTaskId());
        child.setResolution(Resolution.RECONSTRUCTED);
        child.setResolvedPrefixLength(length);
        run.claimed.add(claimKey(entry.ownerTaskId(), entry.declaredPrefix()));
        run.resolved++;
        run.resolvedByLength.merge(length, 1, Integer::sum);
        if (metrics != null) {
            metrics.recordResolvedEdge(length);
        }
        publish(run.runId, "edge.resolved", child.getTaskId(), Map.of(
                "parentId", parent.getTaskId(),
                "prefixLength", length));
        log.debug("Resolved {} -> {} at prefix length {}", child.getTaskId(), parent.getTaskId(), length);
    }

    private static String claimKey(String ownerId, String declaredPrefix) {
        return ownerId + '\u0000' + declaredPrefix;
    }

    private void publish(String runId, String type, String taskId, Map<String, Object> payload) {
        eventBus.publish(ReconstructionEvent.of(type, runId, taskId, payload));
    }

    /** Mutable state of one run; never escapes {@link #run}. */
    private static final class Run {
        final String runId;
        final ReconstructionProperties settings;
        final List<Integer> prefixLengths;
        final ValidationEngine validation;
        final ParentCandidateSelector selector;
        final LayeredPrefixIndex index;
        final List<Skeleton> skeletons = new ArrayList<>();
        final Map<String, Skeleton> byId = new LinkedHashMap<>();
        final List<MalformedRecord> malformed = new ArrayList<>();
        final Set<String> claimed = new HashSet<>();
        final Map<String, Integer> invalidatedByReason = new TreeMap<>();
        final Map<Integer, Integer> resolvedByLength = new TreeMap<>(Comparator.reverseOrder());

        int totalRecords;
        int filteredOut;
        int declaredEdges;
        int declaredRetained;
        int declaredInvalidated;
        int phase3Candidates;
        int resolved;
        int unresolved;
        int ambiguous;

        Run(String runId, ReconstructionProperties settings) {
            this.runId = runId;
            this.settings = settings;
            this.prefixLengths = settings.effectivePrefixLengths();
            this.index = new LayeredPrefixIndex(prefixLengths);
            this.validation = new ValidationEngine(settings);
            this.selector = new ParentCandidateSelector(validation);
        }

        List<Skeleton> canonical() {
            var ordered = new ArrayList<>(skeletons);
            ordered.sort(CANONICAL_ORDER);
            return ordered;
        }

        ReconstructionStats toStats(ForestFinalizer.Summary summary, long durationMs) {
            return new ReconstructionStats(
                    totalRecords,
                    malformed.size(),
                    skeletons.size(),
                    filteredOut,
                    index.size(),
                    declaredEdges,
                    declaredRetained,
                    declaredInvalidated,
                    sortedCopy(invalidatedByReason, Comparator.naturalOrder()),
                    phase3Candidates,
                    resolved,
                    unresolved,
                    ambiguous,
                    sortedCopy(resolvedByLength, Comparator.reverseOrder()),
                    summary.rootCount(),
                    summary.maxDepth(),
                    durationMs);
        }

        private static <K, V> Map<K, V> sortedCopy(Map<K, V> source, Comparator<? super K> order) {
            var copy = new TreeMap<K, V>(order);
            copy.putAll(source);
            return Collections.unmodifiableMap(copy);
        }
    }
}
