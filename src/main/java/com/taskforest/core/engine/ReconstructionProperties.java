package com.taskforest.core.engine;

import com.taskforest.core.prefix.PrefixNormalizer;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

@Component
@ConfigurationProperties(prefix = "taskforest.reconstruction")
public class ReconstructionProperties {

    private int maxPrefixLength = PrefixNormalizer.DEFAULT_MAX_LENGTH;
    private List<Integer> fallbackPrefixLengths = new ArrayList<>();
    private long temporalToleranceMs = 1000;
    private boolean strictWorkspaceIsolation = true;
    private String workspaceFilter = "";
    private int extractionParallelism = 4;
    private boolean sanitizeInstructions = true;

    public int getMaxPrefixLength() {
        return maxPrefixLength;
    }

    public void setMaxPrefixLength(int maxPrefixLength) {
        this.maxPrefixLength = maxPrefixLength;
    }

    public List<Integer> getFallbackPrefixLengths() {
        return fallbackPrefixLengths;
    }

    public void setFallbackPrefixLengths(List<Integer> fallbackPrefixLengths) {
        this.fallbackPrefixLengths = fallbackPrefixLengths != null ? new ArrayList<>(fallbackPrefixLengths) : new ArrayList<>();
    }

    public long getTemporalToleranceMs() {
        return temporalToleranceMs;
    }

    public void setTemporalToleranceMs(long temporalToleranceMs) {
        this.temporalToleranceMs = temporalToleranceMs;
    }

    public boolean isStrictWorkspaceIsolation() {
        return strictWorkspaceIsolation;
    }

    public void setStrictWorkspaceIsolation(boolean strictWorkspaceIsolation) {
        this.strictWorkspaceIsolation = strictWorkspaceIsolation;
    }

    public String getWorkspaceFilter() {
        return workspaceFilter;
    }

    public void setWorkspaceFilter(String workspaceFilter) {
        this.workspaceFilter = workspaceFilter;
    }

    public boolean hasWorkspaceFilter() {
        return workspaceFilter != null && !workspaceFilter.isBlank();
    }

    public int getExtractionParallelism() {
        return extractionParallelism;
    }

    public void setExtractionParallelism(int extractionParallelism) {
        this.extractionParallelism = extractionParallelism;
    }

    public boolean isSanitizeInstructions() {
        return sanitizeInstructions;
    }

    public void setSanitizeInstructions(boolean sanitizeInstructions) {
        this.sanitizeInstructions = sanitizeInstructions;
    }

    /**
     * The full length followed by every positive fallback shorter than it,
     * strictly decreasing and without duplicates.
     */
    public List<Integer> effectivePrefixLengths() {
        var lengths = new TreeSet<Integer>((a, b) -> Integer.compare(b, a));
        lengths.add(maxPrefixLength);
        for (Integer length : fallbackPrefixLengths) {
            if (length != null && length > 0 && length < maxPrefixLength) {
                lengths.add(length);
            }
        }
        return List.copyOf(lengths);
    }

    /** Detached copy, so per-invocation overrides never touch the shared bean. */
    public ReconstructionProperties copy() {
        var copy = new ReconstructionProperties();
        copy.setMaxPrefixLength(maxPrefixLength);
        copy.setFallbackPrefixLengths(fallbackPrefixLengths);
        copy.setTemporalToleranceMs(temporalToleranceMs);
        copy.setStrictWorkspaceIsolation(strictWorkspaceIsolation);
        copy.setWorkspaceFilter(workspaceFilter);
        copy.setExtractionParallelism(extractionParallelism);
        copy.setSanitizeInstructions(sanitizeInstructions);
        return copy;
    }
}
