package com.ficshelf.models;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Summary of a bulk insertion into a target list.
 */
public class BulkAddResult {

    private final List<String> added = new ArrayList<>();
    private final List<String> invalid = new ArrayList<>();
    private int alreadyPresent;
    private int comparisons;

    public void recordAdded(String url) {
        added.add(url);
    }

    public void recordInvalid(String reference) {
        invalid.add(reference);
    }

    public void recordAlreadyPresent() {
        alreadyPresent++;
    }

    public void recordComparison() {
        comparisons++;
    }

    public List<String> getAdded() {
        return Collections.unmodifiableList(added);
    }

    public List<String> getInvalid() {
        return Collections.unmodifiableList(invalid);
    }

    public int getAlreadyPresent() {
        return alreadyPresent;
    }

    /**
     * Number of candidate-versus-existing comparisons the merge made.
     */
    public int getComparisons() {
        return comparisons;
    }

    @Override
    public String toString() {
        return "BulkAddResult{" +
            "added=" + added.size() +
            ", alreadyPresent=" + alreadyPresent +
            ", invalid=" + invalid.size() +
            ", comparisons=" + comparisons +
            '}';
    }
}
