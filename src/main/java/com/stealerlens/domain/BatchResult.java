package com.stealerlens.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Running outcome of one batch of system information files.
 * Not thread-safe: parallel workers produce their own outcomes which are merged
 * into a single instance on the calling thread.
 */
public class BatchResult {

    @JsonProperty("success")
    private int success;

    @JsonProperty("failed")
    private int failed;

    @JsonProperty("errors")
    private final List<FileError> errors = new ArrayList<>();

    public void recordSuccess() {
        success++;
    }

    public void recordFailure(String fileName, String error) {
        failed++;
        errors.add(new FileError(fileName, error));
    }

    /**
     * Fold another result into this one, keeping error order.
     */
    public void merge(BatchResult other) {
        this.success += other.success;
        this.failed += other.failed;
        this.errors.addAll(other.errors);
    }

    public int getSuccess() {
        return success;
    }

    public int getFailed() {
        return failed;
    }

    public List<FileError> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    @Override
    public String toString() {
        return "BatchResult{success=" + success + ", failed=" + failed + ", errors=" + errors + '}';
    }
}
