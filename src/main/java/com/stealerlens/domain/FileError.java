package com.stealerlens.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A per-file failure recorded in a {@link BatchResult}.
 */
public class FileError {

    @JsonProperty("file_name")
    private final String fileName;

    @JsonProperty("error")
    private final String error;

    public FileError(String fileName, String error) {
        this.fileName = fileName;
        this.error = error;
    }

    public String getFileName() {
        return fileName;
    }

    public String getError() {
        return error;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FileError fileError = (FileError) o;
        return Objects.equals(fileName, fileError.fileName) && Objects.equals(error, fileError.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fileName, error);
    }

    @Override
    public String toString() {
        return fileName + ": " + error;
    }
}
