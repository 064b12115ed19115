package com.stealerlens.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A text file extracted from a stealer log archive, already loaded into memory.
 */
public class RawFile {

    @JsonProperty("file_name")
    private final String fileName;

    @JsonProperty("content")
    private final String content;

    public RawFile(String fileName, String content) {
        this.fileName = Objects.requireNonNull(fileName, "fileName");
        this.content = content != null ? content : "";
    }

    public String getFileName() {
        return fileName;
    }

    public String getContent() {
        return content;
    }

    @Override
    public String toString() {
        return "RawFile{fileName='" + fileName + "', length=" + content.length() + '}';
    }
}
