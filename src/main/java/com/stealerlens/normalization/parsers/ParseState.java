package com.stealerlens.normalization.parsers;

import com.stealerlens.domain.ParsedSystemInfo;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-file scan state threaded through {@link LineScanningParser}: the record being
 * filled, the current section, an open list accumulator, and captured intermediate
 * values (such as an OS name waiting for its version).
 *
 * One instance exists per parse call and is never shared.
 */
public final class ParseState {

    private final ParsedSystemInfo result;
    private final String fileName;
    private final Map<String, String> captures = new HashMap<>();
    private final List<String> listItems = new ArrayList<>();

    private String section = "";
    private ListRule openList;
    private String pending;

    ParseState(ParsedSystemInfo result, String fileName) {
        this.result = result;
        this.fileName = fileName;
    }

    public ParsedSystemInfo result() {
        return result;
    }

    public String fileName() {
        return fileName;
    }

    public String section() {
        return section;
    }

    public void enterSection(String section) {
        this.section = section != null ? section : "";
    }

    public boolean inSection(String name) {
        return section.equals(name);
    }

    /**
     * Store an intermediate value under a key; the first value wins.
     */
    public boolean capture(String key, String value) {
        if (value == null || value.isBlank() || captures.containsKey(key)) {
            return false;
        }
        captures.put(key, value);
        return true;
    }

    public String captured(String key) {
        return captures.get(key);
    }

    public boolean hasCaptured(String key) {
        return captures.containsKey(key);
    }

    /**
     * Marker for a value expected on the next line, e.g. after "Processor(s): 1 Processor(s) Installed."
     */
    public void expect(String marker) {
        this.pending = marker;
    }

    public String pending() {
        return pending;
    }

    public void clearPending() {
        this.pending = null;
    }

    ListRule openList() {
        return openList;
    }

    void openList(ListRule rule) {
        this.openList = rule;
        this.listItems.clear();
    }

    void addListItem(String item) {
        listItems.add(item);
    }

    List<String> listItems() {
        return listItems;
    }

    void closeList() {
        this.openList = null;
        this.listItems.clear();
    }
}
