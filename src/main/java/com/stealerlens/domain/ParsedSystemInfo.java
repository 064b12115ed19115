package com.stealerlens.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Host metadata recovered from one stealer-log system information file.
 *
 * An instance is created empty by the dispatcher, filled by exactly one parser,
 * cleaned once and then sealed before it is handed to storage. Field writes during
 * parsing go through {@link #offer(SystemInfoField, String)}, which never overwrites
 * a field that already holds a value.
 */
public class ParsedSystemInfo {

    public static final String DEFAULT_LOG_TIME = "00:00:00";

    @JsonProperty("stealer_type")
    private String stealerType;

    private final Map<SystemInfoField, String> values = new EnumMap<>(SystemInfoField.class);

    @JsonProperty("log_time")
    private String logTime = DEFAULT_LOG_TIME;

    @JsonIgnore
    private boolean sealed;

    /**
     * Default constructor, tagged as Generic
     */
    public ParsedSystemInfo() {
        this(StealerFamily.GENERIC.getTag());
    }

    public ParsedSystemInfo(String stealerType) {
        this.stealerType = stealerType != null ? stealerType : StealerFamily.GENERIC.getTag();
    }

    /**
     * Assign a field only if it is still empty and the candidate is non-blank.
     *
     * @param field the field to fill
     * @param value an already cleaned candidate value, may be null
     * @return true if the value was stored
     */
    public boolean offer(SystemInfoField field, String value) {
        checkNotSealed();
        if (value == null || value.isBlank() || values.containsKey(field)) {
            return false;
        }
        values.put(field, value);
        return true;
    }

    /**
     * Replace a field unconditionally. Only the cleaning pass uses this.
     */
    public void replace(SystemInfoField field, String value) {
        checkNotSealed();
        if (value == null || value.isBlank()) {
            values.remove(field);
        } else {
            values.put(field, value);
        }
    }

    public String get(SystemInfoField field) {
        return values.get(field);
    }

    public boolean has(SystemInfoField field) {
        return values.containsKey(field);
    }

    /**
     * Freeze the record. Any later mutation throws {@link IllegalStateException}.
     */
    public ParsedSystemInfo seal() {
        this.sealed = true;
        return this;
    }

    @JsonIgnore
    public boolean isSealed() {
        return sealed;
    }

    private void checkNotSealed() {
        if (sealed) {
            throw new IllegalStateException("ParsedSystemInfo is sealed and can no longer be modified");
        }
    }

    // Getters and Setters

    public String getStealerType() {
        return stealerType;
    }

    public void setStealerType(String stealerType) {
        checkNotSealed();
        this.stealerType = stealerType != null ? stealerType : StealerFamily.GENERIC.getTag();
    }

    @JsonProperty("os")
    public String getOs() {
        return values.get(SystemInfoField.OS);
    }

    @JsonProperty("ip_address")
    public String getIpAddress() {
        return values.get(SystemInfoField.IP_ADDRESS);
    }

    @JsonProperty("username")
    public String getUsername() {
        return values.get(SystemInfoField.USERNAME);
    }

    @JsonProperty("cpu")
    public String getCpu() {
        return values.get(SystemInfoField.CPU);
    }

    @JsonProperty("ram")
    public String getRam() {
        return values.get(SystemInfoField.RAM);
    }

    @JsonProperty("computer_name")
    public String getComputerName() {
        return values.get(SystemInfoField.COMPUTER_NAME);
    }

    @JsonProperty("gpu")
    public String getGpu() {
        return values.get(SystemInfoField.GPU);
    }

    @JsonProperty("country")
    public String getCountry() {
        return values.get(SystemInfoField.COUNTRY);
    }

    @JsonProperty("log_date")
    public String getLogDate() {
        return values.get(SystemInfoField.LOG_DATE);
    }

    @JsonProperty("hwid")
    public String getHwid() {
        return values.get(SystemInfoField.HWID);
    }

    @JsonProperty("file_path")
    public String getFilePath() {
        return values.get(SystemInfoField.FILE_PATH);
    }

    @JsonProperty("antivirus")
    public String getAntivirus() {
        return values.get(SystemInfoField.ANTIVIRUS);
    }

    public String getLogTime() {
        return logTime;
    }

    public void setLogTime(String logTime) {
        checkNotSealed();
        this.logTime = logTime != null ? logTime : DEFAULT_LOG_TIME;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ParsedSystemInfo that = (ParsedSystemInfo) o;
        return Objects.equals(stealerType, that.stealerType)
            && Objects.equals(values, that.values)
            && Objects.equals(logTime, that.logTime);
    }

    @Override
    public int hashCode() {
        return Objects.hash(stealerType, values, logTime);
    }

    @Override
    public String toString() {
        return "ParsedSystemInfo{" +
                "stealerType='" + stealerType + '\'' +
                ", values=" + values +
                ", logTime='" + logTime + '\'' +
                '}';
    }
}
