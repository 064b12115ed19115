package com.stealerlens.storage;

import com.stealerlens.domain.CredentialRecord;
import com.stealerlens.domain.ParsedSystemInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Default in-process store for parsed records, keyed by device.
 *
 * Records are kept in insertion order per device. Safe for concurrent writers.
 */
@Repository
public class InMemoryStealerLogRepository implements SystemInformationRepository, CredentialRepository {

    private static final Logger log = LoggerFactory.getLogger(InMemoryStealerLogRepository.class);

    private final Map<String, List<StoredSystemInformation>> systemInformation = new ConcurrentHashMap<>();
    private final Map<String, List<CredentialRecord>> credentials = new ConcurrentHashMap<>();

    @Override
    public void saveSystemInformation(String deviceId, ParsedSystemInfo info, String sourceFileName) {
        if (deviceId == null || deviceId.isBlank()) {
            throw new StorageException("Device id is required to store system information from " + sourceFileName);
        }
        systemInformation
            .computeIfAbsent(deviceId, id -> Collections.synchronizedList(new ArrayList<>()))
            .add(new StoredSystemInformation(info, sourceFileName));
        log.debug("Stored {} system information from {} for device {}", info.getStealerType(), sourceFileName, deviceId);
    }

    @Override
    public void saveCredential(String deviceId, CredentialRecord credential) {
        if (deviceId == null || deviceId.isBlank()) {
            throw new StorageException("Device id is required to store credential for " + credential.getUrl());
        }
        credentials
            .computeIfAbsent(deviceId, id -> Collections.synchronizedList(new ArrayList<>()))
            .add(credential);
    }

    public List<StoredSystemInformation> findSystemInformation(String deviceId) {
        List<StoredSystemInformation> stored = systemInformation.get(deviceId);
        if (stored == null) {
            return List.of();
        }
        synchronized (stored) {
            return List.copyOf(stored);
        }
    }

    public List<CredentialRecord> findCredentials(String deviceId) {
        List<CredentialRecord> stored = credentials.get(deviceId);
        if (stored == null) {
            return List.of();
        }
        synchronized (stored) {
            return List.copyOf(stored);
        }
    }

    /**
     * A stored record together with the file it came from.
     */
    public static final class StoredSystemInformation {

        private final ParsedSystemInfo info;
        private final String sourceFileName;

        StoredSystemInformation(ParsedSystemInfo info, String sourceFileName) {
            this.info = info;
            this.sourceFileName = sourceFileName;
        }

        public ParsedSystemInfo getInfo() {
            return info;
        }

        public String getSourceFileName() {
            return sourceFileName;
        }
    }
}
