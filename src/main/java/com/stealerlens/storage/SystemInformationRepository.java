package com.stealerlens.storage;

import com.stealerlens.domain.ParsedSystemInfo;

/**
 * Persists normalized system information records.
 */
public interface SystemInformationRepository {

    /**
     * Store one sealed record.
     *
     * @param deviceId       device (log archive) the file belongs to
     * @param info           cleaned, sealed record
     * @param sourceFileName name of the file it was parsed from
     * @throws StorageException if the record cannot be stored
     */
    void saveSystemInformation(String deviceId, ParsedSystemInfo info, String sourceFileName);
}
