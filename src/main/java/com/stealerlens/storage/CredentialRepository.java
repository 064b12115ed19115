package com.stealerlens.storage;

import com.stealerlens.domain.CredentialRecord;

/**
 * Persists extracted credentials. Passwords arrive already escaped.
 */
public interface CredentialRepository {

    /**
     * @throws StorageException if the credential cannot be stored
     */
    void saveCredential(String deviceId, CredentialRecord credential);
}
