package com.ottoai.analysis.lock;

/**
 * Proof of holding a {@link JobLock} key. The token is unique per acquisition.
 */
public record LockLease(String key, String token) {}
