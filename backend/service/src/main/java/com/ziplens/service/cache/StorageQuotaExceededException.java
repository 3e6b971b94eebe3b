package com.ziplens.service.cache;

public class StorageQuotaExceededException extends RuntimeException {
    private final long quotaBytes;
    private final long requiredBytes;

    public StorageQuotaExceededException(long quotaBytes, long requiredBytes) {
        super("Storage quota of " + quotaBytes + " bytes exceeded (write needs " + requiredBytes + ")");
        this.quotaBytes = quotaBytes;
        this.requiredBytes = requiredBytes;
    }

    public long quotaBytes() {
        return quotaBytes;
    }

    public long requiredBytes() {
        return requiredBytes;
    }
}
