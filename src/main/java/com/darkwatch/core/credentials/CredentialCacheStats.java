package com.darkwatch.core.credentials;

public record CredentialCacheStats(int totalCached, int validEntries, int expiredEntries) {}
