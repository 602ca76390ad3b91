package com.alibaba.cloud.ai.organizer.cache.policy;

import com.alibaba.cloud.ai.organizer.cache.fingerprint.Fingerprint;
import com.alibaba.cloud.ai.organizer.cache.fingerprint.FingerprintKind;
import com.alibaba.cloud.ai.organizer.cache.store.CacheEntry;
import com.alibaba.cloud.ai.organizer.cache.store.CacheKey;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FingerprintInvalidationPolicyTest {

    private final FingerprintInvalidationPolicy policy = new FingerprintInvalidationPolicy();

    @Test
    void equalFingerprintIsValid() {
        assertThat(policy.isValid(entry(file(10, 100)), file(10, 100))).isTrue();
    }

    @Test
    void anyFieldChangeInvalidates() {
        CacheEntry entry = entry(file(10, 100));

        assertThat(policy.isValid(entry, file(11, 100))).isFalse();
        assertThat(policy.isValid(entry, file(10, 101))).isFalse();
    }

    @Test
    void unavailableSubjectIsNeverValid() {
        assertThat(policy.isValid(entry(file(10, 100)), null)).isFalse();
        assertThat(policy.isValid(null, file(10, 100))).isFalse();
    }

    private static Fingerprint file(long size, long modifiedAt) {
        return Fingerprint.builder()
                .kind(FingerprintKind.FILE)
                .path("/src/a.txt")
                .size(size)
                .modifiedAt(modifiedAt)
                .build();
    }

    private static CacheEntry entry(Fingerprint fingerprint) {
        return CacheEntry.builder()
                .formatVersion(CacheEntry.FORMAT_VERSION)
                .key(CacheKey.item("stage3", "/src/a.txt"))
                .fingerprint(fingerprint)
                .payload(new byte[]{1})
                .build();
    }
}
