package com.williamcallahan.statuteindex.domain.legislation;

import java.util.List;

/**
 * Ordered provisions walked out of one document body, plus any reference conflicts met on the way.
 *
 * @param provisions provisions in document order with unique references
 * @param conflicts references that had to be re-keyed to stay unique
 */
public record ProvisionExtraction(List<ProvisionRecord> provisions, List<ReferenceConflict> conflicts) {

    public ProvisionExtraction {
        provisions = provisions == null ? List.of() : List.copyOf(provisions);
        conflicts = conflicts == null ? List.of() : List.copyOf(conflicts);
    }

    public static ProvisionExtraction empty() {
        return new ProvisionExtraction(List.of(), List.of());
    }

    public boolean hasConflicts() {
        return !conflicts.isEmpty();
    }
}
