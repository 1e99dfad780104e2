package com.williamcallahan.statuteindex.domain.legislation;

import java.util.Objects;

/**
 * Records a provision reference that was derived more than once within one document.
 *
 * @param derivedRef reference the markup produced for both provisions
 * @param assignedRef reference the later provision was stored under
 * @param section section label of the later provision
 */
public record ReferenceConflict(String derivedRef, String assignedRef, String section) {

    public ReferenceConflict {
        Objects.requireNonNull(derivedRef, "derivedRef");
        Objects.requireNonNull(assignedRef, "assignedRef");
        Objects.requireNonNull(section, "section");
    }
}
