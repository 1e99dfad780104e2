package com.williamcallahan.statuteindex.domain.legislation;

import java.util.Objects;

/**
 * Provision row as held by the provision store, keyed by document and provision reference.
 *
 * @param documentId owning document identifier
 * @param provision provision content
 */
public record StoredProvision(String documentId, ProvisionRecord provision) {

    public StoredProvision {
        Objects.requireNonNull(documentId, "documentId");
        Objects.requireNonNull(provision, "provision");
    }

    public String provisionRef() {
        return provision.provisionRef();
    }
}
