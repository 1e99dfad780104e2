package com.williamcallahan.statuteindex.web;

import com.williamcallahan.statuteindex.domain.legislation.StoredProvision;

/**
 * Flat JSON view of a stored provision.
 */
public record ProvisionView(String documentId, String provisionRef, String section, String title, String content) {

    static ProvisionView from(StoredProvision stored) {
        return new ProvisionView(
                stored.documentId(),
                stored.provisionRef(),
                stored.provision().section(),
                stored.provision().title(),
                stored.provision().content());
    }
}
