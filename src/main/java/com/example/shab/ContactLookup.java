package com.example.shab;

import java.util.Optional;

/**
 * Secondary source of office contact details, keyed by registration-office id.
 * Implementations never fail: an unavailable lookup yields an empty result.
 */
@FunctionalInterface
public interface ContactLookup {
    ContactLookup NONE = officeId -> Optional.empty();

    Optional<OfficeContact> lookup(String officeId);
}
