package com.example.shab;

public enum PublicationType {
    /** Debt-enforcement auction (SB01). The only type that is normalised and stored. */
    AUCTION,
    /** Commercial-register notice (HR01, HR02, ...). */
    OTHER,
    UNKNOWN
}
