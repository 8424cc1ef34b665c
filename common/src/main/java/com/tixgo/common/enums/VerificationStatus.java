package com.tixgo.common.enums;

public enum VerificationStatus {
    PENDING,     // Awaiting admin review
    APPROVED,    // Visible and bookable
    REJECTED     // Terminal, vendor can no longer modify
}
