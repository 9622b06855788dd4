package de.mirkosertic.mediashrink.scanner;

public enum ScanPhase {
    IDLE,
    REMOVING_IGNORED,
    LISTING_FILES,
    CHECKING_METADATA,
    RECONCILING
}
