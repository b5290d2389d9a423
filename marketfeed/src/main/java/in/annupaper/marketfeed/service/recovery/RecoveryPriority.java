package in.annupaper.marketfeed.service.recovery;

/**
 * Queue order for recovery jobs. Lower ordinal runs first.
 */
public enum RecoveryPriority {
    HIGH,
    NORMAL,
    LOW
}
