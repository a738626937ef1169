package com.pricelens.engine.error;

/**
 * A lifecycle action was attempted on a record whose status does not allow it.
 * The record is left unchanged.
 */
public class InvalidTransitionException extends PricingException {
    private final String recordType;
    private final String recordId;
    private final String currentStatus;
    private final String action;

    public InvalidTransitionException(String recordType, String recordId, String currentStatus, String action) {
        super(String.format("Cannot %s %s %s while it is %s", action, recordType, recordId, currentStatus));
        this.recordType = recordType;
        this.recordId = recordId;
        this.currentStatus = currentStatus;
        this.action = action;
    }

    public String getRecordType() { return recordType; }
    public String getRecordId() { return recordId; }
    public String getCurrentStatus() { return currentStatus; }
    public String getAction() { return action; }
}
