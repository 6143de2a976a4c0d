package com.bmsedge.envmonitor.exception;

/**
 * An insert was acknowledged but the document could not be read back.
 */
public class VerificationMismatchException extends TelemetryStoreException {

    private final String documentId;

    public VerificationMismatchException(String documentId) {
        super("Inserted document " + documentId + " could not be read back");
        this.documentId = documentId;
    }

    public String getDocumentId() {
        return documentId;
    }
}
