package com.flamingo.ai.corpusindex.exception;

/** Exception thrown when a document referenced by a claim or assignment does not exist. */
public class DocumentNotFoundException extends RuntimeException {

  private final String documentId;

  public DocumentNotFoundException(String documentId) {
    super("Document not found: " + documentId);
    this.documentId = documentId;
  }

  public String getDocumentId() {
    return documentId;
  }
}
