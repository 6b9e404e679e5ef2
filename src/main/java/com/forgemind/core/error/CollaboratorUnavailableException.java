package com.forgemind.core.error;

/**
 * Thrown when the language model or the store stays unavailable after all retries.
 * Aborts the current evolution run, which then reports its best-so-far candidate.
 */
public class CollaboratorUnavailableException extends ForgemindException {

    private final String collaborator;

    public CollaboratorUnavailableException(String collaborator, String message, Throwable cause) {
        super(collaborator + " unavailable: " + message, cause);
        this.collaborator = collaborator;
    }

    public String getCollaborator() {
        return collaborator;
    }
}
