package io.github.drompincen.cronsync.runtime.editor;

/**
 * Editor input cannot be turned into a valid job body. Raised before anything is sent.
 */
public class JobValidationException extends RuntimeException {

    public JobValidationException(String message) {
        super(message);
    }
}
