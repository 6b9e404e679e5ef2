package com.forgemind.dispatch.api;

import com.forgemind.core.error.CollaboratorUnavailableException;
import com.forgemind.core.error.ConcurrencyException;
import com.forgemind.core.error.ForgemindException;
import com.forgemind.core.error.InvalidTransitionException;
import com.forgemind.core.error.NotFoundException;
import com.forgemind.core.error.OverfitRejectedException;
import com.forgemind.core.error.PromotionBlockedException;
import com.forgemind.core.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps the Forgemind exception taxonomy to HTTP statuses.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler({ValidationException.class, InvalidTransitionException.class,
            PromotionBlockedException.class, OverfitRejectedException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(ForgemindException e) {
        return respond(HttpStatus.BAD_REQUEST, e);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException e) {
        return respond(HttpStatus.NOT_FOUND, e);
    }

    @ExceptionHandler(ConcurrencyException.class)
    public ResponseEntity<ErrorResponse> handleConflict(ConcurrencyException e) {
        return respond(HttpStatus.CONFLICT, e);
    }

    @ExceptionHandler(CollaboratorUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleUnavailable(CollaboratorUnavailableException e) {
        log.warn("Collaborator {} unavailable: {}", e.getCollaborator(), e.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, e);
    }

    @ExceptionHandler(ForgemindException.class)
    public ResponseEntity<ErrorResponse> handleOther(ForgemindException e) {
        log.error("Unhandled Forgemind error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, e);
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, ForgemindException e) {
        return ResponseEntity.status(status).body(new ErrorResponse(code(e), e.getMessage()));
    }

    /** {@code PromotionBlockedException} becomes {@code promotion_blocked}. */
    static String code(ForgemindException e) {
        String name = e.getClass().getSimpleName().replaceFirst("Exception$", "");
        return name.replaceAll("([a-z])([A-Z])", "$1_$2").toLowerCase();
    }
}
