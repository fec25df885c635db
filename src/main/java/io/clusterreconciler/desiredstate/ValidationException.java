package io.clusterreconciler.desiredstate;

import io.clusterreconciler.ReconcilerException;
import io.clusterreconciler.enums.ErrorKind;
import lombok.Getter;

import java.util.List;

/**
 * Thrown when the desired state document is unreadable or invalid.
 * Carries every violation found, not just the first.
 */
@Getter
public class ValidationException extends ReconcilerException {
    
    private final List<ValidationViolation> violations;
    
    public ValidationException(List<ValidationViolation> violations) {
        super(ErrorKind.VALIDATION, "Desired state has " + violations.size() + " violation(s)");
        this.violations = List.copyOf(violations);
    }
    
    public ValidationException(String message, Throwable cause) {
        super(ErrorKind.VALIDATION, message, cause);
        this.violations = List.of(new ValidationViolation(null, ValidationViolation.Type.UNREADABLE_DOCUMENT, message));
    }
}
