package com.whereq.coordinator.exception;

import com.whereq.coordinator.model.QualityLevel;
import lombok.Getter;

/**
 * Exception thrown when the subscription tier does not permit the requested quality or resources
 */
@Getter
public class QuotaExceededException extends CoordinatorException {

    /**
     * Highest quality the tier permits
     */
    private final QualityLevel permittedQuality;

    public QuotaExceededException(String message, QualityLevel permittedQuality) {
        super(message, null, "quota", null);
        this.permittedQuality = permittedQuality;
    }
}
