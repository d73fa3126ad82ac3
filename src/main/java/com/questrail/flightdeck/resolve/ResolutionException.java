package com.questrail.flightdeck.resolve;

import com.questrail.flightdeck.constraint.Requirement;

/**
 * Base type for failures to turn a requirement into a concrete binding.
 */
public class ResolutionException extends RuntimeException
{
    private final transient Class<?> productType;
    private final transient Requirement requirement;

    public ResolutionException(Class<?> productType, Requirement requirement, String message) {
        super(message);
        this.productType = productType;
        this.requirement = requirement;
    }

    public ResolutionException(Class<?> productType, Requirement requirement, String message, Throwable cause) {
        super(message, cause);
        this.productType = productType;
        this.requirement = requirement;
    }

    public Class<?> productType() {
        return productType;
    }

    public Requirement requirement() {
        return requirement;
    }
}
