package com.questrail.flightdeck.resolve;

import com.questrail.flightdeck.constraint.Requirement;

/**
 * The selected factory's constructor threw or returned {@code null}.
 */
public final class FactoryConstructionException extends ResolutionException
{
    public FactoryConstructionException(Factory<?> factory, Requirement requirement, Throwable cause) {
        super(factory.productType(), requirement,
                "Factory '" + factory.name() + "' failed to construct " + factory.productType().getSimpleName()
                        + " for " + requirement, cause);
    }

    public FactoryConstructionException(Factory<?> factory, Requirement requirement, String reason) {
        super(factory.productType(), requirement,
                "Factory '" + factory.name() + "' failed to construct " + factory.productType().getSimpleName()
                        + " for " + requirement + ": " + reason);
    }
}
