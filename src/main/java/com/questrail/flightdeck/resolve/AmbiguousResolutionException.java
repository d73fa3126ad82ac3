package com.questrail.flightdeck.resolve;

import com.questrail.flightdeck.constraint.Requirement;

import java.util.List;

/**
 * Two or more matching factories are equally (or incomparably) specific.
 * The resolver never picks one silently.
 */
public final class AmbiguousResolutionException extends ResolutionException
{
    private final transient List<String> competingFactories;

    public AmbiguousResolutionException(Class<?> productType,
                                        Requirement requirement,
                                        List<String> competingFactories)
    {
        super(productType, requirement, "Ambiguous resolution of " + productType.getSimpleName()
                + " for " + requirement + ": equally specific factories " + competingFactories);
        this.competingFactories = List.copyOf(competingFactories);
    }

    /**
     * Names of the factories that tied, in registration order.
     */
    public List<String> competingFactories() {
        return competingFactories;
    }
}
