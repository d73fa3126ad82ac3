package com.questrail.flightdeck.api;

/**
 * How a flight reacts when one of its steps finalizes FAILED or ERROR.
 */
public enum FailureResponse
{
    /** Record the failure and keep running the remaining steps. */
    PROCEED,

    /** Record the failure and skip the remaining steps of the flight. */
    CONCLUDE
}
