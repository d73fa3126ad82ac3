package com.questrail.flightdeck.plan;

/**
 * Definition of something that sits directly under a suite.
 */
public sealed interface MemberDefinition permits SuiteDefinition, CaseDefinition
{
    String name();
}
