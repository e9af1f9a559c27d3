package com.muts.ecu.safety;

public enum BreachLevel
{
    WARNING,
    CRITICAL
}
