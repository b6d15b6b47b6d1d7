package io.studiograph.core.model;

/**
 * Kind of data an {@link AutomationLane} records.
 */
public enum AutomationType {
    CC,
    PB,
    AT,
    CV,
    NRPN
}
