package com.pmagents.core.model;

import java.io.Serializable;

/**
 * Result of evaluating one quality gate.
 *
 * @param gateName  gate name
 * @param type      gate type
 * @param passed    whether the gate passed
 * @param blocking  whether the gate was blocking
 * @param observed  observed metric value (NaN when nothing was reported)
 * @param threshold configured threshold
 * @param detail    human-readable explanation
 */
public record GateOutcome(
    String gateName,
    GateType type,
    boolean passed,
    boolean blocking,
    double observed,
    double threshold,
    String detail
) implements Serializable {

    public boolean isWarning() {
        return !passed && !blocking;
    }
}
