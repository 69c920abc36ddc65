package com.tdengine.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Fixed slices of a position, each with its own exit trigger.
 *
 * <ul>
 *   <li>FIRST -- 30%, de-risk on weakness right after entry</li>
 *   <li>SECOND -- 45%, structural exit on support breaches</li>
 *   <li>THIRD -- 25%, runner held until exhaustion or a time stop</li>
 * </ul>
 */
@Getter
@RequiredArgsConstructor
public enum Tranche {
    FIRST(0.30),
    SECOND(0.45),
    THIRD(0.25);

    private final double fraction;
}
