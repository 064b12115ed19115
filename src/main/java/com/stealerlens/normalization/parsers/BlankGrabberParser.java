package com.stealerlens.normalization.parsers;

import com.stealerlens.domain.StealerFamily;

/**
 * Parser for Blank Grabber logs (plain {@code systeminfo} output).
 */
public class BlankGrabberParser extends WindowsSysteminfoParser {

    public BlankGrabberParser() {
        super(StealerFamily.BLANK_GRABBER, systeminfoRules(ParserLayout.builder()).build());
    }
}
