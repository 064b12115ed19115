package com.stealerlens.normalization.parsers;

import com.stealerlens.domain.StealerFamily;
import com.stealerlens.normalization.LineGrammar;

import static com.stealerlens.domain.SystemInfoField.*;

/**
 * Parser for PredatorTheThief logs.
 */
public class PredatorTheThiefParser extends LineScanningParser {

    public PredatorTheThiefParser() {
        super(StealerFamily.PREDATOR_THE_THIEF, ParserLayout.builder()
            .field(USERNAME).startsWith("user name:").map(LineGrammar::extractUsername)
            .field(COMPUTER_NAME).startsWith("machine name:")
            .field(OS).contains("os version:")
            .field(LOG_DATE).contains("launch time:").map(LineGrammar::extractDatePrefix)
            .field(CPU).contains("cpu info:")
            // "8192 MB (6144 MB free)"
            .field(RAM).contains("amount of ram:").map(cutAt("\\s*\\([^)]*\\)$"))
            .field(GPU).contains("gpu info:")
            .field(FILE_PATH).contains("startup folder:")
            .build());
    }
}
