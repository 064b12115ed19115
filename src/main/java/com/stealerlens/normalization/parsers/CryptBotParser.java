package com.stealerlens.normalization.parsers;

import com.stealerlens.domain.StealerFamily;
import com.stealerlens.normalization.LineGrammar;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.stealerlens.domain.SystemInfoField.*;

/**
 * Parser for CryptBot "_Information.txt" files.
 */
public class CryptBotParser extends LineScanningParser {

    // "Bruno (DESKTOP-ET51AJO)"
    private static final Pattern USER_AND_MACHINE = Pattern.compile("^(.+?)\\s*\\((.+?)\\)");

    public CryptBotParser() {
        super(StealerFamily.CRYPTBOT, ParserLayout.builder()
            .field(OS).startsWith("os:")
            .field(LOG_DATE).contains("local date and time:", "local date:", "date and time:")
                .map(LineGrammar::extractDatePrefix)
            .field(CPU).startsWith("cpu:").map(cutAt("\\s*\\["))
            .field(RAM).startsWith("ram:")
            .field(GPU).startsWith("gpu:")
            .build());
    }

    @Override
    protected boolean handleLine(ScanLine line, ParseState state) {
        if (!line.lower().contains("username") || !line.lower().contains("computername")) {
            return false;
        }
        if (state.result().has(USERNAME) || state.result().has(COMPUTER_NAME)) {
            return true;
        }
        String value = LineGrammar.cleanValue(line.value());
        if (value == null) {
            return true;
        }
        Matcher matcher = USER_AND_MACHINE.matcher(value);
        if (matcher.find()) {
            state.result().offer(USERNAME, LineGrammar.cleanValue(LineGrammar.extractUsername(matcher.group(1))));
            state.result().offer(COMPUTER_NAME, LineGrammar.cleanValue(matcher.group(2)));
        } else {
            state.result().offer(USERNAME, LineGrammar.cleanValue(LineGrammar.extractUsername(value)));
        }
        return true;
    }
}
