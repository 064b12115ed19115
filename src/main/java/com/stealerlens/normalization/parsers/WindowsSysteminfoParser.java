package com.stealerlens.normalization.parsers;

import com.stealerlens.domain.StealerFamily;
import com.stealerlens.normalization.LineGrammar;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.stealerlens.domain.SystemInfoField.*;

/**
 * Base for families that dump the output of the Windows {@code systeminfo} command.
 *
 * Processor and IP address values sit on the line after their header, as "[01]: ...".
 */
public abstract class WindowsSysteminfoParser extends LineScanningParser {

    static final String OS_NAME = "osName";
    static final String OS_VERSION = "osVersion";

    private static final String EXPECT_CPU = "cpu";
    private static final String EXPECT_IP = "ip";

    private static final Pattern FIRST_ENTRY = Pattern.compile("\\[01\\]:\\s*(.+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern FIRST_IP = Pattern.compile("\\[01\\]:\\s*([0-9.]+)");

    protected WindowsSysteminfoParser(StealerFamily family, ParserLayout layout) {
        super(family, layout);
    }

    /**
     * The systeminfo labels, for subclasses to extend.
     */
    protected static ParserLayout.RuleBuilder systeminfoRules(ParserLayout.Builder builder) {
        return builder
            .field(COMPUTER_NAME).startsWith("host name:")
            .capture(OS_NAME).startsWith("os name:")
            .capture(OS_VERSION).startsWith("os version:")
            .field(USERNAME).startsWith("registered owner:").map(LineGrammar::extractUsername)
            .field(RAM).startsWith("total physical memory:");
    }

    @Override
    protected boolean handleLine(ScanLine line, ParseState state) {
        String expected = state.pending();
        if (expected != null) {
            state.clearPending();
            if (EXPECT_CPU.equals(expected) && offerFirstEntry(FIRST_ENTRY, line.text(), state, true)) {
                return true;
            }
            if (EXPECT_IP.equals(expected) && offerFirstEntry(FIRST_IP, line.text(), state, false)) {
                return true;
            }
        }

        if (line.lower().startsWith("processor(s):") && !state.result().has(CPU)) {
            // "Processor(s): 1 Processor(s) Installed." optionally followed by "[01]: ..." on the same line
            if (!offerFirstEntry(FIRST_ENTRY, line.text(), state, true)) {
                state.expect(EXPECT_CPU);
            }
            return true;
        }
        if (line.lower().contains("ip address(es)") && !state.result().has(IP_ADDRESS)) {
            if (!offerFirstEntry(FIRST_IP, line.text(), state, false)) {
                state.expect(EXPECT_IP);
            }
            return true;
        }
        return false;
    }

    @Override
    protected void finish(ParseState state) {
        state.result().offer(OS, LineGrammar.cleanValue(
            LineGrammar.combineOs(state.captured(OS_NAME), state.captured(OS_VERSION))));
    }

    private static boolean offerFirstEntry(Pattern pattern, String text, ParseState state, boolean cpu) {
        Matcher matcher = pattern.matcher(text);
        if (!matcher.find()) {
            return false;
        }
        if (cpu) {
            state.result().offer(CPU, LineGrammar.cleanValue(matcher.group(1)));
        } else {
            state.result().offer(IP_ADDRESS, LineGrammar.cleanValue(LineGrammar.extractIp(matcher.group(1))));
        }
        return true;
    }
}
