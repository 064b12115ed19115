package com.stealerlens.normalization;

import com.stealerlens.domain.StealerFamily;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Detects the stealer family that produced a system information file from text fingerprints.
 *
 * Rules are checked in a fixed order and the first match wins. Fingerprints overlap, so
 * the broad systeminfo-style checks must stay at the end.
 */
@Component
public class SignatureDetector {

    private static final Logger log = LoggerFactory.getLogger(SignatureDetector.class);

    private static final double MIN_PRINTABLE_RATIO = 0.8;

    /**
     * Detect stealer family from file content and name
     */
    public StealerFamily detect(String content, String fileName) {
        if (content == null || isBinary(content)) {
            log.debug("Skipping signature detection for binary content in {}", fileName);
            return StealerFamily.GENERIC;
        }

        String text = content.toLowerCase(Locale.ROOT);
        String name = fileName != null ? fileName.toLowerCase(Locale.ROOT) : "";

        // Lumma
        if (text.contains("lummac2") || text.contains("lid:")) {
            return StealerFamily.LUMMA;
        }

        // ExelaStealer telegram banner
        if (text.contains("t.me/exelastealer")) {
            return StealerFamily.EXELA_STEALER;
        }

        // Astris
        if (text.contains("[general]") && text.contains("build: recaptcha-verify")) {
            return StealerFamily.ASTRIS;
        }

        // Atomic Mac (system_profiler dump)
        if (text.contains("productname:") && text.contains("macos")) {
            return StealerFamily.ATOMIC_MAC;
        }

        // CryptBot
        if (name.contains("_information.txt")
                || containsAll(text, "os:", "local date and time:", "username (computername):")) {
            return StealerFamily.CRYPTBOT;
        }

        // PredatorTheThief
        if (text.contains("predator the thief") || text.contains("predatorthethief")
                || containsAll(text, "predator", "v3.0.0 release")) {
            return StealerFamily.PREDATOR_THE_THIEF;
        }

        // Raccoon
        if (text.contains("build compile date") || text.contains("bot_id:")
                || containsAll(text, "user id:", "last seen:")) {
            return StealerFamily.RACCOON;
        }

        // RedLine / META
        if (text.contains("build id:")
                || containsAll(text, "userinformation.txt", "machinename:", "hardwares:")) {
            return StealerFamily.REDLINE_META;
        }

        // Rhadamanthys
        if (containsAll(text, "install date:", "traffic name:")) {
            return StealerFamily.RHADAMANTHYS;
        }

        // RisePro
        if (containsAll(text, "build:", "machineid:")
                || containsAll(text, "information.txt", "location:", "[hardware]")) {
            return StealerFamily.RISEPRO;
        }

        // StealC
        if (containsAll(text, "network info:", "system summary:")) {
            return StealerFamily.STEALC;
        }

        // Stealerium
        if (containsAll(text, "[ip]", "[machine]")) {
            return StealerFamily.STEALERIUM;
        }

        // Vidar
        if (containsAll(text, "ip:", "version:", "information.txt")
                || containsAll(text, "information.txt", "[hardware]", "videocard:")) {
            return StealerFamily.VIDAR;
        }

        // XFiles
        if (text.contains("operation id:")) {
            return StealerFamily.XFILES;
        }

        // Ailurophile
        if (containsAll(text, "pc type: microsoft windows", "allowed extensions:")) {
            return StealerFamily.AILUROPHILE;
        }

        // ArechClientV2
        if (text.contains("userinformation.txt")
                || containsAll(text, "filelocation:", "current language:", "hardwares:")) {
            return StealerFamily.ARECH_CLIENT_V2;
        }

        // Banshee
        if (containsAll(text, "hwid:", "log date:", "build name:")
                || containsAll(text, "system_information.txt", "operation system:", "macos")) {
            return StealerFamily.BANSHEE;
        }

        // DarkCrystal RAT
        if (containsAll(text, "pc name:", "windows server")) {
            return StealerFamily.DARKCRYSTAL_RAT;
        }

        // Meduza
        if (containsAll(text, "hwid:", "build name:", "userinfo.txt")
                || containsAll(text, "userinfo.txt", "country code:", "execute path:")) {
            return StealerFamily.MEDUZA;
        }

        // Noxty
        if (containsAll(text, "user:", "operating system:", "identification.txt")
                || containsAll(text, "identification.txt", "uptime:", "screenresolution:")) {
            return StealerFamily.NOXTY;
        }

        // Phemedrone
        if (containsAll(text, "geolocation data", "hardware info")) {
            return StealerFamily.PHEMEDRONE;
        }

        // RL Stealer
        if (containsAll(text, "operating system :", "pc user :")) {
            return StealerFamily.RL_STEALER;
        }

        // Skalka
        if (containsAll(text, "operation system:", "current jarfile path:")) {
            return StealerFamily.SKALKA;
        }

        // ExelaStealer, Windows systeminfo layout
        if (containsAll(text, "host name:", "os name:", "os version:")) {
            return StealerFamily.EXELA_STEALER;
        }

        // Blank Grabber, systeminfo layout without the OS lines
        if (containsAll(text, "host name:", "system manufacturer:", "total physical memory:")) {
            return StealerFamily.BLANK_GRABBER;
        }

        return StealerFamily.GENERIC;
    }

    /**
     * True for content with a NUL character or fewer than 80% printable ASCII characters.
     */
    boolean isBinary(String content) {
        if (content.indexOf('\0') >= 0) {
            return true;
        }
        if (content.isEmpty()) {
            return false;
        }
        int printable = 0;
        for (int i = 0; i < content.length(); i++) {
            char c = content.charAt(i);
            if ((c >= 0x20 && c <= 0x7E) || c == '\n' || c == '\r' || c == '\t') {
                printable++;
            }
        }
        return (double) printable / content.length() < MIN_PRINTABLE_RATIO;
    }

    private static boolean containsAll(String text, String... needles) {
        for (String needle : needles) {
            if (!text.contains(needle)) {
                return false;
            }
        }
        return true;
    }
}
