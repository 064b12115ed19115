package com.stealerlens.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed set of stealer families the engine can recognize by text signature.
 * Each family has a stable tag that is persisted alongside parsed records.
 */
public enum StealerFamily {

    GENERIC("Generic"),
    LUMMA("Lumma"),
    EXELA_STEALER("ExelaStealer"),
    ASTRIS("Astris"),
    BLANK_GRABBER("Blank Grabber"),
    ATOMIC_MAC("Atomic Mac"),
    CRYPTBOT("CryptBot"),
    DARKCRYSTAL_RAT("DarkCrystal RAT"),
    MEDUZA("Meduza"),
    NOXTY("Noxty"),
    PHEMEDRONE("Phemedrone"),
    PREDATOR_THE_THIEF("PredatorTheThief"),
    RACCOON("Raccoon"),
    REDLINE_META("RedLine/META"),
    RHADAMANTHYS("Rhadamanthys"),
    RISEPRO("RisePro"),
    RL_STEALER("RL Stealer"),
    STEALC("StealC"),
    STEALERIUM("Stealerium"),
    SKALKA("Skalka"),
    VIDAR("Vidar"),
    XFILES("XFiles"),
    AILUROPHILE("Ailurophile"),
    ARECH_CLIENT_V2("ArechClientV2"),
    BANSHEE("Banshee");

    private final String tag;

    StealerFamily(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }

    /**
     * Resolve a persisted tag back to its family.
     * Unknown or null tags resolve to {@link #GENERIC}.
     */
    public static StealerFamily fromTag(String tag) {
        if (tag == null) {
            return GENERIC;
        }
        for (StealerFamily family : values()) {
            if (family.tag.equalsIgnoreCase(tag.trim())) {
                return family;
            }
        }
        return GENERIC;
    }
}
