package com.stealerlens.normalization.parsers;

import com.stealerlens.domain.StealerFamily;
import com.stealerlens.normalization.country.CountryCodeNormalizer;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for system information parsers by stealer family.
 * Every family has a parser; lookups for anything unregistered fall back to the generic parser.
 */
@Component
public class ParserRegistry {

    private final Map<StealerFamily, SystemInfoParser> parsers = new ConcurrentHashMap<>();
    private final SystemInfoParser defaultParser;

    public ParserRegistry(CountryCodeNormalizer countries) {
        for (StealerFamily family : StealerFamily.values()) {
            parsers.put(family, create(family, countries));
        }
        this.defaultParser = parsers.get(StealerFamily.GENERIC);
    }

    private static SystemInfoParser create(StealerFamily family, CountryCodeNormalizer countries) {
        return switch (family) {
            case GENERIC -> new GenericParser(countries);
            case LUMMA -> new LummaParser(countries);
            case EXELA_STEALER -> new ExelaStealerParser(countries);
            case ASTRIS -> new AstrisParser(countries);
            case BLANK_GRABBER -> new BlankGrabberParser();
            case ATOMIC_MAC -> new AtomicMacParser(countries);
            case CRYPTBOT -> new CryptBotParser();
            case DARKCRYSTAL_RAT -> new DarkCrystalRatParser(countries);
            case MEDUZA -> new MeduzaParser(countries);
            case NOXTY -> new NoxtyParser(countries);
            case PHEMEDRONE -> new PhemedroneParser(countries);
            case PREDATOR_THE_THIEF -> new PredatorTheThiefParser();
            case RACCOON -> new RaccoonParser(countries);
            case REDLINE_META -> new RedLineMetaParser(countries);
            case RHADAMANTHYS -> new RhadamanthysParser(countries);
            case RISEPRO -> new RiseProParser(countries);
            case RL_STEALER -> new RlStealerParser();
            case STEALC -> new StealCParser(countries);
            case STEALERIUM -> new StealeriumParser();
            case SKALKA -> new SkalkaParser(countries);
            case VIDAR -> new VidarParser(countries);
            case XFILES -> new XFilesParser(countries);
            case AILUROPHILE -> new AilurophileParser(countries);
            case ARECH_CLIENT_V2 -> new ArechClientV2Parser(countries);
            case BANSHEE -> new BansheeParser(countries);
        };
    }

    /**
     * Gets the parser for the specified family
     *
     * @param family detected family, may be null
     * @return the family's parser, or the generic parser
     */
    public SystemInfoParser getParser(StealerFamily family) {
        if (family == null) {
            return defaultParser;
        }
        return parsers.getOrDefault(family, defaultParser);
    }

    /**
     * Replaces the parser registered for a family
     *
     * @param family the family
     * @param parser the parser implementation
     */
    public void registerParser(StealerFamily family, SystemInfoParser parser) {
        parsers.put(family, parser);
    }
}
