package com.stealerlens.normalization.parsers;

import com.stealerlens.domain.ParsedSystemInfo;
import com.stealerlens.domain.StealerFamily;

/**
 * Interface for parsing one stealer family's system information layout.
 * Implementations are stateless and safe to share between threads.
 */
public interface SystemInfoParser {

    /**
     * Parses raw file text into a partially filled system information record
     *
     * @param content  decoded file content
     * @param fileName name of the file inside the log archive
     * @return parsed record, never null
     * @throws ParseException if the content cannot be scanned
     */
    ParsedSystemInfo parse(String content, String fileName) throws ParseException;

    /**
     * Returns the stealer family this parser handles
     */
    StealerFamily getFamily();
}
