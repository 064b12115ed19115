package com.stealerlens.domain;

/**
 * Optional string fields of a {@link ParsedSystemInfo} that extractors may fill.
 */
public enum SystemInfoField {
    OS,
    IP_ADDRESS,
    USERNAME,
    CPU,
    RAM,
    COMPUTER_NAME,
    GPU,
    COUNTRY,
    LOG_DATE,
    HWID,
    FILE_PATH,
    ANTIVIRUS
}
