package com.stealerlens.normalization.parsers;

/**
 * How a layout marks the start of a section.
 */
public enum SectionStyle {

    /** No sections, or only label-style headers such as "Network Info:". */
    NONE,

    /** INI headers such as "[Hardware]". */
    INI,

    /** Banner separators such as "----- Hardware Info -----". */
    BANNER
}
