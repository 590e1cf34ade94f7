package org.chasm.cli.output;

/**
 * The file formats a compiled program can be written in.
 */
public enum OutputFormat {
    /** The raw big-endian word image, loadable at the program base address. */
    BINARY,
    /** One four-digit upper-case hex word per line. */
    HEX,
    /** The complete artifact including symbols and config values, pretty-printed. */
    JSON
}
