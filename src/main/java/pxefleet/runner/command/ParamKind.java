package pxefleet.runner.command;

/**
 * What a command accepts after its {@code ':'} separator.
 */
public enum ParamKind {
    /** Bare token, a parameter is a syntax error */
    NONE,
    /** Positive integer, may be omitted */
    OPTIONAL_INDEX,
    /** Positive integer, must be present */
    REQUIRED_INDEX,
    /** One of {@link CacheDownloadType}, may be omitted */
    OPTIONAL_DOWNLOAD_TYPE
}
