package io.vizspec.core.diagnostic;

/** Categories of corrective actions taken while normalizing or compiling a spec. */
public enum WarningKind {
    /** {@code facet} channel dropped because {@code row}/{@code column} are also specified. */
    FACET_CHANNEL_DROPPED("facet-channel-dropped"),
    /** {@code columns} removed from a row/column facet or repeat. */
    COLUMNS_NOT_SUPPORTED_BY_ROW_COL("columns-not-supported-by-row-col"),
    /** Parent encoding channels replaced by a child's. */
    ENCODING_OVERRIDDEN("encoding-overridden"),
    /** Parent projection replaced by a child's. */
    PROJECTION_OVERRIDDEN("projection-overridden"),
    /** A repeat reference with no bound value; the channel is dropped. */
    NO_SUCH_REPEATED_VALUE("no-such-repeated-value"),
    /** A line mark with x2/y2 replaced by a rule mark. */
    LINE_WITH_RANGE("line-with-range"),
    /** {@code scale.rangeStep} moved to a step-based width/height. */
    RANGE_STEP_DEPRECATED("range-step-deprecated"),
    /** Shared axes requested across concatenated views. */
    CONCAT_CANNOT_SHARE_AXIS("concat-cannot-share-axis");

    private final String code;

    WarningKind(String code) {
        this.code = code;
    }

    /** Stable kebab-case identifier used in logs and HTTP responses. */
    public String code() {
        return code;
    }
}
