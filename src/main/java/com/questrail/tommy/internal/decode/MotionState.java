package com.questrail.tommy.internal.decode;

/**
 * Motion literal carried by a zone-state message.
 *
 * <p>{@link #DETECTED} and {@link #HOLDING} mean motion; {@link #CLEAR} and
 * {@link #UNKNOWN} mean no motion.</p>
 */
public enum MotionState {
    DETECTED("detected", true),
    HOLDING("holding", true),
    CLEAR("clear", false),
    UNKNOWN(null, false);

    private final String literal;
    private final boolean motion;

    MotionState(String literal, boolean motion) {
        this.literal = literal;
        this.motion = motion;
    }

    public boolean isMotion() {
        return motion;
    }

    /**
     * Maps a wire literal, case-sensitively. Anything unrecognized, including
     * {@code null}, is {@link #UNKNOWN}.
     */
    public static MotionState fromLiteral(String literal) {
        if (literal != null) {
            for (MotionState s : values()) {
                if (literal.equals(s.literal)) {
                    return s;
                }
            }
        }
        return UNKNOWN;
    }
}
