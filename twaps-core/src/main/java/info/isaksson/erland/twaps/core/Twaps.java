package info.isaksson.erland.twaps.core;

/** Framework-wide constants. */
public final class Twaps {

    /** The current version of the framework. */
    public static final String VERSION = "0.1.0";

    private Twaps() {}
}
