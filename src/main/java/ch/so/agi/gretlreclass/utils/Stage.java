package ch.so.agi.gretlreclass.utils;

/**
 * Phase of a reclassification in which a failure occurred.
 */
public enum Stage {
    DETECT,
    ENUMERATE,
    VALIDATE,
    TRANSFORM,
    COMMIT;

    public String label() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }
}
