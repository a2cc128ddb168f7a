package ch.so.agi.gretlreclass.model;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

import ch.so.agi.gretlreclass.utils.InvalidClassTableException;

/**
 * One destination class: integer code, display name and RGB color.
 */
public final class ClassEntry {

    public static final String DEFAULT_COLOR = "#000000";

    private static final Pattern HEX_COLOR = Pattern.compile("#?[0-9a-fA-F]{6}");

    private final int code;
    private final String name;
    private final String color;

    /**
     * @param code  class code
     * @param name  display name, {@code null} is stored as an empty string
     * @param color hex triplet with or without leading {@code #}; {@code null} or blank means black
     * @throws InvalidClassTableException if the color is not a hex triplet
     */
    public ClassEntry(int code, String name, String color) {
        this.code = code;
        this.name = name == null ? "" : name;
        this.color = normalizeColor(code, color);
    }

    public int getCode() {
        return code;
    }

    public String getName() {
        return name;
    }

    /**
     * @return the color as upper case {@code #RRGGBB}
     */
    public String getColor() {
        return color;
    }

    public int getRed() {
        return Integer.parseInt(color.substring(1, 3), 16);
    }

    public int getGreen() {
        return Integer.parseInt(color.substring(3, 5), 16);
    }

    public int getBlue() {
        return Integer.parseInt(color.substring(5, 7), 16);
    }

    /**
     * @return {R, G, B, A} with an opaque alpha channel
     */
    public int[] rgba() {
        return new int[] {getRed(), getGreen(), getBlue(), 255};
    }

    private static String normalizeColor(int code, String color) {
        if (color == null || color.isBlank()) {
            return DEFAULT_COLOR;
        }
        String trimmed = color.trim();
        if (!HEX_COLOR.matcher(trimmed).matches()) {
            throw new InvalidClassTableException("Color of class " + code + " is not a hex triplet: " + color);
        }
        String hex = trimmed.startsWith("#") ? trimmed.substring(1) : trimmed;
        return "#" + hex.toUpperCase(Locale.ROOT);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ClassEntry)) return false;
        ClassEntry that = (ClassEntry) o;
        return code == that.code && name.equals(that.name) && color.equals(that.color);
    }

    @Override
    public int hashCode() {
        return Objects.hash(code, name, color);
    }

    @Override
    public String toString() {
        return code + "," + name + "," + color;
    }
}
