package ch.so.agi.gretlreclass.utils;

import java.math.BigInteger;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Locale;

/**
 * Default names for reclassification outputs: {@code <stem>_reclass} next to
 * the chosen folder, made unique by a trailing {@code _<n>} counter.
 */
public final class DestinationNames {

    public static final String SUFFIX = "_reclass";

    private DestinationNames() {}

    /**
     * @param source    local source file
     * @param directory output directory
     * @param extension extension including the dot, e.g. {@code .tif}
     * @return {@code directory/<stem>_reclass<extension>}
     */
    public static Path localDefault(Path source, Path directory, String extension) {
        return directory.resolve(stem(source.getFileName().toString()) + SUFFIX + extension);
    }

    /**
     * @return the extension of the file name including the dot, lower case, or an empty string
     */
    public static String extension(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(dot).toLowerCase(Locale.ROOT) : "";
    }

    /**
     * Remote asset id of the form {@code <folder>/<stem>_reclass} that does not
     * collide with any of the existing ids.
     */
    public static String remoteDefault(String assetId, String folder, Collection<String> existing) {
        String name = assetId;
        int slash = name.lastIndexOf('/');
        if (slash >= 0) {
            name = name.substring(slash + 1);
        }
        String base = folder.endsWith("/") ? folder : folder + "/";
        return unique(base + stem(name) + SUFFIX, existing);
    }

    public static String unique(String candidate, Collection<String> existing) {
        String name = candidate;
        while (existing.contains(name)) {
            name = next(name);
        }
        return name;
    }

    /**
     * {@code a_reclass} becomes {@code a_reclass_1}, {@code a_reclass_1} becomes {@code a_reclass_2}.
     */
    public static String next(String name) {
        int underscore = name.lastIndexOf('_');
        if (underscore >= 0 && underscore < name.length() - 1) {
            String tail = name.substring(underscore + 1);
            if (tail.chars().allMatch(Character::isDigit)) {
                return name.substring(0, underscore) + "_" + new BigInteger(tail).add(BigInteger.ONE);
            }
        }
        return name + "_1";
    }

    private static String stem(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
