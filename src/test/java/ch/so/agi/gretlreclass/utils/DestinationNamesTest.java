package ch.so.agi.gretlreclass.utils;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

class DestinationNamesTest {

    @Test
    void localDefaultAppendsSuffix() {
        Path out = DestinationNames.localDefault(Path.of("/data/in/landuse.tif"), Path.of("/data/out"), ".tif");

        assertEquals(Path.of("/data/out/landuse_reclass.tif"), out);
    }

    @Test
    void extensionIsLowerCase() {
        assertEquals(".tif", DestinationNames.extension(Path.of("A.TIF")));
        assertEquals("", DestinationNames.extension(Path.of("README")));
    }

    @Test
    void nextIncrementsTrailingCounter() {
        assertEquals("a_reclass_1", DestinationNames.next("a_reclass"));
        assertEquals("a_reclass_2", DestinationNames.next("a_reclass_1"));
        assertEquals("a_reclass_10", DestinationNames.next("a_reclass_9"));
    }

    @Test
    void nextHandlesCountersBeyondLongRange() {
        assertEquals("a_reclass_10000000000000000000000", DestinationNames.next("a_reclass_9999999999999999999999"));
        assertEquals("a_reclass_9223372036854775808", DestinationNames.next("a_reclass_9223372036854775807"));
    }

    @Test
    void remoteDefaultAvoidsExistingAssets() {
        Set<String> existing = Set.of("users/me/landcover_reclass", "users/me/landcover_reclass_1");

        String name = DestinationNames.remoteDefault("projects/p/assets/landcover", "users/me", existing);

        assertEquals("users/me/landcover_reclass_2", name);
    }

    @Test
    void uniqueKeepsFreeName() {
        assertEquals("x", DestinationNames.unique("x", List.of("y")));
    }
}
