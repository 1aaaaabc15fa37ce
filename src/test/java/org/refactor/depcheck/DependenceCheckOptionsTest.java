package org.refactor.depcheck;

import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class DependenceCheckOptionsTest {

    @Test
    void defaultsComeFromProperties() {
        DependenceCheckOptions options = DependenceCheckOptions.parse(new String[]{"A.java"});

        assertEquals(Paths.get("A.java"), options.sourceFile());
        assertEquals(Paths.get("src/main/java"), options.sourceRoot());
        assertNull(options.dotDir());
        assertNull(options.method());
        assertTrue(options.dataDependences());
        assertTrue(options.selects("anything"));
    }

    @Test
    void flagsOverrideDefaults() {
        DependenceCheckOptions options = DependenceCheckOptions.parse(new String[]{
                "--method", "f", "--dot", "out", "--no-data", "--source-root", "src", "A.java"});

        assertEquals("f", options.method());
        assertEquals(Paths.get("out"), options.dotDir());
        assertEquals(Paths.get("src"), options.sourceRoot());
        assertFalse(options.dataDependences());
        assertTrue(options.selects("f"));
        assertFalse(options.selects("g"));
    }

    @Test
    void propertiesAreApplied() {
        DependenceCheckOptions options = new DependenceCheckOptions();
        Properties props = new Properties();
        props.setProperty("depcheck.dotDir", "dots");
        props.setProperty("depcheck.dataDependences", "false");
        options.apply(props);

        assertEquals(Paths.get("dots"), options.dotDir());
        assertFalse(options.dataDependences());
    }

    @Test
    void badCommandLinesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> DependenceCheckOptions.parse(new String[]{}));
        assertThrows(IllegalArgumentException.class, () -> DependenceCheckOptions.parse(new String[]{"--bogus", "A.java"}));
        assertThrows(IllegalArgumentException.class, () -> DependenceCheckOptions.parse(new String[]{"A.java", "--dot"}));
        assertThrows(IllegalArgumentException.class, () -> DependenceCheckOptions.parse(new String[]{"A.java", "B.java"}));
    }
}
