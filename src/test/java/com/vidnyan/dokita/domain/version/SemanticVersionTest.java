package com.vidnyan.dokita.domain.version;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SemanticVersionTest {

    private static SemanticVersion v(String text) {
        return SemanticVersion.parse(text).orElseThrow();
    }

    @Test
    void parse_ShouldReadAllSegments() {
        SemanticVersion version = v("1.22.3-beta.2+build.7");

        assertEquals(1, version.major());
        assertEquals(22, version.minor());
        assertEquals(3, version.patch());
        assertEquals(List.of("beta", "2"), version.preRelease());
        assertEquals("build.7", version.build());
        assertEquals("1.22.3-beta.2+build.7", version.toString());
    }

    @Test
    void parse_ShouldRejectNonSemverText() {
        assertEquals(Optional.empty(), SemanticVersion.parse("1.2"));
        assertEquals(Optional.empty(), SemanticVersion.parse("latest"));
        assertEquals(Optional.empty(), SemanticVersion.parse("^1.0.0"));
        assertEquals(Optional.empty(), SemanticVersion.parse(null));
    }

    @Test
    void numericSegmentsCompareNumerically() {
        assertTrue(v("1.9.0").isOlderThan(v("1.10.0")));
        assertTrue(v("0.2.9").isOlderThan(v("0.10.0")));
        assertTrue(v("1.0.0").isOlderThan(v("1.2.3")));
        assertFalse(v("2.0.0").isOlderThan(v("1.99.99")));
    }

    @Test
    void preReleaseRanksBelowRelease() {
        assertTrue(v("1.0.0-alpha").isOlderThan(v("1.0.0")));
        assertTrue(v("1.0.0-alpha").isOlderThan(v("1.0.0-alpha.1")));
        assertTrue(v("1.0.0-alpha.1").isOlderThan(v("1.0.0-alpha.beta")));
        assertTrue(v("1.0.0-beta.2").isOlderThan(v("1.0.0-beta.11")));
        assertTrue(v("1.0.0-rc.1").isOlderThan(v("1.0.0")));
    }

    @Test
    void buildMetadataIsIgnoredWhenComparing() {
        assertEquals(0, v("1.0.0+abc").compareTo(v("1.0.0+def")));
    }
}
