package com.bloom.recommender.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class CanonicalIdsTest {

    @Test
    public void normalisesCaseWhitespaceAndTrailingSlashes() {
        assertEquals("https://github.com/acme/tool", CanonicalIds.fromUrl("  https://GitHub.com/Acme/Tool//  "));
        assertEquals(CanonicalIds.fromUrl("https://github.com/acme/tool"), CanonicalIds.fromUrl("https://github.com/acme/tool/"));
    }

    @Test
    public void blankUrlHasNoIdentity() {
        assertNull(CanonicalIds.fromUrl(null));
        assertNull(CanonicalIds.fromUrl("   "));
        assertNull(CanonicalIds.fromUrl("///"));
    }
}
