package com.track.resolution.rules;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class MixLabelParserTest {

    @ParameterizedTest
    @DisplayName("Should split the mix designation from the title")
    @CsvSource({
            "Never Sleep Again (Keinemusik Remix),Never Sleep Again,Keinemusik Remix",
            "Track [Extended Mix],Track,Extended Mix",
            "Track - Radio Edit,Track,Radio Edit",
            "A - B - Dub Mix,A - B,Dub Mix",
            "Track (Live at Ibiza),Track (Live at Ibiza),",
            "Plain Title,Plain Title,"
    })
    void testParse(String raw, String expectedTitle, String expectedMix) {
        MixLabelParser.ParsedTitle parsed = MixLabelParser.parse(raw);
        assertEquals(expectedTitle, parsed.title());
        assertEquals(expectedMix, parsed.mixLabel());
    }

    @Test
    @DisplayName("Should collect featured artists and keep the first mix group")
    void testFeaturingAndMultipleGroups() {
        MixLabelParser.ParsedTitle parsed = MixLabelParser.parse("Move (feat. Aki & Tom) (Keinemusik Remix) [Radio Edit]");

        assertEquals("Move [Radio Edit]", parsed.title());
        assertEquals("Keinemusik Remix", parsed.mixLabel());
        assertEquals(List.of("Aki", "Tom"), parsed.featuredArtists());
    }

    @Test
    @DisplayName("Blank titles parse to an empty title")
    void testBlank() {
        MixLabelParser.ParsedTitle parsed = MixLabelParser.parse("  ");
        assertEquals("", parsed.title());
        assertNull(parsed.mixLabel());
        assertTrue(parsed.featuredArtists().isEmpty());
    }

    @ParameterizedTest
    @DisplayName("Should recognize mix vocabulary")
    @CsvSource({
            "Keinemusik Remix,true",
            "Dixon Re-Work,true",
            "Extended,true",
            "Live at Ibiza,false",
            "Remixed Feelings,false"
    })
    void testContainsMixKeyword(String text, boolean expected) {
        assertEquals(expected, MixLabelParser.containsMixKeyword(text));
    }

    @Test
    @DisplayName("Should strip mix vocabulary down to the remixer name")
    void testStripMixKeywords() {
        assertEquals("keinemusik", MixLabelParser.stripMixKeywords("keinemusik remix"));
        assertEquals("adam port", MixLabelParser.stripMixKeywords("adam port  extended remix"));
        assertEquals("", MixLabelParser.stripMixKeywords("original mix"));
        assertEquals("", MixLabelParser.stripMixKeywords(null));
        assertFalse(MixLabelParser.containsMixKeyword(null));
    }

    @ParameterizedTest
    @DisplayName("Should reduce a label to its version types")
    @CsvSource({
            "keinemusik remix,remix",
            "keinemusik extended remix,remix",
            "keinemusik rmx,remix",
            "keinemusik dub,dub",
            "dixon reedit,edit",
            "ame vip mix,vip",
            "extended mix,''"
    })
    void testMixTypes(String label, String expected) {
        Set<String> types = MixLabelParser.mixTypes(label);
        assertEquals(expected, String.join(",", types));
    }

    @Test
    @DisplayName("Should collect every version type a label names")
    void testMixTypesMultiple() {
        assertEquals(Set.of("dub", "remix"), MixLabelParser.mixTypes("keinemusik remix dub"));
        assertTrue(MixLabelParser.mixTypes(null).isEmpty());
    }
}
