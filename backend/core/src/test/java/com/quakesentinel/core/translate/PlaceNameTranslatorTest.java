package com.quakesentinel.core.translate;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PlaceNameTranslatorTest {
    private final PlaceNameTranslator translator = PlaceNameTranslator.withDefaultDictionary();

    @Test
    void translatesPrefectureWithMetroSuffix() {
        assertEquals("TOKYO METRO", translator.translate("東京都"));
    }

    @Test
    void translatesSubRegionWithoutLeavingSourceScript() {
        String translated = translator.translate("福島県中通り");

        assertTrue(translated.contains("FUKUSHIMA"));
        assertTrue(translated.contains("PREF"));
        assertFalse(containsJapanese(translated), translated);
    }

    @Test
    void longerKeysWinOverShorterOnes() {
        assertEquals("IBARAKI PREF SOUTH", translator.translate("茨城県南部"));
        assertEquals("KAGOSHIMA PREF AMAMI NORTH", translator.translate("鹿児島県奄美北部"));
        assertEquals("TOKARA ISLANDS NEAR SEA", translator.translate("トカラ列島近海"));
        assertEquals("FUKUSHIMA PREF NAKADORI NEAR SEA CENTRAL SOUTH", translator.translate("福島県中通り近海 中南部"));
    }

    @Test
    void equalLengthKeysKeepDictionaryOrder() {
        Map<String, String> regions = new LinkedHashMap<>();
        regions.put("東京", " TOKYO");
        regions.put("京都", " KYOTO");
        Map<String, String> suffixes = new LinkedHashMap<>();
        suffixes.put("都", " METRO");
        PlaceNameTranslator ordered = new PlaceNameTranslator(new PlaceNameDictionary(regions, suffixes));

        assertEquals("TOKYO METRO", ordered.translate("東京都"));
        assertEquals("KYOTO", ordered.translate("京都"));
    }

    @Test
    void untranslatableTextPassesThroughUppercasedAndCollapsed() {
        assertEquals("FOO BAR", translator.translate("  foo 　 bar "));
        assertEquals("", translator.translate(null));
        assertEquals("", translator.translate("   "));
    }

    @Test
    void translationIsDeterministic() {
        String first = translator.translate("石川県能登地方");
        for (int i = 0; i < 20; i++) {
            assertEquals(first, translator.translate("石川県能登地方"));
        }
        assertEquals("ISHIKAWA PREF NOTO REGION", first);
    }

    private static boolean containsJapanese(String text) {
        return text.codePoints().anyMatch(cp -> {
            Character.UnicodeScript script = Character.UnicodeScript.of(cp);
            return script == Character.UnicodeScript.HAN
                    || script == Character.UnicodeScript.HIRAGANA
                    || script == Character.UnicodeScript.KATAKANA;
        });
    }
}
