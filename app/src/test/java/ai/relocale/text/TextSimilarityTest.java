package ai.relocale.text;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class TextSimilarityTest {

    @Test
    void testIdentity() {
        assertEquals(0, TextSimilarity.computeEditDistance("profile", "profile"));
        assertEquals(0, TextSimilarity.computeEditDistance("", ""));
    }

    @Test
    void testEmptySide() {
        assertEquals(3, TextSimilarity.computeEditDistance("", "abc"));
        assertEquals(4, TextSimilarity.computeEditDistance("abcd", ""));
    }

    @Test
    void testKnownDistances() {
        assertEquals(1, TextSimilarity.computeEditDistance("cat", "cats"));
        assertEquals(3, TextSimilarity.computeEditDistance("kitten", "sitting"));
        assertEquals(2, TextSimilarity.computeEditDistance("recieve", "receive"));
    }

    @Test
    void testSymmetric() {
        assertEquals(
                TextSimilarity.computeEditDistance("settings", "setting_page"),
                TextSimilarity.computeEditDistance("setting_page", "settings"));
    }
}
