package ai.relocale.text;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class TranslationCallsTest {

    @Test
    void testCallForms() {
        assertTrue(TranslationCalls.containsCall("{t('auth.login')}", "auth.login"));
        assertTrue(TranslationCalls.containsCall("{{ $t(\"auth.login\") }}", "auth.login"));
        assertTrue(TranslationCalls.containsCall("t( 'auth.login', { n })", "auth.login"));
        assertFalse(TranslationCalls.containsCall("format('auth.login')", "auth.login"));
        assertFalse(TranslationCalls.containsCall("t('auth.login_button')", "auth.login"));
    }

    @Test
    void testOptionNames() {
        var content = "t('list.count', { count: items.length, owner })\nt('list.count', { total: n })";
        assertEquals(List.of("count", "owner", "total"), TranslationCalls.knownOptionNames(content, "list.count"));
        assertEquals(List.of(), TranslationCalls.knownOptionNames("t('list.count')", "list.count"));
    }

    @Test
    void testPlaceholderHintsAreLowerCased() {
        var hints = TranslationCalls.placeholderHints("t('a.b', { userName: currentUser })", "a.b");
        assertEquals(List.of("username", "currentuser"), hints);
    }
}
