package ai.relocale.locale;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import org.junit.jupiter.api.Test;

class LocaleTreeTest {

    private static ObjectNode tree(String json) {
        var parsed = LocaleJson.parseObject(json);
        assertNotNull(parsed);
        return parsed;
    }

    @Test
    void testNestedValueOnlyForStringLeaves() {
        var root = tree("{\"auth\": {\"login\": \"Sign in\", \"count\": 3, \"nested\": {}}}");

        assertEquals("Sign in", LocaleTree.getNestedValue(root, "auth.login"));
        assertNull(LocaleTree.getNestedValue(root, "auth.count"));
        assertNull(LocaleTree.getNestedValue(root, "auth.nested"));
        assertNull(LocaleTree.getNestedValue(root, "auth.login.deeper"));
        assertNull(LocaleTree.getNestedValue(null, "auth.login"));
        assertTrue(LocaleTree.hasKeyPath(root, "auth.nested"));
    }

    @Test
    void testFindFirstValueSkipsBlank() {
        var root = tree("{\"a\": {\"b\": \" \"}, \"b\": \"Second\"}");

        assertEquals("Second", LocaleTree.findFirstValue(root, List.of("a.b", "b")));
        assertNull(LocaleTree.findFirstValue(root, List.of("x", "y")));
    }

    @Test
    void testSetCreatesIntermediateObjects() {
        var root = tree("{\"auth\": \"flat\"}");

        LocaleTree.setNestedValue(root, "auth.errors.invalid", "Invalid");
        LocaleTree.setNestedValue(root, "auth.errors.expired", "Expired");

        assertEquals("Invalid", LocaleTree.getNestedValue(root, "auth.errors.invalid"));
        assertEquals("Expired", LocaleTree.getNestedValue(root, "auth.errors.expired"));
    }

    @Test
    void testDeletePrunesEmptyParents() {
        var root = tree("{\"a\": {\"b\": {\"c\": \"x\"}}, \"keep\": {\"d\": \"y\", \"e\": \"z\"}}");

        assertTrue(LocaleTree.deleteKeyPath(root, "a.b.c"));
        assertFalse(root.has("a"));

        assertTrue(LocaleTree.deleteKeyPath(root, "keep.d"));
        assertTrue(root.has("keep"));
        assertFalse(LocaleTree.deleteKeyPath(root, "keep.missing"));
        assertFalse(LocaleTree.deleteKeyPath(root, "keep.e.too.deep"));
    }
}
