package ai.relocale.locale;

import ai.relocale.text.KeyPaths;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/** Dot-path access to locale trees. Leaves are strings; intermediate nodes are objects. */
public final class LocaleTree {
    private LocaleTree() {}

    /** The node at {@code keyPath}, or null when any segment is missing or crosses a non-object. */
    public static @Nullable JsonNode getNode(@Nullable JsonNode root, String keyPath) {
        var segments = KeyPaths.segments(keyPath);
        if (root == null || segments.isEmpty()) {
            return null;
        }
        JsonNode current = root;
        for (var segment : segments) {
            if (!current.isObject() || !current.has(segment)) {
                return null;
            }
            current = current.get(segment);
        }
        return current;
    }

    /** The string leaf at {@code keyPath}; null for missing paths and non-string nodes. */
    public static @Nullable String getNestedValue(@Nullable JsonNode root, String keyPath) {
        var node = getNode(root, keyPath);
        return node != null && node.isTextual() ? node.textValue() : null;
    }

    /** First non-blank string leaf among {@code keyPaths}, tried in order. */
    public static @Nullable String findFirstValue(@Nullable JsonNode root, List<String> keyPaths) {
        for (var keyPath : keyPaths) {
            var value = getNestedValue(root, keyPath);
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }

    public static boolean hasKeyPath(@Nullable JsonNode root, String keyPath) {
        return getNode(root, keyPath) != null;
    }

    /** Sets a string leaf, replacing any non-object node met on the way with a fresh object. */
    public static void setNestedValue(ObjectNode root, String keyPath, String value) {
        var segments = KeyPaths.segments(keyPath);
        if (segments.isEmpty()) {
            throw new IllegalArgumentException("Empty key path");
        }
        var container = root;
        for (var segment : segments.subList(0, segments.size() - 1)) {
            var child = container.get(segment);
            if (child instanceof ObjectNode childObject) {
                container = childObject;
            } else {
                container = container.putObject(segment);
            }
        }
        container.put(segments.get(segments.size() - 1), value);
    }

    /** Removes the node at {@code keyPath} and any parents left empty. Returns whether something was removed. */
    public static boolean deleteKeyPath(@Nullable JsonNode root, String keyPath) {
        var segments = KeyPaths.segments(keyPath);
        if (!(root instanceof ObjectNode object) || segments.isEmpty()) {
            return false;
        }
        return delete(object, segments, 0);
    }

    private static boolean delete(ObjectNode target, List<String> segments, int index) {
        var segment = segments.get(index);
        if (!target.has(segment)) {
            return false;
        }
        if (index == segments.size() - 1) {
            target.remove(segment);
            return true;
        }
        if (!(target.get(segment) instanceof ObjectNode child)) {
            return false;
        }
        var deleted = delete(child, segments, index + 1);
        if (deleted && child.isEmpty()) {
            target.remove(segment);
        }
        return deleted;
    }
}
