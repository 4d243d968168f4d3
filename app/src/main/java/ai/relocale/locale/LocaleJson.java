package ai.relocale.locale;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/** Reads and writes locale JSON trees. Output uses two-space indentation and ends with a newline. */
public final class LocaleJson {
    private static final Logger logger = LogManager.getLogger(LocaleJson.class);

    public static final ObjectMapper MAPPER = new ObjectMapper();

    private LocaleJson() {}

    /** Parses {@code content} into an object tree; null for blank input, invalid JSON or a non-object root. */
    public static @Nullable ObjectNode parseObject(@Nullable String content) {
        if (content == null || content.isBlank()) {
            return null;
        }
        try {
            var node = MAPPER.readTree(content);
            return node instanceof ObjectNode object ? object : null;
        } catch (JsonProcessingException e) {
            logger.debug("Unparseable locale JSON: {}", e.getOriginalMessage());
            return null;
        }
    }

    /** Reads {@code file} from disk; null when missing or unparseable. */
    public static @Nullable ObjectNode read(Path file) {
        try {
            return parseObject(Files.readString(file, StandardCharsets.UTF_8));
        } catch (NoSuchFileException e) {
            return null;
        } catch (IOException e) {
            logger.debug("Could not read locale file {}: {}", file, e.getMessage());
            return null;
        }
    }

    /**
     * Reads {@code file} for modification. A missing or blank file yields a fresh empty tree.
     *
     * @throws IOException if the file cannot be read or does not hold a JSON object
     */
    public static ObjectNode readForUpdate(Path file) throws IOException {
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            return MAPPER.createObjectNode();
        }
        if (content.isBlank()) {
            return MAPPER.createObjectNode();
        }
        var node = MAPPER.readTree(content);
        if (node instanceof ObjectNode object) {
            return object;
        }
        throw new IOException("Locale file " + file + " does not hold a JSON object");
    }

    public static String toJson(JsonNode tree) {
        try {
            return MAPPER.writer(new LocalePrettyPrinter()).writeValueAsString(tree) + "\n";
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Tree could not be serialized", e);
        }
    }

    public static void write(Path file, JsonNode tree) throws IOException {
        var parent = file.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(file, toJson(tree), StandardCharsets.UTF_8);
    }

    /** {@code "key": value} with newline-indented objects and arrays, and compact empty containers. */
    private static final class LocalePrettyPrinter extends DefaultPrettyPrinter {
        LocalePrettyPrinter() {
            var indenter = DefaultIndenter.SYSTEM_LINEFEED_INSTANCE.withLinefeed("\n");
            indentObjectsWith(indenter);
            indentArraysWith(indenter);
        }

        LocalePrettyPrinter(LocalePrettyPrinter base) {
            super(base);
        }

        @Override
        public DefaultPrettyPrinter createInstance() {
            return new LocalePrettyPrinter(this);
        }

        @Override
        public void writeObjectFieldValueSeparator(JsonGenerator g) throws IOException {
            g.writeRaw(": ");
        }

        @Override
        public void writeEndObject(JsonGenerator g, int nrOfEntries) throws IOException {
            if (!_objectIndenter.isInline()) {
                --_nesting;
            }
            if (nrOfEntries > 0) {
                _objectIndenter.writeIndentation(g, _nesting);
            }
            g.writeRaw('}');
        }

        @Override
        public void writeEndArray(JsonGenerator g, int nrOfValues) throws IOException {
            if (!_arrayIndenter.isInline()) {
                --_nesting;
            }
            if (nrOfValues > 0) {
                _arrayIndenter.writeIndentation(g, _nesting);
            }
            g.writeRaw(']');
        }
    }
}
