package work.lcod.compendium.shared;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.core.util.Separators;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.cfg.JsonNodeFeature;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import work.lcod.compendium.api.PackException;
import work.lcod.compendium.api.SerializationFormat;

/**
 * Jackson mappers shared by source files and the pack store. Floating point numbers are kept as exact
 * decimals so values survive a compile/extract round trip unchanged.
 */
public final class DocumentCodec {
    private static final ObjectMapper JSON = configure(new ObjectMapper());
    private static final ObjectMapper YAML = configure(new ObjectMapper(
        YAMLFactory.builder()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
            .build()
    ));

    private DocumentCodec() {}

    public static ObjectMapper json() {
        return JSON;
    }

    public static ObjectMapper yaml() {
        return YAML;
    }

    /**
     * Reads a source file whose root must be an object; the format follows the file extension.
     */
    public static ObjectNode read(Path file) throws IOException {
        SerializationFormat format = SerializationFormat.forFile(file);
        String contents;
        try {
            contents = Files.readString(file, StandardCharsets.UTF_8);
        } catch (CharacterCodingException ex) {
            throw new PackException(PackException.Kind.PARSE, "Source file is not valid UTF-8", file.toString(), ex);
        }
        JsonNode root;
        try {
            root = mapper(format).readTree(contents);
        } catch (JsonProcessingException ex) {
            throw new PackException(
                PackException.Kind.PARSE,
                "Unable to parse " + format.name() + ": " + ex.getOriginalMessage(),
                file.toString(),
                ex
            );
        }
        if (!(root instanceof ObjectNode object)) {
            throw new PackException(PackException.Kind.PARSE, "Source file must contain a single document object", file.toString());
        }
        return object;
    }

    public static String serialize(JsonNode document, SerializationFormat format, int jsonIndent) throws JsonProcessingException {
        if (format == SerializationFormat.YAML) {
            return YAML.writeValueAsString(document);
        }
        return jsonWriter(jsonIndent).writeValueAsString(document) + "\n";
    }

    /**
     * Serializes {@code document} to {@code file}, creating parent directories as needed.
     */
    public static void write(JsonNode document, Path file, SerializationFormat format, int jsonIndent) throws IOException {
        Path parent = file.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(file, serialize(document, format, jsonIndent), StandardCharsets.UTF_8);
    }

    private static ObjectMapper mapper(SerializationFormat format) {
        return format == SerializationFormat.YAML ? YAML : JSON;
    }

    private static ObjectWriter jsonWriter(int indent) {
        if (indent <= 0) {
            return JSON.writer();
        }
        var indenter = new DefaultIndenter(" ".repeat(indent), "\n");
        var printer = new DefaultPrettyPrinter()
            .withSeparators(Separators.createDefaultInstance()
                .withObjectFieldValueSpacing(Separators.Spacing.AFTER)
                .withObjectEmptySeparator("")
                .withArrayEmptySeparator(""));
        printer.indentObjectsWith(indenter);
        printer.indentArraysWith(indenter);
        return JSON.writer(printer);
    }

    private static ObjectMapper configure(ObjectMapper mapper) {
        mapper.enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
        mapper.enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        mapper.configure(JsonNodeFeature.STRIP_TRAILING_BIGDECIMAL_ZEROES, false);
        mapper.setNodeFactory(JsonNodeFactory.withExactBigDecimals(true));
        return mapper;
    }
}
