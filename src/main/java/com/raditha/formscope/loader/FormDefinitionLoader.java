package com.raditha.formscope.loader;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.raditha.formscope.model.FormDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * Reads form definitions from JSON.
 * <p>
 * Accepts a file holding a single form, a file holding an object of forms
 * keyed by identifier, or a directory of {@code *.json} files each holding a
 * single form. A single form is identified by its file name without the
 * extension.
 */
public class FormDefinitionLoader {
    private static final Logger logger = LoggerFactory.getLogger(FormDefinitionLoader.class);

    private static final String JSON_EXTENSION = ".json";

    private final ObjectMapper mapper;

    public FormDefinitionLoader() {
        this.mapper = JsonMapper.builder()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_PROPERTIES)
                .build();
    }

    /**
     * Load forms from a file or directory.
     *
     * @param path JSON file or directory of JSON files
     * @return Forms keyed by identifier, in identifier order
     * @throws IOException if the path is missing or a file cannot be parsed
     */
    public Map<String, FormDefinition> load(Path path) throws IOException {
        if (Files.isDirectory(path)) {
            return loadDirectory(path);
        }
        if (!Files.isRegularFile(path)) {
            throw new IOException("Form definition path not found: " + path);
        }
        return loadFile(path);
    }

    private Map<String, FormDefinition> loadDirectory(Path directory) throws IOException {
        Map<String, FormDefinition> forms = new TreeMap<>();

        List<Path> files;
        try (Stream<Path> entries = Files.list(directory)) {
            files = entries
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(JSON_EXTENSION))
                    .sorted()
                    .toList();
        }

        for (Path file : files) {
            forms.put(formId(file), readForm(file));
        }

        logger.info("Loaded {} forms from {}", forms.size(), directory);
        return forms;
    }

    private Map<String, FormDefinition> loadFile(Path file) throws IOException {
        JsonNode root = mapper.readTree(file.toFile());
        if (root == null || !root.isObject()) {
            throw new IOException("Expected a JSON object in " + file);
        }

        Map<String, FormDefinition> forms = new TreeMap<>();
        if (isSingleForm(root)) {
            forms.put(formId(file), mapper.treeToValue(root, FormDefinition.class));
        } else {
            Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> entry = fields.next();
                forms.put(entry.getKey(), mapper.treeToValue(entry.getValue(), FormDefinition.class));
            }
        }

        logger.info("Loaded {} forms from {}", forms.size(), file);
        return forms;
    }

    /**
     * Read a single form from a JSON file.
     *
     * @throws IOException if the file cannot be read or parsed
     */
    public FormDefinition readForm(Path file) throws IOException {
        return mapper.readValue(file.toFile(), FormDefinition.class);
    }

    private static boolean isSingleForm(JsonNode node) {
        Iterator<String> names = node.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if ("views".equalsIgnoreCase(name)) {
                return true;
            }
        }
        return false;
    }

    private static String formId(Path file) {
        String fileName = file.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
