package com.raditha.formscope.loader;

import com.raditha.formscope.model.ControlDefinition;
import com.raditha.formscope.model.FormDefinition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for FormDefinitionLoader.
 */
class FormDefinitionLoaderTest {

    private static final String CONTACT_FORM = """
            {
              "name": "Contact",
              "views": [
                {
                  "viewName": "Main",
                  "controls": [
                    {"name": "txtEmail", "type": "TextField", "label": "Email", "binding": "my:Email"},
                    {"name": "txtPhone", "type": "TextField", "label": "Phone", "layoutHint": "wide"}
                  ]
                }
              ],
              "rules": [
                {"name": "Require phone", "condition": "string-length(my:Email) > 0",
                 "actions": [{"type": "setValue", "target": "my:Flag", "expression": "true()"}]}
              ]
            }
            """;

    @TempDir
    Path tempDir;

    private FormDefinitionLoader loader;

    @BeforeEach
    void setUp() {
        loader = new FormDefinitionLoader();
    }

    @Test
    void testSingleFormFile() throws IOException {
        Path file = write("contact.json", CONTACT_FORM);

        Map<String, FormDefinition> forms = loader.load(file);

        assertEquals(List.of("contact"), List.copyOf(forms.keySet()), "Form should be keyed by file name");
        FormDefinition form = forms.get("contact");
        assertEquals("Contact", form.name());
        assertEquals(2, form.allControls().count());
        assertEquals("my:Email", form.views().get(0).controls().get(0).binding());
        assertEquals(1, form.rules().size());
        assertTrue(form.rules().get(0).enabled(), "Missing enabled flag should default to true");
        assertEquals("setValue", form.rules().get(0).actions().get(0).type());
    }

    @Test
    void testKeyedFormsFile() throws IOException {
        Path file = write("corpus.json", """
                {
                  "zeta": {"name": "Zeta", "views": []},
                  "alpha": {"name": "Alpha", "views": []}
                }
                """);

        Map<String, FormDefinition> forms = loader.load(file);

        assertEquals(List.of("alpha", "zeta"), List.copyOf(forms.keySet()), "Forms should be in identifier order");
        assertEquals("Zeta", forms.get("zeta").name());
        assertTrue(forms.get("alpha").rules().isEmpty());
    }

    @Test
    void testDirectoryOfForms() throws IOException {
        write("b-form.json", CONTACT_FORM);
        write("a-form.json", CONTACT_FORM);
        write("notes.txt", "not a form");

        Map<String, FormDefinition> forms = loader.load(tempDir);

        assertEquals(List.of("a-form", "b-form"), List.copyOf(forms.keySet()));
    }

    @Test
    void testRepeatingAliases() throws IOException {
        Path file = write("orders.json", """
                {
                  "views": [
                    {"viewName": "Main", "controls": [
                      {"name": "qty", "type": "TextField", "label": "Qty",
                       "isInRepeatingSection": true, "repeatingSectionName": "Lines"},
                      {"name": "tbl", "type": "RepeatingTable", "sectionType": "repeating",
                       "controls": [{"name": "sku", "type": "TextField"}]}
                    ]}
                  ]
                }
                """);

        FormDefinition form = loader.load(file).get("orders");
        List<ControlDefinition> controls = form.views().get(0).controls();

        assertTrue(controls.get(0).inRepeatingSection());
        assertEquals("Lines", controls.get(0).repeatingSectionName());
        assertTrue(controls.get(1).isRepeating());
        assertEquals(1, controls.get(1).controls().size());
    }

    @Test
    void testMissingPath() {
        IOException e = assertThrows(IOException.class, () -> loader.load(tempDir.resolve("missing.json")));
        assertTrue(e.getMessage().contains("not found"));
    }

    @Test
    void testMalformedJson() throws IOException {
        Path file = write("broken.json", "{\"views\": [");

        assertThrows(IOException.class, () -> loader.load(file));
    }

    @Test
    void testArrayRejected() throws IOException {
        Path file = write("list.json", "[]");

        assertThrows(IOException.class, () -> loader.load(file));
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file;
    }
}
