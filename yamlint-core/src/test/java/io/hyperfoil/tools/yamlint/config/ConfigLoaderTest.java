package io.hyperfoil.tools.yamlint.config;

import io.hyperfoil.tools.yamlint.Severity;
import io.hyperfoil.tools.yamlint.rule.RuleId;
import io.hyperfoil.tools.yamlint.rule.RuleSettings;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import static org.junit.Assert.*;

public class ConfigLoaderTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private Path write(Path dir, String name, String... lines) throws IOException {
        Path file = dir.resolve(name);
        Files.createDirectories(file.getParent());
        Files.write(file, String.join("\n", lines).getBytes(StandardCharsets.UTF_8));
        return file;
    }

    private static String errorOf(String content){
        try {
            ConfigLoader.parse(content, null);
        } catch (ConfigException e) {
            return e.getMessage();
        }
        fail("expected a configuration error for " + content);
        return null;
    }

    @Test
    public void rule_options_and_level(){
        LintConfig config = ConfigLoader.parse(String.join("\n",
                "rules:",
                "  line-length:",
                "    max: 120",
                "    level: warning",
                "  document-start: disable",
                "  key-ordering: enable",
                ""), null);
        RuleSettings lineLength = config.getSettings(RuleId.LINE_LENGTH);
        assertTrue(lineLength.isEnabled());
        assertEquals(Severity.WARNING, lineLength.getSeverity());
        assertEquals(120, lineLength.getOptions().getInt("max"));
        assertTrue(lineLength.getOptions().getBoolean("allow-non-breakable-words"));
        assertFalse(config.getSettings(RuleId.DOCUMENT_START).isEnabled());
        assertTrue(config.getSettings(RuleId.KEY_ORDERING).isEnabled());
        assertTrue(config.getSettings(RuleId.COLONS).isEnabled());
    }

    @Test
    public void level_disable(){
        LintConfig config = ConfigLoader.parse("rules:\n  colons:\n    level: disable\n", null);
        assertFalse(config.getSettings(RuleId.COLONS).isEnabled());
    }

    @Test
    public void extends_relaxed(){
        LintConfig config = ConfigLoader.parse("extends: relaxed\n", null);
        assertFalse(config.getSettings(RuleId.TRUTHY).isEnabled());
        assertFalse(config.getSettings(RuleId.DOCUMENT_START).isEnabled());
        assertEquals(1, config.getSettings(RuleId.BRACES).getOptions().getInt("max-spaces-inside"));
        assertEquals(Severity.WARNING, config.getSettings(RuleId.INDENTATION).getSeverity());
        assertEquals("consistent", config.getSettings(RuleId.INDENTATION).getOptions().get("indent-sequences"));
    }

    @Test
    public void ignore_block_and_yaml_files(){
        LintConfig config = ConfigLoader.parse(String.join("\n",
                "ignore: |",
                "  generated/",
                "  *.tmp.yaml",
                "yaml-files:",
                "  - '*.yaml'",
                "  - '*.yaml.dist'",
                ""), null);
        assertEquals(Arrays.asList("generated/", "*.tmp.yaml"), config.getIgnore());
        assertTrue(config.isYamlFile("a.yaml.dist"));
        assertFalse(config.isYamlFile("a.yml"));
    }

    @Test
    public void rule_ignore(){
        LintConfig config = ConfigLoader.parse("rules:\n  line-length:\n    ignore: ['vendor/']\n", null);
        assertEquals(Arrays.asList("vendor/"), config.getSettings(RuleId.LINE_LENGTH).getIgnore());
    }

    @Test
    public void errors(){
        assertEquals("invalid config: not a mapping", errorOf("- a\n"));
        assertEquals("invalid config: no such rule: \"nope\"", errorOf("rules:\n  nope: enable\n"));
        assertEquals("invalid config: unknown option \"wat\" for rule \"colons\"", errorOf("rules:\n  colons:\n    wat: 1\n"));
        assertEquals("invalid config: option \"max\" of \"line-length\" should be an integer",
                errorOf("rules:\n  line-length:\n    max: abc\n"));
        assertTrue(errorOf("foo: 1\n").startsWith("invalid config: unknown key"));
        assertTrue(errorOf("rules:\n  colons:\n    level: loud\n").startsWith("invalid config: level should be"));
        assertTrue(errorOf("extends: nowhere.yaml\n").startsWith("invalid config: extends"));
        assertTrue(errorOf("a: [\n").startsWith("invalid config:"));
    }

    @Test
    public void inconsistent_rule_options(){
        String message = errorOf(String.join("\n",
                "rules:",
                "  quoted-strings:",
                "    required: true",
                "    extra-required: ['^http']",
                ""));
        assertTrue(message, message.startsWith("invalid config: quoted-strings:"));
    }

    @Test
    public void extends_file() throws IOException {
        Path dir = folder.getRoot().toPath();
        write(dir, "base.yaml", "rules:", "  colons: disable", "");
        Path child = write(dir, "child.yaml", "extends: base.yaml", "rules:", "  commas: disable", "");
        LintConfig config = ConfigLoader.load(child);
        assertFalse(config.getSettings(RuleId.COLONS).isEnabled());
        assertFalse(config.getSettings(RuleId.COMMAS).isEnabled());
        assertTrue(config.getSettings(RuleId.HYPHENS).isEnabled());
    }

    @Test
    public void discover_project_file() throws IOException {
        Path dir = folder.getRoot().toPath();
        write(dir, ".yamllint", "rules:", "  line-length: disable", "");
        Path nested = Files.createDirectories(dir.resolve("a/b"));
        assertEquals(dir.resolve(".yamllint").toAbsolutePath().normalize(), ConfigLoader.find(nested));
        LintConfig config = ConfigLoader.discover(null, null, nested);
        assertFalse(config.getSettings(RuleId.LINE_LENGTH).isEnabled());
    }

    @Test
    public void discover_prefers_command_line() throws IOException {
        Path dir = folder.getRoot().toPath();
        write(dir, ".yamllint", "rules:", "  line-length: disable", "");
        Path file = write(dir, "custom.yaml", "rules:", "  colons: disable", "");

        LintConfig fromFile = ConfigLoader.discover(file, "relaxed", dir);
        assertFalse(fromFile.getSettings(RuleId.COLONS).isEnabled());
        assertTrue(fromFile.getSettings(RuleId.LINE_LENGTH).isEnabled());

        LintConfig preset = ConfigLoader.discover(null, "relaxed", dir);
        assertFalse(preset.getSettings(RuleId.TRUTHY).isEnabled());

        LintConfig data = ConfigLoader.discover(null, "{rules: {hyphens: disable}}", dir);
        assertFalse(data.getSettings(RuleId.HYPHENS).isEnabled());
        assertTrue(data.getSettings(RuleId.LINE_LENGTH).isEnabled());
    }

    @Test(expected = ConfigException.class)
    public void missing_file(){
        ConfigLoader.load(folder.getRoot().toPath().resolve("missing.yaml"));
    }

    @Test(expected = ConfigException.class)
    public void unknown_preset(){
        ConfigLoader.preset("strictest");
    }
}
