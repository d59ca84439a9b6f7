package work.lcod.flowguard.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.lcod.flowguard.api.ValidationOptions;

class ValidationOptionsLoaderTest {
    @TempDir
    Path tempDir;

    @Test
    void readsAllRepairSettings() {
        var options = ValidationOptionsLoader.parse("""
            [repair]
            enabled = false
            placeholderCredentials = true
            disabledPasses = ["prune-fanout", " reconnect-orphans "]

            [repair.models]
            denyList = ["acme-llm"]
            parameterKeys = ["engine"]
            """, ValidationOptions.defaults());

        assertFalse(options.autofix());
        assertTrue(options.placeholderCredentials());
        assertEquals(Set.of("prune-fanout", "reconnect-orphans"), options.disabledPasses());
        assertFalse(options.isPassEnabled("prune-fanout"));
        assertTrue(options.isPassEnabled("repair-names"));
        assertEquals(List.of("acme-llm"), options.modelDenyList());
        assertEquals(List.of("engine"), options.modelParameterKeys());
    }

    @Test
    void absentKeysKeepBaseValues() {
        var base = ValidationOptions.builder().placeholderCredentials(true).disablePass("prune-fanout").build();

        var options = ValidationOptionsLoader.parse("[repair]\nenabled = true\n", base);

        assertTrue(options.autofix());
        assertTrue(options.placeholderCredentials());
        assertEquals(Set.of("prune-fanout"), options.disabledPasses());
        assertEquals(ValidationOptions.DEFAULT_MODEL_DENY_LIST, options.modelDenyList());
        assertEquals(base, ValidationOptionsLoader.parse("", base));
    }

    @Test
    void rejectsMalformedConfiguration() {
        var base = ValidationOptions.defaults();

        assertThrows(IllegalArgumentException.class, () -> ValidationOptionsLoader.parse("[repair\n", base));
        assertThrows(IllegalArgumentException.class, () -> ValidationOptionsLoader.parse("[repair]\nenabled = \"yes\"\n", base));
        var mixed = assertThrows(IllegalArgumentException.class,
            () -> ValidationOptionsLoader.parse("[repair]\ndisabledPasses = [1, 2]\n", base));
        assertTrue(mixed.getMessage().contains("repair.disabledPasses must contain strings only"));
    }

    @Test
    void discoversDefaultFileInDirectory() throws Exception {
        assertEquals(Optional.empty(), ValidationOptionsLoader.discover(tempDir));

        var file = tempDir.resolve(ValidationOptionsLoader.DEFAULT_FILE_NAME);
        Files.writeString(file, "[repair]\nplaceholderCredentials = true\n");

        assertEquals(Optional.of(file), ValidationOptionsLoader.discover(tempDir));
        assertTrue(ValidationOptionsLoader.load(file).placeholderCredentials());
        assertThrows(IllegalArgumentException.class, () -> ValidationOptionsLoader.load(tempDir.resolve("nope.toml")));
    }
}
