package com.sylva.codegen.infra.loader;

import com.sylva.codegen.api.backend.Backend;
import com.sylva.codegen.api.exceptions.BackendConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackendConfigLoaderTest {

    private static final String DESCRIPTOR = """
            {
              "name": "lisp",
              "file_extension": ".lisp",
              "comment_prefix": ";",
              "indentation": { "type": "spaces", "size": 2 },
              "fixed_point": { "type": "int", "literal": "${value}", "true_keyword": "t", "false_keyword": "nil" },
              "operators": { "le": "(<= ${lhs} ${rhs})", "add": "(+ ${lhs} ${rhs})" },
              "feature_access": "(aref f ${index})",
              "control": {
                "root_open": ["(if ${condition}"], "open": ["(if ${condition}"], "else": [],
                "close": [")"], "root_close": [")"], "leaf": ["${value}"]
              },
              "accumulator": "y",
              "tree_result": "r",
              "input": { "prefix": "#(", "element": "${value}", "separator": " ", "suffix": ")" },
              "unknown_key": "ignored"
            }
            """;

    @TempDir
    Path backendsDir;

    private Path writeBackend(String name, String descriptor) throws IOException {
        Path dir = Files.createDirectories(backendsDir.resolve(name));
        Files.writeString(dir.resolve("backend.json"), descriptor);
        Files.writeString(dir.resolve("header.template"), "; header\n");
        Files.writeString(dir.resolve("tree.template"), "${tree_logic}\r\n");
        Files.writeString(dir.resolve("main.template"), "(defun predict (f) ${tree_code})\n\n");
        return dir;
    }

    @ParameterizedTest
    @ValueSource(strings = {"zokrates", "rust", "python"})
    @DisplayName("Should load every bundled backend")
    void shouldLoadBundledBackends(String name) {
        Backend backend = BackendConfigLoader.fromClasspath().load(name);

        assertThat(backend.name()).isEqualTo(name);
        assertThat(backend.descriptor().fileExtension()).startsWith(".");
        assertThat(backend.templates().main()).contains("${tree_code}").doesNotEndWith("\n");
        assertThat(backend.templates().tree()).contains("${tree_logic}");
    }

    @Test
    @DisplayName("Rust carries a test module and a Cargo manifest")
    void rustExtras() {
        Backend rust = BackendConfigLoader.fromClasspath().load("rust");

        assertThat(rust.descriptor().extraTemplates()).containsExactly("test");
        assertThat(rust.descriptor().companionFiles()).containsEntry("cargo", "Cargo.toml");
        assertThat(rust.templates().extra("test").orElseThrow()).contains("#[cfg(test)]");
        assertThat(rust.templates().extra("cargo").orElseThrow()).contains("[package]");
    }

    @Test
    @DisplayName("Every bundled backend saturates at -2^63 and 2^63 - 1")
    void bundledBackendsShareSaturationBounds() {
        BackendConfigLoader loader = BackendConfigLoader.fromClasspath();

        assertThat(loader.load("zokrates").templates().header())
                .contains("const u64 I64_MAX = 9223372036854775807;")
                .contains("const u64 I64_MIN_MAGNITUDE = 9223372036854775808;")
                .contains("u64 limit = if a.sgn { I64_MAX } else { I64_MIN_MAGNITUDE };");
        assertThat(loader.load("rust").templates().header()).contains("a.saturating_add(b)");
        assertThat(loader.load("python").templates().header())
                .contains("I64_MIN = -(2 ** 63)")
                .contains("I64_MAX = 2 ** 63 - 1");
    }

    @Test
    @DisplayName("Loaded backends are memoized")
    void backendsAreMemoized() {
        BackendConfigLoader loader = BackendConfigLoader.fromClasspath();

        assertThat(loader.load("python")).isSameAs(loader.load("python"));
    }

    @Test
    @DisplayName("Should load a backend from a directory and strip one trailing newline")
    void shouldLoadFromDirectory() throws IOException {
        writeBackend("lisp", DESCRIPTOR);

        Backend backend = BackendConfigLoader.fromDirectory(backendsDir).load("lisp");

        assertThat(backend.descriptor().control().elseBranch()).isEmpty();
        assertThat(backend.descriptor().control().rootLeaf()).containsExactly("${value}");
        assertThat(backend.templates().header()).isEqualTo("; header");
        assertThat(backend.templates().tree()).isEqualTo("${tree_logic}");
        assertThat(backend.templates().main()).isEqualTo("(defun predict (f) ${tree_code})\n");
    }

    @Test
    @DisplayName("Should reject unknown backends")
    void shouldRejectUnknownBackend() {
        assertThatThrownBy(() -> BackendConfigLoader.fromClasspath().load("cobol"))
                .isInstanceOf(BackendConfigurationException.class)
                .hasMessageContaining("Backend 'cobol'")
                .hasMessageContaining("no backend.json");
    }

    @Test
    @DisplayName("Should reject descriptors with missing keys")
    void shouldRejectMissingKeys() throws IOException {
        writeBackend("lisp", DESCRIPTOR.replace("\"operators\": { \"le\": \"(<= ${lhs} ${rhs})\", ", "\"operators\": { "));

        assertThatThrownBy(() -> BackendConfigLoader.fromDirectory(backendsDir).load("lisp"))
                .isInstanceOf(BackendConfigurationException.class)
                .hasMessage("Backend 'lisp': missing required key 'operators.le'");
    }

    @Test
    @DisplayName("Should reject descriptors whose name differs from their directory")
    void shouldRejectNameMismatch() throws IOException {
        writeBackend("scheme", DESCRIPTOR);

        assertThatThrownBy(() -> BackendConfigLoader.fromDirectory(backendsDir).load("scheme"))
                .isInstanceOf(BackendConfigurationException.class)
                .hasMessageContaining("declares name 'lisp'");
    }

    @Test
    @DisplayName("Should reject missing templates")
    void shouldRejectMissingTemplate() throws IOException {
        Path dir = writeBackend("lisp", DESCRIPTOR);
        Files.delete(dir.resolve("tree.template"));

        assertThatThrownBy(() -> BackendConfigLoader.fromDirectory(backendsDir).load("lisp"))
                .isInstanceOf(BackendConfigurationException.class)
                .hasMessageContaining("missing template 'tree'");
    }

    @Test
    @DisplayName("Should reject malformed descriptor JSON")
    void shouldRejectMalformedJson() throws IOException {
        writeBackend("lisp", "{ \"name\": ");

        assertThatThrownBy(() -> BackendConfigLoader.fromDirectory(backendsDir).load("lisp"))
                .isInstanceOf(BackendConfigurationException.class)
                .hasMessageContaining("cannot be read")
                .hasCauseInstanceOf(IOException.class);
    }
}
