package fr.lapetina.aimux.infrastructure.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigLoaderTest {

    private static final String SINGLE_PROVIDER = String.join("\n",
            "providers:",
            "  - id: solo",
            "    bridge: scripted",
            "    credentials:",
            "      - id: k1",
            "        secret: solo-secret",
            "strategy:",
            "  type: round-robin",
            "");

    private ConfigLoader loader;

    @AfterEach
    void tearDown() {
        if (loader != null) {
            loader.close();
        }
    }

    @Test
    @DisplayName("should load the configuration from the classpath")
    void shouldLoadFromClasspath() {
        loader = new ConfigLoader("test-config.yaml");

        RouterConfig config = loader.load();

        assertThat(config.getProviders()).extracting(RouterConfig.ProviderConfig::getId)
                .containsExactly("alpha", "beta");
        RouterConfig.ProviderConfig alpha = config.getProviders().get(0);
        assertThat(alpha.getCapabilities()).containsExactly("text", "vision");
        assertThat(alpha.getPriority()).isEqualTo(10);
        assertThat(alpha.getRequestsPerWindow()).isEqualTo(5);
        assertThat(alpha.getCredentials()).extracting(RouterConfig.CredentialConfig::getId)
                .containsExactly("a1", "a2");
        assertThat(config.getStrategy().getType()).isEqualTo("cost");
        assertThat(config.getFailover().getMaxAttemptsCap()).isEqualTo(4);
        assertThat(config.getHealthCheck().getFailureThreshold()).isEqualTo(3);
        assertThat(config.getEvents().getRingBufferSize()).isEqualTo(256);
        assertThat(config.getMetrics().getPrefix()).isEqualTo("aimux_test");
        assertThat(loader.getCurrentConfig()).isSameAs(config);
    }

    @Test
    @DisplayName("should prefer a file on disk and keep defaults for missing sections")
    void shouldLoadFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("router.yaml");
        Files.writeString(file, SINGLE_PROVIDER);
        loader = new ConfigLoader(file.toString());

        RouterConfig config = loader.load();

        assertThat(config.getProviders()).singleElement()
                .extracting(RouterConfig.ProviderConfig::getId)
                .isEqualTo("solo");
        assertThat(config.getStrategy().getType()).isEqualTo("round-robin");
        assertThat(config.getFailover().getAttemptTimeoutMs()).isEqualTo(30_000);
        assertThat(config.getServer().isEnabled()).isFalse();
    }

    @Test
    @DisplayName("should fail when the file exists nowhere")
    void shouldFailWhenMissing() {
        loader = new ConfigLoader("no-such-config.yaml");

        assertThatThrownBy(() -> loader.load())
                .isInstanceOf(ConfigLoader.ConfigurationException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("should report malformed YAML")
    void shouldRejectMalformedYaml() {
        loader = new ConfigLoader("unused.yaml");

        assertThatThrownBy(() -> loader.loadFromStream(stream("providers: [unclosed")))
                .isInstanceOf(ConfigLoader.ConfigurationException.class)
                .hasMessageContaining("Malformed configuration");
        assertThat(loader.getCurrentConfig()).isNull();
    }

    @Test
    @DisplayName("should notify listeners with the old and new configuration")
    void shouldNotifyListeners() {
        loader = new ConfigLoader("test-config.yaml");
        List<RouterConfig[]> changes = new ArrayList<>();
        loader.addListener((oldConfig, newConfig) -> changes.add(new RouterConfig[]{oldConfig, newConfig}));

        RouterConfig first = loader.load();
        RouterConfig second = loader.loadFromStream(stream(SINGLE_PROVIDER));

        assertThat(changes).hasSize(2);
        assertThat(changes.get(0)[0]).isNull();
        assertThat(changes.get(0)[1]).isSameAs(first);
        assertThat(changes.get(1)[0]).isSameAs(first);
        assertThat(changes.get(1)[1]).isSameAs(second);
    }

    @Test
    @DisplayName("should keep the previous configuration when a listener vetoes")
    void shouldRestoreOnVeto() {
        loader = new ConfigLoader("test-config.yaml");
        RouterConfig accepted = loader.load();
        loader.addListener((oldConfig, newConfig) -> {
            throw new ConfigLoader.ConfigurationException(List.of("providers[solo].bridge: unknown type 'scripted'"));
        });

        assertThatThrownBy(() -> loader.loadFromStream(stream(SINGLE_PROVIDER)))
                .isInstanceOf(ConfigLoader.ConfigurationException.class)
                .satisfies(e -> assertThat(((ConfigLoader.ConfigurationException) e).getProblems())
                        .containsExactly("providers[solo].bridge: unknown type 'scripted'"));
        assertThat(loader.getCurrentConfig()).isSameAs(accepted);
    }

    @Test
    @DisplayName("should keep the current configuration when a reload fails")
    void shouldKeepCurrentOnFailedReload(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("router.yaml");
        Files.writeString(file, SINGLE_PROVIDER);
        loader = new ConfigLoader(file.toString());
        RouterConfig accepted = loader.load();

        Files.writeString(file, "providers: [unclosed");

        assertThat(loader.reload()).isSameAs(accepted);
        assertThat(loader.getCurrentConfig()).isSameAs(accepted);
    }

    @Test
    @DisplayName("should not notify a removed listener")
    void shouldRemoveListener() {
        loader = new ConfigLoader("test-config.yaml");
        List<RouterConfig> seen = new ArrayList<>();
        ConfigChangeListener listener = (oldConfig, newConfig) -> seen.add(newConfig);
        loader.addListener(listener);
        loader.load();

        loader.removeListener(listener);
        loader.load();

        assertThat(seen).hasSize(1);
    }

    private static ByteArrayInputStream stream(String yaml) {
        return new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8));
    }
}
