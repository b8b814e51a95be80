package cn.leancloud.kafka.dispatch;

import org.apache.kafka.common.config.ConfigException;
import org.junit.Before;
import org.junit.Test;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;
import static org.mockito.Mockito.mock;

public class ConfigResolverTest {
    private ClientErrorHandler errorHandler;

    @Before
    public void setUp() {
        errorHandler = mock(ClientErrorHandler.class);
    }

    @Test
    public void testLaterLayerOverridesEarlierLayer() {
        final Map<String, Object> global = new HashMap<>();
        global.put("client.id", "a");
        final Map<String, Object> consumerType = new HashMap<>();
        consumerType.put("client.id", "b");
        consumerType.put("bootstrap.servers", "x");
        final Map<String, Object> declared = new HashMap<>();
        declared.put("group.id", "g");

        final ConsumerSettings settings = ConsumerSettings.newBuilder()
                .globalConfig(global)
                .consumerConfig(consumerType)
                .errorHandlerFactory(() -> errorHandler)
                .build();

        final ResolvedConfig config = new ConfigResolver(settings, declared).buildConfig();

        final Map<String, Object> expect = new HashMap<>();
        expect.put("client.id", "b");
        expect.put("bootstrap.servers", "x");
        expect.put("group.id", "g");
        expect.put("logger", LoggerFactory.getLogger(TopicConsumer.class.getName()));
        expect.put("error_cb", errorHandler);
        assertThat(config.asMap()).isEqualTo(expect);
    }

    @Test
    public void testEveryLayerOverridesClientIdFromSettings() {
        final Map<String, Object> global = new HashMap<>();
        global.put("client.id", "client-id-overridden-by-global-config");
        global.put("bootstrap.servers", "defined-in-global-config");
        final Map<String, Object> consumerType = new HashMap<>();
        consumerType.put("bootstrap.servers", "bootstrap.servers-overridden-by-consumer");
        consumerType.put("group.id", "group.id-defined-by-consumer-config");
        final Map<String, Object> declared = new HashMap<>();
        declared.put("group.id", "group.id-overridden-by-declared-config");
        declared.put("enable.auto.offset.store", true);

        final ConsumerSettings settings = ConsumerSettings.newBuilder()
                .clientId("client.id-initial-definition")
                .globalConfig(global)
                .consumerConfig(consumerType)
                .errorHandlerFactory(() -> errorHandler)
                .build();

        final ResolvedConfig config = new ConfigResolver(settings, declared).buildConfig();

        assertThat(config.asMap()).containsOnly(
                entry("client.id", "client-id-overridden-by-global-config"),
                entry("bootstrap.servers", "bootstrap.servers-overridden-by-consumer"),
                entry("group.id", "group.id-overridden-by-declared-config"),
                entry("enable.auto.offset.store", true),
                entry("logger", LoggerFactory.getLogger(TopicConsumer.class.getName())),
                entry("error_cb", errorHandler));
    }

    @Test
    public void testClientIdFromSettingsKeptWhenNoLayerOverride() {
        final ConsumerSettings settings = ConsumerSettings.newBuilder()
                .clientId("my-service")
                .build();

        final ResolvedConfig config = new ConfigResolver(settings, new HashMap<>()).buildConfig();

        assertThat(config.get("client.id")).isEqualTo("my-service");
    }

    @Test
    public void testComputedLayerOverridesDeclaredKeys() {
        final Map<String, Object> declared = new HashMap<>();
        declared.put("logger", "declared-logger");
        declared.put("error_cb", "declared-error-cb");

        final ConsumerSettings settings = ConsumerSettings.newBuilder()
                .loggerName("testing-logger")
                .errorHandlerFactory(() -> errorHandler)
                .build();

        final ResolvedConfig config = new ConfigResolver(settings, declared).buildConfig();

        assertThat(config.logger()).isSameAs(LoggerFactory.getLogger("testing-logger"));
        assertThat(config.errorCallback()).isSameAs(errorHandler);
    }

    @Test
    public void testComputedLayerCreatesErrorHandlerOnEveryCall() {
        final ConfigResolver resolver = new ConfigResolver(ConsumerSettings.newBuilder().build(), new HashMap<>());

        final Map<String, Object> first = resolver.computedLayer();
        final Map<String, Object> second = resolver.computedLayer();

        assertThat(first).containsOnlyKeys("logger", "error_cb");
        assertThat(first.get("error_cb")).isInstanceOf(LoggingClientErrorHandler.class);
        assertThat(first.get("error_cb")).isNotSameAs(second.get("error_cb"));
        assertThat(first.get("logger")).isSameAs(second.get("logger"));
    }

    @Test
    public void testResolvedConfigIsDeterministic() {
        final Map<String, Object> declared = new LinkedHashMap<>();
        declared.put("group.id", "g");
        final ConsumerSettings settings = ConsumerSettings.newBuilder()
                .errorHandlerFactory(() -> errorHandler)
                .build();
        final ConfigResolver resolver = new ConfigResolver(settings, declared);

        assertThat(resolver.buildConfig()).isEqualTo(resolver.buildConfig());
    }

    @Test
    public void testResolvedConfigIsImmutable() {
        final ResolvedConfig config = new ConfigResolver(ConsumerSettings.newBuilder().build(), new HashMap<>())
                .buildConfig();

        assertThatThrownBy(() -> config.asMap().put("group.id", "g"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    public void testDeclaredConfigCopiedOnConstruction() {
        final Map<String, Object> declared = new HashMap<>();
        declared.put("group.id", "g");
        final ConfigResolver resolver = new ConfigResolver(ConsumerSettings.newBuilder().build(), declared);

        declared.put("group.id", "changed");

        assertThat(resolver.buildConfig().groupId()).isEqualTo("g");
    }

    @Test
    public void testMissingGroupId() {
        final ResolvedConfig config = new ConfigResolver(ConsumerSettings.newBuilder().build(), new HashMap<>())
                .buildConfig();

        assertThatThrownBy(config::groupId)
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("group.id");
    }

    @Test
    public void testAutoOffsetStore() {
        assertThat(resolve("enable.auto.offset.store", null).autoOffsetStore()).isTrue();
        assertThat(resolve("enable.auto.offset.store", true).autoOffsetStore()).isTrue();
        assertThat(resolve("enable.auto.offset.store", "true").autoOffsetStore()).isTrue();
        assertThat(resolve("enable.auto.offset.store", false).autoOffsetStore()).isFalse();
        assertThat(resolve("enable.auto.offset.store", "false").autoOffsetStore()).isFalse();
    }

    @Test
    public void testClientConfigsWithoutInterceptedKeys() {
        final Map<String, Object> declared = new HashMap<>();
        declared.put("group.id", "g");
        declared.put("bootstrap.servers", "localhost:9092");
        declared.put("enable.auto.offset.store", false);

        final ResolvedConfig config = new ConfigResolver(ConsumerSettings.newBuilder().build(), declared).buildConfig();
        final Map<String, Object> clientConfigs = config.clientConfigs();

        assertThat(clientConfigs).containsOnlyKeys("group.id", "bootstrap.servers");
        clientConfigs.put("enable.auto.commit", "false");
        assertThat(config.get("enable.auto.commit")).isNull();
    }

    @Test
    public void testInvalidSettings() {
        assertThatThrownBy(() -> ConsumerSettings.newBuilder().pollTimeout(java.time.Duration.ofMillis(-1)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("pollTimeout");
        assertThatThrownBy(() -> ConsumerSettings.newBuilder().globalConfig(null))
                .isInstanceOf(NullPointerException.class)
                .hasMessage("globalConfig");
        assertThatThrownBy(() -> new ConfigResolver(ConsumerSettings.newBuilder().build(), null))
                .isInstanceOf(NullPointerException.class)
                .hasMessage("declaredConfig");
    }

    private static ResolvedConfig resolve(String key, Object value) {
        final Map<String, Object> declared = new HashMap<>();
        if (value != null) {
            declared.put(key, value);
        }
        return new ConfigResolver(ConsumerSettings.newBuilder().build(), declared).buildConfig();
    }
}
