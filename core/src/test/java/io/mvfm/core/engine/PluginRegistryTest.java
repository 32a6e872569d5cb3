package io.mvfm.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.mvfm.core.error.PluginConfigurationException;
import io.mvfm.core.model.KindSpec;
import io.mvfm.core.model.TraitDef;
import io.mvfm.core.model.TypeTag;
import io.mvfm.core.plugins.NumPlugin;
import io.mvfm.core.plugins.Prelude;
import io.mvfm.core.plugins.SimplePlugin;
import io.mvfm.core.spi.Handler;
import io.mvfm.core.spi.Step;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

@DisplayName("PluginRegistry")
class PluginRegistryTest {

    private ListAppender<ILoggingEvent> logAppender;
    private Logger registryLogger;

    @BeforeEach
    void setUp() {
        registryLogger = (Logger) LoggerFactory.getLogger(PluginRegistry.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        registryLogger.addAppender(logAppender);
    }

    @AfterEach
    void tearDown() {
        registryLogger.detachAppender(logAppender);
        logAppender.stop();
    }

    @Nested
    @DisplayName("Merging")
    class Merging {

        @Test
        @DisplayName("the later plugin's kind specification wins")
        void laterKindWins() {
            var first = SimplePlugin.builder("p1")
                    .kind("x/k", KindSpec.of(TypeTag.NUMBER, TypeTag.NUMBER))
                    .build();
            var second = SimplePlugin.builder("p2")
                    .kind("x/k", KindSpec.of(TypeTag.STRING, TypeTag.STRING))
                    .build();

            var registry = PluginRegistry.compose(first, second);

            assertThat(registry.requireKindSpec("x/k")).isEqualTo(KindSpec.of(TypeTag.STRING, TypeTag.STRING));
            assertThat(PluginRegistry.compose(second, first).requireKindSpec("x/k"))
                    .isEqualTo(KindSpec.of(TypeTag.NUMBER, TypeTag.NUMBER));
        }

        @Test
        @DisplayName("an override is logged at DEBUG with both plugin names")
        void overrideIsLogged() {
            var first = SimplePlugin.builder("p1").kind("x/k", KindSpec.of(TypeTag.ANY)).build();
            var second = SimplePlugin.builder("p2").kind("x/k", KindSpec.of(TypeTag.ANY)).build();

            PluginRegistry.compose(first, second);

            assertThat(logAppender.list)
                    .filteredOn(e -> e.getLevel() == Level.DEBUG)
                    .extracting(ILoggingEvent::getFormattedMessage)
                    .contains("Kind 'x/k' from plugin 'p2' overrides plugin 'p1'");
        }

        @Test
        @DisplayName("trait mappings from several plugins are merged per type")
        void traitMappingsMerge() {
            var registry = PluginRegistry.compose(Prelude.PLUGINS);

            assertThat(registry.trait("eq"))
                    .containsEntry(TypeTag.NUMBER, "num/eq")
                    .containsEntry(TypeTag.STRING, "str/eq")
                    .containsEntry(TypeTag.BOOLEAN, "bool/eq");
            assertThat(registry.traitOutput("eq")).isEqualTo(TypeTag.BOOLEAN);
            assertThat(registry.traitOutput("compare")).isEqualTo(TypeTag.NUMBER);
        }

        @Test
        @DisplayName("a later trait mapping for the same type replaces the earlier one")
        void laterTraitMappingWins() {
            var custom = SimplePlugin.builder("fuzzy")
                    .kind("fuzzy/eq", KindSpec.of(TypeTag.BOOLEAN, TypeTag.NUMBER, TypeTag.NUMBER))
                    .trait("eq", TraitDef.of(TypeTag.BOOLEAN, TypeTag.NUMBER, "fuzzy/eq"))
                    .build();

            var registry = PluginRegistry.compose(NumPlugin.INSTANCE, custom);

            assertThat(registry.trait("eq")).containsEntry(TypeTag.NUMBER, "fuzzy/eq");
        }

        @Test
        @DisplayName("lift mappings: the later plugin wins")
        void laterLiftWins() {
            var custom = SimplePlugin.builder("big")
                    .kind("big/literal", KindSpec.of(TypeTag.NUMBER))
                    .lift(TypeTag.NUMBER, "big/literal")
                    .build();

            assertThat(PluginRegistry.compose(NumPlugin.INSTANCE, custom).liftKind(TypeTag.NUMBER))
                    .contains("big/literal");
            assertThat(PluginRegistry.compose(custom, NumPlugin.INSTANCE).liftKind(TypeTag.NUMBER))
                    .contains("num/literal");
        }
    }

    @Nested
    @DisplayName("Lookups")
    class Lookups {

        @Test
        @DisplayName("intrinsic kinds are known without a plugin")
        void intrinsicKinds() {
            var registry = PluginRegistry.compose(List.of());

            assertThat(registry.knowsKind("core/tuple")).isTrue();
            assertThat(registry.knowsKind("core/access")).isTrue();
            assertThat(registry.outputOf("core/record")).isEqualTo(TypeTag.RECORD);
            assertThat(registry.outputOf("nope/x")).isEqualTo(TypeTag.ANY);
            assertThat(registry.liftKind(TypeTag.NUMBER)).isEmpty();
        }

        @Test
        @DisplayName("requireKindSpec fails on unknown kinds")
        void requireKindSpecFails() {
            var registry = PluginRegistry.compose(NumPlugin.INSTANCE);

            assertThatThrownBy(() -> registry.requireKindSpec("num/pow"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("num/pow");
        }

        @Test
        @DisplayName("the composed tables are unmodifiable")
        void tablesAreUnmodifiable() {
            var registry = PluginRegistry.compose(NumPlugin.INSTANCE);

            assertThatThrownBy(() -> registry.kindSpecs().put("x", KindSpec.of(TypeTag.ANY)))
                    .isInstanceOf(UnsupportedOperationException.class);
            assertThatThrownBy(() -> registry.liftMap().clear()).isInstanceOf(UnsupportedOperationException.class);
        }
    }

    @Nested
    @DisplayName("Handlers")
    class Handlers {

        private final SimplePlugin external = SimplePlugin.builder("http")
                .kind("http/get", KindSpec.of(TypeTag.RECORD, TypeTag.STRING))
                .build();

        @Test
        @DisplayName("a plugin with node kinds but no handlers is a configuration error")
        void missingHandlersRejected() {
            var registry = PluginRegistry.compose(NumPlugin.INSTANCE, external);

            assertThatThrownBy(registry::handlers)
                    .isInstanceOf(PluginConfigurationException.class)
                    .hasMessage("Plugin \"http\" has no default handlers and no override");
        }

        @Test
        @DisplayName("an override under the plugin name supplies the missing handlers")
        void overrideSuppliesHandlers() {
            Handler stub = node -> Step.done(Map.of("status", 200d));
            var registry = PluginRegistry.compose(NumPlugin.INSTANCE, external);

            Map<String, Handler> handlers = registry.handlers(Map.of("http", Map.of("http/get", stub)));

            assertThat(handlers).containsEntry("http/get", stub).containsKey("num/add");
        }

        @Test
        @DisplayName("an override replaces a plugin's defaults wholesale")
        void overrideReplacesDefaults() {
            Handler add = node -> Step.done(0d);
            Map<String, Handler> handlers = Interpreters.defaults(
                    List.of(NumPlugin.INSTANCE), Map.of("num", Map.of("num/add", add)));

            assertThat(handlers).containsOnlyKeys("num/add");
        }

        @Test
        @DisplayName("a plugin with no node kinds and no handlers is skipped")
        void emptyPluginSkipped() {
            var traitsOnly = SimplePlugin.builder("aliases").build();

            assertThat(Interpreters.defaults(List.of(NumPlugin.INSTANCE, traitsOnly), Map.of()))
                    .containsKey("num/literal");
        }
    }
}
