package org.kwindex.runtime;

import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.kwindex.runtime.value.Value;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class RuntimeSettingsTest {

    @Test
    void testReferenceConfigMatchesDefaults() {
        RuntimeSettings settings = RuntimeSettings.fromConfig(ConfigFactory.defaultReference());

        assertThat(settings).isEqualTo(RuntimeSettings.DEFAULTS);
    }

    @Test
    void testOverridesAreRead() {
        RuntimeSettings settings = RuntimeSettings.fromConfig(ConfigFactory.parseString(
                "kwindex { usage.quote-leading-word = false, lookup.default-label = mode }"));

        assertThat(settings.quoteLeadingWord()).isFalse();
        assertThat(settings.defaultLabel()).isEqualTo("mode");
    }

    @Test
    void testMissingBlockFails() {
        assertThatThrownBy(() -> RuntimeSettings.fromConfig(ConfigFactory.empty()))
                .isInstanceOf(ConfigException.Missing.class);
    }

    @Test
    void testFormatterHonorsLeadingWordSetting() {
        RuntimeSettings settings = new RuntimeSettings(false, "option");

        assertThat(settings.newFormatter().format(List.of(Value.of("a b")), null, null))
                .isEqualTo("wrong # args: should be \"a b\"");
    }
}
