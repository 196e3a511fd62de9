package io.vizspec.core.model;

import static io.vizspec.core.testkit.TestSpecs.json;
import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class ChannelsTest {

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource(
            delimiter = '|',
            value = {
                "{\"field\": \"a\"}                      | true",
                "{\"aggregate\": \"count\"}              | true",
                "{\"field\": null}                       | false",
                "{\"value\": 3}                          | false",
                "[{\"value\": 1}, {\"field\": \"b\"}]    | true",
                "\"a\"                                   | false"
            })
    void fieldDefs(String def, boolean fieldDef) {
        assertThat(Channels.isFieldDef(json(def))).isEqualTo(fieldDef);
    }

    @ParameterizedTest
    @CsvSource({"x2, x", "y2, y", "color, color"})
    void primaryChannels(String channel, String primary) {
        assertThat(Channels.primaryChannel(channel)).isEqualTo(primary);
    }

    @ParameterizedTest(name = "\"{0}\" -> \"{1}\"")
    @CsvSource({"sales chart, sales_chart", "3d, _3d", "a-b.c, a_b_c", "plain, plain"})
    void varNames(String value, String name) {
        assertThat(Identifiers.varName(value)).isEqualTo(name);
    }
}
