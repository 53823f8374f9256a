package com.civicgate.capability;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("OperationDescriptor")
class OperationDescriptorTest {

    @Test
    @DisplayName("builder should default to an unauthenticated core read")
    void shouldApplyDefaults() {
        OperationDescriptor d = OperationDescriptor.builder("init")
                .handler(input -> OperationOutcome.success("{}"))
                .build();

        assertThat(d.group()).isEqualTo("core");
        assertThat(d.risk()).isEqualTo(RiskLevel.READ);
        assertThat(d.category()).isEqualTo("core");
        assertThat(d.requiresAuthentication()).isFalse();
        assertThat(d.inputSchema().properties()).isEmpty();
    }

    @Test
    @DisplayName("should require a handler")
    void shouldRequireHandler() {
        assertThatThrownBy(() -> OperationDescriptor.builder("x").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("handler");
    }

    @Test
    @DisplayName("OperationOutcome failure should require an error message")
    void failureShouldRequireError() {
        assertThatThrownBy(() -> OperationOutcome.failure(" "))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(OperationOutcome.success(null).text()).isEmpty();
    }

    @Test
    @DisplayName("OperationInput should expose typed accessors")
    void inputShouldExposeTypedValues() {
        var input = new OperationInput(Map.of(
                "summary", "done",
                "blank", " ",
                "telemetry", true,
                "enable", List.of("mdms", "pgr"),
                "messages", List.of(Map.of("turn", 1, "role", "user"), "junk")), "s-1");

        assertThat(input.string("summary")).contains("done");
        assertThat(input.string("blank")).isEmpty();
        assertThat(input.bool("telemetry", false)).isTrue();
        assertThat(input.bool("missing", true)).isTrue();
        assertThat(input.strings("enable")).containsExactly("mdms", "pgr");
        assertThat(input.objects("messages")).hasSize(1);
    }

    @Test
    @DisplayName("GroupCatalog should list all unknown ids in one error")
    void catalogShouldAggregateUnknownIds() {
        assertThatThrownBy(() -> GroupCatalog.platformDefault().requireKnown(List.of("a", "mdms", "b")))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("a, b");
    }
}
