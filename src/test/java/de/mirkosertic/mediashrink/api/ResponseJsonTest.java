package de.mirkosertic.mediashrink.api;

import de.mirkosertic.mediashrink.api.dto.SettingsResponse;
import de.mirkosertic.mediashrink.api.dto.SimpleMessageResponse;
import de.mirkosertic.mediashrink.api.dto.TaskActionResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ResponseJson Tests")
class ResponseJsonTest {

    @Test
    @DisplayName("Should omit null components")
    void shouldOmitNulls() {
        // When
        final String json = ResponseJson.toJson(SimpleMessageResponse.success("Queue paused"));

        // Then
        assertThat(json)
                .contains("\"success\":true")
                .contains("\"message\":\"Queue paused\"")
                .doesNotContain("error");
    }

    @Test
    @DisplayName("Should render violations of a rejected settings update")
    void shouldRenderViolations() {
        // When
        final String json = ResponseJson.toJson(SettingsResponse.invalid(List.of("video-crf must be between 0 and 63")));

        // Then
        assertThat(json)
                .contains("\"success\":false")
                .contains("\"violations\":[\"video-crf must be between 0 and 63\"]")
                .doesNotContain("\"settings\"");
    }

    @Test
    @DisplayName("isError should follow the success component")
    void isErrorFollowsSuccess() {
        assertThat(ResponseJson.isError(TaskActionResponse.error(1, "Task not found: 1"))).isTrue();
        assertThat(ResponseJson.isError(TaskActionResponse.success(1, "PENDING", "Task queued again"))).isFalse();
        assertThat(ResponseJson.isError("not a response"))
                .as("Non-record values are never errors")
                .isFalse();
    }
}
