package com.titiplex.frost.core.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SigningRequestNoticeTest {

    @Test
    void previewUsesTemplateContent() {
        assertThat(SigningRequestNotice.preview("{\"kind\":1,\"content\":\"pay the plumber\"}"))
                .isEqualTo("pay the plumber");
    }

    @Test
    void longContentIsCut() {
        String content = "x".repeat(150);

        String preview = SigningRequestNotice.preview("{\"content\":\"" + content + "\"}");

        assertThat(preview).hasSize(SigningRequestNotice.PREVIEW_LIMIT);
        assertThat(preview).isEqualTo("x".repeat(97) + "...");
    }

    @Test
    void missingOrUnreadableContentFallsBackToDefault() {
        assertThat(SigningRequestNotice.preview(null)).isEqualTo(SigningRequestNotice.DEFAULT_PREVIEW);
        assertThat(SigningRequestNotice.preview("  ")).isEqualTo(SigningRequestNotice.DEFAULT_PREVIEW);
        assertThat(SigningRequestNotice.preview("{not json")).isEqualTo(SigningRequestNotice.DEFAULT_PREVIEW);
        assertThat(SigningRequestNotice.preview("{\"content\":42}")).isEqualTo(SigningRequestNotice.DEFAULT_PREVIEW);
        assertThat(SigningRequestNotice.preview("{\"kind\":1}")).isEqualTo(SigningRequestNotice.DEFAULT_PREVIEW);
    }
}
