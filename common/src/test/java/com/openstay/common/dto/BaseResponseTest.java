package com.openstay.common.dto;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class BaseResponseTest {

    @Test
    void success_carriesMessageAndData() {
        BaseResponse<String> response = BaseResponse.success("done", "payload");

        assertThat(response.isSuccess()).isTrue();
        assertThat(response.getMessage()).isEqualTo("done");
        assertThat(response.getData()).isEqualTo("payload");
        assertThat(response.getTimestamp()).isNotNull();
        assertThat(response.getRetryable()).isNull();
    }

    @Test
    void retryableError_isMarkedRetryable() {
        BaseResponse<Void> plain = BaseResponse.error("sold out", "NO_AVAILABILITY");
        BaseResponse<Void> retryable = BaseResponse.retryableError("busy", "CONCURRENT_CONFLICT");

        assertThat(plain.isSuccess()).isFalse();
        assertThat(plain.getRetryable()).isNull();
        assertThat(retryable.getRetryable()).isTrue();
        assertThat(retryable.getErrorCode()).isEqualTo("CONCURRENT_CONFLICT");
    }
}
