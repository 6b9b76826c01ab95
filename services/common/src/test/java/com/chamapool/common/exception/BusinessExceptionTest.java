package com.chamapool.common.exception;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("BusinessException Tests")
class BusinessExceptionTest {

    @Test
    @DisplayName("Should prefix the message with the error code")
    void shouldFormatMessage() {
        BusinessException defaultMessage = new BusinessException(ErrorCode.GROUP_NOT_ADMIN);
        BusinessException custom = new BusinessException(ErrorCode.GROUP_FULL, "Group 7 is full");

        assertThat(defaultMessage.getMessage()).isEqualTo("[GROUP_AUTH_001] Not admin");
        assertThat(custom.getMessage()).isEqualTo("[GROUP_CAPACITY_001] Group 7 is full");
        assertThat(defaultMessage.getErrorId()).isNotEqualTo(custom.getErrorId());
    }

    @Test
    @DisplayName("Should fall back to the internal error code")
    void shouldDefaultErrorCode() {
        BusinessException exception = new BusinessException(null, "boom");

        assertThat(exception.getErrorCode()).isEqualTo(ErrorCode.SYS_INTERNAL_ERROR);
        assertThat(exception.getStatus()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(exception.getMessage()).isEqualTo("boom");
    }

    @Test
    @DisplayName("Should collect metadata and ignore null entries")
    void shouldCollectMetadata() {
        BusinessException exception = new BusinessException(ErrorCode.GROUP_NOT_FOUND)
                .withMetadata("groupId", "7")
                .withMetadata("ignored", null);

        assertThat(exception.getMetadata()).containsOnlyKeys("groupId");
        assertThatThrownBy(() -> exception.getMetadata().put("x", "y"))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
