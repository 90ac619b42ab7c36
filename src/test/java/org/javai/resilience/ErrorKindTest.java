package org.javai.resilience;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ErrorKindTest {

    @Test
    void transientKinds_areRetryableByDefault() {
        assertThat(ErrorKind.NETWORK.isRetryableByDefault()).isTrue();
        assertThat(ErrorKind.TIMEOUT.isRetryableByDefault()).isTrue();
        assertThat(ErrorKind.RATE_LIMIT.isRetryableByDefault()).isTrue();
        assertThat(ErrorKind.API.isRetryableByDefault()).isTrue();
    }

    @Test
    void authenticationAndConfiguration_abortWithoutRetry() {
        for (ErrorKind kind : new ErrorKind[]{ErrorKind.AUTHENTICATION, ErrorKind.CONFIGURATION}) {
            assertThat(kind.defaultSeverity()).isEqualTo(Severity.HIGH);
            assertThat(kind.defaultStrategy()).isEqualTo(RecoveryStrategy.ABORT);
            assertThat(kind.isRetryableByDefault()).isFalse();
        }
    }

    @Test
    void memoryAndResourceExhaustion_areCritical() {
        assertThat(ErrorKind.MEMORY.defaultSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(ErrorKind.RESOURCE_EXHAUSTION.defaultSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(ErrorKind.RESOURCE_EXHAUSTION.defaultStrategy()).isEqualTo(RecoveryStrategy.DEGRADE);
    }

    @Test
    void dataKinds_fallBackOrSkip() {
        assertThat(ErrorKind.MISSING_DATA.defaultStrategy()).isEqualTo(RecoveryStrategy.FALLBACK);
        assertThat(ErrorKind.PROCESSING.defaultStrategy()).isEqualTo(RecoveryStrategy.FALLBACK);
        assertThat(ErrorKind.VALIDATION.defaultStrategy()).isEqualTo(RecoveryStrategy.SKIP);
        assertThat(ErrorKind.BUSINESS_LOGIC.defaultSeverity()).isEqualTo(Severity.LOW);
    }

    @Test
    void severity_isAtLeast_followsDeclarationOrder() {
        assertThat(Severity.CRITICAL.isAtLeast(Severity.HIGH)).isTrue();
        assertThat(Severity.MEDIUM.isAtLeast(Severity.MEDIUM)).isTrue();
        assertThat(Severity.LOW.isAtLeast(Severity.MEDIUM)).isFalse();
    }
}
