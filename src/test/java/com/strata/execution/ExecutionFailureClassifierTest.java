package com.strata.execution;

import com.strata.domain.FailureKind;
import com.strata.storage.PartitionNotFoundException;
import com.strata.storage.StorageOperationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ExecutionFailureClassifier Tests")
class ExecutionFailureClassifierTest {

    private final ExecutionFailureClassifier classifier = new ExecutionFailureClassifier();

    @Test
    @DisplayName("Should keep the kind reported by the storage engine")
    void shouldUseStorageFailureKind() {
        // Given
        Exception wrapped = new ExecutionException(new StorageOperationException(
            "Tablespace offline", "relocate", "sales.P_2024_11", FailureKind.RETRYABLE));

        // When / Then
        assertThat(classifier.classify(wrapped)).isEqualTo(FailureKind.RETRYABLE);
        assertThat(classifier.errorCode(wrapped)).isEqualTo("STORAGE_RELOCATE");
        assertThat(classifier.classify(new PartitionNotFoundException("drop", "sales.P_2010")))
            .isEqualTo(FailureKind.TERMINAL);
    }

    @Test
    @DisplayName("Should classify by exception type")
    void shouldClassifyByType() {
        // When / Then
        assertThat(classifier.classify(new CompletionException(new TimeoutException()))).isEqualTo(FailureKind.RETRYABLE);
        assertThat(classifier.classify(new IllegalArgumentException("no codec"))).isEqualTo(FailureKind.TERMINAL);
        assertThat(classifier.classify(new QueryTimeoutException("slow"))).isEqualTo(FailureKind.RETRYABLE);
        assertThat(classifier.classify(new DataIntegrityViolationException("bad"))).isEqualTo(FailureKind.TERMINAL);
        assertThat(classifier.classify(new RuntimeException("glitch"))).isEqualTo(FailureKind.RETRYABLE);
    }

    @Test
    @DisplayName("Should name unknown errors by their type")
    void shouldDeriveErrorCode() {
        // When / Then
        assertThat(classifier.errorCode(new TimeoutException())).isEqualTo("TIMEOUT");
        assertThat(classifier.errorCode(new CompletionException(new IllegalStateException("x"))))
            .isEqualTo("IllegalStateException");
    }
}
