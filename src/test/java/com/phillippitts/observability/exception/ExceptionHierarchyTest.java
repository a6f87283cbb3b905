package com.phillippitts.observability.exception;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void storageWriteExceptionNamesStorage() {
        StorageWriteException ex = new StorageWriteException("write rejected", "ring-buffer");

        assertThat(ex).isInstanceOf(ObservabilityException.class);
        assertThat(ex.getMessage()).contains("write rejected").contains("ring-buffer");
        assertThat(ex.getStorageName()).isEqualTo("ring-buffer");
    }

    @Test
    void storageWriteExceptionKeepsCause() {
        IllegalStateException cause = new IllegalStateException("disk full");
        StorageWriteException ex = new StorageWriteException("write rejected", "file", cause);

        assertThat(ex.getCause()).isSameAs(cause);
    }

    @Test
    void contextCleanupExceptionNamesRequest() {
        RuntimeException cause = new RuntimeException("teardown");
        ContextCleanupException ex = new ContextCleanupException("req-1", cause);

        assertThat(ex).isInstanceOf(ObservabilityException.class);
        assertThat(ex.getRequestId()).isEqualTo("req-1");
        assertThat(ex.getMessage()).contains("req-1");
        assertThat(ex.getCause()).isSameAs(cause);
    }

    @Test
    void observabilityExceptionsAreUnchecked() {
        assertThat(RuntimeException.class).isAssignableFrom(ObservabilityException.class);
    }
}
