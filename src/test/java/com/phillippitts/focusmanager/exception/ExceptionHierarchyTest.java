package com.phillippitts.focusmanager.exception;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void focusManagerExceptionShouldIncludeCause() {
        IOException cause = new IOException("IO failure");
        FocusManagerException ex = new FocusManagerException("wrapper error", cause);

        assertThat(ex.getMessage()).isEqualTo("wrapper error");
        assertThat(ex.getCause()).isEqualTo(cause);
    }

    @Test
    void arbitrationRejectedExceptionShouldIncludeExecutorName() {
        IllegalStateException cause = new IllegalStateException("pool shut down");
        ArbitrationRejectedException ex = new ArbitrationRejectedException("audio-focus-1", cause);

        assertThat(ex.getMessage()).contains("audio-focus-1");
        assertThat(ex.getExecutorName()).isEqualTo("audio-focus-1");
        assertThat(ex.getCause()).isEqualTo(cause);
    }

    @Test
    void allExceptionsShouldExtendBaseException() {
        assertThat(new ArbitrationRejectedException("x", null)).isInstanceOf(FocusManagerException.class);
        assertThat(new FocusManagerException("x", null)).isInstanceOf(RuntimeException.class);
    }
}
