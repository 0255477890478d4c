package com.demo.sidecar;

import com.myorg.scf.sidecar.config.ServiceSettings;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DemoWorkflowRuntimeTest {

    @Test
    void start_waitsForStateStore_thenIsIdempotent() {
        ServiceSettings settings = new ServiceSettings();
        DemoWorkflowRuntime runtime = new DemoWorkflowRuntime(settings);

        assertThatThrownBy(runtime::start).isInstanceOf(IllegalStateException.class);
        assertThat(runtime.isRunning()).isFalse();

        settings.setStatestoreName("statestore");
        runtime.start();
        runtime.start();
        assertThat(runtime.isRunning()).isTrue();

        runtime.shutdown();
        assertThat(runtime.isRunning()).isFalse();
    }
}
