package com.demo.sidecar;

import com.myorg.scf.sidecar.config.ServiceSettings;
import com.myorg.scf.sidecar.sync.DependentRuntime;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Stand-in for a workflow engine that keeps its state in the sidecar's state store.
 * Cannot start until the state store has been discovered; the sync loop keeps trying.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DemoWorkflowRuntime implements DependentRuntime {

    private final ServiceSettings settings;
    private final AtomicBoolean running = new AtomicBoolean(false);

    @Override
    public String name() {
        return "demo-workflow";
    }

    @Override
    public void start() {
        if (running.get()) return;
        String store = settings.getStatestoreName();
        if (store == null || store.isBlank()) {
            throw new IllegalStateException("statestore not discovered yet");
        }
        if (running.compareAndSet(false, true)) {
            log.info("Workflow runtime started on statestore={}", store);
        }
    }

    @Override
    public void shutdown() {
        if (running.compareAndSet(true, false)) {
            log.info("Workflow runtime stopped");
        }
    }

    public boolean isRunning() {
        return running.get();
    }
}
