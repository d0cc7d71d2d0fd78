package com.elssolution.hydromonitor.alerts;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/** Last-resort handler: anything escaping a thread becomes a CRITICAL alert. */
@Slf4j
@Component
@RequiredArgsConstructor
public class GlobalUncaughtHandler implements Thread.UncaughtExceptionHandler {

    private final AlertService alerts;

    private volatile boolean stopping = false; // quiet during shutdown

    @PostConstruct
    void registerAsDefault() {
        Thread.setDefaultUncaughtExceptionHandler(this);
        log.info("Global uncaught handler installed");
    }

    @EventListener
    public void onContextClosed(ContextClosedEvent e) {
        stopping = true;
    }

    @Override
    public void uncaughtException(Thread t, Throwable e) {
        if (stopping) return;
        String key = (t.getName() != null && t.getName().startsWith("hm-sched-")) ? "POLLER_UNCAUGHT" : "UNCAUGHT";
        log.error("Uncaught in {} -> {}", t.getName(), e.toString(), e);
        alerts.raise(key, e.toString(), AlertService.Severity.CRITICAL);
    }
}
