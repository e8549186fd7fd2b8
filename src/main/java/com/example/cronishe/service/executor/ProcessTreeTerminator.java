package com.example.cronishe.service.executor;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Best-effort termination of a process and everything it spawned.
 * <p>
 * Descendants are signalled before the root so they are not reparented away
 * from the tree first. Processes that are already gone are ignored.
 */
@Slf4j
@Component
public class ProcessTreeTerminator {

    /**
     * Ask the process {@code pid} and its descendants to terminate.
     *
     * @return true if the root process was found and signalled
     */
    public boolean terminate(long pid) {
        var handle = ProcessHandle.of(pid).orElse(null);
        if (handle == null || !handle.isAlive()) {
            log.info("Process {} already exited, nothing to terminate", pid);
            return false;
        }

        try {
            var descendants = handle.descendants().toList();
            descendants.forEach(child -> {
                if (!child.destroy()) {
                    log.debug("Could not signal child process {} of {}", child.pid(), pid);
                }
            });

            var signalled = handle.destroy();
            log.info("Sent termination to process {} and {} descendant(s), accepted: {}", pid, descendants.size(), signalled);
            return signalled;
        } catch (SecurityException | UnsupportedOperationException e) {
            log.warn("Could not terminate process {}: {}", pid, e.getMessage());
            return false;
        }
    }
}
