package com.rozet.locking;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class LockMaintenanceTask {

    private final FileLockManager fileLockManager;

    @Scheduled(fixedDelayString = "${rozet.locks.cleanup-interval:PT60S}",
            initialDelayString = "${rozet.locks.cleanup-interval:PT60S}")
    public void sweepExpiredLocks() {
        int removed = fileLockManager.cleanupExpired();
        if (removed > 0) {
            log.info("Removed {} expired file locks.", removed);
        }
    }
}
