package com.rozet.locking;

import org.junit.jupiter.api.Test;

import static org.mockito.Mockito.*;

class LockMaintenanceTaskTest {

    @Test
    void testSweepDelegatesToManager() {
        FileLockManager manager = mock(FileLockManager.class);
        when(manager.cleanupExpired()).thenReturn(2);

        new LockMaintenanceTask(manager).sweepExpiredLocks();

        verify(manager).cleanupExpired();
    }
}
