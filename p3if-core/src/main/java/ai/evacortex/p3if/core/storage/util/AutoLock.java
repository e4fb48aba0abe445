/*
 * P3IF — Pattern Integration Framework
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.p3if.core.storage.util;

import java.util.concurrent.locks.Lock;

/**
 * One held side of a {@link ConcurrencyGuard}, released by try-with-resources.
 * Closing twice releases once.
 */
public final class AutoLock implements AutoCloseable {
    private final Lock lock;
    private boolean held;

    private AutoLock(Lock lock) {
        this.lock = lock;
        lock.lock();
        this.held = true;
    }

    static AutoLock acquire(Lock lock) {
        return new AutoLock(lock);
    }

    @Override
    public void close() {
        if (!held) return;
        held = false;
        lock.unlock();
    }
}
