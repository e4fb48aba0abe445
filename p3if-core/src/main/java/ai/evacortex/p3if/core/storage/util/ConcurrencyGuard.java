/*
 * P3IF — Pattern Integration Framework
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.p3if.core.storage.util;

import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * The single lock shared by every component of one store instance.
 *
 * <p>Writers (pattern/relationship mutation, hot-swap, multiplex, cache invalidation) hold the write
 * side; readers and metrics recomputation hold the read side. The lock is reentrant, so composite
 * operations that already hold the write lock may call primitive operations freely.</p>
 */
public final class ConcurrencyGuard {

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public AutoLock read() {
        return AutoLock.acquire(lock.readLock());
    }

    public AutoLock write() {
        return AutoLock.acquire(lock.writeLock());
    }
}
