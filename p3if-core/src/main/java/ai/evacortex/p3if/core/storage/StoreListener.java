/*
 * P3IF — Pattern Integration Framework
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.p3if.core.storage;

import ai.evacortex.p3if.core.model.Pattern;
import ai.evacortex.p3if.core.model.Relationship;

/**
 * Receives every primitive mutation, on the mutating thread, while the write lock is held.
 * A listener that throws vetoes the mutation: the store restores its previous state and rethrows.
 */
public interface StoreListener {

    default void patternSaved(Pattern pattern) {}

    default void patternRemoved(String patternId) {}

    default void relationshipSaved(Relationship relationship) {}

    default void relationshipRemoved(String relationshipId) {}

    StoreListener NONE = new StoreListener() {};
}
