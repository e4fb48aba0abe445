/*
 * P3IF — Pattern Integration Framework
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.p3if.core.exceptions;

public class DuplicateIdException extends RuntimeException {
    public DuplicateIdException(String kind, String id) {
        super(kind + " with id already exists: " + id);
    }
}
