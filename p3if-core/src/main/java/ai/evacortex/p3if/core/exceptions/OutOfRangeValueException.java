/*
 * P3IF — Pattern Integration Framework
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.p3if.core.exceptions;

public class OutOfRangeValueException extends RuntimeException {
    public OutOfRangeValueException(String field, double value) {
        super("Value of '" + field + "' must be within [0.0, 1.0], got " + value);
    }
}
