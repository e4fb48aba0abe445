/*
 * P3IF — Pattern Integration Framework
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.p3if.core.engine;

import java.util.List;

/**
 * Outcome of one multiplex batch.
 *
 * @param integrated              external patterns registered
 * @param skipped                 external patterns matching an existing (type, name, domain) or unbuildable
 * @param conflicts               external patterns whose id is already taken
 * @param relationshipsIntegrated external relationships registered
 * @param relationshipsRejected   external relationships refused (dangling, out of range, duplicate id)
 * @param failures                one line per skipped, conflicting or rejected item
 */
public record MultiplexResult(
        int integrated,
        int skipped,
        int conflicts,
        int relationshipsIntegrated,
        int relationshipsRejected,
        List<String> failures
) {
    public MultiplexResult {
        failures = List.copyOf(failures);
    }

    public boolean complete() {
        return skipped == 0 && conflicts == 0 && relationshipsRejected == 0;
    }
}
