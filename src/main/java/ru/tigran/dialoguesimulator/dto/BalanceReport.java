package ru.tigran.dialoguesimulator.dto;

import java.util.Map;

/**
 * Post-hoc balance check of completed conversations.
 *
 * @param balanced true when cell counts differ by at most the tolerance
 * @param counts completed conversations per "group_intervention" cell, planned cells with no success included as 0
 */
public record BalanceReport(
        boolean balanced,
        Map<String, Integer> counts
) {
}
