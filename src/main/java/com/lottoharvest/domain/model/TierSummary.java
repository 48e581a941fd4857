package com.lottoharvest.domain.model;

import java.util.Map;

/**
 * Counts for one tier of one round.
 *
 * @param byRegion     store count per region code, online and unclassified excluded
 * @param online       stores selling through the online channel
 * @param unclassified stores whose region could not be read
 * @param offline      every store that is not online
 * @param total        distinct stores of the tier
 */
public record TierSummary(Map<String, Integer> byRegion, int online, int unclassified, int offline, int total) {
}
