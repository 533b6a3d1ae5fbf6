package com.p14n.lineageflow.broadcast;

/**
 * @param zombiesBefore  zombie sessions present when cleanup started
 * @param zombiesRemoved zombie sessions removed
 */
public record CleanupResult(int zombiesBefore, int zombiesRemoved) {
}
