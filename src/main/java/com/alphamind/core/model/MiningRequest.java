package com.alphamind.core.model;

import java.util.List;

/**
 * Request to start a factor-mining task.
 *
 * @param direction            initial research direction; nullable
 * @param directions           pre-planned branch directions; when non-empty they replace {@code direction}
 * @param numDirections        number of exploration directions the trial should plan; nullable
 * @param maxRounds            evolution rounds; nullable, defaults to 3
 * @param maxLoops             iterations per direction; nullable
 * @param factorsPerHypothesis factors per hypothesis; nullable
 * @param librarySuffix        factor library file suffix; nullable
 * @param parallel             run branches concurrently; nullable, falls back to configuration
 */
public record MiningRequest(
    String direction,
    List<String> directions,
    Integer numDirections,
    Integer maxRounds,
    Integer maxLoops,
    Integer factorsPerHypothesis,
    String librarySuffix,
    Boolean parallel
) {

    public static final int DEFAULT_MAX_ROUNDS = 3;

    public int effectiveMaxRounds() {
        return maxRounds != null && maxRounds > 0 ? maxRounds : DEFAULT_MAX_ROUNDS;
    }

    /**
     * Directions to fan out over. An empty result means a single unnamed branch.
     */
    public List<String> branchDirections() {
        if (directions != null && !directions.isEmpty()) {
            return directions;
        }
        if (direction != null && !direction.isBlank()) {
            return List.of(direction);
        }
        return List.of();
    }
}
