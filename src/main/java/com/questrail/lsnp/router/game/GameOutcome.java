package com.questrail.lsnp.router.game;

import java.util.List;
import java.util.Objects;

/**
 * Terminal result of a game.
 */
public sealed interface GameOutcome
{
    /**
     * @param line the three winning positions (1..9), ascending
     */
    record Win(Symbol symbol, List<Integer> line) implements GameOutcome
    {
        public Win {
            Objects.requireNonNull(symbol, "symbol");
            line = List.copyOf(line);
            if (line.size() != 3) {
                throw new IllegalArgumentException("A winning line has three positions");
            }
        }
    }

    record Draw() implements GameOutcome {}
}
