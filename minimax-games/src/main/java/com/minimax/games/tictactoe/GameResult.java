package com.minimax.games.tictactoe;

import com.minimax.core.Actor;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a finished match: a win for one actor, or a draw.
 */
public final class GameResult {

    private static final GameResult DRAW = new GameResult(null);

    private final Actor winner;

    private GameResult(Actor winner) {
        this.winner = winner;
    }

    public static GameResult win(Actor winner) {
        return new GameResult(Objects.requireNonNull(winner, "winner"));
    }

    public static GameResult draw() {
        return DRAW;
    }

    public Optional<Actor> winner() {
        return Optional.ofNullable(winner);
    }

    public boolean isDraw() {
        return winner == null;
    }

    public boolean isWinFor(Actor actor) {
        return winner == actor;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof GameResult)) {
            return false;
        }
        return winner == ((GameResult) other).winner;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(winner);
    }

    @Override
    public String toString() {
        return isDraw() ? "Draw" : "Win(" + winner + ")";
    }
}
