package com.minimax.games;

import com.minimax.core.Actor;
import com.minimax.core.Strategy;
import com.minimax.games.tictactoe.GameResult;
import com.minimax.games.tictactoe.Placement;
import com.minimax.games.tictactoe.TicTacToeBoard;
import com.minimax.games.tictactoe.TicTacToeRule;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Plays complete tic-tac-toe matches between two strategies and keeps a tally of the outcomes.
 */
public final class SelfPlay {

    private static final Logger LOGGER = Logger.getLogger(SelfPlay.class.getName());

    private final TicTacToeRule rule = TicTacToeRule.instance();
    private final Map<Actor, Strategy<TicTacToeBoard, Placement>> strategies = new EnumMap<>(Actor.class);

    private int gamesPlayed;
    private int firstWins;
    private int secondWins;
    private int draws;

    public SelfPlay(Strategy<TicTacToeBoard, Placement> first, Strategy<TicTacToeBoard, Placement> second) {
        strategies.put(Actor.FIRST, Objects.requireNonNull(first, "first"));
        strategies.put(Actor.SECOND, Objects.requireNonNull(second, "second"));
    }

    /**
     * Plays the requested number of matches, each from the empty board with {@link Actor#FIRST} to
     * move, and returns the tally over every match this instance played.
     */
    public Tally playGames(int gameCount) {
        if (gameCount < 1) {
            throw new IllegalArgumentException("Game count must be at least 1");
        }
        for (int i = 0; i < gameCount; i++) {
            playGame(TicTacToeBoard.empty(), Actor.FIRST);
        }
        return tally();
    }

    /**
     * Plays one match from the provided position until the rules declare it over.
     *
     * @throws IllegalStateException if neither actor can move in an unfinished position
     */
    public Match playGame(TicTacToeBoard start, Actor toMove) {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(toMove, "toMove");

        TicTacToeBoard board = start;
        Actor current = toMove;
        List<Placement> moves = new ArrayList<>();
        int consecutivePasses = 0;

        while (!rule.isTerminal(board)) {
            Placement move = strategies.get(current).selectAction(board, current).orElse(null);
            if (move == null) {
                consecutivePasses++;
                if (consecutivePasses > 1) {
                    throw new IllegalStateException("Neither actor can move on\n" + board);
                }
            } else {
                consecutivePasses = 0;
                board = rule.apply(board, move);
                moves.add(move);
            }
            current = current.opponent();
        }

        GameResult result = board.result().orElseThrow();
        recordResult(result);

        final int gameNumber = gamesPlayed;
        final int moveCount = moves.size();
        LOGGER.info(() -> String.format("Completed self-play game %d (moves=%d, result=%s)", gameNumber, moveCount,
                result));
        return new Match(board, result, moves);
    }

    public Tally tally() {
        return new Tally(gamesPlayed, firstWins, secondWins, draws);
    }

    private void recordResult(GameResult result) {
        gamesPlayed++;
        if (result.isDraw()) {
            draws++;
        } else if (result.isWinFor(Actor.FIRST)) {
            firstWins++;
        } else {
            secondWins++;
        }
    }

    /**
     * A finished match.
     */
    public record Match(TicTacToeBoard finalBoard, GameResult result, List<Placement> moves) {

        public Match {
            moves = List.copyOf(moves);
        }
    }

    /**
     * Outcome counts over the played matches.
     */
    public record Tally(int games, int firstWins, int secondWins, int draws) {
    }
}
