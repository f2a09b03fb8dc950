package com.minimax.games;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.minimax.core.Actor;
import com.minimax.core.Strategy;
import com.minimax.core.ai.SearchStrategy;
import com.minimax.games.tictactoe.CenterMassEvaluator;
import com.minimax.games.tictactoe.GameResult;
import com.minimax.games.tictactoe.LineScoreEvaluator;
import com.minimax.games.tictactoe.Placement;
import com.minimax.games.tictactoe.TicTacToeBoard;
import com.minimax.games.tictactoe.TicTacToeRule;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class SelfPlayTest {

    private static final TicTacToeRule RULE = TicTacToeRule.instance();

    @Test
    void perfectEnginesAlwaysDraw() {
        SelfPlay selfPlay = new SelfPlay(
                SearchStrategy.minimax(RULE, new CenterMassEvaluator(), 9),
                SearchStrategy.negamax(RULE, new LineScoreEvaluator(), 9));

        SelfPlay.Tally tally = selfPlay.playGames(2);

        assertEquals(new SelfPlay.Tally(2, 0, 0, 2), tally);
    }

    @Test
    void recordsEveryMoveOfAMatch() {
        Strategy<TicTacToeBoard, Placement> firstFree = (board, actor) -> RULE.legalActions(board, actor).stream()
                .findFirst();
        SelfPlay selfPlay = new SelfPlay(firstFree, firstFree);

        SelfPlay.Match match = selfPlay.playGame(TicTacToeBoard.empty(), Actor.FIRST);

        // row-major filling completes the first actor's anti-diagonal on the seventh move
        assertEquals(GameResult.win(Actor.FIRST), match.result());
        assertEquals(7, match.moves().size());
        assertEquals(new Placement(0, 0, Actor.FIRST), match.moves().get(0));
        assertEquals(match.finalBoard().result(), Optional.of(match.result()));
        assertEquals(new SelfPlay.Tally(1, 1, 0, 0), selfPlay.tally());
    }

    @Test
    void engineBeatsAWeakOpponent() {
        Strategy<TicTacToeBoard, Placement> firstFree = (board, actor) -> RULE.legalActions(board, actor).stream()
                .findFirst();
        SelfPlay selfPlay = new SelfPlay(firstFree, SearchStrategy.minimax(RULE, new CenterMassEvaluator(), 9));

        SelfPlay.Match match = selfPlay.playGame(TicTacToeBoard.empty(), Actor.FIRST);

        assertTrue(match.result().isWinFor(Actor.SECOND), () -> "Unexpected result " + match.result());
    }

    @Test
    void finishedStartRecordsTheResultWithoutMoves() {
        Strategy<TicTacToeBoard, Placement> unused = (board, actor) -> {
            throw new AssertionError("No move should be requested");
        };
        SelfPlay selfPlay = new SelfPlay(unused, unused);

        SelfPlay.Match match = selfPlay.playGame(TicTacToeBoard.parse("FSF/FSS/SFF"), Actor.FIRST);

        assertTrue(match.result().isDraw());
        assertTrue(match.moves().isEmpty());
        assertEquals(1, selfPlay.tally().draws());
    }

    @Test
    void failsWhenNeitherActorMoves() {
        Strategy<TicTacToeBoard, Placement> passing = (board, actor) -> Optional.empty();
        SelfPlay selfPlay = new SelfPlay(passing, passing);

        assertThrows(IllegalStateException.class, () -> selfPlay.playGame(TicTacToeBoard.empty(), Actor.FIRST));
    }

    @Test
    void rejectsInvalidGameCount() {
        Strategy<TicTacToeBoard, Placement> passing = (board, actor) -> Optional.empty();

        assertThrows(IllegalArgumentException.class, () -> new SelfPlay(passing, passing).playGames(0));
        assertThrows(NullPointerException.class, () -> new SelfPlay(null, passing));
    }
}
