package com.minimax.core.ai;

import static com.minimax.core.ai.TreeGame.branch;
import static com.minimax.core.ai.TreeGame.leaf;
import static com.minimax.core.ai.TreeGame.stuck;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.minimax.core.Actor;
import com.minimax.core.IntPayoffScale;
import com.minimax.core.NegatingPayoffScale;
import com.minimax.core.ZeroSumEvaluator;
import com.minimax.core.ai.TreeGame.Move;
import com.minimax.core.ai.TreeGame.Node;
import java.util.List;
import org.junit.jupiter.api.Test;

class NegamaxSearcherTest {

    private static Node classicTree() {
        return branch(0,
                branch(0, leaf(3), leaf(12), leaf(8)),
                branch(0, leaf(2), leaf(4), leaf(6)),
                branch(0, leaf(14), leaf(5), leaf(2)));
    }

    private static SearchResult<Move, Integer> search(Node root, Actor actor, int depth) {
        return new NegamaxSearcher<>(TreeGame.RULE, new TreeGame.Scores())
                .search(root, actor, SearchConstraints.depth(depth));
    }

    @Test
    void choosesMaximinAction() {
        SearchResult<Move, Integer> result = search(classicTree(), Actor.FIRST, 2);

        assertEquals(new Move(0, Actor.FIRST), result.action());
        assertEquals(3, result.payoff(), "Root payoff is reported for the searching actor");
        assertEquals(List.of(new Move(0, Actor.FIRST), new Move(0, Actor.SECOND)), result.principalVariation());
        assertEquals(2L, result.telemetry().cutoffs());
    }

    @Test
    void reportsEveryScoredRootAlternative() {
        SearchResult<Move, Integer> result = search(classicTree(), Actor.FIRST, 2);

        assertEquals(List.of(
                new SearchResult.Alternative<>(new Move(0, Actor.FIRST), 3),
                new SearchResult.Alternative<>(new Move(1, Actor.FIRST), 2),
                new SearchResult.Alternative<>(new Move(2, Actor.FIRST), 2)),
                result.rootAlternatives());
    }

    @Test
    void keepsFirstFoundActionOnTies() {
        SearchResult<Move, Integer> result = search(branch(0, leaf(5), leaf(7), leaf(7)), Actor.FIRST, 1);

        assertEquals(new Move(1, Actor.FIRST), result.action());
    }

    @Test
    void searchesForTheSecondActor() {
        Node root = branch(0, leaf(5), leaf(-3));

        SearchResult<Move, Integer> result = search(root, Actor.SECOND, 1);

        assertEquals(new Move(1, Actor.SECOND), result.action());
        assertEquals(3, result.payoff());
    }

    @Test
    void skipsChildrenWithoutLegalContinuation() {
        Node root = branch(0, branch(0, stuck(100)), leaf(-5));

        SearchResult<Move, Integer> result = search(root, Actor.FIRST, 3);

        assertEquals(new Move(1, Actor.FIRST), result.action());
        assertEquals(-5, result.payoff());
        assertEquals(1, result.rootAlternatives().size(), "The undecided child is not an alternative");
    }

    @Test
    void returnsNoActionWithoutLegalMoves() {
        assertTrue(search(stuck(3), Actor.SECOND, 2).bestAction().isEmpty());
        assertTrue(search(leaf(3), Actor.FIRST, 2).bestAction().isEmpty());
    }

    @Test
    void fallsBackToFirstActionWhenInterrupted() {
        SearchConstraints constraints = SearchConstraints.depth(2).withStopSignal(() -> true);

        SearchResult<Move, Integer> result = new NegamaxSearcher<>(TreeGame.RULE, new TreeGame.Scores())
                .search(classicTree(), Actor.FIRST, constraints);

        assertTrue(result.timedOut());
        assertEquals(new Move(0, Actor.FIRST), result.action());
        assertNull(result.payoff());
    }

    @Test
    void evaluatorBreakingTheZeroSumLawStillYieldsLegalMoves() {
        ZeroSumEvaluator<Node, Integer> broken = new ZeroSumEvaluator<>() {
            @Override
            public Integer scoreFor(Actor actor, Node state) {
                return state.value;
            }

            @Override
            public NegatingPayoffScale<Integer> scale() {
                return IntPayoffScale.instance();
            }
        };

        SearchResult<Move, Integer> result = new NegamaxSearcher<>(TreeGame.RULE, broken)
                .search(classicTree(), Actor.FIRST, SearchConstraints.depth(2));

        assertTrue(result.action().index() < 3);
    }
}
