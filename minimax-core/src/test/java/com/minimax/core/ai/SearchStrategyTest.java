package com.minimax.core.ai;

import static com.minimax.core.ai.TreeGame.branch;
import static com.minimax.core.ai.TreeGame.leaf;
import static com.minimax.core.ai.TreeGame.stuck;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.minimax.core.Actor;
import com.minimax.core.ai.TreeGame.Move;
import com.minimax.core.ai.TreeGame.Node;
import java.time.Duration;
import java.util.Optional;
import java.util.Random;
import org.junit.jupiter.api.Test;

class SearchStrategyTest {

    @Test
    void selectsActionThroughStaticEntryPoint() {
        Node root = branch(0, branch(0, leaf(1), leaf(-2)), branch(0, leaf(3), leaf(0)));

        Optional<Move> minimax = Strategies.selectAction(TreeGame.RULE, new TreeGame.Scores(), root, Actor.FIRST, 2);
        Optional<Move> negamax = Strategies.selectActionNegamax(TreeGame.RULE, new TreeGame.Scores(), root,
                Actor.FIRST, 2);

        assertEquals(Optional.of(new Move(1, Actor.FIRST)), minimax);
        assertEquals(minimax, negamax);
    }

    @Test
    void returnsEmptyOnlyWithoutLegalActions() {
        assertTrue(Strategies.selectAction(TreeGame.RULE, new TreeGame.Scores(), stuck(0), Actor.FIRST, 3).isEmpty());
        assertTrue(Strategies.selectAction(TreeGame.RULE, new TreeGame.Scores(), branch(0, stuck(0)), Actor.FIRST, 3)
                .isPresent());
    }

    @Test
    void repeatedCallsAreDeterministic() {
        Node tree = TreeGame.random(new Random(42L), 5, 4, 6);
        SearchStrategy<Node, Move, Integer> strategy = SearchStrategy.minimax(TreeGame.RULE, new TreeGame.Scores(), 5);

        for (Node position : TreeGame.allNodes(tree)) {
            Optional<Move> first = strategy.selectAction(position, Actor.SECOND);
            Optional<Move> again = strategy.selectAction(position, Actor.SECOND);
            assertEquals(first, again, "Same inputs must give the same action");
        }
    }

    @Test
    void strategyIsReusableAcrossPositions() {
        SearchStrategy<Node, Move, Integer> strategy = SearchStrategy.negamax(TreeGame.RULE, new TreeGame.Scores(), 1);

        assertEquals(Optional.of(new Move(1, Actor.FIRST)), strategy.selectAction(branch(0, leaf(1), leaf(2)),
                Actor.FIRST));
        assertEquals(Optional.of(new Move(0, Actor.FIRST)), strategy.selectAction(branch(0, leaf(2), leaf(1)),
                Actor.FIRST));
    }

    @Test
    void withConstraintsReplacesLimits() {
        SearchStrategy<Node, Move, Integer> strategy = SearchStrategy.minimax(TreeGame.RULE, new TreeGame.Scores(), 2);
        SearchConstraints limited = SearchConstraints.depth(6).withTimeLimit(Duration.ofSeconds(5));

        SearchStrategy<Node, Move, Integer> updated = strategy.withConstraints(limited);

        assertEquals(2, strategy.constraints().depthLimit());
        assertEquals(limited, updated.constraints());
    }

    @Test
    void rejectsNegativeDepth() {
        assertThrows(IllegalArgumentException.class,
                () -> Strategies.selectAction(TreeGame.RULE, new TreeGame.Scores(), leaf(0), Actor.FIRST, -1));
    }
}
