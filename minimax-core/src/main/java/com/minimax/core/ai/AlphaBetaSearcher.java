package com.minimax.core.ai;

import com.minimax.core.Action;
import com.minimax.core.Actor;
import com.minimax.core.Evaluator;
import com.minimax.core.GameRule;
import com.minimax.core.PayoffScale;
import com.minimax.core.ai.state.SearchAbortedException;
import com.minimax.core.ai.state.SearchState;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Minimax searcher with alpha-beta pruning.
 *
 * <p>Every position is scored from the searching actor's point of view. Nodes where the searching
 * actor moves keep the child with the strictly higher payoff, nodes where the opponent moves keep
 * the strictly lower one, so on ties the first child in enumeration order wins. Each node keeps
 * only its best child, which bounds memory by the search depth.
 *
 * @param <S> the position type
 * @param <A> the action type
 * @param <P> the payoff type
 */
public final class AlphaBetaSearcher<S, A extends Action, P> implements Searcher<S, A, P> {

    private static final Logger LOGGER = Logger.getLogger(AlphaBetaSearcher.class.getName());

    private final GameRule<S, A> rule;
    private final Evaluator<S, P> evaluator;
    private final PayoffScale<P> scale;
    private final boolean pruning;

    public AlphaBetaSearcher(GameRule<S, A> rule, Evaluator<S, P> evaluator) {
        this(rule, evaluator, true);
    }

    /**
     * @param pruning {@code false} to explore the full width of the tree, which only makes the
     *        search slower and is meant for checking pruned results
     */
    public AlphaBetaSearcher(GameRule<S, A> rule, Evaluator<S, P> evaluator, boolean pruning) {
        this.rule = Objects.requireNonNull(rule, "rule");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.scale = Objects.requireNonNull(evaluator.scale(), "scale");
        this.pruning = pruning;
        if (scale.compare(scale.min(), scale.max()) > 0) {
            throw new IllegalArgumentException("Payoff scale minimum exceeds its maximum");
        }
    }

    @Override
    public SearchResult<A, P> search(S state, Actor actor, SearchConstraints constraints) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(actor, "actor");
        Objects.requireNonNull(constraints, "constraints");

        int depth = Math.max(1, constraints.depthLimit());
        SearchState searchState = SearchState.start(constraints);

        if (rule.isTerminal(state)) {
            LOGGER.fine("Root position is terminal, no action to select");
            return SearchResult.noAction(depth, searchState.telemetry());
        }
        List<A> rootActions = rule.legalActions(state, actor);
        if (rootActions.isEmpty()) {
            LOGGER.fine(() -> String.format("%s has no legal action", actor));
            return SearchResult.noAction(depth, searchState.telemetry());
        }

        SearchNode<S, A, P> root = SearchNode.root(state);
        boolean timedOut = false;
        try {
            searchState.visit();
            expand(depth, root, rootActions, actor, Window.full(scale), actor, searchState);
        } catch (SearchAbortedException ex) {
            timedOut = true;
        }

        Optional<SearchNode<S, A, P>> best = root.bestChild();
        A action = best.flatMap(SearchNode::cause).orElse(rootActions.get(0));
        P payoff = best.isPresent() ? root.payoff() : null;
        List<A> line = best.isPresent() ? root.principalVariation() : List.of(action);
        SearchTelemetry telemetry = searchState.telemetry();

        final boolean interrupted = timedOut;
        LOGGER.fine(() -> String.format(
                "Alpha-beta explored %d nodes (depth=%d, cutoffs=%d, pruning=%b, timedOut=%b)",
                telemetry.visitedNodes(), depth, telemetry.cutoffs(), pruning, interrupted));

        return new SearchResult<>(action, payoff, depth, timedOut, telemetry, line, List.of());
    }

    /**
     * Computes the payoff of a node for the searching actor.
     *
     * @return the payoff, or {@code null} when the node is neither terminal nor at the depth
     *         limit and no continuation below it could be scored
     */
    private P alphaBeta(int remainingDepth, SearchNode<S, A, P> node, Window<P> window, Actor searching,
            SearchState searchState) {
        if (!window.isValid(scale)) {
            throw new IllegalStateException("Malformed search window " + window);
        }
        searchState.visit();

        if (remainingDepth == 0 || rule.isTerminal(node.state())) {
            P evaluation = evaluator.scoreFor(searching, node.state());
            searchState.recordEvaluation();
            node.score(evaluation);
            return evaluation;
        }

        // the root is handled by search(), so every node here has a cause
        Actor toMove = node.cause().map(action -> action.actor().opponent()).orElse(searching);
        List<A> actions = rule.legalActions(node.state(), toMove);
        if (actions.isEmpty()) {
            return null;
        }
        return expand(remainingDepth, node, actions, toMove, window, searching, searchState);
    }

    private P expand(int remainingDepth, SearchNode<S, A, P> node, List<A> actions, Actor toMove,
            Window<P> window, Actor searching, SearchState searchState) {
        boolean maximizing = toMove == searching;
        Window<P> current = window;

        for (A action : actions) {
            SearchNode<S, A, P> child = SearchNode.child(rule.apply(node.state(), action), action);
            P childPayoff = alphaBeta(remainingDepth - 1, child, current, searching, searchState);
            if (childPayoff == null) {
                continue;
            }

            P best = node.payoff();
            if (best != null) {
                boolean preferred = maximizing
                        ? scale.isBetter(childPayoff, best)
                        : scale.isWorse(childPayoff, best);
                if (!preferred) {
                    continue;
                }
            }
            node.promote(child, childPayoff);
            if (!pruning) {
                continue;
            }

            Optional<Window<P>> narrowed = maximizing
                    ? current.raiseLow(scale, childPayoff)
                    : current.lowerHigh(scale, childPayoff);
            if (narrowed.isEmpty()) {
                searchState.recordCutoff();
                break;
            }
            current = narrowed.get();
        }
        return node.payoff();
    }
}
