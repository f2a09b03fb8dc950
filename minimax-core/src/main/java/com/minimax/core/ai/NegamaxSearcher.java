package com.minimax.core.ai;

import com.minimax.core.Action;
import com.minimax.core.Actor;
import com.minimax.core.GameRule;
import com.minimax.core.NegatingPayoffScale;
import com.minimax.core.ZeroSumEvaluator;
import com.minimax.core.ai.state.SearchAbortedException;
import com.minimax.core.ai.state.SearchState;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Negamax searcher with alpha-beta pruning.
 *
 * <p>Each node is scored for the actor to move in it, children's payoffs are negated before they
 * are compared and the window is negated and swapped on the way down. As long as the evaluator
 * obeys the zero-sum law this selects the same actions as {@link AlphaBetaSearcher}.
 *
 * <p>The searched tree is kept whole, so the result also reports every scored root alternative.
 *
 * @param <S> the position type
 * @param <A> the action type
 * @param <P> the payoff type
 */
public final class NegamaxSearcher<S, A extends Action, P> implements Searcher<S, A, P> {

    private static final Logger LOGGER = Logger.getLogger(NegamaxSearcher.class.getName());

    private final GameRule<S, A> rule;
    private final ZeroSumEvaluator<S, P> evaluator;
    private final NegatingPayoffScale<P> scale;

    public NegamaxSearcher(GameRule<S, A> rule, ZeroSumEvaluator<S, P> evaluator) {
        this.rule = Objects.requireNonNull(rule, "rule");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.scale = Objects.requireNonNull(evaluator.scale(), "scale");
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

        BranchingNode<S, A, P> root = BranchingNode.root(state);
        boolean timedOut = false;
        try {
            searchState.visit();
            expand(depth, root, rootActions, Window.full(scale), searchState);
        } catch (SearchAbortedException ex) {
            timedOut = true;
        }

        Optional<BranchingNode<S, A, P>> best = root.bestChild();
        A action = best.flatMap(BranchingNode::cause).orElse(rootActions.get(0));
        P payoff = best.isPresent() ? root.payoff() : null;
        List<A> line = best.isPresent() ? root.principalVariation() : List.of(action);
        List<SearchResult.Alternative<A, P>> alternatives = new ArrayList<>();
        for (BranchingNode<S, A, P> child : root.children()) {
            if (child.hasPayoff() && child.cause().isPresent()) {
                alternatives.add(new SearchResult.Alternative<>(child.cause().get(), scale.negate(child.payoff())));
            }
        }
        SearchTelemetry telemetry = searchState.telemetry();

        final boolean interrupted = timedOut;
        LOGGER.fine(() -> String.format("Negamax explored %d nodes (depth=%d, cutoffs=%d, timedOut=%b)",
                telemetry.visitedNodes(), depth, telemetry.cutoffs(), interrupted));

        return new SearchResult<>(action, payoff, depth, timedOut, telemetry, line, alternatives);
    }

    /**
     * Computes the payoff of a node for the actor to move in it.
     *
     * @return the payoff, or {@code null} when no continuation below the node could be scored
     */
    private P negamax(int remainingDepth, BranchingNode<S, A, P> node, Window<P> window, Actor toMove,
            SearchState searchState) {
        if (!window.isValid(scale)) {
            throw new IllegalStateException("Malformed search window " + window);
        }
        searchState.visit();

        if (remainingDepth == 0 || rule.isTerminal(node.state())) {
            P evaluation = evaluator.scoreFor(toMove, node.state());
            searchState.recordEvaluation();
            node.score(evaluation);
            return evaluation;
        }

        List<A> actions = rule.legalActions(node.state(), toMove);
        if (actions.isEmpty()) {
            return null;
        }
        return expand(remainingDepth, node, actions, window, searchState);
    }

    private P expand(int remainingDepth, BranchingNode<S, A, P> node, List<A> actions, Window<P> window,
            SearchState searchState) {
        Window<P> current = window;

        for (A action : actions) {
            BranchingNode<S, A, P> child = BranchingNode.child(rule.apply(node.state(), action), action);
            node.addChild(child);
            P childPayoff = negamax(remainingDepth - 1, child, current.negated(scale), action.actor().opponent(),
                    searchState);
            if (childPayoff == null) {
                continue;
            }

            P value = scale.negate(childPayoff);
            P best = node.payoff();
            if (best != null && !scale.isBetter(value, best)) {
                continue;
            }
            node.promote(child, value);

            Optional<Window<P>> narrowed = current.raiseLow(scale, value);
            if (narrowed.isEmpty()) {
                searchState.recordCutoff();
                break;
            }
            current = narrowed.get();
        }
        return node.payoff();
    }
}
