package com.minimax.games;

import com.minimax.core.ZeroSumEvaluator;
import com.minimax.core.ai.AlphaBetaSearcher;
import com.minimax.core.ai.NegamaxSearcher;
import com.minimax.core.ai.SearchConstraints;
import com.minimax.core.ai.SearchStrategy;
import com.minimax.games.tictactoe.CenterMassEvaluator;
import com.minimax.games.tictactoe.LineScoreEvaluator;
import com.minimax.games.tictactoe.Placement;
import com.minimax.games.tictactoe.TicTacToeBoard;
import com.minimax.games.tictactoe.TicTacToeRule;
import java.time.Duration;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command line entry point for running {@link SelfPlay} sessions with configurable parameters.
 */
public final class SelfPlayRunner {

    private static final Logger LOGGER = Logger.getLogger(SelfPlayRunner.class.getName());

    private SelfPlayRunner() {
    }

    public static void main(String[] args) {
        LoggingSupport.configure();
        if (args.length < 2 || args.length > 5) {
            printUsage();
            return;
        }
        try {
            Options options = Options.parse(args);
            SearchStrategy<TicTacToeBoard, Placement, ?> strategy = options.strategy();
            SelfPlay selfPlay = new SelfPlay(strategy, strategy);
            SelfPlay.Tally tally = selfPlay.playGames(options.gameCount());
            System.out.printf("Games: %d, First wins: %d, Second wins: %d, Draws: %d%n",
                    tally.games(), tally.firstWins(), tally.secondWins(), tally.draws());
        } catch (NumberFormatException ex) {
            LOGGER.log(Level.SEVERE, "Failed to parse arguments", ex);
            printUsage();
        } catch (IllegalArgumentException ex) {
            LOGGER.log(Level.SEVERE, ex.getMessage(), ex);
            printUsage();
        }
    }

    private static void printUsage() {
        System.err.println(
                "Usage: SelfPlayRunner <gameCount> <depth> [--variant=minimax|negamax] "
                        + "[--evaluator=center|lines] [--timeLimitMillis=<value>]");
    }

    /**
     * Parsed command line options.
     */
    record Options(int gameCount, int depth, String variant, String evaluator, long timeLimitMillis) {

        Options {
            if (gameCount < 1) {
                throw new IllegalArgumentException("gameCount must be at least 1");
            }
            if (depth < 0) {
                throw new IllegalArgumentException("depth must not be negative");
            }
            if (timeLimitMillis < 0L) {
                throw new IllegalArgumentException("timeLimitMillis must be non-negative");
            }
            if (!"minimax".equals(variant) && !"negamax".equals(variant)) {
                throw new IllegalArgumentException("Unknown variant: " + variant);
            }
            if (!"center".equals(evaluator) && !"lines".equals(evaluator)) {
                throw new IllegalArgumentException("Unknown evaluator: " + evaluator);
            }
        }

        static Options parse(String[] args) {
            int gameCount = Integer.parseInt(args[0]);
            int depth = Integer.parseInt(args[1]);
            String variant = "minimax";
            String evaluator = "center";
            long timeLimitMillis = 0L;
            for (int index = 2; index < args.length; index++) {
                String option = args[index];
                if (option.startsWith("--variant=")) {
                    variant = option.substring("--variant=".length()).toLowerCase(Locale.ROOT);
                } else if (option.startsWith("--evaluator=")) {
                    evaluator = option.substring("--evaluator=".length()).toLowerCase(Locale.ROOT);
                } else if (option.startsWith("--timeLimitMillis=")) {
                    timeLimitMillis = Long.parseLong(option.substring("--timeLimitMillis=".length()));
                } else {
                    throw new IllegalArgumentException("Unrecognised argument: " + option);
                }
            }
            return new Options(gameCount, depth, variant, evaluator, timeLimitMillis);
        }

        SearchConstraints constraints() {
            return SearchConstraints.depth(depth).withTimeLimit(Duration.ofMillis(timeLimitMillis));
        }

        SearchStrategy<TicTacToeBoard, Placement, ?> strategy() {
            if ("lines".equals(evaluator)) {
                return build(new LineScoreEvaluator());
            }
            return build(new CenterMassEvaluator());
        }

        private <P> SearchStrategy<TicTacToeBoard, Placement, P> build(ZeroSumEvaluator<TicTacToeBoard, P> scoring) {
            TicTacToeRule rule = TicTacToeRule.instance();
            if ("negamax".equals(variant)) {
                return new SearchStrategy<>(new NegamaxSearcher<>(rule, scoring), constraints());
            }
            return new SearchStrategy<>(new AlphaBetaSearcher<>(rule, scoring), constraints());
        }
    }
}
