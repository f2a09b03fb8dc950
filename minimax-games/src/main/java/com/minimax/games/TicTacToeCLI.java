package com.minimax.games;

import com.minimax.core.Actor;
import com.minimax.core.Strategy;
import com.minimax.core.ai.SearchStrategy;
import com.minimax.games.tictactoe.CenterMassEvaluator;
import com.minimax.games.tictactoe.GameResult;
import com.minimax.games.tictactoe.Placement;
import com.minimax.games.tictactoe.TicTacToeBoard;
import com.minimax.games.tictactoe.TicTacToeRule;
import java.util.Optional;
import java.util.Scanner;

/**
 * Simple console front-end for playing tic-tac-toe against the search engine. The human plays
 * {@link Actor#FIRST} unless {@code --second} is passed.
 */
public final class TicTacToeCLI {

    private TicTacToeCLI() {
    }

    public static void main(String[] args) {
        LoggingSupport.configure();
        Actor human = args.length > 0 && "--second".equals(args[0]) ? Actor.SECOND : Actor.FIRST;
        TicTacToeRule rule = TicTacToeRule.instance();
        Strategy<TicTacToeBoard, Placement> engine =
                SearchStrategy.minimax(rule, new CenterMassEvaluator(), TicTacToeBoard.CELL_COUNT);
        Scanner scanner = new Scanner(System.in);
        TicTacToeBoard board = TicTacToeBoard.empty();
        Actor current = Actor.FIRST;

        System.out.println("Tic-tac-toe, console edition");
        while (!rule.isTerminal(board)) {
            System.out.println(board);
            if (current == human) {
                System.out.printf("%s, enter \"column row\" (0-2): ", current);
                if (!scanner.hasNextLine()) {
                    return;
                }
                Optional<Placement> move = parseMove(scanner.nextLine(), current);
                if (move.isEmpty()) {
                    System.out.println("Please enter two numbers between 0 and 2.");
                    continue;
                }
                Placement placement = move.get();
                if (!board.isEmpty(placement.column(), placement.row())) {
                    System.out.println("Cell is already occupied. Choose another one.");
                    continue;
                }
                board = rule.apply(board, placement);
            } else {
                Optional<Placement> move = engine.selectAction(board, current);
                if (move.isPresent()) {
                    System.out.println(move.get());
                    board = rule.apply(board, move.get());
                }
            }
            current = current.opponent();
        }

        System.out.println(board);
        GameResult result = board.result().orElseThrow();
        System.out.println("The result is " + result);
    }

    private static Optional<Placement> parseMove(String input, Actor actor) {
        String[] parts = input.trim().split("\\s+");
        if (parts.length != 2) {
            return Optional.empty();
        }
        try {
            int column = Integer.parseInt(parts[0]);
            int row = Integer.parseInt(parts[1]);
            return Optional.of(new Placement(column, row, actor));
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
    }
}
