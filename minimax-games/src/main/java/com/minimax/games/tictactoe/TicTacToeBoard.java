package com.minimax.games.tictactoe;

import com.minimax.core.Actor;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable bitboard representation of a 3x3 tic-tac-toe field.
 * Cell {@code (column, row)} maps to bit {@code row * SIZE + column} of each actor's mask.
 */
public final class TicTacToeBoard {

    public static final int SIZE = 3;
    public static final int CELL_COUNT = SIZE * SIZE;

    private static final int FULL_MASK = (1 << CELL_COUNT) - 1;
    static final int[] LINES = {
        0b000_000_111, 0b000_111_000, 0b111_000_000,
        0b001_001_001, 0b010_010_010, 0b100_100_100,
        0b100_010_001, 0b001_010_100
    };

    private static final TicTacToeBoard EMPTY = new TicTacToeBoard(0, 0);

    private final int firstBits;
    private final int secondBits;

    private TicTacToeBoard(int firstBits, int secondBits) {
        this.firstBits = firstBits;
        this.secondBits = secondBits;
    }

    /**
     * Returns the board with no marks.
     */
    public static TicTacToeBoard empty() {
        return EMPTY;
    }

    /**
     * Parses a board written row by row with {@code F}, {@code S} and {@code -}, rows separated by
     * {@code /}, for example {@code "F-S/-F-/--S"}.
     */
    public static TicTacToeBoard parse(String layout) {
        Objects.requireNonNull(layout, "layout");
        String[] rows = layout.trim().split("/");
        if (rows.length != SIZE) {
            throw new IllegalArgumentException("Expected " + SIZE + " rows: " + layout);
        }
        int first = 0;
        int second = 0;
        for (int row = 0; row < SIZE; row++) {
            String cells = rows[row].trim();
            if (cells.length() != SIZE) {
                throw new IllegalArgumentException("Row " + row + " must have " + SIZE + " cells: " + layout);
            }
            for (int column = 0; column < SIZE; column++) {
                int bit = 1 << index(column, row);
                switch (cells.charAt(column)) {
                    case 'F':
                        first |= bit;
                        break;
                    case 'S':
                        second |= bit;
                        break;
                    case '-':
                        break;
                    default:
                        throw new IllegalArgumentException("Unknown cell '" + cells.charAt(column) + "': " + layout);
                }
            }
        }
        return new TicTacToeBoard(first, second);
    }

    /**
     * Returns the actor occupying the cell, if any.
     */
    public Optional<Actor> at(int column, int row) {
        int bit = 1 << index(column, row);
        if ((firstBits & bit) != 0) {
            return Optional.of(Actor.FIRST);
        }
        if ((secondBits & bit) != 0) {
            return Optional.of(Actor.SECOND);
        }
        return Optional.empty();
    }

    public boolean isEmpty(int column, int row) {
        return ((firstBits | secondBits) & (1 << index(column, row))) == 0;
    }

    /**
     * Returns a new board with the actor's mark added to the cell.
     */
    public TicTacToeBoard with(int column, int row, Actor actor) {
        Objects.requireNonNull(actor, "actor");
        if (!isEmpty(column, row)) {
            throw new IllegalArgumentException("Cell (" + column + ", " + row + ") is already occupied");
        }
        int bit = 1 << index(column, row);
        return actor == Actor.FIRST
                ? new TicTacToeBoard(firstBits | bit, secondBits)
                : new TicTacToeBoard(firstBits, secondBits | bit);
    }

    /**
     * Returns the number of occupied cells.
     */
    public int countMarks() {
        return Integer.bitCount(firstBits | secondBits);
    }

    public boolean isFull() {
        return (firstBits | secondBits) == FULL_MASK;
    }

    /**
     * Returns the raw mask of the actor's marks.
     */
    public int bits(Actor actor) {
        return actor == Actor.FIRST ? firstBits : secondBits;
    }

    /**
     * Returns the outcome if the match is over: three marks in a line win, a full board without a
     * line is a draw.
     */
    public Optional<GameResult> result() {
        for (int line : LINES) {
            if ((firstBits & line) == line) {
                return Optional.of(GameResult.win(Actor.FIRST));
            }
            if ((secondBits & line) == line) {
                return Optional.of(GameResult.win(Actor.SECOND));
            }
        }
        return isFull() ? Optional.of(GameResult.draw()) : Optional.empty();
    }

    static void checkCell(int column, int row) {
        if (column < 0 || column >= SIZE || row < 0 || row >= SIZE) {
            throw new IllegalArgumentException("Cell out of range: (" + column + ", " + row + ")");
        }
    }

    private static int index(int column, int row) {
        checkCell(column, row);
        return row * SIZE + column;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof TicTacToeBoard)) {
            return false;
        }
        TicTacToeBoard that = (TicTacToeBoard) other;
        return firstBits == that.firstBits && secondBits == that.secondBits;
    }

    @Override
    public int hashCode() {
        return firstBits * 31 + secondBits;
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        for (int row = 0; row < SIZE; row++) {
            for (int column = 0; column < SIZE; column++) {
                String mark = at(column, row).map(actor -> actor == Actor.FIRST ? "F" : "S").orElse("-");
                builder.append(mark).append(' ');
            }
            builder.append(System.lineSeparator());
        }
        return builder.toString();
    }
}
