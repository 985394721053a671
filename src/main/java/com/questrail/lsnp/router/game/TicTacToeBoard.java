package com.questrail.lsnp.router.game;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * TicTacToeBoard
 * -----------------------------------------------------------------------------
 * Immutable 3x3 board. Positions are numbered 1..9 row by row:
 *
 * <pre>
 *   1 | 2 | 3
 *   --+---+--
 *   4 | 5 | 6
 *   --+---+--
 *   7 | 8 | 9
 * </pre>
 */
public final class TicTacToeBoard
{
    public static final int CELLS = 9;

    /** Three rows, three columns, two diagonals; zero-based indices. */
    private static final int[][] LINES = {
            {0, 1, 2}, {3, 4, 5}, {6, 7, 8},
            {0, 3, 6}, {1, 4, 7}, {2, 5, 8},
            {0, 4, 8}, {2, 4, 6}
    };

    private static final TicTacToeBoard EMPTY = new TicTacToeBoard(new Symbol[CELLS]);

    private final Symbol[] cells;

    private TicTacToeBoard(Symbol[] cells) {
        this.cells = cells;
    }

    public static TicTacToeBoard empty() {
        return EMPTY;
    }

    /**
     * Builds a board from a nine-character picture such as {@code "XO.X....O"};
     * any character other than X or O is an empty cell.
     */
    public static TicTacToeBoard of(String picture) {
        Objects.requireNonNull(picture, "picture");
        if (picture.length() != CELLS) {
            throw new IllegalArgumentException("Board picture must have 9 characters");
        }
        Symbol[] cells = new Symbol[CELLS];
        for (int i = 0; i < CELLS; i++) {
            char c = picture.charAt(i);
            cells[i] = c == 'X' ? Symbol.X : c == 'O' ? Symbol.O : null;
        }
        return new TicTacToeBoard(cells);
    }

    public static boolean inRange(int position) {
        return position >= 1 && position <= CELLS;
    }

    public Optional<Symbol> at(int position) {
        checkRange(position);
        return Optional.ofNullable(cells[position - 1]);
    }

    public boolean isFree(int position) {
        checkRange(position);
        return cells[position - 1] == null;
    }

    /**
     * @throws IllegalStateException if the cell is occupied
     */
    public TicTacToeBoard place(int position, Symbol symbol) {
        Objects.requireNonNull(symbol, "symbol");
        if (!isFree(position)) {
            throw new IllegalStateException("Cell " + position + " is occupied");
        }
        Symbol[] next = cells.clone();
        next[position - 1] = symbol;
        return new TicTacToeBoard(next);
    }

    public int filledCells() {
        int n = 0;
        for (Symbol s : cells) {
            if (s != null) {
                n++;
            }
        }
        return n;
    }

    /**
     * Evaluates the board.
     *
     * @return a win if any line holds three equal marks, a draw if the board is
     *         full without one, otherwise empty
     */
    public Optional<GameOutcome> evaluate() {
        for (int[] line : LINES) {
            Symbol a = cells[line[0]];
            if (a != null && a == cells[line[1]] && a == cells[line[2]]) {
                return Optional.of(new GameOutcome.Win(a, List.of(line[0] + 1, line[1] + 1, line[2] + 1)));
            }
        }
        if (filledCells() == CELLS) {
            return Optional.of(new GameOutcome.Draw());
        }
        return Optional.empty();
    }

    private static void checkRange(int position) {
        if (!inRange(position)) {
            throw new IllegalArgumentException("Position must be 1..9: " + position);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TicTacToeBoard that)) return false;
        return Arrays.equals(cells, that.cells);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(cells);
    }

    /**
     * Nine-character picture, {@code '.'} for empty cells.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(CELLS);
        for (Symbol s : cells) {
            sb.append(s == null ? '.' : s.name().charAt(0));
        }
        return sb.toString();
    }
}
