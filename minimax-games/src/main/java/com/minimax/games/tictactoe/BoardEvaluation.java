package com.minimax.games.tictactoe;

/**
 * Qualitative assessment of a board for one actor, from worst to best.
 */
public enum BoardEvaluation {
    LOSE,
    OCCUPIED_CENTER_MASS,
    EQUAL,
    OCCUPY_CENTER_MASS,
    WIN
}
