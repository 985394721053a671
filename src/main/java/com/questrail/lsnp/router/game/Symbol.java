package com.questrail.lsnp.router.game;

import com.questrail.lsnp.api.InvalidMessageFormatException;

/**
 * Player mark. X always moves first.
 */
public enum Symbol
{
    X, O;

    public Symbol opponent() {
        return this == X ? O : X;
    }

    public static Symbol parse(String value) {
        if ("X".equalsIgnoreCase(value.trim())) {
            return X;
        }
        if ("O".equalsIgnoreCase(value.trim())) {
            return O;
        }
        throw new InvalidMessageFormatException("SYMBOL must be X or O: '" + value + "'");
    }
}
