package com.questrail.kitchen.print.codec.impl;

/**
 * ESC/POS control bytes shared by the encoders and the decoder.
 */
final class EscPosCommands
{
    private EscPosCommands() {}

    static final int ESC = 0x1B;
    static final int GS = 0x1D;
    static final int LF = 0x0A;

    // ESC <x>
    static final int INIT = '@';
    static final int BOLD = 'E';
    static final int PRINT_MODE = '!';
    static final int ALIGN = 'a';
    static final int FEED = 'd';
    static final int BUZZER = 'B';
    static final int RED = '4';
    static final int BLACK = '5';

    // GS <x>
    static final int CHAR_SIZE = '!';
    static final int INVERSE = 'B';
    static final int CUT = 'V';

    static final int CUT_FULL_FEED = 65;
    static final int CUT_PARTIAL_FEED = 66;

    // ESC ! bits
    static final int MODE_EMPHASIZED = 0x08;
    static final int MODE_DOUBLE_HEIGHT = 0x10;
    static final int MODE_DOUBLE_WIDTH = 0x20;

    /** Replacement for characters outside printable ASCII. */
    static final char REPLACEMENT = '?';
}
