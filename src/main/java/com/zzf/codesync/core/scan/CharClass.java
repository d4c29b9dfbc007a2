package com.zzf.codesync.core.scan;

/**
 * Lexical class of a single source character.
 */
public enum CharClass {
    CODE,
    STRING,
    LINE_COMMENT,
    BLOCK_COMMENT
}
