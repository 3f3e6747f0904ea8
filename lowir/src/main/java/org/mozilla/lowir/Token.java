/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.lowir;

/**
 * This class implements the node type constants of the low level IR.
 *
 * <p>Every {@link org.mozilla.lowir.ir.IrNode} carries one of these in its {@code type} field.
 */
public class Token {

    // module and definitions
    public static final int ERROR = -1,
            MODULE = 0,
            DEFN = 1,
            FUNCTION = 2,
            DATA = 3,
            CLASS = 4,
            ARGUMENT = 5,

            // statements
            BLOCK = 10,
            WHILE = 11,
            IF = 12,
            SWITCH = 13,
            CASE = 14,
            DEFAULT = 15,
            LABEL = 16,
            GOTO = 17,
            COMPUTED_GOTO = 18,
            CALL = 19,
            RETURN = 20,
            DO_COMMIT = 21,
            TRY_COMMIT = 22,

            // atomic statements
            COMMENT = 30,
            ASSIGN = 31,
            DELETE_OBJECT = 32,
            NEW_OBJECT = 33,
            GC_CHECK = 34,
            MARK_HP = 35,
            RESTORE_HP = 36,
            INLINE_TARGET_CODE = 37,
            OUTLINE_FOREIGN_PROC = 38,
            TARGET_CODE = 39,

            // lvalues
            VAR = 40,
            FIELD = 41,
            MEM_REF = 42,

            // rvalues
            LVAL = 50,
            MKWORD = 51,
            CONST = 52,
            UNOP = 53,
            BINOP = 54,
            MEM_ADDR = 55,
            SELF = 56,

            // initializers and switch conditions
            NO_INIT = 60,
            INIT_OBJ = 61,
            INIT_STRUCT = 62,
            INIT_ARRAY = 63,
            MATCH_VALUE = 64,
            MATCH_RANGE = 65,
            LAST_TOKEN = 66;

    /**
     * Returns a name for the token. Used for tree dumps and error messages.
     *
     * @param token the token code
     * @return the actual name for the token code
     */
    public static String typeToName(int token) {
        switch (token) {
            case ERROR:
                return "ERROR";
            case MODULE:
                return "MODULE";
            case DEFN:
                return "DEFN";
            case FUNCTION:
                return "FUNCTION";
            case DATA:
                return "DATA";
            case CLASS:
                return "CLASS";
            case ARGUMENT:
                return "ARGUMENT";
            case BLOCK:
                return "BLOCK";
            case WHILE:
                return "WHILE";
            case IF:
                return "IF";
            case SWITCH:
                return "SWITCH";
            case CASE:
                return "CASE";
            case DEFAULT:
                return "DEFAULT";
            case LABEL:
                return "LABEL";
            case GOTO:
                return "GOTO";
            case COMPUTED_GOTO:
                return "COMPUTED_GOTO";
            case CALL:
                return "CALL";
            case RETURN:
                return "RETURN";
            case DO_COMMIT:
                return "DO_COMMIT";
            case TRY_COMMIT:
                return "TRY_COMMIT";
            case COMMENT:
                return "COMMENT";
            case ASSIGN:
                return "ASSIGN";
            case DELETE_OBJECT:
                return "DELETE_OBJECT";
            case NEW_OBJECT:
                return "NEW_OBJECT";
            case GC_CHECK:
                return "GC_CHECK";
            case MARK_HP:
                return "MARK_HP";
            case RESTORE_HP:
                return "RESTORE_HP";
            case INLINE_TARGET_CODE:
                return "INLINE_TARGET_CODE";
            case OUTLINE_FOREIGN_PROC:
                return "OUTLINE_FOREIGN_PROC";
            case TARGET_CODE:
                return "TARGET_CODE";
            case VAR:
                return "VAR";
            case FIELD:
                return "FIELD";
            case MEM_REF:
                return "MEM_REF";
            case LVAL:
                return "LVAL";
            case MKWORD:
                return "MKWORD";
            case CONST:
                return "CONST";
            case UNOP:
                return "UNOP";
            case BINOP:
                return "BINOP";
            case MEM_ADDR:
                return "MEM_ADDR";
            case SELF:
                return "SELF";
            case NO_INIT:
                return "NO_INIT";
            case INIT_OBJ:
                return "INIT_OBJ";
            case INIT_STRUCT:
                return "INIT_STRUCT";
            case INIT_ARRAY:
                return "INIT_ARRAY";
            case MATCH_VALUE:
                return "MATCH_VALUE";
            case MATCH_RANGE:
                return "MATCH_RANGE";
        }

        // Token without name
        throw new IllegalStateException(String.valueOf(token));
    }

    /** Returns true for the token codes used by statement nodes. */
    public static boolean isStatement(int token) {
        return (token >= BLOCK && token <= TRY_COMMIT && token != CASE && token != DEFAULT)
                || (token >= COMMENT && token <= OUTLINE_FOREIGN_PROC);
    }
}
