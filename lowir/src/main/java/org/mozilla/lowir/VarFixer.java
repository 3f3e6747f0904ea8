/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.lowir;

import java.util.ArrayList;
import java.util.List;
import org.mozilla.lowir.ir.AtomicStatement;
import org.mozilla.lowir.ir.CaseCond;
import org.mozilla.lowir.ir.Initializer;
import org.mozilla.lowir.ir.IrType;
import org.mozilla.lowir.ir.Lval;
import org.mozilla.lowir.ir.QualVar;
import org.mozilla.lowir.ir.Rval;
import org.mozilla.lowir.ir.Statement;
import org.mozilla.lowir.ir.TargetCode;
import org.mozilla.lowir.ir.VarName;

/**
 * Rewrites variable references inside expressions. A reference to a captured local becomes
 * {@code env_ptr->name}; when hoisting, the untyped {@code env_ptr} the code generator leaves in
 * nested functions gets the environment pointer type. Other references are kept.
 */
final class VarFixer {

    private final ElimInfo info;

    VarFixer(ElimInfo info) {
        this.info = info;
    }

    Lval fixVar(Lval.Var var) {
        QualVar qualVar = var.getVar();
        VarName name = qualVar.getVarName();
        if (qualVar.getModuleName().equals(info.getModuleName())) {
            IrType fieldType = info.getCapturedVarType(name);
            if (fieldType != null) {
                Lval.NamedField fieldId =
                        new Lval.NamedField(
                                info.getEnvType().getMemberQualifier(),
                                name.toIdentifier(),
                                info.getEnvPtrType());
                return new Lval.Field(
                        0,
                        Rval.of(info.getEnvPtrVar()),
                        fieldId,
                        fieldType,
                        info.getEnvPtrType());
            }
        }
        if (info.getStrategy().hoistsNestedFunctions()
                && var.getVarType() == IrType.UNKNOWN
                && name.getSeqNum() == null
                && name.getName().equals(info.getStrategy().envPtrName())) {
            return new Lval.Var(qualVar, info.getEnvPtrType());
        }
        return var;
    }

    Lval fixLval(Lval lval) {
        switch (lval.getType()) {
            case Token.VAR:
                return fixVar((Lval.Var) lval);
            case Token.FIELD:
                {
                    Lval.Field field = (Lval.Field) lval;
                    return field.withPtr(fixRval(field.getPtr()));
                }
            case Token.MEM_REF:
                {
                    Lval.MemRef ref = (Lval.MemRef) lval;
                    return new Lval.MemRef(fixRval(ref.getAddr()), ref.getRefType());
                }
            default:
                throw Kit.codeBug("unexpected lval " + lval.shortName());
        }
    }

    Rval fixRval(Rval rval) {
        switch (rval.getType()) {
            case Token.LVAL:
                return Rval.of(fixLval(((Rval.LvalRef) rval).getLval()));
            case Token.MKWORD:
                {
                    Rval.MkWord mkword = (Rval.MkWord) rval;
                    return new Rval.MkWord(mkword.getTag(), fixRval(mkword.getOperand()));
                }
            case Token.UNOP:
                {
                    Rval.Unop unop = (Rval.Unop) rval;
                    return unop.withOperand(fixRval(unop.getOperand()));
                }
            case Token.BINOP:
                {
                    Rval.Binop binop = (Rval.Binop) rval;
                    return Rval.binop(
                            binop.getOp(), fixRval(binop.getLeft()), fixRval(binop.getRight()));
                }
            case Token.MEM_ADDR:
                return new Rval.MemAddr(fixLval(((Rval.MemAddr) rval).getLval()));
            case Token.CONST:
            case Token.SELF:
                return rval;
            default:
                throw Kit.codeBug("unexpected rval " + rval.shortName());
        }
    }

    Rval fixMaybeRval(Rval rval) {
        return rval == null ? null : fixRval(rval);
    }

    List<Rval> fixRvals(List<Rval> rvals) {
        List<Rval> result = new ArrayList<>(rvals.size());
        for (Rval rval : rvals) {
            result.add(fixRval(rval));
        }
        return result;
    }

    List<Lval> fixLvals(List<Lval> lvals) {
        List<Lval> result = new ArrayList<>(lvals.size());
        for (Lval lval : lvals) {
            result.add(fixLval(lval));
        }
        return result;
    }

    Initializer fixInitializer(Initializer init) {
        switch (init.getType()) {
            case Token.NO_INIT:
                return init;
            case Token.INIT_OBJ:
                return Initializer.of(fixRval(((Initializer.Obj) init).getValue()));
            case Token.INIT_STRUCT:
                {
                    Initializer.Struct struct = (Initializer.Struct) init;
                    return new Initializer.Struct(
                            struct.getStructType(), fixInitializers(struct.getMembers()));
                }
            case Token.INIT_ARRAY:
                return new Initializer.Array(
                        fixInitializers(((Initializer.Array) init).getElements()));
            default:
                throw Kit.codeBug("unexpected initializer " + init.shortName());
        }
    }

    private List<Initializer> fixInitializers(List<Initializer> inits) {
        List<Initializer> result = new ArrayList<>(inits.size());
        for (Initializer init : inits) {
            result.add(fixInitializer(init));
        }
        return result;
    }

    CaseCond fixCaseCond(CaseCond cond) {
        if (cond instanceof CaseCond.MatchValue) {
            return new CaseCond.MatchValue(fixRval(((CaseCond.MatchValue) cond).getValue()));
        }
        CaseCond.MatchRange range = (CaseCond.MatchRange) cond;
        return new CaseCond.MatchRange(fixRval(range.getLow()), fixRval(range.getHigh()));
    }

    List<CaseCond> fixCaseConds(List<CaseCond> conds) {
        List<CaseCond> result = new ArrayList<>(conds.size());
        for (CaseCond cond : conds) {
            result.add(fixCaseCond(cond));
        }
        return result;
    }

    Statement fixAtomic(AtomicStatement stmt) {
        switch (stmt.getType()) {
            case Token.COMMENT:
            case Token.GC_CHECK:
                return stmt;
            case Token.ASSIGN:
                {
                    AtomicStatement.Assign assign = (AtomicStatement.Assign) stmt;
                    return new AtomicStatement.Assign(
                            fixLval(assign.getTarget()),
                            fixRval(assign.getValue()),
                            stmt.getContext());
                }
            case Token.DELETE_OBJECT:
                return new AtomicStatement.DeleteObject(
                        fixLval(((AtomicStatement.DeleteObject) stmt).getObject()),
                        stmt.getContext());
            case Token.NEW_OBJECT:
                {
                    AtomicStatement.NewObject n = (AtomicStatement.NewObject) stmt;
                    return new AtomicStatement.NewObject(
                            fixLval(n.getTarget()),
                            n.getTag(),
                            n.hasSecondaryTag(),
                            n.getObjectType(),
                            fixMaybeRval(n.getSize()),
                            n.getCtorName(),
                            fixRvals(n.getArgs()),
                            n.getArgTypes(),
                            stmt.getContext());
                }
            case Token.MARK_HP:
                return new AtomicStatement.MarkHp(
                        fixLval(((AtomicStatement.MarkHp) stmt).getTarget()), stmt.getContext());
            case Token.RESTORE_HP:
                return new AtomicStatement.RestoreHp(
                        fixRval(((AtomicStatement.RestoreHp) stmt).getSaved()),
                        stmt.getContext());
            case Token.INLINE_TARGET_CODE:
                {
                    AtomicStatement.InlineTargetCode code =
                            (AtomicStatement.InlineTargetCode) stmt;
                    List<TargetCode> components = new ArrayList<>();
                    for (TargetCode component : code.getComponents()) {
                        components.add(fixTargetCode(component));
                    }
                    return new AtomicStatement.InlineTargetCode(
                            code.getLanguage(), components, stmt.getContext());
                }
            case Token.OUTLINE_FOREIGN_PROC:
                {
                    AtomicStatement.OutlineForeignProc proc =
                            (AtomicStatement.OutlineForeignProc) stmt;
                    return new AtomicStatement.OutlineForeignProc(
                            proc.getLanguage(),
                            fixLvals(proc.getOutputs()),
                            proc.getCode(),
                            stmt.getContext());
                }
            default:
                throw Kit.codeBug("unexpected atomic statement " + stmt.shortName());
        }
    }

    private TargetCode fixTargetCode(TargetCode component) {
        if (component instanceof TargetCode.Input) {
            return new TargetCode.Input(fixRval(((TargetCode.Input) component).getValue()));
        }
        if (component instanceof TargetCode.Output) {
            return new TargetCode.Output(fixLval(((TargetCode.Output) component).getTarget()));
        }
        return component;
    }
}
