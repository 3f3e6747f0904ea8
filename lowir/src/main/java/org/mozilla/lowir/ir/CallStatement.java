/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.lowir.ir;

import java.util.List;
import java.util.Objects;
import org.mozilla.lowir.Kit;
import org.mozilla.lowir.Token;

/**
 * A function or method call. The results are stored in the return lvalues.
 *
 * <pre>[<i>RetLvals</i> <b>=</b>] <i>Func</i> <b>(</b> Args <b>)</b> <b>;</b></pre>
 */
public class CallStatement extends Statement {

    public enum CallKind {
        ORDINARY,
        /** The call is the last thing the caller does; its results are the caller's. */
        TAIL,
        /** The callee never returns, e.g. it throws. */
        NO_RETURN
    }

    private final FuncSignature signature;
    private final Rval function;
    private final Rval object;
    private final List<Rval> args;
    private final List<Lval> returnLvals;
    private final CallKind callKind;

    {
        type = Token.CALL;
    }

    public CallStatement(
            FuncSignature signature,
            Rval function,
            Rval object,
            List<Rval> args,
            List<Lval> returnLvals,
            CallKind callKind,
            Context context) {
        super(context);
        this.signature = Objects.requireNonNull(signature);
        this.function = Objects.requireNonNull(function);
        this.object = object;
        this.args = Kit.immutableList(args);
        this.returnLvals = Kit.immutableList(returnLvals);
        this.callKind = Objects.requireNonNull(callKind);
    }

    public FuncSignature getSignature() {
        return signature;
    }

    public Rval getFunction() {
        return function;
    }

    /** Returns the object a method is invoked on, or {@code null} for a plain call. */
    public Rval getObject() {
        return object;
    }

    public List<Rval> getArgs() {
        return args;
    }

    public List<Lval> getReturnLvals() {
        return returnLvals;
    }

    public CallKind getCallKind() {
        return callKind;
    }

    @Override
    public String toSource(int depth) {
        StringBuilder sb = new StringBuilder(makeIndent(depth));
        if (callKind == CallKind.TAIL) {
            sb.append("/* tail call */ ");
        } else if (callKind == CallKind.NO_RETURN) {
            sb.append("/* no return */ ");
        }
        if (returnLvals.size() == 1) {
            sb.append(returnLvals.get(0).toSource(0)).append(" = ");
        } else if (!returnLvals.isEmpty()) {
            sb.append("(").append(printList(returnLvals)).append(") = ");
        }
        if (object != null) {
            sb.append(object.toSource(0)).append(".");
        }
        sb.append(function.toSource(0)).append("(").append(printList(args)).append(");\n");
        return sb.toString();
    }

    @Override
    public void visit(IrVisitor v) {
        if (v.visit(this)) {
            function.visit(v);
            if (object != null) {
                object.visit(v);
            }
            visitAll(args, v);
            visitAll(returnLvals, v);
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof CallStatement)) return false;
        CallStatement other = (CallStatement) obj;
        return callKind == other.callKind
                && context.equals(other.context)
                && signature.equals(other.signature)
                && function.equals(other.function)
                && Objects.equals(object, other.object)
                && args.equals(other.args)
                && returnLvals.equals(other.returnLvals);
    }

    @Override
    public int hashCode() {
        return Objects.hash(function, object, args, returnLvals, callKind);
    }
}
