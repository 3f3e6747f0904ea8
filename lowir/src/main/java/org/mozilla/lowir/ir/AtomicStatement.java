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

/** Statements that do not contain other statements. */
public abstract class AtomicStatement extends Statement {

    private AtomicStatement(Context context) {
        super(context);
    }

    @Override
    public String toSource(int depth) {
        return makeIndent(depth) + atomicSource() + "\n";
    }

    /** The statement text without indentation or line break. */
    protected abstract String atomicSource();

    public static final class Comment extends AtomicStatement {
        private final String text;

        {
            type = Token.COMMENT;
        }

        public Comment(String text, Context context) {
            super(context);
            this.text = Objects.requireNonNull(text);
        }

        public String getText() {
            return text;
        }

        @Override
        protected String atomicSource() {
            return "/* " + text + " */";
        }

        @Override
        public void visit(IrVisitor v) {
            v.visit(this);
        }

        @Override
        public boolean equals(Object obj) {
            if (!(obj instanceof Comment)) return false;
            Comment other = (Comment) obj;
            return context.equals(other.context) && text.equals(other.text);
        }

        @Override
        public int hashCode() {
            return text.hashCode();
        }
    }

    public static final class Assign extends AtomicStatement {
        private final Lval target;
        private final Rval value;

        {
            type = Token.ASSIGN;
        }

        public Assign(Lval target, Rval value, Context context) {
            super(context);
            this.target = Objects.requireNonNull(target);
            this.value = Objects.requireNonNull(value);
        }

        public Lval getTarget() {
            return target;
        }

        public Rval getValue() {
            return value;
        }

        @Override
        protected String atomicSource() {
            return target.toSource(0) + " = " + value.toSource(0) + ";";
        }

        @Override
        public void visit(IrVisitor v) {
            if (v.visit(this)) {
                target.visit(v);
                value.visit(v);
            }
        }

        @Override
        public boolean equals(Object obj) {
            if (!(obj instanceof Assign)) return false;
            Assign other = (Assign) obj;
            return context.equals(other.context)
                    && target.equals(other.target)
                    && value.equals(other.value);
        }

        @Override
        public int hashCode() {
            return target.hashCode() * 31 + value.hashCode();
        }
    }

    public static final class DeleteObject extends AtomicStatement {
        private final Lval object;

        {
            type = Token.DELETE_OBJECT;
        }

        public DeleteObject(Lval object, Context context) {
            super(context);
            this.object = Objects.requireNonNull(object);
        }

        public Lval getObject() {
            return object;
        }

        @Override
        protected String atomicSource() {
            return "delete_object(" + object.toSource(0) + ");";
        }

        @Override
        public void visit(IrVisitor v) {
            if (v.visit(this)) {
                object.visit(v);
            }
        }

        @Override
        public boolean equals(Object obj) {
            if (!(obj instanceof DeleteObject)) return false;
            DeleteObject other = (DeleteObject) obj;
            return context.equals(other.context) && object.equals(other.object);
        }

        @Override
        public int hashCode() {
            return object.hashCode() + 19;
        }
    }

    /**
     * Allocates a new object of {@code objectType} on the heap and stores the (tagged) pointer in
     * {@code target}. The arguments initialize the fields, or are passed to the constructor when
     * {@code ctorName} is set.
     */
    public static final class NewObject extends AtomicStatement {
        private final Lval target;
        private final Integer tag;
        private final boolean hasSecondaryTag;
        private final IrType objectType;
        private final Rval size;
        private final String ctorName;
        private final List<Rval> args;
        private final List<IrType> argTypes;

        {
            type = Token.NEW_OBJECT;
        }

        public NewObject(
                Lval target,
                Integer tag,
                boolean hasSecondaryTag,
                IrType objectType,
                Rval size,
                String ctorName,
                List<Rval> args,
                List<IrType> argTypes,
                Context context) {
            super(context);
            this.target = Objects.requireNonNull(target);
            this.tag = tag;
            this.hasSecondaryTag = hasSecondaryTag;
            this.objectType = Objects.requireNonNull(objectType);
            this.size = size;
            this.ctorName = ctorName;
            this.args = Kit.immutableList(args);
            this.argTypes = Kit.immutableList(argTypes);
            if (this.args.size() != this.argTypes.size()) {
                throw new IllegalArgumentException("argument and argument type counts differ");
            }
        }

        public Lval getTarget() {
            return target;
        }

        /** Returns the primary tag, or {@code null} for an untagged pointer. */
        public Integer getTag() {
            return tag;
        }

        public boolean hasSecondaryTag() {
            return hasSecondaryTag;
        }

        public IrType getObjectType() {
            return objectType;
        }

        /** Returns the size in words, or {@code null} if the type determines it. */
        public Rval getSize() {
            return size;
        }

        public String getCtorName() {
            return ctorName;
        }

        public List<Rval> getArgs() {
            return args;
        }

        public List<IrType> getArgTypes() {
            return argTypes;
        }

        @Override
        protected String atomicSource() {
            StringBuilder sb = new StringBuilder();
            sb.append(target.toSource(0)).append(" = new ").append(objectType.toSource());
            if (tag != null && tag != 0) {
                sb.append(" tag ").append(tag);
            }
            if (ctorName != null) {
                sb.append(" ").append(ctorName);
            }
            sb.append("(").append(printList(args)).append(");");
            return sb.toString();
        }

        @Override
        public void visit(IrVisitor v) {
            if (v.visit(this)) {
                target.visit(v);
                if (size != null) {
                    size.visit(v);
                }
                visitAll(args, v);
            }
        }

        @Override
        public boolean equals(Object obj) {
            if (!(obj instanceof NewObject)) return false;
            NewObject other = (NewObject) obj;
            return hasSecondaryTag == other.hasSecondaryTag
                    && context.equals(other.context)
                    && target.equals(other.target)
                    && Objects.equals(tag, other.tag)
                    && objectType.equals(other.objectType)
                    && Objects.equals(size, other.size)
                    && Objects.equals(ctorName, other.ctorName)
                    && args.equals(other.args)
                    && argTypes.equals(other.argTypes);
        }

        @Override
        public int hashCode() {
            return Objects.hash(target, tag, objectType, ctorName, args);
        }
    }

    /** Runs the collector if the heap is nearly full. */
    public static final class GcCheck extends AtomicStatement {
        {
            type = Token.GC_CHECK;
        }

        public GcCheck(Context context) {
            super(context);
        }

        @Override
        protected String atomicSource() {
            return "gc_check();";
        }

        @Override
        public void visit(IrVisitor v) {
            v.visit(this);
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof GcCheck && context.equals(((GcCheck) obj).context);
        }

        @Override
        public int hashCode() {
            return 23;
        }
    }

    /** Saves the heap pointer into an lvalue. */
    public static final class MarkHp extends AtomicStatement {
        private final Lval target;

        {
            type = Token.MARK_HP;
        }

        public MarkHp(Lval target, Context context) {
            super(context);
            this.target = Objects.requireNonNull(target);
        }

        public Lval getTarget() {
            return target;
        }

        @Override
        protected String atomicSource() {
            return "mark_hp(" + target.toSource(0) + ");";
        }

        @Override
        public void visit(IrVisitor v) {
            if (v.visit(this)) {
                target.visit(v);
            }
        }

        @Override
        public boolean equals(Object obj) {
            if (!(obj instanceof MarkHp)) return false;
            MarkHp other = (MarkHp) obj;
            return context.equals(other.context) && target.equals(other.target);
        }

        @Override
        public int hashCode() {
            return target.hashCode() + 29;
        }
    }

    public static final class RestoreHp extends AtomicStatement {
        private final Rval saved;

        {
            type = Token.RESTORE_HP;
        }

        public RestoreHp(Rval saved, Context context) {
            super(context);
            this.saved = Objects.requireNonNull(saved);
        }

        public Rval getSaved() {
            return saved;
        }

        @Override
        protected String atomicSource() {
            return "restore_hp(" + saved.toSource(0) + ");";
        }

        @Override
        public void visit(IrVisitor v) {
            if (v.visit(this)) {
                saved.visit(v);
            }
        }

        @Override
        public boolean equals(Object obj) {
            if (!(obj instanceof RestoreHp)) return false;
            RestoreHp other = (RestoreHp) obj;
            return context.equals(other.context) && saved.equals(other.saved);
        }

        @Override
        public int hashCode() {
            return saved.hashCode() + 31;
        }
    }

    /** Target language code spliced into the output, with IR values flowing in and out. */
    public static final class InlineTargetCode extends AtomicStatement {
        private final String language;
        private final List<TargetCode> components;

        {
            type = Token.INLINE_TARGET_CODE;
        }

        public InlineTargetCode(String language, List<TargetCode> components, Context context) {
            super(context);
            this.language = Objects.requireNonNull(language);
            this.components = Kit.immutableList(components);
        }

        public String getLanguage() {
            return language;
        }

        public List<TargetCode> getComponents() {
            return components;
        }

        @Override
        protected String atomicSource() {
            StringBuilder sb = new StringBuilder("inline ").append(language).append(" {");
            for (TargetCode component : components) {
                sb.append(component.toSource(0));
            }
            return sb.append("}").toString();
        }

        @Override
        public void visit(IrVisitor v) {
            if (v.visit(this)) {
                visitAll(components, v);
            }
        }

        @Override
        public boolean equals(Object obj) {
            if (!(obj instanceof InlineTargetCode)) return false;
            InlineTargetCode other = (InlineTargetCode) obj;
            return context.equals(other.context)
                    && language.equals(other.language)
                    && components.equals(other.components);
        }

        @Override
        public int hashCode() {
            return language.hashCode() * 31 + components.hashCode();
        }
    }

    /** A call to foreign code kept in a separate file; results go to the output lvalues. */
    public static final class OutlineForeignProc extends AtomicStatement {
        private final String language;
        private final List<Lval> outputs;
        private final String code;

        {
            type = Token.OUTLINE_FOREIGN_PROC;
        }

        public OutlineForeignProc(
                String language, List<Lval> outputs, String code, Context context) {
            super(context);
            this.language = Objects.requireNonNull(language);
            this.outputs = Kit.immutableList(outputs);
            this.code = Objects.requireNonNull(code);
        }

        public String getLanguage() {
            return language;
        }

        public List<Lval> getOutputs() {
            return outputs;
        }

        public String getCode() {
            return code;
        }

        @Override
        protected String atomicSource() {
            return "outline " + language + " (" + printList(outputs) + ") \"" + code + "\";";
        }

        @Override
        public void visit(IrVisitor v) {
            if (v.visit(this)) {
                visitAll(outputs, v);
            }
        }

        @Override
        public boolean equals(Object obj) {
            if (!(obj instanceof OutlineForeignProc)) return false;
            OutlineForeignProc other = (OutlineForeignProc) obj;
            return context.equals(other.context)
                    && language.equals(other.language)
                    && outputs.equals(other.outputs)
                    && code.equals(other.code);
        }

        @Override
        public int hashCode() {
            return Objects.hash(language, outputs, code);
        }
    }
}
