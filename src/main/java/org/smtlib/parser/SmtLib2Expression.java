package org.smtlib.parser;

import lombok.Getter;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 通用 S-表达式树：要么是原子，要么是子表达式的有序列表。
 * 每次解析都产生新的、不可变的树。
 */
public abstract class SmtLib2Expression {

    private SmtLib2Expression() {
    }

    public static Atom atom(String text) {
        return new Atom(text);
    }

    public static SList list(List<SmtLib2Expression> elements) {
        return new SList(elements);
    }

    public static SList list(SmtLib2Expression... elements) {
        return new SList(List.of(elements));
    }

    public abstract boolean isAtom();

    public Atom asAtom() {
        if (!isAtom()) {
            throw new IllegalStateException("不是原子: " + this);
        }
        return (Atom) this;
    }

    public SList asList() {
        if (isAtom()) {
            throw new IllegalStateException("不是列表: " + this);
        }
        return (SList) this;
    }

    /**
     * 原子。竖线引号在解析时已去掉，text 是引号内的原文。
     */
    @Getter
    public static final class Atom extends SmtLib2Expression {

        private final String text;

        private Atom(String text) {
            this.text = Objects.requireNonNull(text, "Atom text cannot be null.");
        }

        @Override
        public boolean isAtom() {
            return true;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Atom that && text.equals(that.text);
        }

        @Override
        public int hashCode() {
            return text.hashCode();
        }

        @Override
        public String toString() {
            return text;
        }
    }

    @Getter
    public static final class SList extends SmtLib2Expression {

        private final List<SmtLib2Expression> elements;

        private SList(List<SmtLib2Expression> elements) {
            this.elements = List.copyOf(Objects.requireNonNull(elements, "List elements cannot be null."));
        }

        public int size() {
            return elements.size();
        }

        public SmtLib2Expression get(int index) {
            return elements.get(index);
        }

        @Override
        public boolean isAtom() {
            return false;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof SList that && elements.equals(that.elements);
        }

        @Override
        public int hashCode() {
            return elements.hashCode();
        }

        @Override
        public String toString() {
            return elements.stream()
                    .map(SmtLib2Expression::toString)
                    .collect(Collectors.joining(" ", "(", ")"));
        }
    }
}
