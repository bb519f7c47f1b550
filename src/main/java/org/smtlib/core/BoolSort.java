package org.smtlib.core;

public final class BoolSort extends Sort {

    public BoolSort() {
        super(SortKind.BOOL);
    }

    @Override
    public String toString() {
        return "Bool";
    }
}
