package com.skyt.core.parse;

import com.github.javaparser.ast.body.MethodDeclaration;

/** A candidate method and the canon method it is compared against. */
public final class MethodPair {

    private final MethodDeclaration candidate;
    private final MethodDeclaration canon;

    public MethodPair(MethodDeclaration candidate, MethodDeclaration canon) {
        this.candidate = candidate;
        this.canon     = canon;
    }

    public MethodDeclaration getCandidate() { return candidate; }
    public MethodDeclaration getCanon()     { return canon; }

    @Override
    public String toString() {
        return "MethodPair{" + candidate.getNameAsString() + " ~ " + canon.getNameAsString() + "}";
    }
}
