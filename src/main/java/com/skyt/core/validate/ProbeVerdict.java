package com.skyt.core.validate;

/** Result of running the behavior probe over two versions of a fragment. */
public final class ProbeVerdict {

    public enum Kind { EQUIVALENT, DIFFERENT, INCONCLUSIVE }

    private final Kind   kind;
    private final int    probes;
    private final String detail;

    private ProbeVerdict(Kind kind, int probes, String detail) {
        this.kind   = kind;
        this.probes = probes;
        this.detail = detail;
    }

    static ProbeVerdict equivalent(int probes) {
        return new ProbeVerdict(Kind.EQUIVALENT, probes, probes + " probe(s) agree");
    }

    static ProbeVerdict different(int probes, String detail) {
        return new ProbeVerdict(Kind.DIFFERENT, probes, detail);
    }

    static ProbeVerdict inconclusive(String detail) {
        return new ProbeVerdict(Kind.INCONCLUSIVE, 0, detail);
    }

    public Kind    getKind()      { return kind; }
    public int     getProbes()    { return probes; }
    public String  getDetail()    { return detail; }
    public boolean isEquivalent() { return kind == Kind.EQUIVALENT; }

    @Override
    public String toString() {
        return "ProbeVerdict{" + kind + ", " + detail + "}";
    }
}
