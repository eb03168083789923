package com.skyt.core.explain;

import com.skyt.core.naming.NamingPolicy;
import com.skyt.core.parse.ParsedSource;

/**
 * What an explainer may look at besides the two property values: both parsed
 * fragments and the naming policy in force. Explainers only read the trees.
 */
public final class ExplanationContext {

    private final ParsedSource candidate;
    private final ParsedSource canon;
    private final NamingPolicy namingPolicy;

    public ExplanationContext(ParsedSource candidate, ParsedSource canon, NamingPolicy namingPolicy) {
        this.candidate    = candidate;
        this.canon        = canon;
        this.namingPolicy = namingPolicy == null ? NamingPolicy.permissive() : namingPolicy;
    }

    public ParsedSource getCandidate()    { return candidate; }
    public ParsedSource getCanon()        { return canon; }
    public NamingPolicy getNamingPolicy() { return namingPolicy; }
}
