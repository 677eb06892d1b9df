package com.di.bugsummary.summary.access;

import java.util.Set;

/**
 * Who can see bugs under an access policy. Consulted by the fan-out for private bugs and by
 * visibility-filtered reads.
 */
public interface AccessViewerSet {

    /** People holding a grant on the policy; empty when none. */
    Set<Long> viewersOf(long policyId);

    /** Policies granted to the person; empty when none. */
    Set<Long> policiesGrantedTo(long userId);
}
