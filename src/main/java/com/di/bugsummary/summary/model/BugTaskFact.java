package com.di.bugsummary.summary.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Snapshot of the bug task fields that feed the summary: one row of the fact table joined with
 * the bug-level attributes (tags, duplicate link, access policy).
 */
@Value
@Builder(toBuilder = true)
public class BugTaskFact {
    long taskId;
    long bugId;
    BugTarget target;
    @Singular
    List<String> tags;
    BugTaskStatus status;
    BugTaskImportance importance;
    Long milestone;
    boolean hasPatch;
    /** Master bug when this bug is a duplicate, otherwise null. */
    Long duplicateOf;
    /** Access policy of a private bug, null for public bugs. */
    Long accessPolicy;

    public boolean isDuplicate() {
        return duplicateOf != null;
    }

    public boolean isPublic() {
        return accessPolicy == null;
    }
}
