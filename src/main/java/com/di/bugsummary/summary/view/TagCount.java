package com.di.bugsummary.summary.view;

/**
 * Open bug count for one tag.
 */
public record TagCount(String tag, long count) {
}
