package db.rangejoin.query;

import db.rangejoin.range.Range;

/**
 * Everything the engine needs after validation: trimmed rectangular ranges,
 * column specs known to be in bounds, and the join options.
 */
public record ValidatedJoin(Range left, Range right, JoinColumns columns, JoinSpec spec) {}
