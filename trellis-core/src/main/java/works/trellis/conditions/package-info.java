/**
 * Conditions decide whether a path segment can be resolved through a
 * particular mount edge, and extract {@link works.trellis.Metadata metadata} from it.
 * <p>
 * The set of conditions is closed: {@link works.trellis.conditions.Condition Condition}
 * is sealed, and each variant is a record.
 * Leaf variants look only at the segment
 * ({@link works.trellis.conditions.Literal Literal},
 * {@link works.trellis.conditions.DecimalId DecimalId},
 * {@link works.trellis.conditions.Matches Matches}),
 * or at the ancestors of the resource being created
 * ({@link works.trellis.conditions.Under Under},
 * {@link works.trellis.conditions.Recursion Recursion}).
 * The combinators
 * {@link works.trellis.conditions.And And},
 * {@link works.trellis.conditions.Or Or} and
 * {@link works.trellis.conditions.Not Not}
 * compose other conditions.
 * <p>
 * Most code should use the constants and factory methods in
 * {@link works.trellis.conditions.Conditions Conditions} rather than
 * constructing the records directly.
 */
package works.trellis.conditions;
