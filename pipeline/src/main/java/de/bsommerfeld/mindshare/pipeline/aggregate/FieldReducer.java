package de.bsommerfeld.mindshare.pipeline.aggregate;

/**
 * Combines two values of one field while folding an author's records.
 * {@code earlier} always stems from records retrieved before those behind
 * {@code later}.
 *
 * <p>
 * Implementations must be associative so that partial aggregates of any
 * contiguous partition can be merged into the same result.
 *
 * @param <T> field type
 */
@FunctionalInterface
public interface FieldReducer<T> {

    T combine(T earlier, T later);
}
