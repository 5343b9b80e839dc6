/**
 * Error taxonomy and cancellation context of the replay layer.
 *
 * <p>All failures surface as unchecked {@link replay.ReplayException} subclasses tagged with an
 * {@link replay.ErrorScope}. {@link replay.LoadContext} carries cancellation and deadlines.
 */
package replay;
