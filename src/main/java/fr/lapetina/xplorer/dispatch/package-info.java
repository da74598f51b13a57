/**
 * Thread placement of endpoint handlers.
 *
 * <p>Handlers flagged for the affinity thread are published to an LMAX Disruptor ring
 * consumed by a single {@code xplorer-affinity} thread. Other handlers run on a cached
 * worker pool. A caller already on the affinity thread runs non-affinity handlers inline
 * and gets an {@link fr.lapetina.xplorer.dispatch.AffinityReentryException} for affinity ones.
 *
 * @see fr.lapetina.xplorer.dispatch.AffinityDispatcher
 * @see com.lmax.disruptor.dsl.Disruptor
 */
package fr.lapetina.xplorer.dispatch;
