/**
 * Channel abstraction
 * =============================================================================
 *
 * Ordered, FIFO message conduits between the engine-under-test and its mock
 * collaborators. Each channel has one logical producer and one logical
 * consumer; consumption order always equals production order.
 *
 * <h2>Ports</h2>
 * <ul>
 *   <li>{@link com.questrail.consensus.channel.CommandSender}: the send side,
 *       handed to whoever emits (usually the engine)</li>
 *   <li>{@link com.questrail.consensus.channel.TimedReceiver}: the
 *       receive-with-timeout side, held by a mock controller or a drain</li>
 * </ul>
 *
 * <p>Channels are bounded. A full channel blocks its sender, which is exactly
 * the backpressure the harness sinks and drains exist to relieve.</p>
 */
package com.questrail.consensus.channel;
