
/**
 * The protocol of the library: {@link rac.flow.Sink sinks} with their
 * {@link rac.flow.ActorTrait capabilities} and the {@link rac.flow.Subscription}
 * handle that ends a delivery relationship.
 */
package rac.flow;
