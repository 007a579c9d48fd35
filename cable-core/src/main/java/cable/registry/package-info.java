/**
 * Channel-to-subscription bookkeeping.
 *
 * <p>Channels are exact names, plus the reserved wildcard {@code "*"}.
 *
 * @see cable.registry.SubscriptionRegistry
 * @see cable.registry.DefaultSubscriptionRegistry
 */
package cable.registry;
