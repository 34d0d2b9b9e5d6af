/**
 * Messaging library implementation module.
 *
 * <p>Provides the default implementation of the messaging API.</p>
 */
module messaging.impl
{
    requires transitive messaging.api;
    requires org.slf4j;

    // Factory implementations for external use
    exports org.abstractica.messaging.impl.client;
    exports org.abstractica.messaging.impl.server;
    exports org.abstractica.messaging.impl.datagram;

    // Building blocks usable on their own
    exports org.abstractica.messaging.impl.framing;
    exports org.abstractica.messaging.impl.util;
}
