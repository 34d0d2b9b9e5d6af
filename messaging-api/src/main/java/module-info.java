/**
 * Messaging library API module.
 *
 * <p>Provides interfaces for exchanging text messages over length-prefixed
 * TCP streams and UDP datagrams.</p>
 */
module messaging.api
{
    exports org.abstractica.messaging;
    exports org.abstractica.messaging.errors;
}
