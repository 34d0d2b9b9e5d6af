package org.abstractica.messaging.errors;

/**
 * Thrown when a builder receives an invalid construction parameter.
 *
 * <p>Raised synchronously from the builder setter or from {@code build()};
 * nothing has been bound or opened at that point.</p>
 */
public class ConfigurationException extends IllegalArgumentException
{
    public ConfigurationException(String message)
    {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
