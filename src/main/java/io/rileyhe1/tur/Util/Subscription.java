package io.rileyhe1.tur.Util;

/**
 * Handle returned by every subscribe call. Closing it more than once is harmless.
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable
{
    @Override
    void close();
}
