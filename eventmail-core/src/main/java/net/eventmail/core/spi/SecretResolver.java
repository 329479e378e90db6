package net.eventmail.core.spi;

/** Turns a configured secret reference into the secret itself. */
@FunctionalInterface
public interface SecretResolver {
    String resolve(String configured);
}
