package ru.nsu.g.akononov.agent.probe;

import java.util.Objects;

/**
 * Username/password offered to the proxy when it asks for RFC 1929 authentication.
 */
public final class Credentials {
    private final String username;
    private final String password;

    public Credentials(String username, String password) {
        this.username = Objects.requireNonNull(username, "username");
        this.password = Objects.requireNonNull(password, "password");
    }

    public String getUsername() {
        return username;
    }

    public String getPassword() {
        return password;
    }

    @Override
    public String toString() {
        return "Credentials{username='" + username + "', password=****}";
    }
}
