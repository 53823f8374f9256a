package com.civicgate.security;

/**
 * Username and password for the platform's identity service.
 */
public record Credentials(String username, String password) {

    public static Credentials none() {
        return new Credentials(null, null);
    }

    public boolean isComplete() {
        return username != null && !username.isBlank() && password != null && !password.isEmpty();
    }

    /**
     * Returns this, with blank fields filled from {@code defaults}.
     */
    public Credentials orDefaults(Credentials defaults) {
        if (defaults == null) {
            return this;
        }
        String user = username == null || username.isBlank() ? defaults.username() : username;
        String pass = password == null || password.isEmpty() ? defaults.password() : password;
        return new Credentials(user, pass);
    }

    @Override
    public String toString() {
        return "Credentials[username=" + username + ", password=***]";
    }
}
