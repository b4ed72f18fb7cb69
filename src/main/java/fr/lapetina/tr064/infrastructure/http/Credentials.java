package fr.lapetina.tr064.infrastructure.http;

/**
 * User name and password sent to the router.
 * An empty password means the router is used without authentication.
 */
public record Credentials(String user, String password) {

    public Credentials {
        user = user != null ? user : "";
        password = password != null ? password : "";
    }

    public boolean hasPassword() {
        return !password.isEmpty();
    }

    public Credentials withUser(String newUser) {
        return new Credentials(newUser, password);
    }

    @Override
    public String toString() {
        return "Credentials{user='" + user + "', password=" + (hasPassword() ? "****" : "<none>") + '}';
    }
}
