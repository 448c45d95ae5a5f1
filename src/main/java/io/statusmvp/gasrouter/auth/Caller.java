package io.statusmvp.gasrouter.auth;

import java.util.Locale;

/** Capability handed to every mutating operation: who is calling and in which role. */
public record Caller(String id, Role role) {

  public static Caller admin(String id) {
    return new Caller(id, Role.ADMIN);
  }

  public static Caller keeper(String id) {
    return new Caller(id, Role.KEEPER);
  }

  public static Caller bridge(String id) {
    return new Caller(id, Role.BRIDGE);
  }

  public static Caller user(String address) {
    return new Caller(address, Role.USER);
  }

  public boolean isAdmin() {
    return role == Role.ADMIN;
  }

  /** Addresses compare case-insensitively. */
  public boolean is(String otherId) {
    if (id == null || otherId == null) return false;
    return id.trim().toLowerCase(Locale.ROOT).equals(otherId.trim().toLowerCase(Locale.ROOT));
  }
}
