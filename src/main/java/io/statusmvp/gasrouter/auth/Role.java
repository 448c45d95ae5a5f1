package io.statusmvp.gasrouter.auth;

public enum Role {
  ADMIN,
  KEEPER,
  BRIDGE,
  USER
}
