package org.monetdb.client.dbclient;

import java.util.Objects;

/** A session option together with the value the client wants for it. */
public final class HandshakeOption {

  private final HandshakeOptionKey key;
  private final Object value;

  public HandshakeOption(HandshakeOptionKey key, Object value) {
    this.key = Objects.requireNonNull(key, "key");
    this.value = Objects.requireNonNull(value, "value");
  }

  public HandshakeOptionKey getKey() {
    return key;
  }

  public Object getValue() {
    return value;
  }

  /** Renders the value the way the handshake line expects it: booleans as 0/1. */
  public String getWireValue() {
    if (value instanceof Boolean) {
      return ((Boolean) value) ? "1" : "0";
    }
    return String.valueOf(value);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof HandshakeOption)) {
      return false;
    }
    HandshakeOption that = (HandshakeOption) o;
    return key == that.key && value.equals(that.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(key, value);
  }

  @Override
  public String toString() {
    return key.getOptionName() + "=" + getWireValue();
  }
}
