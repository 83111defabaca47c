package io.hmis.backend.multitenancy;

/** Which store a read-only session is opened against. Writes always use the primary. */
public enum ReadPath {
  PRIMARY,
  REPLICA
}
