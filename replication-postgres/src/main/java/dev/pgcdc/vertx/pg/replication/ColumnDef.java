/*
 * Copyright (C) 2026 Daniel Henneberger
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.pgcdc.vertx.pg.replication;

import java.util.Objects;

/**
 * Column metadata carried by a pgoutput {@code Relation} message.
 */
public final class ColumnDef {

  private final String name;
  private final int typeOid;
  private final int typeModifier;
  private final boolean key;

  public ColumnDef(String name, int typeOid, int typeModifier, boolean key) {
    this.name = Objects.requireNonNull(name, "name");
    this.typeOid = typeOid;
    this.typeModifier = typeModifier;
    this.key = key;
  }

  public String name() {
    return name;
  }

  /**
   * Type OID, an unsigned 32-bit value stored in an {@code int}.
   */
  public int typeOid() {
    return typeOid;
  }

  public int typeModifier() {
    return typeModifier;
  }

  /**
   * Whether the column is part of the relation's replica identity key.
   */
  public boolean isKey() {
    return key;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ColumnDef)) {
      return false;
    }
    ColumnDef other = (ColumnDef) o;
    return typeOid == other.typeOid
      && typeModifier == other.typeModifier
      && key == other.key
      && name.equals(other.name);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, typeOid, typeModifier, key);
  }

  @Override
  public String toString() {
    return name + ':' + Integer.toUnsignedString(typeOid) + (key ? "(key)" : "");
  }
}
