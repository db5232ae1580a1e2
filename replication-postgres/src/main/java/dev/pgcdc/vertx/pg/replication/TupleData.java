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

import java.util.Collections;
import java.util.List;

/**
 * Column values of one row image, positionally aligned with the relation's columns.
 */
public final class TupleData {

  private final List<ColumnValue> values;

  public TupleData(List<ColumnValue> values) {
    this.values = Collections.unmodifiableList(List.copyOf(values));
  }

  public static TupleData of(ColumnValue... values) {
    return new TupleData(List.of(values));
  }

  public int size() {
    return values.size();
  }

  public ColumnValue get(int index) {
    return values.get(index);
  }

  public List<ColumnValue> values() {
    return values;
  }

  @Override
  public String toString() {
    return values.toString();
  }
}
