/**
 * extdict: External Dictionary Functions.
 *
 * Copyright (C) 2015 Bastian Gloeckle
 *
 * This file is part of extdict.
 *
 * extdict is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */
package org.extdict.testutil.dictionary;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.extdict.data.column.Column;
import org.extdict.data.column.ColumnType;
import org.extdict.data.value.ValueType;
import org.extdict.dictionary.AttributeDescriptor;
import org.extdict.dictionary.ComplexKeyDictionary;
import org.extdict.dictionary.DictionaryKind;
import org.extdict.dictionary.KeyShape;

import com.google.common.base.Preconditions;

/**
 * In-memory {@link ComplexKeyDictionary} for tests.
 *
 * @author Bastian Gloeckle
 */
public class TestComplexKeyDictionary extends AbstractTestDictionary implements ComplexKeyDictionary {
  private List<ColumnType> keyTypes;
  private Map<List<Object>, Object[]> rows = new HashMap<>();

  public TestComplexKeyDictionary(String name, DictionaryKind kind, ColumnType... keyTypes) {
    super(name, kind);
    Preconditions.checkArgument(kind.getKeyShape().equals(KeyShape.COMPLEX), "Not a complex kind: %s", kind);
    this.keyTypes = Arrays.asList(keyTypes);
  }

  public TestComplexKeyDictionary attribute(String name, ColumnType type) {
    addAttribute(new AttributeDescriptor(name, type), defaultNullValue(type));
    return this;
  }

  public TestComplexKeyDictionary row(List<Object> key, Object... values) {
    Preconditions.checkArgument(key.size() == keyTypes.size(), "Wrong key size");
    Preconditions.checkArgument(values.length == numberOfAttributes(), "Wrong number of values");
    Object[] normalized = new Object[values.length];
    for (int i = 0; i < values.length; i++)
      normalized[i] = normalize(values[i]);
    rows.put(key.stream().map(AbstractTestDictionary::normalize).collect(Collectors.toList()), normalized);
    return this;
  }

  @Override
  public String getKeyDescription() {
    return "(" + keyTypes.stream().map(ColumnType::getName).collect(Collectors.joining(", ")) + ")";
  }

  private List<Object> key(List<Column> keyColumns, List<ColumnType> keyTypes, int row) {
    Preconditions.checkArgument(keyTypes.equals(this.keyTypes), "Key types %s do not match %s", keyTypes,
        this.keyTypes);
    List<Object> res = new ArrayList<>(keyColumns.size());
    for (Column keyColumn : keyColumns) {
      Preconditions.checkArgument(!keyColumn.isConstant(), "Constant key columns are not supported.");
      res.add(keyColumn.getValue(row));
    }
    return res;
  }

  @Override
  public void has(List<Column> keyColumns, List<ColumnType> keyTypes, boolean[] out) {
    for (int i = 0; i < out.length; i++)
      out[i] = rows.containsKey(key(keyColumns, keyTypes, i));
  }

  @Override
  public <A> void get(String attributeName, ValueType<A> type, List<Column> keyColumns, List<ColumnType> keyTypes,
      A out) {
    int idx = attributeIndex(attributeName, type);
    for (int i = 0; i < type.length(out); i++) {
      Object[] row = rows.get(key(keyColumns, keyTypes, i));
      type.set(out, i, (row != null) ? row[idx] : nullValue(idx));
    }
  }

  @Override
  public <A> void getWithDefaults(String attributeName, ValueType<A> type, List<Column> keyColumns,
      List<ColumnType> keyTypes, A defaults, A out) {
    int idx = attributeIndex(attributeName, type);
    for (int i = 0; i < type.length(out); i++) {
      Object[] row = rows.get(key(keyColumns, keyTypes, i));
      type.set(out, i, (row != null) ? row[idx] : type.get(defaults, i));
    }
  }

  @Override
  public <A> void getWithDefault(String attributeName, ValueType<A> type, List<Column> keyColumns,
      List<ColumnType> keyTypes, Object defaultValue, A out) {
    int idx = attributeIndex(attributeName, type);
    for (int i = 0; i < type.length(out); i++) {
      Object[] row = rows.get(key(keyColumns, keyTypes, i));
      type.set(out, i, (row != null) ? row[idx] : defaultValue);
    }
  }
}
