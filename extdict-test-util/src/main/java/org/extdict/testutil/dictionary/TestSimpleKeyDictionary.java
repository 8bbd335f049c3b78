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

import java.util.HashMap;
import java.util.Map;

import org.extdict.data.column.ColumnType;
import org.extdict.data.value.ValueType;
import org.extdict.dictionary.AttributeDescriptor;
import org.extdict.dictionary.DictionaryKind;
import org.extdict.dictionary.KeyShape;
import org.extdict.dictionary.SimpleKeyDictionary;

import com.google.common.base.Preconditions;

/**
 * In-memory {@link SimpleKeyDictionary} for tests.
 * 
 * <p>
 * Ancestor checks follow the parent chain of the child (the child itself included) until either the ancestor is found,
 * the chain ends with 0 or {@link #MAX_DEPTH} steps are taken.
 *
 * @author Bastian Gloeckle
 */
public class TestSimpleKeyDictionary extends AbstractTestDictionary implements SimpleKeyDictionary {
  public static final int MAX_DEPTH = 1000;

  private Map<Long, Object[]> rows = new HashMap<>();
  private int hierarchicalAttributeIdx = -1;

  public TestSimpleKeyDictionary(String name, DictionaryKind kind) {
    super(name, kind);
    Preconditions.checkArgument(kind.getKeyShape().equals(KeyShape.SIMPLE), "Not a simple kind: %s", kind);
  }

  public TestSimpleKeyDictionary attribute(String name, ColumnType type) {
    addAttribute(new AttributeDescriptor(name, type), defaultNullValue(type));
    return this;
  }

  public TestSimpleKeyDictionary attribute(String name, ColumnType type, Object nullValue, boolean injective) {
    addAttribute(new AttributeDescriptor(name, type, injective, false), normalize(nullValue));
    return this;
  }

  public TestSimpleKeyDictionary hierarchicalAttribute(String name) {
    hierarchicalAttributeIdx = addAttribute(new AttributeDescriptor(name, ColumnType.UINT64, false, true), 0L);
    return this;
  }

  /**
   * Add a row, the values are in the order the attributes were declared.
   */
  public TestSimpleKeyDictionary row(long id, Object... values) {
    Preconditions.checkArgument(values.length == numberOfAttributes(), "Wrong number of values");
    Object[] normalized = new Object[values.length];
    for (int i = 0; i < values.length; i++)
      normalized[i] = normalize(values[i]);
    rows.put(id, normalized);
    return this;
  }

  @Override
  public void has(long[] ids, boolean[] out) {
    for (int i = 0; i < ids.length; i++)
      out[i] = rows.containsKey(ids[i]);
  }

  @Override
  public <A> void get(String attributeName, ValueType<A> type, long[] ids, A out) {
    int idx = attributeIndex(attributeName, type);
    for (int i = 0; i < ids.length; i++) {
      Object[] row = rows.get(ids[i]);
      type.set(out, i, (row != null) ? row[idx] : nullValue(idx));
    }
  }

  @Override
  public <A> void getWithDefaults(String attributeName, ValueType<A> type, long[] ids, A defaults, A out) {
    int idx = attributeIndex(attributeName, type);
    for (int i = 0; i < ids.length; i++) {
      Object[] row = rows.get(ids[i]);
      type.set(out, i, (row != null) ? row[idx] : type.get(defaults, i));
    }
  }

  @Override
  public <A> void getWithDefault(String attributeName, ValueType<A> type, long[] ids, Object defaultValue, A out) {
    int idx = attributeIndex(attributeName, type);
    for (int i = 0; i < ids.length; i++) {
      Object[] row = rows.get(ids[i]);
      type.set(out, i, (row != null) ? row[idx] : defaultValue);
    }
  }

  @Override
  public boolean hasHierarchy() {
    return hierarchicalAttributeIdx >= 0;
  }

  private long parent(long id) {
    Object[] row = rows.get(id);
    if (row == null || row[hierarchicalAttributeIdx] == null)
      return 0L;
    return ((Number) row[hierarchicalAttributeIdx]).longValue();
  }

  @Override
  public void toParent(long[] ids, long[] out) {
    Preconditions.checkState(hasHierarchy(), "No hierarchy");
    for (int i = 0; i < ids.length; i++)
      out[i] = parent(ids[i]);
  }

  private boolean isIn(long childId, long ancestorId) {
    long id = childId;
    for (int depth = 0; id != 0L && id != ancestorId && depth < MAX_DEPTH; depth++)
      id = parent(id);
    return id != 0L && id == ancestorId;
  }

  @Override
  public void isInVectorVector(long[] childIds, long[] ancestorIds, boolean[] out) {
    for (int i = 0; i < childIds.length; i++)
      out[i] = isIn(childIds[i], ancestorIds[i]);
  }

  @Override
  public void isInVectorConstant(long[] childIds, long ancestorId, boolean[] out) {
    for (int i = 0; i < childIds.length; i++)
      out[i] = isIn(childIds[i], ancestorId);
  }

  @Override
  public void isInConstantVector(long childId, long[] ancestorIds, boolean[] out) {
    for (int i = 0; i < ancestorIds.length; i++)
      out[i] = isIn(childId, ancestorIds[i]);
  }

  @Override
  public boolean isInConstantConstant(long childId, long ancestorId) {
    return isIn(childId, ancestorId);
  }
}
