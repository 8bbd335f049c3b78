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
import java.util.List;

import org.extdict.data.column.ColumnType;
import org.extdict.data.value.ValueType;
import org.extdict.data.value.ValueTypes;
import org.extdict.dictionary.AttributeDescriptor;
import org.extdict.dictionary.Dictionary;
import org.extdict.dictionary.DictionaryKind;
import org.extdict.dictionary.DictionaryStructure;

/**
 * Base class for the in-memory dictionaries used in tests.
 *
 * @author Bastian Gloeckle
 */
public abstract class AbstractTestDictionary implements Dictionary {
  private String name;
  private DictionaryKind kind;
  private List<AttributeDescriptor> attributes = new ArrayList<>();
  private List<Object> nullValues = new ArrayList<>();

  protected AbstractTestDictionary(String name, DictionaryKind kind) {
    this.name = name;
    this.kind = kind;
  }

  protected int addAttribute(AttributeDescriptor attribute, Object nullValue) {
    attributes.add(attribute);
    nullValues.add(nullValue);
    return attributes.size() - 1;
  }

  protected int attributeIndex(String attributeName, ValueType<?> type) {
    for (int i = 0; i < attributes.size(); i++)
      if (attributes.get(i).getName().equals(attributeName)) {
        if (!attributes.get(i).getType().equals(type.getColumnType()))
          throw new IllegalArgumentException("Type mismatch for attribute " + attributeName + ": requested "
              + type.getName() + " but is " + attributes.get(i).getType());
        return i;
      }
    throw new IllegalArgumentException("No such attribute: " + attributeName);
  }

  protected Object nullValue(int attributeIdx) {
    return nullValues.get(attributeIdx);
  }

  protected int numberOfAttributes() {
    return attributes.size();
  }

  protected static Object defaultNullValue(ColumnType type) {
    ValueType<?> valueType = ValueTypes.forColumnType(type);
    return (valueType == null) ? null : valueType.getZeroValue();
  }

  /**
   * Normalizes values so they can be compared: all integral numbers become {@link Long}s.
   */
  protected static Object normalize(Object value) {
    if (value instanceof Integer || value instanceof Short || value instanceof Byte)
      return ((Number) value).longValue();
    return value;
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public DictionaryKind getKind() {
    return kind;
  }

  @Override
  public DictionaryStructure getStructure() {
    return new DictionaryStructure(attributes);
  }
}
