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
package org.extdict.function.dict;

import org.extdict.data.value.ValueType;
import org.extdict.dictionary.AttributeDescriptor;
import org.extdict.dictionary.Dictionary;

/**
 * The result of resolving the type of an attribute of a specific dictionary object.
 *
 * @author Bastian Gloeckle
 */
public class ResolvedAttribute {
  private Dictionary dictionary;
  private AttributeDescriptor attribute;
  private ValueType<?> valueType;

  /* package */ ResolvedAttribute(Dictionary dictionary, AttributeDescriptor attribute, ValueType<?> valueType) {
    this.dictionary = dictionary;
    this.attribute = attribute;
    this.valueType = valueType;
  }

  public Dictionary getDictionary() {
    return dictionary;
  }

  public AttributeDescriptor getAttribute() {
    return attribute;
  }

  public ValueType<?> getValueType() {
    return valueType;
  }

  /**
   * @return <code>true</code> if this was resolved for the given attribute of exactly the given dictionary object. A
   *         reloaded dictionary is a different object, even if it has the same name.
   */
  public boolean isResolvedFor(Dictionary dictionary, String attributeName) {
    return this.dictionary == dictionary && attribute.getName().equals(attributeName);
  }
}
